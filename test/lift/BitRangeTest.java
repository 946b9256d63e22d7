package lift;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;

public class BitRangeTest {
    private Context ctx;
    private BitVecExpr x;
    private BitVecExpr y;

    @Before
    public void setUp() {
        ctx = new Context();
        x = ctx.mkBVConst("x", 32);
        y = ctx.mkBVConst("y", 32);
    }

    @After
    public void tearDown() {
        ctx.close();
    }

    @Test
    public void halfOpenOverlap() {
        BitRange low = new BitRange(x, 0, 8);
        BitRange next = new BitRange(x, 8, 16);
        BitRange middle = new BitRange(x, 4, 12);
        assertFalse(low.overlaps(next));
        assertTrue(low.overlaps(middle));
        assertTrue(middle.overlaps(next));
        assertEquals(8, low.size());
    }

    @Test
    public void differentVariablesNeverOverlap() {
        assertFalse(new BitRange(x, 0, 8).overlaps(new BitRange(y, 0, 8)));
    }

    @Test
    public void unionCoversBoth() {
        BitRange u = new BitRange(x, 0, 8).union(new BitRange(x, 4, 12));
        assertEquals(new BitRange(x, 0, 12), u);
        assertTrue(u.contains(new BitRange(x, 4, 8)));
        assertFalse(u.contains(new BitRange(x, 4, 13)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyRangeIsRejected() {
        new BitRange(x, 4, 4);
    }

    @Test
    public void printedName() {
        BitRange r = new BitRange(x, 8, 16);
        assertEquals("x[8:16)", r.toString());
    }
}
