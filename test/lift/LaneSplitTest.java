package lift;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

import exception.LiftException;

public class LaneSplitTest {
    private Context ctx;
    private Oracle oracle;
    private BitVecExpr x;
    private BitVecExpr y;
    private BitVecExpr z;

    @Before
    public void setUp() {
        ctx = new Context();
        oracle = new Oracle(ctx);
        x = ctx.mkBVConst("x", 16);
        y = ctx.mkBVConst("y", 32);
        z = ctx.mkBVConst("z", 16);
    }

    @After
    public void tearDown() {
        ctx.close();
    }

    @Test
    public void lanesNeedNotAlignWithChildren() {
        Expr<?> f = ctx.mkConcat(ctx.mkConcat(x, y), z);

        List<Expr<?>> lanes = new Translator(ctx).splitLanes(f, 32);

        assertEquals(2, lanes.size());
        assertEquals(32, Formulas.size(lanes.get(0)));
        assertEquals(32, Formulas.size(lanes.get(1)));
        assertTrue(oracle.provablyEqual(lanes.get(0), ctx.mkConcat(x, ctx.mkExtract(31, 16, y))));
        assertTrue(oracle.provablyEqual(lanes.get(1), ctx.mkConcat(ctx.mkExtract(15, 0, y), z)));
    }

    @Test
    public void narrowLanesCutChildren() {
        Expr<?> f = ctx.mkConcat(ctx.mkConcat(x, y), z);

        List<Expr<?>> lanes = new Translator(ctx).splitLanes(f, 16);

        assertEquals(4, lanes.size());
        assertTrue(oracle.provablyEqual(lanes.get(0), x));
        assertTrue(oracle.provablyEqual(lanes.get(1), ctx.mkExtract(31, 16, y)));
        assertTrue(oracle.provablyEqual(lanes.get(2), ctx.mkExtract(15, 0, y)));
        assertTrue(oracle.provablyEqual(lanes.get(3), z));
    }

    @Test
    public void fullWidthLaneIsTheWholeFormula() {
        Expr<?> f = ctx.mkConcat(x, z);

        List<Expr<?>> lanes = new Translator(ctx).splitLanes(f, 32);

        assertEquals(1, lanes.size());
        assertTrue(oracle.provablyEqual(lanes.get(0), f));
    }

    @Test
    public void nonConcatenationIsOneLane() {
        Expr<?> f = ctx.mkBVAdd(y, y);
        assertEquals(List.of(f), new Translator(ctx).splitLanes(f, 7));
    }

    @Test(expected = LiftException.class)
    public void laneWidthMustDivideTheResult() {
        new Translator(ctx).splitLanes(ctx.mkConcat(ctx.mkConcat(x, y), z), 24);
    }

    @Test(expected = LiftException.class)
    public void laneWidthMustBePositive() {
        new Translator(ctx).splitLanes(ctx.mkConcat(x, z), 0);
    }
}
