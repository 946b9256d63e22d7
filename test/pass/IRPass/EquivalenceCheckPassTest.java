package pass.IRPass;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

import ir.Builder;
import ir.IRDag;
import ir.type.IntegerType;
import ir.value.Opcode;
import lift.FloatPrimitives;
import lift.LiftResult;
import lift.Translator;

public class EquivalenceCheckPassTest {
    private Context ctx;
    private BitVecExpr a;
    private BitVecExpr b;

    @Before
    public void setUp() {
        ctx = new Context();
        a = ctx.mkBVConst("a", 32);
        b = ctx.mkBVConst("b", 32);
    }

    @After
    public void tearDown() {
        ctx.close();
    }

    @Test
    public void correctLoweringPasses() {
        Expr<?> f = ctx.mkBVSub(ctx.mkBVMul(a, b), ctx.mkBVUDiv(a, b));
        LiftResult result = new Translator(ctx).translateFormula(f, 32);

        EquivalenceCheckPass check = new EquivalenceCheckPass().setSamples(32).setSeed(7);
        assertTrue(check.run(ctx, result));
        assertFalse(check.wasSkipped());
    }

    @Test
    public void wrongLoweringIsCaught() {
        // a - b lowered as a + b
        IRDag dag = new IRDag();
        Builder builder = new Builder(dag);
        int x = builder.buildLiveIn("a", 0, 32);
        int y = builder.buildLiveIn("b", 0, 32);
        int out = builder.buildBinary(Opcode.ADD, IntegerType.i32, x, y);
        Expr<?> f = ctx.mkBVSub(a, b);
        LiftResult wrong = new LiftResult(f, List.of(f), List.of(out), dag);

        assertFalse(new EquivalenceCheckPass().setSamples(16).setSeed(1).run(ctx, wrong));
    }

    @Test
    public void borrowLeftAboveANarrowLaneIsCaught() {
        // 12-bit x - y in an i16 register with no mask after the sub
        BitVecExpr x = ctx.mkBVConst("x", 12);
        BitVecExpr y = ctx.mkBVConst("y", 12);
        IRDag dag = new IRDag();
        Builder builder = new Builder(dag);
        int lx = builder.buildLiveIn("x", 0, 12);
        int ly = builder.buildLiveIn("y", 0, 12);
        int out = builder.buildBinary(Opcode.SUB, IntegerType.i16, lx, ly);
        Expr<?> f = ctx.mkBVSub(x, y);
        LiftResult dirty = new LiftResult(f, List.of(f), List.of(out), dag);

        assertFalse(new EquivalenceCheckPass().setSamples(16).setSeed(3).run(ctx, dirty));
    }

    @Test
    public void floatPrimitivesAreSkipped() {
        Expr<?> f = FloatPrimitives.floatOp(ctx, FloatPrimitives.FloatOp.MUL, 32, a, b);
        LiftResult result = new Translator(ctx).translateFormula(f, 32);

        EquivalenceCheckPass check = new EquivalenceCheckPass().setSamples(4);
        assertTrue(check.run(ctx, result));
        assertTrue(check.wasSkipped());
    }
}
