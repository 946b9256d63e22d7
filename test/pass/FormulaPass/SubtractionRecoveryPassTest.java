package pass.FormulaPass;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import lift.Formulas;
import lift.Oracle;

public class SubtractionRecoveryPassTest {
    private Context ctx;
    private BitVecExpr a;
    private BitVecExpr b;
    private BitVecExpr minusOne;

    @Before
    public void setUp() {
        ctx = new Context();
        a = ctx.mkBVConst("a", 32);
        b = ctx.mkBVConst("b", 32);
        minusOne = Formulas.allOnes(ctx, 32);
    }

    @After
    public void tearDown() {
        ctx.close();
    }

    private Expr<?> run(Expr<?> f) {
        return new SubtractionRecoveryPass().run(ctx, f);
    }

    private void assertSub(Expr<?> f, Expr<?> lhs, Expr<?> rhs) {
        assertTrue("not a bvsub: " + f, Formulas.isAppOf(f, Z3_decl_kind.Z3_OP_BSUB));
        assertEquals(lhs, f.getArgs()[0]);
        assertEquals(rhs, f.getArgs()[1]);
    }

    @Test
    public void negatedRightAddend() {
        assertSub(run(ctx.mkBVAdd(a, ctx.mkBVMul(minusOne, b))), a, b);
        assertSub(run(ctx.mkBVAdd(a, ctx.mkBVMul(b, minusOne))), a, b);
    }

    @Test
    public void negatedLeftAddend() {
        assertSub(run(ctx.mkBVAdd(ctx.mkBVMul(minusOne, b), a)), a, b);
    }

    @Test
    public void recoversBelowOtherOperators() {
        Expr<?> out = run(ctx.mkBVAND(ctx.mkBVAdd(a, ctx.mkBVMul(minusOne, b)), a));
        assertSub(out.getArgs()[0], a, b);
    }

    @Test
    public void undoesTheSimplifiersSubtraction() {
        Expr<?> simplified = ctx.mkBVSub(a, b).simplify();
        Expr<?> out = run(simplified);
        assertTrue(Formulas.isAppOf(out, Z3_decl_kind.Z3_OP_BSUB));
        assertTrue(new Oracle(ctx).provablyEqual(out, ctx.mkBVSub(a, b)));
    }

    @Test
    public void plainProductIsNotASubtraction() {
        Expr<?> f = ctx.mkBVAdd(a, ctx.mkBVMul(a, b));
        assertEquals(f, run(f));
    }

    @Test
    public void staticRewriteLeavesOtherNodes() {
        assertEquals(a, SubtractionRecoveryPass.recoverSub(ctx, a));
    }
}
