package pass.FormulaPass;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

import lift.Formulas;
import lift.Oracle;

public class RedundantBranchEliminationPassTest {
    private Context ctx;
    private Oracle oracle;
    private BitVecExpr x;
    private BitVecExpr y;

    @Before
    public void setUp() {
        ctx = new Context();
        oracle = new Oracle(ctx);
        x = ctx.mkBVConst("x", 32);
        y = ctx.mkBVConst("y", 32);
    }

    @After
    public void tearDown() {
        ctx.close();
    }

    private Expr<?> run(Expr<?> f) {
        return new RedundantBranchEliminationPass().run(ctx, f);
    }

    @Test
    public void elseArmThatAgreesWhereTheConditionHolds() {
        // x == 0 ? 0 : x  is just x
        Expr<?> f = ctx.mkITE(ctx.mkEq(x, ctx.mkBV(0, 32)), ctx.mkBV(0, 32), x);

        Expr<?> out = run(f);

        assertEquals(x, out);
    }

    @Test
    public void thenArmThatAgreesWhereTheConditionFails() {
        // x != 5 ? x : 5  is just x
        Expr<?> f = ctx.mkITE(ctx.mkNot(ctx.mkEq(x, ctx.mkBV(5, 32))), x, ctx.mkBV(5, 32));

        Expr<?> out = run(f);

        assertEquals(x, out);
    }

    @Test
    public void nestedRedundancyCollapses() {
        Expr<?> inner = ctx.mkITE(ctx.mkEq(x, ctx.mkBV(0, 32)), ctx.mkBV(0, 32), x);
        Expr<?> f = ctx.mkBVMul(y, Formulas.bv(inner));

        Expr<?> out = run(f);

        assertEquals(0, DeadBranchEliminationPassTest.countIte(out));
        assertTrue(oracle.provablyEqual(out, ctx.mkBVMul(y, x)));
    }

    @Test
    public void genuineBranchIsKept() {
        Expr<?> f = ctx.mkITE(ctx.mkBVULT(x, y), x, y);

        Expr<?> out = run(f);

        assertEquals(1, DeadBranchEliminationPassTest.countIte(out));
        assertTrue(oracle.provablyEqual(out, f));
    }

    @Test
    public void secondRunChangesNothing() {
        // the inner select collapses to x; the outer one picks between x and y
        Expr<?> inner = ctx.mkITE(ctx.mkEq(x, ctx.mkBV(0, 32)), ctx.mkBV(0, 32), x);
        Expr<?> f = ctx.mkITE(ctx.mkEq(y, ctx.mkBV(7, 32)), Formulas.bv(inner), y);

        Expr<?> once = run(f);
        Expr<?> twice = run(once);

        assertEquals(1, DeadBranchEliminationPassTest.countIte(once));
        assertEquals(once, twice);
    }
}
