package pass.FormulaPass;

import java.util.HashMap;
import java.util.Map;

import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import lift.Formulas;
import lift.Oracle;
import pass.FormulaPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Collapses {@code ite(c, a, b)} to one arm when the arms agree wherever
 * the other arm would be chosen: {@code a} if a == b whenever !c, {@code b}
 * if a == b whenever c.
 */
public class RedundantBranchEliminationPass implements Pass.FormulaPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    private Context ctx;
    private Oracle oracle;
    // no assumption outlives a single check, so one cache serves the whole formula
    private final Map<Expr<?>, Expr<?>> cache = new HashMap<>();
    private int collapsed;

    @Override
    public FormulaPassType getType() {
        return FormulaPassType.RedundantBranchElimination;
    }

    @Override
    public Expr<?> run(Context ctx, Expr<?> formula) {
        this.ctx = ctx;
        this.oracle = new Oracle(ctx);
        this.collapsed = 0;
        cache.clear();

        Expr<?> out = elim(formula);
        log.debug("collapsed {} redundant branch(es)", collapsed);
        return out;
    }

    private Expr<?> elim(Expr<?> f) {
        Expr<?> cached = cache.get(f);
        if (cached != null) {
            return cached;
        }

        Expr<?>[] args = f.getArgs();
        Expr<?>[] newArgs = new Expr<?>[args.length];
        for (int i = 0; i < args.length; i++) {
            newArgs[i] = elim(args[i]);
        }

        Expr<?> result;
        if (Formulas.isAppOf(f, Z3_decl_kind.Z3_OP_ITE)) {
            Expr<BoolSort> cond = Formulas.bool(newArgs[0]);
            Expr<?> a = newArgs[1];
            Expr<?> b = newArgs[2];

            // a can stand in for b on the false side
            boolean useA = oracle.underAssumption(ctx.mkNot(cond), () -> oracle.provablyEqual(a, b));
            if (useA) {
                collapsed++;
                result = a;
            } else if (oracle.underAssumption(cond, () -> oracle.provablyEqual(a, b))) {
                collapsed++;
                result = b;
            } else {
                result = Formulas.ite(ctx, cond, a, b).simplify();
            }
        } else {
            result = Formulas.rebuild(f, newArgs);
        }

        cache.put(f, result);
        return result;
    }
}
