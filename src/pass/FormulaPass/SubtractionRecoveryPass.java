package pass.FormulaPass;

import java.util.HashMap;
import java.util.Map;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import lift.Formulas;
import pass.FormulaPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * The simplifier canonicalises {@code a - b} into {@code a + 0b11..1 * b};
 * this pass turns it back into a subtraction everywhere in the formula.
 * It does not simplify, which would undo it.
 */
public class SubtractionRecoveryPass implements Pass.FormulaPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    private Context ctx;
    private final Map<Expr<?>, Expr<?>> cache = new HashMap<>();
    private int recovered;

    @Override
    public FormulaPassType getType() {
        return FormulaPassType.SubtractionRecovery;
    }

    @Override
    public Expr<?> run(Context ctx, Expr<?> formula) {
        this.ctx = ctx;
        this.recovered = 0;
        cache.clear();

        Expr<?> out = recover(formula);
        log.debug("recovered {} subtraction(s)", recovered);
        return out;
    }

    private Expr<?> recover(Expr<?> f) {
        Expr<?> cached = cache.get(f);
        if (cached != null) {
            return cached;
        }
        Expr<?>[] args = f.getArgs();
        Expr<?> g = f;
        if (args.length > 0) {
            Expr<?>[] newArgs = new Expr<?>[args.length];
            boolean changed = false;
            for (int i = 0; i < args.length; i++) {
                newArgs[i] = recover(args[i]);
                changed |= !newArgs[i].equals(args[i]);
            }
            if (changed) {
                g = f.update(newArgs);
            }
        }
        Expr<?> result = recoverSub(ctx, g);
        if (result != g) {
            recovered++;
        }
        cache.put(f, result);
        return result;
    }

    /**
     * Rewrites {@code a + (-1 * b)} (either addend, either factor) to
     * {@code a - b}; returns {@code f} itself when it does not match.
     */
    public static Expr<?> recoverSub(Context ctx, Expr<?> f) {
        if (!Formulas.isAppOf(f, Z3_decl_kind.Z3_OP_BADD) || f.getNumArgs() != 2) {
            return f;
        }
        Expr<?> a = f.getArgs()[0];
        Expr<?> b = f.getArgs()[1];
        Expr<?> negated = negatedOperand(b);
        if (negated != null) {
            return ctx.mkBVSub(Formulas.bv(a), Formulas.bv(negated));
        }
        negated = negatedOperand(a);
        if (negated != null) {
            return ctx.mkBVSub(Formulas.bv(b), Formulas.bv(negated));
        }
        return f;
    }

    // x when m is (-1 * x) or (x * -1)
    private static Expr<?> negatedOperand(Expr<?> m) {
        if (!Formulas.isAppOf(m, Z3_decl_kind.Z3_OP_BMUL) || m.getNumArgs() != 2) {
            return null;
        }
        Expr<?> m1 = m.getArgs()[0];
        Expr<?> m2 = m.getArgs()[1];
        if (Formulas.isAllOnes(m1)) {
            return m2;
        }
        if (Formulas.isAllOnes(m2)) {
            return m1;
        }
        return null;
    }
}
