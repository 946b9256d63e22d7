package pass.FormulaPass;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

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
 * Removes if-then-else arms that can never be taken. A condition that is
 * always true (or always false) under the assumptions in force keeps only
 * its live arm; otherwise each arm is simplified assuming the condition
 * (or its negation).
 */
public class DeadBranchEliminationPass implements Pass.FormulaPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    private Context ctx;
    private Oracle oracle;
    // 每个假设帧一张缓存：分支内的结果只在该假设成立时可复用
    private final Deque<Map<Expr<?>, Expr<?>>> frames = new ArrayDeque<>();
    private int removed;

    @Override
    public FormulaPassType getType() {
        return FormulaPassType.DeadBranchElimination;
    }

    @Override
    public Expr<?> run(Context ctx, Expr<?> formula) {
        this.ctx = ctx;
        this.oracle = new Oracle(ctx);
        this.removed = 0;
        frames.clear();
        frames.push(new HashMap<>());

        Expr<?> out = elim(formula);
        log.debug("removed {} dead branch(es)", removed);
        return out;
    }

    private Expr<?> lookup(Expr<?> f) {
        // innermost frame first; outer results stay valid under more assumptions
        for (Map<Expr<?>, Expr<?>> frame : frames) {
            Expr<?> hit = frame.get(f);
            if (hit != null) {
                return hit;
            }
        }
        return null;
    }

    private Expr<?> elim(Expr<?> f) {
        Expr<?> cached = lookup(f);
        if (cached != null) {
            return cached;
        }

        Expr<?> result;
        if (Formulas.isAppOf(f, Z3_decl_kind.Z3_OP_ITE)) {
            Expr<?>[] args = f.getArgs();
            Expr<BoolSort> cond = Formulas.bool(args[0]);
            Expr<?> a = args[1];
            Expr<?> b = args[2];

            if (oracle.isUnsat(ctx.mkNot(cond))) {
                removed++;
                result = elim(a);
            } else if (oracle.isUnsat(cond)) {
                removed++;
                result = elim(b);
            } else {
                // can't statically determine which branch, follow both
                Expr<?> cond2 = elim(cond);
                Expr<?> a2 = underAssumption(cond, () -> elim(a));
                Expr<?> b2 = underAssumption(ctx.mkNot(cond), () -> elim(b));
                result = Formulas.ite(ctx, cond2, a2, b2).simplify();
            }
        } else {
            Expr<?>[] args = f.getArgs();
            Expr<?>[] newArgs = new Expr<?>[args.length];
            for (int i = 0; i < args.length; i++) {
                newArgs[i] = elim(args[i]);
            }
            result = Formulas.rebuild(f, newArgs);
        }

        frames.peek().put(f, result);
        return result;
    }

    private Expr<?> underAssumption(Expr<BoolSort> assumption, Supplier<Expr<?>> body) {
        return oracle.underAssumption(assumption, () -> {
            frames.push(new HashMap<>());
            try {
                return body.get();
            } finally {
                frames.pop();
            }
        });
    }
}
