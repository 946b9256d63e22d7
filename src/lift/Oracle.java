package lift;

import java.util.function.Supplier;

import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;

import exception.LoweringInvariantException;

/**
 * Satisfiability queries over one Z3 solver, with a strict push/pop
 * discipline: every assumption made for one branch is retracted before its
 * sibling is explored.
 */
public class Oracle {
    private final Context ctx;
    private final Solver solver;

    public Oracle(Context ctx) {
        this.ctx = ctx;
        this.solver = ctx.mkSolver();
    }

    /**
     * Runs {@code body} with {@code assumption} asserted, retracting it
     * afterwards even if the body throws.
     */
    public <T> T underAssumption(Expr<BoolSort> assumption, Supplier<T> body) {
        solver.push();
        try {
            solver.add(assumption);
            return body.get();
        } finally {
            solver.pop();
        }
    }

    /** true only if Z3 answers unsat; unknown counts as satisfiable */
    public boolean isUnsat(Expr<BoolSort> query) {
        solver.push();
        try {
            solver.add(query);
            return solver.check() == Status.UNSATISFIABLE;
        } finally {
            solver.pop();
        }
    }

    public boolean provablyEqual(Expr<?> a, Expr<?> b) {
        return isUnsat(Formulas.distinct(ctx, a, b));
    }

    /**
     * Checks a named claim and reports the verdict instead of a bare boolean,
     * so a failure names the rule that made it.
     */
    public Proof prove(String obligation, Expr<BoolSort> claim) {
        solver.push();
        try {
            solver.add(ctx.mkNot(claim));
            Status status = solver.check();
            Verdict verdict = switch (status) {
                case UNSATISFIABLE -> Verdict.PROVED;
                case SATISFIABLE -> Verdict.REFUTED;
                default -> Verdict.UNKNOWN;
            };
            return new Proof(obligation, verdict);
        } finally {
            solver.pop();
        }
    }

    public enum Verdict {
        PROVED, REFUTED, UNKNOWN
    }

    public record Proof(String obligation, Verdict verdict) {
        public boolean holds() {
            return verdict == Verdict.PROVED;
        }

        /** raises a {@link LoweringInvariantException} unless proved */
        public Proof orFail() {
            if (!holds()) {
                throw LoweringInvariantException.failedObligation(obligation + " (" + verdict + ")");
            }
            return this;
        }
    }
}
