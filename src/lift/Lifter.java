package lift;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

import pass.PassManager;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Lowers instruction formulas: normalisation pipeline, translation, then
 * the IR checks. One translator per formula; the Z3 context is shared.
 */
public class Lifter {
    private static final Logger log = LoggingManager.getLogger(Lifter.class);

    private final Context ctx;
    private final PassManager passManager;

    public Lifter(Context ctx) {
        this(ctx, PassManager.getInstance());
    }

    public Lifter(Context ctx, PassManager passManager) {
        this.ctx = ctx;
        this.passManager = passManager;
    }

    /**
     * @param laneWidth bits per output element; ignored unless the formula
     *                  is a concatenation
     * @throws exception.UnsupportedFormulaException for constructs without a
     *         lowering rule
     * @throws exception.LoweringInvariantException when the lowering breaks
     *         its own invariants
     */
    public LiftResult lift(Expr<?> formula, int laneWidth) {
        Expr<?> normalized = passManager.runFormulaPasses(ctx, formula);
        LiftResult result = new Translator(ctx).translateFormula(normalized, laneWidth);
        passManager.runIRPasses(ctx, result);
        log.debug("lifted formula of {} node(s) into {} IR node(s)",
                Formulas.nodeCount(formula), result.dag().size());
        return result;
    }
}
