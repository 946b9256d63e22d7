package exception;

/**
 * The lifter produced output that violates its own invariants or is not
 * equivalent to its input. Always a defect in the lowering rules.
 */
public class LoweringInvariantException extends LiftException {
    public LoweringInvariantException(String message) {
        super(message);
    }

    public static LoweringInvariantException failedObligation(String obligation) {
        return new LoweringInvariantException("proof obligation failed: " + obligation);
    }

    public static LoweringInvariantException sliceWiderThanRoot(String slice, String root) {
        return new LoweringInvariantException("slice " + slice + " is wider than its root " + root);
    }

    public static LoweringInvariantException illegalWidth(String msg) {
        return new LoweringInvariantException("Illegal width: " + msg);
    }

    public static LoweringInvariantException typecheckFailed(String name) {
        return new LoweringInvariantException("lowered IR does not typecheck: " + name);
    }

    public static LoweringInvariantException danglingNode(String msg) {
        return new LoweringInvariantException("Dangling node: " + msg);
    }
}
