package exception;

/**
 * Root of every failure raised while lifting a formula.
 *
 * Two families hang below it: {@link UnsupportedFormulaException} for
 * constructs the lowering rules do not model, and
 * {@link LoweringInvariantException} for lowerings that broke their own
 * invariants.
 */
public class LiftException extends RuntimeException {
    public LiftException(String message) {
        super(message);
    }

    public LiftException(String message, Throwable cause) {
        super(message, cause);
    }

    public static LiftException noArgs() {
        return new LiftException("need args to process");
    }

    public static LiftException wrongArgs(String msg) {
        return new LiftException("Unexpected args: " + msg);
    }

    public static LiftException badLaneWidth(int laneWidth, int totalWidth) {
        return new LiftException("lane width " + laneWidth
                + " does not evenly divide result width " + totalWidth);
    }
}
