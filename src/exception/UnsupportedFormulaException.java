package exception;

/**
 * The formula uses a construct the lifter's fixed rule set does not cover.
 * Expected and frequent: a batch driver skips the instruction and goes on.
 */
public class UnsupportedFormulaException extends LiftException {
    public UnsupportedFormulaException(String message) {
        super(message);
    }

    public static UnsupportedFormulaException unSupported(String msg) {
        return new UnsupportedFormulaException("UnSupported: " + msg);
    }

    public static UnsupportedFormulaException extractionTooWide(int width) {
        return new UnsupportedFormulaException(
                "extraction too complex to model in scalar code: operand is " + width + " bits");
    }

    public static UnsupportedFormulaException unsupportedConcat(String msg) {
        return new UnsupportedFormulaException("concat only supported as extension: " + msg);
    }

    public static UnsupportedFormulaException unknownOperator(String head) {
        return new UnsupportedFormulaException("no lowering rule for operator: " + head);
    }

    public static UnsupportedFormulaException bitwidthTooLarge(int bits) {
        return new UnsupportedFormulaException(
                "bitwidth too large for scalar operation: " + bits);
    }

    public static UnsupportedFormulaException malformedPrimitive(String name) {
        return new UnsupportedFormulaException("malformed primitive name: " + name);
    }
}
