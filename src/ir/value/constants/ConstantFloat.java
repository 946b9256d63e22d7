package ir.value.constants;

import ir.type.IntegerType;

/**
 * Floating literal, single (32) or double (64) precision.
 */
public class ConstantFloat extends Constant {
    private final double value;

    public ConstantFloat(IntegerType type, double value) {
        super(type);
        if (type.getBitWidth() != 32 && type.getBitWidth() != 64) {
            throw new IllegalArgumentException("float constant must be 32 or 64 bits, got " + type);
        }
        this.value = value;
    }

    /** decodes an IEEE-754 bit pattern of the given width */
    public static ConstantFloat fromBits(long bits, int bitWidth) {
        double v = bitWidth == 32
                ? Float.intBitsToFloat((int) bits)
                : Double.longBitsToDouble(bits);
        return new ConstantFloat(IntegerType.getInteger(bitWidth), v);
    }

    public double getValue() { return value; }

    /** IEEE-754 bit pattern of this constant */
    public long toBits() {
        return getBitWidth() == 32
                ? Integer.toUnsignedLong(Float.floatToRawIntBits((float) value))
                : Double.doubleToRawLongBits(value);
    }

    @Override
    public String toIR() {
        return (getBitWidth() == 32 ? "float " : "double ") + value;
    }
}
