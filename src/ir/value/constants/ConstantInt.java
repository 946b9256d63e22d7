package ir.value.constants;

import ir.type.IntegerType;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Integer literal. The value is kept as the raw bit pattern of its width;
 * a 64-bit all-ones constant is stored as -1.
 */
public class ConstantInt extends Constant {
    private final long value;

    public ConstantInt(IntegerType type, long value) {
        super(type);
        this.value = value & type.mask();
    }

    public static ConstantInt of(BigInteger value, IntegerType type) {
        return new ConstantInt(type, value.longValue());
    }

    public static ConstantInt bool(boolean value) {
        return new ConstantInt(IntegerType.i1, value ? 1 : 0);
    }

    public long getValue() { return value; }

    @Override
    public String toIR() {
        return getType().toIR() + " " + Long.toUnsignedString(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstantInt other)) return false;
        return value == other.value && getType() == other.getType();
    }

    @Override
    public int hashCode() {
        return Objects.hash(getBitWidth(), value);
    }
}
