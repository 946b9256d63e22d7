package ir.type;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import exception.UnsupportedFormulaException;

/**
 * Scalar register widths. Every IR value is typed by one of the lattice
 * members 1, 8, 16, 32, 64; wider quantities cannot be expressed.
 */
public final class IntegerType {
    private static final int[] LATTICE = {1, 8, 16, 32, 64};

    private final int bitWidth;

    private static final Map<Integer, IntegerType> pool
        = new ConcurrentHashMap<>();

    public static final IntegerType i1 = IntegerType.getInteger(1);
    public static final IntegerType i8 = IntegerType.getInteger(8);
    public static final IntegerType i16 = IntegerType.getInteger(16);
    public static final IntegerType i32 = IntegerType.getInteger(32);
    public static final IntegerType i64 = IntegerType.getInteger(64);

    private IntegerType(int bitWidth) {
        this.bitWidth = bitWidth;
    }

    public int getBitWidth() {
        return bitWidth;
    }

    public static boolean isLatticeWidth(int bitWidth) {
        for (int w : LATTICE) {
            if (w == bitWidth) return true;
        }
        return false;
    }

    /**
     * @return the lattice type of exactly {@code bitWidth} bits
     */
    public static IntegerType getInteger(int bitWidth) {
        if (!isLatticeWidth(bitWidth)) {
            throw new IllegalArgumentException("Integer with bitWidth " + bitWidth + " is not a lattice width");
        }
        return pool.computeIfAbsent(bitWidth, IntegerType::new);
    }

    /**
     * Smallest lattice width at or above {@code bits}.
     *
     * @throws UnsupportedFormulaException if {@code bits} exceeds 64
     */
    public static int ceilWidth(int bits) {
        if (bits <= 0) {
            throw new IllegalArgumentException("non-positive bitwidth " + bits);
        }
        for (int w : LATTICE) {
            if (w >= bits) return w;
        }
        throw UnsupportedFormulaException.bitwidthTooLarge(bits);
    }

    public static IntegerType ceil(int bits) {
        return getInteger(ceilWidth(bits));
    }

    /** all-ones mask of this width */
    public long mask() {
        return bitWidth == 64 ? -1L : (1L << bitWidth) - 1;
    }

    public String toIR() {
        return "i" + bitWidth;
    }

    @Override public String toString() { return toIR(); }

    // pooled, identity equality is enough
}
