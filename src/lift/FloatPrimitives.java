package lift;

import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;

import exception.UnsupportedFormulaException;
import ir.value.Opcode;

/**
 * Uninterpreted functions the semantics front end leaves in formulas:
 * <ul>
 *   <li>{@code fp_<op>_<bits>}: float primitives over IEEE bit patterns</li>
 *   <li>{@code Saturate_<s|u><in>_to_<s|u><out>}: saturating conversion</li>
 *   <li>{@code Abs_<i|f><bits>}: absolute value</li>
 * </ul>
 */
public final class FloatPrimitives {
    public static final String FP_PREFIX = "fp_";
    public static final String SATURATE_PREFIX = "Saturate_";
    public static final String ABS_PREFIX = "Abs_";

    private FloatPrimitives() {
    }

    public enum FloatOp {
        NEG("neg", Opcode.FNEG, 1, false),
        ADD("add", Opcode.FADD, 2, false),
        SUB("sub", Opcode.FSUB, 2, false),
        MUL("mul", Opcode.FMUL, 2, false),
        DIV("div", Opcode.FDIV, 2, false),
        LT("lt", Opcode.FOLT, 2, true),
        LE("le", Opcode.FOLE, 2, true),
        GT("gt", Opcode.FOGT, 2, true),
        GE("ge", Opcode.FOGE, 2, true),
        NE("ne", Opcode.FONE, 2, true),
        // 字面量：参数是 IEEE 位模式
        LITERAL("literal", null, 1, false),
        ;

        private final String tag;
        private final Opcode opcode;
        private final int arity;
        private final boolean compare;

        FloatOp(String tag, Opcode opcode, int arity, boolean compare) {
            this.tag = tag;
            this.opcode = opcode;
            this.arity = arity;
            this.compare = compare;
        }

        public String getTag() { return tag; }
        public Opcode getOpcode() { return opcode; }
        public int getArity() { return arity; }
        public boolean isCompare() { return compare; }

        public static FloatOp fromTag(String tag) {
            for (FloatOp op : values()) {
                if (op.tag.equals(tag)) {
                    return op;
                }
            }
            return null;
        }
    }

    /** a decoded {@code fp_<op>_<bits>} name */
    public record FloatName(FloatOp op, int bitWidth) {
    }

    /** a decoded {@code Saturate_...} name */
    public record Saturation(int inBits, boolean inSigned, int outBits, boolean outSigned) {
    }

    public static String floatName(FloatOp op, int bitWidth) {
        return FP_PREFIX + op.getTag() + "_" + bitWidth;
    }

    public static FloatName parseFloat(String name) {
        String[] parts = name.split("_");
        if (parts.length != 3 || !name.startsWith(FP_PREFIX)) {
            throw UnsupportedFormulaException.malformedPrimitive(name);
        }
        FloatOp op = FloatOp.fromTag(parts[1]);
        if (op == null) {
            throw UnsupportedFormulaException.malformedPrimitive(name);
        }
        int bw = parseBits(name, parts[2]);
        if (bw != 32 && bw != 64) {
            throw UnsupportedFormulaException.malformedPrimitive(name);
        }
        return new FloatName(op, bw);
    }

    public static String saturateName(int inBits, boolean inSigned, int outBits, boolean outSigned) {
        return SATURATE_PREFIX + (inSigned ? "s" : "u") + inBits + "_to_" + (outSigned ? "s" : "u") + outBits;
    }

    public static Saturation parseSaturation(String name) {
        // Saturate_s32_to_s16
        String[] parts = name.split("_");
        if (parts.length != 4 || !"to".equals(parts[2])) {
            throw UnsupportedFormulaException.malformedPrimitive(name);
        }
        return new Saturation(parseBits(name, parts[1].substring(1)), isSigned(name, parts[1]),
                parseBits(name, parts[3].substring(1)), isSigned(name, parts[3]));
    }

    public static String absName(boolean isInt, int bitWidth) {
        return ABS_PREFIX + (isInt ? "i" : "f") + bitWidth;
    }

    /** @return true for an integer {@code Abs_i..}, false for a float {@code Abs_f..} */
    public static boolean parseAbsIsInt(String name) {
        String[] parts = name.split("_");
        if (parts.length != 2 || parts[1].isEmpty()) {
            throw UnsupportedFormulaException.malformedPrimitive(name);
        }
        char kind = parts[1].charAt(0);
        if (kind != 'i' && kind != 'f') {
            throw UnsupportedFormulaException.malformedPrimitive(name);
        }
        parseBits(name, parts[1].substring(1));
        return kind == 'i';
    }

    private static boolean isSigned(String name, String typeName) {
        if (typeName.startsWith("s")) return true;
        if (typeName.startsWith("u")) return false;
        throw UnsupportedFormulaException.malformedPrimitive(name);
    }

    private static int parseBits(String name, String digits) {
        try {
            int bits = Integer.parseInt(digits);
            if (bits <= 0) {
                throw UnsupportedFormulaException.malformedPrimitive(name);
            }
            return bits;
        } catch (NumberFormatException e) {
            throw UnsupportedFormulaException.malformedPrimitive(name);
        }
    }

    // --- builders, used by the abs rule and by callers producing formulas ---

    public static FuncDecl<?> floatDecl(Context ctx, FloatOp op, int bitWidth) {
        BitVecSort bv = ctx.mkBitVecSort(bitWidth);
        Sort[] domain = new Sort[op.getArity()];
        for (int i = 0; i < domain.length; i++) {
            domain[i] = bv;
        }
        Sort range = op.isCompare() ? ctx.mkBoolSort() : bv;
        return ctx.mkFuncDecl(floatName(op, bitWidth), domain, range);
    }

    @SuppressWarnings("unchecked")
    public static Expr<BitVecSort> floatOp(Context ctx, FloatOp op, int bitWidth, Expr<?>... args) {
        return (Expr<BitVecSort>) (Expr<?>) ctx.mkApp(floatDecl(ctx, op, bitWidth), args);
    }

    @SuppressWarnings("unchecked")
    public static Expr<BoolSort> floatCmp(Context ctx, FloatOp op, int bitWidth, Expr<?> a, Expr<?> b) {
        return (Expr<BoolSort>) (Expr<?>) ctx.mkApp(floatDecl(ctx, op, bitWidth), a, b);
    }

    public static Expr<BitVecSort> literal(Context ctx, double value, int bitWidth) {
        long bits = bitWidth == 32
                ? Integer.toUnsignedLong(Float.floatToRawIntBits((float) value))
                : Double.doubleToRawLongBits(value);
        return floatOp(ctx, FloatOp.LITERAL, bitWidth, Formulas.bvValue(ctx, bits, bitWidth));
    }

    @SuppressWarnings("unchecked")
    public static Expr<BitVecSort> saturate(Context ctx, Expr<BitVecSort> x, Saturation sat) {
        FuncDecl<?> decl = ctx.mkFuncDecl(
                saturateName(sat.inBits(), sat.inSigned(), sat.outBits(), sat.outSigned()),
                ctx.mkBitVecSort(sat.inBits()), ctx.mkBitVecSort(sat.outBits()));
        return (Expr<BitVecSort>) (Expr<?>) ctx.mkApp(decl, x);
    }

    @SuppressWarnings("unchecked")
    public static Expr<BitVecSort> abs(Context ctx, Expr<BitVecSort> x, boolean isInt) {
        int bw = Formulas.size(x);
        FuncDecl<?> decl = ctx.mkFuncDecl(absName(isInt, bw), ctx.mkBitVecSort(bw), ctx.mkBitVecSort(bw));
        return (Expr<BitVecSort>) (Expr<?>) ctx.mkApp(decl, x);
    }
}
