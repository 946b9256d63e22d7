package lift;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import com.microsoft.z3.enumerations.Z3_decl_kind;

/**
 * Helpers over Z3 formulas shared by the translator and the formula passes.
 */
public final class Formulas {
    private Formulas() {
    }

    public static Z3_decl_kind kindOf(Expr<?> f) {
        return f.isApp() ? f.getFuncDecl().getDeclKind() : null;
    }

    public static boolean isAppOf(Expr<?> f, Z3_decl_kind kind) {
        return f.isApp() && f.getFuncDecl().getDeclKind() == kind;
    }

    /** a free variable: uninterpreted constant without arguments */
    public static boolean isVar(Expr<?> f) {
        return isAppOf(f, Z3_decl_kind.Z3_OP_UNINTERPRETED) && f.getNumArgs() == 0;
    }

    public static String nameOf(Expr<?> f) {
        return f.getFuncDecl().getName().toString();
    }

    @SuppressWarnings("unchecked")
    public static Expr<BitVecSort> bv(Expr<?> f) {
        return (Expr<BitVecSort>) f;
    }

    @SuppressWarnings("unchecked")
    public static Expr<BoolSort> bool(Expr<?> f) {
        return (Expr<BoolSort>) f;
    }

    /** bit-vector width; throws for non bit-vector sorts */
    public static int size(Expr<?> f) {
        return ((BitVecSort) f.getSort()).getSize();
    }

    /** bit-vector width, or 1 for booleans */
    public static int widthOf(Expr<?> f) {
        return f.isBool() ? 1 : size(f);
    }

    public static int intParam(Expr<?> f, int index) {
        return f.getFuncDecl().getParameters()[index].getInt();
    }

    /** (hi, lo) of an extraction, both inclusive */
    public static int extractHi(Expr<?> ext) {
        return intParam(ext, 0);
    }

    public static int extractLo(Expr<?> ext) {
        return intParam(ext, 1);
    }

    public static boolean isBVValue(Expr<?> f) {
        return f.isBVNumeral();
    }

    public static BigInteger valueOf(Expr<?> f) {
        return ((BitVecNum) f).getBigInteger();
    }

    public static boolean isBVValue(Expr<?> f, long value) {
        return f.isBVNumeral() && valueOf(f).equals(BigInteger.valueOf(value));
    }

    /** {@code value} reduced modulo 2^width */
    public static BitVecNum bvValue(Context ctx, BigInteger value, int width) {
        BigInteger modulus = BigInteger.ONE.shiftLeft(width);
        return ctx.mkBV(value.mod(modulus).toString(), width);
    }

    public static BitVecNum bvValue(Context ctx, long value, int width) {
        return bvValue(ctx, BigInteger.valueOf(value), width);
    }

    public static BitVecNum allOnes(Context ctx, int width) {
        return bvValue(ctx, BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE), width);
    }

    public static boolean isAllOnes(Expr<?> f) {
        if (!f.isBVNumeral()) {
            return false;
        }
        int w = size(f);
        return valueOf(f).equals(BigInteger.ONE.shiftLeft(w).subtract(BigInteger.ONE));
    }

    /** concatenation, most significant part first; one element is returned as is */
    public static Expr<BitVecSort> concat(Context ctx, List<? extends Expr<BitVecSort>> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("empty concat");
        }
        Expr<BitVecSort> acc = parts.get(0);
        for (int i = 1; i < parts.size(); i++) {
            acc = ctx.mkConcat(acc, parts.get(i));
        }
        return acc;
    }

    public static BigInteger signedMax(int bitwidth) {
        return BigInteger.ONE.shiftLeft(bitwidth - 1).subtract(BigInteger.ONE);
    }

    public static BigInteger signedMin(int bitwidth) {
        return signedMax(bitwidth).negate().subtract(BigInteger.ONE);
    }

    public static BigInteger unsignedMax(int bitwidth) {
        return BigInteger.ONE.shiftLeft(bitwidth).subtract(BigInteger.ONE);
    }

    public static BigInteger unsignedMin(int bitwidth) {
        return BigInteger.ZERO;
    }

    /**
     * Clamp of {@code x} (an {@code inBw}-bit value) into the range of an
     * {@code outBw}-bit type, truncated to {@code outBw} bits. Bounds that the
     * input type cannot exceed are not tested.
     */
    public static Expr<BitVecSort> saturate(Context ctx, Expr<BitVecSort> x, int inBw, boolean inSigned,
                                            int outBw, boolean outSigned) {
        int bw = Math.max(inBw, outBw);
        Expr<BitVecSort> v = x;
        if (bw > inBw) {
            v = inSigned ? ctx.mkSignExt(bw - inBw, x) : ctx.mkZeroExt(bw - inBw, x);
        }
        BigInteger hi = outSigned ? signedMax(outBw) : unsignedMax(outBw);
        BigInteger lo = outSigned ? signedMin(outBw) : unsignedMin(outBw);
        BigInteger inMax = inSigned ? signedMax(inBw) : unsignedMax(inBw);
        BigInteger inMin = inSigned ? signedMin(inBw) : unsignedMin(inBw);

        Expr<BitVecSort> clamped = v;
        if (lo.compareTo(inMin) > 0) {
            BitVecNum loVal = bvValue(ctx, lo, bw);
            BoolExpr tooSmall = inSigned ? ctx.mkBVSLE(v, loVal) : ctx.mkBVULE(v, loVal);
            clamped = ctx.mkITE(tooSmall, loVal, clamped);
        }
        if (hi.compareTo(inMax) < 0) {
            BitVecNum hiVal = bvValue(ctx, hi, bw);
            BoolExpr tooBig = inSigned ? ctx.mkBVSGT(v, hiVal) : ctx.mkBVUGT(v, hiVal);
            clamped = ctx.mkITE(tooBig, hiVal, clamped);
        }
        return bw == outBw ? clamped : ctx.mkExtract(outBw - 1, 0, clamped);
    }

    public static BoolExpr distinct(Context ctx, Expr<?> a, Expr<?> b) {
        return ctx.mkNot(ctx.mkEq(Formulas.<Sort>uncheckedCast(a), Formulas.<Sort>uncheckedCast(b)));
    }

    public static Expr<BoolSort> eq(Context ctx, Expr<?> a, Expr<?> b) {
        return ctx.mkEq(Formulas.<Sort>uncheckedCast(a), Formulas.<Sort>uncheckedCast(b));
    }

    public static Expr<?> ite(Context ctx, Expr<?> cond, Expr<?> a, Expr<?> b) {
        return ctx.mkITE(bool(cond), Formulas.<Sort>uncheckedCast(a), Formulas.<Sort>uncheckedCast(b));
    }

    /**
     * {@code f} over {@code newArgs}, simplified. Leaves and unchanged nodes
     * are only simplified.
     */
    public static Expr<?> rebuild(Expr<?> f, Expr<?>[] newArgs) {
        if (newArgs.length == 0) {
            return f.simplify();
        }
        Expr<?>[] args = f.getArgs();
        boolean changed = false;
        for (int i = 0; i < args.length; i++) {
            if (!args[i].equals(newArgs[i])) {
                changed = true;
                break;
            }
        }
        return changed ? f.update(newArgs).simplify() : f.simplify();
    }

    /** number of distinct subformulas, shared ones counted once */
    public static int nodeCount(Expr<?> f) {
        Set<Expr<?>> seen = new HashSet<>();
        Deque<Expr<?>> work = new ArrayDeque<>();
        work.push(f);
        while (!work.isEmpty()) {
            Expr<?> e = work.pop();
            if (seen.add(e) && e.isApp()) {
                for (Expr<?> arg : e.getArgs()) {
                    work.push(arg);
                }
            }
        }
        return seen.size();
    }

    @SuppressWarnings("unchecked")
    static <R extends Sort> Expr<R> uncheckedCast(Expr<?> f) {
        return (Expr<R>) f;
    }
}
