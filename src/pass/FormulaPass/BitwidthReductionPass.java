package pass.FormulaPass;

import java.math.BigInteger;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import lift.Formulas;
import pass.FormulaPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Narrows unsigned arithmetic over zero-extended operands.
 * {@code op(zext(a), zext(b))} becomes {@code zext(op'(zext'(a), zext'(b)))}
 * where op' runs at the smallest width that cannot overflow. Numerals count
 * as zero-extensions of their significant bits.
 */
public class BitwidthReductionPass implements Pass.FormulaPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    private static final Set<Z3_decl_kind> REDUCIBLE = EnumSet.of(
            Z3_decl_kind.Z3_OP_BADD, Z3_decl_kind.Z3_OP_BMUL,
            Z3_decl_kind.Z3_OP_BUDIV, Z3_decl_kind.Z3_OP_BUDIV_I,
            Z3_decl_kind.Z3_OP_BUREM, Z3_decl_kind.Z3_OP_BUREM_I,
            Z3_decl_kind.Z3_OP_BLSHR, Z3_decl_kind.Z3_OP_BSHL);

    private Context ctx;
    private final Map<Expr<?>, Expr<?>> reduced = new HashMap<>();
    private int narrowed;

    @Override
    public FormulaPassType getType() {
        return FormulaPassType.BitwidthReduction;
    }

    @Override
    public Expr<?> run(Context ctx, Expr<?> formula) {
        this.ctx = ctx;
        this.narrowed = 0;
        reduced.clear();

        Expr<?> out = reduce(formula);
        log.debug("narrowed {} operation(s)", narrowed);
        return out;
    }

    private Expr<?> reduce(Expr<?> f) {
        Expr<?> cached = reduced.get(f);
        if (cached != null) {
            return cached;
        }
        Expr<?> result = reduceNode(f);
        reduced.put(f, result);
        return result;
    }

    private Expr<?> reduceNode(Expr<?> f) {
        Expr<?>[] args = f.getArgs();
        Expr<?>[] newArgs = new Expr<?>[args.length];
        for (int i = 0; i < args.length; i++) {
            newArgs[i] = reduce(args[i]);
        }

        Z3_decl_kind kind = Formulas.kindOf(f);
        if (!f.isBV() || !REDUCIBLE.contains(kind)) {
            return Formulas.rebuild(f, newArgs);
        }

        Expr<?>[] pre = new Expr<?>[newArgs.length];
        int widest = 0;
        int sum = 0;
        for (int i = 0; i < newArgs.length; i++) {
            pre[i] = trimZero(newArgs[i]);
            widest = Math.max(widest, Formulas.size(pre[i]));
            sum += Formulas.size(pre[i]);
        }

        int requiredBits;
        switch (kind) {
            case Z3_OP_BADD:
                requiredBits = widest + pre.length - 1;
                break;
            case Z3_OP_BMUL:
            case Z3_OP_BUREM:
            case Z3_OP_BUREM_I:
                requiredBits = sum;
                break;
            case Z3_OP_BUDIV:
            case Z3_OP_BUDIV_I:
                // x / 0 is all ones at the operation width: narrowing changes it
                if (!pre[1].isBVNumeral() || Formulas.valueOf(pre[1]).signum() == 0) {
                    return Formulas.rebuild(f, newArgs);
                }
                requiredBits = sum;
                break;
            case Z3_OP_BLSHR:
                requiredBits = Formulas.size(pre[0]);
                break;
            default:
                // shl keeps every bit it shifts in
                requiredBits = Formulas.size(f);
                break;
        }
        requiredBits = Math.max(requiredBits, widest);

        int width = Formulas.size(f);
        if (requiredBits >= width) {
            // give up
            return Formulas.rebuild(f, newArgs);
        }

        Expr<BitVecSort>[] zextArgs = newBitVecArray(pre.length);
        for (int i = 0; i < pre.length; i++) {
            Expr<BitVecSort> x = Formulas.bv(pre[i]);
            int pad = requiredBits - Formulas.size(x);
            zextArgs[i] = pad > 0 ? ctx.mkZeroExt(pad, x) : x;
        }
        narrowed++;
        return ctx.mkZeroExt(width - requiredBits, construct(kind, zextArgs)).simplify();
    }

    /** the value with its known-zero high bits dropped */
    private Expr<?> trimZero(Expr<?> x) {
        // concat(0, y)
        if (Formulas.isAppOf(x, Z3_decl_kind.Z3_OP_CONCAT) && x.getNumArgs() == 2
                && Formulas.isBVValue(x.getArgs()[0], 0)) {
            return x.getArgs()[1];
        }
        if (Formulas.isAppOf(x, Z3_decl_kind.Z3_OP_ZERO_EXT)) {
            return x.getArgs()[0];
        }
        if (x.isBVNumeral()) {
            BigInteger v = Formulas.valueOf(x);
            return Formulas.bvValue(ctx, v, Math.max(1, v.bitLength()));
        }
        return x;
    }

    private Expr<BitVecSort> construct(Z3_decl_kind kind, Expr<BitVecSort>[] args) {
        switch (kind) {
            case Z3_OP_BADD: {
                Expr<BitVecSort> acc = args[0];
                for (int i = 1; i < args.length; i++) {
                    acc = ctx.mkBVAdd(acc, args[i]);
                }
                return acc;
            }
            case Z3_OP_BMUL: {
                Expr<BitVecSort> acc = args[0];
                for (int i = 1; i < args.length; i++) {
                    acc = ctx.mkBVMul(acc, args[i]);
                }
                return acc;
            }
            case Z3_OP_BUDIV:
            case Z3_OP_BUDIV_I:
                return ctx.mkBVUDiv(args[0], args[1]);
            case Z3_OP_BUREM:
            case Z3_OP_BUREM_I:
                return ctx.mkBVURem(args[0], args[1]);
            case Z3_OP_BLSHR:
                return ctx.mkBVLSHR(args[0], args[1]);
            case Z3_OP_BSHL:
                return ctx.mkBVSHL(args[0], args[1]);
            default:
                throw new IllegalArgumentException("not reducible: " + kind);
        }
    }

    @SuppressWarnings("unchecked")
    private static Expr<BitVecSort>[] newBitVecArray(int n) {
        return (Expr<BitVecSort>[]) new Expr<?>[n];
    }
}
