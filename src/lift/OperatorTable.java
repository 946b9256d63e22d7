package lift;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import ir.value.Opcode;

import static lift.Formulas.bool;
import static lift.Formulas.bv;

/**
 * Generic lowering table: formula head symbol -> IR opcode. Heads with a
 * dedicated rule in {@link Translator} are not listed here.
 */
public final class OperatorTable {
    private static final Map<Z3_decl_kind, Opcode> TABLE = new EnumMap<>(Z3_decl_kind.class);

    // may arrive flattened with more than two operands
    private static final Set<Z3_decl_kind> REDUCTIONS = EnumSet.of(
            Z3_decl_kind.Z3_OP_AND, Z3_decl_kind.Z3_OP_OR, Z3_decl_kind.Z3_OP_XOR,
            Z3_decl_kind.Z3_OP_BAND, Z3_decl_kind.Z3_OP_BOR, Z3_decl_kind.Z3_OP_BXOR,
            Z3_decl_kind.Z3_OP_BADD, Z3_decl_kind.Z3_OP_BMUL);

    static {
        // 布尔连接词
        TABLE.put(Z3_decl_kind.Z3_OP_AND, Opcode.AND);
        TABLE.put(Z3_decl_kind.Z3_OP_OR, Opcode.OR);
        TABLE.put(Z3_decl_kind.Z3_OP_XOR, Opcode.XOR);
        TABLE.put(Z3_decl_kind.Z3_OP_ITE, Opcode.SELECT);

        // 位运算
        TABLE.put(Z3_decl_kind.Z3_OP_BAND, Opcode.AND);
        TABLE.put(Z3_decl_kind.Z3_OP_BOR, Opcode.OR);
        TABLE.put(Z3_decl_kind.Z3_OP_BXOR, Opcode.XOR);

        // 比较
        TABLE.put(Z3_decl_kind.Z3_OP_ULT, Opcode.ULT);
        TABLE.put(Z3_decl_kind.Z3_OP_ULEQ, Opcode.ULE);
        TABLE.put(Z3_decl_kind.Z3_OP_SLT, Opcode.SLT);
        TABLE.put(Z3_decl_kind.Z3_OP_SLEQ, Opcode.SLE);
        TABLE.put(Z3_decl_kind.Z3_OP_UGT, Opcode.UGT);
        TABLE.put(Z3_decl_kind.Z3_OP_UGEQ, Opcode.UGE);
        TABLE.put(Z3_decl_kind.Z3_OP_SGT, Opcode.SGT);
        TABLE.put(Z3_decl_kind.Z3_OP_SGEQ, Opcode.SGE);
        TABLE.put(Z3_decl_kind.Z3_OP_EQ, Opcode.EQ);
        TABLE.put(Z3_decl_kind.Z3_OP_DISTINCT, Opcode.NE);

        // 算术与移位
        TABLE.put(Z3_decl_kind.Z3_OP_BADD, Opcode.ADD);
        TABLE.put(Z3_decl_kind.Z3_OP_BSUB, Opcode.SUB);
        TABLE.put(Z3_decl_kind.Z3_OP_BMUL, Opcode.MUL);
        TABLE.put(Z3_decl_kind.Z3_OP_BUDIV, Opcode.UDIV);
        TABLE.put(Z3_decl_kind.Z3_OP_BUDIV_I, Opcode.UDIV);
        TABLE.put(Z3_decl_kind.Z3_OP_BSDIV, Opcode.SDIV);
        TABLE.put(Z3_decl_kind.Z3_OP_BSDIV_I, Opcode.SDIV);
        TABLE.put(Z3_decl_kind.Z3_OP_BUREM, Opcode.UREM);
        TABLE.put(Z3_decl_kind.Z3_OP_BUREM_I, Opcode.UREM);
        TABLE.put(Z3_decl_kind.Z3_OP_BSREM, Opcode.SREM);
        TABLE.put(Z3_decl_kind.Z3_OP_BSREM_I, Opcode.SREM);
        TABLE.put(Z3_decl_kind.Z3_OP_BSHL, Opcode.SHL);
        TABLE.put(Z3_decl_kind.Z3_OP_BLSHR, Opcode.LSHR);
        TABLE.put(Z3_decl_kind.Z3_OP_BASHR, Opcode.ASHR);

        // 扩展：等宽情况由 Translator 特殊处理
        TABLE.put(Z3_decl_kind.Z3_OP_SIGN_EXT, Opcode.SEXT);
        TABLE.put(Z3_decl_kind.Z3_OP_ZERO_EXT, Opcode.ZEXT);
    }

    private OperatorTable() {
    }

    /** @return the opcode for {@code kind}, or null when the table has no entry */
    public static Opcode lookup(Z3_decl_kind kind) {
        return TABLE.get(kind);
    }

    public static boolean isReduction(Z3_decl_kind kind) {
        return REDUCTIONS.contains(kind);
    }

    /**
     * Re-expands a flattened reduction {@code op(a, b, c, ...)} into the left
     * fold {@code op(op(a, b), c) ...}.
     */
    public static Expr<?> foldReduction(Context ctx, Expr<?> f) {
        Z3_decl_kind kind = Formulas.kindOf(f);
        if (!isReduction(kind)) {
            throw new IllegalArgumentException("not a reduction: " + f);
        }
        Expr<?>[] args = f.getArgs();
        Expr<?> acc = args[0];
        for (int i = 1; i < args.length; i++) {
            acc = binary(ctx, kind, acc, args[i]);
        }
        return acc;
    }

    private static Expr<?> binary(Context ctx, Z3_decl_kind kind, Expr<?> a, Expr<?> b) {
        return switch (kind) {
            case Z3_OP_AND -> ctx.mkAnd(bool(a), bool(b));
            case Z3_OP_OR -> ctx.mkOr(bool(a), bool(b));
            case Z3_OP_XOR -> ctx.mkXor(bool(a), bool(b));
            case Z3_OP_BAND -> ctx.mkBVAND(bv(a), bv(b));
            case Z3_OP_BOR -> ctx.mkBVOR(bv(a), bv(b));
            case Z3_OP_BXOR -> ctx.mkBVXOR(bv(a), bv(b));
            case Z3_OP_BADD -> ctx.mkBVAdd(bv(a), bv(b));
            case Z3_OP_BMUL -> ctx.mkBVMul(bv(a), bv(b));
            default -> throw new IllegalArgumentException("not a reduction: " + kind);
        };
    }
}
