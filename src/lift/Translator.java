package lift;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import exception.LiftException;
import exception.LoweringInvariantException;
import exception.UnsupportedFormulaException;
import ir.Builder;
import ir.IRDag;
import ir.type.IntegerType;
import ir.value.Opcode;
import ir.value.Slice;
import ir.value.Value;
import ir.value.constants.ConstantFloat;
import ir.value.constants.ConstantInt;
import pass.FormulaPass.SubtractionRecoveryPass;
import util.LoggingManager;
import util.logging.Logger;

import static lift.Formulas.bv;
import static lift.Formulas.isAppOf;
import static lift.Formulas.size;

/**
 * Lowers one formula into an {@link IRDag}. Recursive and memoized by
 * formula identity; a translator (with its extraction history) serves a
 * single {@link #translateFormula} call.
 */
public class Translator {
    private static final Logger log = LoggingManager.getLogger(Translator.class);

    private final Context ctx;
    private final Oracle oracle;
    private final ExtractionHistory extractionHistory = new ExtractionHistory();
    private final IRDag dag = new IRDag();
    private final Builder builder = new Builder(dag);

    // formula -> node id
    private final Map<Expr<?>, Integer> translated = new HashMap<>();
    private boolean finished = false;

    public Translator(Context ctx) {
        this(ctx, new Oracle(ctx));
    }

    public Translator(Context ctx, Oracle oracle) {
        this.ctx = ctx;
        this.oracle = oracle;
    }

    /**
     * Entry point. A top-level concatenation is cut into
     * {@code width / laneWidth} lanes, each lowered on its own; anything else
     * is one lane. Every slice placeholder is then resolved and the DAG
     * compacted.
     */
    public LiftResult translateFormula(Expr<?> f, int laneWidth) {
        if (finished) {
            throw new IllegalStateException("translator already used for a formula");
        }
        finished = true;

        List<Expr<?>> lanes = splitLanes(f, laneWidth);
        List<Integer> outs = new ArrayList<>(lanes.size());
        for (Expr<?> lane : lanes) {
            outs.add(translate(lane));
        }

        Map<Integer, Integer> slice2ir = extractionHistory.translateSlices(builder);
        dag.replaceAllUsesWith(slice2ir);
        List<Integer> resolved = new ArrayList<>(outs.size());
        for (int out : outs) {
            int id = IRDag.resolve(slice2ir, out);
            if (!dag.contains(id)) {
                throw LoweringInvariantException.danglingNode("output %" + id);
            }
            resolved.add(id);
        }

        List<Integer> compacted = dag.compact(resolved);
        for (Value v : dag.asMap().values()) {
            if (v instanceof Slice) {
                throw new LoweringInvariantException("unresolved slice placeholder: " + v.toIR());
            }
        }
        log.debug("lowered {} lane(s) into {} node(s)", lanes.size(), dag.size());
        return new LiftResult(f, lanes, compacted, dag);
    }

    /**
     * Re-chunks a concatenation into lanes of {@code laneWidth} bits, most
     * significant lane first. Children need not align with lane boundaries.
     */
    public List<Expr<?>> splitLanes(Expr<?> f, int laneWidth) {
        if (!isAppOf(f, Z3_decl_kind.Z3_OP_CONCAT)) {
            return List.of(f);
        }
        int total = size(f);
        if (laneWidth <= 0 || total % laneWidth != 0) {
            throw LiftException.badLaneWidth(laneWidth, total);
        }

        List<Expr<BitVecSort>> lanes = new ArrayList<>();
        List<Expr<BitVecSort>> partial = new ArrayList<>();
        int partialSize = 0;
        int offset = 0;
        int xOffset = 0;
        Expr<?>[] children = f.getArgs();
        // 从最低位的子项开始扫描
        for (int i = children.length - 1; i >= 0; i--) {
            Expr<BitVecSort> x = bv(children[i]);
            int xSize = size(x);
            while (offset < xOffset + xSize) {
                int begin = offset - xOffset;
                int end = Math.min(begin + laneWidth - partialSize, xSize);
                int chunk = end - begin;
                partialSize += chunk;
                offset += chunk;
                partial.add(ctx.mkExtract(end - 1, begin, x));

                if (partialSize == laneWidth) {
                    Collections.reverse(partial);
                    lanes.add(Formulas.concat(ctx, partial).simplify());
                    partial = new ArrayList<>();
                    partialSize = 0;
                }
            }
            xOffset += xSize;
        }
        Collections.reverse(lanes);

        oracle.prove("lanes re-concatenate to the formula",
                Formulas.eq(ctx, Formulas.concat(ctx, lanes), f)).orFail();
        log.debug("split {}-bit result into {} lane(s) of {} bits", total, lanes.size(), laneWidth);
        return new ArrayList<>(lanes);
    }

    /** @return id of the node computing {@code f} */
    public int translate(Expr<?> f) {
        Integer cached = translated.get(f);
        if (cached != null) {
            return cached;
        }
        Expr<?> g = rewriteDeMorgan(f);
        cached = translated.get(g);
        if (cached == null) {
            Expr<?> h = SubtractionRecoveryPass.recoverSub(ctx, g);
            cached = translated.get(h);
            if (cached == null) {
                cached = dispatch(h);
                translated.put(h, cached);
            }
            translated.put(g, cached);
        }
        translated.put(f, cached);
        return cached;
    }

    // ~(a | b) -> ~a & ~b
    private Expr<?> rewriteDeMorgan(Expr<?> f) {
        if (f.getNumArgs() != 1) {
            return f;
        }
        Expr<?> x = f.getArgs()[0];
        if (x.getNumArgs() != 2) {
            return f;
        }
        Expr<?> a = x.getArgs()[0];
        Expr<?> b = x.getArgs()[1];
        if (isAppOf(f, Z3_decl_kind.Z3_OP_BNOT) && isAppOf(x, Z3_decl_kind.Z3_OP_BOR)) {
            return ctx.mkBVAND(ctx.mkBVNot(bv(a)).simplify(), ctx.mkBVNot(bv(b)).simplify());
        }
        if (isAppOf(f, Z3_decl_kind.Z3_OP_NOT) && isAppOf(x, Z3_decl_kind.Z3_OP_OR)) {
            return ctx.mkAnd(ctx.mkNot(Formulas.bool(a)), ctx.mkNot(Formulas.bool(b)));
        }
        return f;
    }

    private int dispatch(Expr<?> f) {
        Z3_decl_kind kind = Formulas.kindOf(f);
        if (kind == null) {
            throw UnsupportedFormulaException.unSupported("not an application: " + f);
        }
        return switch (kind) {
            case Z3_OP_TRUE -> builder.buildBool(true);
            case Z3_OP_FALSE -> builder.buildBool(false);
            case Z3_OP_NOT -> translateBoolNot(f);
            case Z3_OP_BNOT -> translateNot(f);
            case Z3_OP_BNEG -> translateNeg(f);
            case Z3_OP_EXTRACT -> translateExtract(f);
            case Z3_OP_CONCAT -> translateConcat(f);
            case Z3_OP_ZERO_EXT -> zeroExtend(translate(f.getArgs()[0]), size(f));
            case Z3_OP_SIGN_EXT -> signExtend(translate(f.getArgs()[0]), size(f.getArgs()[0]), size(f));
            case Z3_OP_UNINTERPRETED -> translateUninterpreted(f);
            case Z3_OP_BNUM -> translateConstant(f);
            default -> translateGeneric(kind, f);
        };
    }

    private int translateGeneric(Z3_decl_kind kind, Expr<?> f) {
        Opcode op = OperatorTable.lookup(kind);
        if (op == null) {
            throw UnsupportedFormulaException.unknownOperator(Formulas.nameOf(f));
        }
        if (!f.isBV() && !f.isBool()) {
            throw UnsupportedFormulaException.unSupported("result sort " + f.getSort() + " of " + Formulas.nameOf(f));
        }
        if (kind == Z3_decl_kind.Z3_OP_DISTINCT && f.getNumArgs() != 2) {
            throw UnsupportedFormulaException.unSupported("distinct over " + f.getNumArgs() + " operands");
        }
        if (OperatorTable.isReduction(kind) && f.getNumArgs() > 2) {
            return translate(OperatorTable.foldReduction(ctx, f));
        }

        int bits = Formulas.widthOf(f);
        IntegerType type = IntegerType.ceil(bits);
        Expr<?>[] args = f.getArgs();
        int[] ids = new int[args.length];
        for (int i = 0; i < args.length; i++) {
            ids[i] = translate(args[i]);
        }
        if (op.isSigned()) {
            // ashr 的移位量按无符号读
            int signedOperands = op == Opcode.ASHR ? 1 : ids.length;
            for (int i = 0; i < signedOperands; i++) {
                ids[i] = builder.buildSignFill(ids[i], size(args[i]));
            }
        }
        int result = builder.buildInstruction(op, type, ids);
        return op.mayDirtyHighBits() ? builder.buildMask(result, bits) : result;
    }

    private int translateConstant(Expr<?> c) {
        IntegerType type = IntegerType.ceil(size(c));
        return builder.buildConst(ConstantInt.of(((BitVecNum) c).getBigInteger(), type));
    }

    // not x == xor 1, x
    private int translateBoolNot(Expr<?> f) {
        return builder.buildBinary(Opcode.XOR, IntegerType.i1,
                builder.buildBool(true), translate(f.getArgs()[0]));
    }

    // ~x == -1 ^ x
    private int translateNot(Expr<?> f) {
        Expr<BitVecSort> x = bv(f.getArgs()[0]);
        return translate(ctx.mkBVXOR(Formulas.allOnes(ctx, size(x)), x));
    }

    // -x == 0 - x
    private int translateNeg(Expr<?> f) {
        Expr<BitVecSort> x = bv(f.getArgs()[0]);
        return translate(ctx.mkBVSub(Formulas.bvValue(ctx, 0, size(x)), x));
    }

    private int translateExtract(Expr<?> ext) {
        if (ExtractionHistory.isSimpleExtraction(ext)) {
            return extractionHistory.record(ext, builder);
        }
        int hi = Formulas.extractHi(ext);
        int lo = Formulas.extractLo(ext);
        Expr<?> source = ext.getArgs()[0];

        // 所取位全部落在被扩展的操作数内：直接从操作数取
        Expr<?> narrow = extensionOperand(source);
        if (narrow != null && hi < size(narrow)) {
            source = narrow;
        }
        if (size(source) > 64) {
            throw UnsupportedFormulaException.extractionTooWide(size(source));
        }

        int value = translate(source);
        if (lo > 0) {
            value = builder.buildLShr(value, lo);
        }
        IntegerType type = IntegerType.ceil(hi - lo + 1);
        int width = dag.bitWidthOf(value);
        if (width < type.getBitWidth()) {
            throw LoweringInvariantException.illegalWidth(
                    "extraction of " + type + " from a " + width + "-bit value");
        }
        if (width != type.getBitWidth()) {
            value = builder.buildTrunc(value, type);
        }
        if (hi + 1 < size(source)) {
            value = builder.buildMask(value, hi - lo + 1);
        }
        return value;
    }

    /** y when x is zero_extend(y), sign_extend(y) or concat(0, y); else null */
    private static Expr<?> extensionOperand(Expr<?> x) {
        if (isAppOf(x, Z3_decl_kind.Z3_OP_ZERO_EXT) || isAppOf(x, Z3_decl_kind.Z3_OP_SIGN_EXT)) {
            return x.getArgs()[0];
        }
        if (isAppOf(x, Z3_decl_kind.Z3_OP_CONCAT) && x.getNumArgs() == 2
                && Formulas.isBVValue(x.getArgs()[0], 0)) {
            return x.getArgs()[1];
        }
        return null;
    }

    private int translateConcat(Expr<?> concat) {
        Integer sext = tryTranslateSext(concat);
        if (sext != null) {
            return sext;
        }

        Expr<?>[] args = concat.getArgs();
        if (args.length != 2) {
            throw UnsupportedFormulaException.unsupportedConcat(args.length + " operands in " + concat);
        }
        if (!Formulas.isBVValue(args[0], 0)) {
            throw UnsupportedFormulaException.unsupportedConcat("high part is not zero in " + concat);
        }
        return zeroExtend(translate(args[1]), size(concat));
    }

    /**
     * A concat is lowered as sext when the oracle proves it equal to the sign
     * extension of its last operand; no structural matching is attempted.
     */
    private Integer tryTranslateSext(Expr<?> concat) {
        Expr<?>[] args = concat.getArgs();
        Expr<BitVecSort> x = bv(args[args.length - 1]);
        int n = size(concat);
        int w = size(x);
        if (n <= w) {
            return null;
        }
        boolean isSext = oracle.prove("concat is a sign extension",
                Formulas.eq(ctx, concat, ctx.mkSignExt(n - w, x))).holds();
        if (!isSext) {
            return null;
        }
        return signExtend(translate(x), w, n);
    }

    // the operand may already sit in a register as wide as the target.
    // Bits above a value's own width are always zero, so a zext is enough.
    private int zeroExtend(int value, int toBits) {
        IntegerType type = IntegerType.ceil(toBits);
        if (dag.bitWidthOf(value) == type.getBitWidth()) {
            return value;
        }
        return builder.buildZExt(value, type);
    }

    private int signExtend(int value, int fromBits, int toBits) {
        IntegerType type = IntegerType.ceil(toBits);
        // 先在寄存器宽度内把符号位铺满
        value = builder.buildSignFill(value, fromBits);
        if (type != dag.get(value).getType()) {
            value = builder.buildSExt(value, type);
        }
        return builder.buildMask(value, toBits);
    }

    private int translateUninterpreted(Expr<?> f) {
        if (f.getNumArgs() == 0) {
            if (!f.isBV()) {
                throw UnsupportedFormulaException.unSupported("live-in of sort " + f.getSort() + ": " + f);
            }
            return extractionHistory.recordVariable(f, builder);
        }

        String name = Formulas.nameOf(f);
        if (name.startsWith(FloatPrimitives.SATURATE_PREFIX)) {
            return translateSaturation(f, name);
        }
        if (name.startsWith(FloatPrimitives.ABS_PREFIX)) {
            return translateAbs(f, name);
        }
        if (name.startsWith(FloatPrimitives.FP_PREFIX)) {
            return translateFloat(f, name);
        }
        throw UnsupportedFormulaException.unknownOperator(name);
    }

    private int translateSaturation(Expr<?> f, String name) {
        FloatPrimitives.Saturation sat = FloatPrimitives.parseSaturation(name);
        Expr<BitVecSort> x = bv(f.getArgs()[0]);
        if (f.getNumArgs() != 1 || size(x) != sat.inBits() || size(f) != sat.outBits()) {
            throw UnsupportedFormulaException.malformedPrimitive(name);
        }
        return translate(Formulas.saturate(ctx, x, sat.inBits(), sat.inSigned(), sat.outBits(), sat.outSigned()));
    }

    private int translateAbs(Expr<?> f, String name) {
        boolean isInt = FloatPrimitives.parseAbsIsInt(name);
        if (f.getNumArgs() != 1) {
            throw UnsupportedFormulaException.malformedPrimitive(name);
        }
        Expr<BitVecSort> x = bv(f.getArgs()[0]);
        int bw = size(x);
        Expr<BitVecSort> y;
        if (isInt) {
            y = ctx.mkITE(ctx.mkBVSLT(x, Formulas.bvValue(ctx, 0, bw)), ctx.mkBVNeg(x), x);
        } else {
            y = ctx.mkITE(
                    FloatPrimitives.floatCmp(ctx, FloatPrimitives.FloatOp.LT, bw, x,
                            FloatPrimitives.literal(ctx, 0.0, bw)),
                    FloatPrimitives.floatOp(ctx, FloatPrimitives.FloatOp.NEG, bw, x),
                    x);
        }
        return translate(y);
    }

    private int translateFloat(Expr<?> f, String name) {
        FloatPrimitives.FloatName fn = FloatPrimitives.parseFloat(name);
        if (f.getNumArgs() != fn.op().getArity()) {
            throw UnsupportedFormulaException.malformedPrimitive(name);
        }
        if (fn.op() == FloatPrimitives.FloatOp.LITERAL) {
            Expr<?> arg = f.getArgs()[0];
            if (!arg.isBVNumeral() || size(arg) != fn.bitWidth()) {
                throw UnsupportedFormulaException.malformedPrimitive(name + " applied to " + arg);
            }
            long bits = ((BitVecNum) arg).getBigInteger().longValue();
            return builder.buildFloat(ConstantFloat.fromBits(bits, fn.bitWidth()));
        }

        int bitwidth = f.isBool() ? 1 : size(f);
        if (bitwidth != 1 && bitwidth != 32 && bitwidth != 64) {
            throw UnsupportedFormulaException.malformedPrimitive(name);
        }
        Expr<?>[] args = f.getArgs();
        int[] ids = new int[args.length];
        for (int i = 0; i < args.length; i++) {
            ids[i] = translate(args[i]);
        }
        return builder.buildInstruction(fn.op().getOpcode(), IntegerType.getInteger(bitwidth), ids);
    }
}
