package ir;

import java.util.HashMap;
import java.util.Map;

import ir.type.IntegerType;
import ir.value.LiveIn;
import ir.value.Opcode;
import ir.value.Slice;
import ir.value.Value;
import ir.value.constants.ConstantFloat;
import ir.value.constants.ConstantInt;
import ir.value.instructions.BinOperator;
import ir.value.instructions.CastInst;
import ir.value.instructions.CmpInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.SelectInst;
import ir.value.instructions.UnaryOperator;

/**
 * Appends values to an {@link IRDag}. Identical constants and identical
 * instructions (same opcode, width and operand ids) are numbered once.
 */
public class Builder {
    private final IRDag dag;

    // 值编号表：常量与指令去重
    private final Map<ConstantInt, Integer> constants = new HashMap<>();
    private final Map<String, Integer> instructions = new HashMap<>();

    public Builder(IRDag dag) {
        this.dag = dag;
    }

    private int insert(Instruction inst) {
        return instructions.computeIfAbsent(inst.getHash(), k -> dag.add(inst));
    }

    // --- 常量 ---
    public int buildConst(long value, IntegerType type) {
        ConstantInt c = new ConstantInt(type, value);
        return constants.computeIfAbsent(c, dag::add);
    }

    public int buildConst(ConstantInt c) {
        return constants.computeIfAbsent(c, dag::add);
    }

    public int buildBool(boolean value) {
        return buildConst(ConstantInt.bool(value));
    }

    public int buildFloat(ConstantFloat c) {
        return dag.add(c);
    }

    // --- 叶子 ---
    public int buildSlice(String variable, int lo, int hi) {
        return dag.add(new Slice(variable, lo, hi));
    }

    public int buildLiveIn(String variable, int lo, int hi) {
        return dag.add(new LiveIn(variable, lo, hi));
    }

    public int add(Value value) {
        return dag.add(value);
    }

    // --- 指令 ---
    public int buildBinary(Opcode opcode, IntegerType type, int lhs, int rhs) {
        return insert(new BinOperator(opcode, type, lhs, rhs));
    }

    public int buildCmp(Opcode predicate, int lhs, int rhs) {
        return insert(new CmpInst(predicate, lhs, rhs));
    }

    public int buildSelect(IntegerType type, int cond, int trueVal, int falseVal) {
        return insert(new SelectInst(type, cond, trueVal, falseVal));
    }

    public int buildCast(Opcode op, int value, IntegerType destType) {
        return insert(new CastInst(op, value, destType));
    }

    public int buildTrunc(int value, IntegerType destType) {
        return buildCast(Opcode.TRUNC, value, destType);
    }

    public int buildZExt(int value, IntegerType destType) {
        return buildCast(Opcode.ZEXT, value, destType);
    }

    public int buildSExt(int value, IntegerType destType) {
        return buildCast(Opcode.SEXT, value, destType);
    }

    public int buildLShr(int value, int amount) {
        IntegerType type = dag.get(value).getType();
        return buildBinary(Opcode.LSHR, type, value, buildConst(amount, type));
    }

    /**
     * Clears every bit of {@code value} at or above {@code bits}; returns
     * {@code value} itself when its register has no such bit.
     */
    public int buildMask(int value, int bits) {
        IntegerType type = dag.get(value).getType();
        if (bits >= type.getBitWidth()) {
            return value;
        }
        return buildBinary(Opcode.AND, type, value, buildConst((1L << bits) - 1, type));
    }

    /**
     * Copies bit {@code bits - 1} of {@code value} into every higher bit of
     * its register with a shl/ashr pair.
     */
    public int buildSignFill(int value, int bits) {
        IntegerType type = dag.get(value).getType();
        int pad = type.getBitWidth() - bits;
        if (pad <= 0) {
            return value;
        }
        int amount = buildConst(pad, type);
        value = buildBinary(Opcode.SHL, type, value, amount);
        return buildBinary(Opcode.ASHR, type, value, amount);
    }

    public int buildFNeg(IntegerType type, int operand) {
        return insert(new UnaryOperator(Opcode.FNEG, type, operand));
    }

    /**
     * Builds any instruction from its opcode. Operand count must match the
     * opcode's arity.
     */
    public int buildInstruction(Opcode op, IntegerType type, int... args) {
        if (op == Opcode.SELECT) {
            checkArity(op, args, 3);
            return buildSelect(type, args[0], args[1], args[2]);
        }
        if (op.isCast()) {
            checkArity(op, args, 1);
            return buildCast(op, args[0], type);
        }
        if (op == Opcode.FNEG) {
            checkArity(op, args, 1);
            return buildFNeg(type, args[0]);
        }
        checkArity(op, args, 2);
        if (op.isCompare()) {
            return buildCmp(op, args[0], args[1]);
        }
        return buildBinary(op, type, args[0], args[1]);
    }

    private static void checkArity(Opcode op, int[] args, int arity) {
        if (args.length != arity) {
            throw new IllegalArgumentException(op + " takes " + arity + " operands, got " + args.length);
        }
    }
}
