package ir.value.instructions;

import java.util.function.IntUnaryOperator;

import ir.InstructionVisitor;
import ir.type.IntegerType;
import ir.value.Opcode;

/**
 * SSA 三元选择指令：result = cond ? trueVal : falseVal
 * 要求：
 * - cond 为 i1
 * - trueVal、falseVal 与结果同宽
 */
public class SelectInst extends Instruction {
    public SelectInst(IntegerType type, int cond, int trueVal, int falseVal) {
        super(Opcode.SELECT, type, cond, trueVal, falseVal);
    }

    public int getCondition() { return getOperand(0); }

    public int getTrueValue() { return getOperand(1); }

    public int getFalseValue() { return getOperand(2); }

    @Override
    public String toIR() {
        return "select " + ref(getCondition()) + ", "
                + getType().toIR() + " " + ref(getTrueValue()) + ", " + ref(getFalseValue());
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public SelectInst remapOperands(IntUnaryOperator remap) {
        return new SelectInst(getType(), remap.applyAsInt(getCondition()),
                remap.applyAsInt(getTrueValue()), remap.applyAsInt(getFalseValue()));
    }
}
