package ir.value.instructions;

import java.util.function.IntUnaryOperator;

import ir.InstructionVisitor;
import ir.type.IntegerType;
import ir.value.Opcode;

/**
 * fneg
 */
public class UnaryOperator extends Instruction {
    public UnaryOperator(Opcode opcode, IntegerType type, int operand) {
        super(opcode, type, operand);
        if (opcode != Opcode.FNEG) {
            throw new IllegalArgumentException("not a unary opcode: " + opcode);
        }
    }

    public int getOperandId() { return getOperand(0); }

    @Override
    public String toIR() {
        return opCode().getMnemonic() + " " + getType().toIR() + " " + ref(getOperandId());
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public UnaryOperator remapOperands(IntUnaryOperator remap) {
        return new UnaryOperator(opCode(), getType(), remap.applyAsInt(getOperandId()));
    }
}
