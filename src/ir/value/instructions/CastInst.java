package ir.value.instructions;

import java.util.function.IntUnaryOperator;

import ir.InstructionVisitor;
import ir.type.IntegerType;
import ir.value.Opcode;

/**
 * zext / sext / trunc. The only instructions whose operand width differs
 * from the result width.
 */
public class CastInst extends Instruction {
    public CastInst(Opcode op, int value, IntegerType destType) {
        super(op, destType, value);
        if (!op.isCast()) {
            throw new IllegalArgumentException("Unknown cast opcode: " + op);
        }
    }

    public int getValue() { return getOperand(0); }

    public IntegerType getDestType() { return getType(); }

    @Override
    public String toIR() {
        return opCode().getMnemonic() + " " + ref(getValue()) + " to " + getDestType().toIR();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public CastInst remapOperands(IntUnaryOperator remap) {
        return new CastInst(opCode(), remap.applyAsInt(getValue()), getDestType());
    }
}
