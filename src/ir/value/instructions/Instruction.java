package ir.value.instructions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

import ir.InstructionVisitor;
import ir.type.IntegerType;
import ir.value.Opcode;
import ir.value.Value;

public abstract class Instruction extends Value {
    private final Opcode opcode;
    private final List<Integer> operands;

    protected Instruction(Opcode opcode, IntegerType type, int... operands) {
        super(type);
        this.opcode = opcode;
        List<Integer> ops = new ArrayList<>(operands.length);
        for (int id : operands) {
            ops.add(id);
        }
        this.operands = Collections.unmodifiableList(ops);
    }

    public Opcode opCode() {
        return opcode;
    }

    @Override
    public List<Integer> getOperandIds() {
        return operands;
    }

    public int getOperand(int index) { return operands.get(index); }

    public boolean isBinary() { return opcode.isBinary(); }

    public boolean isCompare() { return opcode.isCompare(); }

    public boolean isCast() { return opcode.isCast(); }

    public abstract <T> T accept(InstructionVisitor<T> visitor);

    @Override
    public abstract Instruction remapOperands(IntUnaryOperator remap);

    protected static String ref(int id) {
        return "%" + id;
    }

    /** structural key for value numbering: opcode, width and operand ids */
    public String getHash() {
        StringBuilder sb = new StringBuilder();
        sb.append(opcode).append('|').append(getBitWidth());
        for (int id : operands) {
            sb.append('|').append(id);
        }
        return sb.toString();
    }
}
