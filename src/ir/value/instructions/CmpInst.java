package ir.value.instructions;

import java.util.function.IntUnaryOperator;

import ir.InstructionVisitor;
import ir.type.IntegerType;
import ir.value.Opcode;

/**
 * Integer or ordered float comparison; the result is always i1.
 */
public class CmpInst extends Instruction {
    public CmpInst(Opcode predicate, int lhs, int rhs) {
        super(predicate, IntegerType.i1, lhs, rhs);
        assert predicate.isCompare() : "not a compare predicate: " + predicate;
    }

    public Opcode getPredicate() { return opCode(); }

    public int getLhs() { return getOperand(0); }

    public int getRhs() { return getOperand(1); }

    @Override
    public String toIR() {
        return opCode().getMnemonic() + " " + ref(getLhs()) + ", " + ref(getRhs());
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public CmpInst remapOperands(IntUnaryOperator remap) {
        return new CmpInst(opCode(), remap.applyAsInt(getLhs()), remap.applyAsInt(getRhs()));
    }
}
