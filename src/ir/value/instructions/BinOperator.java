package ir.value.instructions;

import java.util.function.IntUnaryOperator;

import ir.InstructionVisitor;
import ir.type.IntegerType;
import ir.value.Opcode;

/**
 * Two-operand arithmetic, bitwise, shift or float arithmetic instruction.
 * Operands and result share one width.
 */
public class BinOperator extends Instruction {
    public BinOperator(Opcode opcode, IntegerType type, int lhs, int rhs) {
        super(opcode, type, lhs, rhs);
        assert opcode.isBinary() : "not a binary opcode: " + opcode;
    }

    public int getLhs() { return getOperand(0); }

    public int getRhs() { return getOperand(1); }

    public boolean isCommutative() {
        return opCode().isCommutative();
    }

    @Override
    public String toIR() {
        return opCode().getMnemonic() + " " + getType().toIR() + " "
                + ref(getLhs()) + ", " + ref(getRhs());
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public BinOperator remapOperands(IntUnaryOperator remap) {
        return new BinOperator(opCode(), getType(),
                remap.applyAsInt(getLhs()), remap.applyAsInt(getRhs()));
    }

    @Override
    public String getHash() {
        // 可交换运算排序操作数，保证相同表达式哈希一致
        int a = getLhs(), b = getRhs();
        if (isCommutative() && a > b) {
            int t = a;
            a = b;
            b = t;
        }
        return opCode() + "|" + getBitWidth() + "|" + a + "|" + b;
    }
}
