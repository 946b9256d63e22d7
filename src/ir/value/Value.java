package ir.value;

import ir.type.IntegerType;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * A node of the lowered DAG. Values are immutable; operands are node ids in
 * the owning {@link ir.IRDag}, never embedded values, so a subgraph is shared
 * by every user that names its id.
 */
public abstract class Value {
    private final IntegerType type;

    protected Value(IntegerType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    /** right-hand side of the textual form, e.g. {@code add i32 %1, %2} */
    public abstract String toIR();

    public IntegerType getType() { return type; }
    public int getBitWidth() { return type.getBitWidth(); }

    public List<Integer> getOperandIds() {
        return Collections.emptyList();
    }

    /**
     * @return this value with every operand id passed through {@code remap};
     *         leaves return themselves
     */
    public Value remapOperands(IntUnaryOperator remap) {
        return this;
    }

    @Override
    public String toString() {
        return toIR();
    }
}
