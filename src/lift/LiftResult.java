package lift;

import java.util.List;

import com.microsoft.z3.Expr;

import ir.IRDag;

/**
 * Outcome of lowering one formula: the compacted node table and one output
 * id per lane, most significant lane first. {@code lanes} holds the formula
 * each output was lowered from.
 */
public record LiftResult(Expr<?> formula, List<Expr<?>> lanes, List<Integer> outputs, IRDag dag) {
    public LiftResult {
        lanes = List.copyOf(lanes);
        outputs = List.copyOf(outputs);
    }

    public int laneCount() {
        return outputs.size();
    }

    public String toIR() {
        return dag.toIR(outputs);
    }
}
