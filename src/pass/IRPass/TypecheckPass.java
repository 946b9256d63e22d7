package pass.IRPass;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.microsoft.z3.Context;

import ir.IRDag;
import ir.InstructionVisitor;
import ir.value.Slice;
import ir.value.Value;
import ir.value.instructions.BinOperator;
import ir.value.instructions.CastInst;
import ir.value.instructions.CmpInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.SelectInst;
import ir.value.instructions.UnaryOperator;
import lift.LiftResult;
import pass.IRPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Bitwidth checker for a lowered DAG:
 * - binary ops: operands and result share one width
 * - compares: operands share one width, result is i1
 * - select: condition is i1, both values have the result width
 * - casts: only required to be a cast
 * All nodes are scanned; every violation is logged.
 */
public class TypecheckPass implements Pass.IRPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    private final List<String> violations = new ArrayList<>();

    @Override
    public IRPassType getType() {
        return IRPassType.Typecheck;
    }

    @Override
    public boolean run(Context ctx, LiftResult result) {
        return typecheck(result.dag());
    }

    public boolean typecheck(IRDag dag) {
        violations.clear();
        Checker checker = new Checker(dag);
        for (Map.Entry<Integer, Value> e : dag.asMap().entrySet()) {
            Value v = e.getValue();
            if (v instanceof Slice) {
                fail(e.getKey(), v, "slice placeholder left in the DAG");
                continue;
            }
            if (!(v instanceof Instruction inst)) {
                continue;
            }
            boolean danglingOperand = false;
            for (int op : inst.getOperandIds()) {
                if (!dag.contains(op)) {
                    fail(e.getKey(), v, "operand %" + op + " does not exist");
                    danglingOperand = true;
                }
            }
            if (!danglingOperand && !inst.accept(checker)) {
                fail(e.getKey(), v, "operand widths do not fit the opcode");
            }
        }
        return violations.isEmpty();
    }

    public List<String> getViolations() {
        return List.copyOf(violations);
    }

    private void fail(int id, Value v, String why) {
        String msg = "%" + id + " = " + v.toIR() + ": " + why;
        violations.add(msg);
        log.debug("[Typecheck] {}", msg);
    }

    private static final class Checker implements InstructionVisitor<Boolean> {
        private final IRDag dag;

        Checker(IRDag dag) {
            this.dag = dag;
        }

        private int width(Instruction inst, int index) {
            return dag.bitWidthOf(inst.getOperand(index));
        }

        @Override
        public Boolean visit(BinOperator inst) {
            return width(inst, 0) == width(inst, 1) && width(inst, 0) == inst.getBitWidth();
        }

        @Override
        public Boolean visit(CmpInst inst) {
            return width(inst, 0) == width(inst, 1) && inst.getBitWidth() == 1;
        }

        @Override
        public Boolean visit(SelectInst inst) {
            return width(inst, 0) == 1
                    && width(inst, 1) == inst.getBitWidth()
                    && width(inst, 2) == inst.getBitWidth();
        }

        @Override
        public Boolean visit(CastInst inst) {
            return inst.isCast();
        }

        @Override
        public Boolean visit(UnaryOperator inst) {
            return width(inst, 0) == inst.getBitWidth();
        }
    }
}
