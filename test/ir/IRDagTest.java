package ir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import exception.LoweringInvariantException;
import ir.type.IntegerType;
import ir.value.LiveIn;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.instructions.BinOperator;

public class IRDagTest {
    private IRDag dag;
    private Builder builder;

    @Before
    public void setUp() {
        dag = new IRDag();
        builder = new Builder(dag);
    }

    @Test
    public void idsAreHandedOutInOrder() {
        int a = builder.buildLiveIn("a", 0, 32);
        int b = builder.buildLiveIn("b", 0, 32);
        int sum = builder.buildBinary(Opcode.ADD, IntegerType.i32, a, b);
        assertEquals(0, a);
        assertEquals(1, b);
        assertEquals(2, sum);
        assertEquals(3, dag.size());
        assertEquals("add i32 %0, %1", dag.get(sum).toIR());
    }

    @Test
    public void identicalInstructionsAreNumberedOnce() {
        int a = builder.buildLiveIn("a", 0, 32);
        int b = builder.buildLiveIn("b", 0, 32);
        int x = builder.buildBinary(Opcode.ADD, IntegerType.i32, a, b);
        int y = builder.buildBinary(Opcode.ADD, IntegerType.i32, b, a);
        int c1 = builder.buildConst(7, IntegerType.i32);
        int c2 = builder.buildConst(7, IntegerType.i32);
        assertEquals(x, y);
        assertEquals(c1, c2);
    }

    @Test(expected = LoweringInvariantException.class)
    public void missingNodeIsAnInvariantFailure() {
        dag.get(42);
    }

    @Test
    public void replaceAllUsesRewiresUsers() {
        int a = builder.buildLiveIn("a", 0, 32);
        int b = builder.buildLiveIn("b", 0, 32);
        int c = builder.buildLiveIn("c", 0, 32);
        int sum = builder.buildBinary(Opcode.ADD, IntegerType.i32, a, b);

        dag.replaceAllUsesWith(b, c);

        BinOperator add = (BinOperator) dag.get(sum);
        assertEquals(a, add.getLhs());
        assertEquals(c, add.getRhs());
    }

    @Test
    public void resolveFollowsChains() {
        assertEquals(3, IRDag.resolve(Map.of(1, 2, 2, 3), 1));
        assertEquals(5, IRDag.resolve(Map.of(1, 2), 5));
    }

    @Test(expected = LoweringInvariantException.class)
    public void cyclicReplacementIsRejected() {
        IRDag.resolve(Map.of(1, 2, 2, 1), 1);
    }

    @Test
    public void compactDropsDeadNodesAndOrdersOperandsFirst() {
        builder.buildLiveIn("dead", 0, 8);
        int a = builder.buildLiveIn("a", 0, 32);
        int b = builder.buildLiveIn("b", 0, 32);
        int sum = builder.buildBinary(Opcode.ADD, IntegerType.i32, a, b);
        int prod = builder.buildBinary(Opcode.MUL, IntegerType.i32, sum, a);
        assertEquals(5, dag.size());

        List<Integer> outs = dag.compact(List.of(prod, sum));

        assertEquals(4, dag.size());
        for (Map.Entry<Integer, Value> e : dag.asMap().entrySet()) {
            for (int op : e.getValue().getOperandIds()) {
                assertTrue("operand %" + op + " after user %" + e.getKey(), op < e.getKey());
            }
            if (e.getValue() instanceof LiveIn in) {
                assertFalse(in.getVariable().equals("dead"));
            }
        }
        assertEquals(Opcode.MUL, ((BinOperator) dag.get(outs.get(0))).opCode());
        assertEquals(Opcode.ADD, ((BinOperator) dag.get(outs.get(1))).opCode());
        assertTrue(dag.toIR(outs).endsWith("ret %" + outs.get(0) + ", %" + outs.get(1) + "\n"));
    }
}
