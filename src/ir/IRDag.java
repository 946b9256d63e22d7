package ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exception.LoweringInvariantException;
import ir.value.Value;

/**
 * Node table of one lowering: id -> value. Ids come from a monotonically
 * increasing counter and are never handed out twice.
 */
public class IRDag {
    private final Map<Integer, Value> nodes = new LinkedHashMap<>();
    private int idCounter = 0;

    public int add(Value value) {
        int id = idCounter++;
        nodes.put(id, value);
        return id;
    }

    public Value get(int id) {
        Value v = nodes.get(id);
        if (v == null) {
            throw LoweringInvariantException.danglingNode("%" + id);
        }
        return v;
    }

    public boolean contains(int id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    public Map<Integer, Value> asMap() {
        return Collections.unmodifiableMap(nodes);
    }

    public int bitWidthOf(int id) {
        return get(id).getBitWidth();
    }

    /**
     * Rewire every operand reference through {@code replacement}. Values are
     * immutable, so users are rebuilt rather than patched.
     */
    public void replaceAllUsesWith(Map<Integer, Integer> replacement) {
        if (replacement.isEmpty()) {
            return;
        }
        for (Map.Entry<Integer, Value> e : nodes.entrySet()) {
            Value v = e.getValue();
            if (v.getOperandIds().isEmpty()) {
                continue;
            }
            boolean touched = false;
            for (int op : v.getOperandIds()) {
                if (replacement.containsKey(op)) {
                    touched = true;
                    break;
                }
            }
            if (touched) {
                e.setValue(v.remapOperands(id -> resolve(replacement, id)));
            }
        }
    }

    public void replaceAllUsesWith(int oldId, int newId) {
        replaceAllUsesWith(Map.of(oldId, newId));
    }

    /** follows replacement chains (a -> b -> c) to their end */
    public static int resolve(Map<Integer, Integer> replacement, int id) {
        int cur = id;
        int guard = replacement.size() + 1;
        while (replacement.containsKey(cur)) {
            cur = replacement.get(cur);
            if (--guard < 0) {
                throw new LoweringInvariantException("cyclic replacement through %" + id);
            }
        }
        return cur;
    }

    /**
     * Drops nodes unreachable from {@code outputs} and renumbers the rest so
     * that every operand id is smaller than its user's id.
     *
     * @return the outputs under the new numbering, in the same order
     */
    public List<Integer> compact(List<Integer> outputs) {
        Map<Integer, Integer> renumber = new HashMap<>();
        List<Integer> order = new ArrayList<>();

        // 迭代后序遍历，避免深表达式爆栈
        for (int root : outputs) {
            if (renumber.containsKey(root)) {
                continue;
            }
            Deque<int[]> stack = new ArrayDeque<>();
            stack.push(new int[] {root, 0});
            Set<Integer> onStack = new HashSet<>();
            onStack.add(root);
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                List<Integer> ops = get(frame[0]).getOperandIds();
                if (frame[1] < ops.size()) {
                    int child = ops.get(frame[1]++);
                    if (renumber.containsKey(child)) {
                        continue;
                    }
                    if (!onStack.add(child)) {
                        throw new LoweringInvariantException("cycle through %" + child);
                    }
                    stack.push(new int[] {child, 0});
                } else {
                    stack.pop();
                    onStack.remove(frame[0]);
                    renumber.put(frame[0], order.size());
                    order.add(frame[0]);
                }
            }
        }

        Map<Integer, Value> old = new LinkedHashMap<>(nodes);
        nodes.clear();
        for (int oldId : order) {
            nodes.put(renumber.get(oldId), old.get(oldId).remapOperands(renumber::get));
        }
        idCounter = order.size();

        List<Integer> newOutputs = new ArrayList<>(outputs.size());
        for (int out : outputs) {
            newOutputs.add(renumber.get(out));
        }
        return newOutputs;
    }

    public String toIR() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, Value> e : nodes.entrySet()) {
            sb.append("  %").append(e.getKey()).append(" = ").append(e.getValue().toIR()).append('\n');
        }
        return sb.toString();
    }

    public String toIR(List<Integer> outputs) {
        StringBuilder sb = new StringBuilder(toIR());
        sb.append("  ret");
        for (int i = 0; i < outputs.size(); i++) {
            sb.append(i == 0 ? " " : ", ").append('%').append(outputs.get(i));
        }
        return sb.append('\n').toString();
    }

    @Override
    public String toString() {
        return toIR();
    }
}
