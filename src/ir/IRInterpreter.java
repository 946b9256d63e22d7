package ir;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

import exception.LoweringInvariantException;
import ir.value.LiveIn;
import ir.value.Value;
import ir.value.constants.ConstantFloat;
import ir.value.constants.ConstantInt;
import ir.value.instructions.BinOperator;
import ir.value.instructions.CastInst;
import ir.value.instructions.CmpInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.SelectInst;
import ir.value.instructions.UnaryOperator;

/**
 * Evaluates a DAG for concrete live-in bindings. Every value is a raw bit
 * pattern of its node width held in a long; floats are IEEE bit patterns.
 * Division by zero follows the bit-vector convention: udiv gives all ones,
 * urem/srem give the dividend.
 */
public class IRInterpreter implements InstructionVisitor<Long> {
    private final IRDag dag;
    private final Map<String, BigInteger> bindings;
    private final Map<Integer, Long> values = new HashMap<>();

    public IRInterpreter(IRDag dag, Map<String, BigInteger> bindings) {
        this.dag = dag;
        this.bindings = bindings;
    }

    /** unsigned value of node {@code id}, masked to its width */
    public long evaluate(int id) {
        Long cached = values.get(id);
        if (cached != null) {
            return cached;
        }
        Value v = dag.get(id);
        long result;
        if (v instanceof ConstantInt c) {
            result = c.getValue();
        } else if (v instanceof ConstantFloat c) {
            result = c.toBits();
        } else if (v instanceof LiveIn in) {
            result = evaluateLiveIn(in);
        } else if (v instanceof Instruction inst) {
            result = inst.accept(this) & v.getType().mask();
        } else {
            throw new LoweringInvariantException("cannot evaluate " + v.toIR());
        }
        values.put(id, result);
        return result;
    }

    private long evaluateLiveIn(LiveIn in) {
        BigInteger bound = bindings.get(in.getVariable());
        if (bound == null) {
            throw new IllegalArgumentException("no binding for live-in " + in.getVariable());
        }
        // 零扩展到格宽度
        BigInteger bits = bound.shiftRight(in.getLo())
                .and(BigInteger.ONE.shiftLeft(in.size()).subtract(BigInteger.ONE));
        return bits.longValue();
    }

    private long operand(Instruction inst, int index) {
        return evaluate(inst.getOperand(index));
    }

    private int widthOf(Instruction inst, int index) {
        return dag.bitWidthOf(inst.getOperand(index));
    }

    static long signExtend(long value, int width) {
        if (width >= 64) {
            return value;
        }
        int shift = 64 - width;
        return (value << shift) >> shift;
    }

    @Override
    public Long visit(BinOperator inst) {
        long a = operand(inst, 0);
        long b = operand(inst, 1);
        int w = inst.getBitWidth();
        switch (inst.opCode()) {
            case ADD: return a + b;
            case SUB: return a - b;
            case MUL: return a * b;
            case UDIV: return b == 0 ? -1L : Long.divideUnsigned(a, b);
            case UREM: return b == 0 ? a : Long.remainderUnsigned(a, b);
            case SDIV: {
                long sa = signExtend(a, w);
                long sb = signExtend(b, w);
                if (sb == 0) {
                    return sa < 0 ? 1L : -1L;
                }
                return sa / sb;
            }
            case SREM: {
                long sa = signExtend(a, w);
                long sb = signExtend(b, w);
                return sb == 0 ? sa : sa % sb;
            }
            case SHL: return Long.compareUnsigned(b, w) >= 0 ? 0L : a << b;
            case LSHR: return Long.compareUnsigned(b, w) >= 0 ? 0L : a >>> b;
            case ASHR: {
                long sa = signExtend(a, w);
                return Long.compareUnsigned(b, w) >= 0 ? (sa < 0 ? -1L : 0L) : sa >> b;
            }
            case AND: return a & b;
            case OR: return a | b;
            case XOR: return a ^ b;
            case FADD: case FSUB: case FMUL: case FDIV:
                return floatArith(inst, a, b, w);
            default:
                throw new LoweringInvariantException("not a binary opcode: " + inst.opCode());
        }
    }

    private static long floatArith(BinOperator inst, long a, long b, int w) {
        if (w == 32) {
            float x = Float.intBitsToFloat((int) a);
            float y = Float.intBitsToFloat((int) b);
            float r = switch (inst.opCode()) {
                case FADD -> x + y;
                case FSUB -> x - y;
                case FMUL -> x * y;
                default -> x / y;
            };
            return Integer.toUnsignedLong(Float.floatToRawIntBits(r));
        }
        double x = Double.longBitsToDouble(a);
        double y = Double.longBitsToDouble(b);
        double r = switch (inst.opCode()) {
            case FADD -> x + y;
            case FSUB -> x - y;
            case FMUL -> x * y;
            default -> x / y;
        };
        return Double.doubleToRawLongBits(r);
    }

    @Override
    public Long visit(CmpInst inst) {
        long a = operand(inst, 0);
        long b = operand(inst, 1);
        int w = widthOf(inst, 0);
        boolean r = switch (inst.getPredicate()) {
            case ULT -> Long.compareUnsigned(a, b) < 0;
            case ULE -> Long.compareUnsigned(a, b) <= 0;
            case UGT -> Long.compareUnsigned(a, b) > 0;
            case UGE -> Long.compareUnsigned(a, b) >= 0;
            case SLT -> signExtend(a, w) < signExtend(b, w);
            case SLE -> signExtend(a, w) <= signExtend(b, w);
            case SGT -> signExtend(a, w) > signExtend(b, w);
            case SGE -> signExtend(a, w) >= signExtend(b, w);
            case EQ -> a == b;
            case NE -> a != b;
            case FOLT, FOLE, FOGT, FOGE, FONE -> floatCompare(inst, a, b, w);
            default -> throw new LoweringInvariantException("not a compare: " + inst.getPredicate());
        };
        return r ? 1L : 0L;
    }

    // ordered comparisons: any NaN operand makes them false
    private static boolean floatCompare(CmpInst inst, long a, long b, int w) {
        double x = w == 32 ? Float.intBitsToFloat((int) a) : Double.longBitsToDouble(a);
        double y = w == 32 ? Float.intBitsToFloat((int) b) : Double.longBitsToDouble(b);
        if (Double.isNaN(x) || Double.isNaN(y)) {
            return false;
        }
        return switch (inst.getPredicate()) {
            case FOLT -> x < y;
            case FOLE -> x <= y;
            case FOGT -> x > y;
            case FOGE -> x >= y;
            default -> x != y;
        };
    }

    @Override
    public Long visit(CastInst inst) {
        long v = operand(inst, 0);
        return switch (inst.opCode()) {
            case ZEXT, TRUNC -> v;
            case SEXT -> signExtend(v, widthOf(inst, 0));
            default -> throw new LoweringInvariantException("not a cast: " + inst.opCode());
        };
    }

    @Override
    public Long visit(SelectInst inst) {
        return operand(inst, 0) != 0 ? operand(inst, 1) : operand(inst, 2);
    }

    @Override
    public Long visit(UnaryOperator inst) {
        long v = operand(inst, 0);
        int w = inst.getBitWidth();
        // fneg 只翻转符号位
        return v ^ (1L << (w - 1));
    }
}
