package ir.value;

import ir.type.IntegerType;

/**
 * A materialised root slice: bits [lo, hi) of an instruction operand,
 * zero-extended to the lattice width.
 */
public final class LiveIn extends Value {
    private final String variable;
    private final int lo;
    private final int hi;

    public LiveIn(String variable, int lo, int hi) {
        super(IntegerType.ceil(hi - lo));
        this.variable = variable;
        this.lo = lo;
        this.hi = hi;
    }

    public String getVariable() { return variable; }
    public int getLo() { return lo; }
    public int getHi() { return hi; }
    public int size() { return hi - lo; }

    @Override
    public String toIR() {
        return "livein " + getType().toIR() + " " + variable + "[" + lo + ":" + hi + ")";
    }
}
