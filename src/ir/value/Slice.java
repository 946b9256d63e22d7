package ir.value;

import ir.type.IntegerType;

/**
 * Placeholder for bits [lo, hi) of a live-in. Only exists while a formula is
 * being translated; resolution replaces every one of them.
 */
public final class Slice extends Value {
    private final String variable;
    private final int lo;
    private final int hi;

    public Slice(String variable, int lo, int hi) {
        super(IntegerType.ceil(hi - lo));
        this.variable = variable;
        this.lo = lo;
        this.hi = hi;
    }

    public String getVariable() { return variable; }
    public int getLo() { return lo; }
    public int getHi() { return hi; }

    @Override
    public String toIR() {
        return "slice " + getType().toIR() + " " + variable + "[" + lo + ":" + hi + ")";
    }
}
