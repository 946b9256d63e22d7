package lift;

import com.microsoft.z3.Expr;

/**
 * Half-open bit interval [lo, hi) of a free variable.
 * Equality is structural; the variable is compared by Z3 identity.
 */
public record BitRange(Expr<?> variable, int lo, int hi) {
    public BitRange {
        if (lo < 0 || lo >= hi) {
            throw new IllegalArgumentException("bad bit range [" + lo + ", " + hi + ")");
        }
    }

    public int size() {
        return hi - lo;
    }

    public boolean overlaps(BitRange other) {
        return variable.equals(other.variable) && lo < other.hi && other.lo < hi;
    }

    public boolean contains(BitRange other) {
        return variable.equals(other.variable) && lo <= other.lo && other.hi <= hi;
    }

    /** smallest range covering both; only meaningful for overlapping ranges */
    public BitRange union(BitRange other) {
        if (!variable.equals(other.variable)) {
            throw new IllegalArgumentException("union of ranges on different variables");
        }
        return new BitRange(variable, Math.min(lo, other.lo), Math.max(hi, other.hi));
    }

    public String variableName() {
        return Formulas.nameOf(variable);
    }

    @Override
    public String toString() {
        return variableName() + "[" + lo + ":" + hi + ")";
    }
}
