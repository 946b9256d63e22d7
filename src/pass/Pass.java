package pass;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

import lift.LiftResult;

public interface Pass {
    // just a mark class for future change

    /** formula -> equivalent formula */
    public interface FormulaPass extends Pass {
        FormulaPassType getType();
        Expr<?> run(Context ctx, Expr<?> formula);
    }

    /** checks a lowered DAG, returns the verdict */
    public interface IRPass extends Pass {
        IRPassType getType();
        boolean run(Context ctx, LiftResult result);
    }
}
