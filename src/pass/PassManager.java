package pass;

import driver.Config;
import exception.LiftException;
import exception.LoweringInvariantException;
import lift.Formulas;
import lift.LiftResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

import pass.Pass.FormulaPass;
import pass.Pass.IRPass;
import util.LoggingManager;
import util.logging.Logger;

public class PassManager {
    private final List<FormulaPass> formulaPipeline = new ArrayList<>();
    private final List<IRPass> irPipeline = new ArrayList<>();

    private final Set<String> enabledFormula;

    private Logger log = LoggingManager.getLogger(PassManager.class);

    private static PassManager INSTANCE = null;

    public static PassManager getInstance() {
        if (INSTANCE == null) {
            INSTANCE = new PassManager(Config.getInstance().isO1);
        }
        return INSTANCE;
    }

    /**
     * A pipeline for the given level that does not touch the shared instance
     */
    public static PassManager create(boolean optimize) {
        return new PassManager(optimize);
    }

    private PassManager(boolean optimize) {
        // read the system property
        // eg: -Dformula.passes=deadbranchelimination,bitwidthreduction
        enabledFormula = loadEnabled("formula.passes");

        // Configure different pipelines based on optimization level
        if (optimize) {
            setO1Pipeline();
        } else {
            setFunctionalPipeline();
        }
    }

    /**
     * Reset the singleton instance (used for testing different configurations)
     */
    public static void resetInstance() {
        INSTANCE = null;
    }

    /**
     * -O0: lower the formula exactly as given
     */
    private void setFunctionalPipeline() {
        setFormulaPipeline();
        setIRPipeline();
    }

    /**
     * -O1: branch elimination first so width reduction sees fewer selects,
     * subtraction recovery last because simplification undoes it
     */
    private void setO1Pipeline() {
        setFormulaPipeline(
                FormulaPassType.DeadBranchElimination,
                FormulaPassType.RedundantBranchElimination,
                FormulaPassType.BitwidthReduction,
                FormulaPassType.SubtractionRecovery);
        setIRPipeline();
    }

    /** read “a,b,c” from system property and convert them to Set */
    private Set<String> loadEnabled(String propName) {
        String raw = System.getProperty(propName, "").trim();
        if (raw.isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .map(String::toLowerCase)
                .collect(Collectors.toSet());
    }

    // 查询工具，当需要获得其他pass作为上下文时通过这个方法得到
    @SuppressWarnings("unchecked")
    public <T extends Pass> T getPass(Class<T> cls) {
        for (Pass p : formulaPipeline) {
            if (cls.isInstance(p)) {
                return (T) p;
            }
        }

        for (Pass p : irPipeline) {
            if (cls.isInstance(p)) {
                return (T) p;
            }
        }

        throw new LiftException("can not get the pass: " + cls.getName());
    }

    public List<FormulaPassType> getFormulaPipeline() {
        List<FormulaPassType> types = new ArrayList<>();
        for (FormulaPass p : formulaPipeline) {
            types.add(p.getType());
        }
        return types;
    }

    public List<IRPassType> getIRPipeline() {
        List<IRPassType> types = new ArrayList<>();
        for (IRPass p : irPipeline) {
            types.add(p.getType());
        }
        return types;
    }

    public Expr<?> runFormulaPasses(Context ctx, Expr<?> formula) {
        Expr<?> f = formula;
        for (FormulaPass p : formulaPipeline) {
            if (log.isDebugEnabled()) {
                log.debug("[Formula] {} on {} node(s)", p.getType().getName(), Formulas.nodeCount(f));
            }
            f = p.run(ctx, f);
        }
        return f;
    }

    /**
     * Runs every IR check on a lowered result; a failing check is a defect
     * in the lowering rules and raises {@link LoweringInvariantException}.
     */
    public void runIRPasses(Context ctx, LiftResult result) {
        for (IRPass p : irPipeline) {
            if (Config.getInstance().isDebug) {
                log.debug("[IR] " + p.getType().getName());
            }
            if (!p.run(ctx, result)) {
                log.error("[IR] {} rejected:\n{}", p.getType().getName(), result.toIR());
                if (p.getType() == IRPassType.Typecheck) {
                    throw LoweringInvariantException.typecheckFailed(result.formula().toString());
                }
                throw LoweringInvariantException.failedObligation(p.getType().getName());
            }
        }
    }

    /**
     * 追加一个formula pass
     */
    public void addFormulaPass(FormulaPassType type) {
        formulaPipeline.add(type.create());
    }

    /**
     * 按顺序整体设置 formula pipeline（会清空重建）
     */
    private void setFormulaPipeline(FormulaPassType... types) {
        formulaPipeline.clear();
        for (FormulaPassType type : types) {
            if (enabledFormula.isEmpty() || enabledFormula.contains(type.getName())) {
                formulaPipeline.add(type.create());
            }
        }
    }

    /**
     * IR checks come from the configuration, not the optimization level
     */
    private void setIRPipeline() {
        irPipeline.clear();
        if (Config.getInstance().typecheck) {
            irPipeline.add(IRPassType.Typecheck.create());
        }
        if (Config.getInstance().checkSamples > 0) {
            irPipeline.add(IRPassType.EquivalenceCheck.create());
        }
    }
}
