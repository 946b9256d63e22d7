package pass.IRPass;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import driver.Config;
import ir.IRInterpreter;
import lift.Formulas;
import lift.LiftResult;
import pass.IRPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Random testing of a lowering: binds every live-in to random bits, then
 * compares each lane formula (evaluated by Z3) with the interpreted IR.
 * The whole register must match, so bits above the lane width must be zero.
 * Formulas that still apply uninterpreted functions cannot be evaluated and
 * are skipped.
 */
public class EquivalenceCheckPass implements Pass.IRPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    private int samples = Config.getInstance().checkSamples;
    private long seed = Config.getInstance().checkSeed;
    private boolean skipped;

    @Override
    public IRPassType getType() {
        return IRPassType.EquivalenceCheck;
    }

    public EquivalenceCheckPass setSamples(int samples) {
        this.samples = samples;
        return this;
    }

    public EquivalenceCheckPass setSeed(long seed) {
        this.seed = seed;
        return this;
    }

    /** whether the last run was skipped for uninterpreted functions */
    public boolean wasSkipped() {
        return skipped;
    }

    @Override
    public boolean run(Context ctx, LiftResult result) {
        skipped = false;
        Map<String, Expr<?>> vars = new LinkedHashMap<>();
        if (!collectVariables(result.formula(), vars)) {
            skipped = true;
            log.debug("[Equivalence] skipped: formula applies uninterpreted functions");
            return true;
        }

        Random random = new Random(seed);
        Expr<?>[] from = vars.values().toArray(new Expr<?>[0]);
        for (int sample = 0; sample < samples; sample++) {
            Map<String, BigInteger> bindings = new HashMap<>();
            Expr<?>[] to = new Expr<?>[from.length];
            for (int i = 0; i < from.length; i++) {
                int width = Formulas.size(from[i]);
                BigInteger bits = new BigInteger(width, random);
                bindings.put(Formulas.nameOf(from[i]), bits);
                to[i] = Formulas.bvValue(ctx, bits, width);
            }
            if (!checkSample(result, bindings, from, to)) {
                return false;
            }
        }
        return true;
    }

    private boolean checkSample(LiftResult result, Map<String, BigInteger> bindings,
                                Expr<?>[] from, Expr<?>[] to) {
        IRInterpreter interpreter = new IRInterpreter(result.dag(), bindings);
        for (int lane = 0; lane < result.laneCount(); lane++) {
            Expr<?> formula = result.lanes().get(lane);
            Expr<?> value = (from.length == 0 ? formula : formula.substitute(from, to)).simplify();
            BigInteger expected;
            if (value.isBVNumeral()) {
                expected = Formulas.valueOf(value);
            } else if (value.isTrue() || value.isFalse()) {
                expected = value.isTrue() ? BigInteger.ONE : BigInteger.ZERO;
            } else {
                log.warn("[Equivalence] lane {} did not evaluate to a constant: {}", lane, value);
                return false;
            }

            // 寄存器中逻辑宽度以上的位也要为零
            long actual = interpreter.evaluate(result.outputs().get(lane));
            if (expected.longValue() != actual) {
                log.error("[Equivalence] lane {} differs under {}: formula gives {}, IR gives {}",
                        lane, bindings, expected, Long.toUnsignedString(actual));
                return false;
            }
        }
        return true;
    }

    /**
     * @return false when the formula applies an uninterpreted function
     */
    private static boolean collectVariables(Expr<?> f, Map<String, Expr<?>> vars) {
        List<Expr<?>> work = new ArrayList<>();
        Set<Expr<?>> seen = new HashSet<>();
        work.add(f);
        while (!work.isEmpty()) {
            Expr<?> e = work.remove(work.size() - 1);
            if (!seen.add(e) || !e.isApp()) {
                continue;
            }
            if (Formulas.isAppOf(e, Z3_decl_kind.Z3_OP_UNINTERPRETED)) {
                if (e.getNumArgs() > 0 || !e.isBV()) {
                    return false;
                }
                vars.put(Formulas.nameOf(e), e);
                continue;
            }
            for (Expr<?> arg : e.getArgs()) {
                work.add(arg);
            }
        }
        return true;
    }
}
