package pass;

import java.util.function.Supplier;
import pass.FormulaPass.*;
import pass.Pass.FormulaPass;

/**
 * FormulaPassFactory: create the FormulaPass here
 */
public enum FormulaPassType implements PassType<FormulaPass> {
    DeadBranchElimination(DeadBranchEliminationPass::new),
    RedundantBranchElimination(RedundantBranchEliminationPass::new),
    BitwidthReduction(BitwidthReductionPass::new),
    SubtractionRecovery(SubtractionRecoveryPass::new),
    // add more formula pass here
    ;

    private final Supplier<FormulaPass> supplier;

    FormulaPassType(Supplier<FormulaPass> constructor) {
        this.supplier = constructor;
    }

    @Override
    public Supplier<FormulaPass> constructor() {
        return supplier;
    }
}
