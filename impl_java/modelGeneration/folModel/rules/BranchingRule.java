package modelGeneration.folModel.rules;

import modelGeneration.folModel.Tableau;

import java.util.List;

/**
 * Rule that splits a branch into alternatives.
 */
public interface BranchingRule {

    /**
     * Expand every formula on the branch the rule applies to and has not dispatched yet.
     *
     * @return alternative children of {@code tableau}, each marking the expanded formulas as dispatched; an empty
     * list when the rule does not apply
     */
    List<Tableau> apply(final Tableau tableau);
}
