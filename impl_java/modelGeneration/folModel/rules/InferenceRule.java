package modelGeneration.folModel.rules;

import modelGeneration.folModel.Tableau;

import java.util.Optional;

/**
 * Rule that extends a branch without splitting it.
 */
public interface InferenceRule {

    /**
     * Apply the rule to a node. Rules never mutate their input.
     *
     * @param tableau the node to apply the rule to; productions are checked against its whole branch
     * @return a child of {@code tableau} holding the rule's productions that are new to the branch, or empty when
     * there are none
     */
    Optional<Tableau> apply(final Tableau tableau);
}
