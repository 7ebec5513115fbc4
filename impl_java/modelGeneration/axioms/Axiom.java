package modelGeneration.axioms;

import modelGeneration.folModel.Tableau;

import java.util.Optional;

/**
 * Domain knowledge checked alongside the calculus rules.
 */
@FunctionalInterface
public interface Axiom {

    /**
     * @return a child of {@code tableau} holding what the axiom concludes about the branch, or empty when it has
     * nothing new to add
     */
    Optional<Tableau> apply(Tableau tableau);
}
