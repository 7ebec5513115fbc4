package modelGeneration.folModel.rules;

import fol.formula.ForallF;
import fol.formula.Formula;
import fol.term.Term;
import modelGeneration.folModel.Tableau;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Instantiates a focused universal only for the entities whose guard already holds on the branch.
 */
public class FocusedForallElim implements InferenceRule {

    @Override
    public Optional<Tableau> apply(final Tableau tableau) {
        List<Term> entities = tableau.getBranchEntities();
        Set<Formula> products = new LinkedHashSet<>();
        for (ForallF forall : getFocusedForalls(tableau)) {
            for (Term entity : entities) {
                if (!entity.sort().equals(forall.sort())) continue;
                if (!tableau.branchContains(forall.applyGuard(entity))) continue;
                Formula formula = forall.apply(entity);
                if (!tableau.branchContains(formula)) products.add(formula);
            }
        }
        if (products.isEmpty()) return Optional.empty();
        return Optional.of(new Tableau(products, List.of(), tableau));
    }

    private List<ForallF> getFocusedForalls(Tableau tableau) {
        return tableau.getBranchFormulas().stream()
                .filter(ForallF.class::isInstance)
                .map(ForallF.class::cast)
                .distinct()
                .toList();
    }
}
