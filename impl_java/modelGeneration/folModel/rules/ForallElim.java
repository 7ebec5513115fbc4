package modelGeneration.folModel.rules;

import fol.formula.Forall;
import fol.formula.Formula;
import fol.term.Term;
import modelGeneration.folModel.Tableau;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Instantiates every universal on the branch with every branch entity of its sort.
 */
public class ForallElim implements InferenceRule {

    @Override
    public Optional<Tableau> apply(final Tableau tableau) {
        List<Term> entities = tableau.getBranchEntities();
        Set<Formula> products = new LinkedHashSet<>();
        for (Forall forall : getForalls(tableau)) {
            for (Term entity : entities) {
                if (!entity.sort().equals(forall.sort())) continue;
                Formula formula = forall.apply(entity);
                if (!tableau.branchContains(formula)) products.add(formula);
            }
        }
        if (products.isEmpty()) return Optional.empty();
        return Optional.of(new Tableau(products, List.of(), tableau));
    }

    private List<Forall> getForalls(Tableau tableau) {
        return tableau.getBranchFormulas().stream()
                .filter(Forall.class::isInstance)
                .map(Forall.class::cast)
                .distinct()
                .toList();
    }
}
