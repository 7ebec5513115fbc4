package modelGeneration.folModel.rules;

import fol.formula.And;
import fol.formula.Formula;
import modelGeneration.folModel.Tableau;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@code a & b} on the node gives {@code a} and {@code b}.
 */
public class AndElim implements InferenceRule {

    @Override
    public Optional<Tableau> apply(final Tableau tableau) {
        Set<Formula> products = new LinkedHashSet<>();
        for (And and : getAnds(tableau)) {
            if (!tableau.branchContains(and.left())) products.add(and.left());
            if (!tableau.branchContains(and.right())) products.add(and.right());
        }
        if (products.isEmpty()) return Optional.empty();
        return Optional.of(new Tableau(products, List.of(), tableau));
    }

    private List<And> getAnds(Tableau tableau) {
        return tableau.getFormulas().stream()
                .filter(And.class::isInstance)
                .map(And.class::cast)
                .toList();
    }
}
