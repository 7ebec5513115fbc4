package modelGeneration.folModel.rules;

import fol.formula.Formula;
import fol.formula.Not;
import modelGeneration.folModel.Tableau;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Double negation: {@code --a} on the node gives {@code a}.
 */
public class NotElim implements InferenceRule {

    @Override
    public Optional<Tableau> apply(final Tableau tableau) {
        Set<Formula> products = new LinkedHashSet<>();
        for (Formula formula : tableau.getFormulas()) {
            if (!(formula instanceof Not outer) || !outer.isDoubleNegation()) continue;
            Formula inner = ((Not) outer.formula()).formula();
            if (!tableau.branchContains(inner)) products.add(inner);
        }
        if (products.isEmpty()) return Optional.empty();
        return Optional.of(new Tableau(products, List.of(), tableau));
    }
}
