package modelGeneration.folModel.rules;

import com.google.common.collect.Lists;
import fol.formula.And;
import fol.formula.Formula;
import fol.formula.Not;
import modelGeneration.folModel.Tableau;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits on every undispatched disjunction {@code -(-a & -b)} of the branch at once. Each branch picks one disjunct
 * per disjunction, so n disjunctions give up to 2^n branches.
 */
public class OrElim implements BranchingRule {

    @Override
    public List<Tableau> apply(final Tableau tableau) {
        List<Not> disjunctions = getDisjunctions(tableau);
        if (disjunctions.isEmpty()) return List.of();
        List<List<Formula>> disjuncts = new ArrayList<>();
        for (Not disjunction : disjunctions) {
            And and = (And) disjunction.formula();
            disjuncts.add(List.of(
                    Formula.removeDoubleNegation(new Not(and.left())),
                    Formula.removeDoubleNegation(new Not(and.right()))));
        }
        Set<Tableau> branches = new LinkedHashSet<>();
        for (List<Formula> choice : Lists.cartesianProduct(disjuncts)) {
            List<Formula> formulas = choice.stream().filter(f -> !tableau.branchContains(f)).distinct().toList();
            // a branch adding nothing is the parent itself
            if (formulas.isEmpty()) continue;
            branches.add(new Tableau(formulas, List.of(), tableau, null, disjunctions, Map.of()));
        }
        return List.copyOf(branches);
    }

    private List<Not> getDisjunctions(Tableau tableau) {
        return tableau.getBranchUndispatchedFormulas().stream()
                .filter(Not.class::isInstance)
                .map(Not.class::cast)
                .filter(Not::isDisjunction)
                .toList();
    }
}
