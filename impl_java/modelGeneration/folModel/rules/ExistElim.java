package modelGeneration.folModel.rules;

import com.google.common.collect.Lists;
import fol.Language;
import fol.Sort;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Not;
import fol.term.Term;
import fol.term.Witness;
import modelGeneration.Salient;
import modelGeneration.folModel.Tableau;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Eliminates existentials {@code -A_x.-body}. Each one can be satisfied by an entity already on the branch or by a
 * fresh witness; every combination over the undispatched existentials of the branch becomes one branch. Branches
 * reusing more salient entities come first.
 */
public class ExistElim implements BranchingRule {

    private final Language language;

    public ExistElim(Language language) {
        this.language = language;
    }

    @Override
    public List<Tableau> apply(final Tableau tableau) {
        List<List<Tableau>> subBranches = new ArrayList<>();
        for (Formula formula : tableau.getBranchUndispatchedFormulas()) {
            if (formula instanceof Not existential && isApplicable(existential)) {
                subBranches.add(getSubBranches(existential, tableau));
            }
        }
        if (subBranches.isEmpty()) return List.of();
        Set<Tableau> branches = new LinkedHashSet<>();
        for (List<Tableau> combination : Lists.cartesianProduct(subBranches)) {
            branches.add(Tableau.merge(combination, tableau));
        }
        return List.copyOf(branches);
    }

    protected boolean isApplicable(Not existential) {
        return existential.formula() instanceof Forall;
    }

    protected List<Tableau> getSubBranches(Not existential, Tableau tableau) {
        Forall forall = (Forall) existential.formula();
        List<Term> candidates = tableau.getBranchEntities().stream()
                .filter(e -> e.sort().equals(forall.sort()))
                .distinct()
                .toList();
        return createSubBranches(existential, forall.sort(), candidates,
                entity -> List.of(Formula.removeDoubleNegation(new Not(forall.apply(entity)))), tableau);
    }

    /**
     * One detached node per candidate entity and one for a fresh witness, each asserting {@code assertion} of its
     * entity and dispatching the existential. Reusing an entity raises it to full salience.
     */
    protected List<Tableau> createSubBranches(Not existential, Sort sort, List<Term> candidates,
                                              Function<Term, List<Formula>> assertion, Tableau tableau) {
        Witness witness = language.freshWitness(sort);
        List<Salient<Term>> ranked = new ArrayList<>();
        ranked.add(new Salient<>(witness, Salient.WITNESS_DEFAULT));
        for (Term candidate : candidates) {
            ranked.add(new Salient<>(candidate, tableau.getSalience(candidate)));
        }
        Set<Tableau> subBranches = new LinkedHashSet<>();
        for (Salient<Term> entity : ranked.stream().sorted(Comparator.reverseOrder()).toList()) {
            if (entity.obj().equals(witness)) {
                subBranches.add(new Tableau(assertion.apply(witness), List.of(witness), null, null,
                        List.of(existential), Map.of(witness, Salient.WITNESS_DEFAULT)));
            } else {
                subBranches.add(new Tableau(assertion.apply(entity.obj()), List.of(), null, null,
                        List.of(existential), Map.of(entity.obj(), Salient.FULL)));
            }
        }
        return List.copyOf(subBranches);
    }
}
