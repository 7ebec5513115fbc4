package modelGeneration.folModel.rules;

import fol.Language;
import fol.formula.ForallF;
import fol.formula.Formula;
import fol.formula.Not;
import fol.term.Term;
import modelGeneration.folModel.Tableau;

import java.util.List;

/**
 * Focused existential {@code -AF_x[guard].-body}: only entities whose guard already holds are reused. The witness
 * branch asserts the guard of the witness next to the body.
 */
public class FocusedExistElim extends ExistElim {

    public FocusedExistElim(Language language) {
        super(language);
    }

    @Override
    protected boolean isApplicable(Not existential) {
        return existential.formula() instanceof ForallF;
    }

    @Override
    protected List<Tableau> getSubBranches(Not existential, Tableau tableau) {
        ForallF forall = (ForallF) existential.formula();
        List<Term> candidates = tableau.getBranchEntities().stream()
                .filter(e -> e.sort().equals(forall.sort()))
                .filter(e -> tableau.branchContains(forall.applyGuard(e)))
                .distinct()
                .toList();
        return createSubBranches(existential, forall.sort(), candidates, entity -> {
            Formula body = Formula.removeDoubleNegation(new Not(forall.apply(entity)));
            if (candidates.contains(entity)) return List.of(body);
            return List.of(forall.applyGuard(entity), body);
        }, tableau);
    }
}
