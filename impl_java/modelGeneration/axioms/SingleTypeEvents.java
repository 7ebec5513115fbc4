package modelGeneration.axioms;

import fol.formula.Predicate;
import modelGeneration.events.EventInformation;
import modelGeneration.events.EventSemantics;
import modelGeneration.folModel.Tableau;

import java.util.List;
import java.util.Optional;

/**
 * An event has at most one type.
 */
public class SingleTypeEvents implements Axiom {

    @Override
    public Optional<Tableau> apply(Tableau tableau) {
        if (tableau.branchContains(Predicate.FALSE)) return Optional.empty();
        for (EventInformation event : EventSemantics.getBranchEventInformation(tableau)) {
            if (event.getTypes().size() > 1) {
                return Optional.of(new Tableau(List.of(Predicate.FALSE), List.of(), tableau));
            }
        }
        return Optional.empty();
    }
}
