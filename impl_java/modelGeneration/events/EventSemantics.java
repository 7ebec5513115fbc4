package modelGeneration.events;

import fol.Sort;
import fol.formula.Formula;
import fol.formula.Not;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.term.Term;
import modelGeneration.axioms.Axiom;
import modelGeneration.axioms.SingleAgentEvents;
import modelGeneration.axioms.SingleTypeEvents;
import modelGeneration.folModel.Tableau;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Neo-Davidsonian vocabulary: a sentence introduces an event, linked to who did it and what kind of event it was.
 */
public final class EventSemantics {

    private EventSemantics() {
    }

    public static class Sorts {
        public static final Sort EVENT = new Sort("Event");
        public static final Sort AGENT = new Sort("agent");
        public static final Sort TYPE = new Sort("type");
    }

    public static class Predicates {
        public static final PSymbol agentPSym = new PSymbol("agent", Sorts.EVENT, Sorts.AGENT);
        public static final PSymbol typePSym = new PSymbol("type", Sorts.EVENT, Sorts.TYPE);

        public static Predicate agent(Term event, Term agent) {
            return agentPSym.apply(event, agent);
        }

        public static Predicate type(Term event, Term type) {
            return typePSym.apply(event, type);
        }
    }

    public static List<Axiom> getAxioms() {
        return List.of(new SingleAgentEvents(), new SingleTypeEvents());
    }

    public static boolean isAgentLiteral(Formula formula) {
        return formula instanceof Predicate p && p.symbol().equals(Predicates.agentPSym);
    }

    public static boolean isTypeLiteral(Formula formula) {
        return formula instanceof Predicate p && p.symbol().equals(Predicates.typePSym);
    }

    /**
     * Group agent and type literals, positive and negated, by the event they talk about. Other formulas are ignored.
     */
    public static Collection<EventInformation> getEventInformation(Iterable<Formula> formulas) {
        Map<Term, EventInformation> events = new LinkedHashMap<>();
        for (Formula formula : formulas) {
            boolean negated = formula instanceof Not;
            Formula atom = negated ? ((Not) formula).formula() : formula;
            if (!isAgentLiteral(atom) && !isTypeLiteral(atom)) continue;
            Predicate predicate = (Predicate) atom;
            EventInformation info = events.computeIfAbsent(predicate.args().get(0), EventInformation::new);
            info.add(predicate, negated);
        }
        return events.values();
    }

    public static Collection<EventInformation> getBranchEventInformation(Tableau tableau) {
        return getEventInformation(tableau.getBranchLiterals());
    }
}
