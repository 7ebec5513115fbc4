package modelGeneration.events;

import fol.formula.Formula;
import fol.formula.Not;
import fol.formula.Predicate;
import fol.term.Term;

import java.util.ArrayList;
import java.util.List;

import static modelGeneration.events.EventSemantics.isAgentLiteral;

/**
 * What a branch says about one event.
 */
public class EventInformation {
    private final Term event;
    private final List<Predicate> agents = new ArrayList<>();
    private final List<Predicate> types = new ArrayList<>();
    private final List<Predicate> notAgents = new ArrayList<>();
    private final List<Predicate> notTypes = new ArrayList<>();

    public EventInformation(Term event) {
        this.event = event;
    }

    void add(Predicate literal, boolean negated) {
        boolean agent = isAgentLiteral(literal);
        List<Predicate> target = negated ? (agent ? notAgents : notTypes) : (agent ? agents : types);
        if (!target.contains(literal)) target.add(literal);
    }

    public Term getEvent() {
        return event;
    }

    public List<Predicate> getAgents() {
        return List.copyOf(agents);
    }

    public List<Predicate> getTypes() {
        return List.copyOf(types);
    }

    public List<Predicate> getNotAgents() {
        return List.copyOf(notAgents);
    }

    public List<Predicate> getNotTypes() {
        return List.copyOf(notTypes);
    }

    public List<Formula> getAllLiterals() {
        List<Formula> out = new ArrayList<>(agents);
        out.addAll(types);
        notAgents.forEach(p -> out.add(new Not(p)));
        notTypes.forEach(p -> out.add(new Not(p)));
        return out;
    }

    @Override
    public String toString() {
        return "Event %s: agents=%s types=%s notAgents=%s notTypes=%s".formatted(event, agents, types, notAgents, notTypes);
    }
}
