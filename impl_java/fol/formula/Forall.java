package fol.formula;

import fol.Sort;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.Set;

public final class Forall implements Formula {

    private final PartialFormula partial;

    public Forall(PartialFormula partial) {
        this.partial = partial;
    }

    public Forall(Variable var, Formula formula) {
        this(new PartialFormula(var, formula));
    }

    public PartialFormula partial() {
        return partial;
    }

    public Sort sort() {
        return partial.sort();
    }

    public Formula apply(Term t) {
        return partial.apply(t);
    }

    @Override
    public int countLiterals() {
        return partial.countLiterals();
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Forall(partial.applySub(substitution));
    }

    @Override
    public String toString() {
        return "A_" + partial.placeholder() + "." + partial.body();
    }

    @Override
    public Set<Variable> freeVars() {
        return partial.freeVars();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Forall other)) return false;
        return getEqString().equals(other.getEqString());
    }

    @Override
    public int hashCode() {
        return getEqString().hashCode();
    }

    @Override
    public String getEqString(int depth) {
        return "A_" + sort().name() + partial.getEqString(depth);
    }
}
