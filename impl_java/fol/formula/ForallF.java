package fol.formula;

import com.google.common.base.Preconditions;
import fol.Sort;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.Set;

/**
 * Focused universal: for every entity already known to satisfy the guard, the focused body holds. Unlike
 * {@link Forall} it says nothing about entities the guard does not hold for yet.
 */
public final class ForallF implements Formula {
    private final PartialFormula guard;
    private final PartialFormula focused;

    public ForallF(PartialFormula guard, PartialFormula focused) {
        Preconditions.checkArgument(guard.sort().equals(focused.sort()),
                "Guard of sort %s and body of sort %s", guard.sort(), focused.sort());
        this.guard = guard;
        this.focused = focused;
    }

    public PartialFormula guard() {
        return guard;
    }

    public PartialFormula focused() {
        return focused;
    }

    public Sort sort() {
        return guard.sort();
    }

    public Formula applyGuard(Term t) {
        return guard.apply(t);
    }

    public Formula apply(Term t) {
        return focused.apply(t);
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new ForallF(guard.applySub(substitution), focused.applySub(substitution));
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = guard.freeVars();
        out.addAll(focused.freeVars());
        return out;
    }

    @Override
    public int countLiterals() {
        return guard.countLiterals() + focused.countLiterals();
    }

    @Override
    public String getEqString(int depth) {
        return "AF_" + sort().name() + "[" + guard.getEqString(depth) + "]" + focused.getEqString(depth);
    }

    @Override
    public String toString() {
        return "AF_" + guard + "." + focused;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof ForallF other)) return false;
        return getEqString().equals(other.getEqString());
    }

    @Override
    public int hashCode() {
        return getEqString().hashCode();
    }
}
