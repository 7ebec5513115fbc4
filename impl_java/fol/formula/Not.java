package fol.formula;

import fol.Substitution;
import fol.term.Variable;

import java.util.Set;

public record Not(Formula formula) implements Formula {

    @Override
    public Formula applySub(Substitution substitution) {
        return new Not(formula.applySub(substitution));
    }

    @Override
    public int countLiterals() {
        return formula.countLiterals();
    }

    public boolean isDoubleNegation() {
        return formula instanceof Not;
    }

    /**
     * {@code -(-a & -b)}, the encoding of {@code a | b}.
     */
    public boolean isDisjunction() {
        return formula instanceof And;
    }

    /**
     * {@code -A_x.-body} or its focused variant, the encoding of an existential.
     */
    public boolean isExistential() {
        return formula instanceof Forall || formula instanceof ForallF;
    }

    @Override
    public String toString() {
        // print the sugar back
        if (formula instanceof And and && and.left() instanceof Not l && and.right() instanceof Not r) {
            return "(" + l.formula() + " | " + r.formula() + ")";
        }
        if (formula instanceof Forall forall && forall.partial().body() instanceof Not body) {
            return "E_" + forall.partial().placeholder() + "." + body.formula();
        }
        return "-" + formula;
    }

    @Override
    public Set<Variable> freeVars() {
        return formula.freeVars();
    }

    @Override
    public String getEqString(int depth) {
        return "-" + formula.getEqString(depth);
    }

    @Override
    public int hashCode() {
        return getEqString().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Not other)) return false;
        return getEqString().equals(other.getEqString());
    }
}
