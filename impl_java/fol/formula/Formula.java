package fol.formula;

import fol.Substitution;
import fol.term.Variable;

import java.util.Set;

public sealed interface Formula permits Predicate, And, Not, Forall, ForallF {
    Formula applySub(Substitution substitution);

    /**
     * Get a set of the current free variables inside the formula
     * @return set of free variables in the current formula
     */
    Set<Variable> freeVars();

    /**
     * Canonical string of the formula. Bound variables are renamed by their nesting depth, so two formulas that only
     * differ in the names of their bound variables share it. Equality and hashing of formulas go through this string.
     */
    default String getEqString() {
        return getEqString(0);
    }

    /**
     * @param depth number of quantifiers enclosing this formula
     */
    String getEqString(int depth);

    int countLiterals();

    static Formula and(Formula first, Formula... rest) {
        Formula out = first;
        for (Formula f : rest) out = new And(out, f);
        return out;
    }

    static Not not(Formula formula) {
        return new Not(formula);
    }

    static Not or(Formula left, Formula right) {
        return new Not(new And(new Not(left), new Not(right)));
    }

    static Not implies(Formula premise, Formula conclusion) {
        return or(new Not(premise), conclusion);
    }

    static boolean isAtom(Formula formula) {
        return formula instanceof Predicate;
    }

    static boolean isLiteral(Formula formula) {
        return isAtom(formula) || (formula instanceof Not n && isAtom(n.formula()));
    }

    /**
     * Strips one double negation from the front of a formula, if there is one.
     */
    static Formula removeDoubleNegation(Formula formula) {
        if (formula instanceof Not outer && outer.formula() instanceof Not inner) return inner.formula();
        return formula;
    }
}
