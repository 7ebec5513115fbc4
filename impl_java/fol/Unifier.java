package fol;

import java.util.Optional;

import fol.term.Substitutable;
import fol.term.Term;
import fol.term.Variable;

/**
 * Unification over function-free terms. Variables bind before witnesses, named constants never bind.
 */
public class Unifier {
    public static Optional<Substitution> unify(Term t1, Term t2) {
        return unify(t1, t2, new Substitution());
    }

    public static Optional<Substitution> unify(Term t1, Term t2, Substitution theta) {
        t1 = theta.apply(t1);
        t2 = theta.apply(t2);

        if (t1.equals(t2)) {
            return Optional.of(theta);
        } else if (!t1.sort().equals(t2.sort())) {
            return Optional.empty();
        } else if (t1 instanceof Variable) {
            return unifyVar(t1, t2, theta);
        } else if (t2 instanceof Variable) {
            return unifyVar(t2, t1, theta);
        } else if (t1 instanceof Substitutable) {
            return unifyVar(t1, t2, theta);
        } else if (t2 instanceof Substitutable) {
            return unifyVar(t2, t1, theta);
        } else {
            return Optional.empty();
        }
    }

    private static Optional<Substitution> unifyVar(Term var, Term term, Substitution theta) {
        return Optional.of(theta.compose(Substitution.of(var, term)));
    }
}
