package fol.formula;

import com.google.common.base.Preconditions;
import fol.Substitution;
import fol.term.Term;

import java.util.Comparator;
import java.util.List;

/**
 * Equality between two terms of the same sort. Arguments are stored sorted, so {@code a = b} and {@code b = a} are
 * the same formula.
 */
public final class Equals extends Predicate {
    public static final PSymbol EQ_PRED_SYM = new PSymbol("=", 2);

    private final Term left;
    private final Term right;

    public Equals(Term left, Term right) {
        super(EQ_PRED_SYM, List.of(left, right).stream().sorted(Comparator.comparing(Object::toString)).toList());
        Preconditions.checkArgument(left.sort().equals(right.sort()), "Equality between sorts %s and %s",
                left.sort(), right.sort());
        this.left = left;
        this.right = right;
    }

    public Term left() {
        return left;
    }

    public Term right() {
        return right;
    }

    @Override
    public String toString() {
        return left + " = " + right;
    }

    @Override
    public String getEqString(int depth) {
        return args().get(0) + " = " + args().get(1);
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Equals(left.applySub(substitution), right.applySub(substitution));
    }
}
