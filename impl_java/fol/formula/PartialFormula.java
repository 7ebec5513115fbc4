package fol.formula;

import com.google.common.base.Preconditions;
import fol.Sort;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.Set;

/**
 * Formula with a hole: a body over a placeholder variable of a fixed sort. Applying it to a term of that sort fills
 * the hole. Quantifiers are built from these.
 */
public final class PartialFormula {
    private final Variable placeholder;
    private final Formula body;

    public PartialFormula(Variable placeholder, Formula body) {
        this.placeholder = Preconditions.checkNotNull(placeholder);
        this.body = Preconditions.checkNotNull(body);
    }

    public Variable placeholder() {
        return placeholder;
    }

    public Formula body() {
        return body;
    }

    public Sort sort() {
        return placeholder.sort();
    }

    public Formula apply(Term term) {
        Preconditions.checkArgument(term.sort().equals(sort()), "Cannot apply %s to %s of sort %s",
                this, term, term.sort());
        return body.applySub(Substitution.of(placeholder, term));
    }

    public PartialFormula applySub(Substitution substitution) {
        return new PartialFormula(placeholder, body.applySub(substitution.without(placeholder)));
    }

    public Set<Variable> freeVars() {
        Set<Variable> out = body.freeVars();
        out.remove(placeholder);
        return out;
    }

    public int countLiterals() {
        return body.countLiterals();
    }

    String getEqString(int depth) {
        Variable probe = Variable.probe(sort(), depth);
        return "\\" + probe + "." + apply(probe).getEqString(depth + 1);
    }

    @Override
    public String toString() {
        return "\\" + placeholder + "." + body;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof PartialFormula other)) return false;
        return sort().equals(other.sort()) && getEqString(0).equals(other.getEqString(0));
    }

    @Override
    public int hashCode() {
        return getEqString(0).hashCode();
    }
}
