package fol.term;

import com.google.common.base.Preconditions;
import fol.Language;
import fol.Sort;
import fol.Substitution;

import java.util.HashSet;
import java.util.Set;

/**
 * Constant without the unique name assumption. Introduced by exists elimination as the individual that satisfies the
 * quantified formula, so it may later be unified with another term of its sort.
 */
public record Witness(Sort sort, String name) implements Term, Substitutable {
    public Witness {
        Preconditions.checkNotNull(sort);
        Preconditions.checkArgument(name != null && !name.isEmpty(), "A witness needs a name");
        Preconditions.checkArgument(Language.isWitnessName(name), "Not a witness name: %s", name);
    }

    @Override
    public Term applySub(Substitution substitution) {
        return substitution.getOrDefault(this, this);
    }

    @Override
    public String toString() {
        return sort.name() + "(" + name + ")";
    }

    @Override
    public Set<Variable> vars() {
        return new HashSet<>();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Witness other && other.name.equals(name) && other.sort.equals(sort);
    }

    @Override
    public int hashCode() {
        return ("W:" + this).hashCode();
    }
}
