package fol.term;

import com.google.common.base.Preconditions;
import fol.Sort;
import fol.Substitution;

import java.util.HashSet;
import java.util.Set;

public record Variable(Sort sort, String name) implements Term, Substitutable {

    private static final String PROBE_PREFIX = "$";

    public Variable {
        Preconditions.checkNotNull(sort);
        Preconditions.checkArgument(name != null && !name.isEmpty(), "A variable needs a name");
    }

    /**
     * Variable used to compare quantified formulas. Bound variables at nesting depth {@code depth} are renamed to it.
     */
    public static Variable probe(Sort sort, int depth) {
        return new Variable(sort, PROBE_PREFIX + depth);
    }

    @Override
    public Term applySub(Substitution substitution) {
        return substitution.getOrDefault(this, this);
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public Set<Variable> vars() {
        return new HashSet<>(Set.of(this));
    }

    @Override
    public int hashCode() {
        return ("V:" + this).hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Variable other)) return false;
        return name.equals(other.name) && sort.equals(other.sort);
    }
}
