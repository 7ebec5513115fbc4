package fol.term;

import com.google.common.base.Preconditions;
import fol.Language;
import fol.Sort;
import fol.Substitution;

import java.util.HashSet;
import java.util.Set;

/**
 * Named individual under the unique name assumption: two constants with different names never denote the same thing.
 */
public record Constant(Sort sort, String name) implements Term {
    public Constant {
        Preconditions.checkNotNull(sort);
        Preconditions.checkArgument(name != null && !name.isEmpty(), "A constant needs a name");
        Preconditions.checkArgument(!Language.isReservedName(name) || Language.isGeneratedConstantName(name),
                "Reserved constant name: %s", name);
    }

    @Override
    public Term applySub(Substitution substitution) {
        return this;
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
        return obj instanceof Constant other && other.name.equals(name) && other.sort.equals(sort);
    }

    @Override
    public int hashCode() {
        return ("C:" + this).hashCode();
    }
}
