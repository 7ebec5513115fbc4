package fol.formula;

import com.google.common.base.Preconditions;
import fol.Sort;
import fol.term.Term;

import java.util.List;

/**
 * Predicate symbol. A typed symbol carries one sort per argument position, an untyped one has {@code sorts == null}
 * and accepts terms of any sort.
 */
public record PSymbol(String name, int arity, List<Sort> sorts) {

    public PSymbol {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "A predicate symbol needs a name");
        Preconditions.checkArgument(arity >= 0, "Negative arity for %s", name);
        if (sorts != null) {
            Preconditions.checkArgument(sorts.size() == arity, "%s expects %s sorts but got %s", name, arity, sorts.size());
            sorts = List.copyOf(sorts);
        }
    }

    public PSymbol(String name, int arity) {
        this(name, arity, null);
    }

    public PSymbol(String name, Sort... sorts) {
        this(name, sorts.length, List.of(sorts));
    }

    public Predicate apply(Term... args) {
        return new Predicate(this, List.of(args));
    }

    void checkArgs(List<Term> args) {
        Preconditions.checkArgument(args.size() == arity, "%s expects %s arguments but got %s", name, arity, args.size());
        if (sorts == null) return;
        for (int i = 0; i < arity; i++) {
            Preconditions.checkArgument(args.get(i).sort().equals(sorts.get(i)),
                    "Argument %s of %s must be of sort %s, got %s", i, name, sorts.get(i), args.get(i));
        }
    }

    public String toString() {
        return name + "\\" + arity;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof PSymbol other)) return false;
        return name.equals(other.name) && arity == other.arity;
    }

    @Override
    public int hashCode() {
        return (name + "\\" + arity).hashCode();
    }
}
