package fol.formula;

import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public sealed class Predicate implements Formula permits Equals {

    public static final Predicate TRUE = new Predicate(new PSymbol("T", 0), List.of());
    public static final Predicate FALSE = new Predicate(new PSymbol("F", 0), List.of());

    private final PSymbol symbol;
    private final List<Term> args;

    public Predicate(PSymbol symbol, List<Term> args) {
        symbol.checkArgs(args);
        this.symbol = symbol;
        this.args = List.copyOf(args);
    }

    @Override
    public int countLiterals() {
        return 1;
    }

    public PSymbol symbol() {
        return symbol;
    }

    public List<Term> args() {
        return args;
    }

    @Override
    public Formula applySub(Substitution substitution) {
        List<Term> newArgs = args.stream().map(t -> t.applySub(substitution)).toList();
        return new Predicate(symbol, newArgs);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return symbol.name();
        }
        return symbol.name() + "(" + String.join(", ", args.stream().map(Object::toString).toArray(String[]::new)) + ")";
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = new HashSet<>();
        for (Term t : args) out.addAll(t.vars());
        return out;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Predicate other)) return false;
        return getEqString().equals(other.getEqString());
    }

    @Override
    public int hashCode() {
        return getEqString().hashCode();
    }

    @Override
    public String getEqString(int depth) {
        return toString();
    }
}
