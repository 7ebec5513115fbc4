package fol;

import fol.formula.Equals;
import fol.term.Substitutable;
import fol.term.Term;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mapping from variables and witnesses to terms. Kept idempotent: no bound term appears as the value of another
 * binding, so applying it once is enough.
 */
public class Substitution {
    private final Map<Term, Term> map;

    public Substitution() {
        this.map = new LinkedHashMap<>();
    }

    private Substitution(Map<Term, Term> map) {
        this.map = map;
    }

    public static Substitution of(Term var, Term term) {
        Substitution out = new Substitution();
        out.put(var, term);
        return out;
    }

    public Term getOrDefault(Term var, Term defaultTerm) {
        return map.getOrDefault(var, defaultTerm);
    }

    public Term apply(Term term) {
        return map.getOrDefault(term, term);
    }

    /**
     * Bind {@code var} to {@code term}. The term is resolved through the current bindings first, and every binding
     * that pointed at {@code var} is redirected to it.
     */
    public void put(Term var, Term term) {
        if (!(var instanceof Substitutable)) {
            throw new IllegalArgumentException("Only variables and witnesses can be bound, got " + var);
        }
        Term resolved = apply(term);
        if (resolved.equals(var)) return;
        map.replaceAll((k, v) -> v.equals(var) ? resolved : v);
        map.put(var, resolved);
    }

    /**
     * This substitution followed by {@code other}: every value resolved through {@code other}, plus the bindings of
     * {@code other} for terms this one leaves alone.
     */
    public Substitution compose(Substitution other) {
        Map<Term, Term> newMap = new LinkedHashMap<>();
        for (var e : map.entrySet()) {
            newMap.put(e.getKey(), other.apply(e.getValue()));
        }
        for (var e : other.map.entrySet()) {
            newMap.putIfAbsent(e.getKey(), e.getValue());
        }
        newMap.entrySet().removeIf(e -> e.getKey().equals(e.getValue()));
        return new Substitution(newMap);
    }

    public Substitution without(Term var) {
        if (!map.containsKey(var)) return this;
        Map<Term, Term> newMap = new LinkedHashMap<>(map);
        newMap.remove(var);
        return new Substitution(newMap);
    }

    /**
     * Combine substitutions into one that agrees with each of them.
     *
     * @return the combined substitution, or empty when two of them bind a term to distinct constants
     */
    public static Optional<Substitution> merge(List<Substitution> substitutions) {
        Substitution output = new Substitution();
        for (Substitution substitution : substitutions) {
            for (var e : substitution.map.entrySet()) {
                Optional<Substitution> unified = Unifier.unify(e.getKey(), e.getValue(), output);
                if (unified.isEmpty()) return Optional.empty();
                output = unified.get();
            }
        }
        return Optional.of(output);
    }

    public static Optional<Substitution> merge(Substitution... substitutions) {
        return merge(List.of(substitutions));
    }

    /**
     * Most general unifier making both sides of every equality the same term.
     */
    public static Optional<Substitution> mostGeneralUnifier(List<Equals> equalities) {
        Substitution output = new Substitution();
        for (Equals eq : equalities) {
            Optional<Substitution> unified = Unifier.unify(eq.left(), eq.right(), output);
            if (unified.isEmpty()) return Optional.empty();
            output = unified.get();
        }
        return Optional.of(output);
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public int size() {
        return map.size();
    }

    public boolean contains(Term var) {
        return map.containsKey(var);
    }

    public Substitution copy() {
        return new Substitution(new LinkedHashMap<>(map));
    }

    @Override
    public String toString() {
        return map.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Substitution other)) return false;
        return map.equals(other.map);
    }

    @Override
    public int hashCode() {
        return Objects.hash(map);
    }
}
