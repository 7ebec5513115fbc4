package modelGeneration.folModel;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import fol.Substitution;
import fol.formula.Formula;
import fol.formula.Predicate;
import fol.term.Term;
import modelGeneration.Salient;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Node of a tableau. A node holds only what it adds to its branch; the branch is the chain of nodes up to the root.
 * Formulas, entities and the dispatched formulas are fixed at construction, saliences are decayed in place as the
 * discourse moves on.
 */
public class Tableau {
    private final ImmutableSet<Formula> formulas;
    private final ImmutableSet<Term> entities;
    private final Tableau parent;
    private final Substitution substitution;
    private final ImmutableSet<Formula> dispatchedFormulas;
    private final Map<Term, Double> saliences;

    public Tableau(Collection<? extends Formula> formulas) {
        this(formulas, List.of(), null);
    }

    public Tableau(Collection<? extends Formula> formulas, Collection<? extends Term> entities) {
        this(formulas, entities, null);
    }

    public Tableau(Collection<? extends Formula> formulas, Collection<? extends Term> entities, Tableau parent) {
        this(formulas, entities, parent, null, List.of(), Map.of());
    }

    /**
     * @param substitution the node's substitution, or {@code null} to take over the parent's
     * @param dispatchedFormulas formulas a branching rule has expanded on this node; those already dispatched on the
     *                           parent's branch are dropped
     * @param saliences saliences set on this node; new entities default to {@link Salient#FULL}, everything else
     *                  not given is inherited from the parent
     */
    public Tableau(Collection<? extends Formula> formulas, Collection<? extends Term> entities, Tableau parent,
                   Substitution substitution, Collection<? extends Formula> dispatchedFormulas,
                   Map<? extends Term, Double> saliences) {
        this.formulas = ImmutableSet.copyOf(formulas);
        this.entities = ImmutableSet.copyOf(entities);
        this.parent = parent;
        if (substitution != null) {
            this.substitution = substitution.copy();
        } else if (parent != null) {
            this.substitution = parent.substitution.copy();
        } else {
            this.substitution = new Substitution();
        }
        this.dispatchedFormulas = dispatchedFormulas.stream()
                .filter(f -> parent == null || !parent.branchDispatched(f))
                .collect(ImmutableSet.toImmutableSet());
        this.saliences = new LinkedHashMap<>(saliences);
        for (Term entity : this.entities) {
            this.saliences.putIfAbsent(entity, Salient.FULL);
        }
        if (parent != null) {
            parent.saliences.forEach(this.saliences::putIfAbsent);
        }
    }

    public ImmutableSet<Formula> getFormulas() {
        return formulas;
    }

    public ImmutableSet<Term> getEntities() {
        return entities;
    }

    public ImmutableSet<Formula> getDispatchedFormulas() {
        return dispatchedFormulas;
    }

    public Tableau getParent() {
        return parent;
    }

    public Substitution getSubstitution() {
        return substitution.copy();
    }

    public Map<Term, Double> getSaliences() {
        return Collections.unmodifiableMap(saliences);
    }

    public double getSalience(Term entity) {
        return saliences.getOrDefault(entity, 0.0);
    }

    public List<Salient<Term>> getSalientEntities() {
        return saliences.entrySet().stream().map(e -> new Salient<>(e.getKey(), e.getValue())).toList();
    }

    public void decaySaliences() {
        saliences.replaceAll((entity, salience) -> salience * Salient.DECAY_RATE);
    }

    /**
     * This node followed by its ancestors up to the root.
     */
    public List<Tableau> getBranch() {
        ImmutableList.Builder<Tableau> out = ImmutableList.builder();
        for (Tableau t = this; t != null; t = t.parent) out.add(t);
        return out.build();
    }

    public List<Formula> getBranchFormulas() {
        ImmutableList.Builder<Formula> out = ImmutableList.builder();
        for (Tableau t = this; t != null; t = t.parent) out.addAll(t.formulas);
        return out.build();
    }

    public List<Term> getBranchEntities() {
        ImmutableList.Builder<Term> out = ImmutableList.builder();
        for (Tableau t = this; t != null; t = t.parent) out.addAll(t.entities);
        return out.build();
    }

    public List<Formula> getBranchDispatchedFormulas() {
        ImmutableList.Builder<Formula> out = ImmutableList.builder();
        for (Tableau t = this; t != null; t = t.parent) out.addAll(t.dispatchedFormulas);
        return out.build();
    }

    /**
     * Branch formulas no branching rule has expanded yet on this branch.
     */
    public List<Formula> getBranchUndispatchedFormulas() {
        return getBranchFormulas().stream().filter(f -> !branchDispatched(f)).distinct().toList();
    }

    public List<Formula> getUndispatchedFormulas() {
        return formulas.stream().filter(f -> !branchDispatched(f)).toList();
    }

    public List<Formula> getLiterals() {
        return formulas.stream().filter(Formula::isLiteral).toList();
    }

    public List<Formula> getBranchLiterals() {
        return getBranchFormulas().stream().filter(Formula::isLiteral).toList();
    }

    public boolean branchContains(Formula formula) {
        for (Tableau t = this; t != null; t = t.parent) {
            if (t.formulas.contains(formula)) return true;
        }
        return false;
    }

    public boolean branchContainsEntity(Term entity) {
        for (Tableau t = this; t != null; t = t.parent) {
            if (t.entities.contains(entity)) return true;
        }
        return false;
    }

    public boolean branchDispatched(Formula formula) {
        for (Tableau t = this; t != null; t = t.parent) {
            if (t.dispatchedFormulas.contains(formula)) return true;
        }
        return false;
    }

    /**
     * Strip from {@code leaf} the formulas and entities already on this node's branch. Everything else about the
     * leaf is kept, including its parent.
     */
    public Tableau getUniqueTableau(Tableau leaf) {
        List<Formula> newFormulas = leaf.formulas.stream().filter(f -> !branchContains(f)).toList();
        List<Term> newEntities = leaf.entities.stream().filter(e -> !branchContainsEntity(e)).toList();
        return new Tableau(newFormulas, newEntities, leaf.parent, leaf.substitution, leaf.dispatchedFormulas,
                leaf.saliences);
    }

    public boolean isEmpty() {
        return formulas.isEmpty() && entities.isEmpty();
    }

    /**
     * Merge nodes into a single child of {@code parent}. Contents are united, saliences take the maximum, and
     * substitutions are merged; a node whose substitutions cannot be merged holds {@link Predicate#FALSE}. The result
     * only keeps what is new relative to the parent's branch.
     */
    public static Tableau merge(Collection<Tableau> tableaus, Tableau parent) {
        Set<Formula> formulas = new LinkedHashSet<>();
        Set<Term> entities = new LinkedHashSet<>();
        Set<Formula> dispatched = new LinkedHashSet<>();
        Map<Term, Double> saliences = new LinkedHashMap<>();
        for (Tableau t : tableaus) {
            formulas.addAll(t.formulas);
            entities.addAll(t.entities);
            dispatched.addAll(t.dispatchedFormulas);
            t.saliences.forEach((entity, salience) -> saliences.merge(entity, salience, Math::max));
        }
        List<Substitution> substitutions = tableaus.stream().map(t -> t.substitution).toList();
        Substitution substitution = Substitution.merge(substitutions).orElse(null);
        if (substitution == null) {
            formulas.add(Predicate.FALSE);
            substitution = new Substitution();
        }
        Tableau merged = new Tableau(formulas, entities, parent, substitution, dispatched, saliences);
        if (parent == null) return merged;
        return parent.getUniqueTableau(merged);
    }

    public static Tableau merge(Tableau... tableaus) {
        return merge(List.of(tableaus), null);
    }

    public Tableau copy() {
        return merge(List.of(this), parent);
    }

    /**
     * The whole branch folded into a single root node.
     */
    public Tableau getCollapsedTableau() {
        List<Tableau> detached = getBranch().stream()
                .map(t -> new Tableau(t.formulas, t.entities, null, t.substitution, t.dispatchedFormulas, t.saliences))
                .toList();
        return merge(detached, null);
    }

    public String createString(int indentation, String delim) {
        StringBuilder sb = new StringBuilder();
        sb.append("Tableau (%d formulas, %d entities):\n".formatted(formulas.size(), entities.size()));
        String outerIndent = "  ".repeat(Math.max(0, indentation)) + delim + " ";
        String nestedIndent = "  ".repeat(Math.max(0, indentation + 1)) + delim + " ";
        if (!formulas.isEmpty()) {
            var formulasStrings = formulas.stream()
                    .sorted((Formula f1, Formula f2) -> {
                        int cmp = Integer.compare(f1.countLiterals(), f2.countLiterals());
                        if (cmp != 0)
                            return cmp;
                        return f1.toString().compareTo(f2.toString());
                    })
                    .map(Object::toString)
                    .collect(Collectors.toList());
            sb.append(outerIndent)
                    .append("Formulas:\n")
                    .append(nestedIndent)
                    .append(String.join("\n" + nestedIndent, formulasStrings))
                    .append("\n");
        }
        if (!saliences.isEmpty())
            sb.append(outerIndent)
                    .append("Entities:\n")
                    .append(nestedIndent)
                    .append(String.join("\n" + nestedIndent, getSalientEntities().stream()
                            .sorted(Comparator.reverseOrder())
                            .map(Object::toString).toList()))
                    .append("\n");
        if (!substitution.isEmpty())
            sb.append(outerIndent).append("Substitution: ").append(substitution).append("\n");
        return sb.toString();
    }

    public String createString(int indentation) {
        return createString(indentation, "*");
    }

    @Override
    public String toString() {
        return createString(0);
    }

    private String getEqString() {
        String formulaString = formulas.stream().map(Formula::getEqString).sorted().collect(Collectors.joining(", "));
        String entityString = entities.stream().map(Object::toString).sorted().collect(Collectors.joining(", "));
        return "{" + formulaString + "}{" + entityString + "}";
    }

    /**
     * Two nodes are equal when they hold the same formulas and entities. Parent, substitution, dispatch marks and
     * saliences are not compared.
     */
    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Tableau other)) return false;
        return getEqString().equals(other.getEqString());
    }

    @Override
    public int hashCode() {
        return getEqString().hashCode();
    }
}
