package modelGeneration.folModel;

import com.google.common.collect.Lists;
import fol.Language;
import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.Not;
import fol.formula.Predicate;
import fol.term.Constant;
import modelGeneration.axioms.Axiom;
import modelGeneration.folModel.rules.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * The tableau rules and the closed-branch check.
 */
public class Calculus {
    private static final Logger log = LogManager.getFormatterLogger();

    private final List<InferenceRule> rulesNonBranching;
    private final List<BranchingRule> rulesBranching;

    public Calculus(List<InferenceRule> rulesNonBranching, List<BranchingRule> rulesBranching) {
        this.rulesNonBranching = List.copyOf(rulesNonBranching);
        this.rulesBranching = List.copyOf(rulesBranching);
    }

    public Calculus(Language language) {
        this(getDefaultInferenceRules(), getDefaultBranchingRules(language));
    }

    private static List<InferenceRule> getDefaultInferenceRules() {
        return List.of(new AndElim(), new NotElim(), new ForallElim(), new FocusedForallElim());
    }

    private static List<BranchingRule> getDefaultBranchingRules(Language language) {
        return List.of(new OrElim(), new ExistElim(language), new FocusedExistElim(language));
    }

    public Optional<Tableau> tryNonBranchingRules(Tableau tableau) {
        return tryNonBranchingRules(tableau, List.of());
    }

    /**
     * Apply the non-branching rules and the axioms until none of them adds anything to the branch.
     *
     * @return a single child of {@code tableau} holding everything derived, or empty when nothing was
     */
    public Optional<Tableau> tryNonBranchingRules(Tableau tableau, List<Axiom> axioms) {
        List<Tableau> outputs = applyNonBranching(tableau, axioms);
        Tableau output = null;
        int rounds = 0;
        while (!outputs.isEmpty()) {
            if (output != null) outputs.add(output);
            output = Tableau.merge(outputs, tableau);
            outputs = applyNonBranching(output, axioms);
            rounds++;
        }
        if (output != null) log.trace("Saturated after %d rounds with %d new formulas", rounds, output.getFormulas().size());
        return Optional.ofNullable(output);
    }

    /**
     * The node itself when nothing can be derived, otherwise the saturated child.
     */
    public Tableau saturate(Tableau tableau, List<Axiom> axioms) {
        return tryNonBranchingRules(tableau, axioms).orElse(tableau);
    }

    private List<Tableau> applyNonBranching(Tableau tableau, List<Axiom> axioms) {
        List<Optional<Tableau>> results = new ArrayList<>();
        for (InferenceRule rule : rulesNonBranching) results.add(rule.apply(tableau));
        for (Axiom axiom : axioms) results.add(axiom.apply(tableau));
        List<Tableau> outputs = new ArrayList<>();
        for (Optional<Tableau> result : results) {
            // an axiom may repeat what the branch already knows
            result.map(tableau::getUniqueTableau)
                    .filter(t -> !t.isEmpty())
                    .ifPresent(outputs::add);
        }
        return outputs;
    }

    /**
     * Combine the alternatives of every branching rule into branches under {@code tableau}. Each branch has the
     * branching rules applied again, so that disjunctions and existentials it exposes are split at the same level.
     *
     * @return the branches, or an empty list when no branching rule applies
     */
    public List<Tableau> tryBranchingRules(Tableau tableau) {
        List<List<Tableau>> productions = new ArrayList<>();
        for (BranchingRule rule : rulesBranching) {
            List<Tableau> alternatives = rule.apply(tableau);
            if (!alternatives.isEmpty()) productions.add(alternatives);
        }
        if (productions.isEmpty()) return List.of();
        Set<Tableau> branches = new LinkedHashSet<>();
        for (List<Tableau> combination : Lists.cartesianProduct(productions)) {
            Tableau branch = Tableau.merge(combination, tableau);
            List<Tableau> deeper = tryBranchingRules(branch);
            if (deeper.isEmpty()) {
                branches.add(branch);
                continue;
            }
            for (Tableau extension : deeper) {
                branches.add(Tableau.merge(List.of(branch, extension), tableau));
            }
        }
        log.trace("Branched into %d alternatives", branches.size());
        return List.copyOf(branches);
    }

    /**
     * A branch is closed when it holds falsity, a formula together with its negation, an equality between two
     * distinct named constants, or a denied self equality.
     */
    public static boolean isBranchConsistent(Tableau tableau) {
        Set<Formula> branch = new HashSet<>(tableau.getBranchFormulas());
        if (branch.contains(Predicate.FALSE) || branch.contains(new Not(Predicate.TRUE))) return false;
        for (Formula formula : branch) {
            if (formula instanceof Not not) {
                if (branch.contains(not.formula())) return false;
                if (not.formula() instanceof Equals eq && eq.left().equals(eq.right())) return false;
            }
            if (formula instanceof Equals eq && eq.left() instanceof Constant && eq.right() instanceof Constant
                    && !eq.left().equals(eq.right())) {
                return false;
            }
        }
        return true;
    }

    public static boolean isBranchConsistent(Tableau tableau, List<Axiom> axioms) {
        if (!isBranchConsistent(tableau)) return false;
        for (Axiom axiom : axioms) {
            Optional<Tableau> conclusion = axiom.apply(tableau);
            if (conclusion.isPresent() && !isBranchConsistent(conclusion.get())) return false;
        }
        return true;
    }
}
