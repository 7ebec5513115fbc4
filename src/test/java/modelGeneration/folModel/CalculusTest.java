package modelGeneration.folModel;

import com.google.common.collect.ImmutableSet;
import fol.Language;
import fol.Sort;
import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.Not;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.term.Constant;
import fol.term.Witness;
import modelGeneration.events.EventSemantics;
import org.junit.Test;

import java.util.List;
import java.util.Optional;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static modelGeneration.events.EventSemantics.Predicates.agent;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.assertThat;

public class CalculusTest {
    private static final Sort PERSON = new Sort("person");
    private static final PSymbol happy = new PSymbol("happy", PERSON);
    private static final PSymbol rich = new PSymbol("rich", PERSON);
    private final Constant john = PERSON.makeConstant("john");
    private final Constant bob = PERSON.makeConstant("bob");
    private final Language language = new Language();
    private final Calculus calculus = new Calculus(language);

    private static boolean consistent(Formula... formulas) {
        return Calculus.isBranchConsistent(new Tableau(List.of(formulas)));
    }

    @Test
    public void closedBranches() {
        assertThat(consistent(happy.apply(john), new Not(happy.apply(john))), is(false));
        assertThat(consistent(Predicate.FALSE), is(false));
        assertThat(consistent(new Not(Predicate.TRUE)), is(false));
        assertThat(consistent(new Equals(john, bob)), is(false));
        assertThat(consistent(new Not(new Equals(john, john))), is(false));
    }

    @Test
    public void openBranches() {
        assertThat(consistent(), is(true));
        assertThat(consistent(happy.apply(john), new Not(happy.apply(bob))), is(true));
        assertThat(consistent(new Equals(john, john)), is(true));
        assertThat(consistent(new Not(new Equals(john, bob))), is(true));
        assertThat(consistent(Predicate.TRUE, new Not(Predicate.FALSE)), is(true));
        Witness witness = language.freshWitness(PERSON);
        assertThat(consistent(new Equals(witness, john)), is(true));
    }

    @Test
    public void contradictionsAcrossTheBranch() {
        Tableau root = new Tableau(List.of(happy.apply(john)));
        Tableau child = new Tableau(List.of(new Not(happy.apply(john))), List.of(), root);
        assertThat(Calculus.isBranchConsistent(root), is(true));
        assertThat(Calculus.isBranchConsistent(child), is(false));
    }

    @Test
    public void axiomsCloseBranches() {
        Witness event = language.freshWitness(EventSemantics.Sorts.EVENT);
        Constant mary = EventSemantics.Sorts.AGENT.makeConstant("mary");
        Constant sue = EventSemantics.Sorts.AGENT.makeConstant("sue");
        Tableau tableau = new Tableau(List.of(agent(event, mary), agent(event, sue)));
        assertThat(Calculus.isBranchConsistent(tableau), is(true));
        assertThat(Calculus.isBranchConsistent(tableau, EventSemantics.getAxioms()), is(false));
        Tableau single = new Tableau(List.of(agent(event, mary)));
        assertThat(Calculus.isBranchConsistent(single, EventSemantics.getAxioms()), is(true));
    }

    @Test
    public void saturationReachesAFixpoint() {
        Formula formula = Formula.and(happy.apply(john), new Not(new Not(Formula.and(rich.apply(john), rich.apply(bob)))));
        Tableau tableau = new Tableau(List.of(formula), List.of(john));
        Optional<Tableau> saturated = calculus.tryNonBranchingRules(tableau);
        assertThat(saturated, isPresent());
        assertThat(saturated.get().getParent(), is(sameInstance(tableau)));
        assertThat(saturated.get().getFormulas(), hasItems(happy.apply(john), rich.apply(john), rich.apply(bob)));
        assertThat(calculus.tryNonBranchingRules(saturated.get()), isEmpty());
    }

    @Test
    public void saturationAppliesUniversalsToDerivedFacts() {
        Formula happyAreRich = language.forallF(PERSON, x -> happy.apply(x), x -> rich.apply(x));
        Tableau tableau = new Tableau(List.of(happyAreRich, Formula.and(happy.apply(bob), happy.apply(bob))),
                List.of(john, bob));
        Tableau saturated = calculus.saturate(tableau, List.of());
        assertThat(saturated.branchContains(rich.apply(bob)), is(true));
        assertThat(saturated.branchContains(rich.apply(john)), is(false));
    }

    @Test
    public void saturationWithAViolatedAxiomTerminates() {
        Witness event = language.freshWitness(EventSemantics.Sorts.EVENT);
        Constant mary = EventSemantics.Sorts.AGENT.makeConstant("mary");
        Constant sue = EventSemantics.Sorts.AGENT.makeConstant("sue");
        Tableau tableau = new Tableau(List.of(Formula.and(agent(event, mary), agent(event, sue))));
        Tableau saturated = calculus.saturate(tableau, EventSemantics.getAxioms());
        assertThat(saturated.branchContains(Predicate.FALSE), is(true));
        assertThat(Calculus.isBranchConsistent(saturated), is(false));
    }

    @Test
    public void saturatedNodesAreLeftAlone() {
        Tableau tableau = new Tableau(List.of(happy.apply(john)), List.of(john));
        assertThat(calculus.tryNonBranchingRules(tableau, EventSemantics.getAxioms()), isEmpty());
        assertThat(calculus.saturate(tableau, List.of()), is(sameInstance(tableau)));
    }

    @Test
    public void branchingCombinesRules() {
        Tableau tableau = new Tableau(List.of(
                Formula.or(happy.apply(john), rich.apply(john)),
                language.exists(PERSON, x -> happy.apply(x))), List.of(john));
        // two disjuncts times (john or a witness)
        assertThat(calculus.tryBranchingRules(tableau).size(), is(4));
    }

    @Test
    public void branchingRecursesIntoExposedFormulas() {
        Tableau tableau = new Tableau(List.of(
                Formula.or(happy.apply(john), Formula.or(rich.apply(john), rich.apply(bob)))));
        List<Tableau> branches = calculus.tryBranchingRules(tableau);
        assertThat(branches.size(), is(3));
        assertThat(branches.get(0).getFormulas(), is(ImmutableSet.<Formula>of(happy.apply(john))));
        for (Tableau branch : branches) {
            assertThat(branch.getParent(), is(sameInstance(tableau)));
        }
        assertThat(branches.get(1).getFormulas(), hasItem(rich.apply(john)));
        assertThat(branches.get(2).getFormulas(), hasItem(rich.apply(bob)));
    }

    @Test
    public void noBranchingRuleApplies() {
        Tableau tableau = new Tableau(List.of(happy.apply(john)), List.of(john));
        assertThat(calculus.tryBranchingRules(tableau).isEmpty(), is(true));
    }
}
