package modelGeneration.search;

import discourse.Focus;
import discourse.NounVerbSentence;
import discourse.Reading;
import discourse.Sentence;
import fol.Language;
import fol.formula.Formula;
import fol.formula.Not;
import fol.formula.Predicate;
import fol.term.Constant;
import fol.term.Term;
import modelGeneration.Heuristics;
import modelGeneration.events.EventSemantics;
import modelGeneration.folModel.Calculus;
import modelGeneration.folModel.ModelGenerator;
import modelGeneration.folModel.Tableau;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static modelGeneration.events.EventSemantics.Predicates.agent;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SearchAgentTest {
    private final Language language = new Language();

    private List<SearchNode<Void>> drain(Iterator<SearchNode<Void>> search) {
        List<SearchNode<Void>> out = new ArrayList<>();
        search.forEachRemaining(out::add);
        return out;
    }

    private SearchAgent<Void> minEventsAgent() {
        return new SearchAgent<>(new Heuristics.MinEvents(), language, EventSemantics.getAxioms(), new Tableau(List.of()));
    }

    @Test
    public void minEventsYieldsBestFirst() {
        SearchAgent<Void> agent = minEventsAgent();
        List<SearchNode<Void>> nodes = drain(agent.search(List.of(
                new NounVerbSentence(language, "john", "ate"),
                new NounVerbSentence(language, "bob", "ate"))));
        // one model per focus after the first sentence, each extended by one model per focus
        assertThat(nodes.size(), is(12));
        for (int i = 1; i < nodes.size(); i++) {
            assertThat(nodes.get(i - 1).priority() >= nodes.get(i).priority(), is(true));
        }
        assertThat(nodes.get(0).priority(), is(-1.0));
        assertThat(nodes.get(0).sentenceDepth(), is(1));
        SearchNode<Void> last = nodes.get(nodes.size() - 1);
        assertThat(last.priority(), is(-2.0));
        assertThat(last.sentenceDepth(), is(2));
        assertThat(last.parent().parent().isRoot(), is(true));
        for (SearchNode<Void> node : nodes) {
            assertThat(Calculus.isBranchConsistent(node.tableau(), EventSemantics.getAxioms()), is(true));
        }
        assertThat(agent.getSentences().size(), is(2));
        assertThat(agent.getQueueSize(), is(0));
        assertThat(agent.getExpandedNodeCount(), is(4));
    }

    @Test
    public void tiesGoToTheOlderNode() {
        List<SearchNode<Void>> nodes = drain(minEventsAgent().search(List.of(
                new NounVerbSentence(language, "john", "ate"))));
        assertThat(nodes.size(), is(3));
        for (int i = 1; i < nodes.size(); i++) {
            assertThat(nodes.get(i - 1).sequence() < nodes.get(i).sequence(), is(true));
        }
    }

    @Test
    public void sentencesArePulledLazily() {
        SearchAgent<Void> agent = minEventsAgent();
        Iterator<SearchNode<Void>> search = agent.search(List.<Sentence>of(
                new NounVerbSentence(language, "john", "ate"),
                new NounVerbSentence(language, "bob", "ate")).iterator());
        assertThat(agent.getSentences().isEmpty(), is(true));
        SearchNode<Void> first = search.next();
        assertThat(first.sentenceDepth(), is(1));
        assertThat(agent.getSentences().size(), is(2));
        // the yielded node is only expanded on the next pull
        assertThat(agent.getQueueSize(), is(2));
        search.next();
        assertThat(agent.getQueueSize(), is(4));
    }

    @Test
    public void emptyNarrativeYieldsNothing() {
        assertThat(minEventsAgent().search(List.<Sentence>of()).hasNext(), is(false));
    }

    @Test(expected = IllegalStateException.class)
    public void agentsSearchOnce() {
        SearchAgent<Void> agent = minEventsAgent();
        agent.search(List.<Sentence>of());
        agent.search(List.<Sentence>of());
    }

    @Test
    public void backgroundKnowledgeRulesOutReadings() {
        Constant john = EventSemantics.Sorts.AGENT.makeConstant("john");
        Tableau background = new Tableau(List.of(
                language.forall(EventSemantics.Sorts.EVENT, e -> new Not(agent(e, john)))), List.of(john));
        SearchAgent<Void> agent = new SearchAgent<>(new Heuristics.BFS(),
                new ModelGenerator(language, EventSemantics.getAxioms()), background);
        assertThat(agent.search(List.of(new NounVerbSentence(language, "john", "ate"))).hasNext(), is(false));
        assertThat(agent.getExpandedNodeCount(), is(1));
    }

    @Test
    public void backgroundConjunctionsAreTakenApart() {
        Constant john = EventSemantics.Sorts.AGENT.makeConstant("john");
        Tableau background = new Tableau(List.of(Formula.and(
                language.forall(EventSemantics.Sorts.EVENT, e -> new Not(agent(e, john))), Predicate.TRUE)),
                List.of(john));
        SearchAgent<Void> agent = new SearchAgent<>(new Heuristics.BFS(),
                new ModelGenerator(language, EventSemantics.getAxioms()), background);
        assertThat(agent.search(List.of(new NounVerbSentence(language, "john", "ate"))).hasNext(), is(false));
        assertThat(agent.getExpandedNodeCount(), is(1));
    }

    @Test
    public void backgroundDoubleNegationsAreRemoved() {
        Constant john = EventSemantics.Sorts.AGENT.makeConstant("john");
        Tableau background = new Tableau(List.of(new Not(new Not(
                language.forall(EventSemantics.Sorts.EVENT, e -> new Not(agent(e, john)))))), List.of(john));
        SearchAgent<Void> agent = new SearchAgent<>(new Heuristics.BFS(),
                new ModelGenerator(language, EventSemantics.getAxioms()), background);
        assertThat(agent.search(List.of(new NounVerbSentence(language, "john", "ate"))).hasNext(), is(false));
    }

    @Test
    public void inconsistentBackgroundLeavesNothingToSearch() {
        Tableau background = new Tableau(List.of(Formula.and(Predicate.TRUE, new Not(Predicate.TRUE))));
        SearchAgent<Void> agent = new SearchAgent<>(new Heuristics.BFS(),
                new ModelGenerator(language, EventSemantics.getAxioms()), background);
        assertThat(agent.search(List.of(new NounVerbSentence(language, "john", "ate"))).hasNext(), is(false));
        assertThat(agent.getExpandedNodeCount(), is(0));
    }

    @Test
    public void sentencesMayRestrictTheirFocuses() {
        Sentence fullOnly = new Sentence() {
            private final NounVerbSentence sentence = new NounVerbSentence(language, "john", "ate");

            @Override
            public List<Reading> getFormulas(Focus focus) {
                return sentence.getFormulas(focus);
            }

            @Override
            public List<Focus> getFocuses() {
                return List.of(Focus.FULL);
            }

            @Override
            public List<Term> getEntities() {
                return sentence.getEntities();
            }
        };
        List<SearchNode<Void>> nodes = drain(minEventsAgent().search(List.of(fullOnly)));
        assertThat(nodes.size(), is(1));
    }

    @Test
    public void newSentencesDecayOlderEntities() {
        SearchAgent<Void> agent = new SearchAgent<>(new Heuristics.DFS(), new ModelGenerator(language, EventSemantics.getAxioms()));
        NounVerbSentence johnAte = new NounVerbSentence(language, "john", "ate");
        List<SearchNode<Void>> nodes = drain(agent.search(List.of(johnAte, new NounVerbSentence(language, "bob", "ate"))));
        SearchNode<Void> deepest = nodes.stream().filter(n -> n.sentenceDepth() == 2).findFirst().get();
        assertThat(deepest.tableau().getSalience(johnAte.getNoun()) < 1.0, is(true));
    }
}
