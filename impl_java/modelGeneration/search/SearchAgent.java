package modelGeneration.search;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import discourse.Focus;
import discourse.Reading;
import discourse.Sentence;
import fol.Language;
import fol.term.Term;
import modelGeneration.Heuristics.Heuristic;
import modelGeneration.axioms.Axiom;
import modelGeneration.folModel.Calculus;
import modelGeneration.folModel.ModelGenerator;
import modelGeneration.folModel.Tableau;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Best first search over discourse models. Reading a sentence extends a model with every model of every reading of
 * the sentence; the heuristic decides which model is extended next.
 */
public class SearchAgent<C> {
    private static final Logger log = LogManager.getFormatterLogger();

    private final Heuristic<C> heuristic;
    private final ModelGenerator modelGenerator;
    private final List<Sentence> sentences = new ArrayList<>();
    private final PriorityQueue<SearchNode<C>> nodes = new PriorityQueue<>(SearchNode.<C>searchOrder());
    private final SearchNode<C> root;
    private long nextSequence = 0;
    private int expandedNodes = 0;
    private boolean started = false;

    /**
     * @param background formulas every discourse model starts from. They are saturated with the generator's axioms
     *                   first; a background that closes leaves nothing to search.
     */
    public SearchAgent(Heuristic<C> heuristic, ModelGenerator modelGenerator, Tableau background) {
        this.heuristic = heuristic;
        this.modelGenerator = modelGenerator;
        List<Axiom> axioms = modelGenerator.getAxioms();
        Tableau saturated = modelGenerator.getCalculus().saturate(background, axioms);
        this.root = new SearchNode<>(0, 0, saturated, null, heuristic.emptyContext(), nextSequence++);
        if (Calculus.isBranchConsistent(saturated, axioms)) {
            nodes.add(root);
        } else {
            log.info("Background knowledge is inconsistent");
        }
    }

    public SearchAgent(Heuristic<C> heuristic, ModelGenerator modelGenerator) {
        this(heuristic, modelGenerator, new Tableau(List.of()));
    }

    public SearchAgent(Heuristic<C> heuristic, Language language, List<Axiom> axioms, Tableau background) {
        this(heuristic, new ModelGenerator(language, axioms), background);
    }

    /**
     * Read a narrative sentence by sentence. The returned iterator yields search nodes best first; a sentence is only
     * taken from {@code narrative} when the next node is requested, and a node is only expanded once the node after
     * it is requested. When the narrative runs out the remaining queue is drained.
     */
    public Iterator<SearchNode<C>> search(Iterator<? extends Sentence> narrative) {
        Preconditions.checkState(!started, "A search agent runs a single search");
        started = true;
        return new SearchIterator(narrative);
    }

    public Iterator<SearchNode<C>> search(Iterable<? extends Sentence> narrative) {
        return search(narrative.iterator());
    }

    public List<Sentence> getSentences() {
        return List.copyOf(sentences);
    }

    public int getExpandedNodeCount() {
        return expandedNodes;
    }

    public int getQueueSize() {
        return nodes.size();
    }

    private void extendModel(SearchNode<C> node) {
        if (node.sentenceDepth() == sentences.size()) return;
        expandedNodes++;
        Sentence sentence = sentences.get(node.sentenceDepth());
        Tableau tableau = node.tableau();
        tableau.decaySaliences();
        List<Term> newEntities = sentence.getEntities().stream()
                .filter(e -> !tableau.branchContainsEntity(e))
                .distinct()
                .toList();
        int before = nodes.size();
        for (Focus focus : sentence.getFocuses()) {
            for (Reading reading : sentence.getFormulas(focus)) {
                Tableau seed = new Tableau(List.of(reading.formula()), newEntities, tableau);
                Iterator<Tableau> models = modelGenerator.generateModels(seed);
                while (models.hasNext()) {
                    nodes.add(createNode(node, models.next()));
                }
            }
        }
        log.debug("Expanded %s with sentence %d into %d nodes", node, node.sentenceDepth(), nodes.size() - before);
    }

    private SearchNode<C> createNode(SearchNode<C> parent, Tableau model) {
        SearchNode<C> unscored = new SearchNode<>(0, parent.sentenceDepth() + 1, model, parent, parent.context(),
                nextSequence++);
        return unscored.withScore(heuristic.score(parent.context(), unscored));
    }

    private class SearchIterator extends AbstractIterator<SearchNode<C>> {
        private final Iterator<? extends Sentence> narrative;
        private SearchNode<C> toExpand;

        SearchIterator(Iterator<? extends Sentence> narrative) {
            this.narrative = narrative;
        }

        @Override
        protected SearchNode<C> computeNext() {
            while (true) {
                if (toExpand != null) {
                    extendModel(toExpand);
                    toExpand = null;
                }
                if (narrative.hasNext()) {
                    sentences.add(narrative.next());
                    log.debug("Read sentence %d", sentences.size());
                }
                SearchNode<C> current = nodes.poll();
                if (current == null) {
                    log.info("Search queue exhausted after %d sentences and %d expansions", sentences.size(), expandedNodes);
                    return endOfData();
                }
                toExpand = current;
                if (current != root) return current;
            }
        }
    }
}
