package modelGeneration.folModel;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Streams;
import fol.Language;
import modelGeneration.axioms.Axiom;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Enumerates the open, fully expanded branches below a node. Branches are explored depth first in the order the
 * calculus produces them.
 */
public class ModelGenerator {
    private static final Logger log = LogManager.getFormatterLogger();

    private final Calculus calculus;
    private final List<Axiom> axioms;
    private int numExploredModels = 0;
    private int closedModels = 0;
    private int yieldedModels = 0;

    public ModelGenerator(Calculus calculus, List<Axiom> axioms) {
        this.calculus = calculus;
        this.axioms = List.copyOf(axioms);
    }

    public ModelGenerator(Language language, List<Axiom> axioms) {
        this(new Calculus(language), axioms);
    }

    public ModelGenerator(Language language) {
        this(language, List.of());
    }

    /**
     * Lazily generate the models extending {@code tableau}. Each model is a leaf node whose branch runs through
     * {@code tableau}; nothing is computed until the iterator is pulled.
     */
    public Iterator<Tableau> generateModels(Tableau tableau) {
        return new ModelIterator(tableau);
    }

    public Stream<Tableau> streamModels(Tableau tableau) {
        return Streams.stream(generateModels(tableau));
    }

    public List<Axiom> getAxioms() {
        return axioms;
    }

    public Calculus getCalculus() {
        return calculus;
    }

    public int getNumExploredModels() {
        return numExploredModels;
    }

    public int getClosedModelCount() {
        return closedModels;
    }

    public int getYieldedModelCount() {
        return yieldedModels;
    }

    private class ModelIterator extends AbstractIterator<Tableau> {
        private final Deque<Tableau> pending = new ArrayDeque<>();

        ModelIterator(Tableau tableau) {
            pending.push(tableau);
        }

        @Override
        protected Tableau computeNext() {
            while (!pending.isEmpty()) {
                Tableau current = pending.pop();
                numExploredModels++;
                Tableau saturated = calculus.saturate(current, axioms);
                if (!Calculus.isBranchConsistent(saturated)) {
                    closedModels++;
                    log.debug("Closed branch:%n%s", saturated);
                    continue;
                }
                List<Tableau> branches = calculus.tryBranchingRules(saturated);
                if (branches.isEmpty()) {
                    yieldedModels++;
                    log.debug("Model found:%n%s", saturated);
                    return saturated;
                }
                List<Tableau> open = branches.stream().filter(Calculus::isBranchConsistent).toList();
                closedModels += branches.size() - open.size();
                log.trace("%d of %d branches open, %d pending", open.size(), branches.size(), pending.size());
                for (int i = open.size() - 1; i >= 0; i--) {
                    pending.push(open.get(i));
                }
            }
            return endOfData();
        }
    }
}
