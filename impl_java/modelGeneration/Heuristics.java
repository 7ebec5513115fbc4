package modelGeneration;

import fol.term.Term;
import modelGeneration.events.EventSemantics;
import modelGeneration.folModel.Tableau;
import modelGeneration.search.SearchNode;

import java.util.Map;

public class Heuristics {

    /**
     * Priority of a search node and the context its children are scored with.
     */
    public record Score<C>(C context, double priority) {}

    /**
     * Scores search nodes. Higher priorities are expanded first.
     *
     * @param <C> context threaded from a node to its children, opaque to the search
     */
    public interface Heuristic<C> {
        Score<C> score(C previousContext, SearchNode<C> node);

        C emptyContext();

        String getName();
    }

    /**
     * Prefer models that explain the discourse with fewer events.
     */
    public static class MinEvents implements Heuristic<Void> {
        @Override
        public Score<Void> score(Void previousContext, SearchNode<Void> node) {
            return new Score<>(null, -countEvents(node.tableau()));
        }

        @Override
        public Void emptyContext() {
            return null;
        }

        @Override
        public String getName() {
            return "MinEvents";
        }
    }

    /**
     * Prefer models whose entities are on average more salient.
     */
    public static class AverageSalience implements Heuristic<Void> {
        @Override
        public Score<Void> score(Void previousContext, SearchNode<Void> node) {
            Map<Term, Double> saliences = node.tableau().getSaliences();
            double total = saliences.values().stream().mapToDouble(Double::doubleValue).sum();
            return new Score<>(null, total / Math.max(1, saliences.size()));
        }

        @Override
        public Void emptyContext() {
            return null;
        }

        @Override
        public String getName() {
            return "Average salience";
        }
    }

    public static class BFS implements Heuristic<Void> {
        private long counter = 0;

        @Override
        public Score<Void> score(Void previousContext, SearchNode<Void> node) {
            return new Score<>(null, -(counter++));
        }

        @Override
        public Void emptyContext() {
            return null;
        }

        @Override
        public String getName() {
            return "BFS";
        }
    }

    public static class DFS implements Heuristic<Void> {
        private long counter = 0;

        @Override
        public Score<Void> score(Void previousContext, SearchNode<Void> node) {
            return new Score<>(null, counter++);
        }

        @Override
        public Void emptyContext() {
            return null;
        }

        @Override
        public String getName() {
            return "DFS";
        }
    }

    /** Number of events the branch of a model mentions. */
    public static int countEvents(Tableau tableau) {
        return EventSemantics.getBranchEventInformation(tableau).size();
    }
}
