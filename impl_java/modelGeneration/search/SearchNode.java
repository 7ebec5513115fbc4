package modelGeneration.search;

import modelGeneration.Heuristics.Score;
import modelGeneration.folModel.Tableau;

import java.util.Comparator;

/**
 * A discourse model reached after reading {@code sentenceDepth} sentences.
 *
 * @param sequence insertion number, breaks priority ties in favour of older nodes
 */
public record SearchNode<C>(double priority, int sentenceDepth, Tableau tableau, SearchNode<C> parent, C context,
                            long sequence) {

    public static <C> Comparator<SearchNode<C>> searchOrder() {
        return Comparator.<SearchNode<C>>comparingDouble(SearchNode::priority).reversed()
                .thenComparingLong(SearchNode::sequence);
    }

    public SearchNode<C> withScore(Score<C> score) {
        return new SearchNode<>(score.priority(), sentenceDepth, tableau, parent, score.context(), sequence);
    }

    public boolean isRoot() {
        return parent == null;
    }

    @Override
    public String toString() {
        return "SearchNode #%d (priority %.3f, depth %d)".formatted(sequence, priority, sentenceDepth);
    }
}
