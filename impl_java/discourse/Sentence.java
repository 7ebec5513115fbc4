package discourse;

import fol.term.Term;

import java.util.List;

/**
 * A sentence already translated to logic.
 */
public interface Sentence {

    /**
     * Readings of the sentence under a focus. Sentences may offer several readings per focus, or none.
     */
    List<Reading> getFormulas(Focus focus);

    default List<Focus> getFocuses() {
        return List.of(Focus.values());
    }

    /**
     * Named entities the sentence mentions.
     */
    List<Term> getEntities();
}
