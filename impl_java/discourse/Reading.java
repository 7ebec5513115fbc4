package discourse;

import fol.formula.Formula;

/**
 * One logical reading of a sentence, with a gloss for humans.
 */
public record Reading(Formula formula, String gloss) {
    @Override
    public String toString() {
        return gloss + ": " + formula;
    }
}
