package fol.term;

/**
 * Marks the terms a substitution may bind: variables and witnesses.
 */
public interface Substitutable {
}
