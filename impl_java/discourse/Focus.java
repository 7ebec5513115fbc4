package discourse;

/**
 * Which part of a sentence is presented as new information. The rest is the guard, expected to be known already.
 */
public enum Focus {
    FULL,
    NOUN,
    VERB
}
