package modelGeneration;


/**
 * An object paired with how present it is in the reader's mind, between 0 and {@link #FULL}.
 */
public record Salient<T>(T obj, Double salience) implements Comparable<Salient<T>> {

    /** Salience of an entity just mentioned or recalled. */
    public static final double FULL = 1.0;
    /** Salience of a witness freshly introduced by exists elimination. */
    public static final double WITNESS_DEFAULT = 0.4;
    /** Factor applied to every salience each time the discourse moves to the next sentence. */
    public static final double DECAY_RATE = 0.7;

    @Override
    public int compareTo(Salient<T> tSalient) {
        return salience.compareTo(tSalient.salience);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Salient<?> s && s.obj.equals(obj);
    }

    @Override
    public int hashCode() {
        return obj.hashCode();
    }

    @Override
    public String toString() {
        return "%s (%.3f)".formatted(obj, salience);
    }
}
