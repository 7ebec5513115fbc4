package fol;

import com.google.common.base.Preconditions;
import fol.term.Constant;

/**
 * Type tag of a term. Predicate argument positions and quantifiers are checked against it.
 */
public record Sort(String name) {

    public Sort {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "A sort needs a name");
    }

    /**
     * Create a named constant of this sort. Names starting with '_' or '$' are reserved for
     * generated terms.
     */
    public Constant makeConstant(String name) {
        Preconditions.checkArgument(!Language.isReservedName(name), "Reserved constant name: %s", name);
        return new Constant(this, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
