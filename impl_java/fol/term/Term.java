package fol.term;

import fol.Sort;
import fol.Substitution;

import java.util.Set;

public sealed interface Term permits Constant, Witness, Variable {
    Term applySub(Substitution substitution);
    Set<Variable> vars();

    Sort sort();

    String name();
}
