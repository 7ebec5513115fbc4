package fol;

import fol.formula.Formula;
import fol.formula.Forall;
import fol.formula.ForallF;
import fol.formula.Not;
import fol.formula.PartialFormula;
import fol.term.Constant;
import fol.term.Term;
import fol.term.Variable;
import fol.term.Witness;

import java.util.function.Function;

/**
 * Source of fresh names for one session. Generated names carry a reserved prefix so they never clash with
 * user-chosen constants.
 */
public class Language {
    private static final String VARIABLE_PREFIX = "_V";
    private static final String WITNESS_PREFIX = "_O";
    private static final String CONSTANT_PREFIX = "_C";

    private int variableCount = 0;
    private int witnessCount = 0;
    private int constantCount = 0;

    public static boolean isReservedName(String name) {
        return name == null || name.isEmpty() || name.startsWith("_") || name.startsWith("$");
    }

    /**
     * Names handed out by {@link #freshConstant}. The only reserved names a constant may carry.
     */
    public static boolean isGeneratedConstantName(String name) {
        return name != null && name.matches(CONSTANT_PREFIX + "\\d+");
    }

    public static boolean isWitnessName(String name) {
        return name != null && name.matches(WITNESS_PREFIX + "\\d+");
    }

    public Variable freshVariable(Sort sort) {
        return new Variable(sort, VARIABLE_PREFIX + variableCount++);
    }

    public Witness freshWitness(Sort sort) {
        return new Witness(sort, WITNESS_PREFIX + witnessCount++);
    }

    public Constant freshConstant(Sort sort) {
        return new Constant(sort, CONSTANT_PREFIX + constantCount++);
    }

    public PartialFormula partial(Sort sort, Function<Term, Formula> body) {
        Variable var = freshVariable(sort);
        return new PartialFormula(var, body.apply(var));
    }

    public Forall forall(Sort sort, Function<Term, Formula> body) {
        return new Forall(partial(sort, body));
    }

    /**
     * {@code E_x.body}, written as {@code -A_x.-body}.
     */
    public Not exists(Sort sort, Function<Term, Formula> body) {
        return new Not(forall(sort, x -> new Not(body.apply(x))));
    }

    public ForallF forallF(Sort sort, Function<Term, Formula> guard, Function<Term, Formula> focused) {
        Variable var = freshVariable(sort);
        return new ForallF(new PartialFormula(var, guard.apply(var)), new PartialFormula(var, focused.apply(var)));
    }

    /**
     * Focused existential: some entity satisfying the guard also satisfies the focused body.
     */
    public Not existsF(Sort sort, Function<Term, Formula> guard, Function<Term, Formula> focused) {
        return new Not(forallF(sort, guard, x -> new Not(focused.apply(x))));
    }
}
