package fol;

import com.google.common.collect.ImmutableList;
import fol.formula.Equals;
import fol.term.Constant;
import fol.term.Term;
import fol.term.Variable;
import fol.term.Witness;
import org.junit.Test;

import java.util.List;
import java.util.Optional;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SubstitutionTest {
    private static final Sort PERSON = new Sort("person");
    private static final Sort PLACE = new Sort("place");
    private final Constant john = PERSON.makeConstant("john");
    private final Constant bob = PERSON.makeConstant("bob");
    private final Witness w0 = new Witness(PERSON, "_O0");
    private final Witness w1 = new Witness(PERSON, "_O1");
    private final Variable x = new Variable(PERSON, "x");

    @Test
    public void identicalTermsUnifyWithoutBindings() {
        Optional<Substitution> unifier = Unifier.unify(john, john);
        assertThat(unifier, isPresent());
        assertThat(unifier.get().isEmpty(), is(true));
    }

    @Test
    public void variablesAndWitnessesBind() {
        assertThat(Unifier.unify(x, john).get().apply(x), is((Term) john));
        assertThat(Unifier.unify(john, w0).get().apply(w0), is((Term) john));
        // variables bind before witnesses
        assertThat(Unifier.unify(w0, x).get().apply(x), is((Term) w0));
    }

    @Test
    public void distinctConstantsDoNotUnify() {
        assertThat(Unifier.unify(john, bob), isEmpty());
    }

    @Test
    public void differentSortsDoNotUnify() {
        assertThat(Unifier.unify(w0, PLACE.makeConstant("paris")), isEmpty());
    }

    @Test
    public void putRedirectsExistingBindings() {
        Substitution substitution = Substitution.of(w0, w1);
        substitution.put(w1, john);
        assertThat(substitution.apply(w0), is((Term) john));
        assertThat(substitution.apply(w1), is((Term) john));
    }

    @Test(expected = IllegalArgumentException.class)
    public void constantsCannotBeBound() {
        new Substitution().put(john, bob);
    }

    @Test
    public void mergeAgreeingSubstitutions() {
        Optional<Substitution> merged = Substitution.merge(Substitution.of(w0, john), Substitution.of(w0, john),
                Substitution.of(w1, bob));
        assertThat(merged, isPresent());
        assertThat(merged.get().apply(w0), is((Term) john));
        assertThat(merged.get().apply(w1), is((Term) bob));
    }

    @Test
    public void mergeFollowsChains() {
        Optional<Substitution> merged = Substitution.merge(Substitution.of(w0, w1), Substitution.of(w1, john));
        assertThat(merged, isPresent());
        assertThat(merged.get().apply(w0), is((Term) john));
    }

    @Test
    public void mergeConflictingSubstitutionsFails() {
        assertThat(Substitution.merge(Substitution.of(w0, john), Substitution.of(w0, bob)), isEmpty());
        assertThat(Substitution.merge(List.of(Substitution.of(w0, w1), Substitution.of(w0, john),
                Substitution.of(w1, bob))), isEmpty());
    }

    @Test
    public void mergeNothing() {
        assertThat(Substitution.merge(List.of()).get().isEmpty(), is(true));
    }

    @Test
    public void mostGeneralUnifier() {
        Optional<Substitution> mgu = Substitution.mostGeneralUnifier(ImmutableList.of(new Equals(w0, w1),
                new Equals(w1, john)));
        assertThat(mgu, isPresent());
        assertThat(mgu.get().apply(w0), is((Term) john));
        assertThat(Substitution.mostGeneralUnifier(ImmutableList.of(new Equals(w0, john), new Equals(w0, bob))),
                isEmpty());
    }
}
