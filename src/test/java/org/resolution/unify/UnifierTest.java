package org.resolution.unify;

import org.junit.Test;
import org.resolution.model.Constant;
import org.resolution.model.Literal;
import org.resolution.model.Substitution;
import org.resolution.model.Variable;

import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class UnifierTest {

    private static final Variable X = new Variable("X");
    private static final Variable Y = new Variable("Y");
    private static final Constant A = new Constant("a");
    private static final Constant B = new Constant("b");
    private static final Constant SOCRATES = new Constant("socrates");

    private final Unifier unifier = new Unifier();

    @Test
    public void variableIsBoundToConstant() {
        Optional<Substitution> theta = unifier.matchComplementary(
                Literal.positive("man", X), Literal.negative("man", SOCRATES));

        assertTrue(theta.isPresent());
        assertEquals(SOCRATES, theta.get().apply(X));
        assertEquals(Literal.positive("man", SOCRATES), Literal.positive("man", X).apply(theta.get()));
    }

    @Test
    public void groundComplementaryLiteralsGiveEmptySubstitution() {
        Optional<Substitution> theta = unifier.matchComplementary(
                Literal.negative("mortal", SOCRATES), Literal.positive("mortal", SOCRATES));

        assertTrue(theta.isPresent());
        assertTrue(theta.get().isEmpty());
    }

    @Test
    public void samePolarityIsRejected() {
        assertFalse(unifier.matchComplementary(Literal.positive("man", X), Literal.positive("man", A)).isPresent());
    }

    @Test
    public void differentPredicateOrArityIsRejected() {
        assertFalse(unifier.matchComplementary(Literal.positive("man", X), Literal.negative("mortal", X)).isPresent());
        assertFalse(unifier.matchComplementary(Literal.positive("p", X), Literal.negative("p", A, B)).isPresent());
    }

    @Test
    public void constantClashFails() {
        assertFalse(unifier.matchComplementary(Literal.positive("p", A), Literal.negative("p", B)).isPresent());
    }

    @Test
    public void repeatedVariableMustAgree() {
        assertFalse(unifier.matchComplementary(Literal.positive("p", X, X), Literal.negative("p", A, B)).isPresent());

        Optional<Substitution> theta = unifier.matchComplementary(
                Literal.positive("p", X, X), Literal.negative("p", A, A));
        assertTrue(theta.isPresent());
        assertEquals(A, theta.get().apply(X));
    }

    @Test
    public void bindingChainsAreFollowed() {
        // X/Y poi Y/a: entrambe le variabili risolvono in a
        Optional<Substitution> theta = unifier.matchComplementary(
                Literal.positive("p", X, A), Literal.negative("p", Y, Y));

        assertTrue(theta.isPresent());
        assertEquals(A, theta.get().apply(X));
        assertEquals(A, theta.get().apply(Y));
    }

    @Test
    public void unifyTermsRespectsExistingBindings() {
        Substitution theta = Substitution.EMPTY.bind(X, A);

        assertFalse(unifier.unifyTerms(X, B, theta).isPresent());
        assertEquals(theta, unifier.unifyTerms(X, A, theta).get());
    }
}
