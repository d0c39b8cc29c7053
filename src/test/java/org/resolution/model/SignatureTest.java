package org.resolution.model;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

public class SignatureTest {

    private static final Variable X = new Variable("X");

    @Test
    public void firstOccurrenceFixesArity() {
        Signature signature = new Signature();
        assertNull(signature.arityOf("parent"));

        signature.validate(Clause.of(Literal.positive("parent", X, new Constant("tom"))));

        assertEquals(Integer.valueOf(2), signature.arityOf("parent"));
        assertEquals("parent/2", signature.toString());
    }

    @Test
    public void arityMismatchIsMalformed() {
        Signature signature = new Signature();
        signature.declare("man", 1);

        try {
            signature.validate(Clause.of(Literal.positive("man", X, X)));
            fail("Arità discordante accettata");
        } catch (MalformedClauseException e) {
            assertEquals("man", e.getPredicate());
            assertEquals(1, e.getExpectedArity());
            assertEquals(2, e.getFoundArity());
        }
    }

    @Test
    public void repeatedDeclarationWithSameArityIsAccepted() {
        Signature signature = new Signature();
        signature.declare("man", 1);
        signature.declare("man", 1);

        assertEquals(Integer.valueOf(1), signature.arityOf("man"));
        assertEquals("man/1", signature.toString());
    }

    @Test(expected = MalformedClauseException.class)
    public void conflictingDeclarationIsMalformed() {
        Signature signature = new Signature();
        signature.declare("man", 1);
        signature.declare("man", 2);
    }
}
