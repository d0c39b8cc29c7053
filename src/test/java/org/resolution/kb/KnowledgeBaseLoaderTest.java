package org.resolution.kb;

import org.junit.Test;
import org.resolution.model.Clause;
import org.resolution.model.Constant;
import org.resolution.model.Literal;
import org.resolution.model.MalformedClauseException;
import org.resolution.model.Variable;
import org.resolution.saturation.ResolutionResult;
import org.resolution.saturation.SaturationLoop;
import org.resolution.saturation.Verdict;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class KnowledgeBaseLoaderTest {

    private static final Constant SOCRATES = new Constant("socrates");

    private static Path fixture(String name) throws URISyntaxException {
        return Paths.get(KnowledgeBaseLoaderTest.class.getResource("/kb/" + name).toURI());
    }

    @Test
    public void builtInKnowledgeBaseContainsNegatedGoal() throws Exception {
        KnowledgeBase kb = KnowledgeBaseLoader.builtIn();

        assertEquals(6, kb.size());
        assertEquals(1, kb.goalClauses().size());
        assertEquals(Clause.of(Literal.negative("mortal", SOCRATES)), kb.goalClauses().get(0));
        assertTrue(kb.clauses().contains(kb.goalClauses().get(0)));
        assertEquals(Integer.valueOf(1), kb.signature().arityOf("thinker"));
    }

    @Test
    public void builtInKnowledgeBaseIsProved() throws Exception {
        ResolutionResult result = new SaturationLoop(KnowledgeBaseLoader.builtIn().clauses()).run();

        assertEquals(Verdict.PROVED, result.getVerdict());
    }

    @Test
    public void separatorsAndNegationSymbolsAreEquivalent() {
        KnowledgeBase kb = KnowledgeBaseLoader.fromString(
                "{ !man(X), mortal(X) }\n{ ~man(Y) | mortal(Y) }.\n{ ¬man(Z), mortal(Z) }", "sintassi");

        Variable x = new Variable("X");
        assertEquals(3, kb.size());
        assertEquals(Clause.of(Literal.negative("man", x), Literal.positive("mortal", x)), kb.clauses().get(0));
        assertTrue(kb.clauses().get(1).get(0).isNegative());
        assertTrue(kb.clauses().get(2).get(0).isNegative());
    }

    @Test
    public void commentsAndEmptyClauseAreRead() {
        KnowledgeBase kb = KnowledgeBaseLoader.fromString("% solo la clausola vuota\n{ }\n", "vuota");

        assertEquals(1, kb.size());
        assertTrue(kb.clauses().get(0).isEmpty());
    }

    @Test
    public void conjunctiveGoalBecomesOneNegatedClause() {
        KnowledgeBase kb = KnowledgeBaseLoader.fromString("goal man(socrates), greek(socrates).", "goal");

        assertEquals(Clause.of(Literal.negative("man", SOCRATES), Literal.negative("greek", SOCRATES)),
                kb.goalClauses().get(0));
    }

    @Test
    public void anonymousVariablesAreDistinct() {
        Clause clause = KnowledgeBaseLoader.fromString("{ p(_, _) }", "anonime").clauses().get(0);

        assertEquals(2, clause.getVariables().size());
        Literal literal = clause.get(0);
        assertNotEquals(literal.getArguments().get(0), literal.getArguments().get(1));
    }

    @Test
    public void anonymousVariableDoesNotCaptureUserVariable() {
        KnowledgeBase kb = KnowledgeBaseLoader.fromString("{ q(_, _G1) }\ngoal q(a, b).", "anonime_utente");

        assertEquals(2, kb.clauses().get(0).getVariables().size());
        assertEquals(Verdict.PROVED, new SaturationLoop(kb.clauses()).run().getVerdict());
    }

    @Test
    public void keywordsCanNamePredicatesAndConstants() {
        KnowledgeBase kb = KnowledgeBaseLoader.fromString(
                "predicate goal/1.\n{ goal(predicate) }\ngoal goal(predicate).", "parole_chiave");

        assertEquals(Clause.of(Literal.positive("goal", new Constant("predicate"))), kb.clauses().get(0));
        assertEquals(Integer.valueOf(1), kb.signature().arityOf("goal"));
        assertEquals(Verdict.PROVED, new SaturationLoop(kb.clauses()).run().getVerdict());
    }

    @Test
    public void numbersAreConstants() {
        Literal literal = KnowledgeBaseLoader.fromString("{ age(bob, 42) }", "numeri").clauses().get(0).get(0);

        assertFalse(literal.getArguments().get(1).isVariable());
        assertEquals("42", literal.getArguments().get(1).getName());
    }

    @Test
    public void arityMismatchStopsLoading() throws Exception {
        try {
            KnowledgeBaseLoader.fromFile(fixture("bad_arity.kb"));
            fail("Clausola malformata accettata");
        } catch (MalformedClauseException e) {
            assertEquals("man", e.getPredicate());
            assertEquals(1, e.getExpectedArity());
            assertEquals(2, e.getFoundArity());
        }
    }

    @Test(expected = MalformedClauseException.class)
    public void arityInferredFromFirstOccurrence() {
        KnowledgeBaseLoader.fromString("{ p(a) }\n{ p(a, b) }", "inferita");
    }

    @Test(expected = MalformedClauseException.class)
    public void conflictingDeclarationIsRejected() {
        KnowledgeBaseLoader.fromString("predicate p/1.\npredicate p/2.", "dichiarazioni");
    }

    @Test
    public void syntaxErrorReportsLine() {
        try {
            KnowledgeBaseLoader.fromString("{ man(socrates) }\n{ Man(socrates) }", "errata");
            fail("Errore di sintassi non rilevato");
        } catch (MalformedClauseException e) {
            fail("Errore di sintassi scambiato per arità: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("errata"));
            assertTrue(e.getMessage().contains("riga 2"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownCharacterIsRejected() {
        KnowledgeBaseLoader.fromString("{ man(X#1) }", "carattere");
    }

    @Test
    public void familyGoalIsProved() throws Exception {
        KnowledgeBase kb = KnowledgeBaseLoader.fromFile(fixture("family.kb"));

        assertEquals("family.kb", kb.name());
        assertEquals(Verdict.PROVED, new SaturationLoop(kb.clauses()).run().getVerdict());
    }

    @Test
    public void unrelatedGoalIsNotProved() throws Exception {
        KnowledgeBase kb = KnowledgeBaseLoader.fromFile(fixture("unprovable.kb"));

        assertEquals(Verdict.NOT_PROVED, new SaturationLoop(kb.clauses()).run().getVerdict());
    }
}
