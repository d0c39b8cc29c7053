package org.resolution.saturation;

import org.junit.Test;
import org.resolution.model.Clause;
import org.resolution.model.Constant;
import org.resolution.model.Literal;
import org.resolution.model.Variable;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SaturationLoopTest {

    private static final Variable X = new Variable("X");
    private static final Constant SOCRATES = new Constant("socrates");

    /**
     * Sillogismo di Socrate senza il goal negato.
     */
    private static List<Clause> greekPhilosopher() {
        List<Clause> clauses = new ArrayList<>();
        clauses.add(Clause.of(Literal.negative("man", X), Literal.positive("mortal", X)));
        clauses.add(Clause.of(Literal.negative("greek", X), Literal.positive("man", X)));
        clauses.add(Clause.of(Literal.negative("philosopher", X), Literal.positive("thinker", X)));
        clauses.add(Clause.of(Literal.positive("greek", SOCRATES)));
        clauses.add(Clause.of(Literal.positive("philosopher", SOCRATES)));
        return clauses;
    }

    private static List<Clause> greekPhilosopherWithGoal() {
        List<Clause> clauses = greekPhilosopher();
        clauses.add(Clause.of(Literal.negative("mortal", SOCRATES)));
        return clauses;
    }

    @Test
    public void socratesIsProvedMortal() {
        SaturationLoop loop = new SaturationLoop(greekPhilosopherWithGoal());
        ResolutionResult result = loop.run();

        assertEquals(SearchState.PROVED_EMPTY, result.getState());
        assertEquals(Verdict.PROVED, result.getVerdict());
        assertTrue(result.isProved());
        assertTrue(loop.getStore().containsEmptyClause());
        assertEquals("Esito: proved", result.toString());

        List<ResolutionStep> trace = result.getTrace();
        assertTrue(trace.get(trace.size() - 1).derivesEmptyClause());
    }

    @Test
    public void proofEndsWithEmptyClauseAndOnlyUsesNeededSteps() {
        ResolutionResult result = new SaturationLoop(greekPhilosopherWithGoal()).run();

        List<ResolutionStep> proof = result.getProof();
        assertFalse(proof.isEmpty());
        assertTrue(proof.get(proof.size() - 1).derivesEmptyClause());
        assertTrue(proof.size() <= result.getTrace().size());
        for (ResolutionStep step : proof) {
            assertFalse(step.resolvent().toString().contains("thinker"));
            assertFalse(step.first().toString().contains("philosopher"));
            assertFalse(step.second().toString().contains("philosopher"));
        }
        assertTrue(result.formatProof().trim().endsWith("genera []"));
        assertEquals(proof.size(), result.getStatistics().getProofSize());
    }

    @Test
    public void firstStepResolvesTheFirstTwoRules() {
        ResolutionResult result = new SaturationLoop(greekPhilosopherWithGoal()).run();

        assertEquals("[1] !man(V1) | mortal(V1)  e  [2] !greek(V1) | man(V1)  genera  [7] mortal(V1) | !greek(V1)",
                result.getTrace().get(0).toTraceLine());
    }

    @Test
    public void withoutGoalTheSetSaturates() {
        SaturationLoop loop = new SaturationLoop(greekPhilosopher());
        ResolutionResult result = loop.run();

        assertEquals(SearchState.SATURATED_NO_PROOF, result.getState());
        assertEquals("Esito: not-proved", result.toString());
        assertFalse(loop.getStore().containsEmptyClause());
        assertTrue(result.getProof().isEmpty());
        assertTrue(result.getFinalClauses().contains(Clause.of(Literal.positive("mortal", SOCRATES))));
        assertTrue(result.getFinalClauses().contains(Clause.of(Literal.positive("thinker", SOCRATES))));
        assertEquals(result.getStatistics().getFinalStoreSize(), result.getFinalClauses().size());
    }

    @Test
    public void clausesWithoutComplementaryLiteralsAddNothing() {
        List<Clause> seeds = List.of(
                Clause.of(Literal.positive("p", new Constant("a"))),
                Clause.of(Literal.positive("q", new Constant("b"))));

        SaturationLoop loop = new SaturationLoop(seeds);
        ResolutionResult result = loop.run();

        assertEquals(Verdict.NOT_PROVED, result.getVerdict());
        assertTrue(result.getTrace().isEmpty());
        assertEquals(2, loop.getStore().size());
        assertEquals(1, result.getStatistics().getRounds());
        assertEquals(1, result.getStatistics().getClausePairs());
        assertEquals(1, result.getStatistics().getLiteralPairs());
        assertEquals(0, result.getStatistics().getUnifications());
        assertEquals(0, result.getStatistics().getResolvents());
    }

    @Test
    public void emptySeedIsProvedImmediately() {
        List<Clause> seeds = List.of(Clause.of(Literal.positive("p", new Constant("a"))), Clause.EMPTY);

        ResolutionResult result = new SaturationLoop(seeds).run();

        assertTrue(result.isProved());
        assertTrue(result.getTrace().isEmpty());
        assertEquals(0, result.getStatistics().getRounds());
        assertTrue(result.formatProof().contains("clausole iniziali"));
    }

    @Test
    public void alphaEquivalentSeedsAreMerged() {
        List<Clause> seeds = List.of(
                Clause.of(Literal.negative("man", X), Literal.positive("mortal", X)),
                Clause.of(Literal.positive("mortal", new Variable("Y")), Literal.negative("man", new Variable("Y"))));

        ResolutionResult result = new SaturationLoop(seeds).run();

        assertEquals(1, result.getSeeds().size());
        assertEquals(1, result.getStatistics().getSeedClauses());
    }

    @Test
    public void listenerSeesEveryStep() {
        List<ResolutionStep> observed = new ArrayList<>();
        SaturationLoop loop = new SaturationLoop(greekPhilosopherWithGoal());
        loop.setStepListener(observed::add);

        ResolutionResult result = loop.run();

        assertEquals(result.getTrace(), observed);
        assertEquals(observed.size(), result.getStatistics().getInsertedClauses());
    }

    @Test
    public void resolventIdsAreStoreIds() {
        SaturationLoop loop = new SaturationLoop(greekPhilosopherWithGoal());
        ResolutionResult result = loop.run();

        for (ResolutionStep step : result.getTrace()) {
            assertEquals(step.resolvent(), loop.getStore().get(step.resolventId()));
            assertEquals(step.first(), loop.getStore().get(step.firstId()));
            assertEquals(step.second(), loop.getStore().get(step.secondId()));
            assertTrue(step.firstId() < step.secondId());
            assertTrue(step.secondId() < step.resolventId());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void loopRunsOnlyOnce() {
        SaturationLoop loop = new SaturationLoop(greekPhilosopher());
        loop.run();
        loop.run();
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullSeedsAreRejected() {
        new SaturationLoop(null);
    }
}
