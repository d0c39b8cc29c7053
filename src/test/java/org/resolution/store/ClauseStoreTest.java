package org.resolution.store;

import org.junit.Test;
import org.resolution.model.Clause;
import org.resolution.model.Constant;
import org.resolution.model.Literal;
import org.resolution.model.Variable;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ClauseStoreTest {

    private static final Variable X = new Variable("X");
    private static final Variable Y = new Variable("Y");
    private static final Constant SOCRATES = new Constant("socrates");

    @Test
    public void variantIsNotInsertedTwice() {
        ClauseStore store = new ClauseStore();

        assertTrue(store.insert(Clause.of(Literal.negative("man", X), Literal.positive("mortal", X))));
        assertFalse(store.insert(Clause.of(Literal.positive("mortal", Y), Literal.negative("man", Y))));

        assertEquals(1, store.size());
        assertTrue(store.contains(Clause.of(Literal.negative("man", new Variable("W")), Literal.positive("mortal", new Variable("W")))));
    }

    @Test
    public void clausesAreStoredInCanonicalForm() {
        ClauseStore store = new ClauseStore();
        store.insert(Clause.of(Literal.negative("man", Y), Literal.positive("mortal", Y)));

        assertEquals("!man(V1) | mortal(V1)", store.get(1).toString());
    }

    @Test
    public void idsFollowInsertionOrder() {
        ClauseStore store = new ClauseStore();
        Clause greek = Clause.of(Literal.positive("greek", SOCRATES));
        Clause man = Clause.of(Literal.positive("man", SOCRATES));
        store.insert(greek);
        store.insert(man);

        assertEquals(greek, store.get(1));
        assertEquals(man, store.get(2));
        assertEquals(2, store.size());
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void idsStartFromOne() {
        ClauseStore store = new ClauseStore();
        store.insert(Clause.of(Literal.positive("greek", SOCRATES)));
        store.get(0);
    }

    @Test
    public void snapshotIsNotAffectedByLaterInserts() {
        ClauseStore store = new ClauseStore();
        store.insert(Clause.of(Literal.positive("greek", SOCRATES)));

        List<Clause> snapshot = store.all();
        store.insert(Clause.of(Literal.positive("man", SOCRATES)));

        assertEquals(1, snapshot.size());
        assertEquals(2, store.size());
    }

    @Test
    public void emptyClauseIsTracked() {
        ClauseStore store = new ClauseStore();
        store.insert(Clause.of(Literal.positive("greek", SOCRATES)));
        assertFalse(store.containsEmptyClause());

        assertTrue(store.insert(Clause.EMPTY));
        assertTrue(store.containsEmptyClause());
        assertFalse(store.insert(Clause.EMPTY));
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullIsRejected() {
        new ClauseStore().insert(null);
    }
}
