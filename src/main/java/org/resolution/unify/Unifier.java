package org.resolution.unify;

import org.resolution.model.Literal;
import org.resolution.model.Substitution;
import org.resolution.model.Term;
import org.resolution.model.Variable;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * UNIFICATORE - Decide se due letterali sono complementari sotto una sostituzione
 *
 * Il vocabolario non ha simboli di funzione: gli argomenti sono solo costanti o
 * variabili, quindi l'occurs-check non serve e nessuna sostituzione ciclica può
 * nascere.
 *
 * REGOLE (posizione per posizione, dopo aver risolto i legami già presenti):
 * • termini identici: nessun nuovo legame
 * • variabile libera contro qualsiasi termine: si lega la variabile
 * • costante contro costante diversa: fallimento
 *
 * PRECONDIZIONE:
 * le clausole che contengono i due letterali devono essere già separate
 * (variabili disgiunte, vedi {@link VariableRenamer#standardizeApart}).
 *
 * Il fallimento è un esito normale della ricerca ed è restituito come
 * {@link Optional#empty()}.
 */
public class Unifier {

    private static final Logger LOGGER = Logger.getLogger(Unifier.class.getName());

    /**
     * Cerca la sostituzione che rende complementari i due letterali.
     *
     * @param first primo letterale
     * @param second secondo letterale
     * @return sostituzione più generale, oppure vuoto se non complementari
     */
    public Optional<Substitution> matchComplementary(Literal first, Literal second) {
        if (!first.hasComplementaryShape(second)) {
            return Optional.empty();
        }

        Optional<Substitution> result = unifyArguments(first.getArguments(), second.getArguments(), Substitution.EMPTY);

        if (result.isPresent()) {
            LOGGER.finest(() -> "Complementari: " + first + " ~ " + second + " con " + result.get());
        }
        return result;
    }

    /**
     * Unifica due liste di argomenti di pari lunghezza partendo da una sostituzione data.
     */
    public Optional<Substitution> unifyArguments(List<Term> left, List<Term> right, Substitution initial) {
        if (left.size() != right.size()) {
            return Optional.empty();
        }

        Substitution current = initial;
        for (int i = 0; i < left.size(); i++) {
            Optional<Substitution> next = unifyTerms(left.get(i), right.get(i), current);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    /**
     * Unifica due termini rispettando i legami già presenti in {@code theta}.
     */
    public Optional<Substitution> unifyTerms(Term left, Term right, Substitution theta) {
        Term l = theta.apply(left);
        Term r = theta.apply(right);

        if (l.equals(r)) {
            return Optional.of(theta);
        } else if (l.isVariable()) {
            return Optional.of(theta.bind((Variable) l, r));
        } else if (r.isVariable()) {
            return Optional.of(theta.bind((Variable) r, l));
        }
        // due costanti diverse
        return Optional.empty();
    }
}
