package org.resolution.resolve;

import org.resolution.model.Clause;
import org.resolution.model.Literal;
import org.resolution.model.Substitution;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * RISOLUTORE - Calcola il risolvente di due clausole su una coppia complementare
 *
 * REGOLA DI RISOLUZIONE:
 *   (A | L1)  e  (B | L2)  con  L1σ = ¬L2σ   genera   (A | B)σ
 *
 * PROCESSO:
 * 1. Verifica delle precondizioni (clausole distinte, letterali presenti e complementari)
 * 2. Rimozione di un'occorrenza del letterale scelto da ciascun lato
 * 3. Applicazione della sostituzione ai letterali rimanenti
 * 4. Unione dei resti con eliminazione dei duplicati
 *
 * Il risultato vuoto è il segnale di successo della refutazione.
 *
 * È compito dell'unificatore filtrare le coppie non complementari: se il
 * risolutore le riceve comunque si tratta di un errore del chiamante.
 */
public class Resolver {

    private static final Logger LOGGER = Logger.getLogger(Resolver.class.getName());

    /**
     * Costruisce il risolvente.
     *
     * @param first prima clausola (già separata dalla seconda)
     * @param second seconda clausola
     * @param firstLiteral letterale di {@code first} su cui risolvere
     * @param secondLiteral letterale di {@code second} complementare al primo
     * @param substitution unificatore dei due letterali
     * @return risolvente, eventualmente {@link Clause#EMPTY}
     * @throws IllegalArgumentException se le precondizioni non sono rispettate
     */
    public Clause resolve(Clause first, Clause second, Literal firstLiteral, Literal secondLiteral,
                          Substitution substitution) {
        validatePreconditions(first, second, firstLiteral, secondLiteral, substitution);

        List<Literal> union = new ArrayList<>(first.size() + second.size() - 2);
        for (Literal literal : first.without(firstLiteral).getLiterals()) {
            union.add(literal.apply(substitution));
        }
        for (Literal literal : second.without(secondLiteral).getLiterals()) {
            union.add(literal.apply(substitution));
        }

        // Clause.of elimina i duplicati creati dalla sostituzione
        Clause resolvent = Clause.of(union);
        LOGGER.finest(() -> "Risolvente di (" + first + ") e (" + second + ") su " + firstLiteral + ": " + resolvent);
        return resolvent;
    }

    private void validatePreconditions(Clause first, Clause second, Literal firstLiteral, Literal secondLiteral,
                                       Substitution substitution) {
        if (first == null || second == null || firstLiteral == null || secondLiteral == null || substitution == null) {
            throw new IllegalArgumentException("Argomenti null per la risoluzione");
        }
        if (first == second) {
            throw new IllegalArgumentException("Risoluzione di una clausola con sé stessa: " + first);
        }
        if (!first.contains(firstLiteral)) {
            throw new IllegalArgumentException("Letterale " + firstLiteral + " assente da (" + first + ")");
        }
        if (!second.contains(secondLiteral)) {
            throw new IllegalArgumentException("Letterale " + secondLiteral + " assente da (" + second + ")");
        }
        if (!firstLiteral.hasComplementaryShape(secondLiteral)
                || !firstLiteral.apply(substitution).negate().equals(secondLiteral.apply(substitution))) {
            throw new IllegalArgumentException("Letterali non complementari sotto " + substitution + ": "
                    + firstLiteral + ", " + secondLiteral);
        }
    }
}
