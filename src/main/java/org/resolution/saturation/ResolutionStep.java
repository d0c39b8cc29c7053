package org.resolution.saturation;

import org.resolution.model.Clause;
import org.resolution.model.Substitution;

/**
 * Passo di risoluzione riuscito: due clausole dell'insieme e il risolvente nuovo
 * che hanno prodotto. Gli identificatori sono quelli assegnati dal ClauseStore.
 *
 * @param round giro di saturazione in cui il passo è avvenuto
 * @param firstId identificatore della prima clausola
 * @param first prima clausola (forma canonica)
 * @param secondId identificatore della seconda clausola
 * @param second seconda clausola (forma canonica)
 * @param resolventId identificatore assegnato al risolvente
 * @param resolvent risolvente (forma canonica)
 * @param unifier sostituzione usata, sulle variabili separate
 */
public record ResolutionStep(int round, int firstId, Clause first, int secondId, Clause second,
                             int resolventId, Clause resolvent, Substitution unifier) {

    public boolean derivesEmptyClause() {
        return resolvent.isEmpty();
    }

    /**
     * Riga di traccia: [i] C1 e [j] C2 genera [k] C3
     */
    public String toTraceLine() {
        String produced = derivesEmptyClause() ? "[] (clausola vuota derivata)" : resolvent.toString();
        return String.format("[%d] %s  e  [%d] %s  genera  [%d] %s",
                firstId, first, secondId, second, resolventId, produced);
    }
}
