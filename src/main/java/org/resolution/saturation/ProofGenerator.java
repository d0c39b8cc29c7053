package org.resolution.saturation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * GENERATORE DI PROVE - Estrae la refutazione dalla traccia di saturazione
 *
 * La traccia contiene ogni risolvente nuovo, anche quelli inutili per la
 * dimostrazione. Partendo dal passo che deriva la clausola vuota, il generatore
 * risale ai genitori di ogni risolvente e conserva solo i passi da cui la
 * clausola vuota dipende, in ordine di derivazione.
 *
 * FORMATO OUTPUT:
 * (clausola1) e (clausola2) genera (clausola_3)
 * ...
 * (clausolaN) e (clausolaM) genera []
 */
public class ProofGenerator {

    private static final Logger LOGGER = Logger.getLogger(ProofGenerator.class.getName());

    private final Map<Integer, ResolutionStep> stepsByResolvent = new HashMap<>();

    private ResolutionStep emptyClauseStep;

    /**
     * Registra un passo della traccia.
     */
    public void recordStep(ResolutionStep step) {
        if (step == null) {
            throw new IllegalArgumentException("Passo di risoluzione null");
        }
        stepsByResolvent.put(step.resolventId(), step);
        if (step.derivesEmptyClause()) {
            emptyClauseStep = step;
            LOGGER.info("*** CLAUSOLA VUOTA [] DERIVATA - REFUTAZIONE COMPLETATA ***");
        }
    }

    /**
     * Passi necessari alla derivazione della clausola vuota.
     *
     * @return passi in ordine di derivazione (lista vuota se non dimostrato)
     */
    public List<ResolutionStep> extractProof() {
        if (emptyClauseStep == null) {
            return List.of();
        }

        Set<Integer> visited = new HashSet<>();
        List<ResolutionStep> needed = new ArrayList<>();
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(emptyClauseStep.resolventId());

        while (!pending.isEmpty()) {
            int id = pending.pop();
            ResolutionStep step = stepsByResolvent.get(id);
            // clausole iniziali: nessun passo
            if (step == null || !visited.add(id)) continue;

            needed.add(step);
            pending.push(step.firstId());
            pending.push(step.secondId());
        }

        needed.sort(Comparator.comparingInt(ResolutionStep::resolventId));
        LOGGER.fine("Prova estratta: " + needed.size() + " passi su " + stepsByResolvent.size() + " registrati");
        return needed;
    }

    /**
     * Prova in formato testuale, una riga per passo.
     *
     * @param proof passi estratti da {@link #extractProof()}
     * @throws IllegalStateException se l'ultimo passo non deriva la clausola vuota
     */
    static String formatProof(List<ResolutionStep> proof) {
        if (proof.isEmpty() || !proof.get(proof.size() - 1).derivesEmptyClause()) {
            throw new IllegalStateException("Impossibile generare prova: clausola vuota non derivata");
        }

        StringBuilder text = new StringBuilder();
        for (ResolutionStep step : proof) {
            text.append(formatStep(step)).append("\n");
        }
        return text.toString();
    }

    static String formatStep(ResolutionStep step) {
        return String.format("(%s) e (%s) genera %s",
                step.first(), step.second(),
                step.derivesEmptyClause() ? "[]" : "(" + step.resolvent() + ")");
    }
}
