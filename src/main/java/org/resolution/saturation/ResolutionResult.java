package org.resolution.saturation;

import org.resolution.model.Clause;

import java.util.List;

/**
 * RISULTATO DI RISOLUZIONE - Contenitore immutabile dell'esito di un tentativo di prova
 *
 * COMPONENTI:
 * • Stato terminale e verdetto (proved / not-proved)
 * • Clausole iniziali e insieme finale, in forma canonica
 * • Traccia completa dei passi riusciti
 * • Prova estratta (solo per verdetto proved)
 * • Statistiche di esecuzione
 */
public class ResolutionResult {

    private final SearchState state;
    private final List<Clause> seeds;
    private final List<Clause> finalClauses;
    private final List<ResolutionStep> trace;
    private final List<ResolutionStep> proof;
    private final ResolutionStatistics statistics;

    public ResolutionResult(SearchState state, List<Clause> seeds, List<Clause> finalClauses,
                            List<ResolutionStep> trace, List<ResolutionStep> proof,
                            ResolutionStatistics statistics) {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("Il risultato richiede uno stato terminale, ricevuto: " + state);
        }
        if (state == SearchState.SATURATED_NO_PROOF && !proof.isEmpty()) {
            throw new IllegalArgumentException("Risultato not-proved non può avere una prova");
        }

        this.state = state;
        this.seeds = List.copyOf(seeds);
        this.finalClauses = List.copyOf(finalClauses);
        this.trace = List.copyOf(trace);
        this.proof = List.copyOf(proof);
        this.statistics = statistics != null ? statistics : new ResolutionStatistics();
    }

    //region ACCESSORS

    public SearchState getState() {
        return state;
    }

    public Verdict getVerdict() {
        return Verdict.of(state);
    }

    public boolean isProved() {
        return state == SearchState.PROVED_EMPTY;
    }

    public List<Clause> getSeeds() {
        return seeds;
    }

    public List<Clause> getFinalClauses() {
        return finalClauses;
    }

    public List<ResolutionStep> getTrace() {
        return trace;
    }

    public List<ResolutionStep> getProof() {
        return proof;
    }

    public ResolutionStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region OUTPUT

    /**
     * @return traccia completa, una riga per risolvente nuovo
     */
    public String formatTrace() {
        StringBuilder text = new StringBuilder();
        for (ResolutionStep step : trace) {
            text.append(step.toTraceLine()).append("\n");
        }
        return text.toString();
    }

    /**
     * @return prova estratta oppure messaggio di assenza
     */
    public String formatProof() {
        if (!isProved()) {
            return "Nessuna prova: saturazione raggiunta senza clausola vuota.\n";
        }
        if (proof.isEmpty()) {
            return "La clausola vuota è presente tra le clausole iniziali.\n";
        }
        return ProofGenerator.formatProof(proof);
    }

    public String toCompactString() {
        return String.format("ResolutionResult{%s, passi=%d, clausole=%d, time=%dms}",
                getVerdict(), trace.size(), finalClauses.size(), statistics.getExecutionTimeMs());
    }

    @Override
    public String toString() {
        return "Esito: " + getVerdict().getLabel();
    }

    //endregion
}
