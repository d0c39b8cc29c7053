package org.resolution.saturation;

/**
 * STATISTICHE DI RISOLUZIONE - Metriche raccolte durante un tentativo di prova
 *
 * Conta il lavoro svolto dal ciclo di saturazione e misura il tempo totale
 * dall'avvio della ricerca alla chiamata di {@link #stopTimer()}.
 */
public class ResolutionStatistics {

    //region CONTATORI

    /** Clausole iniziali effettivamente inserite (dopo la deduplicazione) */
    private int seedClauses = 0;

    /** Giri completi o interrotti del ciclo di saturazione */
    private int rounds = 0;

    /** Coppie di clausole distinte esaminate */
    private long clausePairs = 0;

    /** Coppie di letterali sottoposte all'unificatore */
    private long literalPairs = 0;

    /** Unificazioni riuscite (coppie complementari trovate) */
    private long unifications = 0;

    /** Risolventi costruiti, nuovi o già presenti */
    private long resolvents = 0;

    /** Risolventi scartati perché alfa-equivalenti a clausole presenti */
    private long duplicates = 0;

    /** Risolventi nuovi inseriti nell'insieme */
    private int insertedClauses = 0;

    /** Dimensione finale dell'insieme delle clausole */
    private int finalStoreSize = 0;

    /** Passi della prova estratta (0 se non dimostrato) */
    private int proofSize = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long executionTimeMs = 0;
    private boolean timerStopped = false;

    public ResolutionStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Ferma il timer. Chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo finale, oppure parziale se il timer è ancora attivo
     */
    public long getExecutionTimeMs() {
        return timerStopped ? executionTimeMs : System.currentTimeMillis() - startTime;
    }

    //endregion

    //region INCREMENTI

    void incrementSeedClauses() {
        seedClauses++;
    }

    void incrementRounds() {
        rounds++;
    }

    void incrementClausePairs() {
        clausePairs++;
    }

    void incrementLiteralPairs() {
        literalPairs++;
    }

    void incrementUnifications() {
        unifications++;
    }

    void incrementResolvents() {
        resolvents++;
    }

    void incrementDuplicates() {
        duplicates++;
    }

    void incrementInsertedClauses() {
        insertedClauses++;
    }

    void setFinalStoreSize(int size) {
        this.finalStoreSize = size;
    }

    void setProofSize(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Dimensione prova non può essere negativa: " + size);
        }
        this.proofSize = size;
    }

    //endregion

    //region ACCESSORS

    public int getSeedClauses() {
        return seedClauses;
    }

    public int getRounds() {
        return rounds;
    }

    public long getClausePairs() {
        return clausePairs;
    }

    public long getLiteralPairs() {
        return literalPairs;
    }

    public long getUnifications() {
        return unifications;
    }

    public long getResolvents() {
        return resolvents;
    }

    public long getDuplicates() {
        return duplicates;
    }

    public int getInsertedClauses() {
        return insertedClauses;
    }

    public int getFinalStoreSize() {
        return finalStoreSize;
    }

    public int getProofSize() {
        return proofSize;
    }

    //endregion

    //region OUTPUT

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("=====================[ STATISTICHE RISOLUZIONE ]=====================\n");
        output.append("    Clausole iniziali:    ").append(seedClauses).append("\n");
        output.append("    Giri:                 ").append(rounds).append("\n");
        output.append("    Coppie di clausole:   ").append(clausePairs).append("\n");
        output.append("    Coppie di letterali:  ").append(literalPairs).append("\n");
        output.append("    Unificazioni:         ").append(unifications).append("\n");
        output.append("    Risolventi:           ").append(resolvents).append("\n");
        output.append("    Duplicati scartati:   ").append(duplicates).append("\n");
        output.append("    Clausole derivate:    ").append(insertedClauses).append("\n");
        output.append("    Clausole finali:      ").append(finalStoreSize).append("\n");
        if (proofSize > 0) {
            output.append("    Dimensione prova:     ").append(proofSize).append("\n");
        }
        output.append("    Tempo:                ").append(getExecutionTimeMs()).append("ms\n");
        output.append("=====================================================================\n");
        return output.toString();
    }

    /**
     * @return riepilogo su una riga per il logging
     */
    public String toCompactString() {
        return String.format("Stats[Giri:%d, Coppie:%d, Unif:%d, Nuove:%d, Dup:%d, Time:%dms]",
                rounds, clausePairs, unifications, insertedClauses, duplicates, getExecutionTimeMs());
    }

    //endregion
}
