package org.resolution.saturation;

import org.resolution.model.Clause;
import org.resolution.model.Literal;
import org.resolution.model.Substitution;
import org.resolution.resolve.Resolver;
import org.resolution.store.ClauseStore;
import org.resolution.unify.Unifier;
import org.resolution.unify.VariableRenamer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * CICLO DI SATURAZIONE - Refutazione per risoluzione fino a clausola vuota o punto fisso
 *
 * STATI: SEARCHING → PROVED_EMPTY | SATURATED_NO_PROOF
 *
 * ALGORITMO (un giro per generazione):
 * 1. Fotografia dell'insieme corrente delle clausole, in ordine di inserimento
 * 2. Per ogni coppia non ordinata di clausole distinte (i < j) le due clausole
 *    vengono separate con variabili fresche
 * 3. Per ogni coppia di letterali si interroga l'unificatore; in caso di successo
 *    il risolutore costruisce il risolvente e si tenta l'inserimento
 * 4. Clausola vuota inserita: PROVED_EMPTY, la scansione si interrompe subito
 * 5. Giro concluso senza inserimenti nuovi: SATURATED_NO_PROOF
 * 6. Altrimenti nuovo giro sulla fotografia ingrandita
 *
 * Le clausole inserite durante un giro non sono visibili fino al giro
 * successivo, così l'ordine delle coppie è riproducibile.
 *
 * TERMINAZIONE:
 * con un vocabolario senza funzioni, predicati e costanti finiti, le clausole
 * distinte a meno di rinomina sono finite; la deduplicazione dell'insieme
 * garantisce che si raggiunga uno dei due stati terminali.
 *
 * Ogni istanza esegue un solo tentativo ed è proprietaria esclusiva del proprio
 * {@link ClauseStore}.
 */
public class SaturationLoop {

    private static final Logger LOGGER = Logger.getLogger(SaturationLoop.class.getName());

    //region COMPONENTI

    private final ClauseStore store;
    private final Unifier unifier;
    private final Resolver resolver;
    private final VariableRenamer renamer;
    private final ProofGenerator proofGenerator;
    private final ResolutionStatistics statistics;
    private final List<ResolutionStep> trace = new ArrayList<>();
    private final List<Clause> seeds = new ArrayList<>();

    private Consumer<ResolutionStep> stepListener = step -> { };

    private SearchState state = SearchState.SEARCHING;

    private boolean started = false;

    //endregion

    //region INIZIALIZZAZIONE

    /**
     * Crea il ciclo e inserisce le clausole iniziali, ciascuna separata con
     * variabili fresche. Clausole iniziali alfa-equivalenti vengono fuse.
     *
     * @param seedClauses clausole CNF della base di conoscenza e goal negato
     */
    public SaturationLoop(List<Clause> seedClauses) {
        this(seedClauses, new ClauseStore(), new Unifier(), new Resolver(), new VariableRenamer());
    }

    SaturationLoop(List<Clause> seedClauses, ClauseStore store, Unifier unifier, Resolver resolver,
                   VariableRenamer renamer) {
        if (seedClauses == null) {
            throw new IllegalArgumentException("Lista clausole iniziali null");
        }

        this.store = store;
        this.unifier = unifier;
        this.resolver = resolver;
        this.renamer = renamer;
        this.proofGenerator = new ProofGenerator();
        this.statistics = new ResolutionStatistics();

        loadSeeds(seedClauses);
    }

    private void loadSeeds(List<Clause> seedClauses) {
        for (Clause seed : seedClauses) {
            if (store.insert(renamer.standardizeApart(seed))) {
                statistics.incrementSeedClauses();
                seeds.add(store.get(store.size()));
            } else {
                LOGGER.fine("Clausola iniziale duplicata ignorata: " + seed);
            }
        }
        LOGGER.info("Clausole iniziali caricate: " + store.size() + " su " + seedClauses.size());
    }

    /**
     * Registra un osservatore invocato a ogni passo riuscito, durante la ricerca.
     */
    public void setStepListener(Consumer<ResolutionStep> listener) {
        this.stepListener = listener != null ? listener : step -> { };
    }

    //endregion

    //region ESECUZIONE

    /**
     * Esegue la saturazione fino a uno stato terminale.
     *
     * @return risultato con verdetto, traccia, prova e statistiche
     * @throws IllegalStateException se il ciclo è già stato eseguito
     */
    public ResolutionResult run() {
        if (started) {
            throw new IllegalStateException("Il ciclo di saturazione è già stato eseguito");
        }
        started = true;

        if (store.containsEmptyClause()) {
            LOGGER.info("Clausola vuota presente tra le clausole iniziali");
            state = SearchState.PROVED_EMPTY;
        }

        while (state == SearchState.SEARCHING) {
            runRound();
        }

        return buildResult();
    }

    /**
     * Un giro completo (o interrotto dalla clausola vuota) sulla fotografia corrente.
     */
    private void runRound() {
        statistics.incrementRounds();
        List<Clause> snapshot = store.all();
        int round = statistics.getRounds();
        int insertedBefore = statistics.getInsertedClauses();

        LOGGER.info("Giro " + round + ": " + snapshot.size() + " clausole");

        for (int i = 0; i < snapshot.size() && state == SearchState.SEARCHING; i++) {
            for (int j = i + 1; j < snapshot.size() && state == SearchState.SEARCHING; j++) {
                resolvePair(round, i + 1, snapshot.get(i), j + 1, snapshot.get(j));
            }
        }

        if (state == SearchState.SEARCHING && statistics.getInsertedClauses() == insertedBefore) {
            state = SearchState.SATURATED_NO_PROOF;
            LOGGER.info("Saturazione raggiunta al giro " + round + " senza clausola vuota");
        }
    }

    /**
     * Prova tutte le coppie di letterali di due clausole distinte.
     */
    private void resolvePair(int round, int firstId, Clause first, int secondId, Clause second) {
        statistics.incrementClausePairs();

        Clause left = renamer.standardizeApart(first);
        Clause right = renamer.standardizeApart(second);

        for (Literal leftLiteral : left.getLiterals()) {
            for (Literal rightLiteral : right.getLiterals()) {
                statistics.incrementLiteralPairs();

                Optional<Substitution> unifierResult = unifier.matchComplementary(leftLiteral, rightLiteral);
                if (unifierResult.isEmpty()) continue;
                statistics.incrementUnifications();

                Clause resolvent = resolver.resolve(left, right, leftLiteral, rightLiteral, unifierResult.get());
                statistics.incrementResolvents();

                if (!store.insert(resolvent)) {
                    statistics.incrementDuplicates();
                    continue;
                }
                statistics.incrementInsertedClauses();

                ResolutionStep step = new ResolutionStep(round, firstId, first, secondId, second,
                        store.size(), store.get(store.size()), unifierResult.get());
                recordStep(step);

                if (resolvent.isEmpty()) {
                    state = SearchState.PROVED_EMPTY;
                    return;
                }
            }
        }
    }

    private void recordStep(ResolutionStep step) {
        trace.add(step);
        proofGenerator.recordStep(step);
        LOGGER.fine(step::toTraceLine);
        stepListener.accept(step);
    }

    private ResolutionResult buildResult() {
        List<ResolutionStep> proof = proofGenerator.extractProof();

        statistics.setFinalStoreSize(store.size());
        statistics.setProofSize(proof.size());
        statistics.stopTimer();

        ResolutionResult result = new ResolutionResult(state, seeds, store.all(), trace, proof, statistics);
        LOGGER.info("Ricerca conclusa: " + result.toCompactString());
        LOGGER.fine(() -> statistics.toCompactString() + ", variabili fresche: " + renamer.getFreshCount());
        return result;
    }

    //endregion

    //region ACCESSORS

    public SearchState getState() {
        return state;
    }

    /**
     * Insieme delle clausole del tentativo, esposto per ispezione.
     */
    public ClauseStore getStore() {
        return store;
    }

    //endregion
}
