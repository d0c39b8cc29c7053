package org.resolution.store;

import org.resolution.model.Clause;
import org.resolution.unify.VariableRenamer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * INSIEME DELLE CLAUSOLE - Base di lavoro crescente e senza duplicati
 *
 * Contiene le clausole di un singolo tentativo di prova. Le clausole non vengono
 * mai rimosse e due clausole alfa-equivalenti non possono coesistere.
 *
 * STRUTTURA:
 * • lista in ordine di inserimento: l'identificatore di una clausola è la sua
 *   posizione (a partire da 1)
 * • indice per chiave di forma: limita i confronti di alfa-equivalenza alle sole
 *   clausole con gli stessi predicati, polarità e costanti
 *
 * Le clausole sono memorizzate in forma canonica (variabili V1, V2, ...).
 *
 * Non è thread-safe: appartiene in modo esclusivo al ciclo di saturazione.
 */
public class ClauseStore {

    private static final Logger LOGGER = Logger.getLogger(ClauseStore.class.getName());

    private final List<Clause> clauses = new ArrayList<>();

    private final Map<String, List<Clause>> shapeIndex = new HashMap<>();

    private boolean emptyClausePresent = false;

    //region OPERAZIONI PRINCIPALI

    /**
     * @return true se esiste già una clausola alfa-equivalente
     */
    public boolean contains(Clause clause) {
        List<Clause> bucket = shapeIndex.get(clause.shapeKey());
        if (bucket == null) {
            return false;
        }
        for (Clause stored : bucket) {
            if (VariableRenamer.alphaEquivalent(stored, clause)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Inserisce la clausola se nuova.
     *
     * @param clause clausola da aggiungere
     * @return true se inserita, false se una variante era già presente
     */
    public boolean insert(Clause clause) {
        if (clause == null) {
            throw new IllegalArgumentException("Clausola null");
        }
        if (contains(clause)) {
            LOGGER.finest(() -> "Clausola già presente: " + clause);
            return false;
        }

        Clause canonical = VariableRenamer.canonicalize(clause);
        clauses.add(canonical);
        shapeIndex.computeIfAbsent(canonical.shapeKey(), key -> new ArrayList<>()).add(canonical);
        if (canonical.isEmpty()) {
            emptyClausePresent = true;
        }

        LOGGER.fine(() -> "Inserita [" + clauses.size() + "] " + canonical);
        return true;
    }

    /**
     * Fotografia stabile delle clausole in ordine di inserimento. Gli inserimenti
     * successivi non la modificano.
     */
    public List<Clause> all() {
        return List.copyOf(clauses);
    }

    //endregion

    //region INTERROGAZIONI

    /**
     * @param id identificatore (1 = prima clausola inserita)
     * @return clausola in forma canonica
     */
    public Clause get(int id) {
        if (id < 1 || id > clauses.size()) {
            throw new IndexOutOfBoundsException("Identificatore clausola non valido: " + id);
        }
        return clauses.get(id - 1);
    }

    public int size() {
        return clauses.size();
    }

    public boolean containsEmptyClause() {
        return emptyClausePresent;
    }

    //endregion
}
