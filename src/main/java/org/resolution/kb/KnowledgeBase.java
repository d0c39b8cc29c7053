package org.resolution.kb;

import org.resolution.model.Clause;
import org.resolution.model.Signature;

import java.util.List;

/**
 * Base di conoscenza caricata: clausole iniziali (incluso il goal negato) già
 * validate contro la segnatura.
 *
 * @param name nome della sorgente (file o risorsa)
 * @param signature arità dei predicati
 * @param clauses clausole iniziali in ordine di apparizione
 * @param goalClauses clausole ottenute dalla negazione dei goal
 */
public record KnowledgeBase(String name, Signature signature, List<Clause> clauses, List<Clause> goalClauses) {

    public KnowledgeBase {
        clauses = List.copyOf(clauses);
        goalClauses = List.copyOf(goalClauses);
    }

    public int size() {
        return clauses.size();
    }
}
