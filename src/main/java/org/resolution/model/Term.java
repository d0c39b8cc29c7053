package org.resolution.model;

/**
 * TERMINE - Argomento di un letterale in un vocabolario senza simboli di funzione
 *
 * Un termine è una costante (nome atomico con significato globale) oppure una
 * variabile (nome locale alla clausola che la contiene). Non esistono termini
 * composti: ogni argomento è una foglia.
 */
public interface Term {

    /**
     * @return nome testuale del termine
     */
    String getName();

    /**
     * @return true se il termine è una variabile
     */
    boolean isVariable();
}
