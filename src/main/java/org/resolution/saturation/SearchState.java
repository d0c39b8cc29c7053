package org.resolution.saturation;

/**
 * Stati del ciclo di saturazione. Si parte da SEARCHING; gli altri due sono
 * terminali e mutuamente esclusivi.
 */
public enum SearchState {
    /** Ricerca in corso */
    SEARCHING,
    /** Clausola vuota derivata: il goal è conseguenza logica della base */
    PROVED_EMPTY,
    /** Nessuna nuova clausola derivabile e clausola vuota assente */
    SATURATED_NO_PROOF;

    public boolean isTerminal() {
        return this != SEARCHING;
    }
}
