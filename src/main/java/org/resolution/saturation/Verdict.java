package org.resolution.saturation;

/**
 * Esito finale di un tentativo di prova, con l'etichetta stampata a fine esecuzione.
 */
public enum Verdict {
    PROVED("proved"),
    NOT_PROVED("not-proved");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    static Verdict of(SearchState state) {
        return switch (state) {
            case PROVED_EMPTY -> PROVED;
            case SATURATED_NO_PROOF -> NOT_PROVED;
            case SEARCHING -> throw new IllegalStateException("Ricerca non ancora conclusa");
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
