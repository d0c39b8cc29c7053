package org.resolution.model;

/**
 * Clausola malformata: un letterale usa un predicato con arità diversa da quella
 * dichiarata. È l'unica condizione che interrompe un tentativo di prova, e viene
 * rilevata al caricamento delle clausole iniziali.
 */
public class MalformedClauseException extends IllegalArgumentException {

    private final String predicate;
    private final int expectedArity;
    private final int foundArity;

    public MalformedClauseException(String predicate, int expectedArity, int foundArity, String context) {
        super("Predicato '" + predicate + "' dichiarato con arità " + expectedArity
                + " ma usato con arità " + foundArity + " in " + context);
        this.predicate = predicate;
        this.expectedArity = expectedArity;
        this.foundArity = foundArity;
    }

    public String getPredicate() {
        return predicate;
    }

    public int getExpectedArity() {
        return expectedArity;
    }

    public int getFoundArity() {
        return foundArity;
    }
}
