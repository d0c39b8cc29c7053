package org.resolution.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * SEGNATURA - Arità dichiarata di ogni simbolo di predicato
 *
 * Un predicato riceve la propria arità da una dichiarazione esplicita
 * (predicate p/n.) oppure dalla sua prima occorrenza. Ogni uso successivo deve
 * rispettarla, altrimenti la clausola è malformata.
 */
public class Signature {

    private static final Logger LOGGER = Logger.getLogger(Signature.class.getName());

    private final Map<String, Integer> arities = new LinkedHashMap<>();

    /**
     * Dichiara esplicitamente l'arità di un predicato.
     *
     * @throws MalformedClauseException se il predicato ha già un'arità diversa
     */
    public void declare(String predicate, int arity) {
        if (arity < 0) {
            throw new IllegalArgumentException("Arità negativa per " + predicate + ": " + arity);
        }
        Integer previous = arities.putIfAbsent(predicate, arity);
        if (previous != null && previous != arity) {
            throw new MalformedClauseException(predicate, previous, arity, "dichiarazione predicate " + predicate + "/" + arity);
        }
        LOGGER.finest("Predicato dichiarato: " + predicate + "/" + arity);
    }

    /**
     * Verifica ogni letterale della clausola contro la segnatura. I predicati non
     * ancora noti vengono registrati con l'arità osservata.
     *
     * @param clause clausola da validare
     * @throws MalformedClauseException al primo letterale con arità discordante
     */
    public void validate(Clause clause) {
        for (Literal literal : clause.getLiterals()) {
            Integer declared = arities.get(literal.getPredicate());
            if (declared == null) {
                arities.put(literal.getPredicate(), literal.getArity());
                LOGGER.finest("Arità dedotta da prima occorrenza: " + literal.getPredicate() + "/" + literal.getArity());
            } else if (declared != literal.getArity()) {
                throw new MalformedClauseException(literal.getPredicate(), declared, literal.getArity(),
                        "clausola (" + clause + ")");
            }
        }
    }

    /**
     * @return arità dichiarata o null se il predicato è sconosciuto
     */
    public Integer arityOf(String predicate) {
        return arities.get(predicate);
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder();
        arities.forEach((predicate, arity) -> {
            if (text.length() > 0) text.append(", ");
            text.append(predicate).append('/').append(arity);
        });
        return text.toString();
    }
}
