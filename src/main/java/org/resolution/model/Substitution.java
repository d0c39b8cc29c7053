package org.resolution.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * SOSTITUZIONE - Mappa finita da variabile a termine
 *
 * Immutabile: {@link #bind} restituisce una nuova sostituzione. I legami possono
 * formare catene variabile → variabile → costante; {@link #apply} le percorre
 * fino in fondo. Senza simboli di funzione non possono nascere cicli, purché non
 * si leghi mai una variabile a sé stessa.
 */
public final class Substitution {

    /** Sostituzione identità */
    public static final Substitution EMPTY = new Substitution(Map.of());

    private final Map<Variable, Term> bindings;

    private Substitution(Map<Variable, Term> bindings) {
        this.bindings = bindings;
    }

    /**
     * Estende la sostituzione con un nuovo legame.
     *
     * @param variable variabile ancora libera
     * @param value termine a cui legarla
     * @return nuova sostituzione
     * @throws IllegalArgumentException se la variabile è già legata o legata a sé stessa
     */
    public Substitution bind(Variable variable, Term value) {
        if (variable == null || value == null) {
            throw new IllegalArgumentException("Legame con variabile o valore null");
        }
        if (bindings.containsKey(variable)) {
            throw new IllegalArgumentException("Variabile " + variable + " già legata a " + bindings.get(variable));
        }
        if (variable.equals(value)) {
            throw new IllegalArgumentException("Legame ciclico " + variable + "/" + value);
        }

        Map<Variable, Term> extended = new LinkedHashMap<>(bindings);
        extended.put(variable, value);
        return new Substitution(Collections.unmodifiableMap(extended));
    }

    /**
     * Risolve un termine seguendo la catena dei legami.
     *
     * @param term termine da risolvere
     * @return costante o variabile libera finale
     */
    public Term apply(Term term) {
        Term current = term;
        while (current.isVariable() && bindings.containsKey(current)) {
            current = bindings.get(current);
        }
        return current;
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return bindings.equals(((Substitution) obj).bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return bindings.entrySet().stream()
                .map(entry -> entry.getKey() + "/" + apply(entry.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
