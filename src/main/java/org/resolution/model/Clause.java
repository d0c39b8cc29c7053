package org.resolution.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * CLAUSOLA - Disgiunzione di letterali rappresentata come insieme senza duplicati
 *
 * L'ordine dei letterali è quello di inserimento e serve solo per una stampa
 * stabile e per un'enumerazione deterministica delle coppie di letterali;
 * uguaglianza e hash ignorano l'ordine.
 *
 * CLAUSOLA VUOTA:
 * {@link #EMPTY} rappresenta la contraddizione logica. Derivarla conclude
 * la refutazione con successo.
 *
 * FORMATO TESTUALE:
 * • !man(X) | mortal(X)
 * • [] per la clausola vuota
 */
public final class Clause {

    /** Clausola vuota: falso logico */
    public static final Clause EMPTY = new Clause(List.of());

    //region ATTRIBUTI

    private final List<Literal> literals;

    private final Set<Literal> literalSet;

    //endregion

    //region COSTRUZIONE

    private Clause(Collection<Literal> literals) {
        LinkedHashSet<Literal> distinct = new LinkedHashSet<>(literals);
        this.literals = Collections.unmodifiableList(new ArrayList<>(distinct));
        this.literalSet = Collections.unmodifiableSet(new HashSet<>(distinct));
    }

    /**
     * Costruisce una clausola eliminando i letterali duplicati.
     *
     * @param literals letterali della disgiunzione
     * @return clausola (EMPTY se la collezione è vuota)
     * @throws IllegalArgumentException se la collezione o un letterale è null
     */
    public static Clause of(Collection<Literal> literals) {
        if (literals == null) {
            throw new IllegalArgumentException("Lista letterali null");
        }
        if (literals.contains(null)) {
            throw new IllegalArgumentException("Letterale null nella clausola");
        }
        return literals.isEmpty() ? EMPTY : new Clause(literals);
    }

    public static Clause of(Literal... literals) {
        return of(List.of(literals));
    }

    //endregion

    //region ACCESSORS

    public List<Literal> getLiterals() {
        return literals;
    }

    public Literal get(int index) {
        return literals.get(index);
    }

    public int size() {
        return literals.size();
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    public boolean contains(Literal literal) {
        return literalSet.contains(literal);
    }

    /**
     * @return variabili distinte nell'ordine di prima occorrenza
     */
    public Set<Variable> getVariables() {
        Set<Variable> variables = new LinkedHashSet<>();
        for (Literal literal : literals) {
            variables.addAll(literal.getVariables());
        }
        return variables;
    }

    //endregion

    //region OPERAZIONI

    /**
     * Applica la sostituzione a tutti i letterali; i letterali che diventano
     * identici vengono fusi.
     */
    public Clause apply(Substitution substitution) {
        if (substitution.isEmpty() || isEmpty()) {
            return this;
        }
        List<Literal> replaced = new ArrayList<>(literals.size());
        for (Literal literal : literals) {
            replaced.add(literal.apply(substitution));
        }
        return of(replaced);
    }

    /**
     * Restituisce la clausola privata di un'occorrenza del letterale indicato.
     */
    public Clause without(Literal literal) {
        List<Literal> remaining = new ArrayList<>(literals);
        if (!remaining.remove(literal)) {
            throw new IllegalArgumentException("Letterale " + literal + " non presente in " + this);
        }
        return of(remaining);
    }

    /**
     * Chiave di forma indipendente dall'ordine dei letterali e dai nomi delle variabili.
     * Clausole alfa-equivalenti hanno sempre la stessa chiave (il viceversa non vale).
     */
    public String shapeKey() {
        return literals.stream()
                .map(Literal::shapeKey)
                .sorted()
                .collect(Collectors.joining(" | ", "{", "}"));
    }

    //endregion

    //region UGUAGLIANZA E OUTPUT

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return literalSet.equals(((Clause) obj).literalSet);
    }

    @Override
    public int hashCode() {
        return literalSet.hashCode();
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "[]";
        }
        return literals.stream()
                .map(Literal::toString)
                .collect(Collectors.joining(" | "));
    }

    //endregion
}
