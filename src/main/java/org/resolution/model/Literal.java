package org.resolution.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * LETTERALE - Predicato applicato a termini, con polarità positiva o negativa
 *
 * Rappresenta l'unità elementare di una clausola CNF. Il letterale è immutabile:
 * ogni sostituzione produce un nuovo letterale.
 *
 * FORMATO TESTUALE:
 * • man(socrates)  letterale positivo
 * • !man(X)        letterale negativo
 * • p              atomo proposizionale (arità 0)
 *
 * COMPLEMENTARIETÀ:
 * Due letterali sono complementari se hanno stesso predicato, stessa arità,
 * polarità opposte e argomenti unificabili. Questa classe verifica solo la parte
 * sintattica ({@link #hasComplementaryShape}); l'unificazione degli argomenti è
 * compito di {@link org.resolution.unify.Unifier}.
 */
public final class Literal {

    //region ATTRIBUTI

    /** true per letterale asserito, false per letterale negato */
    private final boolean positive;

    /** Simbolo di predicato */
    private final String predicate;

    /** Argomenti in ordine posizionale (lista immutabile) */
    private final List<Term> arguments;

    //endregion

    //region COSTRUZIONE

    /**
     * @param positive polarità del letterale
     * @param predicate simbolo di predicato (non vuoto)
     * @param arguments argomenti posizionali (null equivale a nessun argomento)
     * @throws IllegalArgumentException se predicato vuoto o argomenti null
     */
    public Literal(boolean positive, String predicate, List<? extends Term> arguments) {
        if (predicate == null || predicate.isBlank()) {
            throw new IllegalArgumentException("Simbolo di predicato non può essere vuoto");
        }
        List<Term> copy = arguments != null ? new ArrayList<>(arguments) : new ArrayList<>();
        if (copy.contains(null)) {
            throw new IllegalArgumentException("Argomento null nel letterale " + predicate);
        }

        this.positive = positive;
        this.predicate = predicate;
        this.arguments = Collections.unmodifiableList(copy);
    }

    /**
     * Crea un letterale positivo.
     */
    public static Literal positive(String predicate, Term... arguments) {
        return new Literal(true, predicate, List.of(arguments));
    }

    /**
     * Crea un letterale negativo.
     */
    public static Literal negative(String predicate, Term... arguments) {
        return new Literal(false, predicate, List.of(arguments));
    }

    //endregion

    //region ACCESSORS

    public boolean isPositive() {
        return positive;
    }

    public boolean isNegative() {
        return !positive;
    }

    public String getPredicate() {
        return predicate;
    }

    public List<Term> getArguments() {
        return arguments;
    }

    public int getArity() {
        return arguments.size();
    }

    /**
     * @return variabili distinte nell'ordine di prima occorrenza
     */
    public Set<Variable> getVariables() {
        Set<Variable> variables = new LinkedHashSet<>();
        for (Term argument : arguments) {
            if (argument.isVariable()) {
                variables.add((Variable) argument);
            }
        }
        return variables;
    }

    //endregion

    //region OPERAZIONI

    /**
     * @return lo stesso atomo con polarità opposta
     */
    public Literal negate() {
        return new Literal(!positive, predicate, arguments);
    }

    /**
     * Verifica i requisiti sintattici della complementarietà: stesso predicato,
     * stessa arità, polarità opposte. Gli argomenti non vengono confrontati.
     */
    public boolean hasComplementaryShape(Literal other) {
        return other != null
                && positive != other.positive
                && predicate.equals(other.predicate)
                && arguments.size() == other.arguments.size();
    }

    /**
     * Applica la sostituzione a ogni argomento.
     *
     * @param substitution sostituzione da applicare
     * @return nuovo letterale (o questo stesso se nessun argomento cambia)
     */
    public Literal apply(Substitution substitution) {
        if (substitution.isEmpty()) {
            return this;
        }
        List<Term> replaced = new ArrayList<>(arguments.size());
        boolean changed = false;
        for (Term argument : arguments) {
            Term value = substitution.apply(argument);
            changed |= !value.equals(argument);
            replaced.add(value);
        }
        return changed ? new Literal(positive, predicate, replaced) : this;
    }

    /**
     * Chiave di forma indipendente dai nomi delle variabili: ogni variabile
     * diventa "?". Due letterali alfa-equivalenti hanno la stessa chiave.
     */
    public String shapeKey() {
        StringBuilder key = new StringBuilder();
        key.append(positive ? '+' : '-').append(predicate).append('/').append(arguments.size());
        for (Term argument : arguments) {
            key.append(' ').append(argument.isVariable() ? "?" : argument.getName());
        }
        return key.toString();
    }

    //endregion

    //region UGUAGLIANZA E OUTPUT

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Literal other = (Literal) obj;
        return positive == other.positive
                && predicate.equals(other.predicate)
                && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positive, predicate, arguments);
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder();
        if (!positive) {
            text.append('!');
        }
        text.append(predicate);
        if (!arguments.isEmpty()) {
            text.append('(');
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) text.append(", ");
                text.append(arguments.get(i));
            }
            text.append(')');
        }
        return text.toString();
    }

    //endregion
}
