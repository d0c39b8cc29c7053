package org.resolution.unify;

import org.resolution.model.Clause;
import org.resolution.model.Literal;
import org.resolution.model.Term;
import org.resolution.model.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * RINOMINA DELLE VARIABILI - Separazione delle clausole e forma canonica
 *
 * Le variabili hanno visibilità limitata alla propria clausola, quindi prima di
 * confrontare o combinare due clausole occorre rinominarle.
 *
 * OPERAZIONI:
 * • standardizeApart: nomi freschi, mai usati prima da questa istanza
 *   (X#1, X#2, ...). Il carattere '#' non è ammesso nei file di input, quindi
 *   i nomi freschi non collidono con quelli scritti dall'utente.
 * • canonicalize: nomi V1, V2, ... nell'ordine di prima occorrenza, usata per
 *   memorizzare e stampare le clausole.
 * • alphaEquivalent: esiste una rinomina biiettiva delle variabili che rende
 *   uguali due clausole?
 *
 * Un'istanza appartiene a un singolo tentativo di prova: il contatore dei nomi
 * freschi non è condiviso tra thread.
 */
public class VariableRenamer {

    private static final Logger LOGGER = Logger.getLogger(VariableRenamer.class.getName());

    private static final String FRESH_SEPARATOR = "#";
    private static final String CANONICAL_PREFIX = "V";

    /** Contatore monotono dei nomi freschi */
    private long freshCounter = 0;

    //region SEPARAZIONE DELLE CLAUSOLE

    /**
     * Rinomina tutte le variabili della clausola con nomi freschi.
     * Due chiamate successive restituiscono clausole con variabili disgiunte.
     *
     * @param clause clausola da separare
     * @return clausola con variabili nuove (la stessa istanza se è ground)
     */
    public Clause standardizeApart(Clause clause) {
        if (clause.getVariables().isEmpty()) {
            return clause;
        }

        Map<Variable, Variable> renaming = new HashMap<>();
        for (Variable variable : clause.getVariables()) {
            renaming.put(variable, new Variable(baseName(variable) + FRESH_SEPARATOR + (++freshCounter)));
        }

        Clause renamed = rename(clause, renaming);
        LOGGER.finest(() -> "Separazione: " + clause + " -> " + renamed);
        return renamed;
    }

    /**
     * Numero di variabili fresche generate finora.
     */
    public long getFreshCount() {
        return freshCounter;
    }

    private static String baseName(Variable variable) {
        String name = variable.getName();
        int separator = name.indexOf(FRESH_SEPARATOR);
        return separator >= 0 ? name.substring(0, separator) : name;
    }

    //endregion

    //region FORMA CANONICA

    /**
     * Rinomina le variabili in V1, V2, ... secondo l'ordine di prima occorrenza.
     *
     * @param clause clausola da normalizzare
     * @return clausola con nomi canonici
     */
    public static Clause canonicalize(Clause clause) {
        Map<Variable, Variable> renaming = new HashMap<>();
        int index = 0;
        for (Variable variable : clause.getVariables()) {
            renaming.put(variable, new Variable(CANONICAL_PREFIX + (++index)));
        }
        return renaming.isEmpty() ? clause : rename(clause, renaming);
    }

    private static Clause rename(Clause clause, Map<Variable, Variable> renaming) {
        List<Literal> literals = new ArrayList<>(clause.size());
        for (Literal literal : clause.getLiterals()) {
            List<Term> arguments = new ArrayList<>(literal.getArity());
            for (Term argument : literal.getArguments()) {
                arguments.add(argument.isVariable() ? renaming.get((Variable) argument) : argument);
            }
            literals.add(new Literal(literal.isPositive(), literal.getPredicate(), arguments));
        }
        return Clause.of(literals);
    }

    //endregion

    //region ALFA-EQUIVALENZA

    /**
     * Verifica se due clausole differiscono solo per i nomi delle variabili.
     *
     * ALGORITMO:
     * 1. Scarta subito coppie con cardinalità o chiave di forma diverse
     * 2. Associa ogni letterale di a a un letterale distinto di b con backtracking
     * 3. Mantiene una rinomina biiettiva variabile ↔ variabile coerente su tutti
     *    i letterali associati
     *
     * @return true se esiste una rinomina biiettiva che rende le clausole uguali
     */
    public static boolean alphaEquivalent(Clause a, Clause b) {
        if (a.size() != b.size()) return false;
        if (a.equals(b)) return true;
        if (!a.shapeKey().equals(b.shapeKey())) return false;

        return matchFrom(0, a, b, new boolean[b.size()], new HashMap<>(), new HashMap<>());
    }

    private static boolean matchFrom(int position, Clause a, Clause b, boolean[] used,
                                     Map<Variable, Variable> forward, Map<Variable, Variable> backward) {
        if (position == a.size()) {
            return true;
        }

        Literal left = a.get(position);
        for (int candidate = 0; candidate < b.size(); candidate++) {
            if (used[candidate]) continue;

            Map<Variable, Variable> nextForward = new HashMap<>(forward);
            Map<Variable, Variable> nextBackward = new HashMap<>(backward);
            if (!matchLiteral(left, b.get(candidate), nextForward, nextBackward)) continue;

            used[candidate] = true;
            if (matchFrom(position + 1, a, b, used, nextForward, nextBackward)) {
                return true;
            }
            used[candidate] = false;
        }
        return false;
    }

    private static boolean matchLiteral(Literal left, Literal right,
                                        Map<Variable, Variable> forward, Map<Variable, Variable> backward) {
        if (left.isPositive() != right.isPositive()
                || !left.getPredicate().equals(right.getPredicate())
                || left.getArity() != right.getArity()) {
            return false;
        }

        for (int i = 0; i < left.getArity(); i++) {
            Term l = left.getArguments().get(i);
            Term r = right.getArguments().get(i);

            if (l.isVariable() && r.isVariable()) {
                Variable lv = (Variable) l;
                Variable rv = (Variable) r;
                Variable mapped = forward.putIfAbsent(lv, rv);
                Variable reverse = backward.putIfAbsent(rv, lv);
                if ((mapped != null && !mapped.equals(rv)) || (reverse != null && !reverse.equals(lv))) {
                    return false;
                }
            } else if (l.isVariable() || r.isVariable() || !l.equals(r)) {
                return false;
            }
        }
        return true;
    }

    //endregion
}
