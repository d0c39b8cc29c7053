package org.resolution.model;

import java.util.Objects;

/**
 * Variabile logica con visibilità limitata alla clausola che la contiene.
 *
 * L'identità è data dal solo nome: due clausole distinte non devono mai
 * condividere nomi di variabile al momento della risoluzione (vedi
 * {@link org.resolution.unify.VariableRenamer#standardizeApart}).
 */
public final class Variable implements Term {

    private final String name;

    public Variable(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome variabile non può essere vuoto");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isVariable() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return name.equals(((Variable) obj).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("v", name);
    }

    @Override
    public String toString() {
        return name;
    }
}
