package org.resolution.model;

import java.util.Objects;

/**
 * Costante: simbolo atomico con significato globale (es. socrates).
 * Due costanti unificano solo se hanno lo stesso nome.
 */
public final class Constant implements Term {

    private final String name;

    public Constant(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome costante non può essere vuoto");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isVariable() {
        return false;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return name.equals(((Constant) obj).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("c", name);
    }

    @Override
    public String toString() {
        return name;
    }
}
