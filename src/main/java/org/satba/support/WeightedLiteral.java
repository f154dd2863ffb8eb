package org.satba.support;

import java.util.Objects;

/**
 * Letterale pesato (coefficiente, letterale) usato dai vincoli pseudo-booleani.
 * Il coefficiente è un intero non negativo a larghezza fissa.
 */
public final class WeightedLiteral {

    private final int coefficient;
    private final Literal literal;

    /**
     * @param coefficient peso del letterale (≥ 0)
     * @param literal letterale pesato (non null)
     * @throws IllegalArgumentException se coefficiente negativo
     */
    public WeightedLiteral(int coefficient, Literal literal) {
        if (coefficient < 0) {
            throw new IllegalArgumentException("Coefficiente deve essere ≥ 0, ricevuto: " + coefficient);
        }
        this.coefficient = coefficient;
        this.literal = Objects.requireNonNull(literal, "Letterale pesato non può essere null");
    }

    public int getCoefficient() {
        return coefficient;
    }

    public Literal getLiteral() {
        return literal;
    }

    /**
     * @return nuovo letterale pesato con stesso coefficiente e letterale complementato
     */
    public WeightedLiteral negate() {
        return new WeightedLiteral(coefficient, literal.negate());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof WeightedLiteral)) return false;
        WeightedLiteral other = (WeightedLiteral) obj;
        return coefficient == other.coefficient && literal.equals(other.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coefficient, literal);
    }

    @Override
    public String toString() {
        return coefficient + "·" + literal;
    }
}
