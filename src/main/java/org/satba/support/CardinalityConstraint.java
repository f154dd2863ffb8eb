package org.satba.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * VINCOLO DI CARDINALITÀ - "almeno k dei letterali elencati sono veri"
 *
 * Specializzazione a coefficienti unitari del vincolo pseudo-booleano.
 * La lista dei letterali è copiata alla costruzione e resa immutabile.
 */
public final class CardinalityConstraint extends BooleanConstraint {

    private final List<Literal> literals;
    private final int threshold;

    /**
     * @param tag letterale di reificazione (null se asserito incondizionatamente)
     * @param literals letterali del corpo (non null, senza elementi null)
     * @param threshold soglia k (≥ 0)
     * @param redundant true se il vincolo è ridondante
     * @throws IllegalArgumentException se soglia negativa o tag nel corpo
     */
    public CardinalityConstraint(Literal tag, List<Literal> literals, int threshold, boolean redundant) {
        super(tag, redundant);
        Objects.requireNonNull(literals, "Lista letterali non può essere null");
        if (literals.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Lista letterali non può contenere elementi null");
        }
        if (threshold < 0) {
            throw new IllegalArgumentException("Soglia deve essere ≥ 0, ricevuta: " + threshold);
        }
        this.literals = Collections.unmodifiableList(new ArrayList<>(literals));
        this.threshold = threshold;
        validateTagNotInBody(this.literals);
    }

    @Override
    public Type type() {
        return Type.CARDINALITY;
    }

    @Override
    public boolean isBodySatisfiedBy(Predicate<Literal> truth) {
        int trueCount = 0;
        for (Literal literal : literals) {
            if (truth.test(literal)) {
                trueCount++;
            }
        }
        return trueCount >= threshold;
    }

    public List<Literal> getLiterals() {
        return literals;
    }

    public int getThreshold() {
        return threshold;
    }

    public int size() {
        return literals.size();
    }

    @Override
    public String toString() {
        return tagPrefix() + "atleast(" + threshold + ": " + literals + ")";
    }
}
