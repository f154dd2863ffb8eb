package org.satba.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * VINCOLO PSEUDO-BOOLEANO - "somma dei coefficienti dei letterali veri ≥ k"
 *
 * I letterali pesati sono copiati alla costruzione; la somma dei coefficienti
 * viene calcolata una sola volta e deve restare nel range degli int.
 */
public final class PseudoBooleanConstraint extends BooleanConstraint {

    private final List<WeightedLiteral> weightedLiterals;
    private final int threshold;
    private final int totalWeight;

    /**
     * @param tag letterale di reificazione (null se asserito incondizionatamente)
     * @param weightedLiterals letterali pesati del corpo
     * @param threshold soglia k (≥ 0)
     * @param redundant true se il vincolo è ridondante
     * @throws IllegalArgumentException se soglia negativa, peso totale fuori range o tag nel corpo
     */
    public PseudoBooleanConstraint(Literal tag, List<WeightedLiteral> weightedLiterals, int threshold,
                                   boolean redundant) {
        super(tag, redundant);
        Objects.requireNonNull(weightedLiterals, "Lista letterali pesati non può essere null");
        if (weightedLiterals.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Lista letterali pesati non può contenere elementi null");
        }
        if (threshold < 0) {
            throw new IllegalArgumentException("Soglia deve essere ≥ 0, ricevuta: " + threshold);
        }

        long sum = 0;
        List<Literal> bodyLiterals = new ArrayList<>();
        for (WeightedLiteral weightedLiteral : weightedLiterals) {
            sum += weightedLiteral.getCoefficient();
            bodyLiterals.add(weightedLiteral.getLiteral());
        }
        if (sum > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Peso totale fuori range: " + sum);
        }

        this.weightedLiterals = Collections.unmodifiableList(new ArrayList<>(weightedLiterals));
        this.threshold = threshold;
        this.totalWeight = (int) sum;
        validateTagNotInBody(bodyLiterals);
    }

    @Override
    public Type type() {
        return Type.PSEUDO_BOOLEAN;
    }

    @Override
    public boolean isBodySatisfiedBy(Predicate<Literal> truth) {
        long weight = 0;
        for (WeightedLiteral weightedLiteral : weightedLiterals) {
            if (truth.test(weightedLiteral.getLiteral())) {
                weight += weightedLiteral.getCoefficient();
            }
        }
        return weight >= threshold;
    }

    public List<WeightedLiteral> getWeightedLiterals() {
        return weightedLiterals;
    }

    public int getThreshold() {
        return threshold;
    }

    /**
     * @return somma C di tutti i coefficienti
     */
    public int getTotalWeight() {
        return totalWeight;
    }

    public int size() {
        return weightedLiterals.size();
    }

    @Override
    public String toString() {
        return tagPrefix() + "pb(" + weightedLiterals + " >= " + threshold + ")";
    }
}
