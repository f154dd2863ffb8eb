package org.satba.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Vincolo di parità (XOR n-ario): vero sse un numero dispari di letterali è vero.
 */
public final class ParityConstraint extends BooleanConstraint {

    private final List<Literal> literals;

    /**
     * @param tag letterale di reificazione (null per le catene di parità)
     * @param literals letterali del corpo (non null, non vuota)
     * @param redundant true se il vincolo è ridondante
     */
    public ParityConstraint(Literal tag, List<Literal> literals, boolean redundant) {
        super(tag, redundant);
        Objects.requireNonNull(literals, "Lista letterali non può essere null");
        if (literals.isEmpty() || literals.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Vincolo di parità richiede letterali non null: " + literals);
        }
        this.literals = Collections.unmodifiableList(new ArrayList<>(literals));
        validateTagNotInBody(this.literals);
    }

    @Override
    public Type type() {
        return Type.PARITY;
    }

    @Override
    public boolean isBodySatisfiedBy(Predicate<Literal> truth) {
        boolean odd = false;
        for (Literal literal : literals) {
            if (truth.test(literal)) {
                odd = !odd;
            }
        }
        return odd;
    }

    public List<Literal> getLiterals() {
        return literals;
    }

    public int size() {
        return literals.size();
    }

    @Override
    public String toString() {
        return tagPrefix() + "xor" + literals;
    }
}
