package org.satba.ba;

import java.util.Optional;

/**
 * ESITO DI UNA CONVERSIONE A LARGHEZZA FISSA
 *
 * Risultato della conversione controllata di un valore a precisione arbitraria
 * (o di una soglia derivata) in un int non negativo: o il valore convertito, o il
 * motivo del rifiuto. La conversione non lancia mai eccezioni; è il chiamante a
 * trasformare un esito negativo in {@link CoefficientOutOfRangeException}.
 */
public final class NarrowedValue {

    private final int value;
    private final String source;
    private final String failure;

    private NarrowedValue(int value, String source, String failure) {
        this.value = value;
        this.source = source;
        this.failure = failure;
    }

    static NarrowedValue of(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Valore convertito deve essere ≥ 0: " + value);
        }
        return new NarrowedValue(value, Integer.toString(value), null);
    }

    static NarrowedValue rejected(String source, String reason) {
        return new NarrowedValue(-1, source, reason);
    }

    public boolean isValid() {
        return failure == null;
    }

    /**
     * @return valore convertito
     * @throws IllegalStateException se la conversione è fallita
     */
    public int getValue() {
        if (failure != null) {
            throw new IllegalStateException("Conversione fallita per " + source + ": " + failure);
        }
        return value;
    }

    public Optional<String> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * @return rappresentazione testuale del valore di partenza
     */
    public String getSource() {
        return source;
    }

    /**
     * Consuma l'esito: restituisce il valore oppure segnala il rifiuto al chiamante.
     */
    public int orElseReject() throws CoefficientOutOfRangeException {
        if (failure != null) {
            throw new CoefficientOutOfRangeException(source, failure);
        }
        return value;
    }

    @Override
    public String toString() {
        return isValid() ? "NarrowedValue{" + value + "}" : "NarrowedValue{" + source + ": " + failure + "}";
    }
}
