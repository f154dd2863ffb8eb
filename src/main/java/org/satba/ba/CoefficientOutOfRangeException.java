package org.satba.ba;

import java.util.Objects;

/**
 * Asserzione rifiutata: un coefficiente o una soglia dichiarata (o derivata) è negativa,
 * non intera o fuori dalla larghezza intera supportata dal motore.
 *
 * Interrompe solo l'internalizzazione del termine che l'ha provocata; lo store
 * non contiene alcun vincolo di quel termine.
 */
public class CoefficientOutOfRangeException extends Exception {

    private final String offendingValue;
    private final String reason;

    public CoefficientOutOfRangeException(String offendingValue, String reason) {
        super("Coefficiente fuori range: " + offendingValue + " (" + reason + ")");
        this.offendingValue = Objects.requireNonNull(offendingValue);
        this.reason = Objects.requireNonNull(reason);
    }

    /**
     * @return rappresentazione testuale del valore rifiutato
     */
    public String getOffendingValue() {
        return offendingValue;
    }

    public String getReason() {
        return reason;
    }
}
