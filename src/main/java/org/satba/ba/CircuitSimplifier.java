package org.satba.ba;

import org.satba.support.Literal;

import java.util.List;

/**
 * Semplificatore di circuiti opzionale: cache strutturale best-effort delle relazioni XOR.
 *
 * Le registrazioni non devono mai cambiare i risultati osservabili dell'internalizzazione.
 */
public interface CircuitSimplifier {

    /** Implementazione di default: nessuna registrazione */
    CircuitSimplifier NO_OP = (closer, literals) -> { };

    /**
     * Registra la relazione closer = XOR(literals).
     */
    void addParity(Literal closer, List<Literal> literals);
}
