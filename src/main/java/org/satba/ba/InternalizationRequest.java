package org.satba.ba;

import org.satba.term.Term;

import java.util.Objects;

/**
 * Parametri di una singola chiamata di internalizzazione.
 *
 * @param term termine da internalizzare
 * @param sign true se il termine va negato
 * @param root true se è l'asserzione più esterna
 * @param redundant true se i vincoli prodotti sono ridondanti
 */
public record InternalizationRequest(Term term, boolean sign, boolean root, boolean redundant) {

    public InternalizationRequest {
        Objects.requireNonNull(term, "Termine da internalizzare non può essere null");
    }
}
