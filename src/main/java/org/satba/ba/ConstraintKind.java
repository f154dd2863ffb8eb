package org.satba.ba;

import org.satba.term.Term;

/**
 * Famiglie di termini accettate dal dispatcher. L'insieme è chiuso: ogni switch
 * sul tipo è esaustivo e verificato in compilazione.
 */
public enum ConstraintKind {
    AT_MOST_K,
    AT_LEAST_K,
    LE,
    GE,
    EQ,
    PARITY_CHAIN;

    /**
     * Classifica l'operatore principale del termine.
     *
     * @throws UnsupportedOperatorException se il termine non appartiene alle famiglie supportate
     */
    public static ConstraintKind of(Term term) {
        return switch (term.getType()) {
            case AT_MOST_K -> AT_MOST_K;
            case AT_LEAST_K -> AT_LEAST_K;
            case PB_LE -> LE;
            case PB_GE -> GE;
            case PB_EQ -> EQ;
            case IFF -> PARITY_CHAIN;
            case ATOM, TRUE, FALSE, NOT, AND, OR, XOR -> throw new UnsupportedOperatorException(term.getType(), term);
        };
    }

    /**
     * @return true se il termine è gestito dall'internalizzatore di algebra booleana
     */
    public static boolean supports(Term term) {
        return term.isThreshold() || term.isIff();
    }
}
