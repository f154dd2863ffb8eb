package org.satba.ba;

import org.satba.term.Term;

/**
 * Violazione di contratto del chiamante: un termine con operatore esterno alle famiglie
 * pseudo-booleana e catena di biimplicazioni ha raggiunto il dispatcher. Errore fatale.
 */
public class UnsupportedOperatorException extends IllegalStateException {

    private final Term.Type operator;

    public UnsupportedOperatorException(Term.Type operator, Term term) {
        super("Operatore non supportato dall'internalizzatore di algebra booleana: " + operator + " in " + term);
        this.operator = operator;
    }

    public Term.Type getOperator() {
        return operator;
    }
}
