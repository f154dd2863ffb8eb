package org.satba.ba;

import org.satba.support.Literal;
import org.satba.term.Term;

/**
 * Rientro ricorsivo per gli operandi dei vincoli: produce un letterale per un
 * sottotermine arbitrario, eventualmente delegando a una teoria sorella.
 */
public interface OperandInternalizer {

    /**
     * @param operand sottotermine da internalizzare
     * @param context contesto della sessione corrente
     * @param redundant true se l'asserzione che contiene l'operando è ridondante
     * @return letterale equivalente all'operando
     * @throws CoefficientOutOfRangeException se un vincolo annidato viene rifiutato
     */
    Literal internalizeOperand(Term operand, InternalizationContext context, boolean redundant)
            throws CoefficientOutOfRangeException;
}
