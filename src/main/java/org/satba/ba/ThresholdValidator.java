package org.satba.ba;

import org.satba.term.Term;

import java.util.ArrayList;
import java.util.List;

/**
 * Validazione preventiva dei vincoli di soglia annidati negli operandi.
 *
 * Un operando di soglia viene sempre internalizzato in forma reificata e non negata,
 * quindi le soglie che userà sono note in anticipo: k, i coefficienti, il peso totale
 * e, per ≤ / al più / uguaglianza, la soglia sui complementi. Verificarle prima di
 * toccare lo store garantisce che un rifiuto in profondità non lasci vincoli parziali.
 */
public final class ThresholdValidator {

    private ThresholdValidator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Verifica il termine e, ricorsivamente, tutti i suoi sottotermini.
     */
    public static void validate(Term term) throws CoefficientOutOfRangeException {
        validateNested(term);
        validateOperands(term);
    }

    /**
     * Verifica ricorsivamente tutti i sottotermini propri del termine.
     */
    static void validateOperands(Term term) throws CoefficientOutOfRangeException {
        for (Term operand : term.getOperands()) {
            validateNested(operand);
            validateOperands(operand);
        }
    }

    private static void validateNested(Term term) throws CoefficientOutOfRangeException {
        if (!term.isThreshold()) {
            return;
        }
        int k = ThresholdArithmetic.narrow(term.getThreshold()).orElseReject();
        List<Integer> coefficients = new ArrayList<>(term.getOperandCount());
        for (int i = 0; i < term.getOperandCount(); i++) {
            coefficients.add(ThresholdArithmetic.narrow(term.getCoefficient(i)).orElseReject());
        }
        ThresholdArithmetic.totalWeight(coefficients).orElseReject();

        switch (term.getType()) {
            case AT_MOST_K, PB_LE, PB_EQ -> ThresholdArithmetic.complementedThreshold(coefficients, k).orElseReject();
            default -> {
            }
        }
    }
}
