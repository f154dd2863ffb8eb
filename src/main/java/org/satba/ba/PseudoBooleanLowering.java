package org.satba.ba;

import org.satba.support.Literal;
import org.satba.support.WeightedLiteral;
import org.satba.term.Term;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * LOWERING DEI VINCOLI PSEUDO-BOOLEANI
 *
 * Stessa struttura del lowering di cardinalità, su letterali pesati:
 * • Σ c_i·l_i ≥ k  memorizzato così com'è
 * • Σ c_i·l_i ≤ k  riscritto come Σ c_i·¬l_i ≥ C - k
 * • Σ c_i·l_i = k  scomposto nelle due metà ≥ k e ≤ k
 *
 * Ogni coefficiente dichiarato, il peso totale e tutte le soglie derivate vengono
 * convertiti prima che un operando sia internalizzato o una variabile allocata.
 */
final class PseudoBooleanLowering {

    private static final Logger LOGGER = Logger.getLogger(PseudoBooleanLowering.class.getName());

    private final InternalizationContext context;

    PseudoBooleanLowering(InternalizationContext context) {
        this.context = context;
    }

    Optional<Literal> convertPbGe(Term term, int k, boolean sign, boolean isRoot, boolean redundant)
            throws CoefficientOutOfRangeException {
        List<Integer> coefficients = narrowCoefficients(term);
        requireNegatedThreshold(coefficients, k, sign, isRoot);
        List<WeightedLiteral> weighted = weightedOperands(term, coefficients, redundant);
        return lowerGreaterEqual(term, weighted, k, sign, isRoot, redundant);
    }

    Optional<Literal> convertPbLe(Term term, int k, boolean sign, boolean isRoot, boolean redundant)
            throws CoefficientOutOfRangeException {
        List<Integer> coefficients = narrowCoefficients(term);
        int greaterEqual = ThresholdArithmetic.complementedThreshold(coefficients, k).orElseReject();
        requireNegatedThreshold(coefficients, greaterEqual, sign, isRoot);

        ThresholdArithmetic.WeightedThreshold rewritten =
                ThresholdArithmetic.toGreaterEqual(weightedOperands(term, coefficients, redundant), k);
        return lowerGreaterEqual(term, rewritten.literals(), rewritten.threshold().getValue(), sign, isRoot,
                redundant);
    }

    Optional<Literal> convertPbEq(Term term, int k, boolean sign, boolean isRoot, boolean redundant)
            throws CoefficientOutOfRangeException {
        List<Integer> coefficients = narrowCoefficients(term);
        ThresholdArithmetic.complementedThreshold(coefficients, k).orElseReject();

        List<WeightedLiteral> weighted = weightedOperands(term, coefficients, redundant);
        ThresholdArithmetic.WeightedThreshold upperHalf = ThresholdArithmetic.toGreaterEqual(weighted, k);
        int complementThreshold = upperHalf.threshold().getValue();

        if (ReificationPolicy.isUnconditionalConjunction(isRoot, sign, context.scopeDepth())) {
            context.addPseudoBoolean(null, weighted, k, redundant);
            context.addPseudoBoolean(null, upperHalf.literals(), complementThreshold, redundant);
            return Optional.empty();
        }

        Literal lower = Literal.positive(context.mintVariable(true));
        Literal upper = Literal.positive(context.mintVariable(true));
        context.addPseudoBoolean(lower, weighted, k, redundant);
        context.addPseudoBoolean(upper, upperHalf.literals(), complementThreshold, redundant);
        return Optional.of(EqualityCombinator.combine(context, term, lower, upper, sign));
    }

    private Optional<Literal> lowerGreaterEqual(Term term, List<WeightedLiteral> weighted, int k, boolean sign,
                                                boolean isRoot, boolean redundant) {
        boolean unconditional = ReificationPolicy.isUnconditional(isRoot, context.scopeDepth());

        if (unconditional && sign) {
            ThresholdArithmetic.WeightedThreshold negated = ThresholdArithmetic.negateWeighted(weighted, k);
            int negatedThreshold = negated.threshold().getValue();
            LOGGER.finest("Asserzione negata di " + term + " con soglia " + negatedThreshold);
            context.addPseudoBoolean(null, negated.literals(), negatedThreshold, redundant);
            return Optional.empty();
        }

        if (unconditional) {
            context.addPseudoBoolean(null, weighted, k, redundant);
            return Optional.empty();
        }

        Literal tag = Literal.positive(context.mintVariable(true));
        context.addPseudoBoolean(tag, weighted, k, redundant);
        context.cache(term, tag);
        return Optional.of(tag.withSign(sign));
    }

    /**
     * La soglia C + 1 - k di un'asserzione negata alla radice va convertita prima
     * che gli operandi siano internalizzati.
     */
    private void requireNegatedThreshold(List<Integer> coefficients, int k, boolean sign, boolean isRoot)
            throws CoefficientOutOfRangeException {
        if (sign && ReificationPolicy.isUnconditional(isRoot, context.scopeDepth())) {
            ThresholdArithmetic.negatedThreshold(coefficients, k).orElseReject();
        }
    }

    /**
     * Converte i coefficienti dichiarati e verifica che il loro totale resti rappresentabile.
     */
    private List<Integer> narrowCoefficients(Term term) throws CoefficientOutOfRangeException {
        List<Integer> coefficients = new ArrayList<>(term.getOperandCount());
        for (int i = 0; i < term.getOperandCount(); i++) {
            BigDecimal declared = term.getCoefficient(i);
            coefficients.add(ThresholdArithmetic.narrow(declared).orElseReject());
        }
        ThresholdArithmetic.totalWeight(coefficients).orElseReject();
        return coefficients;
    }

    private List<WeightedLiteral> weightedOperands(Term term, List<Integer> coefficients, boolean redundant)
            throws CoefficientOutOfRangeException {
        List<Literal> literals = context.internalizeOperands(term, redundant);
        List<WeightedLiteral> weighted = new ArrayList<>(literals.size());
        for (int i = 0; i < literals.size(); i++) {
            weighted.add(new WeightedLiteral(coefficients.get(i), literals.get(i)));
        }
        return weighted;
    }
}
