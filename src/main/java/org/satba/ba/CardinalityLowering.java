package org.satba.ba;

import org.satba.support.Literal;
import org.satba.term.Term;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * LOWERING DEI VINCOLI DI CARDINALITÀ
 *
 * Traduce "almeno k", "al più k" ed "esattamente k" di n operandi in vincoli
 * "almeno k" del backend. Le soglie derivate si calcolano e si validano prima di
 * internalizzare gli operandi: un termine rifiutato non lascia traccia nello store.
 *
 * FORME PRODOTTE:
 * • Asserzione incondizionata: vincolo senza tag, nessun letterale restituito
 * • Altrimenti: variabile fresca v con tag v ↔ corpo, restituito il letterale di v col segno richiesto
 */
final class CardinalityLowering {

    private static final Logger LOGGER = Logger.getLogger(CardinalityLowering.class.getName());

    private final InternalizationContext context;

    CardinalityLowering(InternalizationContext context) {
        this.context = context;
    }

    /**
     * almeno k degli operandi
     */
    Optional<Literal> convertAtLeastK(Term term, int k, boolean sign, boolean isRoot, boolean redundant)
            throws CoefficientOutOfRangeException {
        requireNegatedThreshold(term.getOperandCount(), k, sign, isRoot);
        List<Literal> literals = context.internalizeOperands(term, redundant);
        return lowerAtLeast(term, literals, k, sign, isRoot, redundant);
    }

    /**
     * al più k degli operandi, riscritto come almeno n - k dei complementi
     */
    Optional<Literal> convertAtMostK(Term term, int k, boolean sign, boolean isRoot, boolean redundant)
            throws CoefficientOutOfRangeException {
        int n = term.getOperandCount();
        int atLeast = ThresholdArithmetic.atMostThreshold(n, k).orElseReject();
        requireNegatedThreshold(n, atLeast, sign, isRoot);

        ThresholdArithmetic.CardinalityThreshold rewritten =
                ThresholdArithmetic.atMostToAtLeast(context.internalizeOperands(term, redundant), k);
        return lowerAtLeast(term, rewritten.literals(), rewritten.threshold().getValue(), sign, isRoot, redundant);
    }

    /**
     * esattamente k degli operandi: almeno k degli operandi e almeno n - k dei complementi
     */
    Optional<Literal> convertEqK(Term term, int k, boolean sign, boolean isRoot, boolean redundant)
            throws CoefficientOutOfRangeException {
        ThresholdArithmetic.atMostThreshold(term.getOperandCount(), k).orElseReject();

        List<Literal> literals = context.internalizeOperands(term, redundant);
        ThresholdArithmetic.CardinalityThreshold upperHalf = ThresholdArithmetic.atMostToAtLeast(literals, k);
        int complementThreshold = upperHalf.threshold().getValue();

        if (ReificationPolicy.isUnconditionalConjunction(isRoot, sign, context.scopeDepth())) {
            context.addCardinality(null, literals, k, redundant);
            context.addCardinality(null, upperHalf.literals(), complementThreshold, redundant);
            return Optional.empty();
        }

        Literal lower = Literal.positive(context.mintVariable(true));
        Literal upper = Literal.positive(context.mintVariable(true));
        context.addCardinality(lower, literals, k, redundant);
        context.addCardinality(upper, upperHalf.literals(), complementThreshold, redundant);
        return Optional.of(EqualityCombinator.combine(context, term, lower, upper, sign));
    }

    /**
     * @param literals letterali del corpo "almeno k", già riscritti dal chiamante
     */
    private Optional<Literal> lowerAtLeast(Term term, List<Literal> literals, int k, boolean sign,
                                           boolean isRoot, boolean redundant) {
        boolean unconditional = ReificationPolicy.isUnconditional(isRoot, context.scopeDepth());

        if (unconditional && sign) {
            ThresholdArithmetic.CardinalityThreshold negated = ThresholdArithmetic.negateCardinality(literals, k);
            int negatedThreshold = negated.threshold().getValue();
            LOGGER.finest("Asserzione negata di " + term + " con soglia " + negatedThreshold);
            context.addCardinality(null, negated.literals(), negatedThreshold, redundant);
            return Optional.empty();
        }

        if (unconditional) {
            context.addCardinality(null, literals, k, redundant);
            return Optional.empty();
        }

        Literal tag = Literal.positive(context.mintVariable(true));
        context.addCardinality(tag, literals, k, redundant);
        context.cache(term, tag);
        return Optional.of(tag.withSign(sign));
    }

    /**
     * La soglia n + 1 - k di un'asserzione negata alla radice va convertita prima
     * che gli operandi siano internalizzati.
     */
    private void requireNegatedThreshold(int n, int k, boolean sign, boolean isRoot)
            throws CoefficientOutOfRangeException {
        if (sign && ReificationPolicy.isUnconditional(isRoot, context.scopeDepth())) {
            ThresholdArithmetic.negatedCardinalityThreshold(n, k).orElseReject();
        }
    }
}
