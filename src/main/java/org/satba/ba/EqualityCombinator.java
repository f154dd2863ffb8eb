package org.satba.ba;

import org.satba.support.Literal;
import org.satba.term.Term;

/**
 * Combinatore delle due metà di un'uguaglianza reificata: v ↔ (v1 ∧ v2).
 *
 * Clausole: (¬v ∨ v1), (¬v ∨ v2), (¬v1 ∨ ¬v2 ∨ v).
 */
final class EqualityCombinator {

    private EqualityCombinator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param lower tag della metà "≥ k"
     * @param upper tag della metà sui complementi
     * @return letterale del combinatore con il segno richiesto
     */
    static Literal combine(InternalizationContext context, Term term, Literal lower, Literal upper, boolean sign) {
        Literal combined = Literal.positive(context.mintVariable(false));
        context.addClause(combined.negate(), lower);
        context.addClause(combined.negate(), upper);
        context.addClause(lower.negate(), upper.negate(), combined);
        context.cache(term, combined);
        return combined.withSign(sign);
    }
}
