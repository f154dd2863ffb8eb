package org.satba.ba;

import org.satba.support.Literal;
import org.satba.term.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * RACCOLTA DELLE CATENE DI BIIMPLICAZIONI
 *
 * Una catena annidata a destra x1 ↔ (x2 ↔ (... ↔ xm)) diventa un unico vincolo
 * di parità dispari sulla variabile di chiusura v e sugli operandi:
 *
 *   [¬v, ¬x1, ..., ¬x(m-1), xm]
 *
 * Il vincolo vale esattamente quando v ↔ catena. Non viene mai asserito senza
 * tag: il chiamante riceve sempre il letterale di v.
 */
final class ParityChainCollector {

    private static final Logger LOGGER = Logger.getLogger(ParityChainCollector.class.getName());

    private final InternalizationContext context;

    ParityChainCollector(InternalizationContext context) {
        this.context = context;
    }

    Literal collect(Term chain, boolean sign, boolean redundant) throws CoefficientOutOfRangeException {
        int closer = context.mintVariable(true);
        List<Literal> literals = new ArrayList<>();
        literals.add(Literal.negative(closer));

        Term remainder = chain;
        while (remainder.isIff()) {
            literals.add(context.internalizeOperand(remainder.getOperand(0), redundant));
            remainder = remainder.getOperand(1);
        }
        literals.add(context.internalizeOperand(remainder, redundant));

        for (int i = 1; i + 1 < literals.size(); i++) {
            literals.set(i, literals.get(i).negate());
        }

        context.addParity(literals, redundant);
        Literal last = literals.get(literals.size() - 1);
        context.getCircuitSimplifier().addParity(last.negate(), List.copyOf(literals.subList(1, literals.size())));
        LOGGER.finest("Catena di " + (literals.size() - 1) + " operandi chiusa su b" + closer);

        Literal result = Literal.positive(closer);
        context.cache(chain, result);
        return result.withSign(sign);
    }
}
