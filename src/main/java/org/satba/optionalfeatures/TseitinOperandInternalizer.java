package org.satba.optionalfeatures;

import org.satba.ba.BooleanAlgebraInternalizer;
import org.satba.ba.CoefficientOutOfRangeException;
import org.satba.ba.InternalizationContext;
import org.satba.ba.OperandInternalizer;
import org.satba.ba.UnsupportedOperatorException;
import org.satba.support.ConstraintStore;
import org.satba.support.Literal;
import org.satba.term.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * TRASFORMAZIONE DI TSEITIN - Letterali per gli operandi dei vincoli
 *
 * Produce un letterale per ogni sottotermine che compare come operando di un
 * vincolo di soglia o di una catena di biimplicazioni, introducendo variabili
 * di definizione per le sottostrutture booleane.
 *
 * CASI GESTITI:
 * • ATOM → variabile simbolica dello store, creata al primo uso
 * • NOT → complemento del letterale dell'operando
 * • AND / OR → variabile t con clausole di equivalenza t ↔ sottostruttura
 * • TRUE / FALSE → variabile costante fissata da una clausola unitaria
 * • soglie e biimplicazioni → rientro nell'internalizzatore di algebra booleana
 *
 * CLAUSOLE DI EQUIVALENZA:
 * t ↔ (a1 ∧ ... ∧ an):  (¬t ∨ ai) per ogni i,  (t ∨ ¬a1 ∨ ... ∨ ¬an)
 * t ↔ (a1 ∨ ... ∨ an):  (t ∨ ¬ai) per ogni i,  (¬t ∨ a1 ∨ ... ∨ an)
 *
 * Le variabili di definizione sono registrate nella cache del contesto, quindi
 * la stessa istanza di sottotermine produce sempre lo stesso letterale.
 */
public class TseitinOperandInternalizer implements OperandInternalizer {

    private static final Logger LOGGER = Logger.getLogger(TseitinOperandInternalizer.class.getName());

    private final ConstraintStore store;

    public TseitinOperandInternalizer(ConstraintStore store) {
        if (store == null) {
            throw new IllegalArgumentException("Store non può essere null");
        }
        this.store = store;
    }

    @Override
    public Literal internalizeOperand(Term operand, InternalizationContext context, boolean redundant)
            throws CoefficientOutOfRangeException {
        return switch (operand.getType()) {
            case ATOM -> Literal.positive(store.getOrCreateVariable(operand.getAtom()));
            case NOT -> internalizeOperand(operand.getOperand(0), context, redundant).negate();
            case TRUE -> constant(operand, context, false);
            case FALSE -> constant(operand, context, true);
            case AND -> definition(operand, context, redundant, true);
            case OR -> definition(operand, context, redundant, false);
            case AT_LEAST_K, AT_MOST_K, PB_GE, PB_LE, PB_EQ, IFF -> reenter(operand, context, redundant);
            case XOR -> throw new UnsupportedOperatorException(operand.getType(), operand);
        };
    }

    //region SOTTOSTRUTTURE BOOLEANE

    /**
     * Variabile di definizione per una congiunzione (conjunction=true) o disgiunzione.
     */
    private Literal definition(Term structure, InternalizationContext context, boolean redundant,
                               boolean conjunction) throws CoefficientOutOfRangeException {
        Optional<Literal> cached = context.lookup(structure);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<Literal> operands = new ArrayList<>(structure.getOperandCount());
        for (Term operand : structure.getOperands()) {
            Literal literal = internalizeOperand(operand, context, redundant);
            context.markExternal(literal.getVariable());
            operands.add(literal);
        }

        // Per la disgiunzione si applicano le stesse clausole con polarità invertite
        Literal definition = Literal.positive(context.mintVariable(false));
        Literal head = conjunction ? definition : definition.negate();

        List<Literal> closing = new ArrayList<>(operands.size() + 1);
        closing.add(head);
        for (Literal literal : operands) {
            Literal body = conjunction ? literal : literal.negate();
            context.addClause(head.negate(), body);
            closing.add(body.negate());
        }
        context.addClause(closing);

        context.cache(structure, definition);
        LOGGER.finest("Definizione Tseitin " + definition + " ↔ " + structure);
        return definition;
    }

    /**
     * Costante booleana: variabile fissata a vero, complementata per FALSE.
     */
    private Literal constant(Term term, InternalizationContext context, boolean falsity) {
        Optional<Literal> cached = context.lookup(term);
        Literal truth = cached.orElseGet(() -> {
            Literal fresh = Literal.positive(context.mintVariable(false));
            context.addClause(fresh);
            context.cache(term, fresh);
            return fresh;
        });
        return truth.withSign(falsity);
    }

    //endregion

    //region RIENTRO

    private Literal reenter(Term operand, InternalizationContext context, boolean redundant)
            throws CoefficientOutOfRangeException {
        Optional<Literal> literal = new BooleanAlgebraInternalizer(context)
                .internalize(operand, false, false, redundant);
        return literal.orElseThrow(() -> new IllegalStateException(
                "Operando reificato senza letterale: " + operand));
    }

    //endregion
}
