package org.satba.ba;

import org.satba.support.*;
import org.satba.term.Term;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * PROIEZIONE INVERSA - Dai vincoli memorizzati alle formule
 *
 * Ricostruisce un termine per ogni vincolo dello store, nell'ordine di inserimento:
 * • cardinalità → atleast(k: ...)
 * • pseudo-booleano → pb(c1 l1 + ... >= k)
 * • parità → xor(...)
 * I vincoli reificati diventano tag ↔ corpo.
 */
public final class ReverseProjector {

    private final ConstraintStore store;

    public ReverseProjector(ConstraintStore store) {
        if (store == null) {
            throw new IllegalArgumentException("Store non può essere null");
        }
        this.store = store;
    }

    /**
     * @throws IllegalStateException se il backend non conserva i vincoli in memoria
     */
    static ReverseProjector of(SolverBackend backend) {
        if (backend instanceof ConstraintStore constraintStore) {
            return new ReverseProjector(constraintStore);
        }
        throw new IllegalStateException("Proiezione inversa non disponibile per il backend "
                + backend.getClass().getSimpleName());
    }

    public List<Term> toFormulas(Function<Literal, Term> projector) {
        List<Term> formulas = new ArrayList<>();
        for (BooleanConstraint constraint : store.getConstraints()) {
            formulas.add(toFormula(constraint, projector));
        }
        return formulas;
    }

    public static Term toFormula(BooleanConstraint constraint, Function<Literal, Term> projector) {
        Term body = switch (constraint.type()) {
            case CARDINALITY -> {
                CardinalityConstraint cardinality = (CardinalityConstraint) constraint;
                yield Term.atLeast(BigDecimal.valueOf(cardinality.getThreshold()),
                        project(cardinality.getLiterals(), projector));
            }
            case PSEUDO_BOOLEAN -> {
                PseudoBooleanConstraint pb = (PseudoBooleanConstraint) constraint;
                List<BigDecimal> coefficients = new ArrayList<>();
                List<Literal> literals = new ArrayList<>();
                for (WeightedLiteral weightedLiteral : pb.getWeightedLiterals()) {
                    coefficients.add(BigDecimal.valueOf(weightedLiteral.getCoefficient()));
                    literals.add(weightedLiteral.getLiteral());
                }
                yield Term.pbGe(coefficients, project(literals, projector), BigDecimal.valueOf(pb.getThreshold()));
            }
            case PARITY -> Term.xor(project(((ParityConstraint) constraint).getLiterals(), projector));
        };
        return constraint.getTag()
                .map(tag -> Term.iff(projector.apply(tag), body))
                .orElse(body);
    }

    private static List<Term> project(List<Literal> literals, Function<Literal, Term> projector) {
        List<Term> projected = new ArrayList<>(literals.size());
        for (Literal literal : literals) {
            projected.add(projector.apply(literal));
        }
        return projected;
    }

    /**
     * Proiezione standard: nome simbolico della variabile, oppure "_b&lt;id&gt;" per le
     * variabili generate, negato con NOT per i letterali negativi.
     */
    public static Function<Literal, Term> variableProjection(ConstraintStore store) {
        return literal -> {
            String name = store.getVariableName(literal.getVariable())
                    .orElse("_b" + literal.getVariable());
            Term atom = Term.atom(name);
            return literal.isNegated() ? Term.not(atom) : atom;
        };
    }
}
