package org.satba.ba;

import org.satba.optionalfeatures.TseitinOperandInternalizer;
import org.satba.support.*;
import org.satba.term.Term;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class BooleanAlgebraInternalizerTest {

    private ConstraintStore store;
    private InternalizationContext context;
    private BooleanAlgebraInternalizer internalizer;

    @BeforeEach
    void setUp() {
        store = new ConstraintStore();
        context = new InternalizationContext(store, new TseitinOperandInternalizer(store));
        internalizer = new BooleanAlgebraInternalizer(context);
    }

    private static Term x(int index) {
        return Term.atom("x" + index);
    }

    private static List<BigDecimal> coefficients(long... values) {
        return java.util.Arrays.stream(values).mapToObj(BigDecimal::valueOf).toList();
    }

    /** Un costruttore per ogni famiglia di termini gestita */
    private static List<Supplier<Term>> supportedTerms() {
        return List.of(
                () -> Term.atLeast(2, x(1), x(2), x(3)),
                () -> Term.atMost(1, x(1), x(2), x(3)),
                () -> Term.pbGe(coefficients(2, 3, 1), List.of(x(1), x(2), x(3)), BigDecimal.valueOf(4)),
                () -> Term.pbLe(coefficients(2, 3, 1), List.of(x(1), x(2), x(3)), BigDecimal.valueOf(3)),
                () -> Term.pbEq(coefficients(2, 1, 1), List.of(x(1), x(2), x(3)), BigDecimal.valueOf(2)),
                () -> Term.pbEq(coefficients(1, 1, 1), List.of(x(1), x(2), x(3)), BigDecimal.ONE),
                () -> Term.iffChain(List.of(x(1), x(2), x(3)))
        );
    }

    @Nested
    @DisplayName("Scenari concreti")
    class ConcreteScenarioTests {

        @Test
        @DisplayName("atmost(2: x1, x2, x3) alla radice → atleast(1: ¬x1, ¬x2, ¬x3) senza reificazione")
        void testAtMostAtRoot_AssertsComplementedAtLeast() throws CoefficientOutOfRangeException {
            Term term = Term.atMost(2, x(1), x(2), x(3));

            Optional<Literal> result = internalizer.internalize(term, false, true);

            assertTrue(result.isEmpty(), "Asserzione incondizionata non restituisce letterali");
            assertEquals(3, store.getVariableCount(), "Nessuna variabile di reificazione");
            CardinalityConstraint constraint = (CardinalityConstraint) store.getConstraints().get(0);
            assertAll(
                    () -> assertFalse(constraint.hasTag()),
                    () -> assertEquals(1, constraint.getThreshold()),
                    () -> assertEquals(List.of(Literal.negative(1), Literal.negative(2), Literal.negative(3)),
                            constraint.getLiterals())
            );
            new BruteForceOracle(store).assertEnforces(term, true);
        }

        @Test
        @DisplayName("pb(2 x1 + 3 x2 + 1 x3 >= 4) negato non alla radice → tag v e letterale ¬v")
        void testNegatedPbGe_ReturnsNegatedTag() throws CoefficientOutOfRangeException {
            Term term = Term.pbGe(coefficients(2, 3, 1), List.of(x(1), x(2), x(3)), BigDecimal.valueOf(4));

            Literal result = internalizer.internalize(term, true, false).orElseThrow();

            assertEquals(Literal.negative(4), result);
            PseudoBooleanConstraint constraint = (PseudoBooleanConstraint) store.getConstraints().get(0);
            assertAll(
                    () -> assertEquals(Optional.of(Literal.positive(4)), constraint.getTag()),
                    () -> assertEquals(4, constraint.getThreshold()),
                    () -> assertTrue(store.isExternal(4))
            );
            new BruteForceOracle(store).assertDefines(result, Term.not(term));
        }

        @Test
        @DisplayName("pb(2 x1 + 3 x2 + 1 x3 >= 4) negato alla radice → Σ c·¬x ≥ C + 1 - k = 3")
        void testNegatedPbGeAtRoot_UsesComplementedThreshold() throws CoefficientOutOfRangeException {
            Term term = Term.pbGe(coefficients(2, 3, 1), List.of(x(1), x(2), x(3)), BigDecimal.valueOf(4));

            assertTrue(internalizer.internalize(term, true, true).isEmpty());

            PseudoBooleanConstraint constraint = (PseudoBooleanConstraint) store.getConstraints().get(0);
            assertAll(
                    () -> assertFalse(constraint.hasTag()),
                    () -> assertEquals(3, constraint.getThreshold()),
                    () -> assertEquals(new WeightedLiteral(2, Literal.negative(1)),
                            constraint.getWeightedLiterals().get(0))
            );
            new BruteForceOracle(store).assertEnforces(term, false);
        }

        @Test
        @DisplayName("atmost(1: x1, x2, x3) negato alla radice → atleast(2: x1, x2, x3) sui letterali originali")
        void testNegatedAtMostAtRoot_ComplementsTwice() throws CoefficientOutOfRangeException {
            Term term = Term.atMost(1, x(1), x(2), x(3));

            assertTrue(internalizer.internalize(term, true, true).isEmpty());

            CardinalityConstraint constraint = (CardinalityConstraint) store.getConstraints().get(0);
            assertAll(
                    () -> assertEquals(1, store.getConstraintCount()),
                    () -> assertEquals(2, constraint.getThreshold()),
                    () -> assertEquals(List.of(Literal.positive(1), Literal.positive(2), Literal.positive(3)),
                            constraint.getLiterals())
            );
            new BruteForceOracle(store).assertEnforces(term, false);
        }

        @Test
        @DisplayName("pb(2 x1 + 3 x2 + 1 x3 <= 3) negato alla radice → Σ c·x ≥ 4")
        void testNegatedPbLeAtRoot_ComplementsTwice() throws CoefficientOutOfRangeException {
            Term term = Term.pbLe(coefficients(2, 3, 1), List.of(x(1), x(2), x(3)), BigDecimal.valueOf(3));

            assertTrue(internalizer.internalize(term, true, true).isEmpty());

            PseudoBooleanConstraint constraint = (PseudoBooleanConstraint) store.getConstraints().get(0);
            assertAll(
                    () -> assertEquals(4, constraint.getThreshold()),
                    () -> assertEquals(List.of(new WeightedLiteral(2, Literal.positive(1)),
                                    new WeightedLiteral(3, Literal.positive(2)),
                                    new WeightedLiteral(1, Literal.positive(3))),
                            constraint.getWeightedLiterals())
            );
            new BruteForceOracle(store).assertEnforces(term, false);
        }
    }

    @Nested
    @DisplayName("Dualità della negazione")
    class NegationDualityTests {

        @Test
        @DisplayName("sign=true restituisce il complemento del letterale di sign=false")
        void testNegatedLiteral_IsComplementOfPositive() throws CoefficientOutOfRangeException {
            for (Supplier<Term> factory : supportedTerms()) {
                setUp();
                Term term = factory.get();

                Literal positive = internalizer.internalize(term, false, false).orElseThrow();
                Literal negative = internalizer.internalize(term, true, false).orElseThrow();

                assertEquals(positive.negate(), negative, "Dualità violata per " + term);
                new BruteForceOracle(store).assertDefines(positive, term);
            }
        }

        @Test
        @DisplayName("Senza cache, il letterale negato definisce la negazione del termine")
        void testNegatedLiteral_DefinesNegation() throws CoefficientOutOfRangeException {
            for (Supplier<Term> factory : supportedTerms()) {
                setUp();
                Term term = factory.get();

                Literal negative = internalizer.internalize(term, true, false).orElseThrow();

                new BruteForceOracle(store).assertDefines(negative, Term.not(term));
            }
        }

        @Test
        @DisplayName("Alla radice, sign=true impone la negazione del termine")
        void testNegatedRootAssertion_EnforcesNegation() throws CoefficientOutOfRangeException {
            for (Supplier<Term> factory : supportedTerms()) {
                setUp();
                Term term = factory.get();

                internalizer.internalize(term, true, true).ifPresent(literal -> context.addClause(literal));

                new BruteForceOracle(store).assertEnforces(term, false);
            }
        }

        @Test
        @DisplayName("Alla radice, sign=false impone il termine")
        void testRootAssertion_EnforcesTerm() throws CoefficientOutOfRangeException {
            for (Supplier<Term> factory : supportedTerms()) {
                setUp();
                Term term = factory.get();

                internalizer.assertRoot(term);

                new BruteForceOracle(store).assertEnforces(term, true);
            }
        }
    }

    @Nested
    @DisplayName("Uguaglianze")
    class EqualityTests {

        private final Term equality =
                Term.pbEq(coefficients(2, 1, 1), List.of(x(1), x(2), x(3)), BigDecimal.valueOf(2));

        @Test
        @DisplayName("Il combinatore equivale a (≥ k) ∧ (≤ k)")
        void testCombinator_EquivalentToConjunctionOfHalves() throws CoefficientOutOfRangeException {
            Literal combined = internalizer.internalize(equality, false, false).orElseThrow();

            Term halves = Term.and(List.of(
                    Term.pbGe(equality.getCoefficients(), equality.getOperands(), equality.getThreshold()),
                    Term.pbLe(equality.getCoefficients(), equality.getOperands(), equality.getThreshold())));
            assertAll(
                    () -> assertEquals(2, store.getConstraintCount()),
                    () -> assertEquals(3, store.getClauseCount()),
                    () -> assertFalse(store.isExternal(combined.getVariable()))
            );
            new BruteForceOracle(store).assertDefines(combined, halves);
        }

        @Test
        @DisplayName("Alla radice senza negazione: due metà senza tag e nessun combinatore")
        void testRootEquality_AssertsBothHalvesWithoutCombinator() throws CoefficientOutOfRangeException {
            assertTrue(internalizer.internalize(equality, false, true).isEmpty());

            assertAll(
                    () -> assertEquals(2, store.getConstraintCount()),
                    () -> assertEquals(0, store.getClauseCount()),
                    () -> assertEquals(3, store.getVariableCount()),
                    () -> assertTrue(store.getConstraints().stream().noneMatch(BooleanConstraint::hasTag))
            );
        }

        @Test
        @DisplayName("Alla radice con negazione serve il combinatore")
        void testNegatedRootEquality_UsesCombinator() throws CoefficientOutOfRangeException {
            Optional<Literal> result = internalizer.internalize(equality, true, true);

            assertTrue(result.isPresent());
            assertTrue(result.get().isNegated());
            assertEquals(3, store.getClauseCount());
        }

        @Test
        @DisplayName("Alla radice con scope aperti serve il combinatore, anche per exactly")
        void testRootEqualityInsideScope_UsesCombinator() throws CoefficientOutOfRangeException {
            Term exactly = Term.pbEq(coefficients(1, 1), List.of(x(1), x(2)), BigDecimal.ONE);
            context.pushScope();

            Optional<Literal> result = internalizer.internalize(exactly, false, true);

            assertTrue(result.isPresent());
            assertTrue(store.getConstraints().stream().allMatch(BooleanConstraint::hasTag));
        }
    }

    @Nested
    @DisplayName("Coefficienti unitari")
    class UnitCoefficientTests {

        @Test
        @DisplayName("pb con coefficienti 1 e ≥ diventa un vincolo di cardinalità")
        void testUnitPbGe_UsesCardinalityPath() throws CoefficientOutOfRangeException {
            Term weighted = Term.pbGe(coefficients(1, 1, 1), List.of(x(1), x(2), x(3)), BigDecimal.valueOf(2));

            internalizer.internalize(weighted, false, true);

            CardinalityConstraint constraint = (CardinalityConstraint) store.getConstraints().get(0);
            assertEquals(2, constraint.getThreshold());
            new BruteForceOracle(store).assertEnforces(Term.atLeast(2, x(1), x(2), x(3)), true);
        }

        @Test
        @DisplayName("pb con coefficienti 1 e ≤ equivale ad atmost")
        void testUnitPbLe_EquivalentToAtMost() throws CoefficientOutOfRangeException {
            Term weighted = Term.pbLe(coefficients(1, 1, 1), List.of(x(1), x(2), x(3)), BigDecimal.ONE);

            Literal literal = internalizer.internalize(weighted, false, false).orElseThrow();

            assertEquals(BooleanConstraint.Type.CARDINALITY, store.getConstraints().get(0).type());
            new BruteForceOracle(store).assertDefines(literal, Term.atMost(1, x(1), x(2), x(3)));
        }
    }

    @Nested
    @DisplayName("Asserzioni ripetute e cache")
    class CachingTests {

        @Test
        @DisplayName("Lo stesso termine alla radice due volte, con entrambi i segni, non cambia i modelli")
        void testRootAssertion_Idempotent() throws CoefficientOutOfRangeException {
            for (Supplier<Term> factory : supportedTerms()) {
                for (boolean sign : new boolean[]{false, true}) {
                    setUp();
                    Term term = factory.get();

                    internalizer.internalize(term, sign, true).ifPresent(literal -> context.addClause(literal));
                    internalizer.internalize(term, sign, true).ifPresent(literal -> context.addClause(literal));

                    new BruteForceOracle(store).assertEnforces(term, !sign);
                }
            }
        }

        @Test
        @DisplayName("Una catena già usata come operando e poi asserita alla radice riusa la variabile di chiusura")
        void testNestedThenRootChain_ReusesCloser() throws CoefficientOutOfRangeException {
            Term chain = Term.iffChain(List.of(x(1), x(2), x(3)));

            Literal nested = internalizer.internalize(chain, false, false).orElseThrow();
            Literal root = internalizer.internalize(chain, false, true).orElseThrow();
            context.addClause(root);

            assertAll(
                    () -> assertEquals(nested, root),
                    () -> assertEquals(1, store.getConstraintCount()),
                    () -> assertEquals(1, context.getStatistics().getCacheHits())
            );
            new BruteForceOracle(store).assertEnforces(chain, true);
        }

        @Test
        @DisplayName("Un'uguaglianza negata asserita due volte alla radice riusa il combinatore")
        void testNegatedRootEquality_ReusesCombinator() throws CoefficientOutOfRangeException {
            Term term = Term.pbEq(coefficients(2, 1, 1), List.of(x(1), x(2), x(3)), BigDecimal.valueOf(2));

            Literal first = internalizer.internalize(term, true, true).orElseThrow();
            Literal second = internalizer.internalize(term, true, true).orElseThrow();

            assertAll(
                    () -> assertEquals(first, second),
                    () -> assertEquals(2, store.getConstraintCount())
            );
        }

        @Test
        @DisplayName("Un sottotermine già internalizzato riusa il letterale in cache")
        void testCachedTerm_ReusesLiteral() throws CoefficientOutOfRangeException {
            Term term = Term.atLeast(1, x(1), x(2));

            Literal first = internalizer.internalize(term, false, false).orElseThrow();
            Literal second = internalizer.internalize(term, false, false).orElseThrow();

            assertAll(
                    () -> assertEquals(first, second),
                    () -> assertEquals(1, store.getConstraintCount()),
                    () -> assertEquals(1, context.getStatistics().getCacheHits())
            );
        }

        @Test
        @DisplayName("La cache usa l'identità: un termine uguale ma distinto produce un nuovo vincolo")
        void testCache_KeyedByIdentity() throws CoefficientOutOfRangeException {
            internalizer.internalize(Term.atLeast(1, x(1), x(2)), false, false);
            internalizer.internalize(Term.atLeast(1, x(1), x(2)), false, false);

            assertEquals(2, store.getConstraintCount());
        }

        @Test
        @DisplayName("Il flag redundant è riportato sui vincoli prodotti")
        void testRedundantFlag_PropagatedToConstraints() throws CoefficientOutOfRangeException {
            internalizer.internalize(new InternalizationRequest(
                    Term.pbEq(coefficients(2, 1), List.of(x(1), x(2)), BigDecimal.valueOf(2)), false, false, true));

            assertTrue(store.getConstraints().stream().allMatch(BooleanConstraint::isRedundant));
        }
    }

    @Nested
    @DisplayName("Termini rifiutati")
    class RejectionTests {

        private void assertRejectedWithoutTrace(Term term) {
            assertThrows(CoefficientOutOfRangeException.class, () -> internalizer.internalize(term, false, true));
            assertAll(
                    () -> assertEquals(0, store.getVariableCount(), "Nessuna variabile allocata"),
                    () -> assertEquals(0, store.getConstraintCount(), "Nessun vincolo memorizzato"),
                    () -> assertEquals(0, store.getClauseCount(), "Nessuna clausola memorizzata"),
                    () -> assertEquals(1, context.getStatistics().getRejectedTerms())
            );
        }

        @Test
        @DisplayName("Coefficiente negativo")
        void testNegativeCoefficient() {
            assertRejectedWithoutTrace(
                    Term.pbGe(coefficients(2, -1), List.of(x(1), x(2)), BigDecimal.ONE));
        }

        @Test
        @DisplayName("Soglia frazionaria")
        void testFractionalThreshold() {
            assertRejectedWithoutTrace(Term.atLeast(new BigDecimal("1.5"), List.of(x(1), x(2))));
        }

        @Test
        @DisplayName("Coefficiente oltre la larghezza intera")
        void testCoefficientBeyondIntWidth() {
            assertRejectedWithoutTrace(Term.pbGe(
                    List.of(new BigDecimal("4294967296"), BigDecimal.ONE), List.of(x(1), x(2)), BigDecimal.ONE));
        }

        @Test
        @DisplayName("Peso totale oltre la larghezza intera")
        void testTotalWeightBeyondIntWidth() {
            assertRejectedWithoutTrace(Term.pbGe(
                    coefficients(Integer.MAX_VALUE, 2), List.of(x(1), x(2)), BigDecimal.ONE));
        }

        @Test
        @DisplayName("atmost con k > n produce una soglia derivata negativa")
        void testAtMostBeyondOperandCount() {
            assertRejectedWithoutTrace(Term.atMost(3, x(1), x(2)));
        }

        @Test
        @DisplayName("Un vincolo annidato non valido rifiuta l'intero termine")
        void testInvalidNestedOperand() {
            Term nested = Term.pbGe(coefficients(-1), List.of(x(2)), BigDecimal.ONE);
            assertRejectedWithoutTrace(Term.atLeast(1, x(1), Term.and(List.of(x(3), nested))));
        }
    }

    @Nested
    @DisplayName("Operatori non supportati")
    class UnsupportedOperatorTests {

        @Test
        @DisplayName("Congiunzioni e atomi sono violazioni di contratto")
        void testUnsupportedOperators_Throw() {
            UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class,
                    () -> internalizer.internalize(Term.and(List.of(x(1), x(2))), false, true));

            assertEquals(Term.Type.AND, e.getOperator());
            assertThrows(UnsupportedOperatorException.class, () -> internalizer.internalize(x(1), false, false));
            assertEquals(0, store.getVariableCount());
        }
    }

    @Nested
    @DisplayName("Operandi annidati")
    class NestedOperandTests {

        @Test
        @DisplayName("Vincoli di soglia, catene e strutture booleane come operandi")
        void testNestedOperands_PreserveSemantics() throws CoefficientOutOfRangeException {
            List<Term> terms = List.of(
                    Term.atLeast(1, Term.atMost(1, x(1), x(2)), x(3)),
                    Term.pbGe(coefficients(2, 1), List.of(Term.iff(x(1), x(2)), x(3)), BigDecimal.valueOf(2)),
                    Term.atLeast(2, Term.and(List.of(x(1), x(2))), Term.not(x(3)), Term.or(List.of(x(1), x(3)))),
                    Term.atLeast(2, Term.trueTerm(), x(1), Term.falseTerm()));

            for (Term term : terms) {
                setUp();
                internalizer.assertRoot(term);
                new BruteForceOracle(store).assertEnforces(term, true);
            }
        }

        @Test
        @DisplayName("Le variabili degli operandi sono marcate esterne")
        void testOperandVariables_MarkedExternal() throws CoefficientOutOfRangeException {
            internalizer.internalize(Term.atLeast(1, x(1), Term.not(x(2))), false, true);

            assertTrue(store.isExternal(store.findVariable("x1").orElseThrow()));
            assertTrue(store.isExternal(store.findVariable("x2").orElseThrow()));
        }
    }

    @Nested
    @DisplayName("Scope di backtracking")
    class ScopeTests {

        @Test
        @DisplayName("Alla radice con scope aperti il vincolo è reificato")
        void testRootInsideScope_IsReified() throws CoefficientOutOfRangeException {
            context.pushScope();

            Optional<Literal> result = internalizer.internalize(Term.atLeast(1, x(1), x(2)), false, true);

            assertTrue(result.isPresent());
            assertTrue(store.getConstraints().get(0).hasTag());
        }

        @Test
        @DisplayName("pop ritrae vincoli e voci di cache dello scope")
        void testPop_RetractsConstraintsAndCache() throws CoefficientOutOfRangeException {
            Term outer = Term.atLeast(1, x(1), x(2));
            Term inner = Term.atLeast(2, x(1), x(2));
            Literal outerLiteral = internalizer.internalize(outer, false, false).orElseThrow();

            context.pushScope();
            Literal innerLiteral = internalizer.internalize(inner, false, false).orElseThrow();
            context.popScope();

            assertAll(
                    () -> assertEquals(1, store.getConstraintCount()),
                    () -> assertEquals(1, context.cacheSize()),
                    () -> assertEquals(Optional.of(outerLiteral), context.lookup(outer))
            );
            Literal reinternalized = internalizer.internalize(inner, false, false).orElseThrow();
            assertNotEquals(innerLiteral, reinternalized, "Dopo il pop il termine è internalizzato di nuovo");
        }
    }
}
