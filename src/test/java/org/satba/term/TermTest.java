package org.satba.term;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TermTest {

    private static final Term A = Term.atom("a");
    private static final Term B = Term.atom("b");

    @Test
    @DisplayName("Costruttori accettano liste immutabili")
    void testImmutableOperandLists_Accepted() {
        assertAll(
                () -> assertDoesNotThrow(() -> Term.atLeast(1, A, B)),
                () -> assertDoesNotThrow(() -> Term.and(List.of(A, B))),
                () -> assertDoesNotThrow(() -> Term.xor(List.of(A, B))),
                () -> assertDoesNotThrow(() -> Term.pbGe(List.of(BigDecimal.ONE, BigDecimal.TEN),
                        List.of(A, B), BigDecimal.ONE)),
                () -> assertEquals(2, Term.atMost(BigDecimal.ONE, List.of(A, B)).getOperandCount())
        );
    }

    @Test
    @DisplayName("Operandi o coefficienti null sono rifiutati")
    void testNullElements_Rejected() {
        assertAll(
                () -> assertThrows(IllegalArgumentException.class, () -> Term.or(Arrays.asList(A, null))),
                () -> assertThrows(IllegalArgumentException.class, () -> Term.or(null)),
                () -> assertThrows(IllegalArgumentException.class,
                        () -> Term.pbLe(Arrays.asList(BigDecimal.ONE, null), List.of(A, B), BigDecimal.ONE)),
                () -> assertThrows(IllegalArgumentException.class,
                        () -> Term.pbEq(List.of(BigDecimal.ONE), List.of(A, B), BigDecimal.ONE))
        );
    }
}
