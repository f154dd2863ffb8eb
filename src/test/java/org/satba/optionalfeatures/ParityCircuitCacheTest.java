package org.satba.optionalfeatures;

import org.satba.support.Literal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParityCircuitCacheTest {

    @Test
    @DisplayName("Relazioni sulle stesse variabili sono raggruppate ignorando ordine e polarità")
    void testFindByInputs_IgnoresOrderAndPolarity() {
        ParityCircuitCache cache = new ParityCircuitCache();
        cache.addParity(Literal.positive(1), List.of(Literal.negative(2), Literal.positive(3)));
        cache.addParity(Literal.negative(4), List.of(Literal.positive(3), Literal.positive(2)));
        cache.addParity(Literal.positive(5), List.of(Literal.positive(2)));

        assertAll(
                () -> assertEquals(3, cache.size()),
                () -> assertEquals(2, cache.findByInputs(List.of(Literal.positive(2), Literal.negative(3))).size()),
                () -> assertEquals(1, cache.getDuplicateCount()),
                () -> assertTrue(cache.findByInputs(List.of(Literal.positive(9))).isEmpty())
        );
    }

    @Test
    @DisplayName("Gli ingressi registrati sono una copia immutabile")
    void testRelation_CopiesInputs() {
        ParityCircuitCache cache = new ParityCircuitCache();
        List<Literal> inputs = new java.util.ArrayList<>(List.of(Literal.positive(2)));
        cache.addParity(Literal.positive(1), inputs);
        inputs.add(Literal.positive(3));

        ParityCircuitCache.ParityRelation relation = cache.getRelations().get(0);
        assertEquals(List.of(Literal.positive(2)), relation.inputs());
        assertThrows(UnsupportedOperationException.class, () -> relation.inputs().clear());
        assertThrows(UnsupportedOperationException.class, () -> cache.getRelations().clear());
    }
}
