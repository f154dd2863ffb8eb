package org.satba.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScopeStackTest {

    @Test
    @DisplayName("push e pop restituiscono i marcatori in ordine LIFO")
    void testPushPop_Lifo() {
        ScopeStack stack = new ScopeStack();
        stack.push(0, 1);
        stack.push(2, 3);

        assertEquals(2, stack.depth());
        assertEquals(new ScopeStack.ScopeMark(2, 3), stack.pop());
        assertEquals(new ScopeStack.ScopeMark(0, 1), stack.pop());
        assertTrue(stack.isAtRootLevel());
    }

    @Test
    @DisplayName("Il livello radice non si può chiudere")
    void testPopAtRoot_Throws() {
        assertThrows(IllegalStateException.class, () -> new ScopeStack().pop());
    }

    @Test
    @DisplayName("Marcatori negativi o non monotoni sono rifiutati")
    void testInvalidMarks_Rejected() {
        ScopeStack stack = new ScopeStack();
        stack.push(3, 3);

        assertAll(
                () -> assertThrows(IllegalArgumentException.class, () -> stack.push(-1, 0)),
                () -> assertThrows(IllegalStateException.class, () -> stack.push(2, 5)),
                () -> assertEquals(1, stack.depth())
        );
    }
}
