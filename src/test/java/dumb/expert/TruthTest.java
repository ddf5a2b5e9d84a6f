package dumb.expert;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static dumb.expert.Truth.*;
import static org.junit.jupiter.api.Assertions.*;

class TruthTest {

    @ParameterizedTest
    @CsvSource({
            "TRUE, TRUE, TRUE, TRUE, FALSE, TRUE, TRUE",
            "TRUE, FALSE, FALSE, TRUE, TRUE, FALSE, FALSE",
            "FALSE, TRUE, FALSE, TRUE, TRUE, TRUE, FALSE",
            "FALSE, FALSE, FALSE, FALSE, FALSE, TRUE, TRUE",
            "TRUE, UNDETERMINED, UNDETERMINED, TRUE, UNDETERMINED, UNDETERMINED, UNDETERMINED",
            "FALSE, UNDETERMINED, FALSE, UNDETERMINED, UNDETERMINED, TRUE, UNDETERMINED",
            "UNDETERMINED, TRUE, UNDETERMINED, TRUE, UNDETERMINED, TRUE, UNDETERMINED",
            "UNDETERMINED, FALSE, FALSE, UNDETERMINED, UNDETERMINED, UNDETERMINED, UNDETERMINED",
            "UNDETERMINED, UNDETERMINED, UNDETERMINED, UNDETERMINED, UNDETERMINED, UNDETERMINED, UNDETERMINED"
    })
    void binaryOperators(Truth x, Truth y, Truth and, Truth or, Truth xor, Truth implies, Truth iff) {
        assertEquals(and, x.and(y), "and");
        assertEquals(or, x.or(y), "or");
        assertEquals(xor, x.xor(y), "xor");
        assertEquals(implies, x.implies(y), "implies");
        assertEquals(iff, x.iff(y), "iff");
        assertEquals(and, x.apply(Expr.Op.AND, y));
        assertEquals(iff, x.apply(Expr.Op.IFF, y));
    }

    @Test
    void not() {
        assertEquals(FALSE, TRUE.not());
        assertEquals(TRUE, FALSE.not());
        assertEquals(UNDETERMINED, UNDETERMINED.not());
    }

    @Test
    void notIsNotBinary() {
        assertThrows(IllegalArgumentException.class, () -> TRUE.apply(Expr.Op.NOT, TRUE));
    }

    @Test
    void known() {
        assertTrue(TRUE.known());
        assertTrue(FALSE.known());
        assertFalse(UNDETERMINED.known());
        assertEquals(TRUE, Truth.of(true));
        assertEquals(FALSE, Truth.of(false));
    }
}
