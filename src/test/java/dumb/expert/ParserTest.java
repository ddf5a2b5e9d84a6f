package dumb.expert;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static dumb.expert.Expr.*;
import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private static final Fact A = fact("A"), B = fact("B"), C = fact("C"), D = fact("D");

    @Test
    void andBindsTighterThanXorThanOr() throws SyntaxException {
        assertEquals(or(and(A, B), C), Parser.expression("A + B | C"));
        assertEquals(or(A, and(B, C)), Parser.expression("A | B + C"));
        assertEquals(or(xor(A, B), C), Parser.expression("A ^ B | C"));
        assertEquals(xor(A, and(B, C)), Parser.expression("A ^ B + C"));
    }

    @Test
    void notBindsTightest() throws SyntaxException {
        assertEquals(and(not(A), B), Parser.expression("!A + B"));
        assertEquals(not(not(A)), Parser.expression("!!A"));
        assertEquals(not(or(A, B)), Parser.expression("!(A | B)"));
    }

    @Test
    void leftAssociative() throws SyntaxException {
        assertEquals(and(and(A, B), C), Parser.expression("A + B + C"));
        assertEquals(or(or(A, B), C), Parser.expression("A | B | C"));
    }

    @Test
    void parentheses() throws SyntaxException {
        assertEquals(and(or(A, B), C), Parser.expression("(A | B) + C"));
        assertEquals(A, Parser.expression("((A))"));
    }

    @Test
    void implication() throws SyntaxException {
        var r = Parser.rule("A + B => C");
        assertEquals(Rule.implies(and(A, B), C), r);
        assertFalse(r.biconditional());
    }

    @Test
    void biconditional() throws SyntaxException {
        var r = Parser.rule("A | B <=> C + D");
        assertTrue(r.biconditional());
        assertEquals(or(A, B), r.condition());
        assertEquals(and(C, D), r.conclusion());
        assertEquals(Rule.implies(and(C, D), or(A, B)), r.reverse());
    }

    @Test
    void implicationBindsLooserThanOr() throws SyntaxException {
        var r = Parser.rule("A | B => C | D");
        assertEquals(or(A, B), r.condition());
        assertEquals(or(C, D), r.conclusion());
    }

    @Test
    void renderingParsesBack() throws SyntaxException {
        for (var text : List.of("A + !(B | C) => D", "(A + B) ^ C <=> !D", "!!A => B + C + D")) {
            var r = Parser.rule(text);
            assertEquals(r, Parser.rule(r.toString()), text);
        }
        assertEquals("A + !(B | C) => D", Parser.rule("A+!(B|C)=>D").toString());
    }

    @Test
    void bareExpressionIsNotARule() {
        var e = assertThrows(Parser.ParseException.class, () -> Parser.rule("A + B"));
        assertTrue(e.reason().startsWith("Expected a rule with '=>' or '<=>'"), e.getMessage());
        assertEquals(1, e.line());
        assertEquals(1, e.col());
    }

    @Test
    void missingClosingParenthesis() {
        var e = assertThrows(Parser.ParseException.class, () -> Parser.rule("A => (B + C"));
        assertTrue(e.reason().contains("Expected ')'"), e.getMessage());
        assertTrue(e.reason().contains("end of input"), e.getMessage());
    }

    @Test
    void missingOperand() {
        var e = assertThrows(Parser.ParseException.class, () -> Parser.rule("A => "));
        assertTrue(e.reason().startsWith("Expected '(' or FACT"), e.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {"A => B C", "A => B)", "A + => B", "=> B", "A => => B"})
    void malformedRules(String text) {
        assertThrows(SyntaxException.class, () -> Parser.rule(text));
    }

    @Test
    void tokenListMustEndWithEof() {
        assertThrows(IllegalArgumentException.class, () -> new Parser(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Parser(List.of(new Token(Token.Kind.FACT, "A", 1, 1))));
    }
}
