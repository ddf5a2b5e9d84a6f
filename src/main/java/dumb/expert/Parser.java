package dumb.expert;

import java.util.List;

import static dumb.expert.Token.Kind.*;

/**
 * Recursive-descent parser over a token list. Lowest to highest precedence:
 * <pre>
 * iff     = implies ( '&lt;=&gt;' implies )*
 * implies = or ( '=&gt;' or )*
 * or      = xor ( '|' xor )*
 * xor     = and ( '^' and )*
 * and     = not ( '+' not )*
 * not     = '!' not | primary
 * primary = '(' iff ')' | FACT
 * </pre>
 * All binary operators associate to the left.
 */
public class Parser {
    private final List<Token> tokens;
    private int pos;

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(EOF))
            throw new IllegalArgumentException("Token list must end with EOF");
        this.tokens = List.copyOf(tokens);
    }

    public static Rule rule(String text) throws SyntaxException {
        return new Parser(Lexer.tokenize(text)).parseRule();
    }

    public static Expr expression(String text) throws SyntaxException {
        return new Parser(Lexer.tokenize(text)).parseExpression();
    }

    /** A complete top-level statement whose root operator is {@code =>} or {@code <=>}. */
    public Rule parseRule() throws ParseException {
        var first = current();
        var e = parseIff();
        expectEnd();
        if (e instanceof Expr.Bin b) {
            if (b.op() == Expr.Op.IMPLIES) return Rule.implies(b.left(), b.right());
            if (b.op() == Expr.Op.IFF) return Rule.iff(b.left(), b.right());
        }
        throw new ParseException("Expected a rule with '=>' or '<=>', but got expression: " + e, first.line(), first.column());
    }

    public Expr parseExpression() throws ParseException {
        var e = parseIff();
        expectEnd();
        return e;
    }

    private Expr parseIff() throws ParseException {
        var left = parseImplies();
        while (current().is(IFF)) {
            advance();
            left = new Expr.Bin(Expr.Op.IFF, left, parseImplies());
        }
        return left;
    }

    private Expr parseImplies() throws ParseException {
        var left = parseOr();
        while (current().is(IMPLIES)) {
            advance();
            left = new Expr.Bin(Expr.Op.IMPLIES, left, parseOr());
        }
        return left;
    }

    private Expr parseOr() throws ParseException {
        var left = parseXor();
        while (current().is(OR)) {
            advance();
            left = Expr.or(left, parseXor());
        }
        return left;
    }

    private Expr parseXor() throws ParseException {
        var left = parseAnd();
        while (current().is(XOR)) {
            advance();
            left = Expr.xor(left, parseAnd());
        }
        return left;
    }

    private Expr parseAnd() throws ParseException {
        var left = parseNot();
        while (current().is(AND)) {
            advance();
            left = Expr.and(left, parseNot());
        }
        return left;
    }

    private Expr parseNot() throws ParseException {
        if (current().is(NOT)) {
            advance();
            return Expr.not(parseNot());
        }
        return parsePrimary();
    }

    private Expr parsePrimary() throws ParseException {
        var t = current();
        if (t.is(LPAREN)) {
            advance();
            var e = parseIff();
            expect(RPAREN);
            return e;
        }
        if (t.is(FACT)) {
            advance();
            return Expr.fact(t.lexeme());
        }
        throw unexpected("Expected '(' or FACT", t);
    }

    private Token current() {
        return tokens.get(Math.min(pos, tokens.size() - 1));
    }

    private Token advance() {
        var t = current();
        if (pos < tokens.size() - 1) pos++;
        return t;
    }

    private Token expect(Token.Kind kind) throws ParseException {
        var t = current();
        if (!t.is(kind)) throw unexpected("Expected '" + kind.symbol + "'", t);
        return advance();
    }

    private void expectEnd() throws ParseException {
        var t = current();
        if (!t.is(EOF)) throw unexpected("Unexpected trailing input", t);
    }

    private static ParseException unexpected(String message, Token found) {
        var what = found.is(EOF) ? "end of input" : found.kind() + " '" + found.lexeme() + "'";
        return new ParseException(message + ", got " + what, found.line(), found.column());
    }

    public static class ParseException extends SyntaxException {
        public ParseException(String message, int line, int col) {
            super(message, line, col);
        }
    }
}
