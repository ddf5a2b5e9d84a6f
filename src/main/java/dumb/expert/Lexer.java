package dumb.expert;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static dumb.expert.Token.Kind.*;

/**
 * Turns rule-file text into a flat token sequence terminated by {@link Token.Kind#EOF}.
 * Comments run from {@code #} to end of line; whitespace including newlines is skipped.
 */
public class Lexer {
    private final Reader reader;
    private int currentChar = -2;
    private int line = 1;
    private int col = 1;

    private Lexer(Reader reader) {
        this.reader = reader;
    }

    public static List<Token> tokenize(String text) throws LexException {
        try (var reader = new StringReader(text)) {
            return new Lexer(reader).tokens();
        } catch (IOException e) {
            throw new LexException("IO Error: " + e.getMessage(), -1, -1);
        }
    }

    private List<Token> tokens() throws IOException, LexException {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespaceAndComments();
            var c = peek();
            if (c == -1) break;
            tokens.add(token(c));
        }
        tokens.add(new Token(EOF, "", line, col));
        return tokens;
    }

    private Token token(int c) throws IOException, LexException {
        var startLine = line;
        var startCol = col;
        return switch (c) {
            case '(' -> single(LPAREN);
            case ')' -> single(RPAREN);
            case '!' -> single(NOT);
            case '+' -> single(AND);
            case '|' -> single(OR);
            case '^' -> single(XOR);
            case '?' -> single(QUERY);
            case '=' -> {
                consumeChar();
                if (peek() == '>') {
                    consumeChar();
                    yield new Token(IMPLIES, "=>", startLine, startCol);
                }
                yield new Token(EQUALS, "=", startLine, startCol);
            }
            case '<' -> {
                consumeChar();
                if (peek() != '=') throw new LexException("Invalid character '<'", startLine, startCol);
                consumeChar();
                if (peek() != '>') throw new LexException("Invalid character '<'", startLine, startCol);
                consumeChar();
                yield new Token(IFF, "<=>", startLine, startCol);
            }
            default -> {
                if (c >= 'A' && c <= 'Z') yield single(FACT);
                throw new LexException("Unexpected character '" + (char) c + "'", startLine, startCol);
            }
        };
    }

    private Token single(Token.Kind kind) throws IOException {
        var l = line;
        var c = col;
        var ch = (char) consumeChar();
        return new Token(kind, String.valueOf(ch), l, c);
    }

    private int peek() throws IOException {
        if (currentChar == -2) currentChar = reader.read();
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 1;
            } else {
                col++;
            }
        }
        return c;
    }

    private void skipWhitespaceAndComments() throws IOException {
        while (true) {
            var c = peek();
            if (c == -1) return;
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                consumeChar();
            } else if (c == '#') {
                while (peek() != '\n' && peek() != -1) consumeChar();
            } else {
                return;
            }
        }
    }

    public static class LexException extends SyntaxException {
        public LexException(String message, int line, int col) {
            super(message, line, col);
        }
    }
}
