package dumb.expert;

import static java.util.Objects.requireNonNull;

public record Token(Kind kind, String lexeme, int line, int column) {

    public Token {
        requireNonNull(kind);
        requireNonNull(lexeme);
    }

    public boolean is(Kind k) {
        return kind == k;
    }

    @Override
    public String toString() {
        return "Token(" + kind + ", '" + lexeme + "', L" + line + ":C" + column + ")";
    }

    public enum Kind {
        LPAREN("("), RPAREN(")"), NOT("!"), AND("+"), OR("|"), XOR("^"),
        IMPLIES("=>"), IFF("<=>"), FACT("fact"), EQUALS("="), QUERY("?"), EOF("end of input");

        public final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }
    }
}
