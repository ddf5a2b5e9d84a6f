package dumb.expert;

/**
 * A lexical or grammatical error at a known position of the input.
 */
public abstract class SyntaxException extends Exception {
    private final int line;
    private final int col;

    protected SyntaxException(String message, int line, int col) {
        super(message);
        this.line = line;
        this.col = col;
    }

    public int line() {
        return line;
    }

    public int col() {
        return col;
    }

    /** The message without the location suffix. */
    public String reason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
        return super.getMessage() + location;
    }
}
