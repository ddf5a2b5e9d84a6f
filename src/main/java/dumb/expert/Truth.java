package dumb.expert;

/**
 * Three-valued truth. UNDETERMINED is never inferred away by XOR or IFF.
 */
public enum Truth {
    TRUE("⊤", "✓"),
    FALSE("⊥", "✗"),
    UNDETERMINED("?", "?");

    public final String formal;
    public final String mark;

    Truth(String formal, String mark) {
        this.formal = formal;
        this.mark = mark;
    }

    public static Truth of(boolean b) {
        return b ? TRUE : FALSE;
    }

    public boolean known() {
        return this != UNDETERMINED;
    }

    public Truth not() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNDETERMINED -> UNDETERMINED;
        };
    }

    public Truth and(Truth y) {
        if (this == FALSE || y == FALSE) return FALSE;
        return this == TRUE && y == TRUE ? TRUE : UNDETERMINED;
    }

    public Truth or(Truth y) {
        if (this == TRUE || y == TRUE) return TRUE;
        return this == FALSE && y == FALSE ? FALSE : UNDETERMINED;
    }

    public Truth xor(Truth y) {
        if (this == UNDETERMINED || y == UNDETERMINED) return UNDETERMINED;
        return of(this != y);
    }

    /** {@code this => y}. */
    public Truth implies(Truth y) {
        return switch (this) {
            case FALSE -> TRUE;
            case TRUE -> y;
            case UNDETERMINED -> y == TRUE ? TRUE : UNDETERMINED;
        };
    }

    public Truth iff(Truth y) {
        if (this == UNDETERMINED || y == UNDETERMINED) return UNDETERMINED;
        return of(this == y);
    }

    public Truth apply(Expr.Op op, Truth y) {
        return switch (op) {
            case AND -> and(y);
            case OR -> or(y);
            case XOR -> xor(y);
            case IMPLIES -> implies(y);
            case IFF -> iff(y);
            case NOT -> throw new IllegalArgumentException("NOT is unary");
        };
    }
}
