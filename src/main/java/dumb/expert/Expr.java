package dumb.expert;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.Collections;

import static java.util.Objects.requireNonNull;

/**
 * Propositional expression tree. The operator set is closed: a node is a {@link Fact},
 * a {@link Not} or a binary {@link Bin} tagged with its {@link Op}.
 */
sealed public interface Expr permits Expr.Fact, Expr.Not, Expr.Bin {

    static Fact fact(String name) {
        return new Fact(name);
    }

    static Not not(Expr operand) {
        return new Not(operand);
    }

    static Bin and(Expr left, Expr right) {
        return new Bin(Op.AND, left, right);
    }

    static Bin or(Expr left, Expr right) {
        return new Bin(Op.OR, left, right);
    }

    static Bin xor(Expr left, Expr right) {
        return new Bin(Op.XOR, left, right);
    }

    /** Names of all facts referenced anywhere in this tree. */
    Set<String> facts();

    /** Nesting depth; a lone fact has depth 0. */
    int depth();

    /** Operator occurrences in this tree, keyed by operator. */
    default Map<Op, Integer> operators() {
        var counts = new EnumMap<Op, Integer>(Op.class);
        countOperators(this, counts);
        return counts;
    }

    private static void countOperators(Expr e, Map<Op, Integer> counts) {
        if (e instanceof Not n) {
            counts.merge(Op.NOT, 1, Integer::sum);
            countOperators(n.operand(), counts);
        } else if (e instanceof Bin b) {
            counts.merge(b.op(), 1, Integer::sum);
            countOperators(b.left(), counts);
            countOperators(b.right(), counts);
        }
    }

    enum Op {
        NOT("!", "NOT", "¬"),
        AND("+", "AND", "∧"),
        OR("|", "OR", "∨"),
        XOR("^", "XOR", "⊕"),
        IMPLIES("=>", "IMPLIES", "⇒"),
        IFF("<=>", "IF-AND-ONLY-IF", "⇔");

        public final String symbol;
        public final String word;
        public final String formal;

        Op(String symbol, String word, String formal) {
            this.symbol = symbol;
            this.word = word;
            this.formal = formal;
        }
    }

    record Fact(String name) implements Expr {
        public Fact {
            requireNonNull(name);
        }

        @Override
        public Set<String> facts() {
            return Set.of(name);
        }

        @Override
        public int depth() {
            return 0;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Not(Expr operand) implements Expr {
        public Not {
            requireNonNull(operand);
        }

        @Override
        public Set<String> facts() {
            return operand.facts();
        }

        @Override
        public int depth() {
            return 1 + operand.depth();
        }

        @Override
        public String toString() {
            return "!" + (operand instanceof Bin ? "(" + operand + ")" : operand.toString());
        }
    }

    record Bin(Op op, Expr left, Expr right) implements Expr {
        public Bin {
            requireNonNull(op);
            requireNonNull(left);
            requireNonNull(right);
            if (op == Op.NOT) throw new IllegalArgumentException("NOT is not a binary operator");
        }

        @Override
        public Set<String> facts() {
            var s = new TreeSet<>(left.facts());
            s.addAll(right.facts());
            return Collections.unmodifiableSet(s);
        }

        @Override
        public int depth() {
            return 1 + Math.max(left.depth(), right.depth());
        }

        @Override
        public String toString() {
            return wrap(left) + " " + op.symbol + " " + wrap(right);
        }

        private static String wrap(Expr e) {
            return e instanceof Bin ? "(" + e + ")" : e.toString();
        }
    }
}
