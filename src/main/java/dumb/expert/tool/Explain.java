package dumb.expert.tool;

import dumb.expert.Expr;
import dumb.expert.Knowledge;
import dumb.expert.Reasoner;
import dumb.expert.Reasoner.Basis;
import dumb.expert.Rule;
import dumb.expert.Truth;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Natural-language trace of how a fact gets its value. Each explanation runs a fresh
 * {@link Reasoner} with a recording listener, so the trace follows exactly the steps of the
 * engine, including cycle breaks and contradictions.
 */
public class Explain {
    private final List<Rule> rules;
    private final Set<String> facts;
    private final boolean formal;

    public Explain(List<Rule> rules, Set<String> facts) {
        this(rules, facts, true);
    }

    public Explain(List<Rule> rules, Set<String> facts, boolean formal) {
        this.rules = List.copyOf(requireNonNull(rules));
        this.facts = Set.copyOf(requireNonNull(facts));
        this.formal = formal;
    }

    /** Natural-language rendering: {@code (A AND NOT B)}. */
    public static String natural(Expr e) {
        if (e instanceof Expr.Fact f) return f.name();
        if (e instanceof Expr.Not n) return "NOT " + natural(n.operand());
        var b = (Expr.Bin) e;
        return "(" + natural(b.left()) + " " + b.op().word + " " + natural(b.right()) + ")";
    }

    /** Formal rendering: {@code (A ∧ ¬B)}. */
    public static String formal(Expr e) {
        if (e instanceof Expr.Fact f) return f.name();
        if (e instanceof Expr.Not n) return "¬" + formal(n.operand());
        var b = (Expr.Bin) e;
        return "(" + formal(b.left()) + " " + b.op().formal + " " + formal(b.right()) + ")";
    }

    public Explanation explain(String fact) {
        var trace = new Trace();
        var value = new Reasoner(rules, facts, trace).query(fact);
        return new Explanation(fact, value, summary(fact, value), List.copyOf(trace.steps));
    }

    private String summary(String fact, Truth value) {
        return switch (value) {
            case TRUE -> value.mark + " " + fact + " is TRUE" + (facts.contains(fact) ? " (given as initial fact)" : " (proven by the rules)");
            case FALSE -> value.mark + " " + fact + " is FALSE (not proven true by any rule)";
            case UNDETERMINED -> value.mark + " " + fact + " is UNDETERMINED (insufficient information)";
        };
    }

    public record Explanation(String fact, Truth value, String summary, List<String> steps) {
        @Override
        public String toString() {
            var sb = new StringBuilder();
            steps.forEach(s -> sb.append(s).append('\n'));
            return sb.append("CONCLUSION: ").append(summary).toString();
        }
    }

    private final class Trace implements Reasoner.Listener {
        final List<String> steps = new ArrayList<>();

        private void step(int depth, String message, String formalLine) {
            var indent = "  ".repeat(depth);
            steps.add(indent + "• " + message);
            if (formal && formalLine != null) steps.add(indent + "  Formal: " + formalLine);
        }

        @Override
        public void enter(String fact, int depth) {
            step(depth, "Evaluating " + fact, null);
        }

        @Override
        public void exit(String fact, Truth value, Basis basis, int depth) {
            switch (basis) {
                case INITIAL -> step(depth + 1, fact + " is TRUE (given as initial fact)", fact + " ∈ InitialFacts");
                case NO_RULES -> step(depth + 1, fact + " is FALSE (no rules conclude " + fact + ", default is false)", fact + " = ⊥");
                case DERIVED -> step(depth + 1, fact + " is TRUE (a rule with a true condition concludes it)", fact + " = ⊤");
                case CONTRADICTION -> step(depth + 1, fact + " is UNDETERMINED (proven both TRUE and FALSE)", fact + " = ⊤ ∧ " + fact + " = ⊥ → " + fact + " = ?");
                case INSUFFICIENT -> step(depth + 1, fact + " is UNDETERMINED (insufficient information)", fact + " = ?");
                case NOT_PROVEN -> step(depth + 1, fact + " is FALSE (no rule proves it true)", fact + " = ⊥");
            }
        }

        @Override
        public void cached(String fact, Truth value, int depth) {
            step(depth, fact + " is " + value + " (already established)", fact + " = " + value.formal);
        }

        @Override
        public void cycle(String fact, int depth) {
            step(depth, fact + " is already being evaluated, treated as UNDETERMINED (circular reasoning)", fact + " = ?");
        }

        @Override
        public void rule(String key, Rule rule, Truth condition, int depth) {
            var target = Knowledge.isNegation(key) ? "NOT " + Knowledge.negation(key) : key;
            var outcome = switch (condition) {
                case TRUE -> "condition is TRUE";
                case FALSE -> "condition is FALSE, rule does not apply";
                case UNDETERMINED -> "condition is UNDETERMINED";
            };
            step(depth, "Rule for " + target + ": IF " + natural(rule.condition()) + " THEN " + natural(rule.conclusion()) + ", " + outcome,
                    formal(rule.condition()) + " ⇒ " + formal(rule.conclusion()) + " with " + formal(rule.condition()) + " = " + condition.formal);
        }

        @Override
        public void skipped(String key, Rule rule, int depth) {
            step(depth, "Rule IF " + natural(rule.condition()) + " THEN " + natural(rule.conclusion())
                    + " skipped, its reverse direction is already in use", null);
        }

        @Override
        public void contradiction(String fact, int depth) {
            step(depth, "Contradiction: " + fact + " can be both TRUE and FALSE", null);
        }
    }
}
