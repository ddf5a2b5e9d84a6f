package dumb.expert;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;

/**
 * {@code condition => conclusion}, or {@code condition <=> conclusion} when biconditional.
 */
public record Rule(Expr condition, Expr conclusion, boolean biconditional) {
    public Rule {
        requireNonNull(condition);
        requireNonNull(conclusion);
    }

    public static Rule implies(Expr condition, Expr conclusion) {
        return new Rule(condition, conclusion, false);
    }

    public static Rule iff(Expr condition, Expr conclusion) {
        return new Rule(condition, conclusion, true);
    }

    /** The directional rule {@code conclusion => condition}. */
    public Rule reverse() {
        return new Rule(conclusion, condition, false);
    }

    public Set<String> facts() {
        var s = new TreeSet<>(condition.facts());
        s.addAll(conclusion.facts());
        return Collections.unmodifiableSet(s);
    }

    /** Operator count over both sides. */
    public int complexity() {
        return condition.operators().values().stream().mapToInt(Integer::intValue).sum()
                + conclusion.operators().values().stream().mapToInt(Integer::intValue).sum();
    }

    public int depth() {
        return Math.max(condition.depth(), conclusion.depth());
    }

    @Override
    public String toString() {
        return condition + (biconditional ? " <=> " : " => ") + conclusion;
    }
}
