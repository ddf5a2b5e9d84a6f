package dumb.expert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static dumb.expert.Truth.*;
import static java.util.Objects.requireNonNull;

/**
 * Backward-chaining evaluation of facts against a fixed {@link Knowledge} index.
 * <p>
 * Definite results are memoized; UNDETERMINED never is, because a cycle broken at one
 * entry point may resolve from another. A fact already on the evaluation stack evaluates to
 * UNDETERMINED. The two directions of one biconditional never justify each other: while one
 * direction's condition is evaluated, the other direction is skipped, and a value computed
 * with a skipped rule is cached only once the fact that caused the skip has been resolved.
 * Instances are single-threaded; use a new instance for a different set of initial facts.
 */
public class Reasoner {
    private static final Logger logger = LoggerFactory.getLogger(Reasoner.class);
    private static final int UNTAINTED = Integer.MAX_VALUE;

    private final Knowledge knowledge;
    private final Map<String, List<Knowledge.RuleNode>> index;
    private final Map<String, List<Rule>> rulesConcluding;
    private final Map<String, Truth> cache = new HashMap<>();
    private final Set<String> evaluating = new LinkedHashSet<>();
    /** Rule id in use to its fact's stack depth. */
    private final Map<Integer, Integer> active = new HashMap<>();
    private final Listener listener;
    /** Shallowest stack depth whose active rule caused a skip in the current subtree. */
    private int taint = UNTAINTED;
    private long evaluations;

    public Reasoner(List<Rule> rules, Set<String> initialFacts) {
        this(rules, initialFacts, Listener.NONE);
    }

    public Reasoner(RuleFile file) {
        this(file.rules(), file.facts());
    }

    public Reasoner(List<Rule> rules, Set<String> initialFacts, Listener listener) {
        this.knowledge = new Knowledge(rules, initialFacts);
        this.listener = requireNonNull(listener);
        var nodes = new TreeMap<String, List<Knowledge.RuleNode>>();
        var view = new TreeMap<String, List<Rule>>();
        for (var f : knowledge.facts()) {
            var concluding = knowledge.rulesConcluding(f);
            if (concluding.isEmpty()) continue;
            nodes.put(f, List.copyOf(concluding));
            view.put(f, concluding.stream().map(Knowledge.RuleNode::rule).toList());
        }
        this.index = nodes;
        this.rulesConcluding = Collections.unmodifiableMap(view);
        logger.debug("Reasoner over {}", knowledge);
    }

    /**
     * Whether {@code conclusion} establishes {@code target}, a fact or a {@code !fact} key,
     * once the rule's condition holds. Conjunctions assert every conjunct; disjunctions
     * pin none of theirs, so a matching disjunct is UNDETERMINED. A NOT confirms only the
     * negated key of its own fact; NOT of a compound and nested implications confirm nothing.
     */
    public static Truth conclusionFor(Expr conclusion, String target) {
        if (conclusion instanceof Expr.Fact f) {
            return of(f.name().equals(target));
        } else if (conclusion instanceof Expr.Not n) {
            return of(n.operand() instanceof Expr.Fact f && Knowledge.isNegation(target) && f.name().equals(Knowledge.negation(target)));
        } else if (conclusion instanceof Expr.Bin b) {
            return switch (b.op()) {
                case AND -> {
                    var l = conclusionFor(b.left(), target);
                    var r = conclusionFor(b.right(), target);
                    if (l == TRUE || r == TRUE) yield TRUE;
                    yield l == UNDETERMINED || r == UNDETERMINED ? UNDETERMINED : FALSE;
                }
                case OR, XOR -> conclusionFor(b.left(), target) != FALSE || conclusionFor(b.right(), target) != FALSE
                        ? UNDETERMINED : FALSE;
                default -> FALSE;
            };
        }
        throw new IllegalStateException("Unknown expression: " + conclusion);
    }

    public Truth query(String fact) {
        var cached = cache.get(fact);
        if (cached != null) {
            listener.cached(fact, cached, evaluating.size());
            return cached;
        }
        if (evaluating.contains(fact)) {
            listener.cycle(fact, evaluating.size());
            return UNDETERMINED;
        }

        var depth = evaluating.size();
        var outer = taint;
        listener.enter(fact, depth);
        evaluating.add(fact);
        evaluations++;
        taint = UNTAINTED;
        Outcome outcome;
        boolean resolved;
        try {
            outcome = evaluateFact(fact, depth);
        } finally {
            evaluating.remove(fact);
            // skips caused at this depth or deeper are settled once this fact is
            resolved = taint >= depth;
            taint = Math.min(outer, resolved ? UNTAINTED : taint);
        }
        if (outcome.value.known() && resolved) cache.put(fact, outcome.value);
        logger.debug("{} = {} ({})", fact, outcome.value, outcome.basis);
        listener.exit(fact, outcome.value, outcome.basis, depth);
        return outcome.value;
    }

    /** Evaluates each fact in order; the result iterates in query order. */
    public Map<String, Truth> queryAll(List<String> facts) {
        var results = new LinkedHashMap<String, Truth>();
        for (var f : facts) results.put(f, query(f));
        return results;
    }

    public void resetCache() {
        cache.clear();
        evaluating.clear();
        active.clear();
        taint = UNTAINTED;
    }

    /** Three-valued value of an expression, resolving its facts by {@link #query}. */
    public Truth evaluate(Expr e) {
        if (e instanceof Expr.Fact f) {
            return query(f.name());
        } else if (e instanceof Expr.Not n) {
            return evaluate(n.operand()).not();
        } else if (e instanceof Expr.Bin b) {
            var l = evaluate(b.left());
            var r = evaluate(b.right());
            return l.apply(b.op(), r);
        }
        throw new IllegalStateException("Unknown expression: " + e);
    }

    private Outcome evaluateFact(String fact, int depth) {
        if (knowledge.isInitial(fact)) return new Outcome(TRUE, Basis.INITIAL);

        var negated = Knowledge.negation(fact);
        var positive = index.getOrDefault(fact, List.of());
        var negative = index.getOrDefault(negated, List.of());
        if (positive.isEmpty() && negative.isEmpty()) return new Outcome(FALSE, Basis.NO_RULES);

        var canBeTrue = false;
        var undetermined = false;

        for (var node : positive) {
            if (skipped(fact, node, depth)) continue;
            var condition = condition(node, depth);
            listener.rule(fact, node.rule(), condition, depth + 1);
            if (condition == TRUE) {
                var conclusion = conclusionFor(node.rule().conclusion(), fact);
                if (conclusion == TRUE) {
                    canBeTrue = true;
                    break;
                }
                if (conclusion == UNDETERMINED) undetermined = true;
            } else if (condition == UNDETERMINED) {
                undetermined = true;
            }
        }

        for (var node : negative) {
            if (skipped(negated, node, depth)) continue;
            var condition = condition(node, depth);
            listener.rule(negated, node.rule(), condition, depth + 1);
            // a firing negative rule alone leaves the closed-world default in place
            if (condition == TRUE) {
                if (canBeTrue) {
                    listener.contradiction(fact, depth + 1);
                    return new Outcome(UNDETERMINED, Basis.CONTRADICTION);
                }
            } else if (condition == UNDETERMINED) {
                undetermined = true;
            }
        }

        if (canBeTrue) return new Outcome(TRUE, Basis.DERIVED);
        if (undetermined) return new Outcome(UNDETERMINED, Basis.INSUFFICIENT);
        return new Outcome(FALSE, Basis.NOT_PROVEN);
    }

    private boolean skipped(String key, Knowledge.RuleNode node, int depth) {
        var twin = knowledge.twin(node.id());
        if (twin.isEmpty()) return false;
        var user = active.get(twin.getAsInt());
        if (user == null) return false;
        taint = Math.min(taint, user);
        listener.skipped(key, node.rule(), depth + 1);
        return true;
    }

    private Truth condition(Knowledge.RuleNode node, int depth) {
        active.put(node.id(), depth);
        try {
            return evaluate(node.rule().condition());
        } finally {
            active.remove(node.id());
        }
    }

    public Knowledge knowledge() {
        return knowledge;
    }

    /** Fact key (including {@code !X} keys) to the directional rules concluding it, in rule id order. */
    public Map<String, List<Rule>> rulesConcluding() {
        return rulesConcluding;
    }

    /** Facts evaluated from their rules so far, excluding cache hits and cycle breaks. */
    public long evaluations() {
        return evaluations;
    }

    /** Why a fact received its value. */
    public enum Basis {
        INITIAL, NO_RULES, DERIVED, CONTRADICTION, INSUFFICIENT, NOT_PROVEN
    }

    private record Outcome(Truth value, Basis basis) {
    }

    /**
     * Observes one evaluation as it happens. Depth is the number of facts on the
     * evaluation stack below the call.
     */
    public interface Listener {
        Listener NONE = new Listener() {
        };

        default void enter(String fact, int depth) {
        }

        default void exit(String fact, Truth value, Basis basis, int depth) {
        }

        default void cached(String fact, Truth value, int depth) {
        }

        default void cycle(String fact, int depth) {
        }

        /** A rule concluding {@code key} (a fact or {@code !fact}) had its condition evaluated. */
        default void rule(String key, Rule rule, Truth condition, int depth) {
        }

        /** A rule was passed over because the other direction of its biconditional is in use. */
        default void skipped(String key, Rule rule, int depth) {
        }

        default void contradiction(String fact, int depth) {
        }
    }
}
