package dumb.expert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static java.util.Objects.requireNonNull;
import static java.util.Optional.ofNullable;

/**
 * Bidirectional index between facts and the rules that conclude or consume them.
 * <p>
 * Nodes live in two arenas, facts keyed by name and rules keyed by id; edges are stored
 * as key sets on both ends and are always added in pairs. The index is immutable once built.
 * Rule {@code k} of the input gets id {@code 2k}; a biconditional also gets {@code 2k+1}
 * for its reverse direction.
 */
public class Knowledge {
    public static final String NEGATION = "!";

    private static final Logger logger = LoggerFactory.getLogger(Knowledge.class);

    private final Map<String, FactNode> facts;
    private final SortedMap<Integer, RuleNode> rules;
    private final Map<String, Set<RuleNode>> concluding = new HashMap<>(), using = new HashMap<>();
    private final Set<String> initialFacts;

    public Knowledge(List<Rule> rules, Set<String> initialFacts) {
        this.initialFacts = Collections.unmodifiableSet(new TreeSet<>(requireNonNull(initialFacts)));
        var b = new Builder(this.initialFacts);
        for (var i = 0; i < rules.size(); i++) b.add(i, rules.get(i));
        this.facts = b.freezeFacts();
        this.rules = b.freezeRules();
        for (var f : facts.values()) {
            concluding.put(f.name(), nodes(f.concludedBy()));
            using.put(f.name(), nodes(f.usedBy()));
        }
    }

    public static String negation(String fact) {
        return fact.startsWith(NEGATION) ? fact.substring(NEGATION.length()) : NEGATION + fact;
    }

    public static boolean isNegation(String key) {
        return key.startsWith(NEGATION);
    }

    /**
     * Fact keys a conclusion asserts something about: facts and {@code !fact} keys reached
     * through AND/OR/XOR. NOT of anything but a fact, and nested implications, contribute nothing.
     */
    public static Set<String> concludedFacts(Expr conclusion) {
        var out = new TreeSet<String>();
        collectConcluded(conclusion, out);
        return out;
    }

    private static void collectConcluded(Expr e, Set<String> out) {
        if (e instanceof Expr.Fact f) {
            out.add(f.name());
        } else if (e instanceof Expr.Not n) {
            if (n.operand() instanceof Expr.Fact f) out.add(NEGATION + f.name());
        } else if (e instanceof Expr.Bin b) {
            switch (b.op()) {
                case AND, OR, XOR -> {
                    collectConcluded(b.left(), out);
                    collectConcluded(b.right(), out);
                }
                default -> {
                }
            }
        }
    }

    public Optional<FactNode> fact(String name) {
        return ofNullable(facts.get(name));
    }

    public Optional<RuleNode> rule(int id) {
        return ofNullable(rules.get(id));
    }

    /** The other direction of the biconditional rule {@code id} came from, if any. */
    public OptionalInt twin(int id) {
        var other = id ^ 1;
        return rules.containsKey(id) && rules.containsKey(other) ? OptionalInt.of(other) : OptionalInt.empty();
    }

    /** All fact keys, including {@code !X} keys of facts some rule concludes negated. */
    public Set<String> facts() {
        return facts.keySet();
    }

    public Collection<RuleNode> rules() {
        return rules.values();
    }

    public Set<String> initialFacts() {
        return initialFacts;
    }

    public boolean isInitial(String fact) {
        return fact(fact).map(FactNode::initial).orElse(false);
    }

    /** Rules concluding {@code fact}, in id order. */
    public Set<RuleNode> rulesConcluding(String fact) {
        return concluding.getOrDefault(fact, Set.of());
    }

    /** Rules whose condition mentions {@code fact}, in id order. */
    public Set<RuleNode> rulesUsing(String fact) {
        return using.getOrDefault(fact, Set.of());
    }

    private Set<RuleNode> nodes(Set<Integer> ids) {
        var s = new LinkedHashSet<RuleNode>(ids.size());
        for (var id : ids) s.add(rules.get(id));
        return Collections.unmodifiableSet(s);
    }

    /**
     * Every fact {@code fact} transitively depends on: the condition facts of the rules
     * concluding it, then theirs, and so on. The fact itself is never included.
     */
    public Set<String> dependencies(String fact) {
        var visited = closure(fact);
        visited.remove(fact);
        return visited;
    }

    /** Whether the fact depends on itself through some chain of rules. */
    public boolean isRecursive(String fact) {
        var frontier = new ArrayDeque<String>();
        var visited = new HashSet<String>();
        rulesConcluding(fact).forEach(r -> frontier.addAll(r.conditionFacts()));
        while (!frontier.isEmpty()) {
            var current = frontier.pop();
            if (current.equals(fact)) return true;
            if (!visited.add(current)) continue;
            rulesConcluding(current).forEach(r -> frontier.addAll(r.conditionFacts()));
        }
        return false;
    }

    private Set<String> closure(String fact) {
        var visited = new TreeSet<String>();
        var frontier = new ArrayDeque<String>();
        frontier.add(fact);
        while (!frontier.isEmpty()) {
            var current = frontier.pop();
            if (!visited.add(current)) continue;
            for (var r : rulesConcluding(current))
                for (var f : r.conditionFacts())
                    if (!visited.contains(f)) frontier.add(f);
        }
        return visited;
    }

    @Override
    public String toString() {
        return "Knowledge(facts=" + facts.size() + ", rules=" + rules.size() + ")";
    }

    /**
     * @param concludedBy ids of rules that can conclude this fact
     * @param usedBy      ids of rules whose condition mentions this fact
     */
    public record FactNode(String name, boolean initial, Set<Integer> concludedBy, Set<Integer> usedBy) {
        public FactNode {
            requireNonNull(name);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof FactNode f && name.equals(f.name));
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return "FactNode(" + name + (initial ? " (initial)" : "") + ")";
        }
    }

    /**
     * A directional rule. For the reverse half of a biconditional, {@link #rule()} is the
     * already reversed {@code conclusion => condition}.
     */
    public record RuleNode(int id, Rule rule, Set<String> conditionFacts, Set<String> concludedFacts) {
        public RuleNode {
            requireNonNull(rule);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof RuleNode r && id == r.id);
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(id);
        }

        @Override
        public String toString() {
            return "RuleNode(R" + id + ")";
        }
    }

    private static final class Builder {
        private final Set<String> initialFacts;
        private final Map<String, Set<Integer>> concludedBy = new TreeMap<>();
        private final Map<String, Set<Integer>> usedBy = new TreeMap<>();
        private final SortedMap<Integer, Rule> rules = new TreeMap<>();
        private final Map<Integer, Set<String>> conditions = new HashMap<>();
        private final Map<Integer, Set<String>> conclusions = new HashMap<>();

        Builder(Set<String> initialFacts) {
            this.initialFacts = initialFacts;
            initialFacts.forEach(this::factNode);
        }

        void add(int index, Rule rule) {
            var forward = rule.biconditional() ? new Rule(rule.condition(), rule.conclusion(), false) : rule;
            link(2 * index, forward);
            if (rule.biconditional()) link(2 * index + 1, rule.reverse());
        }

        private void link(int id, Rule directional) {
            rules.put(id, directional);
            conditions.put(id, new TreeSet<>());
            conclusions.put(id, new TreeSet<>());
            directional.condition().facts().forEach(f -> edge(id, f, true));
            var concluded = concludedFacts(directional.conclusion());
            if (concluded.isEmpty())
                logger.warn("Rule R{} ({}) concludes no fact and is never used by inference", id, directional);
            concluded.forEach(f -> edge(id, f, false));
            // facts mentioned only under an unsupported conclusion still get a node
            directional.conclusion().facts().forEach(this::factNode);
        }

        private void edge(int ruleId, String fact, boolean condition) {
            factNode(fact);
            if (condition) {
                conditions.get(ruleId).add(fact);
                usedBy.get(fact).add(ruleId);
            } else {
                conclusions.get(ruleId).add(fact);
                concludedBy.get(fact).add(ruleId);
            }
        }

        private void factNode(String fact) {
            concludedBy.computeIfAbsent(fact, k -> new TreeSet<>());
            usedBy.computeIfAbsent(fact, k -> new TreeSet<>());
        }

        Map<String, FactNode> freezeFacts() {
            var m = new TreeMap<String, FactNode>();
            concludedBy.forEach((name, producers) -> m.put(name, new FactNode(name, initialFacts.contains(name),
                    Collections.unmodifiableSet(producers), Collections.unmodifiableSet(usedBy.get(name)))));
            return Collections.unmodifiableMap(m);
        }

        SortedMap<Integer, RuleNode> freezeRules() {
            var m = new TreeMap<Integer, RuleNode>();
            rules.forEach((id, rule) -> m.put(id, new RuleNode(id, rule,
                    Collections.unmodifiableSet(conditions.get(id)), Collections.unmodifiableSet(conclusions.get(id)))));
            return Collections.unmodifiableSortedMap(m);
        }
    }
}
