package dumb.expert.tool;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.expert.Reasoner;
import dumb.expert.Rule;
import dumb.expert.Truth;
import dumb.expert.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Justification graph of a set of queries: which facts support which conclusions, and by
 * which rule. An edge {@code from -> to} exists when a rule concluding {@code to} has a TRUE
 * condition mentioning {@code from}. Exports to Graphviz DOT and JSON.
 */
public class GraphExport {
    private static final Logger logger = LoggerFactory.getLogger(GraphExport.class);

    private final List<Rule> rules;
    private final Set<String> initialFacts;
    private final Reasoner reasoner;
    private final Map<String, Provenance> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();

    public GraphExport(List<Rule> rules, Set<String> initialFacts) {
        this.rules = List.copyOf(requireNonNull(rules));
        this.initialFacts = new TreeSet<>(requireNonNull(initialFacts));
        this.reasoner = new Reasoner(this.rules, this.initialFacts);
    }

    /** Traces the queries; may be called repeatedly to add more. */
    public GraphExport build(List<String> queries) {
        for (var f : initialFacts)
            nodes.computeIfAbsent(f, k -> new Provenance(k, Truth.TRUE, Type.INITIAL));
        var visited = new HashSet<String>();
        for (var q : queries) trace(q, true, visited);
        logger.debug("Justification graph: {} nodes, {} edges", nodes.size(), edges.size());
        return this;
    }

    private void trace(String fact, boolean query, Set<String> visited) {
        if (query) nodes.computeIfPresent(fact, (k, n) -> n.type == Type.INITIAL ? n : n.as(Type.QUERY));
        if (!visited.add(fact)) return;

        var value = reasoner.query(fact);
        var node = nodes.computeIfAbsent(fact, k -> new Provenance(k, value, query ? Type.QUERY : Type.DERIVED));
        if (initialFacts.contains(fact)) return;

        for (var rule : reasoner.rulesConcluding().getOrDefault(fact, List.of())) {
            var condition = rule.condition().facts();
            for (var c : condition) trace(c, false, visited);
            if (reasoner.evaluate(rule.condition()) != Truth.TRUE) continue;

            var label = Explain.formal(rule.condition()) + " ⇒ " + Explain.formal(rule.conclusion());
            node.rulesUsed.add(label);
            for (var c : condition) {
                node.supporting.add(c);
                var e = new Edge(c, fact, label);
                if (!edges.contains(e)) edges.add(e);
            }
        }
    }

    public List<Node> nodes() {
        return nodes.values().stream().map(Provenance::toNode).toList();
    }

    public List<Edge> edges() {
        return List.copyOf(edges);
    }

    public String toDot() {
        var sb = new StringBuilder();
        sb.append("digraph JustificationGraph {\n");
        sb.append("  rankdir=BT;\n");
        sb.append("  node [shape=box, style=rounded];\n\n");
        for (var n : nodes.values()) {
            var color = "white";
            var shape = "box";
            if (n.type == Type.INITIAL) {
                color = "lightblue";
            } else if (n.type == Type.QUERY) {
                color = switch (n.value) {
                    case TRUE -> "lightgreen";
                    case FALSE -> "lightcoral";
                    case UNDETERMINED -> "lightyellow";
                };
                shape = "doubleoctagon";
            }
            sb.append(String.format("  \"%s\" [label=\"%s\\n%s\", fillcolor=%s, style=filled, shape=%s];%n",
                    n.fact, n.fact, n.value, color, shape));
        }
        sb.append('\n');
        for (var e : edges)
            sb.append(String.format("  \"%s\" -> \"%s\" [label=\"%s\"];%n", e.from(), e.to(), e.rule().replace("\"", "\\\"")));
        sb.append("}\n");
        return sb.toString();
    }

    public String toJson() throws JsonProcessingException {
        return Json.str(new Document(nodes(), edges(), new Metadata(rules.size(), initialFacts, nodes.size())));
    }

    public void writeDot(Path file) throws IOException {
        Files.writeString(file, toDot(), StandardCharsets.UTF_8);
    }

    public void writeJson(Path file) throws IOException {
        Files.writeString(file, toJson(), StandardCharsets.UTF_8);
    }

    public enum Type {
        INITIAL, QUERY, DERIVED;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @JsonPropertyOrder({"id", "value", "type", "supporting_facts", "rules_used"})
    public record Node(String id, Truth value, Type type,
                       @JsonProperty("supporting_facts") SortedSet<String> supportingFacts,
                       @JsonProperty("rules_used") List<String> rulesUsed) {
    }

    public record Edge(String from, String to, String rule) {
    }

    public record Metadata(@JsonProperty("total_rules") int totalRules,
                           @JsonProperty("initial_facts") Set<String> initialFacts,
                           @JsonProperty("total_nodes") int totalNodes) {
    }

    public record Document(List<Node> nodes, List<Edge> edges, Metadata metadata) {
    }

    private static final class Provenance {
        final String fact;
        final Truth value;
        final SortedSet<String> supporting = new TreeSet<>();
        final List<String> rulesUsed = new ArrayList<>();
        Type type;

        Provenance(String fact, Truth value, Type type) {
            this.fact = fact;
            this.value = value;
            this.type = type;
        }

        Provenance as(Type t) {
            type = t;
            return this;
        }

        Node toNode() {
            return new Node(fact, value, type, Collections.unmodifiableSortedSet(new TreeSet<>(supporting)), List.copyOf(rulesUsed));
        }
    }
}
