package dumb.expert.tool;

import dumb.expert.Expr;
import dumb.expert.Knowledge;
import dumb.expert.Rule;

import java.util.*;

/**
 * Size and complexity metrics of a rule set. Complexity of a rule is its operator count.
 */
public record Stats(
        int totalRules,
        int biconditionalRules,
        Map<Expr.Op, Integer> operators,
        List<Integer> complexity,
        int maxDepth,
        SortedSet<String> initialFacts,
        SortedSet<String> factsUsed,
        SortedSet<String> factsConcluded,
        SortedMap<String, SortedSet<String>> dependencies,
        SortedSet<String> recursiveFacts,
        List<Rule> rules
) {
    private static final int TOP_RULES = 5;
    private static final String RULE_LINE = "-".repeat(70), BANNER = "=".repeat(70);

    public static Stats of(List<Rule> rules, Set<String> initialFacts) {
        var knowledge = new Knowledge(rules, initialFacts);
        var operators = new EnumMap<Expr.Op, Integer>(Expr.Op.class);
        var complexity = new ArrayList<Integer>(rules.size());
        var used = new TreeSet<String>();
        var concluded = new TreeSet<String>();
        var maxDepth = 0;
        var biconditional = 0;

        for (var r : rules) {
            if (r.biconditional()) biconditional++;
            r.condition().operators().forEach((op, n) -> operators.merge(op, n, Integer::sum));
            r.conclusion().operators().forEach((op, n) -> operators.merge(op, n, Integer::sum));
            complexity.add(r.complexity());
            maxDepth = Math.max(maxDepth, r.depth());
            used.addAll(r.condition().facts());
            concluded.addAll(r.conclusion().facts());
        }

        var dependencies = new TreeMap<String, SortedSet<String>>();
        var recursive = new TreeSet<String>();
        for (var f : knowledge.facts()) {
            if (Knowledge.isNegation(f)) continue;
            var direct = new TreeSet<String>();
            knowledge.rulesConcluding(f).forEach(n -> direct.addAll(n.conditionFacts()));
            if (!direct.isEmpty()) dependencies.put(f, Collections.unmodifiableSortedSet(direct));
            if (knowledge.isRecursive(f)) recursive.add(f);
        }

        return new Stats(rules.size(), biconditional, Collections.unmodifiableMap(operators), List.copyOf(complexity), maxDepth,
                Collections.unmodifiableSortedSet(new TreeSet<>(initialFacts)),
                Collections.unmodifiableSortedSet(used), Collections.unmodifiableSortedSet(concluded),
                Collections.unmodifiableSortedMap(dependencies), Collections.unmodifiableSortedSet(recursive), List.copyOf(rules));
    }

    public int regularRules() {
        return totalRules - biconditionalRules;
    }

    public OptionalDouble averageComplexity() {
        return complexity.stream().mapToInt(Integer::intValue).average();
    }

    public OptionalInt maxComplexity() {
        return complexity.stream().mapToInt(Integer::intValue).max();
    }

    public OptionalInt minComplexity() {
        return complexity.stream().mapToInt(Integer::intValue).min();
    }

    /** The most complex rules first; ties keep input order. */
    public List<Rule> mostComplex(int n) {
        var idx = new ArrayList<Integer>();
        for (var i = 0; i < rules.size(); i++) idx.add(i);
        idx.sort(Comparator.comparing((Integer i) -> -complexity.get(i)));
        return idx.stream().limit(n).map(rules::get).toList();
    }

    public String report() {
        var sb = new StringBuilder();
        sb.append(BANNER).append('\n').append("RULE SET STATISTICS").append('\n').append(BANNER).append("\n\n");

        section(sb, "BASIC METRICS");
        sb.append(String.format("Total rules:            %d%n", totalRules));
        sb.append(String.format("Biconditional rules:    %d%n", biconditionalRules));
        sb.append(String.format("Regular rules:          %d%n%n", regularRules()));

        section(sb, "FACTS");
        sb.append(String.format("Initial facts:          %s%n", initialFacts.isEmpty() ? "None" : String.join(", ", initialFacts)));
        sb.append(String.format("Total facts used:       %d (%s)%n", factsUsed.size(), String.join(", ", factsUsed)));
        sb.append(String.format("Facts concluded:        %d (%s)%n%n", factsConcluded.size(), String.join(", ", factsConcluded)));

        section(sb, "OPERATORS USED");
        operators.entrySet().stream()
                .sorted(Map.Entry.<Expr.Op, Integer>comparingByValue().reversed())
                .forEach(e -> sb.append(String.format("  %-20s %3d times%n", e.getKey().word + " (" + e.getKey().symbol + ")", e.getValue())));
        sb.append('\n');

        if (!complexity.isEmpty()) {
            section(sb, "COMPLEXITY METRICS");
            sb.append(String.format(Locale.ROOT, "Average complexity:     %.2f%n", averageComplexity().orElse(0)));
            sb.append(String.format("Maximum complexity:     %d%n", maxComplexity().orElse(0)));
            sb.append(String.format("Minimum complexity:     %d%n", minComplexity().orElse(0)));
            sb.append(String.format("Maximum nesting depth:  %d%n%n", maxDepth));
        }

        if (!dependencies.isEmpty()) {
            section(sb, "FACT DEPENDENCIES");
            dependencies.forEach((f, deps) -> sb.append(String.format("  %s depends on: %s%n", f, String.join(", ", deps))));
            if (!recursiveFacts.isEmpty())
                sb.append(String.format("  Recursive: %s%n", String.join(", ", recursiveFacts)));
            sb.append('\n');
        }

        if (!complexity.isEmpty()) {
            section(sb, "MOST COMPLEX RULES");
            var top = mostComplex(TOP_RULES);
            for (var i = 0; i < top.size(); i++)
                sb.append(String.format("  %d. [%d] %s%n", i + 1, top.get(i).complexity(), top.get(i)));
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title) {
        sb.append(title).append('\n').append(RULE_LINE).append('\n');
    }
}
