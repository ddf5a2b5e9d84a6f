package dumb.expert.tool;

import dumb.expert.Configuration;
import dumb.expert.Reasoner;
import dumb.expert.Rule;
import dumb.expert.Truth;
import dumb.expert.Validation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Interactive fact validation. Facts can be asserted and removed persistently, or
 * temporarily through a stack of what-if frames; every query builds a new {@link Reasoner}
 * over the effective facts, so no result survives a change of facts.
 */
public class Shell {
    private static final Logger logger = LoggerFactory.getLogger(Shell.class);
    private static final String SEPARATOR = "=".repeat(70);
    private static final String GREEN = "\033[92m", RED = "\033[91m", YELLOW = "\033[93m", RESET = "\033[0m";

    private final List<Rule> rules;
    private final Set<String> originalFacts;
    private final SortedSet<String> facts;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final SortedSet<String> knownFacts = new TreeSet<>();
    private final Configuration config;
    private final PrintStream out;

    public Shell(List<Rule> rules, Set<String> facts, Configuration config, PrintStream out) {
        this.rules = List.copyOf(requireNonNull(rules));
        this.originalFacts = Set.copyOf(requireNonNull(facts));
        this.facts = new TreeSet<>(facts);
        this.config = requireNonNull(config);
        this.out = requireNonNull(out);
        this.rules.forEach(r -> knownFacts.addAll(r.facts()));
        knownFacts.addAll(facts);
    }

    /** Reads commands until end of input or {@code quit}. */
    public void run(BufferedReader in) throws IOException {
        out.println(SEPARATOR);
        out.println("INTERACTIVE FACT VALIDATION MODE");
        out.println(SEPARATOR);
        out.println("Loaded " + rules.size() + " rule(s)");
        printFacts();
        printHelp();
        while (true) {
            out.print("\n> ");
            out.flush();
            var line = in.readLine();
            if (line == null) {
                out.println("\nExiting interactive mode.");
                return;
            }
            if (!execute(line)) return;
        }
    }

    /**
     * Executes one command line.
     *
     * @return false when the command asks to leave the shell
     */
    public boolean execute(String line) {
        var input = line.strip();
        if (input.isEmpty()) return true;
        var words = input.split("\\s+");
        var cmd = words[0].toLowerCase(Locale.ROOT);

        switch (cmd) {
            case "quit", "exit", "q" -> {
                out.println("Exiting interactive mode.");
                return false;
            }
            case "help" -> printHelp();
            case "facts" -> printFacts();
            case "reset" -> {
                facts.clear();
                facts.addAll(originalFacts);
                frames.clear();
                out.println("Reset to original facts.");
                printFacts();
            }
            case "rules" -> {
                out.println("\nLoaded " + rules.size() + " rule(s):");
                for (var i = 0; i < rules.size(); i++) out.println("  " + (i + 1) + ". " + rules.get(i));
            }
            case "push" -> push(input.substring(4).strip());
            case "pop" -> {
                if (frames.isEmpty()) out.println("No temporary assertions to pop.");
                else out.println("Popped: " + frames.pop());
            }
            case "temp" -> {
                if (frames.isEmpty()) {
                    out.println("Temporary stack is empty.");
                } else {
                    out.println("Temporary assertions (last is top):");
                    var bottomUp = new ArrayList<>(frames);
                    Collections.reverse(bottomUp);
                    for (var i = 0; i < bottomUp.size(); i++) out.println("  " + (i + 1) + ". " + bottomUp.get(i));
                }
            }
            case "clear_temp" -> {
                frames.clear();
                out.println("Cleared temporary assertions.");
            }
            case "suggest" -> suggest(words);
            case "explain" -> explain(words);
            case "export" -> export(words);
            default -> {
                if (input.startsWith("+")) change(input.substring(1), true);
                else if (input.startsWith("-")) change(input.substring(1), false);
                else if (input.startsWith("?")) query(input.substring(1));
                else {
                    out.println("Unknown command: " + input);
                    out.println("Type 'help' for available commands.");
                }
            }
        }
        return true;
    }

    /** Current facts with every what-if frame applied, oldest first. */
    public SortedSet<String> effectiveFacts() {
        var eff = new TreeSet<>(facts);
        var bottomUp = new ArrayList<>(frames);
        Collections.reverse(bottomUp);
        for (var f : bottomUp) {
            eff.addAll(f.add());
            eff.removeAll(f.remove());
        }
        return eff;
    }

    public SortedSet<String> facts() {
        return Collections.unmodifiableSortedSet(facts);
    }

    public int depth() {
        return frames.size();
    }

    private void change(String text, boolean add) {
        var changed = new ArrayList<String>();
        for (var name : letters(text)) {
            if (!Validation.isFactName(name)) {
                out.println("Invalid fact: " + name);
                continue;
            }
            if (add) facts.add(name);
            else facts.remove(name);
            changed.add(name);
        }
        if (!changed.isEmpty()) {
            out.println((add ? "Added" : "Removed") + " fact(s): " + String.join(", ", changed));
            printFacts();
        }
    }

    private void push(String text) {
        if (text.isEmpty()) {
            out.println("Usage: push +A or push -A (use + to add, - to remove)");
            return;
        }
        var sign = text.charAt(0);
        if (sign != '+' && sign != '-') {
            out.println("Push must start with + or -");
            return;
        }
        var named = new TreeSet<String>();
        for (var name : letters(text.substring(1)))
            if (Validation.isFactName(name)) named.add(name);
        var frame = sign == '+' ? new Frame(named, Set.of()) : new Frame(Set.of(), named);
        frames.push(frame);
        out.println("Pushed temporary assertion: " + frame);
    }

    private void query(String text) {
        var names = letters(text);
        if (names.isEmpty()) {
            out.println("No queries specified.");
            return;
        }
        var reasoner = new Reasoner(rules, effectiveFacts());
        out.println(SEPARATOR);
        out.println("QUERY RESULTS");
        out.println(SEPARATOR);
        for (var name : names) {
            if (Validation.isFactName(name)) printResult(name, reasoner.query(name));
            else out.println("Invalid query: " + name);
        }
    }

    private void suggest(String[] words) {
        if (words.length != 2) {
            out.println("Usage: suggest A");
            return;
        }
        var target = words[1].toUpperCase(Locale.ROOT);
        if (!Validation.isFactName(target)) {
            out.println("Suggestion target must be a single fact letter.");
            return;
        }
        var base = effectiveFacts();
        if (new Reasoner(rules, base).query(target) == Truth.TRUE) {
            out.println(target + " is already TRUE with current facts.");
            return;
        }
        var found = suggestions(target, base);
        if (found.isEmpty()) out.println("No single-fact suggestion found to make " + target + " TRUE.");
        else out.println("Asserting any of these would make " + target + " TRUE: " + String.join(", ", found));
    }

    /** Facts not yet asserted whose single addition makes {@code target} TRUE. */
    public List<String> suggestions(String target, Set<String> base) {
        var found = new ArrayList<String>();
        for (var candidate : knownFacts) {
            if (found.size() >= config.suggestions()) break;
            if (candidate.equals(target) || base.contains(candidate)) continue;
            var trial = new TreeSet<>(base);
            trial.add(candidate);
            if (new Reasoner(rules, trial).query(target) == Truth.TRUE) found.add(candidate);
        }
        return found;
    }

    private void explain(String[] words) {
        if (words.length != 2 || !Validation.isFactName(words[1].toUpperCase(Locale.ROOT))) {
            out.println("Usage: explain A");
            return;
        }
        out.println(new Explain(rules, effectiveFacts(), config.formal()).explain(words[1].toUpperCase(Locale.ROOT)));
    }

    private void export(String[] words) {
        if (words.length < 3) {
            out.println("Usage: export dot <filename> or export json <filename>");
            return;
        }
        var format = words[1].toLowerCase(Locale.ROOT);
        if (!format.equals("dot") && !format.equals("json")) {
            out.println("Format must be \"dot\" or \"json\"");
            return;
        }
        var file = Path.of(words[2]);
        var queries = knownFacts.stream().toList();
        try {
            var graph = new GraphExport(rules, effectiveFacts()).build(queries);
            if (format.equals("dot")) {
                graph.writeDot(file);
                out.println("Graph exported to " + file + " (DOT format)");
                out.println("  Visualize with: dot -Tpng " + file + " -o graph.png");
            } else {
                graph.writeJson(file);
                out.println("Graph exported to " + file + " (JSON format)");
            }
        } catch (IOException e) {
            logger.error("Export to {} failed", file, e);
            out.println("Export failed: " + e.getMessage());
        }
    }

    private void printResult(String fact, Truth value) {
        var line = fact + ": " + value.mark + " " + value;
        if (!config.color()) {
            out.println(line);
            return;
        }
        var color = switch (value) {
            case TRUE -> GREEN;
            case FALSE -> RED;
            case UNDETERMINED -> YELLOW;
        };
        out.println(color + line + RESET);
    }

    private void printFacts() {
        out.println("Currently TRUE facts: " + (facts.isEmpty() ? "(none)" : String.join(", ", facts)));
    }

    private void printHelp() {
        out.println("""

                Interactive Mode Commands:
                  +A, +B, ...      Set fact(s) to TRUE (persist)
                  -A, -B, ...      Remove fact(s) from current facts (persist)
                  ?A, ?B, ...      Query fact(s) using current facts + what-if stack
                  facts            Show current facts
                  reset            Reset to original initial facts
                  rules            Show loaded rules
                  push +A          Push a temporary assertion (what-if)
                  pop              Pop last temporary assertion
                  temp             Show temporary assertions stack
                  clear_temp       Clear temporary assertions
                  suggest A        Try single-fact additions to make A TRUE
                  explain A        Show the reasoning for A
                  export dot <f>   Export justification graph as DOT file
                  export json <f>  Export justification graph as JSON file
                  help             Show this help
                  quit, exit       Exit interactive mode""");
    }

    private static List<String> letters(String text) {
        var names = new ArrayList<String>();
        for (var c : text.toUpperCase(Locale.ROOT).replace(",", "").replace(" ", "").toCharArray())
            names.add(String.valueOf(c));
        return names;
    }

    /** One what-if step: facts added, then facts removed. */
    public record Frame(Set<String> add, Set<String> remove) {
        public Frame {
            add = Set.copyOf(add);
            remove = Set.copyOf(remove);
        }

        @Override
        public String toString() {
            return "+" + String.join("", new TreeSet<>(add)) + " -" + String.join("", new TreeSet<>(remove));
        }
    }
}
