package dumb.expert;

import dumb.expert.tool.Explain;
import dumb.expert.tool.GraphExport;
import dumb.expert.tool.Shell;
import dumb.expert.tool.Stats;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Command-line front end: loads a rule file, validates it and prints one {@code X: VALUE}
 * line per query, or hands the rules to one of the tools.
 */
public class ExpertSystem {
    private static final Logger logger = LoggerFactory.getLogger(ExpertSystem.class);
    private static final String SEPARATOR = "=".repeat(70);

    private static final String USAGE = """
            Usage: expert <rule-file> [options]

            Options:
              --explain          print a reasoning trace for each query
              --stats            print rule-set statistics instead of results
              --dot <file>       export the justification graph as Graphviz DOT
              --json <file>      export the justification graph as JSON
              --interactive      start the interactive shell
              --config <file>    load configuration from a JSON file
              -h, --help         show this help""";

    public static void main(String[] args) {
        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.exit(run(args, in, System.out, System.err));
    }

    /** @return the process exit code */
    public static int run(String[] args, BufferedReader in, PrintStream out, PrintStream err) {
        String file = null, dot = null, json = null, configFile = null;
        boolean explain = false, stats = false, interactive = false;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-h", "--help" -> {
                        out.println(USAGE);
                        return 0;
                    }
                    case "--explain" -> explain = true;
                    case "--stats" -> stats = true;
                    case "--interactive", "-i" -> interactive = true;
                    case "--dot" -> dot = args[++i];
                    case "--json" -> json = args[++i];
                    case "--config" -> configFile = args[++i];
                    default -> {
                        if (args[i].startsWith("-")) {
                            err.println("Error: Unknown option: " + args[i]);
                            err.println(USAGE);
                            return 1;
                        }
                        if (file != null) {
                            err.println("Error: More than one rule file given: " + file + ", " + args[i]);
                            return 1;
                        }
                        file = args[i];
                    }
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                err.println("Error: Missing argument for " + args[i - 1]);
                return 1;
            }
        }
        if (file == null) {
            err.println(USAGE);
            return 1;
        }

        try {
            var config = configFile != null ? Configuration.load(Path.of(configFile)) : Configuration.load();
            var rules = RuleFile.load(Path.of(file));
            logger.info("Loaded {}: {} rules, {} facts, {} queries, {} warnings", file,
                    rules.rules().size(), rules.facts().size(), rules.queries().size(), rules.warnings().size());

            if (!(interactive && rules.queries().isEmpty()))
                Validation.validate(rules);

            if (stats) {
                out.print(Stats.of(rules.rules(), rules.facts()).report());
                return 0;
            }
            if (interactive) {
                new Shell(rules.rules(), rules.facts(), config, out).run(in);
                return 0;
            }

            if (config.verbose()) banner(rules, out);

            var results = new Reasoner(rules).queryAll(rules.queries());
            // duplicates in the query list print once per occurrence
            for (var q : rules.queries()) out.println(q + ": " + results.get(q));

            if (explain) {
                var explainer = new Explain(rules.rules(), rules.facts(), config.formal());
                for (var q : rules.queries().stream().distinct().toList()) {
                    out.println();
                    out.println(SEPARATOR);
                    out.println("EXPLANATION FOR " + q);
                    out.println(SEPARATOR);
                    out.println(explainer.explain(q));
                }
            }

            if (dot != null || json != null) {
                var graph = new GraphExport(rules.rules(), rules.facts()).build(rules.queries());
                export(graph, dot, json, out);
            }
            return 0;
        } catch (Validation.ValidationException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (NoSuchFileException e) {
            err.println("Error: File not found: " + e.getFile());
            return 1;
        } catch (IOException e) {
            logger.debug("I/O failure", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void export(GraphExport graph, @Nullable String dot, @Nullable String json, PrintStream out) throws IOException {
        if (dot != null) {
            graph.writeDot(Path.of(dot));
            out.println("Graph exported to " + dot + " (DOT format)");
        }
        if (json != null) {
            graph.writeJson(Path.of(json));
            out.println("Graph exported to " + json + " (JSON format)");
        }
    }

    private static void banner(RuleFile rules, PrintStream out) {
        out.println(SEPARATOR);
        out.println("EXPERT SYSTEM");
        out.println(SEPARATOR);
        out.println("Rules: " + rules.rules().size());
        rules.rules().forEach(r -> out.println("  " + r));
        out.println("Initial facts: " + (rules.facts().isEmpty() ? "(none)" : String.join(", ", rules.facts())));
        out.println("Queries: " + String.join(", ", rules.queries()));
        out.println(SEPARATOR);
    }
}
