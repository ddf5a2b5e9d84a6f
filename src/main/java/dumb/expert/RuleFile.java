package dumb.expert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;

/**
 * The rules, initial facts and queries of one input text.
 * <p>
 * Extraction is line oriented and lenient: a line that does not lex or parse is skipped and
 * recorded as a {@link Warning}; the remaining lines are still read.
 *
 * @param facts        facts asserted true by {@code =} lines
 * @param negatedFacts facts written as {@code !X} on {@code =} lines; only consulted by {@link Validation}
 * @param queries      facts named on {@code ?} lines, in order, duplicates kept
 */
public record RuleFile(List<Rule> rules, Set<String> facts, Set<String> negatedFacts, List<String> queries,
                       List<Warning> warnings) {
    private static final Logger logger = LoggerFactory.getLogger(RuleFile.class);

    public RuleFile {
        rules = List.copyOf(requireNonNull(rules));
        facts = Collections.unmodifiableSet(new TreeSet<>(requireNonNull(facts)));
        negatedFacts = Collections.unmodifiableSet(new TreeSet<>(requireNonNull(negatedFacts)));
        queries = List.copyOf(requireNonNull(queries));
        warnings = List.copyOf(requireNonNull(warnings));
    }

    public static RuleFile load(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static RuleFile parse(String text) {
        var rules = new ArrayList<Rule>();
        var facts = new TreeSet<String>();
        var negated = new TreeSet<String>();
        var queries = new ArrayList<String>();
        var warnings = new ArrayList<Warning>();

        var lines = text.split("\n", -1);
        for (var i = 0; i < lines.length; i++) {
            var lineNum = i + 1;
            var line = lines[i];
            var hash = line.indexOf('#');
            if (hash >= 0) line = line.substring(0, hash);
            line = line.strip();
            if (line.isEmpty()) continue;

            try {
                if (line.startsWith("=")) {
                    collectFacts(Lexer.tokenize(line.substring(1)), facts, negated);
                } else if (line.startsWith("?")) {
                    for (var t : Lexer.tokenize(line.substring(1)))
                        if (t.is(Token.Kind.FACT)) queries.add(t.lexeme());
                } else {
                    var tokens = Lexer.tokenize(line);
                    var isRule = tokens.size() > 2 && tokens.stream().anyMatch(t -> t.is(Token.Kind.IMPLIES) || t.is(Token.Kind.IFF));
                    if (!isRule) {
                        warnings.add(warn(lineNum, line, "Not a rule, fact or query line"));
                        continue;
                    }
                    var rule = new Parser(tokens).parseRule();
                    if (Knowledge.concludedFacts(rule.conclusion()).isEmpty()) {
                        warnings.add(warn(lineNum, line, "Conclusion '" + rule.conclusion() + "' concludes no fact"));
                        continue;
                    }
                    rules.add(rule);
                }
            } catch (SyntaxException e) {
                warnings.add(warn(lineNum, line, e.getMessage()));
            }
        }
        return new RuleFile(rules, facts, negated, queries, warnings);
    }

    private static void collectFacts(List<Token> tokens, Set<String> facts, Set<String> negated) {
        var negate = false;
        for (var t : tokens) {
            switch (t.kind()) {
                case NOT -> negate = true;
                case FACT -> {
                    (negate ? negated : facts).add(t.lexeme());
                    negate = false;
                }
                default -> negate = false;
            }
        }
    }

    private static Warning warn(int line, String text, String message) {
        logger.warn("Could not parse line {}: {} ({})", line, text, message);
        return new Warning(line, text, message);
    }

    /** Facts referenced by any rule, asserted, or queried. */
    public Set<String> allFacts() {
        var s = new TreeSet<>(facts);
        s.addAll(negatedFacts);
        rules.forEach(r -> s.addAll(r.facts()));
        s.addAll(queries);
        return Collections.unmodifiableSet(s);
    }

    public record Warning(int line, String text, String message) {
        @Override
        public String toString() {
            return "line " + line + ": " + text + " (" + message + ")";
        }
    }
}
