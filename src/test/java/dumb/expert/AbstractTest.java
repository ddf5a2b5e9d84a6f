package dumb.expert;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Runs a rule-file script through the whole pipeline: extraction, validation, inference.
 * Expectations are written {@code "C=TRUE D=FALSE"}.
 */
abstract class AbstractTest {

    protected static RuleFile load(String script) {
        var file = RuleFile.parse(script);
        if (!file.warnings().isEmpty())
            fail("Script has unparsable lines:\n" + file.warnings().stream().map(RuleFile.Warning::toString).collect(Collectors.joining("\n")));
        return file;
    }

    protected static Map<String, Truth> run(String script) {
        var file = load(script);
        try {
            Validation.validate(file);
        } catch (Validation.ValidationException e) {
            fail("Script failed validation: " + e.getMessage());
        }
        return new Reasoner(file).queryAll(file.queries());
    }

    protected static Map<String, Truth> expected(String expectations) {
        var m = new LinkedHashMap<String, Truth>();
        for (var pair : expectations.trim().split("\\s+")) {
            var eq = pair.indexOf('=');
            if (eq < 1) throw new IllegalArgumentException("Expected FACT=VALUE, got: " + pair);
            m.put(pair.substring(0, eq), Truth.valueOf(pair.substring(eq + 1)));
        }
        return m;
    }

    protected static void runTest(String script, String expectations) {
        var want = expected(expectations);
        var got = run(script);
        assertEquals(want, got, () -> "Results differ for script:\n" + script);
        assertEquals(want.keySet().stream().toList(), got.keySet().stream().toList(), "Query order");
    }
}
