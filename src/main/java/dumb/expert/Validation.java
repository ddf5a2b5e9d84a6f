package dumb.expert;

import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Checks a {@link RuleFile} before any engine is built over it.
 */
public final class Validation {
    private static final Pattern FACT_NAME = Pattern.compile("[A-Z]");

    private Validation() {
    }

    public static boolean isFactName(String name) {
        return FACT_NAME.matcher(name).matches();
    }

    /**
     * @throws ValidationException when a fact name is not a single uppercase letter, no query
     *                             is given, or a fact is both asserted and negated in the initial facts
     */
    public static void validate(RuleFile file) throws ValidationException {
        if (file.queries().isEmpty())
            throw new ValidationException("No queries specified. Use ?<FACTS> to specify queries.");

        for (var f : file.allFacts()) {
            if (!isFactName(f))
                throw new ValidationException("Invalid fact name: " + f + ". Facts must be single uppercase letters (A-Z).");
        }

        var both = new TreeSet<>(file.facts());
        both.retainAll(file.negatedFacts());
        if (!both.isEmpty())
            throw new ValidationException("Contradiction: " + String.join(", ", both) + " is both asserted and negated.");
    }

    public static class ValidationException extends Exception {
        public ValidationException(String message) {
            super(message);
        }
    }
}
