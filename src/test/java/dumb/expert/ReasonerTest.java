package dumb.expert;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static dumb.expert.Truth.*;
import static org.junit.jupiter.api.Assertions.*;

class ReasonerTest {

    private static Reasoner reasoner(Set<String> facts, String... lines) throws SyntaxException {
        var rules = new ArrayList<Rule>();
        for (var l : lines) rules.add(Parser.rule(l));
        return new Reasoner(rules, facts);
    }

    @Test
    void initialFactsAreTrue() throws SyntaxException {
        var r = reasoner(Set.of("A", "Q"), "B => A");
        assertEquals(TRUE, r.query("A"));
        assertEquals(TRUE, r.query("Q"));
    }

    @Test
    void closedWorld() throws SyntaxException {
        var r = reasoner(Set.of(), "A => B");
        assertEquals(FALSE, r.query("A"));
        assertEquals(FALSE, r.query("Z"));
        assertEquals(FALSE, r.query("B"));
    }

    @Test
    void cachedResultsAreNotRecomputed() throws SyntaxException {
        var r = reasoner(Set.of("A"), "A => B", "B => C");
        assertEquals(TRUE, r.query("C"));
        var evaluations = r.evaluations();
        assertEquals(3, evaluations);
        assertEquals(TRUE, r.query("C"));
        assertEquals(TRUE, r.query("B"));
        assertEquals(evaluations, r.evaluations());
    }

    @Test
    void resetCacheForcesReevaluation() throws SyntaxException {
        var r = reasoner(Set.of("A"), "A => B");
        r.query("B");
        var before = r.evaluations();
        r.resetCache();
        assertEquals(TRUE, r.query("B"));
        assertTrue(r.evaluations() > before);
    }

    @Test
    void undeterminedIsNotCached() throws SyntaxException {
        var r = reasoner(Set.of(), "A => A");
        assertEquals(UNDETERMINED, r.query("A"));
        var before = r.evaluations();
        assertEquals(UNDETERMINED, r.query("A"));
        assertEquals(before + 1, r.evaluations());
    }

    @Test
    void selfReference() throws SyntaxException {
        assertEquals(UNDETERMINED, reasoner(Set.of(), "A => A").query("A"));
        assertEquals(TRUE, reasoner(Set.of("B"), "A => A", "B => A").query("A"));
    }

    @Test
    void contradiction() throws SyntaxException {
        var r = reasoner(Set.of("X"), "X => A", "X => !A");
        assertEquals(UNDETERMINED, r.query("A"));
    }

    @Test
    void negationWithoutPositiveSupportIsFalse() throws SyntaxException {
        assertEquals(FALSE, reasoner(Set.of("X"), "X => !A").query("A"));
    }

    @Test
    void negationWithUndeterminedCondition() throws SyntaxException {
        var r = reasoner(Set.of(), "C => C", "C => !A");
        assertEquals(UNDETERMINED, r.query("A"));
    }

    @Test
    void disjunctiveNegationAloneIsFalse() throws SyntaxException {
        assertEquals(FALSE, reasoner(Set.of("X"), "X => !A | B").query("A"));
    }

    @Test
    void disjunctiveNegationContradictsProof() throws SyntaxException {
        var r = reasoner(Set.of("X"), "X => A", "X => !A | B");
        assertEquals(UNDETERMINED, r.query("A"));
    }

    @Test
    void andConclusion() throws SyntaxException {
        var r = reasoner(Set.of("X"), "X => A + B");
        assertEquals(TRUE, r.query("A"));
        assertEquals(TRUE, r.query("B"));
    }

    @Test
    void orAndXorConclusions() throws SyntaxException {
        var or = reasoner(Set.of("X"), "X => A | B");
        assertEquals(UNDETERMINED, or.query("A"));
        assertEquals(UNDETERMINED, or.query("B"));
        var xor = reasoner(Set.of("X"), "X => A ^ B");
        assertEquals(UNDETERMINED, xor.query("A"));
    }

    @Test
    void definiteRuleWinsOverDisjunction() throws SyntaxException {
        var r = reasoner(Set.of("X", "Y"), "X => A | B", "Y => A");
        assertEquals(TRUE, r.query("A"));
        assertEquals(UNDETERMINED, r.query("B"));
    }

    @Test
    void biconditional() throws SyntaxException {
        assertEquals(TRUE, reasoner(Set.of("A"), "A <=> B").query("B"));
        assertEquals(TRUE, reasoner(Set.of("B"), "A <=> B").query("A"));
        assertEquals(FALSE, reasoner(Set.of(), "A <=> B").query("B"));
        assertEquals(FALSE, reasoner(Set.of(), "A <=> B").query("A"));
    }

    @Test
    void biconditionalResultIsIndependentOfQueryOrder() throws SyntaxException {
        var first = reasoner(Set.of("C"), "A <=> B", "C => B");
        assertEquals(TRUE, first.query("A"));
        assertEquals(TRUE, first.query("B"));
        var second = reasoner(Set.of("C"), "A <=> B", "C => B");
        assertEquals(TRUE, second.query("B"));
        assertEquals(TRUE, second.query("A"));
    }

    @Test
    void queryAllKeepsOrder() throws SyntaxException {
        var r = reasoner(Set.of("A"), "A => B");
        var results = r.queryAll(List.of("Z", "B", "A"));
        assertEquals(List.of("Z", "B", "A"), new ArrayList<>(results.keySet()));
        assertEquals(List.of(FALSE, TRUE, TRUE), new ArrayList<>(results.values()));
    }

    @Test
    void evaluateExpression() throws SyntaxException {
        var r = reasoner(Set.of("A"), "A => B");
        assertEquals(TRUE, r.evaluate(Parser.expression("A + B")));
        assertEquals(FALSE, r.evaluate(Parser.expression("A + !B")));
        assertEquals(TRUE, r.evaluate(Parser.expression("C | B")));
        assertEquals(FALSE, r.evaluate(Parser.expression("A ^ B")));
    }

    @Test
    void conclusionMatching() throws SyntaxException {
        assertEquals(TRUE, Reasoner.conclusionFor(Parser.expression("A"), "A"));
        assertEquals(FALSE, Reasoner.conclusionFor(Parser.expression("A"), "B"));
        assertEquals(TRUE, Reasoner.conclusionFor(Parser.expression("!A"), "!A"));
        assertEquals(FALSE, Reasoner.conclusionFor(Parser.expression("!A"), "A"));
        assertEquals(FALSE, Reasoner.conclusionFor(Parser.expression("!(A + B)"), "!A"));
        assertEquals(TRUE, Reasoner.conclusionFor(Parser.expression("A + (B | C)"), "A"));
        assertEquals(UNDETERMINED, Reasoner.conclusionFor(Parser.expression("A + (B | C)"), "B"));
        assertEquals(UNDETERMINED, Reasoner.conclusionFor(Parser.expression("A | B"), "B"));
        assertEquals(FALSE, Reasoner.conclusionFor(Parser.expression("A | B"), "C"));
        assertEquals(FALSE, Reasoner.conclusionFor(Parser.expression("A => B"), "B"));
    }

    @Test
    void rulesConcludingIsReadOnly() throws SyntaxException {
        var r = reasoner(Set.of(), "A <=> B", "C => !A");
        assertEquals(List.of(Parser.rule("A => B")), r.rulesConcluding().get("B"));
        assertEquals(List.of(Parser.rule("B => A")), r.rulesConcluding().get("A"));
        assertEquals(List.of(Parser.rule("C => !A")), r.rulesConcluding().get("!A"));
        assertThrows(UnsupportedOperationException.class, () -> r.rulesConcluding().clear());
    }

    @Test
    void listenerSeesEvaluation() throws SyntaxException {
        var events = new ArrayList<String>();
        var rules = List.of(Parser.rule("A => B"), Parser.rule("B => B"));
        var r = new Reasoner(rules, Set.of("A"), new Reasoner.Listener() {
            @Override
            public void enter(String fact, int depth) {
                events.add("enter " + fact + "@" + depth);
            }

            @Override
            public void exit(String fact, Truth value, Reasoner.Basis basis, int depth) {
                events.add("exit " + fact + " " + value + " " + basis);
            }

            @Override
            public void cached(String fact, Truth value, int depth) {
                events.add("cached " + fact);
            }
        });
        r.query("B");
        r.query("B");
        assertEquals(List.of("enter B@0", "enter A@1", "exit A TRUE INITIAL", "exit B TRUE DERIVED", "cached B"), events);
    }
}
