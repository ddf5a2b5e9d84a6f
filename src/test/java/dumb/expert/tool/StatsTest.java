package dumb.expert.tool;

import dumb.expert.Expr;
import dumb.expert.Parser;
import dumb.expert.RuleFile;
import dumb.expert.SyntaxException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StatsTest {

    private Stats stats;

    @BeforeEach
    void setUp() {
        var file = RuleFile.parse("""
                A + B => C
                C <=> D
                !A | B => E
                =A
                ?E
                """);
        stats = Stats.of(file.rules(), file.facts());
    }

    @Test
    void counts() {
        assertEquals(3, stats.totalRules());
        assertEquals(1, stats.biconditionalRules());
        assertEquals(2, stats.regularRules());
        assertEquals(Map.of(Expr.Op.AND, 1, Expr.Op.OR, 1, Expr.Op.NOT, 1), stats.operators());
    }

    @Test
    void complexity() {
        assertEquals(List.of(1, 0, 2), stats.complexity());
        assertEquals(1.0, stats.averageComplexity().orElseThrow(), 1e-9);
        assertEquals(2, stats.maxComplexity().orElseThrow());
        assertEquals(0, stats.minComplexity().orElseThrow());
        assertEquals(2, stats.maxDepth());
    }

    @Test
    void facts() {
        assertEquals(Set.of("A"), stats.initialFacts());
        assertEquals(Set.of("A", "B", "C"), stats.factsUsed());
        assertEquals(Set.of("C", "D", "E"), stats.factsConcluded());
    }

    @Test
    void dependencies() {
        assertEquals(Set.of("A", "B", "D"), stats.dependencies().get("C"));
        assertEquals(Set.of("C"), stats.dependencies().get("D"));
        assertEquals(Set.of("A", "B"), stats.dependencies().get("E"));
        assertFalse(stats.dependencies().containsKey("A"));
        assertEquals(Set.of("C", "D"), stats.recursiveFacts());
    }

    @Test
    void mostComplexFirst() throws SyntaxException {
        assertEquals(List.of(Parser.rule("!A | B => E"), Parser.rule("A + B => C")), stats.mostComplex(2));
    }

    @Test
    void report() {
        var r = stats.report();
        assertTrue(r.startsWith("=".repeat(70) + "\nRULE SET STATISTICS\n"));
        assertTrue(r.contains("Total rules:            3"), r);
        assertTrue(r.contains("Initial facts:          A"), r);
        assertTrue(r.contains("Average complexity:     1.00"), r);
        assertTrue(r.contains("C depends on: A, B, D"), r);
        assertTrue(r.contains("Recursive: C, D"), r);
        assertTrue(r.contains("1. [2] !A | B => E"), r);
    }

    @Test
    void emptyRuleSet() {
        var empty = Stats.of(List.of(), Set.of());
        assertEquals(0, empty.totalRules());
        assertTrue(empty.averageComplexity().isEmpty());
        var r = empty.report();
        assertTrue(r.contains("Initial facts:          None"), r);
        assertFalse(r.contains("MOST COMPLEX RULES"), r);
    }
}
