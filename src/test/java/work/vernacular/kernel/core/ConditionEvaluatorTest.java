package work.vernacular.kernel.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.vernacular.kernel.flow.EvaluationException;
import work.vernacular.kernel.flow.NameResolutionException;
import work.vernacular.kernel.runtime.ScopeStack;

class ConditionEvaluatorTest {
    private final ConditionEvaluator evaluator = new ConditionEvaluator();
    private ScopeStack scopes;

    @BeforeEach
    void setUp() {
        scopes = new ScopeStack();
        scopes.bind("age", 21L);
        scopes.bind("price", 9.5);
        scopes.bind("name", "Alice");
        scopes.bind("items", new ArrayList<Object>(List.of("pen", 3L)));
        scopes.bind("empty", new ArrayList<Object>());
        scopes.bind("blank", "");
        scopes.bind("ready", true);
    }

    @Test
    void numericComparisons() {
        assertTrue(evaluator.evaluate("age is greater than 18", scopes));
        assertFalse(evaluator.evaluate("age is less than 21", scopes));
        assertTrue(evaluator.evaluate("age is at least 21", scopes));
        assertTrue(evaluator.evaluate("price is at most 9.5", scopes));
        assertTrue(evaluator.evaluate("age is greater than or equal to 21", scopes));
        assertTrue(evaluator.evaluate("price is less than or equal to 10", scopes));
        assertTrue(evaluator.evaluate("price is less than age", scopes));
    }

    @Test
    void equalityUsesNumericValueWhenBothSidesAreNumbers() {
        assertTrue(evaluator.evaluate("age equals 21.0", scopes));
        assertTrue(evaluator.evaluate("name is equal to \"Alice\"", scopes));
        assertTrue(evaluator.evaluate("name does not equal 'Bob'", scopes));
        assertFalse(evaluator.evaluate("name is not equal to \"Alice\"", scopes));
    }

    @Test
    void containsAndEmptiness() {
        assertTrue(evaluator.evaluate("items contains \"pen\"", scopes));
        assertTrue(evaluator.evaluate("items contains 3", scopes));
        assertTrue(evaluator.evaluate("name contains \"lic\"", scopes));
        assertTrue(evaluator.evaluate("list empty is empty", scopes));
        assertTrue(evaluator.evaluate("blank is empty", scopes));
        assertTrue(evaluator.evaluate("items is not empty", scopes));
        assertTrue(evaluator.evaluate("list items has 2 items", scopes));
        assertFalse(evaluator.evaluate("list items has 3 items", scopes));
    }

    @Test
    void booleanConnectivesWithAndBindingTighter() {
        assertTrue(evaluator.evaluate("age is less than 10 or age is greater than 20 and name equals \"Alice\"", scopes));
        assertFalse(evaluator.evaluate("age is less than 10 or age is greater than 20 and name equals \"Bob\"", scopes));
        assertTrue(evaluator.evaluate("not age is less than 10", scopes));
        assertTrue(evaluator.evaluate("ready", scopes));
        assertFalse(evaluator.evaluate("TRUE and false", scopes));
    }

    @Test
    void keywordsInsideQuotesAreNotConnectives() {
        scopes.bind("phrase", "salt and pepper");

        assertTrue(evaluator.evaluate("phrase equals \"salt and pepper\"", scopes));
    }

    @Test
    void unknownVariableIsNameError() {
        var error = assertThrows(NameResolutionException.class, () -> evaluator.evaluate("ghost is greater than 1", scopes));
        assertEquals("ghost", error.name());
    }

    @Test
    void malformedConditionsAreEvaluationErrors() {
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("age is roughly 20", scopes));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("name is greater than 3", scopes));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("  ", scopes));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("list name is empty", scopes));
    }

    @Test
    void splitKeywordIgnoresQuotedText() {
        assertEquals(List.of("a equals \"x or y\"", "b"), ConditionEvaluator.splitKeyword("a equals \"x or y\" or b", "or"));
    }
}
