package org.natded.logic;

import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class FormulaTest {

    private static final Formula A = Formula.atom("A");
    private static final Formula B = Formula.atom("B");
    private static final Formula C = Formula.atom("C");

    @Test
    public void testStructuralEquality() {
        Formula first = Formula.to(Formula.or(A, B), C);
        Formula second = Formula.to(Formula.or(Formula.atom("A"), Formula.atom("B")), Formula.atom("C"));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(Formula.and(A, B), Formula.and(B, A));
        assertNotEquals(Formula.and(A, B), Formula.or(A, B));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAtomRequiresName() {
        Formula.atom(" ");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOperandsMustNotBeNull() {
        Formula.and(A, null);
    }

    @Test(expected = IllegalStateException.class)
    public void testNegationHasNoRightOperand() {
        Formula.not(A).getRight();
    }

    @Test
    public void testPlainText() {
        assertEquals("(A ∨ B → C) → (A → C) ∧ (B → C)",
                Formula.to(Formula.to(Formula.or(A, B), C),
                        Formula.and(Formula.to(A, C), Formula.to(B, C))).toString());
        assertEquals("¬¬A → A", Formula.to(Formula.not(Formula.not(A)), A).toString());
        assertEquals("¬(A ∧ B)", Formula.not(Formula.and(A, B)).toString());
        assertEquals("(A ∧ B) ∨ ¬C", Formula.or(Formula.and(A, B), Formula.not(C)).toString());
        assertEquals("A → (B → A)", Formula.to(A, Formula.to(B, A)).toString());
    }

    @Test
    public void testTexText() {
        assertEquals("\\lnot A \\land B \\to A \\lor B",
                Formula.to(Formula.and(Formula.not(A), B), Formula.or(A, B)).toTex());
    }

    @Test
    public void testAtomsAreSorted() {
        Formula formula = Formula.to(Formula.and(C, A), Formula.or(B, A));
        assertEquals(List.of("A", "B", "C"), List.copyOf(formula.atoms()));
    }

    @Test
    public void testEvaluate() {
        Map<String, Boolean> assignment = new HashMap<>();
        assignment.put("A", true);
        assignment.put("B", false);

        assertFalse(Formula.to(A, B).evaluate(assignment));
        assertTrue(Formula.to(B, A).evaluate(assignment));
        assertTrue(Formula.or(B, Formula.not(B)).evaluate(assignment));
        assertFalse(Formula.and(A, B).evaluate(assignment));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEvaluateMissingAtom() {
        Formula.or(A, C).evaluate(Map.of("A", false));
    }

    @Test
    public void testCanYield() {
        Formula formula = Formula.and(A, Formula.to(B, C));

        assertTrue(formula.canYield(formula));
        assertTrue(formula.canYield(A));
        assertTrue(formula.canYield(C));
        assertFalse(formula.canYield(B));
        assertFalse(Formula.or(A, B).canYield(A));
        assertFalse(Formula.not(A).canYield(A));
    }

    @Test
    public void testReachesDisjunction() {
        assertTrue(Formula.or(A, B).reachesDisjunction());
        assertTrue(Formula.and(A, Formula.or(B, C)).reachesDisjunction());
        assertTrue(Formula.to(A, Formula.and(B, Formula.or(A, C))).reachesDisjunction());
        assertFalse(Formula.to(Formula.or(A, B), C).reachesDisjunction());
        assertFalse(Formula.not(Formula.or(A, B)).reachesDisjunction());
        assertFalse(A.reachesDisjunction());
    }
}
