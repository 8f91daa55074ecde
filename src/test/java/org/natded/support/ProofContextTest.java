package org.natded.support;

import org.junit.Test;
import org.natded.logic.Formula;

import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

public class ProofContextTest {

    private static final Formula A = Formula.atom("A");
    private static final Formula B = Formula.atom("B");

    @Test
    public void testPushLeavesParentUntouched() {
        ProofContext parent = ProofContext.empty().push(A, 1);
        ProofContext left = parent.push(B, 2);
        ProofContext right = parent.push(Formula.not(B), 3);

        assertEquals(1, parent.size());
        assertFalse(parent.contains(B));
        assertTrue(left.contains(B));
        assertFalse(right.contains(B));
        assertFalse(left.contains(Formula.not(B)));
        assertTrue(ProofContext.empty().isEmpty());
    }

    @Test
    public void testFindReturnsMostRecent() {
        ProofContext context = ProofContext.empty().push(A, 1).push(B, 2).push(A, 5);

        Optional<Assumption> found = context.find(A);
        assertTrue(found.isPresent());
        assertEquals(5, found.get().reference());
        assertFalse(context.find(Formula.not(A)).isPresent());
    }

    @Test
    public void testOrdering() {
        ProofContext context = ProofContext.empty().push(A, 1).push(B, 2);

        assertEquals(List.of(new Assumption(A, 1), new Assumption(B, 2)), context.getAssumptions());
        assertEquals(List.of(new Assumption(B, 2), new Assumption(A, 1)), context.mostRecentFirst());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReferencesMustIncrease() {
        ProofContext.empty().push(A, 2).push(B, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReferenceMustBePositive() {
        new Assumption(A, 0);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testAssumptionsAreReadOnly() {
        ProofContext.empty().push(A, 1).getAssumptions().add(new Assumption(B, 2));
    }

    @Test
    public void testAssumptionText() {
        assertEquals("[A]3", new Assumption(A, 3).toString());
    }
}
