package org.natded;

import org.junit.Before;
import org.junit.Test;
import org.natded.deduction.ProofNode;
import org.natded.deduction.ProofSearch;
import org.natded.deduction.ProofStatistics;
import org.natded.deduction.SearchBudget;
import org.natded.deduction.SearchResult;
import org.natded.logic.Formula;
import org.natded.logic.ParseError;
import org.natded.render.RenderMode;
import org.natded.support.Assumption;
import org.natded.support.ProofContext;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * Test della pipeline completa, un esito per ogni tipo di fallimento.
 */
public class ProverTest {

    private Prover prover;

    @Before
    public void setUp() {
        prover = new Prover();
    }

    @Test
    public void testProvedPlain() {
        ProofOutcome outcome = prover.prove("A to B to A");

        assertEquals(ProofOutcome.Kind.PROVED, outcome.getKind());
        assertTrue(outcome.isProved());
        assertEquals("A → (B → A) : 1\n+ B → A\n  + A from: 1\n", outcome.toDisplayText());
        assertNotNull(outcome.getStatistics());
    }

    @Test
    public void testProvedTex() {
        ProofOutcome outcome = prover.prove("A to A", ProverOptions.defaults().withRenderMode(RenderMode.TEX));

        assertTrue(outcome.isProved());
        assertTrue(outcome.getRendered().startsWith("\\begin{prooftree}"));
    }

    @Test
    public void testParseFailure() {
        ProofOutcome outcome = prover.prove("A and B and C");

        assertEquals(ProofOutcome.Kind.PARSE_FAILED, outcome.getKind());
        assertEquals(ParseError.Kind.AMBIGUOUS_CHAIN, outcome.getParseError().getKind());
        assertNull(outcome.getFormula());
        assertTrue(outcome.toDisplayText().startsWith("error when parsing:\n"));
    }

    @Test
    public void testNotATautology() {
        ProofOutcome outcome = prover.prove("A to B");

        assertEquals(ProofOutcome.Kind.NOT_A_TAUTOLOGY, outcome.getKind());
        assertNull(outcome.getSearchResult());
        assertEquals("error when checking:\nA → B turns out false when: {A=true, B=false}",
                outcome.toDisplayText());
    }

    @Test
    public void testSearchExhausted() {
        ProofOutcome outcome = prover.prove("not (not A) to A");

        assertEquals(ProofOutcome.Kind.SEARCH_EXHAUSTED, outcome.getKind());
        assertEquals(SearchResult.Status.EXHAUSTED, outcome.getSearchResult().getStatus());
        assertEquals("error when solving:\ncould not infer: ¬¬A → A", outcome.toDisplayText());
    }

    @Test
    public void testWithoutClassicalCheckSearchRuns() {
        ProofOutcome outcome = prover.prove("A to B", ProverOptions.defaults().withClassicalCheck(false));

        assertEquals(ProofOutcome.Kind.SEARCH_EXHAUSTED, outcome.getKind());
        assertEquals("error when solving:\ncould not infer: A → B", outcome.toDisplayText());
    }

    @Test
    public void testBudgetExceededIsReported() {
        ProverOptions options = ProverOptions.defaults().withBudget(new SearchBudget(64, 3));
        ProofOutcome outcome = prover.prove("((A or B) to C) to (A to C) and (B to C)", options);

        assertEquals(ProofOutcome.Kind.SEARCH_EXHAUSTED, outcome.getKind());
        assertEquals(SearchResult.Status.BUDGET_EXCEEDED, outcome.getSearchResult().getStatus());
        assertTrue(outcome.toDisplayText().endsWith("(search budget exceeded)"));
    }

    @Test
    public void testRequestsAreIndependent() {
        String first = prover.prove("(A or B) to (B or A)").toDisplayText();
        prover.prove("A and B and C");
        prover.prove("((A or B) to C) to (A to C) and (B to C)");

        assertEquals(first, prover.prove("(A or B) to (B or A)").toDisplayText());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOptionsRequired() {
        prover.prove("A", null);
    }

    /**
     * Una ricerca difettosa che restituisce una foglia mai scaricata: il
     * validatore la rifiuta e la richiesta successiva non ne risente.
     */
    @Test
    public void testInvariantViolationBecomesInternalError() {
        AtomicInteger searches = new AtomicInteger();
        Prover faulty = new Prover(budget -> searches.getAndIncrement() == 0
                ? new DanglingLeafSearch(budget)
                : new ProofSearch(budget));

        ProofOutcome broken = faulty.prove("A to A");
        assertEquals(ProofOutcome.Kind.INTERNAL_ERROR, broken.getKind());
        assertFalse(broken.isProved());
        assertEquals("A → A", broken.getFormula().toString());
        assertNull(broken.getRendered());
        assertTrue(broken.toDisplayText().startsWith("internal error:\n"));

        ProofOutcome next = faulty.prove("A to A");
        assertEquals(ProofOutcome.Kind.PROVED, next.getKind());
        assertEquals("A → A : 1\n+ A from: 1\n", next.toDisplayText());
        assertEquals(2, searches.get());
    }

    private static class DanglingLeafSearch extends ProofSearch {

        DanglingLeafSearch(SearchBudget budget) {
            super(budget);
        }

        @Override
        public SearchResult search(Formula goal, ProofContext context) {
            ProofNode leaf = ProofNode.assumption(new Assumption(goal, 7));
            return SearchResult.proved(goal, leaf, new ProofStatistics());
        }
    }
}
