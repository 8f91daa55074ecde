package org.natded.logic;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Test del parser: precedenze, associatività, catene ambigue, notazioni
 * alternative e classificazione degli errori.
 */
public class FormulaParserTest {

    private FormulaParser parser;

    private static final Formula A = Formula.atom("A");
    private static final Formula B = Formula.atom("B");
    private static final Formula C = Formula.atom("C");

    @Before
    public void setUp() {
        parser = new FormulaParser();
    }

    private ParseError parseFailure(String text) {
        try {
            Formula formula = parser.parse(text);
            fail("Atteso ParseError per \"" + text + "\", ottenuto " + formula);
            return null;
        } catch (ParseError e) {
            return e;
        }
    }

    //region PRECEDENZE

    @Test
    public void testPrecedenceNotAndOrTo() throws ParseError {
        Formula implicit = parser.parse("not A and B to (A to B)");
        Formula explicit = parser.parse("((not A) and B) to (A to B)");

        assertEquals(explicit, implicit);
        assertEquals(Formula.to(Formula.and(Formula.not(A), B), Formula.to(A, B)), implicit);
    }

    @Test
    public void testAndBindsTighterThanOr() throws ParseError {
        assertEquals(Formula.or(Formula.and(A, B), C), parser.parse("A and B or C"));
        assertEquals(Formula.or(A, Formula.and(B, C)), parser.parse("A or B and C"));
    }

    @Test
    public void testImplicationIsRightAssociative() throws ParseError {
        assertEquals(Formula.to(A, Formula.to(B, C)), parser.parse("A to B to C"));
        assertEquals(Formula.to(Formula.to(A, B), C), parser.parse("(A to B) to C"));
    }

    @Test
    public void testNestedNegation() throws ParseError {
        assertEquals(Formula.not(Formula.not(A)), parser.parse("not not A"));
        assertEquals(Formula.not(Formula.not(A)), parser.parse("not (not A)"));
    }

    @Test
    public void testParenthesizedChainsAreAccepted() throws ParseError {
        assertEquals(Formula.and(Formula.and(A, B), C), parser.parse("(A and B) and C"));
        assertEquals(Formula.or(A, Formula.or(B, C)), parser.parse("A or (B or C)"));
    }

    //endregion

    //region NOTAZIONI

    @Test
    public void testKeywordsAreCaseInsensitive() throws ParseError {
        assertEquals(parser.parse("not A and B"), parser.parse("NOT A And B"));
        assertEquals(parser.parse("A to B"), parser.parse("A TO B"));
    }

    @Test
    public void testTexAndUnicodeOperators() throws ParseError {
        Formula expected = parser.parse("(not A or B) to (A and B)");

        assertEquals(expected, parser.parse("(\\lnot A \\lor B) \\to (A \\land B)"));
        assertEquals(expected, parser.parse("(¬A ∨ B) → (A ∧ B)"));
    }

    @Test
    public void testIdentifiers() throws ParseError {
        assertEquals(Formula.atom("p_1"), parser.parse("p_1"));
        assertEquals(Formula.atom("toast"), parser.parse("  toast  "));
        assertEquals(Formula.and(Formula.atom("Nota"), Formula.atom("_x")), parser.parse("Nota and _x"));
    }

    @Test
    public void testPlainOutputParsesBack() throws ParseError {
        String[] inputs = {
                "((A or B) to C) to (A to C) and (B to C)",
                "not A and B to (A to B)",
                "(A and B) and C",
                "A or (B and not C)",
                "((A to B) to A) to A",
                "not (A to B) or not not C"
        };

        for (String input : inputs) {
            Formula formula = parser.parse(input);
            assertEquals(input, formula, parser.parse(formula.toString()));
        }
    }

    //endregion

    //region ERRORI

    @Test
    public void testAmbiguousChains() {
        ParseError and = parseFailure("A and B and C");
        assertEquals(ParseError.Kind.AMBIGUOUS_CHAIN, and.getKind());
        assertEquals(8, and.getPosition());

        ParseError or = parseFailure("A or B or C");
        assertEquals(ParseError.Kind.AMBIGUOUS_CHAIN, or.getKind());
        assertEquals(7, or.getPosition());

        assertEquals(ParseError.Kind.AMBIGUOUS_CHAIN, parseFailure("(A and B and C) to D").getKind());
    }

    @Test
    public void testEmptyInput() {
        assertEquals(ParseError.Kind.EMPTY_INPUT, parseFailure("").getKind());
        assertEquals(ParseError.Kind.EMPTY_INPUT, parseFailure("   ").getKind());
    }

    @Test
    public void testUnknownToken() {
        ParseError error = parseFailure("A & B");
        assertEquals(ParseError.Kind.UNKNOWN_TOKEN, error.getKind());
        assertEquals(2, error.getPosition());
        assertEquals("&", error.getFragment());
    }

    @Test
    public void testUnbalancedParenthesis() {
        ParseError unclosed = parseFailure("(A and B");
        assertEquals(ParseError.Kind.UNBALANCED_PARENTHESIS, unclosed.getKind());
        assertEquals(0, unclosed.getPosition());

        ParseError stray = parseFailure("A )");
        assertEquals(ParseError.Kind.UNBALANCED_PARENTHESIS, stray.getKind());
        assertEquals(2, stray.getPosition());
    }

    @Test
    public void testTrailingInput() {
        ParseError error = parseFailure("A B");
        assertEquals(ParseError.Kind.TRAILING_INPUT, error.getKind());
        assertEquals(2, error.getPosition());
    }

    @Test
    public void testUnexpectedEnd() {
        ParseError error = parseFailure("A and");
        assertEquals(ParseError.Kind.UNEXPECTED_END, error.getKind());
        assertEquals(5, error.getPosition());
    }

    @Test
    public void testUnexpectedToken() {
        ParseError error = parseFailure("to A");
        assertEquals(ParseError.Kind.UNEXPECTED_TOKEN, error.getKind());
        assertEquals(0, error.getPosition());
    }

    @Test
    public void testNestingTooDeep() {
        ParseError error = parseFailure("not ".repeat(3000) + "A");
        assertEquals(ParseError.Kind.TOO_DEEP, error.getKind());
        assertEquals(4 * FormulaParser.MAX_NESTING, error.getPosition());
        assertEquals("not", error.getFragment());

        ParseError parenthesized = parseFailure("(".repeat(500) + "A" + ")".repeat(500));
        assertEquals(ParseError.Kind.TOO_DEEP, parenthesized.getKind());
    }

    @Test
    public void testNestingWithinLimit() throws ParseError {
        Formula formula = parser.parse("not ".repeat(50) + "(A and B)");
        for (int i = 0; i < 50; i++) {
            assertEquals(Formula.Type.NOT, formula.getType());
            formula = formula.getLeft();
        }
        assertEquals(Formula.and(A, B), formula);

        assertEquals(A, parser.parse("(".repeat(100) + "A" + ")".repeat(100)));
    }

    @Test
    public void testErrorMessageCarriesPositionAndFragment() {
        ParseError error = parseFailure("A and B and C");
        assertEquals("ambiguous chain, add parentheses at 8: 'and'", error.getMessage());
    }

    //endregion
}
