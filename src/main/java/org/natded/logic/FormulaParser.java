package org.natded.logic;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.natded.antlr.LogicFormulaLexer;
import org.natded.antlr.LogicFormulaParser;
import org.natded.antlr.LogicFormulaParser.FormulaContext;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FORMULE - Pipeline ANTLR completa da testo a {@link Formula}
 *
 * Lexing -> controllo parentesi -> parsing -> visitor {@link FormulaBuilder}.
 * Ogni fase che fallisce produce un {@link ParseError} con tipo e posizione;
 * nessun errore viene stampato su console dagli ascoltatori di default di ANTLR.
 *
 * Privo di stato: la stessa istanza può servire richieste concorrenti.
 */
public class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /** Annidamento massimo accettato: parser, formule e ricerca sono ricorsivi */
    public static final int MAX_NESTING = 200;

    /**
     * Analizza il testo di una formula.
     *
     * @param text formula in notazione testuale (parole chiave, macro TeX o simboli Unicode)
     * @return formula costruita
     * @throws ParseError se l'input è vuoto, malformato o ambiguo
     */
    public Formula parse(String text) throws ParseError {
        if (text == null || text.trim().isEmpty()) {
            throw new ParseError(ParseError.Kind.EMPTY_INPUT, 0, "");
        }

        LOGGER.fine("Parsing formula: " + text);

        // FASE 1: lexing completo, così gli errori lessicali precedono quelli sintattici
        FirstErrorListener errors = new FirstErrorListener(text);
        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        errors.throwIfFailed();

        // FASE 2: bilanciamento parentesi e profondità
        checkParenthesisBalance(tokens.getTokens());
        checkNesting(tokens.getTokens());

        // FASE 3: parsing
        LogicFormulaParser parser = new LogicFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        FormulaContext tree = parser.formula();
        errors.throwIfFailed();

        // FASE 4: costruzione della formula
        return new FormulaBuilder().build(tree);
    }

    /**
     * Segnala la prima parentesi chiusa senza apertura, oppure la più interna
     * tra quelle aperte e mai chiuse.
     */
    private void checkParenthesisBalance(List<Token> tokens) throws ParseError {
        Deque<Token> open = new ArrayDeque<>();

        for (Token token : tokens) {
            if (token.getType() == LogicFormulaLexer.LPAR) {
                open.push(token);
            } else if (token.getType() == LogicFormulaLexer.RPAR) {
                if (open.isEmpty()) {
                    throw new ParseError(ParseError.Kind.UNBALANCED_PARENTHESIS,
                            token.getStartIndex(), token.getText());
                }
                open.pop();
            }
        }

        if (!open.isEmpty()) {
            Token unclosed = open.peek();
            throw new ParseError(ParseError.Kind.UNBALANCED_PARENTHESIS,
                    unclosed.getStartIndex(), unclosed.getText());
        }
    }

    /**
     * Stima l'annidamento della formula sui token: ogni negazione, parentesi
     * aperta o implicazione (associativa a destra) apre un livello. I connettivi
     * ∧ e ∨ restano allo stesso livello. Segnala il primo token oltre
     * {@link #MAX_NESTING}.
     */
    private void checkNesting(List<Token> tokens) throws ParseError {
        Deque<Integer> enclosing = new ArrayDeque<>();
        int base = 0;
        int depth = 0;

        for (Token token : tokens) {
            switch (token.getType()) {
                case LogicFormulaLexer.NOT -> depth++;
                case LogicFormulaLexer.LPAR -> {
                    enclosing.push(base);
                    base = ++depth;
                }
                case LogicFormulaLexer.RPAR -> {
                    base = enclosing.isEmpty() ? 0 : enclosing.pop();
                    depth = base;
                }
                case LogicFormulaLexer.IMPLIES -> {
                    base++;
                    depth = base;
                }
                case LogicFormulaLexer.IDENTIFIER -> depth = base;
            }

            if (depth > MAX_NESTING) {
                throw new ParseError(ParseError.Kind.TOO_DEEP, token.getStartIndex(), token.getText());
            }
        }
    }

    //region RACCOLTA ERRORI ANTLR

    /**
     * Ascoltatore che conserva soltanto il primo errore segnalato da lexer o
     * parser, già classificato come {@link ParseError}.
     */
    private static final class FirstErrorListener extends BaseErrorListener {

        private final String text;
        private ParseError first;

        FirstErrorListener(String text) {
            this.text = text;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            if (first != null) {
                return;
            }

            LOGGER.finest("Errore ANTLR " + line + ":" + charPositionInLine + " " + msg);

            if (offendingSymbol instanceof Token) {
                first = classify(recognizer, (Token) offendingSymbol);
            } else {
                first = lexicalError(line, charPositionInLine, e);
            }
        }

        private ParseError classify(Recognizer<?, ?> recognizer, Token token) {
            if (token.getType() == Token.EOF) {
                return new ParseError(ParseError.Kind.UNEXPECTED_END, text.length(), "");
            }

            // Errore sul token EOF atteso dalla regola radice: la formula è completa
            // ma seguita da altro testo
            if (recognizer instanceof LogicFormulaParser
                    && ((LogicFormulaParser) recognizer).getContext() instanceof FormulaContext) {
                return new ParseError(ParseError.Kind.TRAILING_INPUT,
                        token.getStartIndex(), text.substring(token.getStartIndex()).trim());
            }

            return new ParseError(ParseError.Kind.UNEXPECTED_TOKEN, token.getStartIndex(), token.getText());
        }

        private ParseError lexicalError(int line, int charPositionInLine, RecognitionException e) {
            int position;
            if (e instanceof LexerNoViableAltException) {
                position = ((LexerNoViableAltException) e).getStartIndex();
            } else {
                position = line == 1 ? charPositionInLine : 0;
            }

            String fragment = position < text.length()
                    ? new String(Character.toChars(text.codePointAt(position)))
                    : "";
            return new ParseError(ParseError.Kind.UNKNOWN_TOKEN, position, fragment);
        }

        void throwIfFailed() throws ParseError {
            if (first != null) {
                throw first;
            }
        }
    }

    //endregion
}
