package org.natded.logic;

/**
 * ERRORE DI PARSING - Input malformato o ambiguo
 *
 * Eccezione controllata sollevata da {@link FormulaParser}. Porta con sé il tipo
 * di errore, la posizione (offset del carattere, a partire da 0) e il frammento
 * di input che ha causato il fallimento, così che il chiamante possa produrre
 * un messaggio leggibile per l'utente.
 */
public class ParseError extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Categorie di errore riconosciute.
     */
    public enum Kind {
        EMPTY_INPUT("empty input"),
        UNKNOWN_TOKEN("unknown token"),
        UNBALANCED_PARENTHESIS("unbalanced parenthesis"),
        AMBIGUOUS_CHAIN("ambiguous chain, add parentheses"),
        TRAILING_INPUT("trailing input"),
        UNEXPECTED_END("unexpected end of input"),
        TOO_DEEP("formula nested too deeply"),
        UNEXPECTED_TOKEN("unexpected token");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Kind kind;
    private final int position;
    private final String fragment;

    /**
     * @param kind tipo di errore
     * @param position offset del frammento nell'input (0-based)
     * @param fragment testo che ha causato l'errore (vuoto per fine input)
     */
    public ParseError(Kind kind, int position, String fragment) {
        super(buildMessage(kind, position, fragment));
        this.kind = kind;
        this.position = position;
        this.fragment = fragment == null ? "" : fragment;
    }

    private static String buildMessage(Kind kind, int position, String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return kind.getDescription() + " at " + position;
        }
        return kind.getDescription() + " at " + position + ": '" + fragment + "'";
    }

    public Kind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }

    public String getFragment() {
        return fragment;
    }
}
