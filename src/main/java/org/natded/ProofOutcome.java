package org.natded;

import org.natded.deduction.ProofStatistics;
import org.natded.deduction.SearchResult;
import org.natded.logic.Formula;
import org.natded.logic.ParseError;

import java.util.Map;

/**
 * ESITO DI UNA RICHIESTA - Contenitore immutabile restituito da {@link Prover}
 *
 * ESITI POSSIBILI:
 * • PROVED: albero trovato e reso nella notazione richiesta
 * • PARSE_FAILED: input malformato o ambiguo
 * • NOT_A_TAUTOLOGY: il controllo classico ha trovato un controesempio
 * • SEARCH_EXHAUSTED: nessuna derivazione entro regole e budget ("best effort")
 * • INTERNAL_ERROR: invariante dell'albero violato, errore del motore
 *
 * Ogni esito ha un testo per l'utente ({@link #toDisplayText()}); solo PROVED
 * contiene un albero.
 */
public final class ProofOutcome {

    public enum Kind {
        PROVED,
        PARSE_FAILED,
        NOT_A_TAUTOLOGY,
        SEARCH_EXHAUSTED,
        INTERNAL_ERROR
    }

    private final Kind kind;
    private final Formula formula;
    private final String rendered;
    private final SearchResult searchResult;
    private final ParseError parseError;
    private final Map<String, Boolean> counterexample;
    private final String errorMessage;

    private ProofOutcome(Kind kind, Formula formula, String rendered, SearchResult searchResult,
                         ParseError parseError, Map<String, Boolean> counterexample, String errorMessage) {
        this.kind = kind;
        this.formula = formula;
        this.rendered = rendered;
        this.searchResult = searchResult;
        this.parseError = parseError;
        this.counterexample = counterexample;
        this.errorMessage = errorMessage;
    }

    //region FACTORY METHODS

    public static ProofOutcome proved(Formula formula, SearchResult result, String rendered) {
        if (result == null || !result.isProved() || rendered == null) {
            throw new IllegalArgumentException("Esito PROVED richiede una ricerca riuscita e un albero reso");
        }
        return new ProofOutcome(Kind.PROVED, formula, rendered, result, null, null, null);
    }

    public static ProofOutcome parseFailed(ParseError error) {
        if (error == null) {
            throw new IllegalArgumentException("Errore di parsing null");
        }
        return new ProofOutcome(Kind.PARSE_FAILED, null, null, null, error, null, null);
    }

    public static ProofOutcome notATautology(Formula formula, Map<String, Boolean> counterexample) {
        if (counterexample == null || counterexample.isEmpty()) {
            throw new IllegalArgumentException("Controesempio null o vuoto");
        }
        return new ProofOutcome(Kind.NOT_A_TAUTOLOGY, formula, null, null, null, counterexample, null);
    }

    public static ProofOutcome searchExhausted(Formula formula, SearchResult result) {
        if (result == null || result.isProved()) {
            throw new IllegalArgumentException("Esito SEARCH_EXHAUSTED richiede una ricerca fallita");
        }
        return new ProofOutcome(Kind.SEARCH_EXHAUSTED, formula, null, result, null, null, null);
    }

    public static ProofOutcome internalError(Formula formula, String message) {
        return new ProofOutcome(Kind.INTERNAL_ERROR, formula, null, null, null, null, message);
    }

    //endregion

    //region ACCESSORS

    public Kind getKind() {
        return kind;
    }

    public boolean isProved() {
        return kind == Kind.PROVED;
    }

    /**
     * @return formula analizzata, null se il parsing è fallito
     */
    public Formula getFormula() {
        return formula;
    }

    /**
     * @return albero reso, null se l'esito non è PROVED
     */
    public String getRendered() {
        return rendered;
    }

    public SearchResult getSearchResult() {
        return searchResult;
    }

    public ParseError getParseError() {
        return parseError;
    }

    public Map<String, Boolean> getCounterexample() {
        return counterexample;
    }

    /**
     * @return statistiche della ricerca, null se la ricerca non è stata eseguita
     */
    public ProofStatistics getStatistics() {
        return searchResult != null ? searchResult.getStatistics() : null;
    }

    //endregion

    /**
     * Testo da mostrare all'utente: l'albero oppure un messaggio di errore
     * distinguibile per ogni tipo di fallimento.
     */
    public String toDisplayText() {
        return switch (kind) {
            case PROVED -> rendered;
            case PARSE_FAILED -> "error when parsing:\n" + parseError.getMessage();
            case NOT_A_TAUTOLOGY -> "error when checking:\n" + formula + " turns out false when: " + counterexample;
            case SEARCH_EXHAUSTED -> "error when solving:\ncould not infer: " + formula
                    + (searchResult.getStatus() == SearchResult.Status.BUDGET_EXCEEDED
                    ? " (search budget exceeded)" : "");
            case INTERNAL_ERROR -> "internal error:\n" + errorMessage;
        };
    }

    @Override
    public String toString() {
        return kind + (formula != null ? " " + formula : "");
    }
}
