package org.natded.deduction;

import org.natded.logic.Formula;

/**
 * RISULTATO DI RICERCA - Esito tutto-o-niente di una {@link ProofSearch}
 *
 * Contiene l'albero completo se la ricerca ha avuto successo, altrimenti
 * nessun albero: non esistono prove parziali.
 */
public final class SearchResult {

    /**
     * Esito della ricerca.
     */
    public enum Status {
        /** Derivazione completa trovata */
        PROVED,
        /** Tutte le regole esaurite senza derivazione */
        EXHAUSTED,
        /** Ricerca troncata dai limiti di {@link SearchBudget} */
        BUDGET_EXCEEDED
    }

    private final Status status;
    private final Formula goal;
    private final ProofNode proof;
    private final ProofStatistics statistics;

    private SearchResult(Status status, Formula goal, ProofNode proof, ProofStatistics statistics) {
        if ((status == Status.PROVED) != (proof != null)) {
            throw new IllegalArgumentException("Solo un risultato PROVED contiene un albero di prova");
        }
        this.status = status;
        this.goal = goal;
        this.proof = proof;
        this.statistics = statistics != null ? statistics : new ProofStatistics();
    }

    //region FACTORY METHODS

    public static SearchResult proved(Formula goal, ProofNode proof, ProofStatistics statistics) {
        if (proof == null) {
            throw new IllegalArgumentException("Albero di prova null per risultato PROVED");
        }
        return new SearchResult(Status.PROVED, goal, proof, statistics);
    }

    public static SearchResult exhausted(Formula goal, ProofStatistics statistics) {
        return new SearchResult(Status.EXHAUSTED, goal, null, statistics);
    }

    public static SearchResult budgetExceeded(Formula goal, ProofStatistics statistics) {
        return new SearchResult(Status.BUDGET_EXCEEDED, goal, null, statistics);
    }

    //endregion

    //region ACCESSORS

    public Status getStatus() {
        return status;
    }

    public boolean isProved() {
        return status == Status.PROVED;
    }

    public Formula getGoal() {
        return goal;
    }

    /**
     * @return albero di prova, null se la ricerca è fallita
     */
    public ProofNode getProof() {
        return proof;
    }

    public ProofStatistics getStatistics() {
        return statistics;
    }

    //endregion

    @Override
    public String toString() {
        return status + " " + goal + " " + statistics;
    }
}
