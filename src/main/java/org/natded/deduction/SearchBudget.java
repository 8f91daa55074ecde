package org.natded.deduction;

/**
 * Limiti della ricerca: profondità massima di ricorsione e numero massimo di
 * tentativi di regola. Il superamento è un esito normale della ricerca
 * ({@link SearchResult.Status#BUDGET_EXCEEDED}), non un errore.
 *
 * @param maxDepth profondità massima di {@code derive} (> 0)
 * @param maxRuleApplications tentativi di regola consentiti (> 0)
 */
public record SearchBudget(int maxDepth, long maxRuleApplications) {

    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final long DEFAULT_MAX_RULE_APPLICATIONS = 200_000L;

    public SearchBudget {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("Profondità massima deve essere positiva: " + maxDepth);
        }
        if (maxRuleApplications <= 0) {
            throw new IllegalArgumentException("Numero massimo di regole deve essere positivo: " + maxRuleApplications);
        }
    }

    public static SearchBudget defaults() {
        return new SearchBudget(DEFAULT_MAX_DEPTH, DEFAULT_MAX_RULE_APPLICATIONS);
    }
}
