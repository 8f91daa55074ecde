package org.natded.deduction;

import org.natded.logic.Formula;
import org.natded.support.Assumption;
import org.natded.support.ProofContext;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * RICERCA DI PROVE - Backward chaining per la deduzione naturale proposizionale
 *
 * Dato un obiettivo e un contesto di assunzioni vive, prova a costruire una
 * derivazione applicando le regole in ordine deterministico. Ogni tentativo
 * restituisce un {@link Optional}: vuoto significa fallimento locale, e il
 * chiamante passa alla regola successiva. Nessuna eccezione per i fallimenti
 * attesi.
 *
 * ORDINE DELLE REGOLE:
 * 1. Introduzione del connettivo principale dell'obiettivo
 *    • A ∧ B: deriva A e B nello stesso contesto
 *    • A ∨ B: assunzione identica, altrimenti A, altrimenti B
 *    • A → B: assume A con numero fresco, deriva B, scarica
 *    • atomo o ¬A: assunzione identica, dalla più recente
 * 2. Catene di eliminazione (∧-elim, →-elim) a partire dalle assunzioni che
 *    possono produrre l'obiettivo, dalla più recente; una disgiunzione
 *    raggiunta lungo la catena viene eliminata per casi
 * 3. ∨-elim per casi su ogni disgiunzione viva, dalla più recente
 *
 * TERMINAZIONE:
 * • Un obiettivo già pendente sullo stesso cammino con le stesse formule vive
 *   fallisce subito (taglio dei cicli)
 * • {@link SearchBudget} limita profondità e tentativi di regola
 *
 * STATO:
 * Il contatore dei numeri di riferimento, le statistiche e gli obiettivi
 * pendenti appartengono all'istanza. Un'istanza serve una sola ricerca; ricerche
 * indipendenti possono girare in parallelo su istanze diverse.
 */
public class ProofSearch {

    private static final Logger LOGGER = Logger.getLogger(ProofSearch.class.getName());

    //region STATO DELLA RICERCA

    private final SearchBudget budget;
    private final ProofStatistics statistics = new ProofStatistics();

    /** Obiettivi in corso di derivazione sul cammino corrente */
    private final Set<PendingGoal> pending = new HashSet<>();

    /** Ultimo numero di riferimento assegnato; cresce soltanto */
    private int lastReference = 0;

    /** Tentativi di regola esauriti: la ricerca si interrompe ovunque */
    private boolean aborted = false;

    /** Almeno un ramo troncato dal limite di profondità */
    private boolean truncated = false;

    private boolean started = false;

    //endregion

    public ProofSearch() {
        this(SearchBudget.defaults());
    }

    public ProofSearch(SearchBudget budget) {
        if (budget == null) {
            throw new IllegalArgumentException("Budget di ricerca non può essere null");
        }
        this.budget = budget;
    }

    //region PUNTO DI INGRESSO

    /**
     * Cerca una derivazione dell'obiettivo dal contesto dato.
     *
     * @param goal formula da dimostrare
     * @param context assunzioni vive iniziali (tipicamente vuoto)
     * @return albero completo oppure fallimento, mai una prova parziale
     * @throws IllegalStateException se l'istanza è già stata usata
     */
    public SearchResult search(Formula goal, ProofContext context) {
        if (goal == null || context == null) {
            throw new IllegalArgumentException("Obiettivo e contesto non possono essere null");
        }
        if (started) {
            throw new IllegalStateException("ProofSearch serve una sola ricerca");
        }
        started = true;

        for (Assumption assumption : context.getAssumptions()) {
            lastReference = Math.max(lastReference, assumption.reference());
        }

        LOGGER.fine("Inizio ricerca per: " + goal);
        Optional<ProofNode> proof = derive(goal, context, 0);
        statistics.stopTimer();

        SearchResult result;
        if (proof.isPresent()) {
            result = SearchResult.proved(goal, proof.get(), statistics);
        } else if (aborted || truncated) {
            result = SearchResult.budgetExceeded(goal, statistics);
        } else {
            result = SearchResult.exhausted(goal, statistics);
        }

        LOGGER.fine("Ricerca conclusa: " + result);
        return result;
    }

    public ProofStatistics getStatistics() {
        return statistics;
    }

    //endregion

    //region DERIVAZIONE

    /**
     * Deriva un obiettivo: prima l'introduzione, poi le eliminazioni.
     */
    private Optional<ProofNode> derive(Formula goal, ProofContext context, int depth) {
        if (aborted) {
            return Optional.empty();
        }
        if (depth > budget.maxDepth()) {
            truncated = true;
            statistics.incrementDepthCutoffs();
            return Optional.empty();
        }
        statistics.recordDepth(depth);

        PendingGoal key = new PendingGoal(goal, context.getFormulas());
        if (!pending.add(key)) {
            statistics.incrementCyclesCut();
            return Optional.empty();
        }

        try {
            trace(depth, "obiettivo " + goal + " con " + context);

            Optional<ProofNode> proof = introduce(goal, context, depth);
            if (proof.isEmpty()) {
                proof = eliminate(goal, context, depth);
            }
            if (proof.isEmpty()) {
                statistics.incrementBacktracks();
                trace(depth, "fallito " + goal);
            }
            return proof;
        } finally {
            pending.remove(key);
        }
    }

    /**
     * Applica la regola che corrisponde al connettivo principale dell'obiettivo.
     */
    private Optional<ProofNode> introduce(Formula goal, ProofContext context, int depth) {
        return switch (goal.getType()) {
            case AND -> introduceAnd(goal, context, depth);
            case OR -> introduceOr(goal, context, depth);
            case TO -> introduceImplication(goal, context, depth);
            case ATOM, NOT -> useAssumption(goal, context);
        };
    }

    private Optional<ProofNode> introduceAnd(Formula goal, ProofContext context, int depth) {
        if (!attempt()) {
            return Optional.empty();
        }

        Optional<ProofNode> left = derive(goal.getLeft(), context, depth + 1);
        if (left.isEmpty()) {
            return Optional.empty();
        }
        Optional<ProofNode> right = derive(goal.getRight(), context, depth + 1);
        if (right.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(ProofNode.inference(goal, Rule.AND_INTRO, left.get(), right.get()));
    }

    private Optional<ProofNode> introduceOr(Formula goal, ProofContext context, int depth) {
        // Una disgiunzione già assunta si usa direttamente
        Optional<ProofNode> direct = useAssumption(goal, context);
        if (direct.isPresent()) {
            return direct;
        }

        if (!attempt()) {
            return Optional.empty();
        }
        Optional<ProofNode> left = derive(goal.getLeft(), context, depth + 1);
        if (left.isPresent()) {
            return Optional.of(ProofNode.inference(goal, Rule.OR_INTRO_LEFT, left.get()));
        }

        if (!attempt()) {
            return Optional.empty();
        }
        Optional<ProofNode> right = derive(goal.getRight(), context, depth + 1);
        return right.map(premise -> ProofNode.inference(goal, Rule.OR_INTRO_RIGHT, premise));
    }

    private Optional<ProofNode> introduceImplication(Formula goal, ProofContext context, int depth) {
        if (!attempt()) {
            return Optional.empty();
        }

        int reference = freshReference();
        ProofContext child = context.push(goal.getLeft(), reference);
        trace(depth, "assumo " + goal.getLeft() + " : " + reference);

        return derive(goal.getRight(), child, depth + 1)
                .map(premise -> ProofNode.impliesIntro(goal, reference, premise));
    }

    private Optional<ProofNode> useAssumption(Formula goal, ProofContext context) {
        if (!attempt()) {
            return Optional.empty();
        }
        return context.find(goal).map(ProofNode::assumption);
    }

    //endregion

    //region ELIMINAZIONI

    /**
     * Ripiego dopo l'introduzione: catene ∧/→ prima, poi ∨-elim.
     */
    private Optional<ProofNode> eliminate(Formula goal, ProofContext context, int depth) {
        for (Assumption assumption : context.mostRecentFirst()) {
            if (aborted) {
                return Optional.empty();
            }
            if (leadsTo(assumption.formula(), goal)) {
                Optional<ProofNode> proof = chain(ProofNode.assumption(assumption), goal, context, depth);
                if (proof.isPresent()) {
                    return proof;
                }
            }
        }

        for (Assumption assumption : context.mostRecentFirst()) {
            if (aborted) {
                return Optional.empty();
            }
            if (assumption.formula().is(Formula.Type.OR)) {
                Optional<ProofNode> proof = eliminateOr(ProofNode.assumption(assumption), goal, context, depth);
                if (proof.isPresent()) {
                    return proof;
                }
            }
        }

        return Optional.empty();
    }

    /**
     * Scompone una formula già derivata fino a raggiungere l'obiettivo:
     * proiezioni di congiunzioni e modus ponens, derivando l'antecedente con
     * una nuova ricerca all'indietro. Una disgiunzione derivata lungo la
     * catena dimostra l'obiettivo per casi.
     *
     * @param derived prova della formula da cui si parte
     */
    private Optional<ProofNode> chain(ProofNode derived, Formula goal, ProofContext context, int depth) {
        Formula formula = derived.getFormula();
        if (formula.equals(goal)) {
            return Optional.of(derived);
        }

        switch (formula.getType()) {
            case AND -> {
                if (leadsTo(formula.getLeft(), goal) && attempt()) {
                    ProofNode left = ProofNode.inference(formula.getLeft(), Rule.AND_ELIM_LEFT, derived);
                    Optional<ProofNode> proof = chain(left, goal, context, depth);
                    if (proof.isPresent()) {
                        return proof;
                    }
                }
                if (leadsTo(formula.getRight(), goal) && attempt()) {
                    ProofNode right = ProofNode.inference(formula.getRight(), Rule.AND_ELIM_RIGHT, derived);
                    return chain(right, goal, context, depth);
                }
                return Optional.empty();
            }
            case TO -> {
                if (!leadsTo(formula.getRight(), goal) || !attempt()) {
                    return Optional.empty();
                }
                Optional<ProofNode> antecedent = derive(formula.getLeft(), context, depth + 1);
                if (antecedent.isEmpty()) {
                    return Optional.empty();
                }
                ProofNode consequent = ProofNode.inference(formula.getRight(), Rule.IMPLIES_ELIM,
                        antecedent.get(), derived);
                return chain(consequent, goal, context, depth);
            }
            case OR -> {
                // Le disgiunzioni assunte direttamente sono coperte dal passo ∨-elim
                if (derived.isLeaf()) {
                    return Optional.empty();
                }
                return eliminateOr(derived, goal, context, depth);
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    private static boolean leadsTo(Formula formula, Formula goal) {
        return formula.canYield(goal) || formula.reachesDisjunction();
    }

    /**
     * ∨-elim: dimostra l'obiettivo in entrambi i casi della disgiunzione, ognuno
     * con la propria assunzione fresca.
     *
     * @param disjunction prova della disgiunzione, foglia o catena di eliminazioni
     */
    private Optional<ProofNode> eliminateOr(ProofNode disjunction, Formula goal, ProofContext context, int depth) {
        if (!attempt()) {
            return Optional.empty();
        }

        Formula formula = disjunction.getFormula();

        int leftReference = freshReference();
        trace(depth, "caso " + formula.getLeft() + " : " + leftReference + " di " + formula);
        Optional<ProofNode> leftCase = derive(goal, context.push(formula.getLeft(), leftReference), depth + 1);
        if (leftCase.isEmpty()) {
            return Optional.empty();
        }

        int rightReference = freshReference();
        trace(depth, "caso " + formula.getRight() + " : " + rightReference + " di " + formula);
        Optional<ProofNode> rightCase = derive(goal, context.push(formula.getRight(), rightReference), depth + 1);
        if (rightCase.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(ProofNode.orElim(goal, disjunction,
                leftReference, leftCase.get(), rightReference, rightCase.get()));
    }

    //endregion

    //region SUPPORTO

    /**
     * Registra un tentativo di regola.
     *
     * @return false se il budget di tentativi è esaurito
     */
    private boolean attempt() {
        if (aborted) {
            return false;
        }
        statistics.incrementRuleApplications();
        if (statistics.getRuleApplications() > budget.maxRuleApplications()) {
            aborted = true;
            LOGGER.warning("Budget di " + budget.maxRuleApplications() + " regole esaurito");
            return false;
        }
        return true;
    }

    private int freshReference() {
        statistics.incrementAssumptionsIntroduced();
        return ++lastReference;
    }

    private void trace(int depth, String message) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("  ".repeat(depth) + message);
        }
    }

    /**
     * Chiave del taglio dei cicli: obiettivo più insieme delle formule vive.
     */
    private record PendingGoal(Formula goal, Set<Formula> live) {}

    //endregion
}
