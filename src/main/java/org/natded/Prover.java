package org.natded;

import org.natded.deduction.DischargeValidator;
import org.natded.deduction.ProofInvariantViolation;
import org.natded.deduction.ProofSearch;
import org.natded.deduction.SearchBudget;
import org.natded.deduction.SearchResult;
import org.natded.logic.Formula;
import org.natded.logic.FormulaParser;
import org.natded.logic.ParseError;
import org.natded.optionalfeatures.ClassicalValidityCheck;
import org.natded.render.ProofRenderer;
import org.natded.support.ProofContext;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * DIMOSTRATORE - Pipeline completa per una singola formula
 *
 * PIPELINE:
 * 1. PARSING: testo -> {@link Formula} (ANTLR)
 * 2. CONTROLLO CLASSICO (opzionale): tavola di verità, rifiuta le non-tautologie
 * 3. RICERCA: backward chaining dal contesto vuoto
 * 4. VALIDAZIONE: invariante di scarico sull'albero trovato
 * 5. RENDERING: Plain o TeX
 *
 * Ogni fallimento atteso diventa un {@link ProofOutcome}; una violazione di
 * invariante interrompe solo la richiesta corrente. Nessuno stato condiviso tra
 * richieste: la stessa istanza può servire thread diversi.
 */
public class Prover {

    private static final Logger LOGGER = Logger.getLogger(Prover.class.getName());

    private final FormulaParser parser = new FormulaParser();
    private final ProofRenderer renderer = new ProofRenderer();
    private final Function<SearchBudget, ProofSearch> searchFactory;

    public Prover() {
        this(ProofSearch::new);
    }

    /**
     * @param searchFactory crea una ricerca nuova per ogni richiesta
     */
    Prover(Function<SearchBudget, ProofSearch> searchFactory) {
        this.searchFactory = searchFactory;
    }

    public ProofOutcome prove(String text) {
        return prove(text, ProverOptions.defaults());
    }

    /**
     * @param text formula in notazione testuale
     * @param options notazione di output, budget e controllo classico
     * @return esito della richiesta, mai null
     */
    public ProofOutcome prove(String text, ProverOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Opzioni della richiesta null");
        }

        // FASE 1: parsing
        Formula formula;
        try {
            formula = parser.parse(text);
        } catch (ParseError e) {
            LOGGER.fine("Parsing fallito: " + e.getMessage());
            return ProofOutcome.parseFailed(e);
        }
        LOGGER.info("Formula letta: " + formula);

        // FASE 2: controllo classico
        if (options.classicalCheck()) {
            ClassicalValidityCheck check = new ClassicalValidityCheck();
            Optional<Map<String, Boolean>> counterexample = check.findCounterexample(formula);
            LOGGER.fine(check.getCheckInfo());
            if (counterexample.isPresent()) {
                return ProofOutcome.notATautology(formula, counterexample.get());
            }
        }

        try {
            // FASE 3: ricerca
            SearchResult result = searchFactory.apply(options.budget()).search(formula, ProofContext.empty());
            LOGGER.info("Ricerca " + result.getStatus() + " " + result.getStatistics());
            if (!result.isProved()) {
                return ProofOutcome.searchExhausted(formula, result);
            }

            // FASE 4-5: validazione e rendering
            DischargeValidator.validate(result.getProof());
            String rendered = renderer.render(result.getProof(), options.renderMode());
            return ProofOutcome.proved(formula, result, rendered);

        } catch (ProofInvariantViolation e) {
            LOGGER.log(Level.SEVERE, "Invariante violato durante la prova di " + formula, e);
            return ProofOutcome.internalError(formula, e.getMessage());
        }
    }
}
