package org.natded;

import org.natded.deduction.SearchBudget;
import org.natded.render.RenderMode;

/**
 * Opzioni di una singola richiesta al {@link Prover}.
 *
 * @param renderMode notazione dell'albero prodotto
 * @param budget limiti della ricerca
 * @param classicalCheck true per rifiutare le non-tautologie prima della ricerca
 */
public record ProverOptions(RenderMode renderMode, SearchBudget budget, boolean classicalCheck) {

    public ProverOptions {
        if (renderMode == null || budget == null) {
            throw new IllegalArgumentException("Modalità di rendering e budget sono obbligatori");
        }
    }

    /**
     * Output Plain, budget di default, controllo classico attivo.
     */
    public static ProverOptions defaults() {
        return new ProverOptions(RenderMode.PLAIN, SearchBudget.defaults(), true);
    }

    public ProverOptions withRenderMode(RenderMode mode) {
        return new ProverOptions(mode, budget, classicalCheck);
    }

    public ProverOptions withBudget(SearchBudget newBudget) {
        return new ProverOptions(renderMode, newBudget, classicalCheck);
    }

    public ProverOptions withClassicalCheck(boolean enabled) {
        return new ProverOptions(renderMode, budget, enabled);
    }
}
