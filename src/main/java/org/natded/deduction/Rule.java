package org.natded.deduction;

/**
 * Regole della deduzione naturale applicabili da {@link ProofSearch}.
 *
 * Ogni regola dichiara il numero di premesse e l'etichetta usata dal
 * renderer TeX. Non esistono regole per il falso, l'ex falso o la riduzione
 * all'assurdo: la doppia negazione e il terzo escluso non sono derivabili.
 */
public enum Rule {
    ASSUMPTION(0, "assumption", ""),
    AND_INTRO(2, "∧-intro", "$\\land$I"),
    AND_ELIM_LEFT(1, "∧-elim-left", "$\\land$E$_1$"),
    AND_ELIM_RIGHT(1, "∧-elim-right", "$\\land$E$_2$"),
    OR_INTRO_LEFT(1, "∨-intro-left", "$\\lor$I$_1$"),
    OR_INTRO_RIGHT(1, "∨-intro-right", "$\\lor$I$_2$"),
    OR_ELIM(3, "∨-elim", "$\\lor$E"),
    IMPLIES_INTRO(1, "→-intro", "$\\to$I"),
    IMPLIES_ELIM(2, "→-elim", "$\\to$E");

    private final int premises;
    private final String label;
    private final String texLabel;

    Rule(int premises, String label, String texLabel) {
        this.premises = premises;
        this.label = label;
        this.texLabel = texLabel;
    }

    public int getPremises() {
        return premises;
    }

    public String getLabel() {
        return label;
    }

    public String getTexLabel() {
        return texLabel;
    }

    /**
     * Vero per le regole che scaricano assunzioni.
     */
    public boolean discharges() {
        return this == IMPLIES_INTRO || this == OR_ELIM;
    }

    @Override
    public String toString() {
        return label;
    }
}
