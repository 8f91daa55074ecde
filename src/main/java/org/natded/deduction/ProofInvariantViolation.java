package org.natded.deduction;

/**
 * Violazione di un invariante dell'albero di prova o del contesto.
 *
 * Segnala un errore di programmazione, non un esito atteso della ricerca:
 * interrompe la singola richiesta e viene registrata a livello SEVERE.
 */
public class ProofInvariantViolation extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ProofInvariantViolation(String message) {
        super(message);
    }
}
