package org.natded.support;

import org.natded.logic.Formula;

/**
 * ASSUNZIONE - Formula presa temporaneamente come vera durante una derivazione
 *
 * Il numero di riferimento viene assegnato al momento dell'introduzione
 * (antecedente di una →-intro, caso di una ∨-elim) ed è unico nell'intera
 * ricerca: non viene mai riutilizzato, nemmeno dopo lo scarico.
 *
 * @param formula formula assunta (non null)
 * @param reference numero di riferimento (> 0)
 */
public record Assumption(Formula formula, int reference) {

    public Assumption {
        if (formula == null) {
            throw new IllegalArgumentException("Formula dell'assunzione non può essere null");
        }
        if (reference <= 0) {
            throw new IllegalArgumentException("Numero di riferimento non valido: " + reference);
        }
    }

    @Override
    public String toString() {
        return "[" + formula + "]" + reference;
    }
}
