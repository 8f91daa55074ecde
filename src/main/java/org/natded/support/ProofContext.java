package org.natded.support;

import org.natded.logic.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * CONTESTO DI PROVA - Sequenza ordinata delle assunzioni vive
 *
 * Ogni ramo della ricerca vede il contesto del padre più, al massimo, una
 * nuova assunzione. Il contesto non viene mai modificato sul posto:
 * {@link #push(Formula, int)} restituisce un nuovo contesto, quello del padre
 * resta intatto e i rami fratelli non vedono le assunzioni l'uno dell'altro.
 *
 * INVARIANTI:
 * • Ordine di inserimento preservato (l'ultima assunzione è la più recente)
 * • Numeri di riferimento strettamente crescenti lungo la sequenza
 * • Istanze immutabili, condivisibili tra thread
 */
public final class ProofContext {

    private static final ProofContext EMPTY = new ProofContext(Collections.emptyList());

    /** Assunzioni vive, dalla meno recente alla più recente */
    private final List<Assumption> assumptions;

    /** Formule vive senza ripetizioni, usato come chiave per il controllo dei cicli */
    private final Set<Formula> formulas;

    private ProofContext(List<Assumption> assumptions) {
        this.assumptions = Collections.unmodifiableList(assumptions);
        Set<Formula> live = new HashSet<>();
        for (Assumption assumption : assumptions) {
            live.add(assumption.formula());
        }
        this.formulas = Collections.unmodifiableSet(live);
    }

    /**
     * Contesto iniziale della chiamata di primo livello.
     */
    public static ProofContext empty() {
        return EMPTY;
    }

    //region BIFORCAZIONE

    /**
     * Restituisce un nuovo contesto con l'assunzione aggiunta in coda.
     *
     * @param formula formula assunta
     * @param reference numero di riferimento fresco
     * @return contesto figlio (questo contesto non cambia)
     * @throws IllegalArgumentException se il numero non è maggiore dell'ultimo in uso
     */
    public ProofContext push(Formula formula, int reference) {
        if (!assumptions.isEmpty() && reference <= assumptions.get(assumptions.size() - 1).reference()) {
            throw new IllegalArgumentException("Numero di riferimento " + reference
                    + " non crescente rispetto al contesto " + assumptions);
        }

        List<Assumption> forked = new ArrayList<>(assumptions.size() + 1);
        forked.addAll(assumptions);
        forked.add(new Assumption(formula, reference));
        return new ProofContext(forked);
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * Cerca un'assunzione viva uguale alla formula, dalla più recente.
     */
    public Optional<Assumption> find(Formula formula) {
        if (!formulas.contains(formula)) {
            return Optional.empty();
        }
        for (int i = assumptions.size() - 1; i >= 0; i--) {
            if (assumptions.get(i).formula().equals(formula)) {
                return Optional.of(assumptions.get(i));
            }
        }
        return Optional.empty();
    }

    public boolean contains(Formula formula) {
        return formulas.contains(formula);
    }

    /**
     * @return assunzioni dalla più recente alla meno recente
     */
    public List<Assumption> mostRecentFirst() {
        List<Assumption> reversed = new ArrayList<>(assumptions);
        Collections.reverse(reversed);
        return reversed;
    }

    /**
     * @return assunzioni in ordine di inserimento
     */
    public List<Assumption> getAssumptions() {
        return assumptions;
    }

    /**
     * @return insieme delle formule vive, senza numeri di riferimento
     */
    public Set<Formula> getFormulas() {
        return formulas;
    }

    public int size() {
        return assumptions.size();
    }

    public boolean isEmpty() {
        return assumptions.isEmpty();
    }

    //endregion

    @Override
    public String toString() {
        return assumptions.toString();
    }
}
