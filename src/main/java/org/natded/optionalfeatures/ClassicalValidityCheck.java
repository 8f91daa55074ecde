package org.natded.optionalfeatures;

import org.natded.logic.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * CONTROLLO DI VALIDITÀ CLASSICA - Tavola di verità prima della ricerca
 *
 * Una formula falsa sotto qualche assegnamento non è un teorema e nessuna
 * ricerca può dimostrarla: il controllo la rifiuta subito mostrando un
 * controesempio. Il superamento del controllo non garantisce la prova, perché
 * la ricerca è intuizionista e incompleta (¬¬A → A passa il controllo ma non
 * viene dimostrata).
 *
 * ENUMERAZIONE:
 * • Atomi in ordine alfabetico
 * • Ogni atomo prova prima vero, poi falso
 * • Oltre {@link #MAX_ATOMS} atomi il controllo viene saltato
 */
public class ClassicalValidityCheck {

    private static final Logger LOGGER = Logger.getLogger(ClassicalValidityCheck.class.getName());

    /** Limite oltre il quale la tavola di verità diventa troppo costosa */
    public static final int MAX_ATOMS = 20;

    private long evaluatedAssignments = 0;
    private boolean skipped = false;
    private Map<String, Boolean> lastCounterexample;

    /**
     * Cerca un assegnamento che rende falsa la formula.
     *
     * @param formula formula da controllare
     * @return primo controesempio in ordine di enumerazione, vuoto se la formula
     *         è una tautologia o se il controllo è stato saltato
     */
    public Optional<Map<String, Boolean>> findCounterexample(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da controllare null");
        }

        evaluatedAssignments = 0;
        skipped = false;
        lastCounterexample = null;

        List<String> atoms = new ArrayList<>(formula.atoms());
        if (atoms.size() > MAX_ATOMS) {
            skipped = true;
            LOGGER.warning("Controllo classico saltato: " + atoms.size() + " atomi (limite " + MAX_ATOMS + ")");
            return Optional.empty();
        }

        long combinations = 1L << atoms.size();
        for (long mask = 0; mask < combinations; mask++) {
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (int i = 0; i < atoms.size(); i++) {
                // Bit a 0 = vero: il primo atomo varia più lentamente
                long bit = (mask >> (atoms.size() - 1 - i)) & 1L;
                assignment.put(atoms.get(i), bit == 0);
            }

            evaluatedAssignments++;
            if (!formula.evaluate(assignment)) {
                lastCounterexample = Collections.unmodifiableMap(assignment);
                LOGGER.fine("Controesempio per " + formula + ": " + assignment);
                return Optional.of(lastCounterexample);
            }
        }

        LOGGER.fine("Tautologia classica verificata su " + evaluatedAssignments + " assegnamenti");
        return Optional.empty();
    }

    /**
     * Riepilogo dell'ultimo controllo eseguito.
     */
    public String getCheckInfo() {
        if (skipped) {
            return "Controllo classico saltato (troppi atomi)";
        }
        if (lastCounterexample != null) {
            return "Controesempio trovato dopo " + evaluatedAssignments + " assegnamenti: " + lastCounterexample;
        }
        return "Tautologia classica (" + evaluatedAssignments + " assegnamenti)";
    }

    public long getEvaluatedAssignments() {
        return evaluatedAssignments;
    }

    public boolean wasSkipped() {
        return skipped;
    }
}
