package org.natded.deduction;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Verifica dell'invariante di scarico su un albero di prova completo.
 *
 * CONTROLLI:
 * • Ogni foglia usa un numero scaricato da esattamente un antenato, nello
 *   scope della premessa che la contiene
 * • Nessun numero viene scaricato due volte nell'albero
 * • Le premesse rispettano l'arità della regola
 *
 * Una violazione indica un errore del motore, non un esito della ricerca.
 */
public final class DischargeValidator {

    private static final Logger LOGGER = Logger.getLogger(DischargeValidator.class.getName());

    private DischargeValidator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param root radice dell'albero da verificare, dimostrata dal contesto vuoto
     * @throws ProofInvariantViolation alla prima violazione trovata
     */
    public static void validate(ProofNode root) {
        validate(root, Set.of());
    }

    /**
     * @param root radice dell'albero da verificare
     * @param openReferences numeri delle assunzioni del contesto iniziale, che
     *                       nessun nodo dell'albero scarica
     * @throws ProofInvariantViolation alla prima violazione trovata
     */
    public static void validate(ProofNode root, Collection<Integer> openReferences) {
        if (root == null) {
            throw new IllegalArgumentException("Albero di prova null");
        }
        walk(root, new HashSet<>(openReferences), new HashSet<>(openReferences));
        LOGGER.finest("Invariante di scarico verificato su " + root.size() + " nodi");
    }

    private static void walk(ProofNode node, Set<Integer> inScope, Set<Integer> seen) {
        if (node.getPremises().size() != node.getRule().getPremises()) {
            throw new ProofInvariantViolation("Arità errata per " + node);
        }

        if (node.isLeaf()) {
            if (!inScope.contains(node.getReference())) {
                throw new ProofInvariantViolation("La foglia " + node
                        + " usa un numero non scaricato da alcun antenato");
            }
            return;
        }

        for (Integer reference : node.getDischarged()) {
            if (!seen.add(reference)) {
                throw new ProofInvariantViolation("Numero " + reference + " scaricato più di una volta");
            }
        }

        for (int i = 0; i < node.getPremises().size(); i++) {
            Set<Integer> scope = new HashSet<>(inScope);
            scope.addAll(node.dischargedInto(i));
            walk(node.getPremises().get(i), scope, seen);
        }
    }
}
