package org.natded.render;

import org.natded.deduction.ProofNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * RENDERER PLAIN - Albero dall'alto verso il basso con rami disegnati a caratteri
 *
 * FORMATO:
 * <pre>
 * (A ∨ B → C) → (A → C) ∧ (B → C) : 1
 * + (A → C) ∧ (B → C)
 *   + A → C : 2
 *   | + C
 *   |   + A ∨ B
 *   |   | + A from: 2
 *   |   + A ∨ B → C from: 1
 *   + B → C : 3
 *     ...
 * </pre>
 *
 * REGOLE DI LAYOUT:
 * • Ogni premessa inizia con l'indentazione corrente seguita da "+ "
 * • Il sottoalbero di una premessa non ultima continua con "| ", l'ultima con
 *   due spazi
 * • " : N" sui nodi che scaricano numeri usati da qualche foglia
 *   (" : N, M" per ∨-elim), " from: N" sulle foglie
 *
 * NUMERAZIONE:
 * La ricerca non riusa mai un numero, quindi i rami falliti lasciano buchi
 * (un albero di sei righe può scaricare 122 e 126). In stampa i numeri
 * scaricati vengono rinumerati 1, 2, 3, ... nell'ordine in cui compaiono,
 * dopo gli eventuali numeri aperti, che restano invariati.
 */
public class PlainTreeRenderer implements TreeRenderer {

    private static final String BRANCH = "+ ";
    private static final String CONTINUATION = "| ";
    private static final String BLANK = "  ";

    @Override
    public String render(ProofNode root) {
        if (root == null) {
            throw new IllegalArgumentException("Albero di prova null");
        }
        Set<Integer> used = root.usedReferences();
        Set<Integer> open = new TreeSet<>(used);
        removeDischarged(root, open);

        Numbering numbering = new Numbering(used, open.isEmpty() ? 0 : Collections.max(open));
        StringBuilder tree = new StringBuilder();
        print(root, tree, "", numbering);
        return tree.toString();
    }

    private void print(ProofNode node, StringBuilder tree, String indent, Numbering numbering) {
        tree.append(node.getFormula()).append(marker(node, numbering)).append('\n');

        List<ProofNode> premises = node.getPremises();
        for (int i = 0; i < premises.size(); i++) {
            boolean last = i == premises.size() - 1;
            tree.append(indent).append(BRANCH);
            print(premises.get(i), tree, indent + (last ? BLANK : CONTINUATION), numbering);
        }
    }

    private String marker(ProofNode node, Numbering numbering) {
        if (node.isLeaf()) {
            return " from: " + numbering.shown(node.getReference());
        }

        List<String> live = new ArrayList<>();
        for (Integer reference : node.getDischarged()) {
            if (numbering.used.contains(reference)) {
                live.add(String.valueOf(numbering.assign(reference)));
            }
        }
        return live.isEmpty() ? "" : " : " + String.join(", ", live);
    }

    private static void removeDischarged(ProofNode node, Set<Integer> references) {
        references.removeAll(node.getDischarged());
        for (ProofNode premise : node.getPremises()) {
            removeDischarged(premise, references);
        }
    }

    /**
     * Numeri mostrati per un singolo rendering. Un nodo che scarica precede in
     * pre-ordine tutte le foglie che usano i suoi numeri.
     */
    private static final class Numbering {
        private final Set<Integer> used;
        private final Map<Integer, Integer> shown = new HashMap<>();
        private int last;

        Numbering(Set<Integer> used, int last) {
            this.used = used;
            this.last = last;
        }

        int assign(int reference) {
            return shown.computeIfAbsent(reference, r -> ++last);
        }

        int shown(int reference) {
            return shown.getOrDefault(reference, reference);
        }
    }
}
