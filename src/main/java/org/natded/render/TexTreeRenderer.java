package org.natded.render;

import org.natded.deduction.ProofNode;

/**
 * RENDERER TEX - Albero per il pacchetto bussproofs
 *
 * Visita in post-ordine: ogni foglia produce una riga \AxiomC con
 * l'assunzione tra parentesi quadre, ogni inferenza due righe (\RightLabel con
 * il nome della regola e \UnaryInfC, \BinaryInfC o \TrinaryInfC con la
 * conclusione). Nessun numero di riferimento: l'annidamento basta.
 */
public class TexTreeRenderer implements TreeRenderer {

    private static final String INDENT = "  ";

    @Override
    public String render(ProofNode root) {
        if (root == null) {
            throw new IllegalArgumentException("Albero di prova null");
        }
        StringBuilder tree = new StringBuilder();
        tree.append("\\begin{prooftree}\n");
        print(root, tree, INDENT);
        tree.append("\\end{prooftree}\n");
        return tree.toString();
    }

    private void print(ProofNode node, StringBuilder tree, String indent) {
        for (ProofNode premise : node.getPremises()) {
            print(premise, tree, indent + INDENT);
        }

        if (node.isLeaf()) {
            tree.append(indent).append("\\AxiomC{$[").append(node.getFormula().toTex()).append("]$}\n");
            return;
        }

        tree.append(indent).append("\\RightLabel{\\scriptsize ").append(node.getRule().getTexLabel()).append("}\n");
        tree.append(indent).append(inference(node.getPremises().size()))
                .append("{$").append(node.getFormula().toTex()).append("$}\n");
    }

    private static String inference(int premises) {
        return switch (premises) {
            case 1 -> "\\UnaryInfC";
            case 2 -> "\\BinaryInfC";
            case 3 -> "\\TrinaryInfC";
            default -> throw new IllegalArgumentException("Numero di premesse non supportato: " + premises);
        };
    }
}
