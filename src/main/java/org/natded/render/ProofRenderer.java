package org.natded.render;

import org.natded.deduction.ProofNode;

/**
 * Punto di accesso unico ai renderer: sceglie l'implementazione per modalità.
 */
public class ProofRenderer {

    private final TreeRenderer plain = new PlainTreeRenderer();
    private final TreeRenderer tex = new TexTreeRenderer();

    /**
     * @param root albero di prova completo
     * @param mode notazione di output
     * @return testo dell'albero, terminato da un a capo
     */
    public String render(ProofNode root, RenderMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Modalità di rendering null");
        }
        return switch (mode) {
            case PLAIN -> plain.render(root);
            case TEX -> tex.render(root);
        };
    }
}
