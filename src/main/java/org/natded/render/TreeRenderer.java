package org.natded.render;

import org.natded.deduction.ProofNode;

/**
 * Conversione di un albero di prova in testo.
 *
 * Le implementazioni sono funzioni pure dell'albero: nessuno stato conservato
 * tra una chiamata e l'altra.
 */
public interface TreeRenderer {

    String render(ProofNode root);
}
