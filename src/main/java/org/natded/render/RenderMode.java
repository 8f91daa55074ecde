package org.natded.render;

/**
 * Notazioni di output supportate.
 */
public enum RenderMode {
    /** Albero testuale con operatori Unicode e annotazioni dei numeri */
    PLAIN,
    /** Albero bussproofs per documenti TeX, senza numeri di riferimento */
    TEX
}
