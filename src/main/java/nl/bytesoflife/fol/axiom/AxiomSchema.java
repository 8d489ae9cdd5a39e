package nl.bytesoflife.fol.axiom;

import nl.bytesoflife.fol.formula.Formula;

/**
 * Recognises the instances of one logical axiom schema.
 */
public interface AxiomSchema {

    /**
     * Whether the formula is an instance of this schema. Never throws for a formula that
     * merely has the wrong shape.
     */
    boolean matches(Formula formula);

    AxiomKind getKind();
}
