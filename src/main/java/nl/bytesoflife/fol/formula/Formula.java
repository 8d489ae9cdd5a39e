package nl.bytesoflife.fol.formula;

import nl.bytesoflife.fol.language.Language;

import java.util.Set;

/**
 * A well-formed formula of a first-order language.
 * <p>
 * Only the five primitive shapes exist; conjunction, implication, equivalence and
 * existential quantification are built by {@link Formulas} out of negation, disjunction
 * and universal quantification, so code matching on the primitives also sees the derived
 * forms. Formulas are immutable and compared structurally.
 */
public sealed interface Formula
        permits EqualityFormula, RelationFormula, NegationFormula, DisjunctionFormula, QuantifiedFormula {

    Language language();

    Set<String> freeVariables();

    default boolean isFree(String variable) {
        return freeVariables().contains(variable);
    }

    /**
     * A sentence is a formula without free variables.
     */
    default boolean isSentence() {
        return freeVariables().isEmpty();
    }
}
