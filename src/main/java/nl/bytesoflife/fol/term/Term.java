package nl.bytesoflife.fol.term;

import nl.bytesoflife.fol.language.Language;

import java.util.Set;

/**
 * A term of a first-order language: a variable, a constant, or an n-ary function symbol
 * applied to n terms.
 * <p>
 * Terms are immutable and compared structurally. {@link #toString()} renders the term as
 * the space-delimited symbol string accepted by the parser.
 */
public sealed interface Term permits VariableTerm, ConstantTerm, FunctionTerm {

    Language language();

    /**
     * The variable symbols occurring in this term. Every variable of a term is free.
     */
    Set<String> variables();
}
