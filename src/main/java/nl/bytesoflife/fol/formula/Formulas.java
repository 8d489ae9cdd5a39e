package nl.bytesoflife.fol.formula;

import nl.bytesoflife.fol.language.Language;

/**
 * Builders for the shorthand connectives, expressed with the primitive shapes only.
 */
public final class Formulas {

    private Formulas() {
    }

    /**
     * "( P && Q )", i.e. "( !! ( ( !! P ) || ( !! Q ) ) )".
     */
    public static Formula conjunction(Formula p, Formula q) {
        Language language = p.language();
        return new NegationFormula(language,
                new DisjunctionFormula(language, new NegationFormula(language, p), new NegationFormula(language, q)));
    }

    /**
     * "( P -> Q )", i.e. "( ( !! P ) || Q )".
     */
    public static Formula implication(Formula p, Formula q) {
        Language language = p.language();
        return new DisjunctionFormula(language, new NegationFormula(language, p), q);
    }

    /**
     * "( P <-> Q )", i.e. "( ( P -> Q ) && ( Q -> P ) )".
     */
    public static Formula equivalence(Formula p, Formula q) {
        return conjunction(implication(p, q), implication(q, p));
    }

    /**
     * "( EE v ) ( P )", i.e. "( !! ( AA v ) ( !! P ) )".
     */
    public static Formula existential(String variable, Formula p) {
        Language language = p.language();
        return new NegationFormula(language, new QuantifiedFormula(language, variable, new NegationFormula(language, p)));
    }

    public static Formula negation(Formula p) {
        return new NegationFormula(p.language(), p);
    }

    public static Formula disjunction(Formula p, Formula q) {
        return new DisjunctionFormula(p.language(), p, q);
    }

    public static Formula universal(String variable, Formula p) {
        return new QuantifiedFormula(p.language(), variable, p);
    }
}
