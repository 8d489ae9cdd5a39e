package nl.bytesoflife.fol.axiom;

import nl.bytesoflife.fol.formula.EqualityFormula;
import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.language.Language;
import nl.bytesoflife.fol.term.VariableTerm;

/**
 * "= x x" for a variable x.
 */
public class ReflexivityAxiom implements AxiomSchema {

    public Formula create(Language language, String x) {
        VariableTerm variable = new VariableTerm(language, x);
        return new EqualityFormula(language, variable, variable);
    }

    @Override
    public boolean matches(Formula formula) {
        return formula instanceof EqualityFormula equality
                && equality.left() instanceof VariableTerm
                && equality.left().equals(equality.right());
    }

    @Override
    public AxiomKind getKind() {
        return AxiomKind.REFLEXIVITY;
    }
}
