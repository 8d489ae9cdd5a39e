package nl.bytesoflife.fol.axiom;

import nl.bytesoflife.fol.formula.DisjunctionFormula;
import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.formula.Formulas;
import nl.bytesoflife.fol.formula.NegationFormula;
import nl.bytesoflife.fol.formula.QuantifiedFormula;
import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.substitution.Substitutions;
import nl.bytesoflife.fol.term.Term;

/**
 * "( ( AA x ) ( P ) -> P[t/x] )" where t is substitutable for x in P.
 */
public class UniversalInstantiationAxiom implements AxiomSchema {

    /**
     * @throws InvalidConstructionException if t is not substitutable for x in P
     */
    public Formula create(Formula p, String x, Term t) {
        if (!Substitutions.isSubstitutable(p, x, t)) {
            throw new InvalidConstructionException(t + " is not substitutable for " + x + " in " + p);
        }
        return Formulas.implication(Formulas.universal(x, p), Substitutions.substitute(p, x, t));
    }

    @Override
    public boolean matches(Formula formula) {
        if (!(formula instanceof DisjunctionFormula implication)
                || !(implication.left() instanceof NegationFormula negation)
                || !(negation.operand() instanceof QuantifiedFormula universal)) {
            return false;
        }
        return Instantiations.isInstance(universal.body(), implication.right(), universal.variable());
    }

    @Override
    public AxiomKind getKind() {
        return AxiomKind.UNIVERSAL_INSTANTIATION;
    }
}
