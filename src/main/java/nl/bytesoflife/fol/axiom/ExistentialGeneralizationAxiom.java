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
 * "( P[t/x] -> ( EE x ) ( P ) )" where t is substitutable for x in P.
 */
public class ExistentialGeneralizationAxiom implements AxiomSchema {

    /**
     * @throws InvalidConstructionException if t is not substitutable for x in P
     */
    public Formula create(Formula p, String x, Term t) {
        if (!Substitutions.isSubstitutable(p, x, t)) {
            throw new InvalidConstructionException(t + " is not substitutable for " + x + " in " + p);
        }
        return Formulas.implication(Substitutions.substitute(p, x, t), Formulas.existential(x, p));
    }

    @Override
    public boolean matches(Formula formula) {
        // ( ( !! P[t/x] ) || ( !! ( AA x ) ( ( !! P ) ) ) )
        if (!(formula instanceof DisjunctionFormula implication)
                || !(implication.left() instanceof NegationFormula instance)
                || !(implication.right() instanceof NegationFormula negatedUniversal)
                || !(negatedUniversal.operand() instanceof QuantifiedFormula universal)
                || !(universal.body() instanceof NegationFormula negatedBody)) {
            return false;
        }
        return Instantiations.isInstance(negatedBody.operand(), instance.operand(), universal.variable());
    }

    @Override
    public AxiomKind getKind() {
        return AxiomKind.EXISTENTIAL_GENERALIZATION;
    }
}
