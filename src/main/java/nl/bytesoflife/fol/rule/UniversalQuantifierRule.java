package nl.bytesoflife.fol.rule;

import nl.bytesoflife.fol.formula.DisjunctionFormula;
import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.formula.NegationFormula;
import nl.bytesoflife.fol.formula.QuantifiedFormula;

import java.util.Set;

/**
 * From "( psi -> phi )" infer "( psi -> ( AA x ) ( phi ) )" when x is not free in psi.
 */
public class UniversalQuantifierRule implements InferenceRule {

    @Override
    public boolean isInstance(Set<Formula> premises, Formula conclusion) {
        InferenceRule.requireSameLanguage(premises, conclusion);
        if (premises.size() != 1) {
            return false;
        }
        Formula premise = premises.iterator().next();
        if (!(premise instanceof DisjunctionFormula given)
                || !(given.left() instanceof NegationFormula givenHypothesis)
                || !(conclusion instanceof DisjunctionFormula inferred)
                || !(inferred.left() instanceof NegationFormula inferredHypothesis)
                || !(inferred.right() instanceof QuantifiedFormula universal)) {
            return false;
        }
        Formula psi = givenHypothesis.operand();
        return inferredHypothesis.operand().equals(psi)
                && universal.body().equals(given.right())
                && !psi.isFree(universal.variable());
    }
}
