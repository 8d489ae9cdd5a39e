package nl.bytesoflife.fol.rule;

import nl.bytesoflife.fol.formula.DisjunctionFormula;
import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.formula.NegationFormula;
import nl.bytesoflife.fol.formula.QuantifiedFormula;

import java.util.Set;

/**
 * From "( phi -> psi )" infer "( ( EE x ) ( phi ) -> psi )" when x is not free in psi.
 */
public class ExistentialQuantifierRule implements InferenceRule {

    @Override
    public boolean isInstance(Set<Formula> premises, Formula conclusion) {
        InferenceRule.requireSameLanguage(premises, conclusion);
        if (premises.size() != 1) {
            return false;
        }
        Formula premise = premises.iterator().next();
        // ( ( !! ( !! ( AA x ) ( ( !! phi ) ) ) ) || psi )
        if (!(premise instanceof DisjunctionFormula given)
                || !(given.left() instanceof NegationFormula givenHypothesis)
                || !(conclusion instanceof DisjunctionFormula inferred)
                || !(inferred.left() instanceof NegationFormula inferredHypothesis)
                || !(inferredHypothesis.operand() instanceof NegationFormula existential)
                || !(existential.operand() instanceof QuantifiedFormula universal)
                || !(universal.body() instanceof NegationFormula negatedPhi)) {
            return false;
        }
        Formula psi = given.right();
        return negatedPhi.operand().equals(givenHypothesis.operand())
                && inferred.right().equals(psi)
                && !psi.isFree(universal.variable());
    }
}
