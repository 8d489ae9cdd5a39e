package nl.bytesoflife.fol.axiom;

import nl.bytesoflife.fol.formula.DisjunctionFormula;
import nl.bytesoflife.fol.formula.EqualityFormula;
import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.formula.Formulas;
import nl.bytesoflife.fol.formula.NegationFormula;
import nl.bytesoflife.fol.language.Language;
import nl.bytesoflife.fol.term.FunctionTerm;

import java.util.List;
import java.util.Optional;

/**
 * "( ( = x1 y1 && ... && = xn yn ) -> = f x1 ... xn f y1 ... yn )" for an n-ary function
 * symbol f.
 */
public class FunctionSubstitutionAxiom implements AxiomSchema {

    public Formula create(Language language, List<VariablePair> pairs, String function) {
        Formula hypothesis = EqualityConjunctions.create(language, pairs);
        Formula conclusion = new EqualityFormula(language,
                new FunctionTerm(language, function, EqualityConjunctions.lefts(language, pairs)),
                new FunctionTerm(language, function, EqualityConjunctions.rights(language, pairs)));
        return Formulas.implication(hypothesis, conclusion);
    }

    @Override
    public boolean matches(Formula formula) {
        if (!(formula instanceof DisjunctionFormula implication)
                || !(implication.left() instanceof NegationFormula hypothesis)
                || !(implication.right() instanceof EqualityFormula conclusion)
                || !(conclusion.left() instanceof FunctionTerm left)
                || !(conclusion.right() instanceof FunctionTerm right)
                || !left.function().equals(right.function())) {
            return false;
        }
        Optional<List<VariablePair>> pairs = EqualityConjunctions.extract(hypothesis.operand());
        Language language = formula.language();
        return pairs.isPresent()
                && EqualityConjunctions.lefts(language, pairs.get()).equals(left.arguments())
                && EqualityConjunctions.rights(language, pairs.get()).equals(right.arguments());
    }

    @Override
    public AxiomKind getKind() {
        return AxiomKind.FUNCTION_SUBSTITUTION;
    }
}
