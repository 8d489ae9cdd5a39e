package nl.bytesoflife.fol.axiom;

import nl.bytesoflife.fol.formula.DisjunctionFormula;
import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.formula.Formulas;
import nl.bytesoflife.fol.formula.NegationFormula;
import nl.bytesoflife.fol.formula.RelationFormula;
import nl.bytesoflife.fol.language.Language;

import java.util.List;
import java.util.Optional;

/**
 * "( ( = x1 y1 && ... && = xn yn ) -> ( R x1 ... xn -> R y1 ... yn ) )" for an n-ary
 * relation symbol R.
 */
public class RelationSubstitutionAxiom implements AxiomSchema {

    public Formula create(Language language, List<VariablePair> pairs, String relation) {
        Formula hypothesis = EqualityConjunctions.create(language, pairs);
        Formula conclusion = Formulas.implication(
                new RelationFormula(language, relation, EqualityConjunctions.lefts(language, pairs)),
                new RelationFormula(language, relation, EqualityConjunctions.rights(language, pairs)));
        return Formulas.implication(hypothesis, conclusion);
    }

    @Override
    public boolean matches(Formula formula) {
        if (!(formula instanceof DisjunctionFormula implication)
                || !(implication.left() instanceof NegationFormula hypothesis)
                || !(implication.right() instanceof DisjunctionFormula conclusion)
                || !(conclusion.left() instanceof NegationFormula negatedLeft)
                || !(negatedLeft.operand() instanceof RelationFormula left)
                || !(conclusion.right() instanceof RelationFormula right)
                || !left.relation().equals(right.relation())) {
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
        return AxiomKind.RELATION_SUBSTITUTION;
    }
}
