package nl.bytesoflife.fol.axiom;

import nl.bytesoflife.fol.formula.DisjunctionFormula;
import nl.bytesoflife.fol.formula.EqualityFormula;
import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.formula.Formulas;
import nl.bytesoflife.fol.formula.NegationFormula;
import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;
import nl.bytesoflife.fol.term.Term;
import nl.bytesoflife.fol.term.VariableTerm;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The left-nested conjunction "( ... ( E1 && E2 ) && ... ) && En )" of variable equalities
 * used as the hypothesis of the substitution axioms.
 */
final class EqualityConjunctions {

    private EqualityConjunctions() {
    }

    static Formula create(Language language, List<VariablePair> pairs) {
        if (pairs.isEmpty()) {
            throw new InvalidConstructionException("At least one variable pair is required");
        }
        Formula conjunction = equality(language, pairs.get(0));
        for (VariablePair pair : pairs.subList(1, pairs.size())) {
            conjunction = Formulas.conjunction(conjunction, equality(language, pair));
        }
        return conjunction;
    }

    private static Formula equality(Language language, VariablePair pair) {
        return new EqualityFormula(language, new VariableTerm(language, pair.left()),
                new VariableTerm(language, pair.right()));
    }

    /**
     * The pairs of a conjunction built by {@link #create}, or empty for any other formula.
     */
    static Optional<List<VariablePair>> extract(Formula formula) {
        Optional<VariablePair> single = variableEquality(formula);
        if (single.isPresent()) {
            List<VariablePair> pairs = new ArrayList<>();
            pairs.add(single.get());
            return Optional.of(pairs);
        }
        // ( !! ( ( !! rest ) || ( !! = x y ) ) )
        if (formula instanceof NegationFormula outer
                && outer.operand() instanceof DisjunctionFormula disjunction
                && disjunction.left() instanceof NegationFormula rest
                && disjunction.right() instanceof NegationFormula last) {
            Optional<VariablePair> pair = variableEquality(last.operand());
            if (pair.isEmpty()) {
                return Optional.empty();
            }
            Optional<List<VariablePair>> pairs = extract(rest.operand());
            pairs.ifPresent(list -> list.add(pair.get()));
            return pairs;
        }
        return Optional.empty();
    }

    private static Optional<VariablePair> variableEquality(Formula formula) {
        if (formula instanceof EqualityFormula equality
                && equality.left() instanceof VariableTerm left
                && equality.right() instanceof VariableTerm right) {
            return Optional.of(new VariablePair(left.name(), right.name()));
        }
        return Optional.empty();
    }

    static List<Term> lefts(Language language, List<VariablePair> pairs) {
        List<Term> terms = new ArrayList<>(pairs.size());
        for (VariablePair pair : pairs) {
            terms.add(new VariableTerm(language, pair.left()));
        }
        return terms;
    }

    static List<Term> rights(Language language, List<VariablePair> pairs) {
        List<Term> terms = new ArrayList<>(pairs.size());
        for (VariablePair pair : pairs) {
            terms.add(new VariableTerm(language, pair.right()));
        }
        return terms;
    }
}
