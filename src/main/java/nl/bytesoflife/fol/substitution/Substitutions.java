package nl.bytesoflife.fol.substitution;

import nl.bytesoflife.fol.formula.DisjunctionFormula;
import nl.bytesoflife.fol.formula.EqualityFormula;
import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.formula.NegationFormula;
import nl.bytesoflife.fol.formula.QuantifiedFormula;
import nl.bytesoflife.fol.formula.RelationFormula;
import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;
import nl.bytesoflife.fol.term.ConstantTerm;
import nl.bytesoflife.fol.term.FunctionTerm;
import nl.bytesoflife.fol.term.Term;
import nl.bytesoflife.fol.term.VariableTerm;

import java.util.ArrayList;
import java.util.List;

/**
 * Substitution of a term for the free occurrences of a variable, the capture check that
 * goes with it, and its inverse: recovering the substituted term from a pattern and an
 * instance of it.
 * <p>
 * All operations return new trees and leave their inputs untouched.
 */
public final class Substitutions {

    private Substitutions() {
    }

    /**
     * The term with {@code t} in place of every occurrence of {@code x}.
     *
     * @throws InvalidConstructionException if {@code x} is not a variable symbol or
     *                                      {@code t} is of another language
     */
    public static Term substitute(Term term, String x, Term t) {
        checkArguments(term.language(), x, t);
        return replace(term, x, t);
    }

    /**
     * The formula with {@code t} in place of every free occurrence of {@code x}, often
     * written P[t/x]. Occurrences under a quantifier over {@code x} are left alone.
     *
     * @throws InvalidConstructionException if {@code x} is not a variable symbol or
     *                                      {@code t} is of another language
     */
    public static Formula substitute(Formula formula, String x, Term t) {
        checkArguments(formula.language(), x, t);
        return replace(formula, x, t);
    }

    private static Term replace(Term term, String x, Term t) {
        if (term instanceof VariableTerm variable) {
            return variable.name().equals(x) ? t : variable;
        }
        if (term instanceof ConstantTerm) {
            return term;
        }
        FunctionTerm function = (FunctionTerm) term;
        return new FunctionTerm(function.language(), function.function(), replaceAll(function.arguments(), x, t));
    }

    private static List<Term> replaceAll(List<Term> terms, String x, Term t) {
        List<Term> replaced = new ArrayList<>(terms.size());
        for (Term term : terms) {
            replaced.add(replace(term, x, t));
        }
        return replaced;
    }

    private static Formula replace(Formula formula, String x, Term t) {
        Language language = formula.language();
        if (formula instanceof EqualityFormula equality) {
            return new EqualityFormula(language, replace(equality.left(), x, t), replace(equality.right(), x, t));
        }
        if (formula instanceof RelationFormula relation) {
            return new RelationFormula(language, relation.relation(), replaceAll(relation.arguments(), x, t));
        }
        if (formula instanceof NegationFormula negation) {
            return new NegationFormula(language, replace(negation.operand(), x, t));
        }
        if (formula instanceof DisjunctionFormula disjunction) {
            return new DisjunctionFormula(language, replace(disjunction.left(), x, t), replace(disjunction.right(), x, t));
        }
        QuantifiedFormula quantified = (QuantifiedFormula) formula;
        if (quantified.variable().equals(x)) {
            // x is bound here, nothing below is free
            return quantified;
        }
        return new QuantifiedFormula(language, quantified.variable(), replace(quantified.body(), x, t));
    }

    /**
     * Whether {@code t} can be substituted for {@code x} without a variable of {@code t}
     * falling under a quantifier.
     *
     * @throws InvalidConstructionException if {@code x} is not a variable symbol or
     *                                      {@code t} is of another language
     */
    public static boolean isSubstitutable(Formula formula, String x, Term t) {
        checkArguments(formula.language(), x, t);
        return substitutable(formula, x, t);
    }

    private static boolean substitutable(Formula formula, String x, Term t) {
        if (formula instanceof EqualityFormula || formula instanceof RelationFormula) {
            return true;
        }
        if (formula instanceof NegationFormula negation) {
            return substitutable(negation.operand(), x, t);
        }
        if (formula instanceof DisjunctionFormula disjunction) {
            return substitutable(disjunction.left(), x, t) && substitutable(disjunction.right(), x, t);
        }
        QuantifiedFormula quantified = (QuantifiedFormula) formula;
        return !quantified.body().isFree(x)
                || (!t.variables().contains(quantified.variable()) && substitutable(quantified.body(), x, t));
    }

    /**
     * Finds the term s with {@code result == substitute(pattern, x, s)}.
     *
     * @throws InvalidConstructionException if {@code x} is not a variable symbol or the
     *                                      trees are of different languages
     */
    public static SubstitutionMatch findSubstitutedTerm(Term pattern, Term result, String x) {
        checkMatchArguments(pattern.language(), result.language(), x);
        return match(pattern, result, x);
    }

    /**
     * Finds the term s with {@code result == substitute(pattern, x, s)}: a witness when s
     * is determined, no constraint when {@code x} is not free anywhere it could be
     * observed, and unsatisfiable when the trees cannot be related this way.
     *
     * @throws InvalidConstructionException if {@code x} is not a variable symbol or the
     *                                      formulas are of different languages
     */
    public static SubstitutionMatch findSubstitutedTerm(Formula pattern, Formula result, String x) {
        checkMatchArguments(pattern.language(), result.language(), x);
        return match(pattern, result, x);
    }

    private static SubstitutionMatch match(Term pattern, Term result, String x) {
        if (pattern instanceof VariableTerm variable && variable.name().equals(x)) {
            return new SubstitutionMatch.Witness(result);
        }
        if (pattern instanceof FunctionTerm function) {
            if (!(result instanceof FunctionTerm other) || !function.function().equals(other.function())) {
                return mismatch(pattern, result);
            }
            return matchAll(function.arguments(), other.arguments(), x);
        }
        // a constant, or a variable other than x
        return pattern.equals(result) ? SubstitutionMatch.NO_CONSTRAINT : mismatch(pattern, result);
    }

    private static SubstitutionMatch matchAll(List<Term> patterns, List<Term> results, String x) {
        SubstitutionMatch match = SubstitutionMatch.NO_CONSTRAINT;
        for (int i = 0; i < patterns.size() && match.isSatisfiable(); i++) {
            match = match.merge(match(patterns.get(i), results.get(i), x));
        }
        return match;
    }

    private static SubstitutionMatch match(Formula pattern, Formula result, String x) {
        if (pattern instanceof EqualityFormula equality) {
            if (!(result instanceof EqualityFormula other)) {
                return mismatch(pattern, result);
            }
            SubstitutionMatch left = match(equality.left(), other.left(), x);
            return left.isSatisfiable() ? left.merge(match(equality.right(), other.right(), x)) : left;
        }
        if (pattern instanceof RelationFormula relation) {
            if (!(result instanceof RelationFormula other) || !relation.relation().equals(other.relation())) {
                return mismatch(pattern, result);
            }
            return matchAll(relation.arguments(), other.arguments(), x);
        }
        if (pattern instanceof NegationFormula negation) {
            if (!(result instanceof NegationFormula other)) {
                return mismatch(pattern, result);
            }
            return match(negation.operand(), other.operand(), x);
        }
        if (pattern instanceof DisjunctionFormula disjunction) {
            if (!(result instanceof DisjunctionFormula other)) {
                return mismatch(pattern, result);
            }
            SubstitutionMatch left = match(disjunction.left(), other.left(), x);
            return left.isSatisfiable() ? left.merge(match(disjunction.right(), other.right(), x)) : left;
        }
        QuantifiedFormula quantified = (QuantifiedFormula) pattern;
        if (!(result instanceof QuantifiedFormula other)) {
            return mismatch(pattern, result);
        }
        if (quantified.variable().equals(x)) {
            // substitution stops at a quantifier over x, so the subtree must come back unchanged
            return quantified.equals(other) ? SubstitutionMatch.NO_CONSTRAINT : mismatch(pattern, result);
        }
        if (!quantified.variable().equals(other.variable())) {
            return mismatch(pattern, result);
        }
        return match(quantified.body(), other.body(), x);
    }

    private static SubstitutionMatch mismatch(Object pattern, Object result) {
        return new SubstitutionMatch.Unsatisfiable("'" + result + "' is not an instance of '" + pattern + "'");
    }

    private static void checkArguments(Language language, String x, Term t) {
        if (!Language.isVariableSymbol(x)) {
            throw new InvalidConstructionException("Not a variable symbol: " + x);
        }
        if (!language.equals(t.language())) {
            throw new InvalidConstructionException("Term " + t + " belongs to a different language");
        }
    }

    private static void checkMatchArguments(Language pattern, Language result, String x) {
        if (!Language.isVariableSymbol(x)) {
            throw new InvalidConstructionException("Not a variable symbol: " + x);
        }
        if (!pattern.equals(result)) {
            throw new InvalidConstructionException("Pattern and result belong to different languages");
        }
    }
}
