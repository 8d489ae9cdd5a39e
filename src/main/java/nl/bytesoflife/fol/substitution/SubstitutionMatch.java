package nl.bytesoflife.fol.substitution;

import nl.bytesoflife.fol.term.Term;

import java.util.Optional;

/**
 * Answer to "which term s turns the pattern into the result when substituted for x?".
 */
public sealed interface SubstitutionMatch
        permits SubstitutionMatch.Witness, SubstitutionMatch.NoConstraint, SubstitutionMatch.Unsatisfiable {

    /**
     * Exactly this term was substituted.
     */
    record Witness(Term term) implements SubstitutionMatch {
    }

    /**
     * The variable does not occur free where it could be observed; any term fits.
     */
    record NoConstraint() implements SubstitutionMatch {
    }

    /**
     * The two trees differ somewhere the variable cannot explain, or its occurrences
     * demand different terms.
     */
    record Unsatisfiable(String reason) implements SubstitutionMatch {
    }

    NoConstraint NO_CONSTRAINT = new NoConstraint();

    default boolean isSatisfiable() {
        return !(this instanceof Unsatisfiable);
    }

    /**
     * @return the witness, or empty when any term fits
     * @throws UnsatisfiableSubstitutionException when no term fits
     */
    default Optional<Term> resolve() {
        if (this instanceof Witness witness) {
            return Optional.of(witness.term());
        }
        if (this instanceof Unsatisfiable unsatisfiable) {
            throw new UnsatisfiableSubstitutionException(unsatisfiable.reason());
        }
        return Optional.empty();
    }

    /**
     * Combines the answers for two sibling positions.
     */
    default SubstitutionMatch merge(SubstitutionMatch other) {
        if (this instanceof Unsatisfiable) return this;
        if (other instanceof Unsatisfiable) return other;
        if (this instanceof NoConstraint) return other;
        if (other instanceof NoConstraint) return this;
        Term mine = ((Witness) this).term();
        Term theirs = ((Witness) other).term();
        if (mine.equals(theirs)) {
            return this;
        }
        return new Unsatisfiable("occurrences require different terms: " + mine + " and " + theirs);
    }
}
