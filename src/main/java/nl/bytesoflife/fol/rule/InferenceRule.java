package nl.bytesoflife.fol.rule;

import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;

import java.util.Set;

/**
 * Decides whether a conclusion may be inferred from a set of premises by one rule.
 */
public interface InferenceRule {

    /**
     * @throws InvalidConstructionException if the formulas are of different languages
     */
    boolean isInstance(Set<Formula> premises, Formula conclusion);

    static void requireSameLanguage(Set<Formula> premises, Formula conclusion) {
        Language language = conclusion.language();
        for (Formula premise : premises) {
            if (!language.equals(premise.language())) {
                throw new InvalidConstructionException("Premise " + premise + " belongs to a different language");
            }
        }
    }
}
