package nl.bytesoflife.fol.axiom;

import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;

/**
 * Two variable symbols asserted equal, as "= left right".
 */
public record VariablePair(String left, String right) {

    public VariablePair {
        if (!Language.isVariableSymbol(left) || !Language.isVariableSymbol(right)) {
            throw new InvalidConstructionException("Not a pair of variable symbols: " + left + ", " + right);
        }
    }

    @Override
    public String toString() {
        return "= " + left + " " + right;
    }
}
