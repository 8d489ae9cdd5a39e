package nl.bytesoflife.fol.formula;

import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;

import java.util.Objects;
import java.util.Set;

public record NegationFormula(Language language, Formula operand) implements Formula {

    public NegationFormula {
        Objects.requireNonNull(language, "language");
        if (!language.equals(operand.language())) {
            throw new InvalidConstructionException("Negated formula belongs to a different language: " + operand);
        }
    }

    @Override
    public Set<String> freeVariables() {
        return operand.freeVariables();
    }

    @Override
    public String toString() {
        return "( !! " + operand + " )";
    }
}
