package nl.bytesoflife.fol.formula;

import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The universally quantified formula "( AA v ) ( P )".
 */
public record QuantifiedFormula(Language language, String variable, Formula body) implements Formula {

    public QuantifiedFormula {
        Objects.requireNonNull(language, "language");
        if (!Language.isVariableSymbol(variable)) {
            throw new InvalidConstructionException("Not a variable symbol: " + variable);
        }
        if (!language.equals(body.language())) {
            throw new InvalidConstructionException("Quantified formula belongs to a different language: " + body);
        }
    }

    @Override
    public Set<String> freeVariables() {
        Set<String> variables = new HashSet<>(body.freeVariables());
        variables.remove(variable);
        return variables;
    }

    @Override
    public String toString() {
        return "( AA " + variable + " ) ( " + body + " )";
    }
}
