package nl.bytesoflife.fol.term;

import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;

import java.util.Objects;
import java.util.Set;

public record VariableTerm(Language language, String name) implements Term {

    public VariableTerm {
        Objects.requireNonNull(language, "language");
        if (!Language.isVariableSymbol(name)) {
            throw new InvalidConstructionException("Not a variable symbol: " + name);
        }
    }

    @Override
    public Set<String> variables() {
        return Set.of(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
