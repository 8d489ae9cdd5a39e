package nl.bytesoflife.fol.term;

import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;

import java.util.Objects;
import java.util.Set;

public record ConstantTerm(Language language, String name) implements Term {

    public ConstantTerm {
        Objects.requireNonNull(language, "language");
        if (!language.isConstantSymbol(name)) {
            throw new InvalidConstructionException("Not a constant symbol: " + name);
        }
    }

    @Override
    public Set<String> variables() {
        return Set.of();
    }

    @Override
    public String toString() {
        return name;
    }
}
