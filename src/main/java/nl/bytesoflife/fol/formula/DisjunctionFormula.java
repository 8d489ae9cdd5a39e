package nl.bytesoflife.fol.formula;

import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

public record DisjunctionFormula(Language language, Formula left, Formula right) implements Formula {

    public DisjunctionFormula {
        Objects.requireNonNull(language, "language");
        if (!language.equals(left.language()) || !language.equals(right.language())) {
            throw new InvalidConstructionException("Disjuncts belong to a different language");
        }
    }

    @Override
    public Set<String> freeVariables() {
        Set<String> variables = new HashSet<>(left.freeVariables());
        variables.addAll(right.freeVariables());
        return variables;
    }

    @Override
    public String toString() {
        return "( " + left + " || " + right + " )";
    }
}
