package nl.bytesoflife.fol.formula;

import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;
import nl.bytesoflife.fol.term.Term;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

public record EqualityFormula(Language language, Term left, Term right) implements Formula {

    public EqualityFormula {
        Objects.requireNonNull(language, "language");
        if (!language.equals(left.language()) || !language.equals(right.language())) {
            throw new InvalidConstructionException("Terms of " + left + " = " + right + " belong to a different language");
        }
    }

    @Override
    public Set<String> freeVariables() {
        Set<String> variables = new HashSet<>(left.variables());
        variables.addAll(right.variables());
        return variables;
    }

    @Override
    public String toString() {
        return "= " + left + " " + right;
    }
}
