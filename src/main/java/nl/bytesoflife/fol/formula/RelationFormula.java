package nl.bytesoflife.fol.formula;

import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;
import nl.bytesoflife.fol.term.Term;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * The formula "R t1 ... tn" where R is an n-ary relation symbol.
 */
public record RelationFormula(Language language, String relation, List<Term> arguments) implements Formula {

    public RelationFormula {
        Objects.requireNonNull(language, "language");
        OptionalInt arity = language.relationArity(relation);
        if (arity.isEmpty()) {
            throw new InvalidConstructionException("Not a relation symbol: " + relation);
        }
        if (arguments.size() != arity.getAsInt()) {
            throw new InvalidConstructionException(arguments.size() + " arguments given for "
                    + arity.getAsInt() + "-ary relation symbol " + relation);
        }
        for (Term argument : arguments) {
            if (!language.equals(argument.language())) {
                throw new InvalidConstructionException("Argument " + argument + " belongs to a different language");
            }
        }
        arguments = List.copyOf(arguments);
    }

    @Override
    public Set<String> freeVariables() {
        Set<String> variables = new HashSet<>();
        for (Term argument : arguments) {
            variables.addAll(argument.variables());
        }
        return variables;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(relation);
        for (Term argument : arguments) {
            sb.append(' ').append(argument);
        }
        return sb.toString();
    }
}
