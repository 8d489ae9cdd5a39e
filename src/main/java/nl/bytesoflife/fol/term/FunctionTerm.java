package nl.bytesoflife.fol.term;

import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * The term "f t1 ... tn" where f is an n-ary function symbol.
 */
public record FunctionTerm(Language language, String function, List<Term> arguments) implements Term {

    public FunctionTerm {
        Objects.requireNonNull(language, "language");
        OptionalInt arity = language.functionArity(function);
        if (arity.isEmpty()) {
            throw new InvalidConstructionException("Not a function symbol: " + function);
        }
        if (arguments.size() != arity.getAsInt()) {
            throw new InvalidConstructionException(arguments.size() + " arguments given for "
                    + arity.getAsInt() + "-ary function symbol " + function);
        }
        for (Term argument : arguments) {
            if (!language.equals(argument.language())) {
                throw new InvalidConstructionException("Argument " + argument + " belongs to a different language");
            }
        }
        arguments = List.copyOf(arguments);
    }

    @Override
    public Set<String> variables() {
        Set<String> variables = new HashSet<>();
        for (Term argument : arguments) {
            variables.addAll(argument.variables());
        }
        return variables;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(function);
        for (Term argument : arguments) {
            sb.append(' ').append(argument);
        }
        return sb.toString();
    }
}
