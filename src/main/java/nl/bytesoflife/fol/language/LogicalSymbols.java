package nl.bytesoflife.fol.language;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Symbols shared by every first-order language.
 * <p>
 * To stay within ASCII, {@code ||} stands for disjunction, {@code !!} for negation and
 * {@code AA} for universal quantification. The shorthand connectives {@code &&}, {@code ->},
 * {@code <->} and {@code EE} are accepted by the parser and desugared into the primitives.
 */
public final class LogicalSymbols {

    public static final String OPEN = "(";
    public static final String CLOSE = ")";
    public static final String OR = "||";
    public static final String NOT = "!!";
    public static final String FOR_ALL = "AA";
    public static final String EQUALS = "=";

    public static final String AND = "&&";
    public static final String IMPLIES = "->";
    public static final String IFF = "<->";
    public static final String EXISTS = "EE";

    public static final Set<String> COMMON = Set.of(OPEN, CLOSE, OR, NOT, FOR_ALL, EQUALS);
    public static final Set<String> SHORTHAND = Set.of(AND, IMPLIES, IFF, EXISTS);
    public static final Set<String> BINARY_CONNECTIVES = Set.of(OR, AND, IMPLIES, IFF);

    private static final Pattern VARIABLE = Pattern.compile("v[1-9]\\d*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private LogicalSymbols() {
    }

    public static boolean isVariable(String symbol) {
        return symbol != null && VARIABLE.matcher(symbol).matches();
    }

    public static boolean isLogical(String symbol) {
        return COMMON.contains(symbol) || SHORTHAND.contains(symbol);
    }

    /**
     * Whether the symbol may be declared as a constant, function or relation symbol.
     */
    public static boolean isValidNonLogical(String symbol) {
        return symbol != null
                && !symbol.isEmpty()
                && !WHITESPACE.matcher(symbol).find()
                && !isLogical(symbol)
                && !isVariable(symbol);
    }
}
