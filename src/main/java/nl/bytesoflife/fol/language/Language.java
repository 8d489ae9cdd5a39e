package nl.bytesoflife.fol.language;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The vocabulary of a first-order language: its constant symbols and its function and
 * relation symbols with their arities.
 * <p>
 * A language is immutable once built and is compared by value, so two languages declaring
 * the same symbols are interchangeable. Variable symbols ({@code v1, v2, ...}) and the
 * logical symbols are common to all languages and are never declared here.
 */
public final class Language {

    private final Set<String> constants;
    private final Map<String, Integer> functionArities;
    private final Map<String, Integer> relationArities;
    private final int hash;

    /**
     * @param constants the constant symbols
     * @param functions function symbols keyed by their (positive) arity
     * @param relations relation symbols keyed by their (positive) arity
     * @throws InvalidConstructionException if a symbol is declared twice, an arity is not
     *                                      positive, or a symbol cannot be non-logical
     */
    public Language(Set<String> constants, Map<Integer, Set<String>> functions,
                    Map<Integer, Set<String>> relations) {
        Set<String> seen = new HashSet<>();
        for (String constant : constants) {
            declare(seen, constant, "constant");
        }
        this.constants = Set.copyOf(constants);
        this.functionArities = Collections.unmodifiableMap(byArity(seen, functions, "function"));
        this.relationArities = Collections.unmodifiableMap(byArity(seen, relations, "relation"));
        this.hash = computeHash();
    }

    private static Map<String, Integer> byArity(Set<String> seen, Map<Integer, Set<String>> symbolsByArity,
                                                String kind) {
        Map<String, Integer> arities = new HashMap<>();
        for (Map.Entry<Integer, Set<String>> entry : symbolsByArity.entrySet()) {
            Integer arity = entry.getKey();
            if (arity == null || arity < 1) {
                throw new InvalidConstructionException("Invalid " + kind + " arity: " + arity);
            }
            for (String symbol : entry.getValue()) {
                declare(seen, symbol, kind);
                arities.put(symbol, arity);
            }
        }
        return arities;
    }

    private static void declare(Set<String> seen, String symbol, String kind) {
        if (!LogicalSymbols.isValidNonLogical(symbol)) {
            throw new InvalidConstructionException("Invalid " + kind + " symbol: " + symbol);
        }
        if (!seen.add(symbol)) {
            throw new InvalidConstructionException("Symbol declared more than once: " + symbol);
        }
    }

    public static boolean isVariableSymbol(String symbol) {
        return LogicalSymbols.isVariable(symbol);
    }

    public static boolean isLogicalSymbol(String symbol) {
        return LogicalSymbols.isLogical(symbol);
    }

    /**
     * Returns n for the variable symbol "vn".
     *
     * @throws InvalidConstructionException if the symbol is not a variable symbol
     */
    public static int variableIndex(String variable) {
        if (!isVariableSymbol(variable)) {
            throw new InvalidConstructionException("Not a variable symbol: " + variable);
        }
        return Integer.parseInt(variable.substring(1));
    }

    public boolean isConstantSymbol(String symbol) {
        return constants.contains(symbol);
    }

    public OptionalInt functionArity(String symbol) {
        Integer arity = functionArities.get(symbol);
        return arity == null ? OptionalInt.empty() : OptionalInt.of(arity);
    }

    public OptionalInt relationArity(String symbol) {
        Integer arity = relationArities.get(symbol);
        return arity == null ? OptionalInt.empty() : OptionalInt.of(arity);
    }

    public Set<String> getConstants() {
        return constants;
    }

    public Map<Integer, Set<String>> getFunctions() {
        return group(functionArities);
    }

    public Map<Integer, Set<String>> getRelations() {
        return group(relationArities);
    }

    private static Map<Integer, Set<String>> group(Map<String, Integer> arities) {
        Map<Integer, Set<String>> grouped = new TreeMap<>();
        arities.forEach((symbol, arity) -> grouped.computeIfAbsent(arity, k -> new TreeSet<>()).add(symbol));
        return Collections.unmodifiableMap(grouped);
    }

    private int computeHash() {
        int result = constants.hashCode();
        result = 31 * result + functionArities.hashCode();
        result = 31 * result + relationArities.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Language other)) return false;
        return hash == other.hash
                && constants.equals(other.constants)
                && functionArities.equals(other.functionArities)
                && relationArities.equals(other.relationArities);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Language{constants=").append(new TreeSet<>(constants));
        sb.append(", functions=").append(getFunctions());
        sb.append(", relations=").append(getRelations());
        sb.append('}');
        return sb.toString();
    }
}
