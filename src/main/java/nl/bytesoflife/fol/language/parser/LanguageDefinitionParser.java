package nl.bytesoflife.fol.language.parser;

import nl.bytesoflife.fol.language.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link Language} from a definition file such as:
 * <pre>
 * (language
 *   (constants a b c)
 *   (function f1 1)
 *   (function f3 3)
 *   (relation r2 2))
 * </pre>
 */
public class LanguageDefinitionParser {

    private static final Logger log = LoggerFactory.getLogger(LanguageDefinitionParser.class);

    public Language load(Path path) throws IOException {
        log.debug("Loading language definition from {}", path);
        return parse(Files.readString(path));
    }

    public Language parse(String content) {
        SExpressionParser sexprParser = new SExpressionParser();
        List<SNode> nodes = sexprParser.parse(content);

        Language language = null;
        for (SNode node : nodes) {
            SNode.SList list = (SNode.SList) node;
            if (!"language".equals(list.tag())) {
                throw new IllegalArgumentException("Unknown top-level entry: " + list);
            }
            if (language != null) {
                throw new IllegalArgumentException("More than one (language ...) block");
            }
            language = buildLanguage(list);
        }
        if (language == null) {
            throw new IllegalArgumentException("No (language ...) block found");
        }
        log.debug("Loaded {}", language);
        return language;
    }

    private Language buildLanguage(SNode.SList list) {
        Set<String> constants = new HashSet<>();
        Map<Integer, Set<String>> functions = new HashMap<>();
        Map<Integer, Set<String>> relations = new HashMap<>();

        for (int i = 1; i < list.size(); i++) {
            if (!(list.children().get(i) instanceof SNode.SList entry)) {
                throw new IllegalArgumentException("Expected a list entry but found: " + list.children().get(i));
            }
            switch (entry.tag()) {
                case "constants" -> parseConstants(entry, constants);
                case "function" -> parseSymbol(entry, functions);
                case "relation" -> parseSymbol(entry, relations);
                default -> throw new IllegalArgumentException("Unknown language entry: " + entry);
            }
        }

        return new Language(constants, functions, relations);
    }

    private void parseConstants(SNode.SList entry, Set<String> constants) {
        for (int i = 1; i < entry.size(); i++) {
            String symbol = entry.atom(i);
            if (symbol == null) {
                throw new IllegalArgumentException("Constant must be an atom: " + entry);
            }
            if (!constants.add(symbol)) {
                throw new IllegalArgumentException("Duplicate constant: " + symbol);
            }
        }
    }

    private void parseSymbol(SNode.SList entry, Map<Integer, Set<String>> symbolsByArity) {
        // (function f3 3)
        String symbol = entry.atom(1);
        String arityValue = entry.atom(2);
        if (entry.size() != 3 || symbol == null || arityValue == null) {
            throw new IllegalArgumentException("Expected (" + entry.tag() + " <symbol> <arity>) but found: " + entry);
        }
        int arity = parseArity(arityValue, entry);
        for (Set<String> declared : symbolsByArity.values()) {
            if (declared.contains(symbol)) {
                throw new IllegalArgumentException("Duplicate " + entry.tag() + ": " + symbol);
            }
        }
        symbolsByArity.computeIfAbsent(arity, k -> new HashSet<>()).add(symbol);
    }

    static int parseArity(String value, SNode.SList entry) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid arity '" + value + "' in " + entry, e);
        }
    }
}
