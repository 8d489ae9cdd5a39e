package nl.bytesoflife.fol.language.parser;

import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LanguageDefinitionParserTest {

    private final LanguageDefinitionParser parser = new LanguageDefinitionParser();

    @Test
    void loadArithmetic() throws IOException {
        Language language = parser.load(Path.of("src/test/resources/languages/arithmetic.lang"));

        assertTrue(language.isConstantSymbol("0"));
        assertEquals(1, language.functionArity("S").getAsInt());
        assertEquals(2, language.functionArity("+").getAsInt());
        assertEquals(2, language.functionArity("*").getAsInt());
        assertEquals(2, language.relationArity("<").getAsInt());
    }

    @Test
    void loadedLanguageEqualsDeclaredOne() throws IOException {
        Language loaded = parser.load(Path.of("src/test/resources/languages/abc.lang"));
        Language declared = new Language(
                Set.of("a", "b", "c"), Map.of(1, Set.of("f1"), 3, Set.of("f3")), Map.of(2, Set.of("r2")));
        assertEquals(declared, loaded);
    }

    @Test
    void emptyLanguage() {
        Language language = parser.parse("(language)");
        assertTrue(language.getConstants().isEmpty());
        assertTrue(language.getFunctions().isEmpty());
    }

    @Test
    void rejectMissingLanguageBlock() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("# nothing here"));
    }

    @Test
    void rejectUnknownEntries() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("(vocabulary (constants a))"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("(language (predicate P 1))"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("(language constants)"));
    }

    @Test
    void rejectMalformedSymbolEntries() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("(language (function f two))"));
        assertTrue(e.getMessage().contains("two"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("(language (function f))"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("(language (relation R 2 3))"));
    }

    @Test
    void rejectRepeatedSymbolEntries() {
        IllegalArgumentException function = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("(language (function f 1) (function f 1))"));
        assertEquals("Duplicate function: f", function.getMessage());
        IllegalArgumentException relation = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("(language (relation R 2) (relation R 3))"));
        assertEquals("Duplicate relation: R", relation.getMessage());
        IllegalArgumentException constant = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("(language (constants a b a))"));
        assertEquals("Duplicate constant: a", constant.getMessage());
    }

    @Test
    void rejectSecondLanguageBlock() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("(language) (language)"));
    }

    @Test
    void vocabularyRulesStillApply() {
        assertThrows(InvalidConstructionException.class, () -> parser.parse("(language (constants v1))"));
        assertThrows(InvalidConstructionException.class, () -> parser.parse("(language (function f 0))"));
        assertThrows(InvalidConstructionException.class,
                () -> parser.parse("(language (constants f) (function f 1))"));
    }
}
