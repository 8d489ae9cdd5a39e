package nl.bytesoflife.fol.axiom;

import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.language.InvalidConstructionException;
import nl.bytesoflife.fol.language.Language;
import nl.bytesoflife.fol.parser.FolParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReflexivityAxiomTest {

    private static final Language LANGUAGE = new Language(
            Set.of("a", "b", "c"), Map.of(1, Set.of("f1"), 3, Set.of("f3")), Map.of(2, Set.of("r2")));

    private static final FolParser PARSER = new FolParser(LANGUAGE);

    private final ReflexivityAxiom axiom = new ReflexivityAxiom();

    @Test
    void create() {
        Formula formula = axiom.create(LANGUAGE, "v7");
        assertEquals("= v7 v7", formula.toString());
        assertTrue(axiom.matches(formula));
    }

    @ParameterizedTest
    @ValueSource(strings = {"= v1 v2", "= a a", "= f1 v1 f1 v1", "r2 v1 v1", "( !! = v1 v1 )"})
    void rejectOtherFormulas(String text) {
        assertFalse(axiom.matches(formula(text)));
    }

    @Test
    void rejectNonVariable() {
        assertThrows(InvalidConstructionException.class, () -> axiom.create(LANGUAGE, "a"));
    }

    private static Formula formula(String text) {
        return PARSER.parseFormula(text);
    }
}
