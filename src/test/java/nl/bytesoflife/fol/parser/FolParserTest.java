package nl.bytesoflife.fol.parser;

import nl.bytesoflife.fol.formula.DisjunctionFormula;
import nl.bytesoflife.fol.formula.EqualityFormula;
import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.formula.Formulas;
import nl.bytesoflife.fol.formula.NegationFormula;
import nl.bytesoflife.fol.formula.QuantifiedFormula;
import nl.bytesoflife.fol.formula.RelationFormula;
import nl.bytesoflife.fol.language.Language;
import nl.bytesoflife.fol.term.ConstantTerm;
import nl.bytesoflife.fol.term.FunctionTerm;
import nl.bytesoflife.fol.term.Term;
import nl.bytesoflife.fol.term.VariableTerm;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FolParserTest {

    private static final Language LANGUAGE = new Language(
            Set.of("a", "b", "c"), Map.of(1, Set.of("f1"), 3, Set.of("f3")), Map.of(2, Set.of("r2")));

    private static final Language WIDE = new Language(Set.of("a"), Map.of(10, Set.of("g")), Map.of());

    private final FolParser parser = new FolParser(LANGUAGE);

    private static Term constant(String name) {
        return new ConstantTerm(LANGUAGE, name);
    }

    private static Term variable(String name) {
        return new VariableTerm(LANGUAGE, name);
    }

    private static Term apply(String function, Term... args) {
        return new FunctionTerm(LANGUAGE, function, List.of(args));
    }

    @Test
    void parseAtomicTerms() {
        assertEquals(variable("v1"), parser.parseTerm("v1"));
        assertEquals(constant("a"), parser.parseTerm("a"));
        assertEquals(apply("f1", constant("a")), parser.parseTerm("f1 a"));
    }

    @Test
    void segmentUndelimitedArguments() {
        Term term = parser.parseTerm("f3 a v1 f1 c");
        assertEquals(apply("f3", constant("a"), variable("v1"), apply("f1", constant("c"))), term);

        Term nested = parser.parseTerm("f3 f3 a b c f1 f1 v2 f3 v1 v2 v3");
        assertEquals(apply("f3",
                apply("f3", constant("a"), constant("b"), constant("c")),
                apply("f1", apply("f1", variable("v2"))),
                apply("f3", variable("v1"), variable("v2"), variable("v3"))), nested);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "f1", "f3 a", "f3 a b", "f1 a b", "r2 a b", "=", "blah", "v0", "a b"})
    void rejectMalformedTerms(String text) {
        assertThrows(ParseException.class, () -> parser.parseTerm(text));
    }

    @Test
    void parseEquality() {
        Formula formula = parser.parseFormula("= v1 a");
        assertEquals(new EqualityFormula(LANGUAGE, variable("v1"), constant("a")), formula);
        assertEquals("= v1 a", formula.toString());
    }

    @Test
    void equalitySplitsBetweenNestedTerms() {
        Formula formula = parser.parseFormula("= f3 f1 v1 a v2 f1 v1");
        assertEquals(new EqualityFormula(LANGUAGE,
                apply("f3", apply("f1", variable("v1")), constant("a"), variable("v2")),
                apply("f1", variable("v1"))), formula);
    }

    @Test
    void parseRelation() {
        Formula formula = parser.parseFormula("r2 f1 v1 a");
        assertEquals(new RelationFormula(LANGUAGE, "r2", List.of(apply("f1", variable("v1")), constant("a"))), formula);
    }

    @Test
    void parseNegationDisjunctionAndQuantifier() {
        Formula equality = parser.parseFormula("= v1 a");
        assertEquals(new NegationFormula(LANGUAGE, equality), parser.parseFormula("( !! = v1 a )"));
        assertEquals(new DisjunctionFormula(LANGUAGE, equality, parser.parseFormula("r2 v1 b")),
                parser.parseFormula("( = v1 a || r2 v1 b )"));
        assertEquals(new QuantifiedFormula(LANGUAGE, "v1", equality), parser.parseFormula("( AA v1 ) ( = v1 a )"));
    }

    @Test
    void desugarExistential() {
        Formula formula = parser.parseFormula("( EE v1 ) ( = v1 a )");
        assertEquals("( !! ( AA v1 ) ( ( !! = v1 a ) ) )", formula.toString());
    }

    @Test
    void desugarBinaryShorthand() {
        Formula p = parser.parseFormula("= v1 a");
        Formula q = parser.parseFormula("r2 v2 b");
        assertEquals(Formulas.conjunction(p, q), parser.parseFormula("( = v1 a && r2 v2 b )"));
        assertEquals(Formulas.implication(p, q), parser.parseFormula("( = v1 a -> r2 v2 b )"));
        assertEquals(Formulas.equivalence(p, q), parser.parseFormula("( = v1 a <-> r2 v2 b )"));
        assertEquals("( ( !! = v1 a ) || r2 v2 b )", parser.parseFormula("( = v1 a -> r2 v2 b )").toString());
    }

    @Test
    void topLevelConnectiveIsFoundAtDepthOne() {
        Formula formula = parser.parseFormula("( ( = v1 a || = v2 b ) -> ( AA v3 ) ( ( !! r2 v3 c ) ) )");
        DisjunctionFormula implication = assertInstanceOf(DisjunctionFormula.class, formula);
        NegationFormula hypothesis = assertInstanceOf(NegationFormula.class, implication.left());
        assertInstanceOf(DisjunctionFormula.class, hypothesis.operand());
        assertInstanceOf(QuantifiedFormula.class, implication.right());
    }

    @Test
    void whitespaceRunsSeparateSymbols() {
        assertEquals(parser.parseFormula("( !! = v1 a )"), parser.parseFormula("  (   !!\t= v1\na )  "));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "", "blah", "f1", "f3 a", "|| AA", "v1", "f3 a v1 f1 c", "r2", "r2 f3 a v1 f1 c",
            "= a", "= a b c", "( = a b )", "( !! )", "( || = a b )", "( = a b || )",
            "( AA a ) ( = a b )", "( AA v1 ) = v1 a", "( = a b = a b )", "( = a b || = a b",
            "( !! ( AA v1 ) ( = v1 v2 ) ) )", "( AA v1 ) ( = v1 a ) || ( = v1 b )"
    })
    void rejectMalformedFormulas(String text) {
        ParseException e = assertThrows(ParseException.class, () -> parser.parseFormula(text));
        assertFalse(e instanceof ParseLimitExceededException);
        assertEquals(text, e.getInput());
    }

    static Stream<Formula> constructedFormulas() {
        Term a = constant("a");
        Term v1 = variable("v1");
        Term v2 = variable("v2");
        Term f3 = apply("f3", apply("f1", v1), a, apply("f3", v2, v2, constant("c")));
        Formula equality = new EqualityFormula(LANGUAGE, f3, apply("f1", f3));
        Formula relation = new RelationFormula(LANGUAGE, "r2", List.of(apply("f1", a), f3));
        Formula negation = new NegationFormula(LANGUAGE, relation);
        Formula disjunction = new DisjunctionFormula(LANGUAGE, negation, equality);
        Formula quantified = new QuantifiedFormula(LANGUAGE, "v2", disjunction);
        return Stream.of(
                equality,
                relation,
                negation,
                disjunction,
                quantified,
                new DisjunctionFormula(LANGUAGE, quantified, new QuantifiedFormula(LANGUAGE, "v1", quantified)),
                Formulas.equivalence(quantified, Formulas.existential("v1", relation)),
                new NegationFormula(LANGUAGE, new NegationFormula(LANGUAGE, quantified)));
    }

    @ParameterizedTest
    @MethodSource("constructedFormulas")
    void renderingParsesBackToTheSameFormula(Formula formula) {
        assertEquals(formula, parser.parseFormula(formula.toString()));
    }

    @Test
    void renderingParsesBackToTheSameTerm() {
        Term term = apply("f3", apply("f3", variable("v7"), constant("b"), constant("a")),
                apply("f1", apply("f1", apply("f1", constant("c")))), variable("v12"));
        assertEquals(term, parser.parseTerm(term.toString()));
    }

    @Test
    void staticEntryPoints() {
        assertEquals(constant("b"), FolParser.parseTerm(LANGUAGE, "b"));
        assertEquals(parser.parseFormula("= b b"), FolParser.parseFormula(LANGUAGE, "= b b"));
    }

    @Test
    void nestingBeyondLimitIsFatal() {
        FolParser shallow = new FolParser(LANGUAGE, ParserLimits.DEFAULT.withMaxDepth(2));
        assertEquals("( !! = a a )", shallow.parseFormula("( !! = a a )").toString());
        assertThrows(ParseLimitExceededException.class,
                () -> shallow.parseFormula("( !! ( !! ( !! ( !! = a a ) ) ) )"));
    }

    @Test
    void attemptBudgetIsFatal() {
        FolParser impatient = new FolParser(LANGUAGE, ParserLimits.DEFAULT.withMaxAttempts(3));
        assertThrows(ParseLimitExceededException.class, () -> impatient.parseFormula("= f3 a b c f3 a b c"));
    }

    @Test
    void depthLimitBoundaryWithBacktracking() {
        // "f1" and "f1 f1" are tried before the left argument settles on "f1 f1 a"
        String text = "= f1 f1 a f1 a";
        FolParser exact = new FolParser(LANGUAGE, ParserLimits.DEFAULT.withMaxDepth(3));
        assertEquals(text, exact.parseFormula(text).toString());
        FolParser tooShallow = new FolParser(LANGUAGE, ParserLimits.DEFAULT.withMaxDepth(2));
        assertThrows(ParseLimitExceededException.class, () -> tooShallow.parseFormula(text));
    }

    private static String wideApplication() {
        // a 10-ary symbol over 46 tokens of which only single tokens are terms
        StringBuilder text = new StringBuilder("g");
        String[] cycle = {"a", "v1", "v2"};
        for (int i = 0; i < 46; i++) {
            text.append(' ').append(cycle[i % 3]);
        }
        return text.toString();
    }

    @Test
    void failingSliceSkipsEverySplitThatKeepsIt() {
        // about 1,600 slice attempts; without skipping, C(45, 9) splits would be tried
        FolParser bounded = new FolParser(WIDE, ParserLimits.DEFAULT.withMaxAttempts(2_000));
        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            ParseException e = assertThrows(ParseException.class, () -> bounded.parseTerm(wideApplication()));
            assertFalse(e instanceof ParseLimitExceededException);
        });
    }

    @Test
    void revisitedSlicesCountAgainstBudget() {
        // only about 340 distinct slices, but each split re-reads the earlier ones
        FolParser bounded = new FolParser(WIDE, ParserLimits.DEFAULT.withMaxAttempts(1_000));
        assertThrows(ParseLimitExceededException.class, () -> bounded.parseTerm(wideApplication()));
    }

    @Test
    void wideApplicationStillParses() {
        String text = "g a v1 a v2 a v3 a v4 a v5";
        Term term = new FolParser(WIDE).parseTerm(text);
        assertEquals(text, term.toString());
        assertEquals(10, ((FunctionTerm) term).arguments().size());
    }

    @Test
    void deepInputWithinDefaultLimits() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 100; i++) text.append("( !! ");
        text.append("= a a");
        for (int i = 0; i < 100; i++) text.append(" )");
        Formula formula = parser.parseFormula(text.toString());
        assertEquals(text.toString(), formula.toString());
    }

    @Test
    void rejectInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> new ParserLimits(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new ParserLimits(10, 0));
    }
}
