package nl.bytesoflife.fol.language.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void parseSimpleList() {
        List<SNode> nodes = parser.parse("(function f1 1)");
        assertEquals(1, nodes.size());
        assertInstanceOf(SNode.SList.class, nodes.get(0));
        SNode.SList list = (SNode.SList) nodes.get(0);
        assertEquals(3, list.size());
        assertEquals("function", list.tag());
        assertEquals("f1", list.atom(1));
        assertEquals("1", list.atom(2));
        assertNull(list.atom(3));
    }

    @Test
    void parseNestedLists() {
        List<SNode> nodes = parser.parse("(language (constants a b) (relation < 2))");
        SNode.SList list = (SNode.SList) nodes.get(0);
        assertEquals(3, list.size());
        assertInstanceOf(SNode.SList.class, list.children().get(2));
        assertNull(list.atom(1));
        assertEquals("(language (constants a b) (relation < 2))", list.toString());
    }

    @Test
    void parseQuotedAtom() {
        List<SNode> nodes = parser.parse("(constants \"a\\\"b\" plain)");
        SNode.SList list = (SNode.SList) nodes.get(0);
        assertEquals("a\"b", list.atom(1));
        assertEquals("plain", list.atom(2));
    }

    @Test
    void skipComments() {
        String input = """
                # This is a comment
                (constants a)
                # Another comment
                (function f 1) # trailing
                """;
        List<SNode> nodes = parser.parse(input);
        assertEquals(2, nodes.size());
    }

    @Test
    void commentEndsAnAtom() {
        SNode.SList list = (SNode.SList) parser.parse("(constants a# b\n c)").get(0);
        assertEquals(3, list.size());
        assertEquals("a", list.atom(1));
        assertEquals("c", list.atom(2));
    }

    @Test
    void parseEmptyInput() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("   \n\n  # comment only\n  ").isEmpty());
    }

    @Test
    void reportLineOfUnclosedList() {
        SExpressionParser.ParseException e = assertThrows(SExpressionParser.ParseException.class,
                () -> parser.parse("(language\n  (constants a b)\n"));
        assertEquals(3, e.getLine());
    }

    @Test
    void rejectTopLevelAtom() {
        assertThrows(SExpressionParser.ParseException.class, () -> parser.parse("language"));
    }

    @Test
    void rejectUnterminatedQuote() {
        assertThrows(SExpressionParser.ParseException.class, () -> parser.parse("(constants \"a)"));
    }
}
