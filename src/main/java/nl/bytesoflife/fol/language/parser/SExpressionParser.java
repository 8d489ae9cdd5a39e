package nl.bytesoflife.fol.language.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the S-expression notation of language definition files: nested lists of bare or
 * double-quoted atoms, with {@code #} starting a comment that runs to the end of the line.
 */
public class SExpressionParser {

    private String input;
    private int pos;
    private int line;

    public List<SNode> parse(String text) {
        this.input = text;
        this.pos = 0;
        this.line = 1;
        List<SNode> nodes = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) break;
            if (input.charAt(pos) != '(') {
                throw new ParseException("Expected '(' at top level", pos, line);
            }
            nodes.add(parseList());
        }
        return nodes;
    }

    private SNode.SList parseList() {
        expect('(');
        List<SNode> children = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                throw new ParseException("Unexpected end of input, expected ')'", pos, line);
            }
            char c = input.charAt(pos);
            if (c == ')') {
                pos++;
                return new SNode.SList(children);
            } else if (c == '(') {
                children.add(parseList());
            } else if (c == '"') {
                children.add(parseQuotedAtom());
            } else {
                children.add(parseAtom());
            }
        }
    }

    private SNode.SAtom parseQuotedAtom() {
        int startLine = line;
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new SNode.SAtom(sb.toString());
            }
            if (c == '\\' && pos + 1 < input.length()) {
                pos++;
                c = input.charAt(pos);
            }
            if (c == '\n') line++;
            sb.append(c);
            pos++;
        }
        throw new ParseException("Unterminated quoted atom starting on line " + startLine, pos, line);
    }

    private SNode.SAtom parseAtom() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || c == '#' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        return new SNode.SAtom(input.substring(start, pos));
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw new ParseException("Expected '" + expected + "'", pos, line);
        }
        pos++;
    }

    public static class ParseException extends RuntimeException {
        private final int position;
        private final int line;

        public ParseException(String message, int position, int line) {
            super(message + " (line " + line + ", position " + position + ")");
            this.position = position;
            this.line = line;
        }

        public int getPosition() {
            return position;
        }

        public int getLine() {
            return line;
        }
    }
}
