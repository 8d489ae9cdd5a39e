package nl.bytesoflife.fol.parser;

/**
 * The input does not match the term or formula grammar. No partial result is kept.
 */
public class ParseException extends RuntimeException {

    private final String input;

    public ParseException(String message, String input) {
        super(message + ": \"" + input + "\"");
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
