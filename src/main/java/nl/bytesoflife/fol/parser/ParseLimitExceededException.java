package nl.bytesoflife.fol.parser;

/**
 * Parsing was aborted because the input nests too deeply or the split search tried too
 * many candidates. Unlike an ordinary parse failure this is never caught by backtracking.
 */
public class ParseLimitExceededException extends ParseException {

    public ParseLimitExceededException(String message, String input) {
        super(message, input);
    }
}
