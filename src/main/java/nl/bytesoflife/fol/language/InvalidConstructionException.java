package nl.bytesoflife.fol.language;

/**
 * Thrown when a language, term or formula cannot be built from the given parts:
 * a vocabulary mismatch, an arity mismatch, a symbol of the wrong kind or a malformed
 * variable name.
 */
public class InvalidConstructionException extends IllegalArgumentException {

    public InvalidConstructionException(String message) {
        super(message);
    }
}
