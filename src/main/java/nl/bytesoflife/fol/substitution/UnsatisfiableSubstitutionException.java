package nl.bytesoflife.fol.substitution;

/**
 * No term substituted for the variable turns the pattern into the given result.
 */
public class UnsatisfiableSubstitutionException extends RuntimeException {

    public UnsatisfiableSubstitutionException(String message) {
        super(message);
    }
}
