package nl.bytesoflife.fol.parser;

/**
 * Resource bounds for a single parse call.
 *
 * @param maxDepth    deepest allowed nesting of term and formula parses
 * @param maxAttempts total number of token slices the parser may try
 */
public record ParserLimits(int maxDepth, int maxAttempts) {

    public static final ParserLimits DEFAULT = new ParserLimits(256, 1_000_000);

    public ParserLimits {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
    }

    public ParserLimits withMaxDepth(int maxDepth) {
        return new ParserLimits(maxDepth, maxAttempts);
    }

    public ParserLimits withMaxAttempts(int maxAttempts) {
        return new ParserLimits(maxDepth, maxAttempts);
    }
}
