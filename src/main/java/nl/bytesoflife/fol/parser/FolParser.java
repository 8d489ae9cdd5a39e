package nl.bytesoflife.fol.parser;

import nl.bytesoflife.fol.formula.DisjunctionFormula;
import nl.bytesoflife.fol.formula.EqualityFormula;
import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.formula.Formulas;
import nl.bytesoflife.fol.formula.NegationFormula;
import nl.bytesoflife.fol.formula.QuantifiedFormula;
import nl.bytesoflife.fol.formula.RelationFormula;
import nl.bytesoflife.fol.language.Language;
import nl.bytesoflife.fol.language.LogicalSymbols;
import nl.bytesoflife.fol.term.ConstantTerm;
import nl.bytesoflife.fol.term.FunctionTerm;
import nl.bytesoflife.fol.term.Term;
import nl.bytesoflife.fol.term.VariableTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Parses space-delimited symbol strings into terms and formulas of a language.
 * <p>
 * Arguments of function and relation symbols carry no delimiters, so "f a1 ... an" is
 * segmented by trying every way to cut the remaining tokens into n slices, in increasing
 * order of cut positions, and keeping the first segmentation in which every slice parses.
 * Compound formulas are recognised by their fixed markers ({@code !!}, {@code AA},
 * {@code EE}) or else by the first binary connective found at bracket depth 1.
 * <p>
 * A parser holds no per-call state and may be shared between threads.
 */
public class FolParser {

    private static final Logger log = LoggerFactory.getLogger(FolParser.class);

    private final Language language;
    private final ParserLimits limits;

    public FolParser(Language language) {
        this(language, ParserLimits.DEFAULT);
    }

    public FolParser(Language language, ParserLimits limits) {
        this.language = Objects.requireNonNull(language, "language");
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public static Term parseTerm(Language language, String text) {
        return new FolParser(language).parseTerm(text);
    }

    public static Formula parseFormula(Language language, String text) {
        return new FolParser(language).parseFormula(text);
    }

    public Language getLanguage() {
        return language;
    }

    public ParserLimits getLimits() {
        return limits;
    }

    /**
     * @throws ParseException if the text is not a term of this parser's language
     */
    public Term parseTerm(String text) {
        Run run = new Run(text);
        ParseResult<Term> result = run.term(0, run.tokens.length, 0);
        return run.unwrap(result, "term");
    }

    /**
     * @throws ParseException if the text is not a formula of this parser's language
     */
    public Formula parseFormula(String text) {
        Run run = new Run(text);
        ParseResult<Formula> result = run.formula(0, run.tokens.length, 0);
        return run.unwrap(result, "formula");
    }

    static String[] tokenize(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return new String[0];
        }
        return trimmed.split("\\s+");
    }

    /**
     * State of one parse call: the tokens, the slice budget and the memo of term slices.
     */
    private final class Run {

        private final String input;
        private final String[] tokens;
        private final Map<Long, ParseResult<Term>> terms = new HashMap<>();
        private int attempts;

        Run(String input) {
            this.input = Objects.requireNonNull(input, "input");
            this.tokens = tokenize(input);
        }

        <T> T unwrap(ParseResult<T> result, String kind) {
            if (result instanceof ParseResult.Success<T> success) {
                log.debug("Parsed {} \"{}\" in {} attempts", kind, input, attempts);
                return success.value();
            }
            String reason = ((ParseResult.Failure<T>) result).reason();
            log.debug("Cannot parse {} \"{}\": {}", kind, input, reason);
            throw new ParseException("Cannot parse " + kind + " (" + reason + ")", input);
        }

        private void enter(int depth) {
            if (depth > limits.maxDepth()) {
                log.warn("Nesting depth {} exceeded while parsing \"{}\"", limits.maxDepth(), input);
                throw new ParseLimitExceededException("Nesting deeper than " + limits.maxDepth(), input);
            }
            if (++attempts > limits.maxAttempts()) {
                log.warn("Gave up after {} attempts while parsing \"{}\"", limits.maxAttempts(), input);
                throw new ParseLimitExceededException("More than " + limits.maxAttempts() + " parse attempts", input);
            }
        }

        ParseResult<Term> term(int from, int to, int depth) {
            // counted and depth-checked even when the slice is already known
            enter(depth);
            long key = ((long) from << 32) | to;
            ParseResult<Term> cached = terms.get(key);
            if (cached != null) {
                return cached;
            }
            ParseResult<Term> result = computeTerm(from, to, depth);
            terms.put(key, result);
            return result;
        }

        private ParseResult<Term> computeTerm(int from, int to, int depth) {
            int length = to - from;
            if (length < 1) {
                return ParseResult.failure("empty term");
            }
            String head = tokens[from];
            if (length == 1) {
                if (Language.isVariableSymbol(head)) {
                    return ParseResult.success(new VariableTerm(language, head));
                }
                if (language.isConstantSymbol(head)) {
                    return ParseResult.success(new ConstantTerm(language, head));
                }
                return ParseResult.failure("'" + head + "' is neither a variable nor a constant");
            }

            OptionalInt arity = language.functionArity(head);
            if (arity.isEmpty()) {
                return ParseResult.failure("'" + head + "' is not a function symbol");
            }
            if (length < arity.getAsInt() + 1) {
                return ParseResult.failure("too few symbols for " + head);
            }
            return arguments(head, from + 1, to, arity.getAsInt(), depth)
                    .map(args -> new FunctionTerm(language, head, args));
        }

        /**
         * Parses {@code [from, to)} as exactly {@code count} consecutive terms.
         */
        private ParseResult<List<Term>> arguments(String head, int from, int to, int count, int depth) {
            SplitPoints splits = new SplitPoints(from, to, count);
            while (!splits.isExhausted()) {
                int[] bounds = splits.boundaries();
                List<Term> args = new ArrayList<>(count);
                int failed = -1;
                for (int i = 0; i < count && failed < 0; i++) {
                    ParseResult<Term> arg = term(bounds[i], bounds[i + 1], depth + 1);
                    if (arg instanceof ParseResult.Success<Term> success) {
                        args.add(success.value());
                    } else {
                        failed = i;
                    }
                }
                if (failed < 0) {
                    return ParseResult.success(args);
                }
                if (log.isTraceEnabled()) {
                    log.trace("Rejected split {} of arguments to {} at slice {}", Arrays.toString(bounds), head, failed);
                }
                // every later split keeping this slice fails the same way
                splits.skip(failed);
            }
            return ParseResult.failure("no split of the arguments of " + head + " into " + count + " terms");
        }

        ParseResult<Formula> formula(int from, int to, int depth) {
            enter(depth);
            int length = to - from;
            if (length < 2) {
                return ParseResult.failure("formula too short");
            }
            String head = tokens[from];

            if (LogicalSymbols.EQUALS.equals(head)) {
                return arguments(head, from + 1, to, 2, depth)
                        .map(args -> new EqualityFormula(language, args.get(0), args.get(1)));
            }

            OptionalInt arity = language.relationArity(head);
            if (arity.isPresent() && length >= arity.getAsInt() + 1) {
                return arguments(head, from + 1, to, arity.getAsInt(), depth)
                        .map(args -> new RelationFormula(language, head, args));
            }

            if (!LogicalSymbols.OPEN.equals(head) || !LogicalSymbols.CLOSE.equals(tokens[to - 1])) {
                return ParseResult.failure("expected a bracketed formula");
            }

            String marker = tokens[from + 1];
            if (LogicalSymbols.NOT.equals(marker)) {
                return formula(from + 2, to - 1, depth + 1)
                        .map(operand -> new NegationFormula(language, operand));
            }

            if (length >= 6
                    && (LogicalSymbols.FOR_ALL.equals(marker) || LogicalSymbols.EXISTS.equals(marker))
                    && Language.isVariableSymbol(tokens[from + 2])
                    && LogicalSymbols.CLOSE.equals(tokens[from + 3])
                    && LogicalSymbols.OPEN.equals(tokens[from + 4])) {
                String variable = tokens[from + 2];
                ParseResult<Formula> body = formula(from + 5, to - 1, depth + 1);
                if (LogicalSymbols.FOR_ALL.equals(marker)) {
                    return body.map(p -> new QuantifiedFormula(language, variable, p));
                }
                return body.map(p -> Formulas.existential(variable, p));
            }

            int connective = topLevelConnective(from, to);
            if (connective < 0) {
                return ParseResult.failure("no binary connective at top level");
            }
            ParseResult<Formula> left = formula(from + 1, connective, depth + 1);
            if (!(left instanceof ParseResult.Success<Formula> p)) {
                return left;
            }
            ParseResult<Formula> right = formula(connective + 1, to - 1, depth + 1);
            if (!(right instanceof ParseResult.Success<Formula> q)) {
                return right;
            }
            return ParseResult.success(combine(tokens[connective], p.value(), q.value()));
        }

        /**
         * Index of the first binary connective at bracket depth 1, or -1 when there is none
         * or it leaves either operand empty.
         */
        private int topLevelConnective(int from, int to) {
            int depth = 0;
            for (int i = from; i < to; i++) {
                String token = tokens[i];
                if (LogicalSymbols.OPEN.equals(token)) {
                    depth++;
                } else if (LogicalSymbols.CLOSE.equals(token)) {
                    depth--;
                } else if (depth == 1 && LogicalSymbols.BINARY_CONNECTIVES.contains(token)) {
                    return i > from + 1 && i < to - 2 ? i : -1;
                }
            }
            return -1;
        }

        private Formula combine(String connective, Formula p, Formula q) {
            return switch (connective) {
                case LogicalSymbols.OR -> new DisjunctionFormula(language, p, q);
                case LogicalSymbols.AND -> Formulas.conjunction(p, q);
                case LogicalSymbols.IMPLIES -> Formulas.implication(p, q);
                case LogicalSymbols.IFF -> Formulas.equivalence(p, q);
                default -> throw new IllegalStateException("Not a binary connective: " + connective);
            };
        }
    }
}
