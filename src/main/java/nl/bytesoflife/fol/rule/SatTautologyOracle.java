package nl.bytesoflife.fol.rule;

import nl.bytesoflife.fol.formula.DisjunctionFormula;
import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.formula.NegationFormula;
import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides validity with the SAT4J solver: a formula is a tautology when its negation,
 * Tseitin-encoded into clauses, is unsatisfiable.
 */
public class SatTautologyOracle implements TautologyOracle {

    private static final Logger log = LoggerFactory.getLogger(SatTautologyOracle.class);

    public static final int DEFAULT_TIMEOUT_SECONDS = 60;

    private final int timeoutSeconds;

    public SatTautologyOracle() {
        this(DEFAULT_TIMEOUT_SECONDS);
    }

    public SatTautologyOracle(int timeoutSeconds) {
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
        }
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * @throws IllegalStateException if the solver does not finish within the timeout
     */
    @Override
    public boolean isTautology(Formula formula) {
        Encoding encoding = new Encoding();
        int root = encoding.literal(formula);
        encoding.clauses.add(new int[]{-root});

        ISolver solver = SolverFactory.newDefault();
        solver.setTimeout(timeoutSeconds);
        solver.newVar(encoding.variables);
        solver.setExpectedNumberOfClauses(encoding.clauses.size());
        try {
            for (int[] clause : encoding.clauses) {
                solver.addClause(new VecInt(clause));
            }
            boolean counterexample = solver.isSatisfiable();
            log.debug("{} atoms, {} clauses: {}", encoding.atoms, encoding.clauses.size(),
                    counterexample ? "falsifiable" : "tautology");
            return !counterexample;
        } catch (ContradictionException e) {
            // unit propagation alone refuted the negation
            log.debug("Negation of {} refuted while adding clauses", formula);
            return true;
        } catch (TimeoutException e) {
            throw new IllegalStateException("SAT solver gave up after " + timeoutSeconds + "s on " + formula, e);
        }
    }

    /**
     * Clauses defining one solver variable per atom and per disjunction. Negation maps to a
     * negated literal. Equality, relation and quantified formulas are atoms.
     */
    private static final class Encoding {

        private final Map<Formula, Integer> variablesByFormula = new HashMap<>();
        private final List<int[]> clauses = new ArrayList<>();
        private int variables;
        private int atoms;

        int literal(Formula formula) {
            if (formula instanceof NegationFormula negation) {
                return -literal(negation.operand());
            }
            Integer known = variablesByFormula.get(formula);
            if (known != null) {
                return known;
            }
            if (formula instanceof DisjunctionFormula disjunction) {
                int left = literal(disjunction.left());
                int right = literal(disjunction.right());
                int d = ++variables;
                // d <-> (left || right)
                clauses.add(new int[]{-d, left, right});
                clauses.add(new int[]{d, -left});
                clauses.add(new int[]{d, -right});
                variablesByFormula.put(formula, d);
                return d;
            }
            int atom = ++variables;
            atoms++;
            variablesByFormula.put(formula, atom);
            return atom;
        }
    }
}
