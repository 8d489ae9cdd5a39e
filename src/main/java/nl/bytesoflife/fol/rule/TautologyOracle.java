package nl.bytesoflife.fol.rule;

import nl.bytesoflife.fol.formula.Formula;

/**
 * Decides propositional validity. Equality, relation and quantified formulas are
 * propositional atoms; only negation and disjunction are interpreted.
 */
public interface TautologyOracle {

    boolean isTautology(Formula formula);
}
