package nl.bytesoflife.fol.rule;

import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.formula.Formulas;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * The conclusion follows when every truth assignment satisfying all premises also
 * satisfies it, i.e. when "( ( P1 && ... && Pn ) -> theta )" is a tautology.
 */
public class PropositionalConsequenceRule implements InferenceRule {

    private final TautologyOracle oracle;

    public PropositionalConsequenceRule() {
        this(new SatTautologyOracle());
    }

    public PropositionalConsequenceRule(TautologyOracle oracle) {
        this.oracle = oracle;
    }

    @Override
    public boolean isInstance(Set<Formula> premises, Formula conclusion) {
        InferenceRule.requireSameLanguage(premises, conclusion);
        if (premises.isEmpty()) {
            return oracle.isTautology(conclusion);
        }
        // fixed order keeps the built formula deterministic
        List<Formula> ordered = premises.stream()
                .sorted(Comparator.comparing(Formula::toString))
                .toList();
        Formula hypothesis = ordered.get(0);
        for (Formula premise : ordered.subList(1, ordered.size())) {
            hypothesis = Formulas.conjunction(hypothesis, premise);
        }
        return oracle.isTautology(Formulas.implication(hypothesis, conclusion));
    }
}
