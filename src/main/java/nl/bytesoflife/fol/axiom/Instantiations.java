package nl.bytesoflife.fol.axiom;

import nl.bytesoflife.fol.formula.Formula;
import nl.bytesoflife.fol.substitution.SubstitutionMatch;
import nl.bytesoflife.fol.substitution.Substitutions;

final class Instantiations {

    private Instantiations() {
    }

    /**
     * Whether {@code instance} is {@code p} with some term substitutable for {@code x}
     * put in place of x.
     */
    static boolean isInstance(Formula p, Formula instance, String x) {
        SubstitutionMatch match = Substitutions.findSubstitutedTerm(p, instance, x);
        if (match instanceof SubstitutionMatch.Witness witness) {
            return Substitutions.isSubstitutable(p, x, witness.term());
        }
        return match.isSatisfiable();
    }
}
