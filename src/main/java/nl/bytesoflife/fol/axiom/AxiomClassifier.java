package nl.bytesoflife.fol.axiom;

import nl.bytesoflife.fol.formula.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Tells which of the registered axiom schemas a formula is an instance of.
 */
public class AxiomClassifier {

    private static final Logger log = LoggerFactory.getLogger(AxiomClassifier.class);

    private final Map<AxiomKind, AxiomSchema> schemas = new EnumMap<>(AxiomKind.class);

    public static AxiomClassifier withDefaultSchemas() {
        return new AxiomClassifier()
                .registerSchema(new ReflexivityAxiom())
                .registerSchema(new FunctionSubstitutionAxiom())
                .registerSchema(new RelationSubstitutionAxiom())
                .registerSchema(new UniversalInstantiationAxiom())
                .registerSchema(new ExistentialGeneralizationAxiom());
    }

    public AxiomClassifier registerSchema(AxiomSchema schema) {
        schemas.put(schema.getKind(), schema);
        return this;
    }

    public Set<AxiomKind> classify(Formula formula) {
        Set<AxiomKind> kinds = EnumSet.noneOf(AxiomKind.class);
        for (AxiomSchema schema : schemas.values()) {
            if (schema.matches(formula)) {
                kinds.add(schema.getKind());
            }
        }
        log.debug("{} is an instance of {}", formula, kinds);
        return kinds;
    }

    public boolean isLogicalAxiom(Formula formula) {
        for (AxiomSchema schema : schemas.values()) {
            if (schema.matches(formula)) {
                return true;
            }
        }
        return false;
    }
}
