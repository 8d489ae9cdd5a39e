package nl.bytesoflife.fol.axiom;

public enum AxiomKind {
    REFLEXIVITY,
    FUNCTION_SUBSTITUTION,
    RELATION_SUBSTITUTION,
    UNIVERSAL_INSTANTIATION,
    EXISTENTIAL_GENERALIZATION
}
