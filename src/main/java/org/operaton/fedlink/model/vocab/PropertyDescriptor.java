package org.operaton.fedlink.model.vocab;

/**
 * Static description of one property of an object type.
 * Every property is classified once as either scalar-only or resolvable.
 */
public abstract class PropertyDescriptor {

    private final String compactName;
    private final String iri;
    private final boolean functional;

    protected PropertyDescriptor(String compactName, String iri, boolean functional) {
        this.compactName = compactName;
        this.iri = iri;
        this.functional = functional;
    }

    /**
     * @return the property name used in compacted documents
     */
    public String getCompactName() {
        return compactName;
    }

    /**
     * @return the full property IRI used in expanded documents
     */
    public String getIri() {
        return iri;
    }

    /**
     * @return true if the property holds at most one value
     */
    public boolean isFunctional() {
        return functional;
    }

    public abstract boolean isResolvable();

    @Override
    public String toString() {
        return compactName;
    }
}
