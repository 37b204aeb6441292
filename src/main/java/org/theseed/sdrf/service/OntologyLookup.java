/**
 *
 */
package org.theseed.sdrf.service;

/**
 * This interface normalizes raw cell values against an ontology.  It is read-only.
 *
 * @author Bruce Parrello
 *
 */
public interface OntologyLookup {

    /** lookup that never normalizes anything */
    public static final OntologyLookup NONE = (type, value) -> null;

    /**
     * @return the normalized form of a value, or NULL if the lookup has nothing to offer
     *
     * @param ontologyType	ontology type of the column (never NULL)
     * @param value			raw value to normalize
     */
    public String normalize(String ontologyType, String value);

}
