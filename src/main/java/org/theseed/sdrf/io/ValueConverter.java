/**
 *
 */
package org.theseed.sdrf.io;

import org.apache.commons.lang3.StringUtils;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.service.FavouriteOption;
import org.theseed.sdrf.service.FavouriteList;
import org.theseed.sdrf.service.FavouriteSource;
import org.theseed.sdrf.service.FavouriteTier;
import org.theseed.sdrf.service.OntologyLookup;

/**
 * This object converts imported cell values into stored column values.  A value in the favourite display
 * format "[id] display[*]" (or "[**]" or "[***]") is translated back to the favourite's stored value.  If the
 * favourite is unknown, the display text is used with the marker removed.  Afterward, if the column has an
 * ontology type, the ontology lookup may replace the value with a normalized term.
 *
 * @author Bruce Parrello
 *
 */
public class ValueConverter {

    // FIELDS
    /** source of favourite options */
    private final FavouriteSource favourites;
    /** ontology normalizer */
    private final OntologyLookup ontology;

    /**
     * Construct a value converter.
     *
     * @param favourites	source of favourite options
     * @param ontology		ontology normalizer
     */
    public ValueConverter(FavouriteSource favourites, OntologyLookup ontology) {
        this.favourites = favourites;
        this.ontology = ontology;
    }

    /**
     * @return a converter with no favourites and no ontology normalization
     */
    public static ValueConverter plain() {
        return new ValueConverter(new FavouriteList(), OntologyLookup.NONE);
    }

    /**
     * @return the stored value for an imported cell
     *
     * @param column	column receiving the value
     * @param raw		raw cell value
     */
    public String convert(MetadataColumn column, String raw) {
        String retVal = StringUtils.trimToEmpty(raw);
        if (retVal.startsWith("[") && retVal.contains("] ")) {
            String idString = StringUtils.substringBetween(retVal, "[", "] ");
            String display = StringUtils.substringAfter(retVal, "] ");
            FavouriteTier tier = FavouriteTier.fromSuffix(display);
            if (tier != null)
                display = StringUtils.removeEnd(display, tier.getMarker());
            FavouriteOption option = null;
            if (StringUtils.isNumeric(idString) && idString.length() < 18)
                option = this.favourites.getOption(Long.parseLong(idString));
            if (option != null)
                retVal = option.getValue();
            else
                retVal = display.trim();
        }
        String type = column.getOntologyType();
        if (type != null && ! retVal.isEmpty()) {
            String normalized = this.ontology.normalize(type, retVal);
            if (normalized != null)
                retVal = normalized;
        }
        return retVal;
    }

}
