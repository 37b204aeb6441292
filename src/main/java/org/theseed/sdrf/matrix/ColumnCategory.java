/**
 *
 */
package org.theseed.sdrf.matrix;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/**
 * This enum describes the categories of SDRF columns.  The category is determined by the column name:  a
 * name of the form "type[inner]" takes its category from the type prefix, and the literal names "source name"
 * and "technology type" have categories of their own.  Everything else is special.
 *
 * The enum order is the section order used when columns are sorted into the basic SDRF layout.
 *
 * @author Bruce Parrello
 *
 */
public enum ColumnCategory {
    SOURCE_NAME("source name"),
    CHARACTERISTICS("characteristics"),
    SPECIAL("special"),
    TECHNOLOGY_TYPE("technology type"),
    COMMENT("comment"),
    FACTOR_VALUE("factor value");

    /** SDRF label for this category */
    private final String label;

    private ColumnCategory(String label) {
        this.label = label;
    }

    /**
     * @return the SDRF label (type prefix) for this category
     */
    public String getLabel() {
        return this.label;
    }

    /**
     * @return the category of a column with the specified name
     *
     * @param name		column name to parse
     */
    public static ColumnCategory fromName(String name) {
        String key = normalize(name);
        ColumnCategory retVal = SPECIAL;
        int bracket = key.indexOf('[');
        if (bracket > 0 && key.endsWith("]")) {
            String prefix = key.substring(0, bracket).trim();
            switch (prefix) {
            case "characteristics" :
                retVal = CHARACTERISTICS;
                break;
            case "comment" :
                retVal = COMMENT;
                break;
            case "factor value" :
                retVal = FACTOR_VALUE;
                break;
            default :
                retVal = SPECIAL;
            }
        } else if (key.equals(SOURCE_NAME.label))
            retVal = SOURCE_NAME;
        else if (key.equals(TECHNOLOGY_TYPE.label))
            retVal = TECHNOLOGY_TYPE;
        return retVal;
    }

    /**
     * @return the category with the specified SDRF label, or SPECIAL if the label is not recognized
     *
     * @param label		label to parse (as written in a column map sheet)
     */
    public static ColumnCategory fromLabel(String label) {
        String key = normalize(label);
        ColumnCategory retVal = SPECIAL;
        for (ColumnCategory category : ColumnCategory.values()) {
            if (category.label.equals(key) || normalize(category.name()).equals(key))
                retVal = category;
        }
        return retVal;
    }

    /**
     * Normalize a column name for matching.  Matching is case-insensitive, ignores surrounding white space,
     * and treats underscores as spaces.
     *
     * @param name		column name to normalize
     *
     * @return the matching key for the name
     */
    public static String normalize(String name) {
        String retVal = StringUtils.trimToEmpty(name).toLowerCase(Locale.ROOT);
        return retVal.replace('_', ' ');
    }

    /**
     * @return the inner name of a "type[inner]" column name, or the whole normalized name if there is no type prefix
     *
     * @param name		column name to parse
     */
    public static String innerName(String name) {
        String key = normalize(name);
        String retVal = StringUtils.substringBetween(key, "[", "]");
        if (retVal == null)
            retVal = key;
        return retVal.trim();
    }

}
