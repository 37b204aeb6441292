/**
 *
 */
package org.theseed.sdrf.service;

/**
 * A favourite option is a saved value for a column.  It has a short display form for dropdown lists and
 * the full value that is stored in the column.
 *
 * @author Bruce Parrello
 *
 */
public class FavouriteOption {

    // FIELDS
    /** option ID */
    private final long id;
    /** tier of the option */
    private final FavouriteTier tier;
    /** column name the option belongs to */
    private final String columnName;
    /** display form */
    private final String display;
    /** stored value */
    private final String value;

    /**
     * Construct a favourite option.
     *
     * @param id			option ID
     * @param tier			option tier
     * @param columnName	name of the column the option belongs to
     * @param display		display form
     * @param value			stored value
     */
    public FavouriteOption(long id, FavouriteTier tier, String columnName, String display, String value) {
        this.id = id;
        this.tier = tier;
        this.columnName = columnName;
        this.display = display;
        this.value = value;
    }

    /**
     * @return the dropdown form of this option, "[id] display[marker]"
     */
    public String toChoice() {
        return "[" + this.id + "] " + this.display + this.tier.getMarker();
    }

    /**
     * @return the option ID
     */
    public long getId() {
        return this.id;
    }

    /**
     * @return the option tier
     */
    public FavouriteTier getTier() {
        return this.tier;
    }

    /**
     * @return the name of the column the option belongs to
     */
    public String getColumnName() {
        return this.columnName;
    }

    /**
     * @return the display form
     */
    public String getDisplay() {
        return this.display;
    }

    /**
     * @return the stored value
     */
    public String getValue() {
        return this.value;
    }

    @Override
    public String toString() {
        return this.toChoice();
    }

}
