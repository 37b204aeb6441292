/**
 *
 */
package org.theseed.sdrf.service;

/**
 * The tiers of favourite options.  Each tier has a marker that is appended to the display form of its options.
 *
 * @author Bruce Parrello
 *
 */
public enum FavouriteTier {
    USER("[*]"),
    LAB_GROUP("[**]"),
    GLOBAL("[***]");

    /** display marker */
    private final String marker;

    private FavouriteTier(String marker) {
        this.marker = marker;
    }

    /**
     * @return the display marker for this tier
     */
    public String getMarker() {
        return this.marker;
    }

    /**
     * @return the tier whose marker ends the specified string, or NULL if there is none
     *
     * @param display	display string to check
     */
    public static FavouriteTier fromSuffix(String display) {
        FavouriteTier retVal = null;
        if (display.endsWith(GLOBAL.marker))
            retVal = GLOBAL;
        else if (display.endsWith(LAB_GROUP.marker))
            retVal = LAB_GROUP;
        else if (display.endsWith(USER.marker))
            retVal = USER;
        return retVal;
    }

}
