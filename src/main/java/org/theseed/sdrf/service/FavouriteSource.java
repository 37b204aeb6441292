/**
 *
 */
package org.theseed.sdrf.service;

import java.util.List;

/**
 * This interface supplies the favourite options for columns.  It is read-only.
 *
 * @author Bruce Parrello
 *
 */
public interface FavouriteSource {

    /**
     * @return the options for a column in a tier, in display order
     *
     * @param columnName	name of the column (matched case-insensitively)
     * @param tier			tier of interest
     */
    public List<FavouriteOption> getOptions(String columnName, FavouriteTier tier);

    /**
     * @return the option with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired option
     */
    public FavouriteOption getOption(long id);

}
