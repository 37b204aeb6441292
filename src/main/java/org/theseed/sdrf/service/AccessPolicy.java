/**
 *
 */
package org.theseed.sdrf.service;

import org.theseed.sdrf.matrix.MetadataTable;

/**
 * This interface decides who may read and change a table.
 *
 * @author Bruce Parrello
 *
 */
public interface AccessPolicy {

    /**
     * @return TRUE if the actor may read the table
     *
     * @param actor		name of the user making the request
     * @param table		table of interest
     */
    public boolean canView(String actor, MetadataTable table);

    /**
     * @return TRUE if the actor may change the table
     *
     * @param actor		name of the user making the request
     * @param table		table of interest
     */
    public boolean canEdit(String actor, MetadataTable table);

}
