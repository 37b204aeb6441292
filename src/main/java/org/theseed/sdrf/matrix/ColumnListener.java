/**
 *
 */
package org.theseed.sdrf.matrix;

/**
 * This interface is notified when columns are added to, changed in, or removed from a metadata table.  It is used to
 * keep the pool-level copies of the columns in step with the table.
 *
 * @author Bruce Parrello
 *
 */
public interface ColumnListener {

    /**
     * Process a column that has just been added to a table.
     *
     * @param table		table containing the new column
     * @param column	column added
     */
    public void onColumnAdded(MetadataTable table, MetadataColumn column);

    /**
     * Process a column that has just been removed from a table.
     *
     * @param table		table that contained the column
     * @param column	column removed
     */
    public void onColumnRemoved(MetadataTable table, MetadataColumn column);

    /**
     * Process a column whose name or properties have just been changed.
     *
     * @param table		table containing the column
     * @param column	column changed
     */
    public void onColumnChanged(MetadataTable table, MetadataColumn column);

}
