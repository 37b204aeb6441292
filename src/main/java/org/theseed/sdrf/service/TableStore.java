/**
 *
 */
package org.theseed.sdrf.service;

import java.io.IOException;
import java.util.List;

import org.theseed.sdrf.errors.NotFoundException;
import org.theseed.sdrf.errors.SdrfException;
import org.theseed.sdrf.matrix.MetadataTable;

/**
 * This interface describes the storage used by the table service.  Changes are made only inside a transaction:
 * either all the changes made by the work are kept or none of them are.
 *
 * @author Bruce Parrello
 *
 */
public interface TableStore {

    /**
     * @return a new, empty table with a fresh ID
     *
     * @param name			name of the table
     * @param sampleCount	initial number of samples
     * @param owner			owner of the table
     */
    public MetadataTable create(String name, int sampleCount, String owner);

    /**
     * @return a copy of the table with the specified ID
     *
     * @param tableId	ID of the desired table
     *
     * @throws NotFoundException if there is no such table
     */
    public MetadataTable load(long tableId) throws NotFoundException;

    /**
     * Store a table, replacing any previous version with the same ID.
     *
     * @param table		table to store
     */
    public void save(MetadataTable table);

    /**
     * Delete a table.
     *
     * @param tableId	ID of the table to delete
     *
     * @throws NotFoundException if there is no such table
     */
    public void delete(long tableId) throws NotFoundException;

    /**
     * @return copies of all the stored tables, in ID order
     */
    public List<MetadataTable> list();

    /**
     * Perform work on a table inside a transaction.  If the work fails, the stored table is unchanged.
     *
     * @param tableId	ID of the table to update
     * @param work		work to perform
     *
     * @return the result of the work
     *
     * @throws NotFoundException if there is no such table
     * @throws SdrfException if the work fails
     * @throws IOException if an input or output error occurs
     */
    public <T> T inTransaction(long tableId, TableWork<T> work) throws SdrfException, IOException;

}
