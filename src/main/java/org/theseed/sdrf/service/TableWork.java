/**
 *
 */
package org.theseed.sdrf.service;

import java.io.IOException;

import org.theseed.sdrf.errors.SdrfException;
import org.theseed.sdrf.matrix.MetadataTable;

/**
 * This interface describes a unit of work performed on a table inside a transaction.
 *
 * @param <T>	type of the work's result
 *
 * @author Bruce Parrello
 *
 */
@FunctionalInterface
public interface TableWork<T> {

    /**
     * @return the result of the work
     *
     * @param table		working copy of the table
     *
     * @throws SdrfException if the work fails
     * @throws IOException if an input or output error occurs
     */
    public T apply(MetadataTable table) throws SdrfException, IOException;

}
