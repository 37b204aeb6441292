/**
 *
 */
package org.theseed.sdrf.service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.errors.NotFoundException;
import org.theseed.sdrf.errors.SdrfException;
import org.theseed.sdrf.matrix.MetadataTable;

/**
 * This is an in-memory table store.  A transaction works on a deep copy of the table, and the copy replaces
 * the stored table only if the work completes normally.
 *
 * @author Bruce Parrello
 *
 */
public class MemoryTableStore implements TableStore {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(MemoryTableStore.class);
    /** map of table IDs to tables */
    private final SortedMap<Long, MetadataTable> tables;
    /** next table ID to assign */
    private long nextId;

    /**
     * Create an empty table store.
     */
    public MemoryTableStore() {
        this.tables = new TreeMap<Long, MetadataTable>();
        this.nextId = 1;
    }

    @Override
    public synchronized MetadataTable create(String name, int sampleCount, String owner) {
        MetadataTable retVal = new MetadataTable(this.nextId, name, sampleCount);
        this.nextId++;
        retVal.setOwner(owner);
        this.tables.put(retVal.getId(), retVal.copy());
        log.debug("Created table {} \"{}\".", retVal.getId(), name);
        return retVal;
    }

    @Override
    public synchronized MetadataTable load(long tableId) throws NotFoundException {
        return this.find(tableId).copy();
    }

    @Override
    public synchronized void save(MetadataTable table) {
        this.tables.put(table.getId(), table.copy());
        if (table.getId() >= this.nextId)
            this.nextId = table.getId() + 1;
    }

    @Override
    public synchronized void delete(long tableId) throws NotFoundException {
        this.find(tableId);
        this.tables.remove(tableId);
        log.debug("Deleted table {}.", tableId);
    }

    @Override
    public synchronized List<MetadataTable> list() {
        List<MetadataTable> retVal = new ArrayList<MetadataTable>(this.tables.size());
        for (MetadataTable table : this.tables.values())
            retVal.add(table.copy());
        return retVal;
    }

    @Override
    public synchronized <T> T inTransaction(long tableId, TableWork<T> work) throws SdrfException, IOException {
        MetadataTable working = this.find(tableId).copy();
        T retVal = work.apply(working);
        this.tables.put(tableId, working);
        return retVal;
    }

    /**
     * @return the stored table with the specified ID
     *
     * @param tableId	ID of the desired table
     *
     * @throws NotFoundException if there is no such table
     */
    private MetadataTable find(long tableId) throws NotFoundException {
        MetadataTable retVal = this.tables.get(tableId);
        if (retVal == null)
            throw new NotFoundException("Table " + tableId + " not found.");
        return retVal;
    }

    /**
     * @return the number of tables stored
     */
    public synchronized int size() {
        return this.tables.size();
    }

}
