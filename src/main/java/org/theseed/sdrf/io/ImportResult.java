/**
 *
 */
package org.theseed.sdrf.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.pools.SyncResult;
import org.theseed.sdrf.templates.ColumnOrderer;

/**
 * Summary of a completed import.
 *
 * @author Bruce Parrello
 *
 */
public class ImportResult {

    // FIELDS
    /** number of columns created */
    private int columnsCreated;
    /** IDs of the existing columns updated */
    private Set<Long> columnsUpdated;
    /** number of samples in the table after the import */
    private int sampleCount;
    /** result of pool synchronization, or NULL if no pools were imported */
    private SyncResult poolSync;
    /** ordering strategy applied */
    private ColumnOrderer.Strategy strategy;
    /** non-fatal problems */
    private List<PartialImportWarning> warnings;

    public ImportResult() {
        this.columnsCreated = 0;
        this.columnsUpdated = new HashSet<Long>();
        this.sampleCount = 0;
        this.poolSync = null;
        this.strategy = null;
        this.warnings = new ArrayList<PartialImportWarning>();
    }

    protected void countCreated() {
        this.columnsCreated++;
    }

    protected void countUpdated(MetadataColumn column) {
        this.columnsUpdated.add(column.getId());
    }

    protected void setSampleCount(int sampleCount) {
        this.sampleCount = sampleCount;
    }

    protected void setPoolSync(SyncResult poolSync) {
        this.poolSync = poolSync;
    }

    protected void setStrategy(ColumnOrderer.Strategy strategy) {
        this.strategy = strategy;
    }

    protected void addWarning(int line, String message) {
        this.warnings.add(new PartialImportWarning(line, message));
    }

    /**
     * @return the number of columns created
     */
    public int getColumnsCreated() {
        return this.columnsCreated;
    }

    /**
     * @return the number of existing columns updated
     */
    public int getColumnsUpdated() {
        return this.columnsUpdated.size();
    }

    /**
     * @return the number of samples after the import
     */
    public int getSampleCount() {
        return this.sampleCount;
    }

    /**
     * @return the pool synchronization counts, or NULL if the import contained no pools
     */
    public SyncResult getPoolSync() {
        return this.poolSync;
    }

    /**
     * @return the column ordering strategy used
     */
    public ColumnOrderer.Strategy getStrategy() {
        return this.strategy;
    }

    /**
     * @return the non-fatal problems found
     */
    public List<PartialImportWarning> getWarnings() {
        return Collections.unmodifiableList(this.warnings);
    }

}
