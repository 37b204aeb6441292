/**
 *
 */
package org.theseed.sdrf.pools;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.errors.EmptyPoolException;
import org.theseed.sdrf.errors.NotFoundException;
import org.theseed.sdrf.errors.ValidationFailureException;
import org.theseed.sdrf.matrix.ColumnListener;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.PoolColumn;
import org.theseed.sdrf.matrix.SamplePool;

/**
 * This object keeps the pools of a table consistent with the table's columns.  When attached to a table as
 * its column listener, it adds a derived column to every pool when a column is added, copies a column's new
 * name and properties to the pools when it changes, and removes the derived column when a column is removed.
 * It also reconciles the pools of a table with the pool list of an imported document.
 *
 * @author Bruce Parrello
 *
 */
public class PoolSynchronizer implements ColumnListener {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(PoolSynchronizer.class);
    /** aggregator for computing pool values */
    private final PoolAggregator aggregator;

    /**
     * Construct a pool synchronizer.
     *
     * @param aggregator	aggregator for computing pool values
     */
    public PoolSynchronizer(PoolAggregator aggregator) {
        this.aggregator = aggregator;
    }

    /**
     * Attach this synchronizer to a table so that it is notified of column changes.
     *
     * @param table		table to watch
     */
    public void attach(MetadataTable table) {
        table.setListener(this);
    }

    @Override
    public void onColumnAdded(MetadataTable table, MetadataColumn column) {
        for (SamplePool pool : table.getPools()) {
            String value = this.aggregator.deriveValue(table, column, pool);
            pool.putDerivedValue(column, value);
            pool.followParentOrder(table.getColumns());
        }
        log.debug("Column \"{}\" added to {} pools.", column.getName(), table.getPools().size());
    }

    @Override
    public void onColumnRemoved(MetadataTable table, MetadataColumn column) {
        int count = 0;
        for (SamplePool pool : table.getPools()) {
            if (pool.removeDerivedColumn(column))
                count++;
        }
        log.debug("Column \"{}\" removed from {} pools.", column.getName(), count);
    }

    @Override
    public void onColumnChanged(MetadataTable table, MetadataColumn column) {
        for (SamplePool pool : table.getPools()) {
            PoolColumn derived = pool.getDerivedColumn(column);
            if (derived == null)
                pool.putDerivedValue(column, this.aggregator.deriveValue(table, column, pool));
            else
                derived.copyParent(column);
            pool.followParentOrder(table.getColumns());
        }
        log.debug("Column \"{}\" updated in {} pools.", column.getName(), table.getPools().size());
    }

    /**
     * Reconcile the pools of a table with the pools found in an imported document.  Each specification is
     * matched to an existing pool by ID and then by name.  Matched pools are updated in place, unmatched
     * specifications produce new pools, and existing pools not matched by any specification are deleted.
     * Every pool touched is refreshed, after which the explicit values of its specification are applied.
     *
     * @param table		table whose pools are to be synchronized
     * @param specs		pool specifications from the import
     *
     * @return counts of the pools created, updated and deleted
     *
     * @throws EmptyPoolException if a specification has no members
     * @throws ValidationFailureException if a specification's members overlap or are out of range
     */
    public SyncResult syncPoolsWithImport(MetadataTable table, List<PoolSpec> specs)
            throws EmptyPoolException, ValidationFailureException {
        SyncResult retVal = new SyncResult();
        List<SamplePool> existing = new ArrayList<SamplePool>(table.getPools());
        Set<Long> matched = new HashSet<Long>();
        for (PoolSpec spec : specs) {
            SamplePool pool = this.findMatch(existing, spec, matched);
            if (pool != null) {
                pool.setMembers(spec.getPooledOnly(), spec.getPooledAndIndependent());
                pool.checkRange(table.getSampleCount());
                pool.setReference(spec.isReference());
                pool.setName(spec.getName());
                retVal.countUpdated();
            } else {
                pool = table.addPool(spec.getName(), spec.getPooledOnly(), spec.getPooledAndIndependent(),
                        spec.isReference());
                retVal.countCreated();
            }
            matched.add(pool.getId());
            this.aggregator.refreshPool(table, pool);
            this.applyExplicitValues(table, pool, spec);
        }
        // Delete the pools that were not in the import.
        for (SamplePool pool : existing) {
            if (! matched.contains(pool.getId())) {
                try {
                    table.removePool(pool.getId());
                } catch (NotFoundException e) {
                    // The pool list was copied from the table, so the pool must be there.
                    throw new IllegalStateException("Pool " + pool.getId() + " vanished during synchronization.", e);
                }
                log.info("Pool \"{}\" deleted because it was not in the import.", pool.getName());
                retVal.countDeleted();
            }
        }
        log.info("Pool synchronization for table \"{}\": {}.", table.getName(), retVal);
        return retVal;
    }

    /**
     * @return the existing pool matching a specification, or NULL if there is none
     *
     * @param existing	list of pools in the table before synchronization
     * @param spec		specification to match
     * @param matched	IDs of pools already matched to other specifications
     */
    private SamplePool findMatch(List<SamplePool> existing, PoolSpec spec, Set<Long> matched) {
        SamplePool retVal = null;
        if (spec.getPoolId() > 0) {
            for (int i = 0; i < existing.size() && retVal == null; i++) {
                SamplePool pool = existing.get(i);
                if (pool.getId() == spec.getPoolId() && ! matched.contains(pool.getId()))
                    retVal = pool;
            }
        }
        for (int i = 0; i < existing.size() && retVal == null; i++) {
            SamplePool pool = existing.get(i);
            if (pool.getName().equals(spec.getName()) && ! matched.contains(pool.getId()))
                retVal = pool;
        }
        return retVal;
    }

    /**
     * Store the explicit values of a specification in a pool.
     *
     * @param table		table containing the pool
     * @param pool		pool to update
     * @param spec		specification containing the explicit values
     */
    private void applyExplicitValues(MetadataTable table, SamplePool pool, PoolSpec spec) {
        for (MetadataColumn column : table.getColumns()) {
            String value = spec.getExplicitValue(column.getId());
            if (value != null)
                pool.putDerivedValue(column, value);
        }
        if (spec.getSdrfValue() != null)
            pool.setSdrfValue(spec.getSdrfValue());
    }

    /**
     * @return the aggregator used by this synchronizer
     */
    public PoolAggregator getAggregator() {
        return this.aggregator;
    }

}
