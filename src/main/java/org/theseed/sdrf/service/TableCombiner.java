/**
 *
 */
package org.theseed.sdrf.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.errors.EmptyPoolException;
import org.theseed.sdrf.errors.ValidationFailureException;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.SamplePool;
import org.theseed.sdrf.matrix.ValueCompactor;
import org.theseed.sdrf.pools.PoolAggregator;
import org.theseed.sdrf.templates.ColumnOrderer;

/**
 * This object combines several tables into one.  A column-wise combination places the columns of the source
 * tables side by side, with one sample per row up to the largest source sample count.  A row-wise combination
 * stacks the samples of the source tables, so that sample I of the second table becomes sample N1 + I of the
 * result.  In both cases the pools of each source table are copied with a "T<n>_" prefix on their names when
 * there is more than one source.
 *
 * @author Bruce Parrello
 *
 */
public class TableCombiner {

    /**
     * Column selection for row-wise combination.
     */
    public static enum MergeStrategy {
        /** keep every column found in any source table */
        UNION,
        /** keep only the columns found in all source tables */
        INTERSECTION;
    }

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TableCombiner.class);
    /** aggregator for pool values */
    private final PoolAggregator aggregator;
    /** column orderer for the result */
    private final ColumnOrderer orderer;

    /**
     * Construct a table combiner.
     *
     * @param aggregator	aggregator for pool values
     * @param orderer		column orderer for the result
     */
    public TableCombiner(PoolAggregator aggregator, ColumnOrderer orderer) {
        this.aggregator = aggregator;
        this.orderer = orderer;
    }

    /**
     * Combine tables side by side.  Every source column is copied in order, values and all.  Repeated column
     * names are kept as repeated columns.
     *
     * @param sources		tables to combine
     * @param target		empty table to receive the result
     * @param reorder		TRUE to apply schema ordering to the result, else the source order is kept
     *
     * @throws ValidationFailureException if there are no source tables or a pool cannot be copied
     */
    public void combineColumnwise(List<MetadataTable> sources, MetadataTable target, boolean reorder)
            throws ValidationFailureException {
        checkSources(sources);
        int sampleCount = 0;
        for (MetadataTable source : sources)
            sampleCount = Math.max(sampleCount, source.getSampleCount());
        target.setSampleCount(sampleCount);
        for (MetadataTable source : sources) {
            for (MetadataColumn sourceCol : source.getColumns()) {
                target.addColumn(sourceCol.getName(), -1, x -> {
                    x.copyValues(sourceCol);
                    x.copyProperties(sourceCol);
                });
            }
        }
        this.copyPools(sources, target, false);
        this.finish(target, reorder);
        log.info("{} tables combined column-wise into \"{}\" with {} columns and {} samples.", sources.size(),
                target.getName(), target.getColumnCount(), sampleCount);
    }

    /**
     * Combine tables by stacking their samples.  Columns are matched by name (the first column of each name in
     * each source).  A sample from a table without the column gets "not available" for it.
     *
     * @param sources		tables to combine
     * @param target		empty table to receive the result
     * @param strategy		column selection strategy
     * @param reorder		TRUE to apply schema ordering to the result, else the order of first appearance is kept
     *
     * @throws ValidationFailureException if there are no source tables, no columns are selected, or a pool
     * 									  cannot be copied
     */
    public void combineRowwise(List<MetadataTable> sources, MetadataTable target, MergeStrategy strategy,
            boolean reorder) throws ValidationFailureException {
        checkSources(sources);
        // Find the first column of each name in each source.  The linked map keeps the order of first appearance.
        Map<String, List<MetadataColumn>> columnMap = new LinkedHashMap<String, List<MetadataColumn>>();
        for (int t = 0; t < sources.size(); t++) {
            for (MetadataColumn column : sources.get(t).getColumns()) {
                List<MetadataColumn> found = columnMap.computeIfAbsent(column.getKey(), k -> newSlots(sources.size()));
                if (found.get(t) == null)
                    found.set(t, column);
            }
        }
        if (strategy == MergeStrategy.INTERSECTION)
            columnMap.values().removeIf(x -> x.contains(null));
        if (columnMap.isEmpty())
            throw new ValidationFailureException("No columns selected by " + strategy + " merge.");
        int sampleCount = 0;
        for (MetadataTable source : sources)
            sampleCount += source.getSampleCount();
        target.setSampleCount(sampleCount);
        for (List<MetadataColumn> found : columnMap.values()) {
            MetadataColumn model = found.stream().filter(x -> x != null).findFirst().get();
            MetadataColumn column = target.addColumn(model.getName(), -1, x -> x.copyProperties(model));
            // Build the combined value map.
            Map<Integer, String> valueMap = new HashMap<Integer, String>();
            boolean notApplicable = false;
            int offset = 0;
            for (int t = 0; t < sources.size(); t++) {
                MetadataColumn sourceCol = found.get(t);
                int n = sources.get(t).getSampleCount();
                if (sourceCol != null)
                    notApplicable = notApplicable || sourceCol.isNotApplicable();
                for (int i = 1; i <= n; i++) {
                    String value = (sourceCol == null ? MetadataColumn.NOT_AVAILABLE : sourceCol.resolve(i));
                    valueMap.put(offset + i, value);
                }
                offset += n;
            }
            column.applyCompaction(ValueCompactor.compact(valueMap));
            column.setNotApplicable(notApplicable);
        }
        this.copyPools(sources, target, true);
        this.finish(target, reorder);
        log.info("{} tables combined row-wise ({}) into \"{}\" with {} columns and {} samples.", sources.size(),
                strategy, target.getName(), target.getColumnCount(), sampleCount);
    }

    /**
     * @return a list of empty column slots, one per source table
     *
     * @param n		number of source tables
     */
    private static List<MetadataColumn> newSlots(int n) {
        List<MetadataColumn> retVal = new ArrayList<MetadataColumn>(n);
        for (int i = 0; i < n; i++)
            retVal.add(null);
        return retVal;
    }

    /**
     * Verify that there is at least one source table.
     *
     * @param sources	list of source tables
     *
     * @throws ValidationFailureException if the list is empty
     */
    private static void checkSources(List<MetadataTable> sources) throws ValidationFailureException {
        if (sources.isEmpty())
            throw new ValidationFailureException("At least one source table is required.");
    }

    /**
     * Copy the pools of the source tables into the target table.
     *
     * @param sources	source tables
     * @param target	target table
     * @param stacked	TRUE if the sample indices of each source are offset by the samples of the previous ones
     *
     * @throws ValidationFailureException if a pool cannot be copied
     */
    private void copyPools(List<MetadataTable> sources, MetadataTable target, boolean stacked)
            throws ValidationFailureException {
        int offset = 0;
        for (int t = 0; t < sources.size(); t++) {
            MetadataTable source = sources.get(t);
            String prefix = (sources.size() > 1 ? "T" + (t + 1) + "_" : "");
            for (SamplePool pool : source.getPools()) {
                String name = prefix + pool.getName();
                String baseName = name;
                for (int counter = 1; target.findPool(name) != null; counter++)
                    name = baseName + "_" + counter;
                try {
                    SamplePool copy = target.addPool(name, pool.getPooledOnly().shift(offset),
                            pool.getPooledAndIndependent().shift(offset), pool.isReference());
                    copy.setDescription(pool.getDescription());
                } catch (EmptyPoolException e) {
                    throw new ValidationFailureException("Pool \"" + pool.getName() + "\" in table \""
                            + source.getName() + "\" has no members.", e);
                }
            }
            if (stacked)
                offset += source.getSampleCount();
        }
    }

    /**
     * Order the columns of a combined table and compute its pool values.
     *
     * @param target	combined table
     * @param reorder	TRUE to apply schema ordering
     */
    private void finish(MetadataTable target, boolean reorder) {
        if (reorder)
            this.orderer.reorder(target, ColumnOrderer.Strategy.AUTO);
        else
            target.normalizePositions();
        this.aggregator.refreshAll(target);
    }

}
