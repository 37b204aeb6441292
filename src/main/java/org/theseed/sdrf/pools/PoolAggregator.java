/**
 *
 */
package org.theseed.sdrf.pools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.theseed.sdrf.matrix.ColumnCategory;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.PoolColumn;
import org.theseed.sdrf.matrix.SamplePool;

/**
 * This object computes the pool-level value of each column.  The pooled-sample column gets the pool's SDRF
 * encoding, the source name column gets the pool name, and every other column gets the most common value
 * among the pool members.
 *
 * @author Bruce Parrello
 *
 */
public class PoolAggregator {

    /** prefix for a reference pool's pooled-sample value */
    public static final String SN_PREFIX = "SN=";
    /** pooled-sample value for a non-reference pool */
    public static final String POOLED_MARKER = "pooled";
    /** normalized name fragment identifying the pooled-sample column */
    public static final String POOLED_SAMPLE_KEY = "pooled sample";

    /**
     * @return TRUE if the specified column is the pooled-sample column
     *
     * @param column	column to check
     */
    public static boolean isPooledSampleColumn(MetadataColumn column) {
        return isPooledSampleName(column.getName());
    }

    /**
     * @return TRUE if the specified column name identifies the pooled-sample column
     *
     * @param name		column name to check
     */
    public static boolean isPooledSampleName(String name) {
        return ColumnCategory.normalize(name).contains(POOLED_SAMPLE_KEY);
    }

    /**
     * @return TRUE if the specified column is the source name column
     *
     * @param column	column to check
     */
    public static boolean isSourceNameColumn(MetadataColumn column) {
        return column.getKey().contains(ColumnCategory.SOURCE_NAME.getLabel());
    }

    /**
     * @return the pool-level value of a column
     *
     * @param table		table containing the pool
     * @param column	column of interest
     * @param pool		pool of interest
     */
    public String deriveValue(MetadataTable table, MetadataColumn column, SamplePool pool) {
        String retVal;
        if (isPooledSampleColumn(column))
            retVal = this.sdrfValue(table, pool);
        else if (isSourceNameColumn(column))
            retVal = pool.getName();
        else {
            // Count the stored values of the members.  The linked map keeps the first-seen order for ties.
            Map<String, Integer> counts = new LinkedHashMap<String, Integer>();
            for (int idx : pool.getAllSamples()) {
                String value = column.rawValue(idx);
                if (value != null)
                    counts.merge(value, 1, Integer::sum);
            }
            retVal = null;
            int best = 0;
            for (Map.Entry<String, Integer> count : counts.entrySet()) {
                if (count.getValue() > best) {
                    best = count.getValue();
                    retVal = count.getKey();
                }
            }
            if (retVal == null)
                retVal = column.getEmptyValue();
        }
        return retVal;
    }

    /**
     * @return the pooled-sample column value for a pool
     *
     * @param table		table containing the pool
     * @param pool		pool of interest
     */
    public String sdrfValue(MetadataTable table, SamplePool pool) {
        String retVal;
        if (pool.isReference()) {
            List<String> names = new ArrayList<String>(pool.getAllSamples().size());
            for (int idx : pool.getAllSamples()) {
                String sourceName = table.getSourceName(idx);
                if (StringUtils.isBlank(sourceName))
                    sourceName = "sample " + idx;
                names.add(sourceName);
            }
            retVal = SN_PREFIX + StringUtils.join(names, ',');
        } else
            retVal = POOLED_MARKER;
        return retVal;
    }

    /**
     * @return the stored pool-level value of a column, falling back to the column default and then to the
     * 		   column's empty-cell value if the pool has no value for the column
     *
     * @param table		table containing the pool
     * @param column	column of interest
     * @param pool		pool of interest
     */
    public String storedValue(MetadataTable table, MetadataColumn column, SamplePool pool) {
        String retVal;
        if (isPooledSampleColumn(column)) {
            retVal = pool.getSdrfValue();
            if (StringUtils.isEmpty(retVal))
                retVal = this.sdrfValue(table, pool);
        } else if (isSourceNameColumn(column))
            retVal = pool.getName();
        else {
            PoolColumn derived = pool.getDerivedColumn(column);
            retVal = (derived == null ? null : derived.getValue());
            if (StringUtils.isEmpty(retVal))
                retVal = column.getDefaultValue();
            if (StringUtils.isEmpty(retVal))
                retVal = column.getEmptyValue();
        }
        return retVal;
    }

    /**
     * Recompute all the derived columns of a pool.  Derived columns whose parents no longer exist are
     * removed, and the rest are sorted to follow the parent order.
     *
     * @param table		table containing the pool
     * @param pool		pool to refresh
     */
    public void refreshPool(MetadataTable table, SamplePool pool) {
        List<MetadataColumn> parents = table.getColumns();
        List<PoolColumn> derived = new ArrayList<PoolColumn>(parents.size());
        for (MetadataColumn parent : parents) {
            PoolColumn column = pool.putDerivedValue(parent, this.deriveValue(table, parent, pool));
            derived.add(column);
        }
        pool.setDerivedColumns(derived);
        pool.setSdrfValue(this.sdrfValue(table, pool));
    }

    /**
     * Recompute the derived columns of every pool in a table.
     *
     * @param table		table whose pools are to be refreshed
     */
    public void refreshAll(MetadataTable table) {
        for (SamplePool pool : table.getPools())
            this.refreshPool(table, pool);
    }

}
