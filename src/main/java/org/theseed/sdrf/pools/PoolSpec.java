/**
 *
 */
package org.theseed.sdrf.pools;

import java.util.LinkedHashMap;
import java.util.Map;

import org.theseed.sdrf.matrix.RangeSet;

/**
 * A pool specification describes a pool found in an imported document.  It contains the membership
 * information and any pool-level cell values that were stated explicitly in the document.  Explicit
 * values take precedence over the aggregated values when the pool is synchronized.
 *
 * @author Bruce Parrello
 *
 */
public class PoolSpec {

    // FIELDS
    /** ID of the pool in the source document, or 0 if unknown */
    private long poolId;
    /** pool name */
    private final String name;
    /** samples that exist only in the pool */
    private RangeSet pooledOnly;
    /** samples also reported independently */
    private RangeSet pooledAndIndependent;
    /** TRUE for a reference pool */
    private boolean reference;
    /** explicit pooled-sample value, or NULL */
    private String sdrfValue;
    /** explicit cell values, keyed by parent column ID */
    private Map<Long, String> explicitValues;

    /**
     * Construct a pool specification.
     *
     * @param name					pool name
     * @param pooledOnly			samples that exist only in the pool
     * @param pooledAndIndependent	samples also reported independently
     * @param reference				TRUE for a reference pool
     */
    public PoolSpec(String name, RangeSet pooledOnly, RangeSet pooledAndIndependent, boolean reference) {
        this.poolId = 0;
        this.name = name;
        this.pooledOnly = pooledOnly;
        this.pooledAndIndependent = pooledAndIndependent;
        this.reference = reference;
        this.sdrfValue = null;
        this.explicitValues = new LinkedHashMap<Long, String>();
    }

    /**
     * Specify an explicit value for a column.
     *
     * @param columnId	ID of the parent column
     * @param value		value for the pool
     */
    public void putExplicitValue(long columnId, String value) {
        this.explicitValues.put(columnId, value);
    }

    /**
     * @return the explicit value for a column, or NULL if there is none
     *
     * @param columnId	ID of the parent column
     */
    public String getExplicitValue(long columnId) {
        return this.explicitValues.get(columnId);
    }

    /**
     * @return the source pool ID, or 0 if unknown
     */
    public long getPoolId() {
        return this.poolId;
    }

    /**
     * @param poolId 	the source pool ID
     */
    public void setPoolId(long poolId) {
        this.poolId = poolId;
    }

    /**
     * @return the pool name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the pooled-only samples
     */
    public RangeSet getPooledOnly() {
        return this.pooledOnly;
    }

    /**
     * @return the pooled-and-independent samples
     */
    public RangeSet getPooledAndIndependent() {
        return this.pooledAndIndependent;
    }

    /**
     * @return TRUE if this is a reference pool
     */
    public boolean isReference() {
        return this.reference;
    }

    /**
     * @return the explicit pooled-sample value, or NULL
     */
    public String getSdrfValue() {
        return this.sdrfValue;
    }

    /**
     * @param sdrfValue 	the explicit pooled-sample value
     */
    public void setSdrfValue(String sdrfValue) {
        this.sdrfValue = sdrfValue;
    }

    @Override
    public String toString() {
        return this.name + " [" + this.pooledOnly.encode() + "|" + this.pooledAndIndependent.encode() + "]";
    }

}
