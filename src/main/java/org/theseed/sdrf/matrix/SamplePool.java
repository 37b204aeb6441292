/**
 *
 */
package org.theseed.sdrf.matrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import org.theseed.sdrf.errors.EmptyPoolException;
import org.theseed.sdrf.errors.ValidationFailureException;

/**
 * A sample pool is a named group of samples that is reported as a single aggregate entry.  Each member is
 * either pooled-only (it exists only as part of the pool) or pooled-and-independent (it is also reported
 * on its own).  The two member sets are disjoint and at least one must be non-empty.
 *
 * The pool carries one derived value per parent column.  These values are computed by the pool aggregator
 * and stored as a flat snapshot.
 *
 * @author Bruce Parrello
 *
 */
public class SamplePool {

    // FIELDS
    /** ID of this pool within its table */
    private final long id;
    /** name of the pool */
    private String name;
    /** description of the pool, or NULL */
    private String description;
    /** samples that exist only as part of the pool */
    private RangeSet pooledOnly;
    /** samples reported both independently and within the pool */
    private RangeSet pooledAndIndependent;
    /** TRUE if this pool was declared by an SN= row */
    private boolean reference;
    /** pool-level value for the pooled-sample column */
    private String sdrfValue;
    /** derived columns */
    private List<PoolColumn> derivedColumns;

    /**
     * Construct a sample pool.
     *
     * @param id					ID of the pool
     * @param name					name of the pool
     * @param pooledOnly			samples that exist only in the pool
     * @param pooledAndIndependent	samples also reported independently
     * @param reference				TRUE for a reference pool
     *
     * @throws EmptyPoolException if both member sets are empty
     * @throws ValidationFailureException if the member sets overlap
     */
    public SamplePool(long id, String name, RangeSet pooledOnly, RangeSet pooledAndIndependent, boolean reference)
            throws EmptyPoolException, ValidationFailureException {
        this.id = id;
        this.name = name;
        this.description = null;
        this.reference = reference;
        this.sdrfValue = null;
        this.derivedColumns = new ArrayList<PoolColumn>();
        this.setMembers(pooledOnly, pooledAndIndependent);
    }

    /**
     * Construct a copy of a pool.
     *
     * @param other		pool to copy
     */
    public SamplePool(SamplePool other) {
        this.id = other.id;
        this.name = other.name;
        this.description = other.description;
        this.pooledOnly = other.pooledOnly;
        this.pooledAndIndependent = other.pooledAndIndependent;
        this.reference = other.reference;
        this.sdrfValue = other.sdrfValue;
        this.derivedColumns = new ArrayList<PoolColumn>(other.derivedColumns.size());
        for (PoolColumn column : other.derivedColumns)
            this.derivedColumns.add(new PoolColumn(column));
    }

    /**
     * Replace the member sets of this pool.
     *
     * @param pooledOnly			samples that exist only in the pool
     * @param pooledAndIndependent	samples also reported independently
     *
     * @throws EmptyPoolException if both member sets are empty
     * @throws ValidationFailureException if the member sets overlap
     */
    public void setMembers(RangeSet pooledOnly, RangeSet pooledAndIndependent)
            throws EmptyPoolException, ValidationFailureException {
        if (pooledOnly.isEmpty() && pooledAndIndependent.isEmpty())
            throw new EmptyPoolException("Pool \"" + this.name + "\" has no samples.");
        if (pooledOnly.intersects(pooledAndIndependent))
            throw new ValidationFailureException("Pool \"" + this.name + "\" lists samples as both pooled-only and independent.");
        this.pooledOnly = pooledOnly;
        this.pooledAndIndependent = pooledAndIndependent;
    }

    /**
     * Verify that all the members of this pool are valid sample indices.
     *
     * @param sampleCount	number of samples in the owning table
     *
     * @throws ValidationFailureException if a member is outside the table's sample range
     */
    public void checkRange(int sampleCount) throws ValidationFailureException {
        RangeSet all = this.getAllSamples();
        if (! all.isEmpty() && all.last() > sampleCount)
            throw new ValidationFailureException("Pool \"" + this.name + "\" references sample " + all.last()
                    + " but the table has only " + sampleCount + " samples.");
    }

    /**
     * @return all the members of this pool
     */
    public RangeSet getAllSamples() {
        return this.pooledOnly.union(this.pooledAndIndependent);
    }

    /**
     * @return the membership status of a sample
     *
     * @param sampleIdx		index of the sample to check
     */
    public SampleStatus getSampleStatus(int sampleIdx) {
        SampleStatus retVal;
        if (this.pooledOnly.contains(sampleIdx))
            retVal = SampleStatus.POOLED_ONLY;
        else if (this.pooledAndIndependent.contains(sampleIdx))
            retVal = SampleStatus.POOLED_AND_INDEPENDENT;
        else
            retVal = SampleStatus.NOT_IN_POOL;
        return retVal;
    }

    /**
     * Add a sample to this pool.  If the sample is already present, its status is changed.
     *
     * @param sampleIdx		index of the sample to add
     * @param status		membership status for the sample
     */
    public void addSample(int sampleIdx, SampleStatus status) {
        RangeSet sample = RangeSet.of(sampleIdx);
        this.pooledOnly = this.pooledOnly.minus(sample);
        this.pooledAndIndependent = this.pooledAndIndependent.minus(sample);
        switch (status) {
        case POOLED_ONLY :
            this.pooledOnly = this.pooledOnly.union(sample);
            break;
        case POOLED_AND_INDEPENDENT :
            this.pooledAndIndependent = this.pooledAndIndependent.union(sample);
            break;
        default :
            break;
        }
    }

    /**
     * Remove a sample from this pool.
     *
     * @param sampleIdx		index of the sample to remove
     *
     * @throws EmptyPoolException if the pool would be left with no samples
     */
    public void removeSample(int sampleIdx) throws EmptyPoolException {
        RangeSet sample = RangeSet.of(sampleIdx);
        RangeSet newOnly = this.pooledOnly.minus(sample);
        RangeSet newBoth = this.pooledAndIndependent.minus(sample);
        if (newOnly.isEmpty() && newBoth.isEmpty())
            throw new EmptyPoolException("Removing sample " + sampleIdx + " would leave pool \"" + this.name + "\" empty.");
        this.pooledOnly = newOnly;
        this.pooledAndIndependent = newBoth;
    }

    /**
     * Move a member from one sample index to another.
     *
     * @param oldIdx	current index of the sample
     * @param newIdx	new index of the sample
     *
     * @return TRUE if the pool changed
     */
    public boolean moveSample(int oldIdx, int newIdx) {
        SampleStatus status = this.getSampleStatus(oldIdx);
        boolean retVal = (status != SampleStatus.NOT_IN_POOL);
        if (retVal) {
            RangeSet oldSample = RangeSet.of(oldIdx);
            this.pooledOnly = this.pooledOnly.minus(oldSample);
            this.pooledAndIndependent = this.pooledAndIndependent.minus(oldSample);
            this.addSample(newIdx, status);
        }
        return retVal;
    }

    /**
     * Remove all members beyond the end of a table.  If this would empty the pool, it is left alone.
     *
     * @param sampleCount	number of samples in the owning table
     *
     * @return TRUE if the pool is still valid, FALSE if it should be deleted
     */
    public boolean truncateSamples(int sampleCount) {
        RangeSet all = this.getAllSamples();
        boolean retVal = true;
        if (! all.isEmpty() && all.last() > sampleCount) {
            RangeSet excess = RangeSet.span(sampleCount + 1, all.last());
            RangeSet newOnly = this.pooledOnly.minus(excess);
            RangeSet newBoth = this.pooledAndIndependent.minus(excess);
            if (newOnly.isEmpty() && newBoth.isEmpty())
                retVal = false;
            else {
                this.pooledOnly = newOnly;
                this.pooledAndIndependent = newBoth;
            }
        }
        return retVal;
    }

    /**
     * @return the derived column for the specified parent column, or NULL if there is none
     *
     * @param parent	parent column of interest
     */
    public PoolColumn getDerivedColumn(MetadataColumn parent) {
        PoolColumn retVal = null;
        for (int i = 0; i < this.derivedColumns.size() && retVal == null; i++) {
            PoolColumn column = this.derivedColumns.get(i);
            if (column.isFor(parent))
                retVal = column;
        }
        return retVal;
    }

    /**
     * Store a derived value for a parent column.  The derived column is created if it does not exist.
     *
     * @param parent	parent column
     * @param value		derived value to store
     *
     * @return the pool column updated
     */
    public PoolColumn putDerivedValue(MetadataColumn parent, String value) {
        PoolColumn retVal = this.getDerivedColumn(parent);
        if (retVal == null) {
            retVal = new PoolColumn(parent, value);
            this.derivedColumns.add(retVal);
        } else {
            retVal.setValue(value);
            retVal.copyParent(parent);
        }
        return retVal;
    }

    /**
     * Remove the derived column for a parent column.  The match is made by ID first and then by name.
     *
     * @param parent	parent column being removed
     *
     * @return TRUE if a derived column was removed
     */
    public boolean removeDerivedColumn(MetadataColumn parent) {
        boolean retVal = false;
        Iterator<PoolColumn> iter = this.derivedColumns.iterator();
        while (iter.hasNext() && ! retVal) {
            PoolColumn column = iter.next();
            if (column.getParentId() == parent.getId()) {
                iter.remove();
                retVal = true;
            }
        }
        if (! retVal) {
            iter = this.derivedColumns.iterator();
            while (iter.hasNext() && ! retVal) {
                PoolColumn column = iter.next();
                if (column.getKey().equals(parent.getKey())) {
                    iter.remove();
                    retVal = true;
                }
            }
        }
        return retVal;
    }

    /**
     * Replace the derived columns with a new list.
     *
     * @param columns	new derived columns
     */
    public void setDerivedColumns(List<PoolColumn> columns) {
        this.derivedColumns = new ArrayList<PoolColumn>(columns);
    }

    /**
     * Copy the parent positions onto the derived columns and sort them into the same order.
     *
     * @param parents	parent columns, in display order
     */
    public void followParentOrder(List<MetadataColumn> parents) {
        for (MetadataColumn parent : parents) {
            PoolColumn derived = this.getDerivedColumn(parent);
            if (derived != null)
                derived.setPosition(parent.getPosition());
        }
        Collections.sort(this.derivedColumns, Comparator.comparingInt(PoolColumn::getPosition));
    }

    /**
     * @return an unmodifiable view of the derived columns
     */
    public List<PoolColumn> getDerivedColumns() {
        return Collections.unmodifiableList(this.derivedColumns);
    }

    /**
     * @return the ID of this pool
     */
    public long getId() {
        return this.id;
    }

    /**
     * @return the pool name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @param name 	the new pool name
     */
    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return the pool description
     */
    public String getDescription() {
        return this.description;
    }

    /**
     * @param description 	the new pool description
     */
    public void setDescription(String description) {
        this.description = description;
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
     * @param reference 	TRUE if this is a reference pool
     */
    public void setReference(boolean reference) {
        this.reference = reference;
    }

    /**
     * @return the pooled-sample column value for this pool
     */
    public String getSdrfValue() {
        return this.sdrfValue;
    }

    /**
     * @param sdrfValue 	the pooled-sample column value for this pool
     */
    public void setSdrfValue(String sdrfValue) {
        this.sdrfValue = sdrfValue;
    }

    @Override
    public String toString() {
        return this.name + " [" + this.pooledOnly.encode() + "|" + this.pooledAndIndependent.encode() + "]";
    }

}
