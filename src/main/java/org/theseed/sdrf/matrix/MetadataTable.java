/**
 *
 */
package org.theseed.sdrf.matrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.errors.EmptyPoolException;
import org.theseed.sdrf.errors.NotFoundException;
import org.theseed.sdrf.errors.ValidationFailureException;

/**
 * A metadata table is an ordered set of metadata columns over a fixed number of samples, plus the sample pools
 * defined on those samples.  Columns are displayed in position order, with ties broken by insertion order.
 * The same column name may occur more than once, in which case the occurrences are distinguished by their
 * order.
 *
 * Column additions, removals and property changes are reported to an optional column listener, which is used
 * to keep the pool copies of the columns synchronized.
 *
 * @author Bruce Parrello
 *
 */
public class MetadataTable {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(MetadataTable.class);
    /** ID of this table */
    private final long id;
    /** name of this table */
    private String name;
    /** number of samples */
    private int sampleCount;
    /** user who owns the table */
    private String owner;
    /** users allowed to view the table */
    private Set<String> viewers;
    /** columns, in insertion order */
    private List<MetadataColumn> columns;
    /** sample pools */
    private List<SamplePool> pools;
    /** next column ID to assign */
    private long nextColumnId;
    /** next pool ID to assign */
    private long nextPoolId;
    /** listener for column changes */
    private ColumnListener listener;

    /** column sort order:  position, with ties left in insertion order by the stable sort */
    private static final Comparator<MetadataColumn> POSITION_ORDER = Comparator.comparingInt(MetadataColumn::getPosition);

    /**
     * Construct a new, empty metadata table.
     *
     * @param id			ID of the table
     * @param name			name of the table
     * @param sampleCount	number of samples
     */
    public MetadataTable(long id, String name, int sampleCount) {
        if (sampleCount < 0)
            throw new IllegalArgumentException("Sample count cannot be negative.");
        this.id = id;
        this.name = name;
        this.sampleCount = sampleCount;
        this.owner = null;
        this.viewers = new LinkedHashSet<String>();
        this.columns = new ArrayList<MetadataColumn>();
        this.pools = new ArrayList<SamplePool>();
        this.nextColumnId = 1;
        this.nextPoolId = 1;
        this.listener = null;
    }

    /**
     * @return a deep copy of this table
     */
    public MetadataTable copy() {
        MetadataTable retVal = new MetadataTable(this.id, this.name, this.sampleCount);
        retVal.owner = this.owner;
        retVal.viewers = new LinkedHashSet<String>(this.viewers);
        for (MetadataColumn column : this.columns)
            retVal.columns.add(column.copy());
        for (SamplePool pool : this.pools)
            retVal.pools.add(new SamplePool(pool));
        retVal.nextColumnId = this.nextColumnId;
        retVal.nextPoolId = this.nextPoolId;
        retVal.listener = this.listener;
        return retVal;
    }

    /**
     * @return the columns of this table in display order
     */
    public List<MetadataColumn> getColumns() {
        List<MetadataColumn> retVal = new ArrayList<MetadataColumn>(this.columns);
        Collections.sort(retVal, POSITION_ORDER);
        return retVal;
    }

    /**
     * @return the visible columns of this table in display order
     */
    public List<MetadataColumn> getVisibleColumns() {
        List<MetadataColumn> retVal = this.getColumns();
        retVal.removeIf(x -> x.isHidden());
        return retVal;
    }

    /**
     * @return the hidden columns of this table in display order
     */
    public List<MetadataColumn> getHiddenColumns() {
        List<MetadataColumn> retVal = this.getColumns();
        retVal.removeIf(x -> ! x.isHidden());
        return retVal;
    }

    /**
     * @return the number of columns
     */
    public int getColumnCount() {
        return this.columns.size();
    }

    /**
     * @return the column with the specified ID
     *
     * @param columnId	ID of the desired column
     *
     * @throws NotFoundException if the column does not exist
     */
    public MetadataColumn getColumn(long columnId) throws NotFoundException {
        MetadataColumn retVal = this.findColumn(columnId);
        if (retVal == null)
            throw new NotFoundException("Column " + columnId + " not found in table \"" + this.name + "\".");
        return retVal;
    }

    /**
     * @return the column with the specified ID, or NULL if there is none
     *
     * @param columnId	ID of the desired column
     */
    public MetadataColumn findColumn(long columnId) {
        MetadataColumn retVal = null;
        for (int i = 0; i < this.columns.size() && retVal == null; i++) {
            if (this.columns.get(i).getId() == columnId)
                retVal = this.columns.get(i);
        }
        return retVal;
    }

    /**
     * @return all the columns with the specified name, in display order
     *
     * @param name		column name (matched case-insensitively)
     */
    public List<MetadataColumn> findColumns(String name) {
        String key = ColumnCategory.normalize(name);
        List<MetadataColumn> retVal = this.getColumns();
        retVal.removeIf(x -> ! x.getKey().equals(key));
        return retVal;
    }

    /**
     * @return the first column whose normalized name contains the specified text, or NULL if there is none
     *
     * @param fragment	text to search for (normalized)
     */
    public MetadataColumn findColumnContaining(String fragment) {
        String key = ColumnCategory.normalize(fragment);
        MetadataColumn retVal = null;
        Iterator<MetadataColumn> iter = this.getColumns().iterator();
        while (iter.hasNext() && retVal == null) {
            MetadataColumn column = iter.next();
            if (column.getKey().contains(key))
                retVal = column;
        }
        return retVal;
    }

    /**
     * Add a column at the end of the table.
     *
     * @param name		name of the new column
     *
     * @return the column created
     */
    public MetadataColumn addColumn(String name) {
        return this.addColumn(name, -1, null);
    }

    /**
     * Add a column to this table.  If a position is specified, the columns at or after the position are
     * shifted to make room.  Otherwise, the column goes after the current last column.  The setup function,
     * if any, is applied before the column listener is notified, so that pools see the finished column.
     *
     * @param name		name of the new column
     * @param position	desired position, or a negative number to append
     * @param setup		initialization to apply to the new column, or NULL
     *
     * @return the column created
     */
    public MetadataColumn addColumn(String name, int position, Consumer<MetadataColumn> setup) {
        int newPosition;
        if (position < 0)
            newPosition = this.nextPosition();
        else {
            newPosition = position;
            for (MetadataColumn column : this.columns) {
                if (column.getPosition() >= position)
                    column.setPosition(column.getPosition() + 1);
            }
        }
        MetadataColumn retVal = new MetadataColumn(this.nextColumnId, name, newPosition);
        this.nextColumnId++;
        if (setup != null)
            setup.accept(retVal);
        this.columns.add(retVal);
        log.debug("Added column {} \"{}\" at position {}.", retVal.getId(), retVal.getName(), newPosition);
        if (this.listener != null && ! this.pools.isEmpty())
            this.listener.onColumnAdded(this, retVal);
        return retVal;
    }

    /**
     * @return the position after the last column
     */
    private int nextPosition() {
        int retVal = 0;
        for (MetadataColumn column : this.columns)
            retVal = Math.max(retVal, column.getPosition() + 1);
        return retVal;
    }

    /**
     * Remove a column from this table.  The columns after it are shifted down to close the gap.
     *
     * @param columnId	ID of the column to remove
     *
     * @return the column removed
     *
     * @throws NotFoundException if the column does not exist
     */
    public MetadataColumn removeColumn(long columnId) throws NotFoundException {
        MetadataColumn retVal = this.getColumn(columnId);
        this.columns.remove(retVal);
        int position = retVal.getPosition();
        for (MetadataColumn column : this.columns) {
            if (column.getPosition() > position)
                column.setPosition(column.getPosition() - 1);
        }
        log.debug("Removed column {} \"{}\".", retVal.getId(), retVal.getName());
        if (this.listener != null && ! this.pools.isEmpty())
            this.listener.onColumnRemoved(this, retVal);
        return retVal;
    }

    /**
     * Change the name or other properties of a column.  The column listener is notified afterward.
     *
     * @param columnId	ID of the column to change
     * @param change	update to apply to the column
     *
     * @return the column changed
     *
     * @throws NotFoundException if the column does not exist
     */
    public MetadataColumn updateColumn(long columnId, Consumer<MetadataColumn> change) throws NotFoundException {
        MetadataColumn retVal = this.getColumn(columnId);
        change.accept(retVal);
        log.debug("Updated column {} \"{}\".", retVal.getId(), retVal.getName());
        if (this.listener != null && ! this.pools.isEmpty())
            this.listener.onColumnChanged(this, retVal);
        return retVal;
    }

    /**
     * Remove all the columns and pools from this table.  The column listener is not notified.
     */
    public void clear() {
        this.columns.clear();
        this.pools.clear();
    }

    /**
     * Move a column to a new position.  The target position is clamped into the valid range and the
     * columns in between are shifted.
     *
     * @param columnId		ID of the column to move
     * @param newPosition	desired position
     *
     * @throws NotFoundException if the column does not exist
     */
    public void moveColumn(long columnId, int newPosition) throws NotFoundException {
        MetadataColumn target = this.getColumn(columnId);
        List<MetadataColumn> ordered = this.getColumns();
        ordered.remove(target);
        int position = Math.max(0, Math.min(newPosition, ordered.size()));
        ordered.add(position, target);
        this.applyOrder(ordered);
    }

    /**
     * Renumber the column positions from 0 to N-1, preserving the current order.
     */
    public void normalizePositions() {
        this.applyOrder(this.getColumns());
    }

    /**
     * Assign positions to the columns in the specified order.  The pool derived columns are sorted to follow.
     *
     * @param ordered	all the columns of this table, in the desired order
     */
    public void applyOrder(List<MetadataColumn> ordered) {
        if (ordered.size() != this.columns.size())
            throw new IllegalArgumentException("Column order must include all " + this.columns.size() + " columns.");
        for (int i = 0; i < ordered.size(); i++)
            ordered.get(i).setPosition(i);
        for (SamplePool pool : this.pools)
            pool.followParentOrder(ordered);
    }

    /**
     * @return the resolved values of all the visible columns for a sample, in display order
     *
     * @param sampleIdx		1-based index of the sample of interest
     */
    public List<Pair<String, String>> resolveRow(int sampleIdx) {
        return this.resolveRow(sampleIdx, this.getVisibleColumns());
    }

    /**
     * @return the resolved values of the specified columns for a sample
     *
     * @param sampleIdx		1-based index of the sample of interest
     * @param cols			columns to resolve, in output order
     */
    public List<Pair<String, String>> resolveRow(int sampleIdx, List<MetadataColumn> cols) {
        List<Pair<String, String>> retVal = new ArrayList<Pair<String, String>>(cols.size());
        for (MetadataColumn column : cols)
            retVal.add(new ImmutablePair<String, String>(column.getName(), column.resolve(sampleIdx)));
        return retVal;
    }

    /**
     * @return the source name of a sample, or NULL if there is no source name column or no stored value
     *
     * @param sampleIdx		1-based index of the sample of interest
     */
    public String getSourceName(int sampleIdx) {
        String retVal = null;
        MetadataColumn sourceCol = this.findColumnContaining(ColumnCategory.SOURCE_NAME.getLabel());
        if (sourceCol != null)
            retVal = sourceCol.rawValue(sampleIdx);
        return retVal;
    }

    /**
     * Change the number of samples.  Any modifiers or pool members beyond the new count are removed, and
     * pools left with no members are deleted.
     *
     * @param sampleCount	new sample count
     */
    public void setSampleCount(int sampleCount) {
        if (sampleCount < 0)
            throw new IllegalArgumentException("Sample count cannot be negative.");
        if (sampleCount < this.sampleCount) {
            for (MetadataColumn column : this.columns)
                column.truncateSamples(sampleCount);
            Iterator<SamplePool> iter = this.pools.iterator();
            while (iter.hasNext()) {
                SamplePool pool = iter.next();
                if (! pool.truncateSamples(sampleCount)) {
                    log.warn("Pool \"{}\" deleted because all its samples were removed.", pool.getName());
                    iter.remove();
                }
            }
        }
        this.sampleCount = sampleCount;
    }

    /**
     * Move a sample's values and pool memberships to a new index.  The values at the new index are replaced,
     * and the old index is left with the column defaults.
     *
     * @param oldIdx	current index of the sample
     * @param newIdx	new index for the sample
     *
     * @return the number of columns and pools updated
     *
     * @throws ValidationFailureException if either index is outside the table
     */
    public int changeSampleIndex(int oldIdx, int newIdx) throws ValidationFailureException {
        this.checkIndex(oldIdx);
        this.checkIndex(newIdx);
        int retVal = 0;
        if (oldIdx != newIdx)
            retVal = this.moveSample(oldIdx, newIdx);
        return retVal;
    }

    /**
     * Move several samples at once.  The samples are first moved to temporary indices beyond the end of the
     * table, and then to their final positions, so that swaps and rotations are handled correctly.
     *
     * @param mappings	map of current indices to new indices
     *
     * @return the number of column and pool updates made
     *
     * @throws ValidationFailureException if an index is invalid or a move would overwrite a sample that is not moving
     */
    public int batchChangeSampleIndices(Map<Integer, Integer> mappings) throws ValidationFailureException {
        // Validate all the mappings before changing anything.
        Set<Integer> targets = new LinkedHashSet<Integer>();
        for (Map.Entry<Integer, Integer> mapping : mappings.entrySet()) {
            int oldIdx = mapping.getKey();
            int newIdx = mapping.getValue();
            this.checkIndex(oldIdx);
            this.checkIndex(newIdx);
            if (! targets.add(newIdx))
                throw new ValidationFailureException("More than one sample is being moved to index " + newIdx + ".");
            if (! mappings.containsKey(newIdx))
                throw new ValidationFailureException("Index " + newIdx + " is occupied by a sample that is not being moved.");
        }
        int offset = this.sampleCount + 1000;
        int retVal = 0;
        for (int oldIdx : mappings.keySet())
            retVal += this.moveSample(oldIdx, offset + oldIdx);
        for (Map.Entry<Integer, Integer> mapping : mappings.entrySet())
            retVal += this.moveSample(offset + mapping.getKey(), mapping.getValue());
        log.debug("{} updates made moving {} samples in table \"{}\".", retVal, mappings.size(), this.name);
        return retVal;
    }

    /**
     * Move a sample without checking the indices.
     *
     * @param oldIdx	current index of the sample
     * @param newIdx	new index for the sample
     *
     * @return the number of columns and pools updated
     */
    private int moveSample(int oldIdx, int newIdx) {
        int retVal = 0;
        for (MetadataColumn column : this.columns) {
            if (column.moveSample(oldIdx, newIdx))
                retVal++;
        }
        for (SamplePool pool : this.pools) {
            if (pool.moveSample(oldIdx, newIdx))
                retVal++;
        }
        return retVal;
    }

    /**
     * Verify that a sample index is valid for this table.
     *
     * @param idx	index to check
     *
     * @throws ValidationFailureException if the index is out of range
     */
    private void checkIndex(int idx) throws ValidationFailureException {
        if (idx < 1 || idx > this.sampleCount)
            throw new ValidationFailureException("Sample index " + idx + " is outside the range 1 to "
                    + this.sampleCount + ".");
    }

    /**
     * Create a new pool in this table.  The pool's derived columns are not computed here.
     *
     * @param name					name of the pool
     * @param pooledOnly			samples that exist only in the pool
     * @param pooledAndIndependent	samples also reported independently
     * @param reference				TRUE for a reference pool
     *
     * @return the pool created
     *
     * @throws EmptyPoolException if the pool has no members
     * @throws ValidationFailureException if the member sets overlap or are out of range
     */
    public SamplePool addPool(String name, RangeSet pooledOnly, RangeSet pooledAndIndependent, boolean reference)
            throws EmptyPoolException, ValidationFailureException {
        SamplePool retVal = new SamplePool(this.nextPoolId, name, pooledOnly, pooledAndIndependent, reference);
        retVal.checkRange(this.sampleCount);
        this.nextPoolId++;
        this.pools.add(retVal);
        return retVal;
    }

    /**
     * Delete a pool from this table.
     *
     * @param poolId	ID of the pool to delete
     *
     * @throws NotFoundException if the pool does not exist
     */
    public void removePool(long poolId) throws NotFoundException {
        SamplePool pool = this.getPool(poolId);
        this.pools.remove(pool);
    }

    /**
     * @return the pool with the specified ID
     *
     * @param poolId	ID of the desired pool
     *
     * @throws NotFoundException if the pool does not exist
     */
    public SamplePool getPool(long poolId) throws NotFoundException {
        SamplePool retVal = null;
        for (int i = 0; i < this.pools.size() && retVal == null; i++) {
            if (this.pools.get(i).getId() == poolId)
                retVal = this.pools.get(i);
        }
        if (retVal == null)
            throw new NotFoundException("Pool " + poolId + " not found in table \"" + this.name + "\".");
        return retVal;
    }

    /**
     * @return the first pool with the specified name, or NULL if there is none
     *
     * @param poolName	name of the desired pool
     */
    public SamplePool findPool(String poolName) {
        SamplePool retVal = null;
        for (int i = 0; i < this.pools.size() && retVal == null; i++) {
            if (this.pools.get(i).getName().equals(poolName))
                retVal = this.pools.get(i);
        }
        return retVal;
    }

    /**
     * @return an unmodifiable view of the pools
     */
    public List<SamplePool> getPools() {
        return Collections.unmodifiableList(this.pools);
    }

    /**
     * @return the ID of this table
     */
    public long getId() {
        return this.id;
    }

    /**
     * @return the table name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @param name 	the new table name
     */
    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return the number of samples
     */
    public int getSampleCount() {
        return this.sampleCount;
    }

    /**
     * @return the owning user, or NULL if the table is unowned
     */
    public String getOwner() {
        return this.owner;
    }

    /**
     * @param owner 	the owning user
     */
    public void setOwner(String owner) {
        this.owner = owner;
    }

    /**
     * @return the users allowed to view this table
     */
    public Set<String> getViewers() {
        return this.viewers;
    }

    /**
     * @return the column listener, or NULL if there is none
     */
    public ColumnListener getListener() {
        return this.listener;
    }

    /**
     * @param listener 	the column listener to notify of column changes
     */
    public void setListener(ColumnListener listener) {
        this.listener = listener;
    }

    @Override
    public String toString() {
        return "MetadataTable " + this.id + " \"" + this.name + "\" (" + this.sampleCount + " samples, "
                + this.columns.size() + " columns, " + this.pools.size() + " pools)";
    }

}
