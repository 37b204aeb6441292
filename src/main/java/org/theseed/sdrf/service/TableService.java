/**
 *
 */
package org.theseed.sdrf.service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.errors.NotFoundException;
import org.theseed.sdrf.errors.PermissionDeniedException;
import org.theseed.sdrf.errors.SdrfException;
import org.theseed.sdrf.errors.ValidationFailureException;
import org.theseed.sdrf.io.ImportOptions;
import org.theseed.sdrf.io.ImportResult;
import org.theseed.sdrf.io.SdrfExporter;
import org.theseed.sdrf.io.SdrfImporter;
import org.theseed.sdrf.io.ValueConverter;
import org.theseed.sdrf.io.WorkbookExporter;
import org.theseed.sdrf.io.WorkbookImporter;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.RangeSet;
import org.theseed.sdrf.matrix.SamplePool;
import org.theseed.sdrf.pools.PoolAggregator;
import org.theseed.sdrf.pools.PoolSynchronizer;
import org.theseed.sdrf.templates.ColumnOrderer;
import org.theseed.sdrf.templates.ColumnTemplate;
import org.theseed.sdrf.templates.TemplateMatcher;
import org.theseed.sdrf.templates.TemplateRegistry;

/**
 * This is the main entry point for table operations.  Every operation checks the actor's permission on the
 * table before anything is read or changed, and every change runs inside a store transaction, so that a
 * failed operation leaves the stored table as it was.  The column synchronizer is attached to each working
 * copy, so pool values follow column changes.
 *
 * @author Bruce Parrello
 *
 */
public class TableService {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TableService.class);
    /** table storage */
    private final TableStore store;
    /** access policy */
    private final AccessPolicy policy;
    /** template library */
    private final TemplateRegistry registry;
    /** pool aggregator */
    private final PoolAggregator aggregator;
    /** pool synchronizer */
    private final PoolSynchronizer synchronizer;
    /** template matcher */
    private final TemplateMatcher matcher;
    /** column orderer */
    private final ColumnOrderer orderer;
    /** SDRF reader */
    private final SdrfImporter sdrfImporter;
    /** SDRF writer */
    private final SdrfExporter sdrfExporter;
    /** workbook reader */
    private final WorkbookImporter workbookImporter;
    /** workbook writer */
    private final WorkbookExporter workbookExporter;
    /** table combiner */
    private final TableCombiner combiner;
    /** bulk exporter */
    private final BulkExporter bulkExporter;

    /**
     * Construct a table service.
     *
     * @param store			table storage
     * @param policy		access policy
     * @param registry		template library
     * @param favourites	source of favourite options, or NULL if there are none
     * @param ontology		ontology lookup for imported values, or NULL for none
     */
    public TableService(TableStore store, AccessPolicy policy, TemplateRegistry registry, FavouriteSource favourites,
            OntologyLookup ontology) {
        this.store = store;
        this.policy = policy;
        this.registry = registry;
        this.aggregator = new PoolAggregator();
        this.synchronizer = new PoolSynchronizer(this.aggregator);
        this.matcher = new TemplateMatcher(registry);
        this.orderer = new ColumnOrderer(registry);
        FavouriteSource favouriteSource = (favourites == null ? new FavouriteList() : favourites);
        ValueConverter converter = new ValueConverter(favouriteSource,
                (ontology == null ? OntologyLookup.NONE : ontology));
        this.sdrfImporter = new SdrfImporter(this.matcher, this.orderer, this.synchronizer, converter);
        this.sdrfExporter = new SdrfExporter(this.aggregator);
        this.workbookImporter = new WorkbookImporter(this.matcher, this.synchronizer, converter);
        this.workbookExporter = new WorkbookExporter(this.aggregator, favouriteSource);
        this.combiner = new TableCombiner(this.aggregator, this.orderer);
        this.bulkExporter = new BulkExporter(this.sdrfExporter, this.workbookExporter);
    }

    /**
     * @return a new, empty table owned by the actor
     *
     * @param actor			name of the user making the request
     * @param name			name of the table
     * @param sampleCount	number of samples
     */
    public MetadataTable createTable(String actor, String name, int sampleCount) {
        MetadataTable retVal = this.store.create(name, sampleCount, actor);
        log.info("Table {} \"{}\" created for {} with {} samples.", retVal.getId(), name, actor, sampleCount);
        return retVal;
    }

    /**
     * @return a copy of a table
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the desired table
     *
     * @throws NotFoundException if the table does not exist
     * @throws PermissionDeniedException if the actor may not view the table
     */
    public MetadataTable getTable(String actor, long tableId) throws NotFoundException, PermissionDeniedException {
        MetadataTable retVal = this.store.load(tableId);
        if (! this.policy.canView(actor, retVal))
            throw new PermissionDeniedException("User " + actor + " may not view table " + tableId + ".");
        return retVal;
    }

    /**
     * @return copies of all the tables the actor may view
     *
     * @param actor		name of the user making the request
     */
    public List<MetadataTable> listTables(String actor) {
        List<MetadataTable> retVal = this.store.list();
        retVal.removeIf(x -> ! this.policy.canView(actor, x));
        return retVal;
    }

    /**
     * Delete a table.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to delete
     *
     * @throws NotFoundException if the table does not exist
     * @throws PermissionDeniedException if the actor may not change the table
     */
    public void deleteTable(String actor, long tableId) throws NotFoundException, PermissionDeniedException {
        this.checkEdit(actor, tableId);
        this.store.delete(tableId);
        log.info("Table {} deleted by {}.", tableId, actor);
    }

    /**
     * Perform work on a table after verifying that the actor may change it.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to change
     * @param work		work to perform
     *
     * @return the result of the work
     *
     * @throws SdrfException if the table is not found, permission is denied, or the work fails
     * @throws IOException if an input or output error occurs
     */
    protected <T> T update(String actor, long tableId, TableWork<T> work) throws SdrfException, IOException {
        this.checkEdit(actor, tableId);
        return this.store.inTransaction(tableId, table -> {
            this.synchronizer.attach(table);
            return work.apply(table);
        });
    }

    /**
     * Verify that an actor may change a table.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to change
     *
     * @throws NotFoundException if the table does not exist
     * @throws PermissionDeniedException if the actor may not change the table
     */
    private void checkEdit(String actor, long tableId) throws NotFoundException, PermissionDeniedException {
        MetadataTable table = this.store.load(tableId);
        if (! this.policy.canEdit(actor, table))
            throw new PermissionDeniedException("User " + actor + " may not change table " + tableId + ".");
    }

    /**
     * @return a new column added to a table
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to change
     * @param name		name of the new column
     * @param position	position for the column, or a negative number to put it at the end
     *
     * @throws SdrfException if the table is not found or permission is denied
     * @throws IOException if an input or output error occurs
     */
    public MetadataColumn addColumn(String actor, long tableId, String name, int position)
            throws SdrfException, IOException {
        return this.update(actor, tableId, table -> this.matcher.addColumn(table, name, position).copy());
    }

    /**
     * Remove a column from a table.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to change
     * @param columnId	ID of the column to remove
     *
     * @throws SdrfException if the table or column is not found or permission is denied
     * @throws IOException if an input or output error occurs
     */
    public void removeColumn(String actor, long tableId, long columnId) throws SdrfException, IOException {
        this.update(actor, tableId, table -> table.removeColumn(columnId));
    }

    /**
     * Rename a column.  The pool copies of the column follow the new name and the pool values are recomputed.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to change
     * @param columnId	ID of the column to rename
     * @param newName	new column name
     *
     * @throws SdrfException if the table or column is not found, permission is denied, or the name is blank
     * @throws IOException if an input or output error occurs
     */
    public void renameColumn(String actor, long tableId, long columnId, String newName)
            throws SdrfException, IOException {
        if (StringUtils.isBlank(newName))
            throw new ValidationFailureException("Column name cannot be blank.");
        this.update(actor, tableId, table -> {
            table.updateColumn(columnId, x -> x.setName(newName));
            this.aggregator.refreshAll(table);
            return null;
        });
    }

    /**
     * Change the display and validation flags of a column.  The pool copies of the column are updated and the
     * pool values are recomputed.
     *
     * @param actor			name of the user making the request
     * @param tableId		ID of the table to change
     * @param columnId		ID of the column to change
     * @param hidden		TRUE if the column should be hidden
     * @param mandatory		TRUE if the column should be mandatory
     * @param notApplicable	TRUE if unset values should render as "not applicable"
     *
     * @throws SdrfException if the table or column is not found or permission is denied
     * @throws IOException if an input or output error occurs
     */
    public void setColumnFlags(String actor, long tableId, long columnId, boolean hidden, boolean mandatory,
            boolean notApplicable) throws SdrfException, IOException {
        this.update(actor, tableId, table -> {
            table.updateColumn(columnId, x -> {
                x.setHidden(hidden);
                x.setMandatory(mandatory);
                x.setNotApplicable(notApplicable);
            });
            this.aggregator.refreshAll(table);
            return null;
        });
    }

    /**
     * Move a column to a new position.
     *
     * @param actor			name of the user making the request
     * @param tableId		ID of the table to change
     * @param columnId		ID of the column to move
     * @param newPosition	desired position (clamped into range)
     *
     * @throws SdrfException if the table or column is not found or permission is denied
     * @throws IOException if an input or output error occurs
     */
    public void moveColumn(String actor, long tableId, long columnId, int newPosition)
            throws SdrfException, IOException {
        this.update(actor, tableId, table -> {
            table.moveColumn(columnId, newPosition);
            return null;
        });
    }

    /**
     * Store a value for some or all of the samples in a column.  The pool values are recomputed.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to change
     * @param columnId	ID of the column to change
     * @param value		new value
     * @param samples	samples to change, or NULL to replace the whole column
     *
     * @throws SdrfException if the table or column is not found, permission is denied, or the samples are out of range
     * @throws IOException if an input or output error occurs
     */
    public void setColumnValue(String actor, long tableId, long columnId, String value, RangeSet samples)
            throws SdrfException, IOException {
        this.update(actor, tableId, table -> {
            MetadataColumn column = table.getColumn(columnId);
            if (samples == null)
                column.replaceAll(value);
            else {
                if (! samples.isEmpty() && (samples.first() < 1 || samples.last() > table.getSampleCount()))
                    throw new ValidationFailureException("Samples " + samples + " are outside the range 1 to "
                            + table.getSampleCount() + ".");
                column.setValueForSamples(value, samples);
            }
            this.aggregator.refreshAll(table);
            return null;
        });
    }

    /**
     * Reorder the columns of a table.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to change
     * @param strategy	ordering strategy
     *
     * @return the strategy actually used
     *
     * @throws SdrfException if the table is not found or permission is denied
     * @throws IOException if an input or output error occurs
     */
    public ColumnOrderer.Strategy reorderColumns(String actor, long tableId, ColumnOrderer.Strategy strategy)
            throws SdrfException, IOException {
        return this.update(actor, tableId, table -> this.orderer.reorder(table, strategy));
    }

    /**
     * Change the number of samples in a table.
     *
     * @param actor			name of the user making the request
     * @param tableId		ID of the table to change
     * @param sampleCount	new sample count
     *
     * @throws SdrfException if the table is not found, permission is denied, or the count is negative
     * @throws IOException if an input or output error occurs
     */
    public void setSampleCount(String actor, long tableId, int sampleCount) throws SdrfException, IOException {
        if (sampleCount < 0)
            throw new ValidationFailureException("Sample count cannot be negative.");
        this.update(actor, tableId, table -> {
            table.setSampleCount(sampleCount);
            this.aggregator.refreshAll(table);
            return null;
        });
    }

    /**
     * Move a sample to a new index.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to change
     * @param oldIdx	current index of the sample
     * @param newIdx	new index for the sample
     *
     * @return the number of columns and pools updated
     *
     * @throws SdrfException if the table is not found, permission is denied, or an index is invalid
     * @throws IOException if an input or output error occurs
     */
    public int changeSampleIndex(String actor, long tableId, int oldIdx, int newIdx) throws SdrfException, IOException {
        return this.update(actor, tableId, table -> {
            int retVal = table.changeSampleIndex(oldIdx, newIdx);
            this.aggregator.refreshAll(table);
            return retVal;
        });
    }

    /**
     * Move several samples at once.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to change
     * @param mappings	map of current indices to new indices
     *
     * @return the number of column and pool updates made
     *
     * @throws SdrfException if the table is not found, permission is denied, or a mapping is invalid
     * @throws IOException if an input or output error occurs
     */
    public int batchChangeSampleIndices(String actor, long tableId, Map<Integer, Integer> mappings)
            throws SdrfException, IOException {
        return this.update(actor, tableId, table -> {
            int retVal = table.batchChangeSampleIndices(mappings);
            this.aggregator.refreshAll(table);
            return retVal;
        });
    }

    /**
     * @return the ID of a new pool created in a table
     *
     * @param actor					name of the user making the request
     * @param tableId				ID of the table to change
     * @param name					name of the pool
     * @param pooledOnly			samples that exist only in the pool
     * @param pooledAndIndependent	samples also reported independently
     * @param reference				TRUE for a reference pool
     *
     * @throws SdrfException if the table is not found, permission is denied, or the pool is invalid
     * @throws IOException if an input or output error occurs
     */
    public long createPool(String actor, long tableId, String name, RangeSet pooledOnly, RangeSet pooledAndIndependent,
            boolean reference) throws SdrfException, IOException {
        return this.update(actor, tableId, table -> {
            SamplePool pool = table.addPool(name, pooledOnly, pooledAndIndependent, reference);
            this.aggregator.refreshPool(table, pool);
            return pool.getId();
        });
    }

    /**
     * Delete a pool from a table.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to change
     * @param poolId	ID of the pool to delete
     *
     * @throws SdrfException if the table or pool is not found or permission is denied
     * @throws IOException if an input or output error occurs
     */
    public void removePool(String actor, long tableId, long poolId) throws SdrfException, IOException {
        this.update(actor, tableId, table -> {
            table.removePool(poolId);
            return null;
        });
    }

    /**
     * Import an SDRF file into a table.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to change
     * @param reader	reader for the SDRF file
     * @param options	import options
     *
     * @return a summary of the import
     *
     * @throws SdrfException if the table is not found, permission is denied, or the input is invalid
     * @throws IOException if an input error occurs
     */
    public ImportResult importSdrf(String actor, long tableId, Reader reader, ImportOptions options)
            throws SdrfException, IOException {
        return this.update(actor, tableId, table -> this.sdrfImporter.importSdrf(table, reader, options));
    }

    /**
     * Import a workbook into a table.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to change
     * @param inStream	input stream for the workbook
     * @param options	import options
     *
     * @return a summary of the import
     *
     * @throws SdrfException if the table is not found, permission is denied, or the input is invalid
     * @throws IOException if an input error occurs
     */
    public ImportResult importWorkbook(String actor, long tableId, InputStream inStream, ImportOptions options)
            throws SdrfException, IOException {
        return this.update(actor, tableId, table -> this.workbookImporter.importWorkbook(table, inStream, options));
    }

    /**
     * Write a table in SDRF format.
     *
     * @param actor			name of the user making the request
     * @param tableId		ID of the table to export
     * @param writer		output writer
     * @param includePools	TRUE to include reference pool lines
     * @param columnFilter	IDs of the columns to export, or NULL for all visible columns
     *
     * @return the number of data lines written
     *
     * @throws SdrfException if the table is not found or permission is denied
     * @throws IOException if an output error occurs
     */
    public int exportSdrf(String actor, long tableId, Writer writer, boolean includePools, Collection<Long> columnFilter)
            throws SdrfException, IOException {
        MetadataTable table = this.getTable(actor, tableId);
        return this.sdrfExporter.export(table, writer, includePools, columnFilter);
    }

    /**
     * Write a table as a workbook.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to export
     * @param outStream	output stream
     *
     * @throws SdrfException if the table is not found or permission is denied
     * @throws IOException if an output error occurs
     */
    public void exportWorkbook(String actor, long tableId, OutputStream outStream) throws SdrfException, IOException {
        MetadataTable table = this.getTable(actor, tableId);
        this.workbookExporter.export(table, outStream);
    }

    /**
     * Export several tables to a ZIP archive.  Tables the actor may not view are recorded as failures.
     *
     * @param actor			name of the user making the request
     * @param tableIds		IDs of the tables to export
     * @param format		output format
     * @param includePools	TRUE to include reference pool lines in SDRF output
     * @param outStream		output stream for the archive
     *
     * @return the manifest of the export
     *
     * @throws IOException if an error occurs writing the archive
     */
    public ExportManifest bulkExport(String actor, List<Long> tableIds, BulkExporter.Format format,
            boolean includePools, OutputStream outStream) throws IOException {
        List<MetadataTable> tables = new ArrayList<MetadataTable>(tableIds.size());
        ExportManifest denied = new ExportManifest();
        for (long tableId : tableIds) {
            try {
                tables.add(this.getTable(actor, tableId));
            } catch (NotFoundException | PermissionDeniedException e) {
                log.warn("Table {} skipped in bulk export: {}", tableId, e.getMessage());
                denied.addFailure(tableId, "", e.getMessage());
            }
        }
        return this.bulkExporter.export(tables, denied, format, includePools, outStream);
    }

    /**
     * @return a new table combining several others
     *
     * @param actor		name of the user making the request
     * @param tableIds	IDs of the tables to combine
     * @param name		name for the new table
     * @param rowwise	TRUE to stack the samples, FALSE to place the columns side by side
     * @param strategy	column selection strategy for a row-wise combination
     *
     * @throws SdrfException if a table is not found, permission is denied, or the combination is invalid
     * @throws IOException if an input or output error occurs
     */
    public MetadataTable combineTables(String actor, List<Long> tableIds, String name, boolean rowwise,
            TableCombiner.MergeStrategy strategy) throws SdrfException, IOException {
        List<MetadataTable> sources = new ArrayList<MetadataTable>(tableIds.size());
        for (long tableId : tableIds)
            sources.add(this.getTable(actor, tableId));
        if (sources.isEmpty())
            throw new ValidationFailureException("At least one source table is required.");
        MetadataTable target = this.store.create(name, 0, actor);
        try {
            return this.store.inTransaction(target.getId(), table -> {
                this.synchronizer.attach(table);
                if (rowwise)
                    this.combiner.combineRowwise(sources, table, strategy, true);
                else
                    this.combiner.combineColumnwise(sources, table, true);
                return table.copy();
            });
        } catch (SdrfException | IOException | RuntimeException e) {
            this.store.delete(target.getId());
            throw e;
        }
    }

    /**
     * Check a table for values that break its templates' rules.  Each mandatory column must have a real value for
     * every sample, and each value of a column with a template must match the template's pattern.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to check
     *
     * @return a list of problem descriptions (empty if the table is valid)
     *
     * @throws NotFoundException if the table does not exist
     * @throws PermissionDeniedException if the actor may not view the table
     */
    public List<String> validate(String actor, long tableId) throws NotFoundException, PermissionDeniedException {
        MetadataTable table = this.getTable(actor, tableId);
        List<String> retVal = new ArrayList<String>();
        for (MetadataColumn column : table.getColumns()) {
            ColumnTemplate template = this.findTemplate(column);
            Set<String> values = new LinkedHashSet<String>();
            int missing = 0;
            for (int i = 1; i <= table.getSampleCount(); i++) {
                String value = column.rawValue(i);
                if (value == null)
                    missing++;
                else
                    values.add(value);
            }
            if (column.isMandatory() && missing > 0)
                retVal.add("Mandatory column \"" + column.getName() + "\" has no value for " + missing + " samples.");
            if (template != null) {
                for (String value : values) {
                    if (! value.equalsIgnoreCase(MetadataColumn.NOT_APPLICABLE)
                            && ! value.equalsIgnoreCase(MetadataColumn.NOT_AVAILABLE)) {
                        String problem = template.checkValue(value);
                        if (problem != null)
                            retVal.add(problem);
                    }
                }
            }
        }
        log.info("Validation of table \"{}\" found {} problems.", table.getName(), retVal.size());
        return retVal;
    }

    /**
     * Verify that a table is valid.
     *
     * @param actor		name of the user making the request
     * @param tableId	ID of the table to check
     *
     * @throws ValidationFailureException if the table has problems
     * @throws NotFoundException if the table does not exist
     * @throws PermissionDeniedException if the actor may not view the table
     */
    public void requireValid(String actor, long tableId)
            throws ValidationFailureException, NotFoundException, PermissionDeniedException {
        List<String> problems = this.validate(actor, tableId);
        if (! problems.isEmpty())
            throw new ValidationFailureException(problems.size() + " validation problems found: " + problems.get(0));
    }

    /**
     * @return the template a column was built from, or NULL if there is none
     *
     * @param column	column of interest
     */
    private ColumnTemplate findTemplate(MetadataColumn column) {
        ColumnTemplate retVal = null;
        String schema = ColumnTemplate.schemaOf(column.getTemplateRef());
        if (schema != null)
            retVal = this.registry.match(column.getName(), schema);
        return retVal;
    }

}
