/**
 *
 */
package org.theseed.sdrf.io;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.errors.EmptyPoolException;
import org.theseed.sdrf.errors.MissingRequiredSheetException;
import org.theseed.sdrf.errors.ValidationFailureException;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.RangeSet;
import org.theseed.sdrf.pools.PoolAggregator;
import org.theseed.sdrf.pools.PoolSpec;
import org.theseed.sdrf.pools.PoolSynchronizer;
import org.theseed.sdrf.templates.TemplateMatcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * This object reads a workbook produced by the workbook exporter back into a metadata table.
 *
 * The "main" and "id_metadata_column_map" sheets are required.  The column map lists each column with its
 * name, its hidden flag and its index in its own sheet ("main" or "hidden").  The data rows of a sheet stop
 * at the first legend line.  Each column is matched to an existing column with the same name and occurrence
 * number or created, and its values are compacted into a default plus modifiers.  The imported columns take the
 * workbook's order.
 *
 * Pools are read from the "pool_object_map" sheet.  If the "pool_main" or "pool_hidden" sheets are present
 * along with "pool_id_metadata_column_map", their values override the computed pool values.
 *
 * @author Bruce Parrello
 *
 */
public class WorkbookImporter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(WorkbookImporter.class);
    /** template matcher for new columns */
    private final TemplateMatcher matcher;
    /** pool synchronizer */
    private final PoolSynchronizer synchronizer;
    /** cell value converter */
    private final ValueConverter converter;
    /** JSON mapper for sample index lists */
    private final ObjectMapper mapper;

    /** type descriptor for a sample index list */
    private static final TypeReference<List<Integer>> INDEX_LIST = new TypeReference<List<Integer>>() {};

    /**
     * This class describes a single column from a column map sheet.
     */
    protected static class MapEntry {

        /** ID of the column when exported */
        private final long id;
        /** index of the column in its data sheet */
        private final int index;
        /** name of the column */
        private final String name;
        /** TRUE if the column is in the hidden sheet */
        private final boolean hidden;
        /** position of the column when exported */
        private final double position;

        /**
         * Create a column map entry from a map sheet row.
         *
         * @param row		row containing the entry
         * @param rowIdx	index of the row, used when there is no position
         */
        protected MapEntry(Row row, int rowIdx) {
            this.id = (long) ExcelUtils.numValue(row.getCell(0));
            double idx = ExcelUtils.numValue(row.getCell(1));
            this.index = (Double.isNaN(idx) ? -1 : (int) idx);
            this.name = ExcelUtils.stringValue(row.getCell(2));
            this.hidden = ExcelUtils.flagValue(row.getCell(4));
            double pos = ExcelUtils.numValue(row.getCell(5));
            this.position = (Double.isNaN(pos) ? rowIdx : pos);
        }

        /**
         * @return the column ID
         */
        public long getId() {
            return this.id;
        }

        /**
         * @return the column index in the data sheet
         */
        public int getIndex() {
            return this.index;
        }

        /**
         * @return the column name
         */
        public String getName() {
            return this.name;
        }

        /**
         * @return TRUE if the column is hidden
         */
        public boolean isHidden() {
            return this.hidden;
        }

        /**
         * @return the exported position of the column
         */
        public double getPosition() {
            return this.position;
        }

    }

    /**
     * Construct a workbook importer.
     *
     * @param matcher		template matcher for new columns
     * @param synchronizer	pool synchronizer
     * @param converter		cell value converter
     */
    public WorkbookImporter(TemplateMatcher matcher, PoolSynchronizer synchronizer, ValueConverter converter) {
        this.matcher = matcher;
        this.synchronizer = synchronizer;
        this.converter = converter;
        this.mapper = new ObjectMapper();
    }

    /**
     * Import a workbook into a table.  The stream is not closed.
     *
     * @param table		target table
     * @param inStream	input stream containing the workbook
     * @param options	import options
     *
     * @return a summary of the import
     *
     * @throws IOException if an input error occurs
     * @throws MissingRequiredSheetException if the main sheet or the column map is missing
     * @throws ValidationFailureException if an imported pool is invalid
     */
    public ImportResult importWorkbook(MetadataTable table, InputStream inStream, ImportOptions options)
            throws IOException, MissingRequiredSheetException, ValidationFailureException {
        try (Workbook workbook = new XSSFWorkbook(inStream)) {
            return this.importWorkbook(table, workbook, options);
        }
    }

    /**
     * Import an open workbook into a table.
     *
     * @param table		target table
     * @param workbook	workbook to read
     * @param options	import options
     *
     * @return a summary of the import
     *
     * @throws MissingRequiredSheetException if the main sheet or the column map is missing
     * @throws ValidationFailureException if an imported pool is invalid
     */
    public ImportResult importWorkbook(MetadataTable table, Workbook workbook, ImportOptions options)
            throws MissingRequiredSheetException, ValidationFailureException {
        ImportResult retVal = new ImportResult();
        Sheet mainSheet = ExcelUtils.findSheet(workbook, WorkbookExporter.MAIN_SHEET)
                .orElseThrow(() -> new MissingRequiredSheetException("Workbook has no \"main\" sheet."));
        Sheet idSheet = ExcelUtils.findSheet(workbook, WorkbookExporter.ID_MAP_SHEET)
                .orElseThrow(() -> new MissingRequiredSheetException("Workbook has no \"id_metadata_column_map\" sheet."));
        Optional<Sheet> hiddenSheet = ExcelUtils.findSheet(workbook, WorkbookExporter.HIDDEN_SHEET);
        this.synchronizer.attach(table);
        if (options.isReplaceExisting())
            table.clear();
        // Count the data rows.
        int found = ExcelUtils.countDataRows(mainSheet, headerWidth(mainSheet));
        if (hiddenSheet.isPresent())
            found = Math.max(found, ExcelUtils.countDataRows(hiddenSheet.get(), headerWidth(hiddenSheet.get())));
        int expected = table.getSampleCount();
        if (expected == 0)
            expected = found;
        if (found > expected)
            retVal.addWarning(0, (found - expected) + " sample rows beyond the table's " + expected + " samples were ignored.");
        final int rowsToRead = Math.min(found, expected);
        table.setSampleCount(expected);
        retVal.setSampleCount(expected);
        // Load the columns in workbook order.
        List<MapEntry> entries = readColumnMap(idSheet);
        entries.sort(Comparator.comparingDouble(MapEntry::getPosition));
        ColumnLoader loader = new ColumnLoader(this.matcher, this.converter);
        Map<Long, MetadataColumn> loaded = new HashMap<Long, MetadataColumn>();
        List<MetadataColumn> order = new ArrayList<MetadataColumn>(entries.size());
        for (MapEntry entry : entries) {
            MetadataColumn column = loader.findOrCreate(table, entry.getName(), order.size(), retVal);
            column.setHidden(entry.isHidden());
            Optional<Sheet> source = (entry.isHidden() ? hiddenSheet : Optional.of(mainSheet));
            List<String> cells;
            if (source.isEmpty() || entry.getIndex() < 0) {
                retVal.addWarning(0, "No data found for column \"" + entry.getName() + "\".");
                cells = new ArrayList<String>();
            } else
                cells = ExcelUtils.columnValues(source.get(), entry.getIndex(), rowsToRead);
            while (cells.size() < expected)
                cells.add("");
            loader.storeValues(column, cells);
            loaded.put(entry.getId(), column);
            order.add(column);
        }
        for (MetadataColumn column : table.getColumns()) {
            if (! order.contains(column))
                order.add(column);
        }
        table.applyOrder(order);
        // Build the pools.
        List<PoolSpec> specs = new ArrayList<PoolSpec>();
        Optional<Sheet> poolSheet = ExcelUtils.findSheet(workbook, WorkbookExporter.POOL_OBJECT_SHEET);
        if (options.isCreatePools() && poolSheet.isPresent()) {
            List<PoolSpec> rowSpecs = this.readPools(poolSheet.get(), retVal);
            this.readPoolValues(workbook, table, rowSpecs, loaded, loader);
            for (PoolSpec spec : rowSpecs) {
                if (spec != null)
                    specs.add(spec);
            }
        }
        if (! specs.isEmpty()) {
            try {
                retVal.setPoolSync(this.synchronizer.syncPoolsWithImport(table, specs));
            } catch (EmptyPoolException e) {
                throw new ValidationFailureException("Imported pool has no members: " + e.getMessage(), e);
            }
        } else
            this.synchronizer.getAggregator().refreshAll(table);
        log.info("Workbook import into \"{}\": {} samples, {} columns created, {} updated, {} pools, {} warnings.",
                table.getName(), expected, retVal.getColumnsCreated(), retVal.getColumnsUpdated(), specs.size(),
                retVal.getWarnings().size());
        return retVal;
    }

    /**
     * @return the number of header cells in a sheet
     *
     * @param sheet		sheet to examine
     */
    private static int headerWidth(Sheet sheet) {
        int retVal = 0;
        Row header = sheet.getRow(0);
        if (header != null)
            retVal = Math.max(0, header.getLastCellNum());
        return retVal;
    }

    /**
     * @return the entries in a column map sheet
     *
     * @param sheet		column map sheet
     */
    protected static List<MapEntry> readColumnMap(Sheet sheet) {
        List<MapEntry> retVal = new ArrayList<MapEntry>();
        for (int r = 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row != null && ! Double.isNaN(ExcelUtils.numValue(row.getCell(0)))
                    && ! ExcelUtils.stringValue(row.getCell(2)).isEmpty())
                retVal.add(new MapEntry(row, r));
        }
        return retVal;
    }

    /**
     * @return the pool specifications in the pool object sheet, one per data row (NULL for an invalid row)
     *
     * @param sheet		pool object sheet
     * @param result	import result for warnings
     */
    private List<PoolSpec> readPools(Sheet sheet, ImportResult result) {
        List<PoolSpec> retVal = new ArrayList<PoolSpec>();
        for (int r = 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            PoolSpec spec = null;
            if (row != null) {
                String name = ExcelUtils.stringValue(row.getCell(0));
                if (name.isEmpty())
                    name = "Pool " + r;
                try {
                    List<Integer> pooledOnly = this.parseIndices(ExcelUtils.stringValue(row.getCell(1)));
                    List<Integer> independent = this.parseIndices(ExcelUtils.stringValue(row.getCell(2)));
                    if (pooledOnly.isEmpty() && independent.isEmpty())
                        result.addWarning(r + 1, "Pool \"" + name + "\" has no samples and was skipped.");
                    else {
                        spec = new PoolSpec(name, RangeSet.of(pooledOnly), RangeSet.of(independent),
                                ExcelUtils.flagValue(row.getCell(3)));
                        String sdrfValue = ExcelUtils.stringValue(row.getCell(4));
                        if (! sdrfValue.isEmpty())
                            spec.setSdrfValue(sdrfValue);
                    }
                } catch (JsonProcessingException e) {
                    result.addWarning(r + 1, "Pool \"" + name + "\" has an invalid sample list and was skipped.");
                }
            }
            retVal.add(spec);
        }
        return retVal;
    }

    /**
     * @return the sample indices in a JSON list
     *
     * @param json	JSON list string (may be empty)
     *
     * @throws JsonProcessingException if the string is not a valid list of integers
     */
    private List<Integer> parseIndices(String json) throws JsonProcessingException {
        List<Integer> retVal;
        if (StringUtils.isBlank(json))
            retVal = new ArrayList<Integer>();
        else
            retVal = this.mapper.readValue(json, INDEX_LIST);
        return retVal;
    }

    /**
     * Store the explicit pool values from the pool data sheets in the pool specifications.  Row N of each pool
     * data sheet belongs to the pool in row N of the pool object sheet.
     *
     * @param workbook	workbook being imported
     * @param table		target table
     * @param specs		pool specifications, one per pool object row
     * @param loaded	map of exported column IDs to imported columns
     * @param loader	column loader for value conversion
     */
    private void readPoolValues(Workbook workbook, MetadataTable table, List<PoolSpec> specs,
            Map<Long, MetadataColumn> loaded, ColumnLoader loader) {
        Optional<Sheet> poolMap = ExcelUtils.findSheet(workbook, WorkbookExporter.POOL_ID_MAP_SHEET);
        Optional<Sheet> poolMain = ExcelUtils.findSheet(workbook, WorkbookExporter.POOL_MAIN_SHEET);
        Optional<Sheet> poolHidden = ExcelUtils.findSheet(workbook, WorkbookExporter.POOL_HIDDEN_SHEET);
        if (poolMap.isPresent() && (poolMain.isPresent() || poolHidden.isPresent())) {
            for (MapEntry entry : readColumnMap(poolMap.get())) {
                MetadataColumn column = loaded.get(entry.getId());
                if (column == null) {
                    List<MetadataColumn> byName = table.findColumns(entry.getName());
                    column = (byName.isEmpty() ? null : byName.get(0));
                }
                Optional<Sheet> source = (entry.isHidden() ? poolHidden : poolMain);
                if (column != null && source.isPresent() && entry.getIndex() >= 0
                        && ! PoolAggregator.isPooledSampleColumn(column) && ! PoolAggregator.isSourceNameColumn(column)) {
                    List<String> values = ExcelUtils.columnValues(source.get(), entry.getIndex(), specs.size());
                    for (int k = 0; k < specs.size(); k++) {
                        PoolSpec spec = specs.get(k);
                        String value = values.get(k);
                        if (spec != null && ! value.isEmpty())
                            spec.putExplicitValue(column.getId(), loader.convertPoolValue(column, value));
                    }
                }
            }
        }
    }

}
