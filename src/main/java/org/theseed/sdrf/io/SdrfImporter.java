/**
 *
 */
package org.theseed.sdrf.io;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.errors.EmptyDocumentException;
import org.theseed.sdrf.errors.EmptyPoolException;
import org.theseed.sdrf.errors.ValidationFailureException;
import org.theseed.sdrf.matrix.ColumnCategory;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.RangeSet;
import org.theseed.sdrf.pools.PoolAggregator;
import org.theseed.sdrf.pools.PoolSpec;
import org.theseed.sdrf.pools.PoolSynchronizer;
import org.theseed.sdrf.templates.ColumnOrderer;
import org.theseed.sdrf.templates.TemplateMatcher;

/**
 * This object reads an SDRF file into a metadata table.
 *
 * Lines whose pooled-sample cell begins with "SN=" describe reference pools.  They are removed from the sample
 * lines and used to build pool specifications, with the members located by source name.  If there are no
 * such lines, the sample lines whose pooled-sample cell is "pooled" form a single inferred pool.
 *
 * Each header is matched to an existing column of the same name and occurrence number, or else a new column is
 * created (inheriting metadata from a matching template).  The cell values of each column are then compacted
 * into a default value plus modifiers.  Finally, the pools are synchronized and the columns are reordered.
 *
 * @author Bruce Parrello
 *
 */
public class SdrfImporter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SdrfImporter.class);
    /** template matcher for new columns */
    private final TemplateMatcher matcher;
    /** column orderer */
    private final ColumnOrderer orderer;
    /** pool synchronizer */
    private final PoolSynchronizer synchronizer;
    /** cell value converter */
    private final ValueConverter converter;

    /** pooled-sample cell values indicating a sample that is also reported independently */
    private static final Set<String> INDEPENDENT_MARKERS = Set.of("", "not pooled", "independent");

    /**
     * Construct an SDRF importer.
     *
     * @param matcher		template matcher for new columns
     * @param orderer		column orderer
     * @param synchronizer	pool synchronizer
     * @param converter		cell value converter
     */
    public SdrfImporter(TemplateMatcher matcher, ColumnOrderer orderer, PoolSynchronizer synchronizer,
            ValueConverter converter) {
        this.matcher = matcher;
        this.orderer = orderer;
        this.synchronizer = synchronizer;
        this.converter = converter;
    }

    /**
     * Import an SDRF file into a table.
     *
     * @param table		target table
     * @param reader	reader for the SDRF file
     * @param options	import options
     *
     * @return a summary of the import
     *
     * @throws IOException if an input error occurs
     * @throws EmptyDocumentException if the file has no header
     * @throws ValidationFailureException if an imported pool is invalid
     */
    public ImportResult importSdrf(MetadataTable table, Reader reader, ImportOptions options)
            throws IOException, EmptyDocumentException, ValidationFailureException {
        List<List<String>> records = readRecords(reader);
        if (records.isEmpty() || records.get(0).stream().allMatch(x -> StringUtils.isBlank(x)))
            throw new EmptyDocumentException("SDRF input has no header line.");
        return this.importRows(table, records.get(0), records.subList(1, records.size()), options);
    }

    /**
     * @return the records of an SDRF file as lists of strings
     *
     * @param reader	reader for the SDRF file
     *
     * @throws IOException if an input error occurs
     */
    public static List<List<String>> readRecords(Reader reader) throws IOException {
        List<List<String>> retVal = new ArrayList<List<String>>();
        try (CSVParser parser = SdrfExporter.SDRF_FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                List<String> row = new ArrayList<String>(record.size());
                for (String cell : record)
                    row.add(cell);
                retVal.add(row);
            }
        } catch (IllegalStateException e) {
            throw new IOException("Invalid SDRF input: " + e.getMessage(), e);
        }
        return retVal;
    }

    /**
     * Import SDRF header and data lines into a table.
     *
     * @param table		target table
     * @param headers	column headers
     * @param dataRows	data lines
     * @param options	import options
     *
     * @return a summary of the import
     *
     * @throws ValidationFailureException if an imported pool is invalid
     */
    public ImportResult importRows(MetadataTable table, List<String> headers, List<List<String>> dataRows,
            ImportOptions options) throws ValidationFailureException {
        ImportResult retVal = new ImportResult();
        this.synchronizer.attach(table);
        if (options.isReplaceExisting())
            table.clear();
        // Separate the reference pool lines from the sample lines.
        int pooledCol = findHeader(headers, PoolAggregator.POOLED_SAMPLE_KEY);
        int sourceCol = findHeader(headers, ColumnCategory.SOURCE_NAME.getLabel());
        List<List<String>> sampleRows = new ArrayList<List<String>>(dataRows.size());
        List<List<String>> snRows = new ArrayList<List<String>>();
        List<Integer> snLines = new ArrayList<Integer>();
        Set<Integer> pooledSamples = new TreeSet<Integer>();
        for (int i = 0; i < dataRows.size(); i++) {
            List<String> row = dataRows.get(i);
            String poolCell = cell(row, pooledCol);
            if (poolCell.startsWith(PoolAggregator.SN_PREFIX)) {
                snRows.add(row);
                snLines.add(i + 2);
            } else {
                sampleRows.add(row);
                if (poolCell.equalsIgnoreCase(PoolAggregator.POOLED_MARKER))
                    pooledSamples.add(sampleRows.size());
            }
        }
        // Compute the sample count and pad or truncate the sample lines to match.
        int expected = table.getSampleCount();
        if (expected == 0)
            expected = sampleRows.size();
        if (sampleRows.size() > expected) {
            retVal.addWarning(0, (sampleRows.size() - expected) + " sample lines beyond the table's " + expected
                    + " samples were ignored.");
            sampleRows = new ArrayList<List<String>>(sampleRows.subList(0, expected));
            final int limit = expected;
            pooledSamples.removeIf(x -> x > limit);
        }
        while (sampleRows.size() < expected)
            sampleRows.add(new ArrayList<String>());
        table.setSampleCount(expected);
        retVal.setSampleCount(expected);
        // Connect the headers to columns.
        ColumnLoader loader = new ColumnLoader(this.matcher, this.converter);
        List<MetadataColumn> importCols = loader.matchColumns(table, headers, retVal);
        // Store the values.
        for (int j = 0; j < importCols.size(); j++) {
            MetadataColumn column = importCols.get(j);
            if (column != null) {
                List<String> cells = new ArrayList<String>(sampleRows.size());
                for (List<String> row : sampleRows)
                    cells.add(cell(row, j));
                loader.storeValues(column, cells);
            }
        }
        // Build the pools.
        List<PoolSpec> specs = new ArrayList<PoolSpec>();
        if (options.isCreatePools() && pooledCol >= 0) {
            if (! snRows.isEmpty()) {
                for (int k = 0; k < snRows.size(); k++) {
                    PoolSpec spec = this.buildReferencePool(k, snRows.get(k), snLines.get(k), loader, importCols,
                            sampleRows, pooledCol, sourceCol, retVal);
                    if (spec != null)
                        specs.add(spec);
                }
            } else if (! pooledSamples.isEmpty())
                specs.add(new PoolSpec("Pool 1", RangeSet.of(pooledSamples), RangeSet.EMPTY, false));
        }
        if (! specs.isEmpty()) {
            try {
                retVal.setPoolSync(this.synchronizer.syncPoolsWithImport(table, specs));
            } catch (EmptyPoolException e) {
                // Empty specifications are filtered out above.
                throw new ValidationFailureException("Imported pool has no members: " + e.getMessage(), e);
            }
        } else
            this.synchronizer.getAggregator().refreshAll(table);
        retVal.setStrategy(this.orderer.reorder(table, ColumnOrderer.Strategy.AUTO));
        log.info("SDRF import into \"{}\": {} samples, {} columns created, {} updated, {} pools, {} warnings.",
                table.getName(), expected, retVal.getColumnsCreated(), retVal.getColumnsUpdated(), specs.size(),
                retVal.getWarnings().size());
        return retVal;
    }

    /**
     * @return a reference pool specification built from an SN= line, or NULL if no members were found
     *
     * @param k				index of the pool line
     * @param row			pool line
     * @param line			input line number of the pool line
     * @param loader		column loader for value conversion
     * @param importCols	columns corresponding to the headers
     * @param sampleRows	sample data lines
     * @param pooledCol		index of the pooled-sample column
     * @param sourceCol		index of the source name column, or -1 if there is none
     * @param result		import result for warnings
     */
    private PoolSpec buildReferencePool(int k, List<String> row, int line, ColumnLoader loader,
            List<MetadataColumn> importCols,
            List<List<String>> sampleRows, int pooledCol, int sourceCol, ImportResult result) {
        String sdrfValue = cell(row, pooledCol);
        String poolName = cell(row, sourceCol);
        if (poolName.isEmpty())
            poolName = "Pool " + (k + 1);
        Set<Integer> pooledOnly = new TreeSet<Integer>();
        Set<Integer> independent = new TreeSet<Integer>();
        String[] names = StringUtils.split(sdrfValue.substring(PoolAggregator.SN_PREFIX.length()), ',');
        for (String rawName : names) {
            String name = rawName.trim();
            boolean found = false;
            for (int i = 1; i <= sampleRows.size() && sourceCol >= 0; i++) {
                List<String> sampleRow = sampleRows.get(i - 1);
                if (cell(sampleRow, sourceCol).equals(name)) {
                    found = true;
                    String status = cell(sampleRow, pooledCol).toLowerCase();
                    if (INDEPENDENT_MARKERS.contains(status))
                        independent.add(i);
                    else
                        pooledOnly.add(i);
                }
            }
            if (! found && ! name.isEmpty())
                result.addWarning(line, "Source name \"" + name + "\" in pool \"" + poolName + "\" does not match any sample.");
        }
        PoolSpec retVal = null;
        if (pooledOnly.isEmpty() && independent.isEmpty())
            result.addWarning(line, "Pool \"" + poolName + "\" has no matching samples and was skipped.");
        else {
            retVal = new PoolSpec(poolName, RangeSet.of(pooledOnly), RangeSet.of(independent), true);
            retVal.setSdrfValue(sdrfValue);
            for (int j = 0; j < importCols.size(); j++) {
                MetadataColumn column = importCols.get(j);
                String value = cell(row, j);
                if (column != null && j != pooledCol && j != sourceCol && ! value.isEmpty())
                    retVal.putExplicitValue(column.getId(), loader.convertPoolValue(column, value));
            }
        }
        return retVal;
    }

    /**
     * @return the index of the first header containing the specified normalized text, or -1 if there is none
     *
     * @param headers	list of headers
     * @param fragment	normalized text to look for
     */
    private static int findHeader(List<String> headers, String fragment) {
        int retVal = -1;
        for (int j = 0; j < headers.size() && retVal < 0; j++) {
            if (ColumnCategory.normalize(headers.get(j)).contains(fragment))
                retVal = j;
        }
        return retVal;
    }

    /**
     * @return the trimmed value of a cell, or an empty string if the cell does not exist
     *
     * @param row	data line
     * @param j		column index (may be negative)
     */
    private static String cell(List<String> row, int j) {
        String retVal = "";
        if (j >= 0 && j < row.size())
            retVal = StringUtils.trimToEmpty(row.get(j));
        return retVal;
    }

}
