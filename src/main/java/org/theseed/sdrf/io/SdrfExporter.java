/**
 *
 */
package org.theseed.sdrf.io;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.SamplePool;
import org.theseed.sdrf.pools.PoolAggregator;

/**
 * This object writes a metadata table in SDRF format.  The output has a header line of visible column names
 * followed by one line per sample.  If pools are included, each reference pool adds a line at the end whose
 * pooled-sample cell holds the pool's "SN=" encoding and whose source name cell holds the pool name.
 *
 * @author Bruce Parrello
 *
 */
public class SdrfExporter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SdrfExporter.class);
    /** aggregator for pool values */
    private final PoolAggregator aggregator;

    /** SDRF file format:  tab-delimited, unquoted, newline-terminated */
    public static final CSVFormat SDRF_FORMAT = CSVFormat.TDF.builder().setQuote(null).setRecordSeparator("\n")
            .setIgnoreEmptyLines(true).build();

    /**
     * Construct an SDRF exporter.
     *
     * @param aggregator	aggregator for pool values
     */
    public SdrfExporter(PoolAggregator aggregator) {
        this.aggregator = aggregator;
    }

    /**
     * Write a table in SDRF format.  The writer is flushed but not closed.
     *
     * @param table			table to export
     * @param writer		output writer
     * @param includePools	TRUE to append a line for each reference pool
     * @param columnFilter	IDs of the columns to export, or NULL for all visible columns
     *
     * @return the number of data lines written
     *
     * @throws IOException if an output error occurs
     */
    public int export(MetadataTable table, Writer writer, boolean includePools, Collection<Long> columnFilter)
            throws IOException {
        List<List<String>> rows = this.toRows(table, includePools, columnFilter);
        CSVPrinter printer = new CSVPrinter(writer, SDRF_FORMAT);
        for (List<String> row : rows)
            printer.printRecord(row);
        printer.flush();
        log.debug("{} SDRF lines written for table \"{}\".", rows.size() - 1, table.getName());
        return rows.size() - 1;
    }

    /**
     * @return a table in SDRF format as a string
     *
     * @param table			table to export
     * @param includePools	TRUE to append a line for each reference pool
     *
     * @throws IOException if an output error occurs
     */
    public String exportToString(MetadataTable table, boolean includePools) throws IOException {
        StringWriter retVal = new StringWriter();
        this.export(table, retVal, includePools, null);
        return retVal.toString();
    }

    /**
     * @return the SDRF cells for a table, beginning with the header line
     *
     * @param table			table to export
     * @param includePools	TRUE to append a line for each reference pool
     * @param columnFilter	IDs of the columns to export, or NULL for all visible columns
     */
    public List<List<String>> toRows(MetadataTable table, boolean includePools, Collection<Long> columnFilter) {
        List<MetadataColumn> cols = table.getVisibleColumns();
        if (columnFilter != null)
            cols.removeIf(x -> ! columnFilter.contains(x.getId()));
        List<List<String>> retVal = new ArrayList<List<String>>(table.getSampleCount() + 1);
        List<String> header = new ArrayList<String>(cols.size());
        for (MetadataColumn column : cols)
            header.add(column.getName());
        retVal.add(header);
        for (int i = 1; i <= table.getSampleCount(); i++) {
            List<String> row = new ArrayList<String>(cols.size());
            for (Pair<String, String> cell : table.resolveRow(i, cols))
                row.add(cell.getValue());
            retVal.add(row);
        }
        if (includePools) {
            boolean hasPoolColumn = cols.stream().anyMatch(x -> PoolAggregator.isPooledSampleColumn(x));
            for (SamplePool pool : table.getPools()) {
                if (pool.isReference()) {
                    if (! hasPoolColumn)
                        log.warn("Pool \"{}\" not exported because there is no pooled-sample column.", pool.getName());
                    else {
                        List<String> row = new ArrayList<String>(cols.size());
                        for (MetadataColumn column : cols)
                            row.add(this.aggregator.storedValue(table, column, pool));
                        retVal.add(row);
                    }
                }
            }
        }
        return retVal;
    }

}
