/**
 *
 */
package org.theseed.sdrf.io;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.theseed.sdrf.matrix.ColumnCategory;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.ValueCompactor;
import org.theseed.sdrf.templates.TemplateMatcher;

/**
 * This object connects imported column headers to the columns of a table and loads the imported cell values
 * into them.  It is shared by the SDRF and workbook importers.
 *
 * A header is connected to the existing column with the same name and occurrence number (so the second
 * "comment[modification parameters]" header goes to the second such column).  If there is no such column,
 * a new one is created at the header's position using the template matcher.  Columns created this way
 * do not take the template default, since their values come only from the imported cells.
 *
 * @author Bruce Parrello
 *
 */
public class ColumnLoader {

    // FIELDS
    /** template matcher for new columns */
    private final TemplateMatcher matcher;
    /** cell value converter */
    private final ValueConverter converter;
    /** number of times each normalized header has been seen */
    private final Map<String, Integer> usage;

    /**
     * Construct a column loader for a single import.
     *
     * @param matcher		template matcher for new columns
     * @param converter		cell value converter
     */
    public ColumnLoader(TemplateMatcher matcher, ValueConverter converter) {
        this.matcher = matcher;
        this.converter = converter;
        this.usage = new HashMap<String, Integer>();
    }

    /**
     * @return the column for the next header with the specified name, creating it if necessary
     *
     * @param table		target table
     * @param header	column header
     * @param position	position for a new column
     * @param result	import result to update
     */
    public MetadataColumn findOrCreate(MetadataTable table, String header, int position, ImportResult result) {
        int occurrence = this.usage.merge(ColumnCategory.normalize(header), 1, Integer::sum) - 1;
        List<MetadataColumn> existing = table.findColumns(header);
        MetadataColumn retVal;
        if (occurrence < existing.size()) {
            retVal = existing.get(occurrence);
            result.countUpdated(retVal);
        } else {
            retVal = this.matcher.addImportedColumn(table, header, position);
            result.countCreated();
        }
        return retVal;
    }

    /**
     * @return the columns corresponding to a list of headers (NULL for a blank header)
     *
     * @param table		target table
     * @param headers	column headers
     * @param result	import result to update
     */
    public List<MetadataColumn> matchColumns(MetadataTable table, List<String> headers, ImportResult result) {
        List<MetadataColumn> retVal = new ArrayList<MetadataColumn>(headers.size());
        for (int j = 0; j < headers.size(); j++) {
            String header = StringUtils.trimToEmpty(headers.get(j));
            if (header.isEmpty()) {
                result.addWarning(1, "Column " + (j + 1) + " has no header and was skipped.");
                retVal.add(null);
            } else
                retVal.add(this.findOrCreate(table, header, j, result));
        }
        return retVal;
    }

    /**
     * Compute the default value and modifiers of a column from its cells.  Empty cells are skipped.  A
     * "not applicable" cell sets the column's not-applicable flag and is otherwise skipped.
     *
     * @param column	column to update
     * @param cells		cell values, one per sample in index order
     */
    public void storeValues(MetadataColumn column, List<String> cells) {
        Map<Integer, String> valueMap = new HashMap<Integer, String>();
        for (int i = 1; i <= cells.size(); i++) {
            String value = StringUtils.trimToEmpty(cells.get(i - 1));
            if (value.equalsIgnoreCase(MetadataColumn.NOT_APPLICABLE))
                column.setNotApplicable(true);
            else if (! value.isEmpty())
                valueMap.put(i, this.converter.convert(column, value));
        }
        column.applyCompaction(ValueCompactor.compact(valueMap));
    }

    /**
     * @return the converted form of a pool-level cell value ("not applicable" is kept as is)
     *
     * @param column	column containing the value
     * @param value		raw cell value
     */
    public String convertPoolValue(MetadataColumn column, String value) {
        String retVal = value;
        if (! value.equalsIgnoreCase(MetadataColumn.NOT_APPLICABLE))
            retVal = this.converter.convert(column, value);
        return retVal;
    }

}
