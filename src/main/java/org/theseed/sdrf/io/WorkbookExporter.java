/**
 *
 */
package org.theseed.sdrf.io;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataValidation;
import org.apache.poi.ss.usermodel.DataValidationConstraint;
import org.apache.poi.ss.usermodel.DataValidationHelper;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.ss.util.CellRangeAddressList;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.matrix.ColumnCategory;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.SamplePool;
import org.theseed.sdrf.pools.PoolAggregator;
import org.theseed.sdrf.service.FavouriteOption;
import org.theseed.sdrf.service.FavouriteSource;
import org.theseed.sdrf.service.FavouriteTier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * This object writes a metadata table as an Excel workbook.  The visible columns go in the "main" sheet and the
 * hidden columns in the "hidden" sheet, each with a header row followed by one row per sample.  The
 * "id_metadata_column_map" sheet records the identity of each column so the workbook can be imported again.
 * If the table has pools, four more sheets describe them:  "pool_main" and "pool_hidden" hold one row of
 * pool-level values per pool, "pool_id_metadata_column_map" maps the pool sheet columns, and "pool_object_map"
 * holds the pool names and membership lists.
 *
 * Each data column gets a dropdown list of suggested values, and the main sheet ends with a legend explaining
 * the favourite markers.
 *
 * @author Bruce Parrello
 *
 */
public class WorkbookExporter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(WorkbookExporter.class);
    /** aggregator for pool values */
    private final PoolAggregator aggregator;
    /** source of favourite options for dropdown lists (may be NULL) */
    private final FavouriteSource favourites;
    /** JSON mapper for sample index lists */
    private final ObjectMapper mapper;

    /** names of the workbook sheets */
    public static final String MAIN_SHEET = "main";
    public static final String HIDDEN_SHEET = "hidden";
    public static final String ID_MAP_SHEET = "id_metadata_column_map";
    public static final String POOL_MAIN_SHEET = "pool_main";
    public static final String POOL_HIDDEN_SHEET = "pool_hidden";
    public static final String POOL_ID_MAP_SHEET = "pool_id_metadata_column_map";
    public static final String POOL_OBJECT_SHEET = "pool_object_map";

    /** headers of the column map sheets */
    public static final String[] ID_MAP_HEADERS = new String[] { "id", "column", "name", "type", "hidden", "position" };
    /** headers of the pool object sheet */
    public static final String[] POOL_OBJECT_HEADERS = new String[] { "pool_name", "pooled_only_samples",
            "pooled_and_independent_samples", "is_reference", "sdrf_value" };

    /** legend lines at the bottom of the main sheet */
    public static final String[] LEGEND = new String[] {
            "Note: Empty cells will be filled with 'not applicable' or 'not available' when submitted.",
            "[*] User-specific favourite options.",
            "[**] Lab group-recommended options.",
            "[***] Global recommendations." };

    /** inner column names whose dropdown lists begin with "not applicable" */
    public static final Set<String> REQUIRED_NAMES = Set.of("tissue", "organism part", "disease", "species");

    /** maximum length of an explicit dropdown list */
    public static final int MAX_LIST_LENGTH = 255;

    /** maximum column width in characters */
    private static final int MAX_WIDTH = 80;

    /**
     * Construct a workbook exporter.
     *
     * @param aggregator	aggregator for pool values
     * @param favourites	source of favourite options, or NULL if there are none
     */
    public WorkbookExporter(PoolAggregator aggregator, FavouriteSource favourites) {
        this.aggregator = aggregator;
        this.favourites = favourites;
        this.mapper = new ObjectMapper();
    }

    /**
     * Write a table to an output stream as a workbook.  The stream is not closed.
     *
     * @param table		table to export
     * @param outStream	output stream
     *
     * @throws IOException if an output error occurs
     */
    public void export(MetadataTable table, OutputStream outStream) throws IOException {
        try (Workbook workbook = this.createWorkbook(table)) {
            workbook.write(outStream);
        }
        outStream.flush();
        log.debug("Workbook written for table \"{}\".", table.getName());
    }

    /**
     * @return a workbook containing the specified table
     *
     * @param table		table to export
     *
     * @throws IOException if a pool membership list cannot be encoded
     */
    public Workbook createWorkbook(MetadataTable table) throws IOException {
        Workbook retVal = new XSSFWorkbook();
        CellStyle headStyle = retVal.createCellStyle();
        headStyle.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        headStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        List<MetadataColumn> visible = table.getVisibleColumns();
        List<MetadataColumn> hidden = table.getHiddenColumns();
        int nSamples = table.getSampleCount();
        // Build the sample sheets.
        Sheet mainSheet = retVal.createSheet(MAIN_SHEET);
        this.fillSampleSheet(mainSheet, table, visible, headStyle);
        this.addLegend(mainSheet, nSamples, visible.size());
        Sheet hiddenSheet = retVal.createSheet(HIDDEN_SHEET);
        this.fillSampleSheet(hiddenSheet, table, hidden, headStyle);
        this.fillIdMap(retVal.createSheet(ID_MAP_SHEET), visible, hidden, headStyle);
        // Build the pool sheets.
        List<SamplePool> pools = table.getPools();
        if (! pools.isEmpty()) {
            this.fillPoolSheet(retVal.createSheet(POOL_MAIN_SHEET), table, visible, pools, headStyle);
            this.fillPoolSheet(retVal.createSheet(POOL_HIDDEN_SHEET), table, hidden, pools, headStyle);
            this.fillIdMap(retVal.createSheet(POOL_ID_MAP_SHEET), visible, hidden, headStyle);
            this.fillPoolObjects(retVal.createSheet(POOL_OBJECT_SHEET), pools, headStyle);
        }
        log.info("Workbook built for table \"{}\": {} samples, {} visible and {} hidden columns, {} pools.",
                table.getName(), nSamples, visible.size(), hidden.size(), pools.size());
        return retVal;
    }

    /**
     * Fill a sheet with the header and sample rows for a set of columns.
     *
     * @param sheet		target sheet
     * @param table		source table
     * @param cols		columns to put in the sheet
     * @param headStyle	style for header cells
     */
    private void fillSampleSheet(Sheet sheet, MetadataTable table, List<MetadataColumn> cols, CellStyle headStyle) {
        int[] widths = this.writeHeader(sheet, cols, headStyle);
        for (int i = 1; i <= table.getSampleCount(); i++) {
            Row row = sheet.createRow(i);
            int j = 0;
            for (Pair<String, String> cell : table.resolveRow(i, cols)) {
                ExcelUtils.store(row, j, cell.getValue(), null);
                widths[j] = Math.max(widths[j], cell.getValue().length());
                j++;
            }
        }
        this.finishSheet(sheet, cols, widths, table.getSampleCount());
    }

    /**
     * Fill a pool sheet with one row of pool-level values per pool.
     *
     * @param sheet		target sheet
     * @param table		source table
     * @param cols		columns to put in the sheet
     * @param pools		pools to write
     * @param headStyle	style for header cells
     */
    private void fillPoolSheet(Sheet sheet, MetadataTable table, List<MetadataColumn> cols, List<SamplePool> pools,
            CellStyle headStyle) {
        int[] widths = this.writeHeader(sheet, cols, headStyle);
        int r = 1;
        for (SamplePool pool : pools) {
            Row row = sheet.createRow(r);
            for (int j = 0; j < cols.size(); j++) {
                String value = this.aggregator.storedValue(table, cols.get(j), pool);
                ExcelUtils.store(row, j, value, null);
                widths[j] = Math.max(widths[j], value.length());
            }
            r++;
        }
        this.finishSheet(sheet, cols, widths, pools.size());
    }

    /**
     * Write the header row of a data sheet.
     *
     * @param sheet		target sheet
     * @param cols		columns in the sheet
     * @param headStyle	style for header cells
     *
     * @return an array of the column widths so far
     */
    private int[] writeHeader(Sheet sheet, List<MetadataColumn> cols, CellStyle headStyle) {
        int[] retVal = new int[cols.size()];
        Row row = sheet.createRow(0);
        for (int j = 0; j < cols.size(); j++) {
            String name = cols.get(j).getName();
            ExcelUtils.store(row, j, name, headStyle);
            retVal[j] = name.length();
        }
        return retVal;
    }

    /**
     * Set the column widths, freeze the header, and add the dropdown lists to a data sheet.
     *
     * @param sheet		target sheet
     * @param cols		columns in the sheet
     * @param widths	maximum content width of each column
     * @param nRows		number of data rows
     */
    private void finishSheet(Sheet sheet, List<MetadataColumn> cols, int[] widths, int nRows) {
        for (int j = 0; j < widths.length; j++)
            sheet.setColumnWidth(j, Math.min(widths[j] + 2, MAX_WIDTH) * 256);
        sheet.createFreezePane(0, 1);
        if (nRows > 0) {
            DataValidationHelper helper = sheet.getDataValidationHelper();
            for (int j = 0; j < cols.size(); j++) {
                List<String> options = this.dropdownOptions(cols.get(j).getName());
                DataValidationConstraint constraint = helper.createExplicitListConstraint(options.toArray(new String[0]));
                DataValidation validation = helper.createValidation(constraint, new CellRangeAddressList(1, nRows, j, j));
                validation.setSuppressDropDownArrow(true);
                validation.setShowErrorBox(false);
                sheet.addValidationData(validation);
            }
        }
    }

    /**
     * @return the dropdown options for a column
     *
     * @param columnName	name of the column
     */
    public List<String> dropdownOptions(String columnName) {
        List<String> retVal = new ArrayList<String>();
        String inner = ColumnCategory.innerName(columnName);
        if (REQUIRED_NAMES.contains(inner))
            retVal.add(MetadataColumn.NOT_APPLICABLE);
        else
            retVal.add(MetadataColumn.NOT_AVAILABLE);
        int length = retVal.get(0).length();
        if (this.favourites != null) {
            for (FavouriteTier tier : FavouriteTier.values()) {
                for (FavouriteOption option : this.favourites.getOptions(columnName, tier)) {
                    String choice = option.toChoice();
                    // Explicit list entries cannot contain commas, and the whole list has a length limit.
                    if (! StringUtils.contains(choice, ',') && length + 1 + choice.length() <= MAX_LIST_LENGTH) {
                        retVal.add(choice);
                        length += 1 + choice.length();
                    }
                }
            }
        }
        return retVal;
    }

    /**
     * Add the legend lines below the data in a sheet.
     *
     * @param sheet		target sheet
     * @param nSamples	number of data rows
     * @param width		number of data columns
     */
    private void addLegend(Sheet sheet, int nSamples, int width) {
        int r = nSamples + 1;
        for (String line : LEGEND) {
            Row row = sheet.createRow(r);
            ExcelUtils.store(row, 0, line, null);
            if (width > 1)
                sheet.addMergedRegion(new CellRangeAddress(r, r, 0, width - 1));
            r++;
        }
    }

    /**
     * Fill a column map sheet.  Each column's "column" entry is its index in its own sheet.
     *
     * @param sheet		target sheet
     * @param visible	visible columns
     * @param hidden	hidden columns
     * @param headStyle	style for header cells
     */
    private void fillIdMap(Sheet sheet, List<MetadataColumn> visible, List<MetadataColumn> hidden, CellStyle headStyle) {
        Row row = sheet.createRow(0);
        for (int j = 0; j < ID_MAP_HEADERS.length; j++)
            ExcelUtils.store(row, j, ID_MAP_HEADERS[j], headStyle);
        int r = 1;
        for (List<MetadataColumn> cols : List.of(visible, hidden)) {
            for (int j = 0; j < cols.size(); j++) {
                MetadataColumn column = cols.get(j);
                row = sheet.createRow(r);
                ExcelUtils.store(row, 0, (double) column.getId());
                ExcelUtils.store(row, 1, (double) j);
                ExcelUtils.store(row, 2, column.getName(), null);
                ExcelUtils.store(row, 3, column.getCategory().getLabel(), null);
                row.createCell(4).setCellValue(column.isHidden());
                ExcelUtils.store(row, 5, (double) column.getPosition());
                r++;
            }
        }
    }

    /**
     * Fill the pool object sheet.
     *
     * @param sheet		target sheet
     * @param pools		pools to describe
     * @param headStyle	style for header cells
     *
     * @throws JsonProcessingException if a membership list cannot be encoded
     */
    private void fillPoolObjects(Sheet sheet, List<SamplePool> pools, CellStyle headStyle) throws JsonProcessingException {
        Row row = sheet.createRow(0);
        for (int j = 0; j < POOL_OBJECT_HEADERS.length; j++)
            ExcelUtils.store(row, j, POOL_OBJECT_HEADERS[j], headStyle);
        int r = 1;
        for (SamplePool pool : pools) {
            row = sheet.createRow(r);
            ExcelUtils.store(row, 0, pool.getName(), null);
            ExcelUtils.store(row, 1, this.mapper.writeValueAsString(pool.getPooledOnly().toList()), null);
            ExcelUtils.store(row, 2, this.mapper.writeValueAsString(pool.getPooledAndIndependent().toList()), null);
            row.createCell(3).setCellValue(pool.isReference());
            ExcelUtils.store(row, 4, StringUtils.defaultString(pool.getSdrfValue()), null);
            r++;
        }
    }

}
