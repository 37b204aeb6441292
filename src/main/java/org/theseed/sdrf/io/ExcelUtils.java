/**
 *
 */
package org.theseed.sdrf.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

/**
 * This is a simple static class that contains useful Excel functions for the workbook codec.
 *
 * @author Bruce Parrello
 *
 */
public class ExcelUtils {

    /** prefixes of the legend lines at the bottom of a data sheet */
    public static final String[] LEGEND_MARKERS = new String[] { "Note:", "[*]", "[**]", "[***]" };

    /**
     * @return the string in a cell, or an empty string if it has none
     *
     * @param cell	spreadsheet cell to examine
     */
    public static String stringValue(Cell cell) {
        String retVal = "";
        if (cell != null) {
            switch (cell.getCellType()) {
            case STRING :
            case FORMULA :
                retVal = StringUtils.trim(cell.getStringCellValue());
                break;
            case NUMERIC :
                double value = cell.getNumericCellValue();
                if (value == Math.rint(value) && Math.abs(value) < 1e15)
                    retVal = Long.toString((long) value);
                else
                    retVal = Double.toString(value);
                break;
            case BOOLEAN :
                retVal = Boolean.toString(cell.getBooleanCellValue()).toUpperCase();
                break;
            default:
                break;
            }
        }
        return retVal;
    }

    /**
     * @return the number in a cell, or NaN if it has none
     *
     * @param cell	spreadsheet cell to examine
     */
    public static double numValue(Cell cell) {
        double retVal = Double.NaN;
        if (cell != null) {
            switch (cell.getCellType()) {
            case NUMERIC :
                retVal = cell.getNumericCellValue();
                break;
            case STRING :
                String string = StringUtils.trim(cell.getStringCellValue());
                try {
                    retVal = Double.parseDouble(string);
                } catch (NumberFormatException e) {
                    retVal = Double.NaN;
                }
                break;
            default:
                break;
            }
        }
        return retVal;
    }

    /**
     * @return TRUE if a cell contains a true boolean or a string beginning with "T" or "Y"
     *
     * @param cell	spreadsheet cell to examine
     */
    public static boolean flagValue(Cell cell) {
        boolean retVal = false;
        if (cell != null) {
            switch (cell.getCellType()) {
            case BOOLEAN :
                retVal = cell.getBooleanCellValue();
                break;
            default:
                retVal = StringUtils.startsWithAny(stringValue(cell).toUpperCase(), "T", "Y", "1");
            }
        }
        return retVal;
    }

    /**
     * @return the cell in the specified row and column
     *
     * @param sheet		worksheet containing the cell
     * @param row		row index (0-based)
     * @param col		column index (0-based)
     */
    public static Cell getCell(Sheet sheet, int row, int col) {
        Cell retVal = null;
        Row rowObject = sheet.getRow(row);
        if (rowObject != null)
            retVal = rowObject.getCell(col);
        return retVal;
    }

    /**
     * @return the named sheet of a workbook, or an empty result if there is no such sheet
     *
     * @param workbook	workbook to search
     * @param name		name of the desired sheet
     */
    public static Optional<Sheet> findSheet(Workbook workbook, String name) {
        return Optional.ofNullable(workbook.getSheet(name));
    }

    /**
     * @return TRUE if the specified row is a legend line
     *
     * @param row	row to check (may be NULL)
     */
    public static boolean isLegendRow(Row row) {
        boolean retVal = false;
        if (row != null) {
            String value = stringValue(row.getCell(0));
            retVal = StringUtils.startsWithAny(value, LEGEND_MARKERS);
        }
        return retVal;
    }

    /**
     * Compute the number of data rows in a sheet.  The data rows follow the header row and end at the first
     * legend line.  Blank rows at the end of the data are not counted.
     *
     * @param sheet		sheet to examine
     * @param width		number of columns to examine for blank-row detection
     *
     * @return the number of data rows
     */
    public static int countDataRows(Sheet sheet, int width) {
        int end = 1;
        int last = sheet.getLastRowNum();
        while (end <= last && ! isLegendRow(sheet.getRow(end)))
            end++;
        // Back up over blank rows.
        int retVal = end - 1;
        while (retVal > 0 && isBlankRow(sheet.getRow(retVal), width))
            retVal--;
        return retVal;
    }

    /**
     * @return TRUE if the specified row has no non-blank cells in the first N columns
     *
     * @param row		row to check (may be NULL)
     * @param width		number of columns to check
     */
    public static boolean isBlankRow(Row row, int width) {
        boolean retVal = true;
        if (row != null) {
            for (int j = 0; j < width && retVal; j++)
                retVal = stringValue(row.getCell(j)).isEmpty();
        }
        return retVal;
    }

    /**
     * @return the strings in a column of a sheet, for the specified data rows
     *
     * @param sheet		sheet to read
     * @param col		column index (0-based)
     * @param count		number of data rows (beginning with row 1)
     */
    public static List<String> columnValues(Sheet sheet, int col, int count) {
        List<String> retVal = new ArrayList<String>(count);
        for (int i = 1; i <= count; i++)
            retVal.add(stringValue(getCell(sheet, i, col)));
        return retVal;
    }

    /**
     * Store a string in the specified cell of a row.
     *
     * @param row		spreadsheet row to update
     * @param idx		column index
     * @param val		string to store
     * @param style		style for the cell, or NULL for the default
     */
    public static void store(Row row, int idx, String val, CellStyle style) {
        Cell cell = row.createCell(idx);
        cell.setCellValue(val);
        if (style != null)
            cell.setCellStyle(style);
    }

    /**
     * Store a number in the specified cell of a row.
     *
     * @param row	spreadsheet row to update
     * @param idx	column index
     * @param val	number to store
     */
    public static void store(Row row, int idx, double val) {
        Cell cell = row.createCell(idx);
        cell.setCellValue(val);
    }

}
