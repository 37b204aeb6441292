/**
 *
 */
package org.theseed.sdrf.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.util.List;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.theseed.sdrf.errors.MissingRequiredSheetException;
import org.theseed.sdrf.errors.SdrfException;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.RangeSet;
import org.theseed.sdrf.matrix.SamplePool;
import org.theseed.sdrf.pools.PoolAggregator;
import org.theseed.sdrf.pools.PoolSynchronizer;
import org.theseed.sdrf.service.FavouriteList;
import org.theseed.sdrf.service.OntologyLookup;
import org.theseed.sdrf.templates.ColumnOrderer;
import org.theseed.sdrf.templates.TemplateMatcher;
import org.theseed.sdrf.templates.TemplateRegistry;

/**
 * Tests for workbook export and import.
 *
 * @author Bruce Parrello
 *
 */
public class WorkbookTest {

    private TemplateMatcher matcher;
    private PoolSynchronizer synchronizer;
    private SdrfImporter sdrfImporter;
    private WorkbookExporter exporter;
    private WorkbookImporter importer;
    private FavouriteList favourites;

    @BeforeEach
    public void setup() throws IOException {
        TemplateRegistry registry = TemplateRegistry.loadDefault();
        PoolAggregator aggregator = new PoolAggregator();
        this.matcher = new TemplateMatcher(registry);
        this.synchronizer = new PoolSynchronizer(aggregator);
        this.favourites = FavouriteList.load(new File("data", "favourites.tsv"));
        ValueConverter converter = new ValueConverter(this.favourites, OntologyLookup.NONE);
        this.sdrfImporter = new SdrfImporter(this.matcher, new ColumnOrderer(registry), this.synchronizer, converter);
        this.exporter = new WorkbookExporter(aggregator, this.favourites);
        this.importer = new WorkbookImporter(this.matcher, this.synchronizer, converter);
    }

    /**
     * @return a table loaded from the pool test file, with the assay name column hidden
     */
    private MetadataTable loadPoolTable() throws IOException, SdrfException {
        MetadataTable retVal = new MetadataTable(1, "pools", 0);
        try (Reader reader = Files.newBufferedReader(new File("data", "pools.sdrf.tsv").toPath())) {
            this.sdrfImporter.importSdrf(retVal, reader, new ImportOptions());
        }
        retVal.findColumns("assay name").get(0).setHidden(true);
        return retVal;
    }

    @Test
    public void testWorkbookLayout() throws IOException, SdrfException {
        MetadataTable table = this.loadPoolTable();
        try (Workbook workbook = this.exporter.createWorkbook(table)) {
            assertThat(workbook.getNumberOfSheets(), equalTo(7));
            Sheet main = workbook.getSheet(WorkbookExporter.MAIN_SHEET);
            Row header = main.getRow(0);
            assertThat(ExcelUtils.stringValue(header.getCell(0)), equalTo("source name"));
            assertThat(ExcelUtils.stringValue(header.getCell(3)), equalTo("characteristics[pooled sample]"));
            assertThat(header.getLastCellNum(), equalTo((short) 4));
            assertThat(ExcelUtils.stringValue(main.getRow(2).getCell(2)), equalTo("cancer"));
            assertThat(ExcelUtils.isLegendRow(main.getRow(5)), equalTo(true));
            assertThat(ExcelUtils.stringValue(main.getRow(8).getCell(0)), startsWith("[***]"));
            assertThat(ExcelUtils.countDataRows(main, 4), equalTo(4));
            Sheet hidden = workbook.getSheet(WorkbookExporter.HIDDEN_SHEET);
            assertThat(ExcelUtils.stringValue(hidden.getRow(0).getCell(0)), equalTo("assay name"));
            assertThat(ExcelUtils.stringValue(hidden.getRow(4).getCell(0)), equalTo("run 4"));
            Sheet idMap = workbook.getSheet(WorkbookExporter.ID_MAP_SHEET);
            assertThat(idMap.getLastRowNum(), equalTo(5));
            assertThat(ExcelUtils.stringValue(idMap.getRow(5).getCell(2)), equalTo("assay name"));
            assertThat(ExcelUtils.numValue(idMap.getRow(5).getCell(1)), equalTo(0.0));
            assertThat(ExcelUtils.flagValue(idMap.getRow(5).getCell(4)), equalTo(true));
            Sheet poolObjects = workbook.getSheet(WorkbookExporter.POOL_OBJECT_SHEET);
            Row poolRow = poolObjects.getRow(1);
            assertThat(ExcelUtils.stringValue(poolRow.getCell(0)), equalTo("P1"));
            assertThat(ExcelUtils.stringValue(poolRow.getCell(1)), equalTo("[2,3]"));
            assertThat(ExcelUtils.stringValue(poolRow.getCell(2)), equalTo("[1]"));
            assertThat(ExcelUtils.stringValue(poolRow.getCell(4)), equalTo("SN=S1,S2,S3"));
            Sheet poolHidden = workbook.getSheet(WorkbookExporter.POOL_HIDDEN_SHEET);
            assertThat(ExcelUtils.stringValue(poolHidden.getRow(1).getCell(0)), equalTo("run 5"));
        }
    }

    @Test
    public void testDropdownOptions() {
        List<String> organism = this.exporter.dropdownOptions("characteristics[organism]");
        assertThat(organism, contains("not available", "[101] Human[*]", "[102] Mouse[**]", "[103] Rat[***]"));
        List<String> disease = this.exporter.dropdownOptions("characteristics[disease]");
        assertThat(disease, contains("not applicable", "[201] Healthy[*]"));
        List<String> label = this.exporter.dropdownOptions("comment[label]");
        assertThat(label, contains("not available"));
        WorkbookExporter plain = new WorkbookExporter(new PoolAggregator(), null);
        assertThat(plain.dropdownOptions("characteristics[organism part]"), contains("not applicable"));
    }

    @Test
    public void testRoundTrip() throws IOException, SdrfException {
        MetadataTable table = this.loadPoolTable();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        this.exporter.export(table, buffer);
        MetadataTable copy = new MetadataTable(2, "copy", 0);
        ImportResult result = this.importer.importWorkbook(copy, new ByteArrayInputStream(buffer.toByteArray()),
                new ImportOptions());
        assertThat(result.getSampleCount(), equalTo(4));
        assertThat(result.getColumnsCreated(), equalTo(5));
        assertThat(result.getWarnings(), empty());
        assertThat(result.getPoolSync().getCreated(), equalTo(1));
        for (int i = 1; i <= 4; i++)
            assertThat(copy.resolveRow(i), equalTo(table.resolveRow(i)));
        MetadataColumn assay = copy.findColumns("assay name").get(0);
        assertThat(assay.isHidden(), equalTo(true));
        assertThat(assay.getPosition(), equalTo(4));
        assertThat(assay.resolve(2), equalTo("run 2"));
        SamplePool pool = copy.findPool("P1");
        assertThat(pool.isReference(), equalTo(true));
        assertThat(pool.getPooledOnly(), equalTo(RangeSet.of(2, 3)));
        assertThat(pool.getPooledAndIndependent(), equalTo(RangeSet.of(1)));
        assertThat(pool.getDerivedColumn(assay).getValue(), equalTo("run 5"));
        MetadataColumn disease = copy.findColumns("characteristics[disease]").get(0);
        assertThat(pool.getDerivedColumn(disease).getValue(), equalTo("cancer"));
        // A second import into the same table updates every column.
        result = this.importer.importWorkbook(copy, new ByteArrayInputStream(buffer.toByteArray()),
                new ImportOptions());
        assertThat(result.getColumnsCreated(), equalTo(0));
        assertThat(result.getColumnsUpdated(), equalTo(5));
        assertThat(result.getPoolSync().getUpdated(), equalTo(1));
        assertThat(copy.getPools().size(), equalTo(1));
        // A larger table keeps its sample count.
        MetadataTable larger = new MetadataTable(3, "larger", 6);
        result = this.importer.importWorkbook(larger, new ByteArrayInputStream(buffer.toByteArray()),
                new ImportOptions().setReplaceExisting(true));
        assertThat(result.getSampleCount(), equalTo(6));
        assertThat(larger.getSampleCount(), equalTo(6));
        assertThat(larger.findColumns("assay name").get(0).resolve(4), equalTo("run 4"));
    }

    @Test
    public void testFavouriteCells() throws IOException, SdrfException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet main = workbook.createSheet(WorkbookExporter.MAIN_SHEET);
            String[][] cells = new String[][] { { "source name", "characteristics[organism]" },
                    { "A", "[101] Human[*]" }, { "B", "[103] Rat[***]" }, { "C", "[999] Unknown[**]" },
                    { "", "" }, { WorkbookExporter.LEGEND[0], "" } };
            for (int r = 0; r < cells.length; r++) {
                Row row = main.createRow(r);
                for (int j = 0; j < cells[r].length; j++)
                    ExcelUtils.store(row, j, cells[r][j], null);
            }
            Sheet idMap = workbook.createSheet(WorkbookExporter.ID_MAP_SHEET);
            ExcelUtils.store(idMap.createRow(0), 0, "id", null);
            for (int j = 0; j < 2; j++) {
                Row row = idMap.createRow(j + 1);
                ExcelUtils.store(row, 0, (double) (j + 10));
                ExcelUtils.store(row, 1, (double) j);
                ExcelUtils.store(row, 2, cells[0][j], null);
            }
            MetadataTable table = new MetadataTable(1, "favourites", 0);
            ImportResult result = this.importer.importWorkbook(table, workbook, new ImportOptions());
            assertThat(result.getSampleCount(), equalTo(3));
            assertThat(result.getPoolSync(), nullValue());
            MetadataColumn organism = table.findColumns("characteristics[organism]").get(0);
            assertThat(organism.resolve(1), equalTo("homo sapiens"));
            assertThat(organism.resolve(2), equalTo("rattus norvegicus"));
            assertThat(organism.resolve(3), equalTo("Unknown"));
            assertThat(table.getPools(), empty());
        }
    }

    @Test
    public void testMissingSheets() throws IOException {
        MetadataTable table = new MetadataTable(1, "test", 0);
        try (Workbook workbook = new XSSFWorkbook()) {
            workbook.createSheet("data");
            assertThrows(MissingRequiredSheetException.class,
                    () -> this.importer.importWorkbook(table, workbook, new ImportOptions()));
            workbook.createSheet(WorkbookExporter.MAIN_SHEET);
            assertThrows(MissingRequiredSheetException.class,
                    () -> this.importer.importWorkbook(table, workbook, new ImportOptions()));
        }
        assertThat(table.getColumnCount(), equalTo(0));
    }

}
