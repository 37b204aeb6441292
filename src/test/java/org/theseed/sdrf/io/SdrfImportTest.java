/**
 *
 */
package org.theseed.sdrf.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.theseed.sdrf.errors.EmptyDocumentException;
import org.theseed.sdrf.errors.SdrfException;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.Modifier;
import org.theseed.sdrf.matrix.RangeSet;
import org.theseed.sdrf.matrix.SamplePool;
import org.theseed.sdrf.pools.PoolAggregator;
import org.theseed.sdrf.pools.PoolSynchronizer;
import org.theseed.sdrf.service.FavouriteList;
import org.theseed.sdrf.service.SynonymLookup;
import org.theseed.sdrf.templates.ColumnOrderer;
import org.theseed.sdrf.templates.TemplateMatcher;
import org.theseed.sdrf.templates.TemplateRegistry;

/**
 * Tests for reading and writing SDRF files.
 *
 * @author Bruce Parrello
 *
 */
public class SdrfImportTest {

    private TemplateMatcher matcher;
    private ColumnOrderer orderer;
    private PoolSynchronizer synchronizer;
    private SdrfImporter importer;
    private SdrfExporter exporter;

    @BeforeEach
    public void setup() throws IOException {
        TemplateRegistry registry = TemplateRegistry.loadDefault();
        PoolAggregator aggregator = new PoolAggregator();
        this.matcher = new TemplateMatcher(registry);
        this.orderer = new ColumnOrderer(registry);
        this.synchronizer = new PoolSynchronizer(aggregator);
        this.importer = new SdrfImporter(this.matcher, this.orderer, this.synchronizer, ValueConverter.plain());
        this.exporter = new SdrfExporter(aggregator);
    }

    /**
     * @return a new table loaded from a data file
     *
     * @param fileName	name of the file in the data directory
     * @param result	array to receive the import result
     */
    private MetadataTable load(String fileName, ImportResult[] result) throws IOException, SdrfException {
        MetadataTable retVal = new MetadataTable(1, fileName, 0);
        try (Reader reader = Files.newBufferedReader(new File("data", fileName).toPath(), StandardCharsets.UTF_8)) {
            result[0] = this.importer.importSdrf(retVal, reader, new ImportOptions());
        }
        return retVal;
    }

    /**
     * @return the lines of a data file
     *
     * @param fileName	name of the file in the data directory
     */
    private static List<String> lines(String fileName) throws IOException {
        return Files.readAllLines(new File("data", fileName).toPath(), StandardCharsets.UTF_8);
    }

    /**
     * @return the lines of a table's SDRF export
     *
     * @param table			table to export
     * @param includePools	TRUE to include reference pool lines
     */
    private List<String> export(MetadataTable table, boolean includePools) throws IOException {
        String text = this.exporter.exportToString(table, includePools);
        assertThat(text, endsWith("\n"));
        return Arrays.asList(text.split("\n"));
    }

    @Test
    public void testSimpleRoundTrip() throws IOException, SdrfException {
        MetadataTable table = new MetadataTable(1, "simple", 2);
        MetadataColumn organism = this.matcher.addColumn(table, "characteristics[organism]", -1);
        organism.replaceAll("homo sapiens");
        String text = this.exporter.exportToString(table, true);
        assertThat(text, equalTo("characteristics[organism]\nhomo sapiens\nhomo sapiens\n"));
        MetadataTable copy = new MetadataTable(2, "copy", 0);
        ImportResult result = this.importer.importSdrf(copy, new StringReader(text), new ImportOptions());
        assertThat(result.getSampleCount(), equalTo(2));
        assertThat(result.getColumnsCreated(), equalTo(1));
        assertThat(result.getWarnings(), empty());
        MetadataColumn imported = copy.getColumns().get(0);
        assertThat(imported.getDefaultValue(), equalTo("homo sapiens"));
        assertThat(imported.getModifiers(), empty());
        assertThat(copy.resolveRow(1), equalTo(table.resolveRow(1)));
        assertThat(copy.resolveRow(2), equalTo(table.resolveRow(2)));
    }

    @Test
    public void testFileRoundTrip() throws IOException, SdrfException {
        ImportResult[] result = new ImportResult[1];
        MetadataTable table = this.load("simple.sdrf.tsv", result);
        assertThat(result[0].getSampleCount(), equalTo(4));
        assertThat(result[0].getColumnsCreated(), equalTo(6));
        assertThat(result[0].getColumnsUpdated(), equalTo(0));
        assertThat(result[0].getStrategy(), equalTo(ColumnOrderer.Strategy.SCHEMA));
        assertThat(result[0].getPoolSync(), nullValue());
        MetadataColumn disease = table.findColumns("characteristics[disease]").get(0);
        assertThat(disease.getDefaultValue(), equalTo("normal"));
        assertThat(disease.getModifiers(), contains(new Modifier(RangeSet.of(2, 4), "cancer")));
        assertThat(disease.isNotApplicable(), equalTo(false));
        assertThat(disease.getTemplateRef(), equalTo("minimum/characteristics[disease]"));
        MetadataColumn label = table.findColumns("comment[label]").get(0);
        assertThat(label.getModifiers(), empty());
        assertThat(this.export(table, true), equalTo(lines("simple.sdrf.tsv")));
    }

    @Test
    public void testReferencePool() throws IOException, SdrfException {
        ImportResult[] result = new ImportResult[1];
        MetadataTable table = this.load("pools.sdrf.tsv", result);
        assertThat(table.getSampleCount(), equalTo(4));
        assertThat(result[0].getPoolSync().getCreated(), equalTo(1));
        assertThat(table.getPools().size(), equalTo(1));
        SamplePool pool = table.getPools().get(0);
        assertThat(pool.getName(), equalTo("P1"));
        assertThat(pool.isReference(), equalTo(true));
        assertThat(pool.getPooledOnly(), equalTo(RangeSet.of(2, 3)));
        assertThat(pool.getPooledAndIndependent(), equalTo(RangeSet.of(1)));
        assertThat(pool.getSdrfValue(), equalTo("SN=S1,S2,S3"));
        MetadataColumn disease = table.findColumns("characteristics[disease]").get(0);
        assertThat(pool.getDerivedColumn(disease).getValue(), equalTo("cancer"));
        MetadataColumn assay = table.findColumns("assay name").get(0);
        assertThat(pool.getDerivedColumn(assay).getValue(), equalTo("run 5"));
        assertThat(pool.getDerivedColumns().size(), equalTo(table.getColumnCount()));
        List<String> expected = lines("pools.sdrf.tsv");
        assertThat(this.export(table, true), equalTo(expected));
        assertThat(this.export(table, false), equalTo(expected.subList(0, 5)));
    }

    @Test
    public void testExplicitPoolRows() throws SdrfException {
        MetadataTable table = new MetadataTable(1, "test", 0);
        List<String> headers = Arrays.asList("source name", "characteristics[pooled sample]");
        List<List<String>> rows = Arrays.asList(Arrays.asList("S1", "pooled"), Arrays.asList("S2", "pooled"),
                Arrays.asList("S3", "not pooled"), Arrays.asList("", "SN=S1,S2"));
        ImportResult result = this.importer.importRows(table, headers, rows, new ImportOptions());
        assertThat(table.getSampleCount(), equalTo(3));
        assertThat(table.getPools().size(), equalTo(1));
        SamplePool pool = table.getPools().get(0);
        assertThat(pool.getName(), equalTo("Pool 1"));
        assertThat(pool.getPooledOnly(), equalTo(RangeSet.of(1, 2)));
        assertThat(pool.getPooledAndIndependent().isEmpty(), equalTo(true));
        assertThat(result.getWarnings(), empty());
        MetadataColumn source = table.findColumns("source name").get(0);
        assertThat(source.resolve(3), equalTo("S3"));
    }

    @Test
    public void testUnresolvedNames() throws SdrfException {
        MetadataTable table = new MetadataTable(1, "test", 0);
        List<String> headers = Arrays.asList("source name", "characteristics[pooled sample]", "comment[label]");
        List<List<String>> rows = Arrays.asList(Arrays.asList("S1", "", "TMT126"),
                Arrays.asList("S2", "independent", "TMT127"),
                Arrays.asList("P1", "SN=S1,S9", "TMT126"), Arrays.asList("P2", "SN=Q1,Q2", "TMT126"));
        ImportResult result = this.importer.importRows(table, headers, rows, new ImportOptions());
        assertThat(table.getSampleCount(), equalTo(2));
        assertThat(table.getPools().size(), equalTo(1));
        SamplePool pool = table.findPool("P1");
        assertThat(pool.getPooledOnly().isEmpty(), equalTo(true));
        assertThat(pool.getPooledAndIndependent(), equalTo(RangeSet.of(1)));
        List<String> messages = result.getWarnings().stream().map(PartialImportWarning::getMessage)
                .collect(Collectors.toList());
        assertThat(messages, hasItem(containsString("\"S9\"")));
        assertThat(messages, hasItem(containsString("\"P2\"")));
        assertThat(result.getWarnings().get(0).getLine(), equalTo(4));
    }

    @Test
    public void testInferredPool() throws IOException, SdrfException {
        ImportResult[] result = new ImportResult[1];
        MetadataTable table = this.load("inferred.sdrf.tsv", result);
        assertThat(table.getPools().size(), equalTo(1));
        SamplePool pool = table.getPools().get(0);
        assertThat(pool.getName(), equalTo("Pool 1"));
        assertThat(pool.isReference(), equalTo(false));
        assertThat(pool.getPooledOnly(), equalTo(RangeSet.of(2, 3)));
        assertThat(pool.getSdrfValue(), equalTo(PoolAggregator.POOLED_MARKER));
        // Non-reference pools are not written as SDRF lines.
        assertThat(this.export(table, true), equalTo(lines("inferred.sdrf.tsv")));
        // Pool creation can be turned off.
        MetadataTable other = new MetadataTable(2, "other", 0);
        try (Reader reader = Files.newBufferedReader(new File("data", "inferred.sdrf.tsv").toPath())) {
            this.importer.importSdrf(other, reader, new ImportOptions().setCreatePools(false));
        }
        assertThat(other.getPools(), empty());
    }

    @Test
    public void testEmptyDocument() {
        MetadataTable table = new MetadataTable(1, "test", 0);
        assertThrows(EmptyDocumentException.class, () -> this.importer.importSdrf(table, new StringReader(""),
                new ImportOptions()));
        assertThrows(EmptyDocumentException.class, () -> this.importer.importSdrf(table, new StringReader("\n\n"),
                new ImportOptions()));
        assertThrows(EmptyDocumentException.class, () -> this.importer.importSdrf(table, new StringReader("\t\t\n"),
                new ImportOptions()));
        assertThat(table.getColumnCount(), equalTo(0));
    }

    @Test
    public void testMergeAndRepeats() throws IOException, SdrfException {
        SynonymLookup synonyms = SynonymLookup.load(new File("data", "synonyms.tsv"));
        SdrfImporter normalizer = new SdrfImporter(this.matcher, this.orderer, this.synchronizer,
                new ValueConverter(new FavouriteList(), synonyms));
        MetadataTable table = new MetadataTable(1, "repeats", 0);
        ImportResult result;
        try (Reader reader = Files.newBufferedReader(new File("data", "repeats.sdrf.tsv").toPath())) {
            result = normalizer.importSdrf(table, reader, new ImportOptions());
        }
        assertThat(result.getColumnsCreated(), equalTo(6));
        List<MetadataColumn> mods = table.findColumns("comment[modification parameters]");
        assertThat(mods.size(), equalTo(2));
        assertThat(mods.get(0).resolve(3), equalTo("NT=Oxidation;AC=UNIMOD:35"));
        assertThat(mods.get(1).resolve(1), equalTo("NT=Carbamidomethyl;AC=UNIMOD:4"));
        assertThat(mods.get(1).resolve(3), equalTo("NT=Acetyl;AC=UNIMOD:1"));
        MetadataColumn organism = table.findColumns("characteristics[organism]").get(0);
        assertThat(organism.getDefaultValue(), equalTo("homo sapiens"));
        assertThat(organism.resolve(3), equalTo("mus musculus"));
        // Importing a second time reuses every column.
        try (Reader reader = Files.newBufferedReader(new File("data", "repeats.sdrf.tsv").toPath())) {
            result = this.importer.importSdrf(table, reader, new ImportOptions());
        }
        assertThat(result.getColumnsCreated(), equalTo(0));
        assertThat(result.getColumnsUpdated(), equalTo(6));
        assertThat(table.getColumnCount(), equalTo(6));
        assertThat(organism.resolve(1), equalTo("Human"));
        assertThat(mods.get(1).resolve(3), equalTo("NT=Acetyl;AC=UNIMOD:1"));
    }

    @Test
    public void testSampleCountRules() throws IOException, SdrfException {
        ImportResult[] result = new ImportResult[1];
        MetadataTable table = this.load("simple.sdrf.tsv", result);
        String text = "source name\tcomment[data file]\nA\ta.raw\nB\tb.raw\nC\tc.raw\nD\td.raw\nE\te.raw\nF\tf.raw\n";
        ImportResult merged = this.importer.importSdrf(table, new StringReader(text), new ImportOptions());
        assertThat(table.getSampleCount(), equalTo(4));
        assertThat(merged.getWarnings().size(), equalTo(1));
        assertThat(merged.getColumnsUpdated(), equalTo(2));
        MetadataColumn source = table.findColumns("source name").get(0);
        assertThat(source.resolve(4), equalTo("D"));
        MetadataColumn organism = table.findColumns("characteristics[organism]").get(0);
        assertThat(organism.resolve(4), equalTo("mus musculus"));
        ImportResult replaced = this.importer.importSdrf(table, new StringReader(text),
                new ImportOptions().setReplaceExisting(true));
        assertThat(table.getSampleCount(), equalTo(4));
        assertThat(table.getColumnCount(), equalTo(2));
        assertThat(replaced.getColumnsCreated(), equalTo(2));
        assertThat(replaced.getWarnings().size(), equalTo(1));
        // A table with samples keeps its count when fewer lines come in.
        MetadataTable padded = new MetadataTable(2, "padded", 10);
        ImportResult short4 = this.importer.importSdrf(padded, new StringReader("source name\nA\nB\nC\nD\n"),
                new ImportOptions());
        assertThat(padded.getSampleCount(), equalTo(10));
        assertThat(short4.getSampleCount(), equalTo(10));
        assertThat(padded.findColumns("source name").get(0).resolve(4), equalTo("D"));
        this.importer.importSdrf(padded, new StringReader("source name\nA\nB\n"),
                new ImportOptions().setReplaceExisting(true));
        assertThat(padded.getSampleCount(), equalTo(10));
    }

    @Test
    public void testNotApplicable() throws IOException, SdrfException {
        MetadataTable table = new MetadataTable(1, "test", 0);
        String text = "source name\tcharacteristics[age]\tcharacteristics[sex]\nA\tnot applicable\tmale\n"
                + "B\tNot Applicable\t\nC\tnot applicable\tfemale\n";
        this.importer.importSdrf(table, new StringReader(text), new ImportOptions());
        MetadataColumn age = table.findColumns("characteristics[age]").get(0);
        assertThat(age.isNotApplicable(), equalTo(true));
        assertThat(age.getDefaultValue(), nullValue());
        assertThat(age.getModifiers(), empty());
        assertThat(age.resolve(2), equalTo(MetadataColumn.NOT_APPLICABLE));
        MetadataColumn sex = table.findColumns("characteristics[sex]").get(0);
        assertThat(sex.isNotApplicable(), equalTo(false));
        assertThat(sex.getDefaultValue(), equalTo("male"));
        assertThat(sex.getModifiers(), contains(new Modifier(RangeSet.of(3), "female")));
        assertThat(sex.resolve(2), equalTo("male"));
        // Mixed with real values, "not applicable" only sets the flag.
        MetadataTable mixed = new MetadataTable(2, "mixed", 0);
        this.importer.importSdrf(mixed, new StringReader("source name\tcharacteristics[disease]\nA\tcancer\n"
                + "B\tnot applicable\nC\tnormal\nD\tcancer\n"), new ImportOptions());
        MetadataColumn disease = mixed.findColumns("characteristics[disease]").get(0);
        assertThat(disease.isNotApplicable(), equalTo(true));
        assertThat(disease.getDefaultValue(), equalTo("cancer"));
        assertThat(disease.getModifiers(), contains(new Modifier(RangeSet.of(3), "normal")));
        assertThat(disease.resolve(2), equalTo("cancer"));
    }

    @Test
    public void testEmptyImportedColumn() throws IOException, SdrfException {
        MetadataTable table = new MetadataTable(1, "test", 0);
        String text = "source name\tcomment[technical replicate]\nA\t\nB\t\n";
        ImportResult result = this.importer.importSdrf(table, new StringReader(text), new ImportOptions());
        assertThat(result.getColumnsCreated(), equalTo(2));
        MetadataColumn replicate = table.findColumns("comment[technical replicate]").get(0);
        assertThat(replicate.getTemplateRef(), equalTo("minimum/comment[technical replicate]"));
        assertThat(replicate.getDefaultValue(), nullValue());
        assertThat(replicate.resolve(1), equalTo(MetadataColumn.NOT_AVAILABLE));
        String exported = this.exporter.exportToString(table, true);
        assertThat(exported, equalTo("source name\tcomment[technical replicate]\nA\tnot available\n"
                + "B\tnot available\n"));
        // A column added directly still takes the template default.
        MetadataColumn fraction = this.matcher.addColumn(table, "comment[fraction identifier]", -1);
        assertThat(fraction.getDefaultValue(), equalTo("1"));
    }

    @Test
    public void testColumnOrderAndFilter() throws IOException, SdrfException {
        ImportResult[] result = new ImportResult[1];
        MetadataTable table = this.load("unordered.sdrf.tsv", result);
        List<String> header = table.getColumns().stream().map(MetadataColumn::getName).collect(Collectors.toList());
        assertThat(header, contains("source name", "characteristics[organism]", "characteristics[disease]",
                "assay name", "technology type", "comment[data file]", "factor value[disease]"));
        MetadataColumn source = table.findColumns("source name").get(0);
        MetadataColumn file = table.findColumns("comment[data file]").get(0);
        file.setHidden(true);
        StringWriter writer = new StringWriter();
        int count = this.exporter.export(table, writer, false, Set.of(source.getId(), file.getId()));
        assertThat(count, equalTo(2));
        assertThat(writer.toString(), equalTo("source name\nX1\nX2\n"));
    }

    @Test
    public void testHeaderPositions() throws IOException, SdrfException {
        MetadataTable table = new MetadataTable(1, "test", 2);
        table.addColumn("comment[second]");
        String text = "comment[first]\tcomment[second]\nx\ty\nx\tz\n";
        ImportResult result = this.importer.importSdrf(table, new StringReader(text), new ImportOptions());
        assertThat(result.getColumnsCreated(), equalTo(1));
        assertThat(result.getColumnsUpdated(), equalTo(1));
        List<String> header = table.getColumns().stream().map(MetadataColumn::getName).collect(Collectors.toList());
        assertThat(header, contains("comment[first]", "comment[second]"));
        assertThat(table.findColumns("comment[second]").get(0).resolve(2), equalTo("z"));
    }

}
