/**
 *
 */
package org.theseed.sdrf.service;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.theseed.sdrf.errors.EmptyDocumentException;
import org.theseed.sdrf.errors.NotFoundException;
import org.theseed.sdrf.errors.PermissionDeniedException;
import org.theseed.sdrf.errors.SdrfException;
import org.theseed.sdrf.errors.ValidationFailureException;
import org.theseed.sdrf.io.ImportOptions;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.PoolColumn;
import org.theseed.sdrf.matrix.RangeSet;
import org.theseed.sdrf.matrix.SamplePool;
import org.theseed.sdrf.templates.ColumnOrderer;
import org.theseed.sdrf.templates.TemplateRegistry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Tests for the table service.
 *
 * @author Bruce Parrello
 *
 */
public class TableServiceTest {

    private MemoryTableStore store;
    private TableService service;

    @BeforeEach
    public void setup() throws IOException {
        this.store = new MemoryTableStore();
        this.service = new TableService(this.store, new OwnerAccessPolicy(), TemplateRegistry.loadDefault(), null, null);
    }

    /**
     * @return the ID of a four-sample table owned by "alice" with a reference pool
     */
    private long buildPoolTable() throws SdrfException, IOException {
        long retVal = this.service.createTable("alice", "pooled", 4).getId();
        long sourceId = this.service.addColumn("alice", retVal, "source name", -1).getId();
        for (int i = 1; i <= 4; i++)
            this.service.setColumnValue("alice", retVal, sourceId, "S" + i, RangeSet.of(i));
        long diseaseId = this.service.addColumn("alice", retVal, "characteristics[disease]", -1).getId();
        this.service.setColumnValue("alice", retVal, diseaseId, "normal", null);
        this.service.setColumnValue("alice", retVal, diseaseId, "cancer", RangeSet.of(2, 3));
        this.service.createPool("alice", retVal, "P", RangeSet.of(2, 3), RangeSet.of(1), true);
        this.service.addColumn("alice", retVal, "characteristics[pooled sample]", -1);
        return retVal;
    }

    @Test
    public void testPermissions() throws SdrfException, IOException {
        long tableId = this.service.createTable("alice", "private", 2).getId();
        assertThat(this.service.getTable("alice", tableId).getOwner(), equalTo("alice"));
        assertThrows(PermissionDeniedException.class, () -> this.service.getTable("bob", tableId));
        assertThrows(PermissionDeniedException.class, () -> this.service.addColumn("bob", tableId, "assay name", -1));
        assertThat(this.service.listTables("bob"), empty());
        MetadataTable stored = this.store.load(tableId);
        stored.getViewers().add("bob");
        this.store.save(stored);
        assertThat(this.service.getTable("bob", tableId).getName(), equalTo("private"));
        assertThat(this.service.listTables("bob").size(), equalTo(1));
        assertThat(this.service.listTables("carol"), empty());
        assertThrows(PermissionDeniedException.class, () -> this.service.setSampleCount("bob", tableId, 5));
        assertThrows(PermissionDeniedException.class, () -> this.service.deleteTable("bob", tableId));
        assertThrows(NotFoundException.class, () -> this.service.getTable("alice", 99));
        // A table with no owner is open to everyone.
        stored.setOwner(null);
        this.store.save(stored);
        this.service.setSampleCount("carol", tableId, 5);
        assertThat(this.service.getTable("dave", tableId).getSampleCount(), equalTo(5));
        this.service.deleteTable("alice", tableId);
        assertThrows(NotFoundException.class, () -> this.service.getTable("alice", tableId));
    }

    @Test
    public void testRollback() throws SdrfException, IOException {
        long tableId = this.service.createTable("alice", "rollback", 3).getId();
        MetadataColumn organism = this.service.addColumn("alice", tableId, "characteristics[organism]", -1);
        assertThrows(ValidationFailureException.class, () -> this.service.setColumnValue("alice", tableId,
                organism.getId(), "homo sapiens", RangeSet.of(2, 9)));
        assertThrows(EmptyDocumentException.class, () -> this.service.importSdrf("alice", tableId,
                new StringReader(""), new ImportOptions().setReplaceExisting(true)));
        assertThrows(ValidationFailureException.class, () -> this.service.createPool("alice", tableId, "bad",
                RangeSet.of(1, 2), RangeSet.of(2), true));
        assertThrows(ValidationFailureException.class, () -> this.service.update("alice", tableId, table -> {
            table.addColumn("assay name");
            table.setSampleCount(10);
            throw new ValidationFailureException("Stop.");
        }));
        MetadataTable table = this.service.getTable("alice", tableId);
        assertThat(table.getColumnCount(), equalTo(1));
        assertThat(table.getSampleCount(), equalTo(3));
        assertThat(table.getPools(), empty());
        assertThat(table.getColumn(organism.getId()).rawValue(2), nullValue());
    }

    @Test
    public void testPoolsAndMoves() throws SdrfException, IOException {
        long tableId = this.buildPoolTable();
        StringWriter writer = new StringWriter();
        int count = this.service.exportSdrf("alice", tableId, writer, true, null);
        assertThat(count, equalTo(5));
        String[] lines = writer.toString().split("\n");
        assertThat(lines[0], equalTo("source name\tcharacteristics[disease]\tcharacteristics[pooled sample]"));
        assertThat(lines[2], equalTo("S2\tcancer\tnot pooled"));
        assertThat(lines[5], equalTo("P\tcancer\tSN=S1,S2,S3"));
        // Swap two samples.
        this.service.batchChangeSampleIndices("alice", tableId, Map.of(2, 3, 3, 2));
        MetadataTable table = this.service.getTable("alice", tableId);
        MetadataColumn source = table.findColumns("source name").get(0);
        assertThat(source.resolve(2), equalTo("S3"));
        assertThat(source.resolve(3), equalTo("S2"));
        SamplePool pool = table.findPool("P");
        assertThat(pool.getPooledOnly(), equalTo(RangeSet.of(2, 3)));
        assertThat(pool.getSdrfValue(), equalTo("SN=S1,S3,S2"));
        // Invalid moves change nothing.
        assertThrows(ValidationFailureException.class, () -> this.service.batchChangeSampleIndices("alice", tableId,
                Map.of(1, 2)));
        assertThrows(ValidationFailureException.class, () -> this.service.changeSampleIndex("alice", tableId, 1, 9));
        table = this.service.getTable("alice", tableId);
        assertThat(table.findColumns("source name").get(0).resolve(1), equalTo("S1"));
        // Removing a column removes its pool values.
        MetadataColumn disease = table.findColumns("characteristics[disease]").get(0);
        this.service.removeColumn("alice", tableId, disease.getId());
        table = this.service.getTable("alice", tableId);
        pool = table.findPool("P");
        assertThat(pool.getDerivedColumn(disease), nullValue());
        assertThat(pool.getDerivedColumns().size(), equalTo(2));
        this.service.removePool("alice", tableId, pool.getId());
        assertThat(this.service.getTable("alice", tableId).getPools(), empty());
        assertThrows(NotFoundException.class, () -> this.service.removePool("alice", tableId, 42));
    }

    @Test
    public void testColumnOperations() throws SdrfException, IOException {
        long tableId = this.service.createTable("alice", "columns", 2).getId();
        MetadataColumn file = this.service.addColumn("alice", tableId, "comment[data file]", -1);
        MetadataColumn source = this.service.addColumn("alice", tableId, "source name", -1);
        MetadataColumn tech = this.service.addColumn("alice", tableId, "technology type", 0);
        assertThat(tech.getDefaultValue(), equalTo("proteomic profiling by mass spectrometry"));
        this.service.moveColumn("alice", tableId, file.getId(), 0);
        MetadataTable table = this.service.getTable("alice", tableId);
        assertThat(table.getColumns().get(0).getId(), equalTo(file.getId()));
        this.service.reorderColumns("alice", tableId, ColumnOrderer.Strategy.AUTO);
        table = this.service.getTable("alice", tableId);
        assertThat(table.getColumns().get(0).getId(), equalTo(source.getId()));
        assertThat(table.getColumns().get(1).getId(), equalTo(tech.getId()));
        assertThat(table.getColumns().get(2).getId(), equalTo(file.getId()));
        assertThrows(NotFoundException.class, () -> this.service.removeColumn("alice", tableId, 77));
        this.service.setSampleCount("alice", tableId, 1);
        assertThat(this.service.getTable("alice", tableId).getSampleCount(), equalTo(1));
        assertThrows(ValidationFailureException.class, () -> this.service.setSampleCount("alice", tableId, -1));
    }

    @Test
    public void testColumnChanges() throws SdrfException, IOException {
        long tableId = this.buildPoolTable();
        MetadataTable table = this.service.getTable("alice", tableId);
        long diseaseId = table.findColumns("characteristics[disease]").get(0).getId();
        this.service.renameColumn("alice", tableId, diseaseId, "characteristics[phenotype]");
        this.service.setColumnFlags("alice", tableId, diseaseId, true, true, false);
        table = this.service.getTable("alice", tableId);
        MetadataColumn phenotype = table.getColumn(diseaseId);
        assertThat(phenotype.getName(), equalTo("characteristics[phenotype]"));
        assertThat(phenotype.isHidden(), equalTo(true));
        PoolColumn derived = table.findPool("P").getDerivedColumn(phenotype);
        assertThat(derived.getName(), equalTo("characteristics[phenotype]"));
        assertThat(derived.isHidden(), equalTo(true));
        assertThat(derived.isMandatory(), equalTo(true));
        assertThat(derived.getValue(), equalTo("cancer"));
        assertThrows(ValidationFailureException.class, () -> this.service.renameColumn("alice", tableId, diseaseId, " "));
        assertThrows(PermissionDeniedException.class, () -> this.service.renameColumn("bob", tableId, diseaseId,
                "characteristics[disease]"));
        assertThrows(NotFoundException.class, () -> this.service.setColumnFlags("alice", tableId, 77, false, false,
                false));
    }

    @Test
    public void testValidation() throws SdrfException, IOException {
        TableService checker = new TableService(new MemoryTableStore(), new OpenAccessPolicy(),
                TemplateRegistry.load(new File("data", "templates.tsv")), null, null);
        long tableId = checker.createTable("alice", "checked", 2).getId();
        MetadataColumn organism = checker.addColumn("alice", tableId, "characteristics[organism]", -1);
        assertThat(organism.isMandatory(), equalTo(true));
        MetadataColumn age = checker.addColumn("alice", tableId, "characteristics[age]", -1);
        checker.setColumnValue("alice", tableId, age.getId(), "30Y", null);
        checker.setColumnValue("alice", tableId, age.getId(), "thirty", RangeSet.of(2));
        MetadataColumn internal = checker.addColumn("alice", tableId, "comment[internal id]", -1);
        assertThat(internal.isHidden(), equalTo(true));
        assertThat(internal.getDefaultValue(), equalTo("none"));
        List<String> problems = checker.validate("alice", tableId);
        assertThat(problems.size(), equalTo(2));
        assertThat(problems, hasItem(containsString("\"characteristics[organism]\"")));
        assertThat(problems, hasItem(containsString("\"thirty\"")));
        assertThrows(ValidationFailureException.class, () -> checker.requireValid("alice", tableId));
        checker.setColumnValue("alice", tableId, organism.getId(), "homo sapiens", null);
        checker.setColumnValue("alice", tableId, age.getId(), "not available", RangeSet.of(2));
        assertThat(checker.validate("alice", tableId), empty());
        checker.requireValid("alice", tableId);
    }

    @Test
    public void testCombine() throws SdrfException, IOException {
        long id1 = this.buildPoolTable();
        long id2 = this.service.createTable("alice", "labels", 2).getId();
        this.service.addColumn("alice", id2, "comment[label]", -1);
        int before = this.store.size();
        assertThrows(ValidationFailureException.class, () -> this.service.combineTables("alice", List.of(id1, id2),
                "nothing", true, TableCombiner.MergeStrategy.INTERSECTION));
        assertThat(this.store.size(), equalTo(before));
        MetadataTable combined = this.service.combineTables("alice", List.of(id1, id2), "merged", true,
                TableCombiner.MergeStrategy.UNION);
        assertThat(this.store.size(), equalTo(before + 1));
        assertThat(combined.getSampleCount(), equalTo(6));
        assertThat(combined.getColumnCount(), equalTo(4));
        assertThat(combined.findPool("T1_P"), not(nullValue()));
        MetadataTable stored = this.service.getTable("alice", combined.getId());
        assertThat(stored.getName(), equalTo("merged"));
        assertThat(stored.getOwner(), equalTo("alice"));
        assertThrows(PermissionDeniedException.class, () -> this.service.combineTables("bob", List.of(id1),
                "stolen", false, TableCombiner.MergeStrategy.UNION));
    }

    @Test
    public void testBulkExport() throws SdrfException, IOException {
        long id1 = this.buildPoolTable();
        long id2 = this.service.createTable("carol", "secret", 1).getId();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ExportManifest manifest = this.service.bulkExport("alice", List.of(id1, id2, 99L), BulkExporter.Format.SDRF,
                true, buffer);
        assertThat(manifest.getSuccessCount(), equalTo(1));
        assertThat(manifest.getFailureCount(), equalTo(2));
        ExportManifest.Entry entry = manifest.getEntries().get(0);
        assertThat(entry.getFileName(), equalTo("pooled.sdrf.tsv"));
        assertThat(manifest.getEntries().get(1).getTableId(), equalTo(id2));
        assertThat(manifest.getEntries().get(1).getTableName(), equalTo(""));
        assertThat(manifest.getEntries().get(2).getError(), containsString("99"));
        // The archived manifest lists the rejected tables too.
        JsonNode json = null;
        try (ZipInputStream zipStream = new ZipInputStream(new ByteArrayInputStream(buffer.toByteArray()),
                StandardCharsets.UTF_8)) {
            for (ZipEntry zipEntry = zipStream.getNextEntry(); zipEntry != null; zipEntry = zipStream.getNextEntry()) {
                if (zipEntry.getName().equals(BulkExporter.MANIFEST_NAME))
                    json = new ObjectMapper().readTree(IOUtils.toByteArray(zipStream));
            }
        }
        assertThat(json, not(nullValue()));
        assertThat(json.get("successCount").asInt(), equalTo(1));
        assertThat(json.get("failureCount").asInt(), equalTo(2));
        JsonNode entries = json.get("entries");
        assertThat(entries.size(), equalTo(3));
        assertThat(entries.get(0).get("fileName").asText(), equalTo("pooled.sdrf.tsv"));
        assertThat(entries.get(1).get("tableId").asLong(), equalTo(id2));
        assertThat(entries.get(2).get("tableId").asLong(), equalTo(99L));
        assertThat(entries.get(2).get("error").asText(), containsString("99"));
    }

}
