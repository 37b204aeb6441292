/**
 *
 */
package org.theseed.sdrf.templates;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;

/**
 * Tests for creating columns from templates.
 *
 * @author Bruce Parrello
 *
 */
public class TemplateMatcherTest {

    private TemplateMatcher matcher;

    @BeforeEach
    public void setup() throws IOException {
        this.matcher = new TemplateMatcher(TemplateRegistry.load(new File("data", "templates.tsv")));
    }

    @Test
    public void testFirstMatch() {
        MetadataTable table = new MetadataTable(1, "test", 2);
        assertThat(this.matcher.preferredSchema(table), nullValue());
        MetadataColumn organism = this.matcher.addColumn(table, "Characteristics[organism]", -1);
        assertThat(organism.getName(), equalTo("Characteristics[organism]"));
        assertThat(organism.getTemplateRef(), equalTo("basic/characteristics[organism]"));
        assertThat(organism.getOntologyType(), equalTo("species"));
        assertThat(organism.isMandatory(), equalTo(true));
        assertThat(organism.resolve(1), equalTo(MetadataColumn.NOT_AVAILABLE));
        MetadataColumn internal = this.matcher.addColumn(table, "comment[internal id]", 0);
        assertThat(internal.isHidden(), equalTo(true));
        assertThat(internal.resolve(2), equalTo("none"));
        assertThat(internal.getPosition(), equalTo(0));
        assertThat(this.matcher.preferredSchema(table), equalTo("basic"));
    }

    @Test
    public void testSchemaPreference() {
        MetadataTable table = new MetadataTable(1, "test", 2);
        MetadataColumn strain = this.matcher.addColumn(table, "characteristics[strain]", -1);
        assertThat(strain.getTemplateRef(), equalTo("extended/characteristics[strain]"));
        assertThat(this.matcher.preferredSchema(table), equalTo("extended"));
        MetadataColumn organism = this.matcher.addColumn(table, "characteristics[organism]", -1);
        assertThat(organism.getTemplateRef(), equalTo("extended/characteristics[organism]"));
        assertThat(organism.resolve(2), equalTo("mus musculus"));
        // A name the preferred schema lacks falls back to the first template of that name.
        MetadataColumn age = this.matcher.addColumn(table, "characteristics[age]", -1);
        assertThat(age.getTemplateRef(), equalTo("basic/characteristics[age]"));
    }

    @Test
    public void testNoTemplate() {
        MetadataTable table = new MetadataTable(1, "test", 2);
        MetadataColumn column = this.matcher.addColumn(table, "characteristics[tissue type]", -1);
        assertThat(column.getTemplateRef(), nullValue());
        assertThat(column.getOntologyType(), equalTo("tissue"));
        assertThat(column.isMandatory(), equalTo(false));
    }

    @Test
    public void testDetectOntologyType() {
        assertThat(TemplateMatcher.detectOntologyType("characteristics[organism]"), equalTo("species"));
        assertThat(TemplateMatcher.detectOntologyType("characteristics[NCBI_TaxID]"), equalTo("species"));
        // Species patterns are checked first, so "organism part" is a species column.
        assertThat(TemplateMatcher.detectOntologyType("characteristics[organism part]"), equalTo("species"));
        assertThat(TemplateMatcher.detectOntologyType("characteristics[cell type]"), equalTo("tissue"));
        assertThat(TemplateMatcher.detectOntologyType("characteristics[disease]"), equalTo("disease"));
        assertThat(TemplateMatcher.detectOntologyType("characteristics[subcellular location]"),
                equalTo("subcellular_location"));
        assertThat(TemplateMatcher.detectOntologyType("comment[instrument]"), equalTo("ms_terms"));
        assertThat(TemplateMatcher.detectOntologyType("comment[modification parameters]"), equalTo("unimod"));
        assertThat(TemplateMatcher.detectOntologyType("characteristics[age]"), nullValue());
    }

}
