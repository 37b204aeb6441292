/**
 *
 */
package org.theseed.sdrf.matrix;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.theseed.sdrf.errors.ValidationFailureException;

/**
 * Tests for column value resolution, editing and naming.
 *
 * @author Bruce Parrello
 *
 */
public class MetadataColumnTest {

    @Test
    public void testResolve() throws ValidationFailureException {
        MetadataColumn column = new MetadataColumn(1, " Characteristics[Organism] ", 0);
        assertThat(column.getName(), equalTo("Characteristics[Organism]"));
        assertThat(column.getKey(), equalTo("characteristics[organism]"));
        assertThat(column.getCategory(), equalTo(ColumnCategory.CHARACTERISTICS));
        assertThat(column.resolve(1), equalTo(MetadataColumn.NOT_AVAILABLE));
        column.setNotApplicable(true);
        assertThat(column.resolve(1), equalTo(MetadataColumn.NOT_APPLICABLE));
        assertThat(column.rawValue(1), nullValue());
        column.setDefaultValue("homo sapiens");
        column.setModifiers(Arrays.asList(new Modifier(RangeSet.of(2, 3), "mus musculus"),
                new Modifier(RangeSet.of(5), "rattus norvegicus")));
        assertThat(column.resolve(1), equalTo("homo sapiens"));
        assertThat(column.resolve(2), equalTo("mus musculus"));
        assertThat(column.resolve(3), equalTo("mus musculus"));
        assertThat(column.resolve(4), equalTo("homo sapiens"));
        assertThat(column.resolve(5), equalTo("rattus norvegicus"));
        assertThat(column.maxReferencedSample(), equalTo(5));
        // An empty default counts as no default.
        column.setDefaultValue("");
        assertThat(column.resolve(4), equalTo(MetadataColumn.NOT_APPLICABLE));
    }

    @Test
    public void testOverlappingModifiers() {
        MetadataColumn column = new MetadataColumn(1, "comment[label]", 0);
        assertThrows(ValidationFailureException.class, () -> column.setModifiers(Arrays.asList(
                new Modifier(RangeSet.of(1, 2), "a"), new Modifier(RangeSet.of(2, 3), "b"))));
        assertThat(column.getModifiers(), empty());
    }

    @Test
    public void testSetValueForSamples() {
        MetadataColumn column = new MetadataColumn(1, "characteristics[disease]", 0);
        column.setDefaultValue("normal");
        column.setValueForSamples("cancer", RangeSet.of(2, 3, 4));
        column.setValueForSamples("flu", RangeSet.of(3));
        assertThat(column.resolve(2), equalTo("cancer"));
        assertThat(column.resolve(3), equalTo("flu"));
        assertThat(column.resolve(4), equalTo("cancer"));
        column.setValueForSamples("cancer", RangeSet.of(6));
        assertThat(column.getModifiers(), contains(new Modifier(RangeSet.of(2, 4, 6), "cancer"),
                new Modifier(RangeSet.of(3), "flu")));
        column.setValueForSamples("cancer", RangeSet.of(3));
        assertThat(column.getModifiers(), contains(new Modifier(RangeSet.of(2, 3, 4, 6), "cancer")));
        column.replaceAll("unknown");
        assertThat(column.getModifiers(), empty());
        assertThat(column.resolve(3), equalTo("unknown"));
    }

    @Test
    public void testMoveAndTruncate() {
        MetadataColumn column = new MetadataColumn(1, "assay name", 0);
        column.setDefaultValue("run");
        column.setValueForSamples("A", RangeSet.of(1));
        column.setValueForSamples("B", RangeSet.of(3, 4));
        assertThat(column.moveSample(1, 3), equalTo(true));
        assertThat(column.resolve(1), equalTo("run"));
        assertThat(column.resolve(3), equalTo("A"));
        assertThat(column.resolve(4), equalTo("B"));
        assertThat(column.moveSample(2, 5), equalTo(false));
        column.truncateSamples(3);
        assertThat(column.getModifiers(), contains(new Modifier(RangeSet.of(3), "A")));
        assertThat(column.maxReferencedSample(), equalTo(3));
    }

    @Test
    public void testCopy() {
        MetadataColumn column = new MetadataColumn(4, "comment[instrument]", 2);
        column.setDefaultValue("Q Exactive");
        column.setValueForSamples("Orbitrap", RangeSet.of(2));
        column.setHidden(true);
        column.setMandatory(true);
        column.setOntologyType("ms_terms");
        column.setOntologyOptions(Arrays.asList("MS"));
        column.setTemplateRef("minimum/comment[instrument]");
        MetadataColumn copy = column.copy(9);
        assertThat(copy.getId(), equalTo(9L));
        assertThat(copy.getPosition(), equalTo(2));
        assertThat(copy.resolve(2), equalTo("Orbitrap"));
        assertThat(copy.isHidden(), equalTo(true));
        assertThat(copy.isMandatory(), equalTo(true));
        assertThat(copy.getOntologyOptions(), contains("MS"));
        assertThat(copy.getTemplateRef(), equalTo("minimum/comment[instrument]"));
        copy.setValueForSamples("Astral", RangeSet.of(3));
        assertThat(column.resolve(3), equalTo("Q Exactive"));
    }

    @Test
    public void testCategories() {
        assertThat(ColumnCategory.fromName("Source Name"), equalTo(ColumnCategory.SOURCE_NAME));
        assertThat(ColumnCategory.fromName("characteristics[organism part]"), equalTo(ColumnCategory.CHARACTERISTICS));
        assertThat(ColumnCategory.fromName("Comment[data file]"), equalTo(ColumnCategory.COMMENT));
        assertThat(ColumnCategory.fromName("factor value[disease]"), equalTo(ColumnCategory.FACTOR_VALUE));
        assertThat(ColumnCategory.fromName("technology type"), equalTo(ColumnCategory.TECHNOLOGY_TYPE));
        assertThat(ColumnCategory.fromName("assay name"), equalTo(ColumnCategory.SPECIAL));
        assertThat(ColumnCategory.fromName("material type"), equalTo(ColumnCategory.SPECIAL));
        assertThat(ColumnCategory.fromName("other[thing]"), equalTo(ColumnCategory.SPECIAL));
        assertThat(ColumnCategory.fromLabel("factor value"), equalTo(ColumnCategory.FACTOR_VALUE));
        assertThat(ColumnCategory.fromLabel("SOURCE_NAME"), equalTo(ColumnCategory.SOURCE_NAME));
        assertThat(ColumnCategory.fromLabel("bogus"), equalTo(ColumnCategory.SPECIAL));
        assertThat(ColumnCategory.normalize(" Comment[Data_File] "), equalTo("comment[data file]"));
        assertThat(ColumnCategory.innerName("characteristics[Organism Part]"), equalTo("organism part"));
        assertThat(ColumnCategory.innerName("organism"), equalTo("organism"));
    }

}
