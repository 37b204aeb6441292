/**
 *
 */
package org.theseed.sdrf.templates;

import java.util.LinkedHashMap;
import java.util.Map;

import org.theseed.sdrf.matrix.ColumnCategory;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;

/**
 * This object matches new column names against a template registry.  Matching is exact and case-insensitive.
 * When the table already has columns created from templates, the schema sharing the most templates with the
 * table is searched first, so that new columns come from the schema family already in use.
 *
 * @author Bruce Parrello
 *
 */
public class TemplateMatcher {

    // FIELDS
    /** template library */
    private final TemplateRegistry registry;

    /** name fragments for each detected ontology type, in priority order */
    private static final String[][] ONTOLOGY_PATTERNS = new String[][] {
        { "species", "organism", "species", "taxonomy", "taxon", "ncbi taxid", "ncbitaxid" },
        { "tissue", "tissue", "organ", "organism part", "body part", "anatomical part", "cell type", "sample type" },
        { "disease", "disease", "disorder", "condition", "pathology", "phenotype", "clinical finding", "medical condition" },
        { "subcellular_location", "subcellular location", "cellular component", "cell component", "organelle",
                "compartment", "localization" },
        { "ms_terms", "instrument", "mass spectrometer", "ms instrument", "ionization", "fragmentation", "analyzer",
                "detector", "scan type", "mass accuracy" },
        { "unimod", "modification parameters", "ptm", "post-translational modification", "chemical modification",
                "protein modification", "unimod" }
    };

    /**
     * Construct a template matcher.
     *
     * @param registry	template library to search
     */
    public TemplateMatcher(TemplateRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return the best template for a new column in a table, or NULL if there is none
     *
     * @param table		table receiving the column
     * @param name		name of the new column
     */
    public ColumnTemplate match(MetadataTable table, String name) {
        ColumnTemplate retVal = null;
        String schema = this.preferredSchema(table);
        if (schema != null)
            retVal = this.registry.match(name, schema);
        if (retVal == null)
            retVal = this.registry.match(name);
        return retVal;
    }

    /**
     * @return the known schema with the most templates in use by a table, or NULL if the table uses none
     *
     * @param table		table to examine
     */
    public String preferredSchema(MetadataTable table) {
        Map<String, Integer> counts = new LinkedHashMap<String, Integer>();
        for (MetadataColumn column : table.getColumns()) {
            String schema = ColumnTemplate.schemaOf(column.getTemplateRef());
            if (schema != null && this.registry.hasSchema(schema))
                counts.merge(schema, 1, Integer::sum);
        }
        String retVal = null;
        int best = 0;
        for (Map.Entry<String, Integer> count : counts.entrySet()) {
            if (count.getValue() > best) {
                best = count.getValue();
                retVal = count.getKey();
            }
        }
        return retVal;
    }

    /**
     * Copy a template's metadata onto a column.  The template default is only used if requested and the
     * column has no default of its own.
     *
     * @param template		source template
     * @param column		column to update
     * @param withDefault	TRUE to copy the template's default value
     */
    public static void applyTemplate(ColumnTemplate template, MetadataColumn column, boolean withDefault) {
        column.setOntologyType(template.getOntologyType());
        column.setOntologyOptions(template.getOntologyOptions());
        column.setTemplateRef(template.getReference());
        column.setHidden(template.isHidden());
        column.setMandatory(template.isMandatory());
        if (withDefault && column.getDefaultValue() == null)
            column.setDefaultValue(template.getDefaultValue());
    }

    /**
     * Add a column to a table, inheriting metadata from a matching template.  If there is no template, the
     * ontology type is guessed from the column name.
     *
     * @param table		table to receive the column
     * @param name		name of the new column
     * @param position	desired position, or a negative number to append
     *
     * @return the column created
     */
    public MetadataColumn addColumn(MetadataTable table, String name, int position) {
        final ColumnTemplate template = this.match(table, name);
        return table.addColumn(name, position, x -> this.setupColumn(template, x, true));
    }

    /**
     * Add a column for imported data.  This is the same as {@link #addColumn}, except the template default
     * is not copied, since the column's values come entirely from the imported cells.
     *
     * @param table		table to receive the column
     * @param name		name of the new column
     * @param position	desired position, or a negative number to append
     *
     * @return the column created
     */
    public MetadataColumn addImportedColumn(MetadataTable table, String name, int position) {
        final ColumnTemplate template = this.match(table, name);
        return table.addColumn(name, position, x -> this.setupColumn(template, x, false));
    }

    /**
     * Initialize a new column from a template.
     *
     * @param template		template to use, or NULL if there is none
     * @param column		new column to initialize
     * @param withDefault	TRUE to copy the template's default value
     */
    private void setupColumn(ColumnTemplate template, MetadataColumn column, boolean withDefault) {
        if (template != null)
            applyTemplate(template, column, withDefault);
        else if (column.getOntologyType() == null)
            column.setOntologyType(detectOntologyType(column.getName()));
    }

    /**
     * @return the ontology type suggested by a column name, or NULL if none is suggested
     *
     * @param name		column name to examine
     */
    public static String detectOntologyType(String name) {
        String key = ColumnCategory.normalize(name);
        String retVal = null;
        for (int i = 0; i < ONTOLOGY_PATTERNS.length && retVal == null; i++) {
            String[] patterns = ONTOLOGY_PATTERNS[i];
            for (int j = 1; j < patterns.length && retVal == null; j++) {
                if (key.contains(patterns[j]))
                    retVal = patterns[0];
            }
        }
        return retVal;
    }

}
