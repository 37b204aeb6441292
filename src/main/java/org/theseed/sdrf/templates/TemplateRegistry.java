/**
 *
 */
package org.theseed.sdrf.templates;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.matrix.ColumnCategory;

/**
 * This object holds a library of column templates.  Templates are looked up by normalized column name, and
 * grouped into schemas.  A schema is the ordered list of templates sharing a schema name.  The same column name
 * may appear in several schemas; a plain lookup returns the first one loaded.
 *
 * The library is loaded from a tab-delimited file with a header line.  The columns are
 *
 * 	name			column name
 * 	schema			schema name
 * 	ontology_type	ontology type (optional)
 * 	ontology_options	allowed ontology sources, separated by semicolons (optional)
 * 	hidden			"Y" if the column is hidden
 * 	mandatory		"Y" if the column is required
 * 	default_value	default value (optional)
 * 	pattern			regular expression for stored values (optional)
 *
 * The registry is passed explicitly to each component that needs it.
 *
 * @author Bruce Parrello
 *
 */
public class TemplateRegistry {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TemplateRegistry.class);
    /** map of normalized names to templates, in load order */
    private Map<String, List<ColumnTemplate>> templateMap;
    /** map of schema names to templates, in load order */
    private Map<String, List<ColumnTemplate>> schemaMap;

    /** name of the built-in template library resource */
    public static final String DEFAULT_RESOURCE = "templates/default_templates.tsv";

    /** format of a template library file */
    private static final CSVFormat LIBRARY_FORMAT = CSVFormat.TDF.builder().setHeader().setSkipHeaderRecord(true)
            .setQuote(null).setIgnoreEmptyLines(true).build();

    /**
     * Construct an empty template registry.
     */
    public TemplateRegistry() {
        this.templateMap = new LinkedHashMap<String, List<ColumnTemplate>>();
        this.schemaMap = new LinkedHashMap<String, List<ColumnTemplate>>();
    }

    /**
     * @return a registry containing the built-in template library
     *
     * @throws IOException if the library resource cannot be read
     */
    public static TemplateRegistry loadDefault() throws IOException {
        TemplateRegistry retVal = new TemplateRegistry();
        InputStream stream = TemplateRegistry.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (stream == null)
            throw new IOException("Template library resource " + DEFAULT_RESOURCE + " not found.");
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            retVal.load(reader);
        }
        return retVal;
    }

    /**
     * @return a registry containing the templates from a library file
     *
     * @param libFile	template library file to read
     *
     * @throws IOException if the file cannot be read
     */
    public static TemplateRegistry load(File libFile) throws IOException {
        TemplateRegistry retVal = new TemplateRegistry();
        try (Reader reader = Files.newBufferedReader(libFile.toPath(), StandardCharsets.UTF_8)) {
            retVal.load(reader);
        }
        log.info("{} templates in {} schemas loaded from {}.", retVal.size(), retVal.schemaMap.size(), libFile);
        return retVal;
    }

    /**
     * Add the templates from a library stream to this registry.
     *
     * @param reader	reader for the library file
     *
     * @throws IOException if the library cannot be parsed
     */
    public void load(Reader reader) throws IOException {
        try (CSVParser parser = LIBRARY_FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                String name = record.get("name");
                if (! StringUtils.isBlank(name)) {
                    ColumnTemplate template = new ColumnTemplate(name, record.get("schema"));
                    template.setOntologyType(optional(record, "ontology_type"));
                    String options = optional(record, "ontology_options");
                    if (! StringUtils.isBlank(options))
                        template.setOntologyOptions(Arrays.asList(StringUtils.split(options, ';')));
                    template.setHidden(flag(optional(record, "hidden")));
                    template.setMandatory(flag(optional(record, "mandatory")));
                    template.setDefaultValue(optional(record, "default_value"));
                    template.setValuePattern(optional(record, "pattern"));
                    this.add(template);
                }
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IOException("Invalid template library: " + e.getMessage(), e);
        }
    }

    /**
     * @return the value of an optional field, or an empty string if the field is absent
     *
     * @param record	input record
     * @param field		name of the field
     */
    private static String optional(CSVRecord record, String field) {
        String retVal = "";
        if (record.isMapped(field) && record.isSet(field))
            retVal = record.get(field);
        return retVal;
    }

    /**
     * @return TRUE if a flag field is set
     *
     * @param value		value of the flag field
     */
    private static boolean flag(String value) {
        return StringUtils.startsWithAny(value.toUpperCase(), "Y", "T", "1");
    }

    /**
     * Add a template to this registry.
     *
     * @param template	template to add
     */
    public void add(ColumnTemplate template) {
        this.templateMap.computeIfAbsent(template.getKey(), x -> new ArrayList<ColumnTemplate>()).add(template);
        this.schemaMap.computeIfAbsent(template.getSchema(), x -> new ArrayList<ColumnTemplate>()).add(template);
    }

    /**
     * @return the first template for a column name, or NULL if there is none
     *
     * @param name		column name to match (case-insensitive, exact)
     */
    public ColumnTemplate match(String name) {
        ColumnTemplate retVal = null;
        List<ColumnTemplate> templates = this.templateMap.get(ColumnCategory.normalize(name));
        if (templates != null)
            retVal = templates.get(0);
        return retVal;
    }

    /**
     * @return the template for a column name within a specific schema, or NULL if there is none
     *
     * @param name		column name to match
     * @param schema	schema to search
     */
    public ColumnTemplate match(String name, String schema) {
        ColumnTemplate retVal = null;
        List<ColumnTemplate> templates = this.templateMap.get(ColumnCategory.normalize(name));
        if (templates != null) {
            for (int i = 0; i < templates.size() && retVal == null; i++) {
                if (templates.get(i).getSchema().equals(schema))
                    retVal = templates.get(i);
            }
        }
        return retVal;
    }

    /**
     * @return the templates of a schema, in schema order (empty if the schema is unknown)
     *
     * @param schema	name of the schema
     */
    public List<ColumnTemplate> getSchema(String schema) {
        List<ColumnTemplate> retVal = this.schemaMap.get(schema);
        if (retVal == null)
            retVal = Collections.emptyList();
        return Collections.unmodifiableList(retVal);
    }

    /**
     * @return TRUE if the named schema exists
     *
     * @param schema	name of the schema
     */
    public boolean hasSchema(String schema) {
        return this.schemaMap.containsKey(schema);
    }

    /**
     * @return the names of all the schemas, in load order
     */
    public Collection<String> getSchemaNames() {
        return Collections.unmodifiableSet(this.schemaMap.keySet());
    }

    /**
     * @return the total number of templates
     */
    public int size() {
        int retVal = 0;
        for (List<ColumnTemplate> templates : this.schemaMap.values())
            retVal += templates.size();
        return retVal;
    }

}
