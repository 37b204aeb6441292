/**
 *
 */
package org.theseed.sdrf.templates;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.theseed.sdrf.matrix.ColumnCategory;

/**
 * A column template is a reusable column definition.  When a new column's name matches a template, the column
 * inherits the template's ontology information, flags and default value.  A template belongs to a schema,
 * which is an ordered list of templates used to arrange the columns of a table.
 *
 * @author Bruce Parrello
 *
 */
public class ColumnTemplate {

    // FIELDS
    /** column name */
    private final String name;
    /** name of the owning schema */
    private final String schema;
    /** column category */
    private final ColumnCategory columnType;
    /** ontology type, or NULL */
    private String ontologyType;
    /** allowed ontology sources */
    private List<String> ontologyOptions;
    /** TRUE if the column should be hidden */
    private boolean hidden;
    /** TRUE if the column is required */
    private boolean mandatory;
    /** default value, or NULL */
    private String defaultValue;
    /** pattern that stored values must match, or NULL */
    private Pattern valuePattern;

    /**
     * Construct a column template.
     *
     * @param name		column name
     * @param schema	name of the owning schema
     */
    public ColumnTemplate(String name, String schema) {
        this.name = StringUtils.trimToEmpty(name);
        this.schema = StringUtils.trimToEmpty(schema);
        this.columnType = ColumnCategory.fromName(this.name);
        this.ontologyType = null;
        this.ontologyOptions = new ArrayList<String>();
        this.hidden = false;
        this.mandatory = false;
        this.defaultValue = null;
        this.valuePattern = null;
    }

    /**
     * @return the reference string stored in columns created from this template
     */
    public String getReference() {
        return this.schema + "/" + this.name;
    }

    /**
     * @return the schema name portion of a template reference, or NULL if the reference is malformed
     *
     * @param reference		template reference to parse
     */
    public static String schemaOf(String reference) {
        String retVal = null;
        if (reference != null && reference.contains("/"))
            retVal = StringUtils.substringBefore(reference, "/");
        return retVal;
    }

    /**
     * @return a description of the problem with a value, or NULL if the value is acceptable
     *
     * @param value		value to check
     */
    public String checkValue(String value) {
        String retVal = null;
        if (this.valuePattern != null && value != null && ! this.valuePattern.matcher(value).matches())
            retVal = "Value \"" + value + "\" in column \"" + this.name + "\" does not match pattern "
                    + this.valuePattern.pattern() + ".";
        return retVal;
    }

    /**
     * @return the normalized column name
     */
    public String getKey() {
        return ColumnCategory.normalize(this.name);
    }

    /**
     * @return the column name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the schema name
     */
    public String getSchema() {
        return this.schema;
    }

    /**
     * @return the column category
     */
    public ColumnCategory getColumnType() {
        return this.columnType;
    }

    /**
     * @return the ontology type, or NULL
     */
    public String getOntologyType() {
        return this.ontologyType;
    }

    /**
     * @param ontologyType 	the ontology type to set
     */
    public void setOntologyType(String ontologyType) {
        this.ontologyType = StringUtils.trimToNull(ontologyType);
    }

    /**
     * @return the allowed ontology sources
     */
    public List<String> getOntologyOptions() {
        return Collections.unmodifiableList(this.ontologyOptions);
    }

    /**
     * @param ontologyOptions 	the allowed ontology sources
     */
    public void setOntologyOptions(List<String> ontologyOptions) {
        this.ontologyOptions = new ArrayList<String>(ontologyOptions);
    }

    /**
     * @return TRUE if columns from this template are hidden
     */
    public boolean isHidden() {
        return this.hidden;
    }

    /**
     * @param hidden 	TRUE if columns from this template are hidden
     */
    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

    /**
     * @return TRUE if columns from this template are required
     */
    public boolean isMandatory() {
        return this.mandatory;
    }

    /**
     * @param mandatory 	TRUE if columns from this template are required
     */
    public void setMandatory(boolean mandatory) {
        this.mandatory = mandatory;
    }

    /**
     * @return the default value, or NULL
     */
    public String getDefaultValue() {
        return this.defaultValue;
    }

    /**
     * @param defaultValue 	the default value to set
     */
    public void setDefaultValue(String defaultValue) {
        this.defaultValue = StringUtils.trimToNull(defaultValue);
    }

    /**
     * @return the value pattern, or NULL
     */
    public Pattern getValuePattern() {
        return this.valuePattern;
    }

    /**
     * @param regex 	the value pattern to set, or an empty string for none
     */
    public void setValuePattern(String regex) {
        if (StringUtils.isBlank(regex))
            this.valuePattern = null;
        else
            this.valuePattern = Pattern.compile(regex);
    }

    @Override
    public String toString() {
        return this.getReference();
    }

}
