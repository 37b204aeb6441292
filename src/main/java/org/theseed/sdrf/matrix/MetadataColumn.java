/**
 *
 */
package org.theseed.sdrf.matrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.theseed.sdrf.errors.ValidationFailureException;

/**
 * A metadata column holds one SDRF field for every sample in a table.  Rather than storing a value per sample,
 * the column stores a default value plus a list of modifiers.  Each modifier assigns a value to a set of
 * samples, and no sample may be covered by more than one modifier.  A sample not covered by a modifier takes
 * the default value.  If there is no default, the sample resolves to "not applicable" or "not available",
 * depending on the column's not-applicable flag.
 *
 * Besides the values, the column carries its display position and the provenance information inherited from
 * a column template (ontology type, allowed ontology sources, template name).
 *
 * @author Bruce Parrello
 *
 */
public class MetadataColumn {

    // FIELDS
    /** ID of this column within its table */
    private final long id;
    /** column name (case preserved) */
    private String name;
    /** column category */
    private ColumnCategory category;
    /** default value, or NULL if there is none */
    private String defaultValue;
    /** sample-specific exceptions to the default */
    private List<Modifier> modifiers;
    /** TRUE if unset cells are "not applicable" rather than "not available" */
    private boolean notApplicable;
    /** TRUE if the column is hidden from the main view */
    private boolean hidden;
    /** TRUE if the column is required */
    private boolean mandatory;
    /** ontology type for validation, or NULL */
    private String ontologyType;
    /** allowed ontology sources */
    private List<String> ontologyOptions;
    /** name of the template this column came from, or NULL */
    private String templateRef;
    /** display position */
    private int position;

    /** value for unset cells in a not-applicable column */
    public static final String NOT_APPLICABLE = "not applicable";
    /** value for unset cells in a normal column */
    public static final String NOT_AVAILABLE = "not available";

    /**
     * Construct a blank column.
     *
     * @param id		ID of the column
     * @param name		name of the column
     * @param position	display position
     */
    public MetadataColumn(long id, String name, int position) {
        this.id = id;
        this.name = StringUtils.trimToEmpty(name);
        this.category = ColumnCategory.fromName(this.name);
        this.defaultValue = null;
        this.modifiers = new ArrayList<Modifier>();
        this.notApplicable = false;
        this.hidden = false;
        this.mandatory = false;
        this.ontologyType = null;
        this.ontologyOptions = new ArrayList<String>();
        this.templateRef = null;
        this.position = position;
    }

    /**
     * @return a copy of this column with the same ID
     */
    public MetadataColumn copy() {
        return this.copy(this.id);
    }

    /**
     * @return a copy of this column with a different ID
     *
     * @param newId		ID to give the copy
     */
    public MetadataColumn copy(long newId) {
        MetadataColumn retVal = new MetadataColumn(newId, this.name, this.position);
        retVal.category = this.category;
        retVal.copyValues(this);
        retVal.copyProperties(this);
        return retVal;
    }

    /**
     * Copy the value information (default and modifiers) from another column.
     *
     * @param other		column whose values are to be copied
     */
    public void copyValues(MetadataColumn other) {
        this.defaultValue = other.defaultValue;
        this.modifiers = new ArrayList<Modifier>(other.modifiers);
        this.notApplicable = other.notApplicable;
    }

    /**
     * Copy the display and provenance properties from another column.
     *
     * @param other		column whose properties are to be copied
     */
    public void copyProperties(MetadataColumn other) {
        this.hidden = other.hidden;
        this.mandatory = other.mandatory;
        this.ontologyType = other.ontologyType;
        this.ontologyOptions = new ArrayList<String>(other.ontologyOptions);
        this.templateRef = other.templateRef;
    }

    /**
     * @return the value of this column for the specified sample
     *
     * @param sampleIdx		1-based index of the sample of interest
     */
    public String resolve(int sampleIdx) {
        String retVal = this.rawValue(sampleIdx);
        if (retVal == null)
            retVal = this.getEmptyValue();
        return retVal;
    }

    /**
     * @return the explicitly-stored value for a sample (from a modifier or the default), or NULL if there is none
     *
     * @param sampleIdx		1-based index of the sample of interest
     */
    public String rawValue(int sampleIdx) {
        String retVal = null;
        for (int i = 0; i < this.modifiers.size() && retVal == null; i++) {
            Modifier modifier = this.modifiers.get(i);
            if (modifier.getSamples().contains(sampleIdx))
                retVal = modifier.getValue();
        }
        if (retVal == null && ! StringUtils.isEmpty(this.defaultValue))
            retVal = this.defaultValue;
        return retVal;
    }

    /**
     * @return the value used for samples with no stored value
     */
    public String getEmptyValue() {
        return (this.notApplicable ? NOT_APPLICABLE : NOT_AVAILABLE);
    }

    /**
     * Store the results of a compaction in this column.  The existing default and modifiers are replaced.
     *
     * @param compaction	compacted value information
     */
    public void applyCompaction(ValueCompactor.Compaction compaction) {
        this.defaultValue = compaction.getDefaultValue();
        this.modifiers = new ArrayList<Modifier>(compaction.getModifiers());
    }

    /**
     * Replace the modifiers of this column.
     *
     * @param newModifiers	list of new modifiers
     *
     * @throws ValidationFailureException if two modifiers cover the same sample
     */
    public void setModifiers(List<Modifier> newModifiers) throws ValidationFailureException {
        for (int i = 0; i < newModifiers.size(); i++) {
            RangeSet samples = newModifiers.get(i).getSamples();
            for (int j = i + 1; j < newModifiers.size(); j++) {
                if (samples.intersects(newModifiers.get(j).getSamples()))
                    throw new ValidationFailureException("Modifiers " + newModifiers.get(i) + " and "
                            + newModifiers.get(j) + " of column \"" + this.name + "\" overlap.");
            }
        }
        this.modifiers = new ArrayList<Modifier>(newModifiers);
    }

    /**
     * Assign a value to a set of samples.  The samples are removed from any other modifier, and then either
     * merged into an existing modifier with the same value or added as a new modifier.
     *
     * @param value		value to assign
     * @param samples	samples to receive the value
     */
    public void setValueForSamples(String value, RangeSet samples) {
        List<Modifier> updated = new ArrayList<Modifier>(this.modifiers.size() + 1);
        boolean merged = false;
        for (Modifier modifier : this.modifiers) {
            if (modifier.getValue().equals(value)) {
                updated.add(new Modifier(modifier.getSamples().union(samples), value));
                merged = true;
            } else {
                RangeSet remaining = modifier.getSamples().minus(samples);
                if (! remaining.isEmpty())
                    updated.add(new Modifier(remaining, modifier.getValue()));
            }
        }
        if (! merged)
            updated.add(new Modifier(samples, value));
        this.modifiers = updated;
    }

    /**
     * Set a new default value and remove all the modifiers.
     *
     * @param value		new value for every sample
     */
    public void replaceAll(String value) {
        this.defaultValue = value;
        this.modifiers = new ArrayList<Modifier>();
    }

    /**
     * Move the value of one sample to another index.  Whatever was stored at the new index is replaced,
     * and the old index is left with the default value.
     *
     * @param oldIdx	index to be moved
     * @param newIdx	destination index
     *
     * @return TRUE if any modifier changed
     */
    public boolean moveSample(int oldIdx, int newIdx) {
        boolean retVal = false;
        List<Modifier> updated = new ArrayList<Modifier>(this.modifiers.size());
        RangeSet both = RangeSet.of(oldIdx, newIdx);
        RangeSet newSet = RangeSet.of(newIdx);
        for (Modifier modifier : this.modifiers) {
            RangeSet samples = modifier.getSamples();
            if (samples.intersects(both)) {
                boolean moving = samples.contains(oldIdx);
                samples = samples.minus(both);
                if (moving)
                    samples = samples.union(newSet);
                retVal = true;
            }
            if (! samples.isEmpty())
                updated.add(new Modifier(samples, modifier.getValue()));
        }
        this.modifiers = updated;
        return retVal;
    }

    /**
     * @return the highest sample index referenced by a modifier, or 0 if there are no modifiers
     */
    public int maxReferencedSample() {
        int retVal = 0;
        for (Modifier modifier : this.modifiers) {
            if (! modifier.getSamples().isEmpty())
                retVal = Math.max(retVal, modifier.getSamples().last());
        }
        return retVal;
    }

    /**
     * Remove all references to samples beyond a specified limit.
     *
     * @param sampleCount	highest valid sample index
     */
    public void truncateSamples(int sampleCount) {
        if (this.maxReferencedSample() > sampleCount) {
            RangeSet excess = RangeSet.span(sampleCount + 1, this.maxReferencedSample());
            List<Modifier> updated = new ArrayList<Modifier>(this.modifiers.size());
            for (Modifier modifier : this.modifiers) {
                RangeSet samples = modifier.getSamples().minus(excess);
                if (! samples.isEmpty())
                    updated.add(new Modifier(samples, modifier.getValue()));
            }
            this.modifiers = updated;
        }
    }

    /**
     * @return the ID of this column
     */
    public long getId() {
        return this.id;
    }

    /**
     * @return the column name
     */
    public String getName() {
        return this.name;
    }

    /**
     * Rename this column.  The category is recomputed from the new name.
     *
     * @param name 	the new name
     */
    public void setName(String name) {
        this.name = StringUtils.trimToEmpty(name);
        this.category = ColumnCategory.fromName(this.name);
    }

    /**
     * @return the normalized name used for matching
     */
    public String getKey() {
        return ColumnCategory.normalize(this.name);
    }

    /**
     * @return the column category
     */
    public ColumnCategory getCategory() {
        return this.category;
    }

    /**
     * @return the default value (may be NULL)
     */
    public String getDefaultValue() {
        return this.defaultValue;
    }

    /**
     * Specify a new default value.
     *
     * @param defaultValue 	the default value to set (may be NULL)
     */
    public void setDefaultValue(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    /**
     * @return an unmodifiable view of the modifiers
     */
    public List<Modifier> getModifiers() {
        return Collections.unmodifiableList(this.modifiers);
    }

    /**
     * @return TRUE if unset cells are "not applicable"
     */
    public boolean isNotApplicable() {
        return this.notApplicable;
    }

    /**
     * @param notApplicable 	TRUE if unset cells should be "not applicable"
     */
    public void setNotApplicable(boolean notApplicable) {
        this.notApplicable = notApplicable;
    }

    /**
     * @return TRUE if this column is hidden
     */
    public boolean isHidden() {
        return this.hidden;
    }

    /**
     * @param hidden 	TRUE to hide this column
     */
    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

    /**
     * @return TRUE if this column is mandatory
     */
    public boolean isMandatory() {
        return this.mandatory;
    }

    /**
     * @param mandatory 	TRUE if this column is required
     */
    public void setMandatory(boolean mandatory) {
        this.mandatory = mandatory;
    }

    /**
     * @return the ontology type, or NULL if there is none
     */
    public String getOntologyType() {
        return this.ontologyType;
    }

    /**
     * @param ontologyType 	the ontology type to set
     */
    public void setOntologyType(String ontologyType) {
        this.ontologyType = ontologyType;
    }

    /**
     * @return the allowed ontology sources
     */
    public List<String> getOntologyOptions() {
        return this.ontologyOptions;
    }

    /**
     * @param ontologyOptions 	the allowed ontology sources
     */
    public void setOntologyOptions(List<String> ontologyOptions) {
        this.ontologyOptions = new ArrayList<String>(ontologyOptions);
    }

    /**
     * @return the name of the source template, or NULL if there is none
     */
    public String getTemplateRef() {
        return this.templateRef;
    }

    /**
     * @param templateRef 	the name of the source template
     */
    public void setTemplateRef(String templateRef) {
        this.templateRef = templateRef;
    }

    /**
     * @return the display position
     */
    public int getPosition() {
        return this.position;
    }

    /**
     * @param position 	the new display position
     */
    public void setPosition(int position) {
        this.position = position;
    }

    @Override
    public String toString() {
        return this.name + " (" + this.category.getLabel() + ")";
    }

}
