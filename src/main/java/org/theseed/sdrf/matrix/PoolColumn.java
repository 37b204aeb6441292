/**
 *
 */
package org.theseed.sdrf.matrix;

import java.util.ArrayList;
import java.util.List;

/**
 * A pool column is the pool-level copy of a table column.  Pools do not store modifiers, so each pool column
 * holds a single flat value.  The pool column is linked to its parent column by ID, and carries the parent's
 * name so that the link can be recovered by name when the ID is unknown (as in a spreadsheet import).  The
 * parent's metadata (category, default, ontology data and flags) is cloned onto the pool column and refreshed
 * whenever the derived value is.
 *
 * @author Bruce Parrello
 *
 */
public class PoolColumn {

    // FIELDS
    /** ID of the parent column, or 0 if the parent is not known */
    private long parentId;
    /** name of the parent column */
    private String name;
    /** column category */
    private ColumnCategory category;
    /** default value of the parent column */
    private String defaultValue;
    /** derived value */
    private String value;
    /** TRUE if unset values render as "not applicable" */
    private boolean notApplicable;
    /** TRUE if the parent column is hidden */
    private boolean hidden;
    /** TRUE if the parent column is mandatory */
    private boolean mandatory;
    /** ontology type, or NULL */
    private String ontologyType;
    /** ontology sources */
    private List<String> ontologyOptions;
    /** template reference, or NULL */
    private String templateRef;
    /** display position */
    private int position;

    /**
     * Construct a pool column for a parent column.
     *
     * @param parent	parent column in the owning table
     * @param value		derived value for the pool
     */
    public PoolColumn(MetadataColumn parent, String value) {
        this.value = value;
        this.ontologyOptions = new ArrayList<String>();
        this.copyParent(parent);
    }

    /**
     * Construct a copy of a pool column.
     *
     * @param other		pool column to copy
     */
    public PoolColumn(PoolColumn other) {
        this.parentId = other.parentId;
        this.name = other.name;
        this.category = other.category;
        this.defaultValue = other.defaultValue;
        this.value = other.value;
        this.notApplicable = other.notApplicable;
        this.hidden = other.hidden;
        this.mandatory = other.mandatory;
        this.ontologyType = other.ontologyType;
        this.ontologyOptions = new ArrayList<String>(other.ontologyOptions);
        this.templateRef = other.templateRef;
        this.position = other.position;
    }

    /**
     * Refresh the link and the metadata of this pool column from its parent.  The derived value is not
     * changed.
     *
     * @param parent	parent column in the owning table
     */
    public void copyParent(MetadataColumn parent) {
        this.parentId = parent.getId();
        this.name = parent.getName();
        this.category = parent.getCategory();
        this.defaultValue = parent.getDefaultValue();
        this.notApplicable = parent.isNotApplicable();
        this.hidden = parent.isHidden();
        this.mandatory = parent.isMandatory();
        this.ontologyType = parent.getOntologyType();
        this.ontologyOptions = new ArrayList<String>(parent.getOntologyOptions());
        this.templateRef = parent.getTemplateRef();
        this.position = parent.getPosition();
    }

    /**
     * @return TRUE if this pool column belongs to the specified parent column
     *
     * @param parent	parent column to check
     */
    public boolean isFor(MetadataColumn parent) {
        boolean retVal;
        if (this.parentId != 0)
            retVal = (this.parentId == parent.getId());
        else
            retVal = this.getKey().equals(parent.getKey());
        return retVal;
    }

    /**
     * @return the ID of the parent column
     */
    public long getParentId() {
        return this.parentId;
    }

    /**
     * @return the column name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the normalized column name
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
     * @return the default value of the parent column, or NULL
     */
    public String getDefaultValue() {
        return this.defaultValue;
    }

    /**
     * @return the derived value
     */
    public String getValue() {
        return this.value;
    }

    /**
     * @param value 	the new derived value
     */
    public void setValue(String value) {
        this.value = value;
    }

    /**
     * @return TRUE if unset values render as "not applicable"
     */
    public boolean isNotApplicable() {
        return this.notApplicable;
    }

    /**
     * @return TRUE if this column is hidden
     */
    public boolean isHidden() {
        return this.hidden;
    }

    /**
     * @return TRUE if this column is mandatory
     */
    public boolean isMandatory() {
        return this.mandatory;
    }

    /**
     * @return the ontology type, or NULL
     */
    public String getOntologyType() {
        return this.ontologyType;
    }

    /**
     * @return the ontology sources
     */
    public List<String> getOntologyOptions() {
        return this.ontologyOptions;
    }

    /**
     * @return the template reference, or NULL
     */
    public String getTemplateRef() {
        return this.templateRef;
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
        return this.name + "=" + this.value;
    }

}
