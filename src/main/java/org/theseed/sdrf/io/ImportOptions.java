/**
 *
 */
package org.theseed.sdrf.io;

/**
 * Options for an import.
 *
 * @author Bruce Parrello
 *
 */
public class ImportOptions {

    // FIELDS
    /** TRUE to delete the existing columns and pools before importing */
    private boolean replaceExisting;
    /** TRUE to create pools from the pooled-sample column */
    private boolean createPools;

    /**
     * Construct the default options:  merge with the existing columns and create pools.
     */
    public ImportOptions() {
        this.replaceExisting = false;
        this.createPools = true;
    }

    /**
     * @return TRUE if the existing columns and pools are deleted first
     */
    public boolean isReplaceExisting() {
        return this.replaceExisting;
    }

    /**
     * @param replaceExisting 	TRUE to delete the existing columns and pools first
     *
     * @return this object, for chaining
     */
    public ImportOptions setReplaceExisting(boolean replaceExisting) {
        this.replaceExisting = replaceExisting;
        return this;
    }

    /**
     * @return TRUE if pools are created from the pooled-sample column
     */
    public boolean isCreatePools() {
        return this.createPools;
    }

    /**
     * @param createPools 	TRUE to create pools from the pooled-sample column
     *
     * @return this object, for chaining
     */
    public ImportOptions setCreatePools(boolean createPools) {
        this.createPools = createPools;
        return this;
    }

}
