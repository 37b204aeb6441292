/**
 *
 */
package org.theseed.sdrf.pools;

/**
 * Counts of the pools created, updated and deleted by a pool synchronization.
 *
 * @author Bruce Parrello
 *
 */
public class SyncResult {

    // FIELDS
    private int created;
    private int updated;
    private int deleted;

    public SyncResult() {
        this.created = 0;
        this.updated = 0;
        this.deleted = 0;
    }

    protected void countCreated() {
        this.created++;
    }

    protected void countUpdated() {
        this.updated++;
    }

    protected void countDeleted() {
        this.deleted++;
    }

    /**
     * @return the number of pools created
     */
    public int getCreated() {
        return this.created;
    }

    /**
     * @return the number of pools updated
     */
    public int getUpdated() {
        return this.updated;
    }

    /**
     * @return the number of pools deleted
     */
    public int getDeleted() {
        return this.deleted;
    }

    @Override
    public String toString() {
        return this.created + " created, " + this.updated + " updated, " + this.deleted + " deleted";
    }

}
