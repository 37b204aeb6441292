/**
 *
 */
package org.theseed.sdrf.service;

import java.util.ArrayList;
import java.util.List;

/**
 * This object describes the result of a bulk export:  one entry per table, with the file name used for a
 * successful export or the error message for a failed one.
 *
 * @author Bruce Parrello
 *
 */
public class ExportManifest {

    /**
     * This class describes the export of a single table.
     */
    public static class Entry {

        /** ID of the table */
        private final long tableId;
        /** name of the table */
        private final String tableName;
        /** name of the file in the archive, or NULL if the export failed */
        private final String fileName;
        /** size of the file in bytes */
        private final long size;
        /** error message, or NULL if the export succeeded */
        private final String error;

        /**
         * Create a manifest entry.
         *
         * @param tableId		ID of the table
         * @param tableName		name of the table
         * @param fileName		name of the file in the archive, or NULL for a failure
         * @param size			size of the file
         * @param error			error message, or NULL for a success
         */
        protected Entry(long tableId, String tableName, String fileName, long size, String error) {
            this.tableId = tableId;
            this.tableName = tableName;
            this.fileName = fileName;
            this.size = size;
            this.error = error;
        }

        /**
         * @return the table ID
         */
        public long getTableId() {
            return this.tableId;
        }

        /**
         * @return the table name
         */
        public String getTableName() {
            return this.tableName;
        }

        /**
         * @return the archive file name, or NULL if the export failed
         */
        public String getFileName() {
            return this.fileName;
        }

        /**
         * @return the file size in bytes
         */
        public long getSize() {
            return this.size;
        }

        /**
         * @return the error message, or NULL if the export succeeded
         */
        public String getError() {
            return this.error;
        }

        /**
         * @return TRUE if the export succeeded
         */
        public boolean isSuccess() {
            return this.error == null;
        }

    }

    // FIELDS
    /** list of table entries */
    private final List<Entry> entries;
    /** TRUE if the export was interrupted */
    private boolean cancelled;

    /**
     * Create an empty manifest.
     */
    public ExportManifest() {
        this.entries = new ArrayList<Entry>();
        this.cancelled = false;
    }

    /**
     * Record a successful export.
     *
     * @param tableId		ID of the table
     * @param tableName		name of the table
     * @param fileName		name of the file in the archive
     * @param size			size of the file
     */
    protected void addSuccess(long tableId, String tableName, String fileName, long size) {
        this.entries.add(new Entry(tableId, tableName, fileName, size, null));
    }

    /**
     * Record a failed export.
     *
     * @param tableId		ID of the table
     * @param tableName		name of the table
     * @param error			error message
     */
    protected void addFailure(long tableId, String tableName, String error) {
        this.entries.add(new Entry(tableId, tableName, null, 0, error));
    }

    /**
     * Denote that the export was interrupted.
     */
    protected void setCancelled() {
        this.cancelled = true;
    }

    /**
     * @return the table entries
     */
    public List<Entry> getEntries() {
        return this.entries;
    }

    /**
     * @return the number of successful exports
     */
    public int getSuccessCount() {
        return (int) this.entries.stream().filter(x -> x.isSuccess()).count();
    }

    /**
     * @return the number of failed exports
     */
    public int getFailureCount() {
        return this.entries.size() - this.getSuccessCount();
    }

    /**
     * @return TRUE if the export was interrupted before all the tables were processed
     */
    public boolean isCancelled() {
        return this.cancelled;
    }

    @Override
    public String toString() {
        return this.getSuccessCount() + " exported, " + this.getFailureCount() + " failed"
                + (this.cancelled ? ", cancelled" : "");
    }

}
