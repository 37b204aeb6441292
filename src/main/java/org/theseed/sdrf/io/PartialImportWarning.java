/**
 *
 */
package org.theseed.sdrf.io;

/**
 * A non-fatal problem found during an import.  The import recovers with a fallback and records the warning.
 *
 * @author Bruce Parrello
 *
 */
public class PartialImportWarning {

    // FIELDS
    /** 1-based input line number, or 0 if the warning is not tied to a line */
    private final int line;
    /** description of the problem */
    private final String message;

    /**
     * Construct a warning.
     *
     * @param line		input line number, or 0
     * @param message	description of the problem
     */
    public PartialImportWarning(int line, String message) {
        this.line = line;
        this.message = message;
    }

    /**
     * @return the input line number, or 0
     */
    public int getLine() {
        return this.line;
    }

    /**
     * @return the description of the problem
     */
    public String getMessage() {
        return this.message;
    }

    @Override
    public String toString() {
        return (this.line > 0 ? "line " + this.line + ": " : "") + this.message;
    }

}
