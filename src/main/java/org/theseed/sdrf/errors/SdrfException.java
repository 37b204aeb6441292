/**
 *
 */
package org.theseed.sdrf.errors;

/**
 * This is the base class for all the failures reported by the metadata matrix engine.  Subclasses identify
 * the structural failures that abort an import, export or column edit.
 *
 * @author Bruce Parrello
 *
 */
public class SdrfException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = 1L;

    /**
     * Construct an exception with a message.
     *
     * @param message	description of the failure
     */
    public SdrfException(String message) {
        super(message);
    }

    /**
     * Construct an exception with a message and a cause.
     *
     * @param message	description of the failure
     * @param cause		underlying exception
     */
    public SdrfException(String message, Throwable cause) {
        super(message, cause);
    }

}
