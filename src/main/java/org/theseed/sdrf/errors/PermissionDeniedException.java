/**
 *
 */
package org.theseed.sdrf.errors;

/**
 * This exception is thrown when the access policy refuses an operation on a table.
 *
 * @author Bruce Parrello
 *
 */
public class PermissionDeniedException extends SdrfException {

    /** serialization ID */
    private static final long serialVersionUID = 1L;

    /**
     * Construct an exception with a message.
     *
     * @param message	description of the failure
     */
    public PermissionDeniedException(String message) {
        super(message);
    }

}
