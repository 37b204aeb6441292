/**
 *
 */
package org.theseed.sdrf.errors;

/**
 * This exception is thrown when a table, column or pool referenced by ID does not exist.
 *
 * @author Bruce Parrello
 *
 */
public class NotFoundException extends SdrfException {

    /** serialization ID */
    private static final long serialVersionUID = 1L;

    /**
     * Construct an exception with a message.
     *
     * @param message	description of the failure
     */
    public NotFoundException(String message) {
        super(message);
    }

}
