/**
 *
 */
package org.theseed.sdrf.errors;

/**
 * This exception is thrown when a value or structure fails validation, for example overlapping pool
 * membership sets or a sample index outside the table.
 *
 * @author Bruce Parrello
 *
 */
public class ValidationFailureException extends SdrfException {

    /** serialization ID */
    private static final long serialVersionUID = 1L;

    /**
     * Construct an exception with a message.
     *
     * @param message	description of the failure
     */
    public ValidationFailureException(String message) {
        super(message);
    }

    /**
     * Construct an exception with a message and a cause.
     *
     * @param message	description of the failure
     * @param cause		underlying exception
     */
    public ValidationFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
