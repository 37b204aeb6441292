/**
 *
 */
package org.theseed.sdrf.errors;

/**
 * This exception is thrown when a sample range string contains a token that is neither a positive integer
 * nor an ascending "start-end" pair.
 *
 * @author Bruce Parrello
 *
 */
public class MalformedRangeException extends SdrfException {

    /** serialization ID */
    private static final long serialVersionUID = 1L;

    /**
     * Construct an exception with a message.
     *
     * @param message	description of the failure
     */
    public MalformedRangeException(String message) {
        super(message);
    }

    /**
     * Construct an exception with a message and a cause.
     *
     * @param message	description of the failure
     * @param cause		underlying exception
     */
    public MalformedRangeException(String message, Throwable cause) {
        super(message, cause);
    }

}
