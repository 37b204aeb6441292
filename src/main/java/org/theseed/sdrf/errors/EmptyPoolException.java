/**
 *
 */
package org.theseed.sdrf.errors;

/**
 * This exception is thrown when a sample pool would be created with no member samples.
 *
 * @author Bruce Parrello
 *
 */
public class EmptyPoolException extends SdrfException {

    /** serialization ID */
    private static final long serialVersionUID = 1L;

    /**
     * Construct an exception with a message.
     *
     * @param message	description of the failure
     */
    public EmptyPoolException(String message) {
        super(message);
    }

}
