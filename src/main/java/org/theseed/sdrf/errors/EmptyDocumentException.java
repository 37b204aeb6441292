/**
 *
 */
package org.theseed.sdrf.errors;

/**
 * This exception is thrown when an SDRF document has no header line.
 *
 * @author Bruce Parrello
 *
 */
public class EmptyDocumentException extends SdrfException {

    /** serialization ID */
    private static final long serialVersionUID = 1L;

    /**
     * Construct an exception with a message.
     *
     * @param message	description of the failure
     */
    public EmptyDocumentException(String message) {
        super(message);
    }

}
