/**
 *
 */
package org.theseed.sdrf.errors;

/**
 * This exception is thrown when a workbook lacks one of the sheets an import cannot do without.
 *
 * @author Bruce Parrello
 *
 */
public class MissingRequiredSheetException extends SdrfException {

    /** serialization ID */
    private static final long serialVersionUID = 1L;

    /**
     * Construct an exception with a message.
     *
     * @param message	description of the failure
     */
    public MissingRequiredSheetException(String message) {
        super(message);
    }

    /**
     * Construct an exception with a message and a cause.
     *
     * @param message	description of the failure
     * @param cause		underlying exception
     */
    public MissingRequiredSheetException(String message, Throwable cause) {
        super(message, cause);
    }

}
