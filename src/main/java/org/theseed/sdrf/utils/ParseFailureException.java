/**
 *
 */
package org.theseed.sdrf.utils;

/**
 * This exception is thrown when a command-line parameter is invalid.
 *
 * @author Bruce Parrello
 *
 */
public class ParseFailureException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = 6124391458729731290L;

    public ParseFailureException(String message) {
        super(message);
    }

}
