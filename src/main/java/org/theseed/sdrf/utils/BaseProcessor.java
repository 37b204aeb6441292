/**
 *
 */
package org.theseed.sdrf.utils;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for a command processor.  The subclass declares its options and arguments with args4j
 * annotations, sets their defaults in "setDefaults", checks them in "validateParms", and does its work in
 * "runCommand".  Every command supports the following options.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** start time of the command */
    private long startTime;
    /** TRUE if the command completed successfully */
    private boolean success;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "--help", aliases = { "-h" }, help = true, usage = "display command-line usage")
    private boolean help;

    /** debug-message flag */
    @Option(name = "--verbose", aliases = { "-v", "--debug" }, usage = "display more frequent log messages")
    private boolean debug;

    /**
     * Parse the command-line parameters.
     *
     * @param args	command-line parameters
     *
     * @return TRUE if the command is ready to run, FALSE if it should be skipped
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help)
                parser.printUsage(System.err);
            else {
                if (this.debug) {
                    ch.qos.logback.classic.Logger root =
                            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
                    root.setLevel(Level.DEBUG);
                }
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException | IOException e) {
            System.err.println(e.toString());
            parser.printUsage(System.err);
        }
        return retVal;
    }

    /**
     * Run the command, logging any error.
     */
    public void run() {
        this.startTime = System.currentTimeMillis();
        this.success = false;
        try {
            this.runCommand();
            this.success = true;
            log.info("{} seconds to run command.", (System.currentTimeMillis() - this.startTime) / 1000.0);
        } catch (Exception e) {
            log.error("Command failed.", e);
        }
    }

    /**
     * @return TRUE if the last run completed successfully
     */
    public boolean isSuccessful() {
        return this.success;
    }

    /**
     * Set the defaults for the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options.
     *
     * @return TRUE if the command should run, FALSE otherwise
     *
     * @throws IOException if an input file cannot be accessed
     * @throws ParseFailureException if a parameter is invalid
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Perform the command's work.
     *
     * @throws Exception if an error occurs
     */
    protected abstract void runCommand() throws Exception;

}
