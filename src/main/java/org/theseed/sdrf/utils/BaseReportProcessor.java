/**
 *
 */
package org.theseed.sdrf.utils;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.kohsuke.args4j.Option;

/**
 * This is the base class for a command that writes a text report.  The report goes to the standard output
 * unless an output file is specified.  In addition to the base options, the following option is supported.
 *
 * -o	output file for the report (if not STDOUT)
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseReportProcessor extends BaseProcessor {

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "--output", aliases = { "-o" }, metaVar = "report.txt", usage = "output file (if not STDOUT)")
    private File outFile;

    @Override
    protected final void setDefaults() {
        this.outFile = null;
        this.setReporterDefaults();
    }

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        this.validateReporterParms();
        if (this.outFile != null)
            log.info("Report will be written to {}.", this.outFile);
        return true;
    }

    @Override
    protected final void runCommand() throws Exception {
        OutputStream outStream = (this.outFile == null ? System.out : new FileOutputStream(this.outFile));
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(outStream, StandardCharsets.UTF_8));
        try {
            this.runReporter(writer);
        } finally {
            writer.flush();
            if (this.outFile != null)
                writer.close();
        }
    }

    /**
     * Set the defaults for the subclass's command-line options.
     */
    protected abstract void setReporterDefaults();

    /**
     * Validate the subclass's command-line options.
     *
     * @throws IOException if an input file cannot be accessed
     * @throws ParseFailureException if a parameter is invalid
     */
    protected abstract void validateReporterParms() throws IOException, ParseFailureException;

    /**
     * Write the report.
     *
     * @param writer	output writer for the report
     *
     * @throws Exception if an error occurs
     */
    protected abstract void runReporter(PrintWriter writer) throws Exception;

}
