/**
 *
 */
package org.theseed.sdrf;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.utils.BaseProcessor;
import org.theseed.sdrf.utils.ParseFailureException;

/**
 * This command converts a metadata file between SDRF and workbook format.  The format of each file is
 * determined by its name:  a file ending in ".xlsx" is a workbook and anything else is SDRF.
 *
 * The positional parameters are the names of the input file and the output file.  The command-line options
 * are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --templates	template library file (default is the built-in library)
 * --favourites	file of favourite options for the workbook dropdown lists
 * --synonyms	file of ontology synonyms for normalizing imported values
 * --noPools	if specified, reference pool lines will not be written to SDRF output
 *
 * @author Bruce Parrello
 *
 */
public class ConvertProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ConvertProcessor.class);
    /** table file support */
    private CommandSupport support;

    // COMMAND-LINE OPTIONS

    /** template library file */
    @Option(name = "--templates", metaVar = "templates.tsv", usage = "template library file (if not built-in)")
    private File templateFile;

    /** favourite options file */
    @Option(name = "--favourites", metaVar = "favourites.tsv", usage = "favourite options file")
    private File favouriteFile;

    /** ontology synonym file */
    @Option(name = "--synonyms", metaVar = "synonyms.tsv", usage = "ontology synonym file")
    private File synonymFile;

    /** if specified, pool lines are omitted from SDRF output */
    @Option(name = "--noPools", usage = "if specified, reference pool lines will not be written")
    private boolean noPools;

    /** input file */
    @Argument(index = 0, metaVar = "input.sdrf.tsv", usage = "input SDRF or workbook file", required = true)
    private File inFile;

    /** output file */
    @Argument(index = 1, metaVar = "output.xlsx", usage = "output SDRF or workbook file", required = true)
    private File outFile;

    @Override
    protected void setDefaults() {
        this.templateFile = null;
        this.favouriteFile = null;
        this.synonymFile = null;
        this.noPools = false;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (! this.inFile.canRead())
            throw new FileNotFoundException("Input file " + this.inFile + " is not found or unreadable.");
        if (this.inFile.getAbsoluteFile().equals(this.outFile.getAbsoluteFile()))
            throw new ParseFailureException("Input and output files must be different.");
        this.support = new CommandSupport(this.templateFile, this.favouriteFile, this.synonymFile);
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        long tableId = this.support.load(this.inFile);
        this.support.save(tableId, this.outFile, ! this.noPools);
        log.info("{} converted to {}.", this.inFile, this.outFile);
    }

}
