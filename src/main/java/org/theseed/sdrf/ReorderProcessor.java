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
import org.theseed.sdrf.templates.ColumnOrderer;
import org.theseed.sdrf.utils.BaseProcessor;
import org.theseed.sdrf.utils.ParseFailureException;

/**
 * This command rewrites a metadata file with its columns in section order.  With the SCHEMA or AUTO strategy,
 * the columns named by the schemas of the file's templates come first in each section.
 *
 * The positional parameters are the names of the input file and the output file.  The command-line options
 * are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --templates	template library file (default is the built-in library)
 * --strategy	ordering strategy (default AUTO)
 *
 * @author Bruce Parrello
 *
 */
public class ReorderProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReorderProcessor.class);
    /** table file support */
    private CommandSupport support;

    // COMMAND-LINE OPTIONS

    /** template library file */
    @Option(name = "--templates", metaVar = "templates.tsv", usage = "template library file (if not built-in)")
    private File templateFile;

    /** ordering strategy */
    @Option(name = "--strategy", usage = "column ordering strategy")
    private ColumnOrderer.Strategy strategy;

    /** input file */
    @Argument(index = 0, metaVar = "input.sdrf.tsv", usage = "input SDRF or workbook file", required = true)
    private File inFile;

    /** output file */
    @Argument(index = 1, metaVar = "output.sdrf.tsv", usage = "output SDRF or workbook file", required = true)
    private File outFile;

    @Override
    protected void setDefaults() {
        this.templateFile = null;
        this.strategy = ColumnOrderer.Strategy.AUTO;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (! this.inFile.canRead())
            throw new FileNotFoundException("Input file " + this.inFile + " is not found or unreadable.");
        this.support = new CommandSupport(this.templateFile, null, null);
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        long tableId = this.support.load(this.inFile);
        ColumnOrderer.Strategy used = this.support.getService().reorderColumns(CommandSupport.ACTOR, tableId,
                this.strategy);
        log.info("Columns reordered using {} strategy.", used);
        this.support.save(tableId, this.outFile, true);
    }

}
