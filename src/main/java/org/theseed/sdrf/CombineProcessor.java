/**
 *
 */
package org.theseed.sdrf;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FilenameUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.service.TableCombiner;
import org.theseed.sdrf.utils.BaseProcessor;
import org.theseed.sdrf.utils.ParseFailureException;

/**
 * This command combines several metadata files into one.  By default the columns of the input files are placed
 * side by side.  With "--rows", the samples of the input files are stacked instead.
 *
 * The positional parameters are the name of the output file followed by the names of the input files.  The
 * command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --templates	template library file (default is the built-in library)
 * --rows		if specified, the samples are stacked rather than the columns
 * --strategy	column selection for stacked samples (UNION or INTERSECTION, default UNION)
 *
 * @author Bruce Parrello
 *
 */
public class CombineProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CombineProcessor.class);
    /** table file support */
    private CommandSupport support;

    // COMMAND-LINE OPTIONS

    /** template library file */
    @Option(name = "--templates", metaVar = "templates.tsv", usage = "template library file (if not built-in)")
    private File templateFile;

    /** if specified, combine row-wise */
    @Option(name = "--rows", usage = "if specified, the samples will be stacked")
    private boolean rowwise;

    /** column selection strategy for row-wise combination */
    @Option(name = "--strategy", usage = "column selection strategy for stacked samples")
    private TableCombiner.MergeStrategy strategy;

    /** output file */
    @Argument(index = 0, metaVar = "output.sdrf.tsv", usage = "output SDRF or workbook file", required = true)
    private File outFile;

    /** input files */
    @Argument(index = 1, metaVar = "in1.sdrf.tsv in2.sdrf.tsv ...", usage = "input SDRF or workbook files",
            required = true)
    private List<File> inFiles;

    @Override
    protected void setDefaults() {
        this.templateFile = null;
        this.rowwise = false;
        this.strategy = TableCombiner.MergeStrategy.UNION;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        for (File inFile : this.inFiles) {
            if (! inFile.canRead())
                throw new FileNotFoundException("Input file " + inFile + " is not found or unreadable.");
        }
        this.support = new CommandSupport(this.templateFile, null, null);
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        List<Long> tableIds = new ArrayList<Long>(this.inFiles.size());
        for (File inFile : this.inFiles)
            tableIds.add(this.support.load(inFile));
        String name = FilenameUtils.getBaseName(this.outFile.getName());
        MetadataTable combined = this.support.getService().combineTables(CommandSupport.ACTOR, tableIds, name,
                this.rowwise, this.strategy);
        this.support.save(combined.getId(), this.outFile, true);
        log.info("{} files combined into {}: {} samples, {} columns.", this.inFiles.size(), this.outFile,
                combined.getSampleCount(), combined.getColumnCount());
    }

}
