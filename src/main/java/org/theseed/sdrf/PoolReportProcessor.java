/**
 *
 */
package org.theseed.sdrf;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.PoolColumn;
import org.theseed.sdrf.matrix.SamplePool;
import org.theseed.sdrf.utils.BaseReportProcessor;
import org.theseed.sdrf.utils.ParseFailureException;

/**
 * This command lists the pools of a metadata file.  For each pool, the report shows the pool name, whether it
 * is a reference pool, its member ranges and its pooled-sample value, followed by one line per column with the
 * pool-level value.
 *
 * The positional parameter is the name of the input file.  The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for the report (if not STDOUT)
 *
 * --templates	template library file (default is the built-in library)
 *
 * @author Bruce Parrello
 *
 */
public class PoolReportProcessor extends BaseReportProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(PoolReportProcessor.class);
    /** table file support */
    private CommandSupport support;

    // COMMAND-LINE OPTIONS

    /** template library file */
    @Option(name = "--templates", metaVar = "templates.tsv", usage = "template library file (if not built-in)")
    private File templateFile;

    /** input file */
    @Argument(index = 0, metaVar = "input.sdrf.tsv", usage = "input SDRF or workbook file", required = true)
    private File inFile;

    @Override
    protected void setReporterDefaults() {
        this.templateFile = null;
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        if (! this.inFile.canRead())
            throw new FileNotFoundException("Input file " + this.inFile + " is not found or unreadable.");
        this.support = new CommandSupport(this.templateFile, null, null);
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        long tableId = this.support.load(this.inFile);
        MetadataTable table = this.support.getService().getTable(CommandSupport.ACTOR, tableId);
        writer.println("pool\treference\tpooled_only\tpooled_and_independent\tsdrf_value");
        for (SamplePool pool : table.getPools()) {
            writer.format("%s\t%s\t%s\t%s\t%s%n", pool.getName(), pool.isReference() ? "Y" : "",
                    pool.getPooledOnly().encode(), pool.getPooledAndIndependent().encode(), pool.getSdrfValue());
            for (PoolColumn column : pool.getDerivedColumns())
                writer.format("\t%s\t%s%n", column.getName(), column.getValue());
        }
        log.info("{} pools found in {}.", table.getPools().size(), this.inFile);
    }

}
