/**
 *
 */
package org.theseed.sdrf;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FilenameUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.errors.SdrfException;
import org.theseed.sdrf.service.BulkExporter;
import org.theseed.sdrf.service.ExportManifest;
import org.theseed.sdrf.utils.BaseProcessor;
import org.theseed.sdrf.utils.ParseFailureException;

/**
 * This command exports every metadata file in a directory into a single ZIP archive.  The input files are the
 * workbooks (".xlsx") and SDRF files (".tsv" or ".sdrf") in the directory.  A file that cannot be loaded is
 * skipped.  The manifest of the export is written to the standard output.
 *
 * The positional parameters are the name of the input directory and the name of the output archive.  The
 * command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --templates	template library file (default is the built-in library)
 * --favourites	file of favourite options for the workbook dropdown lists
 * --format		output format (SDRF or WORKBOOK, default SDRF)
 * --noPools	if specified, reference pool lines will not be written to SDRF output
 *
 * @author Bruce Parrello
 *
 */
public class BulkExportProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BulkExportProcessor.class);
    /** table file support */
    private CommandSupport support;
    /** input files */
    private List<File> inFiles;

    // COMMAND-LINE OPTIONS

    /** template library file */
    @Option(name = "--templates", metaVar = "templates.tsv", usage = "template library file (if not built-in)")
    private File templateFile;

    /** favourite options file */
    @Option(name = "--favourites", metaVar = "favourites.tsv", usage = "favourite options file")
    private File favouriteFile;

    /** output format */
    @Option(name = "--format", usage = "output format")
    private BulkExporter.Format format;

    /** if specified, pool lines are omitted from SDRF output */
    @Option(name = "--noPools", usage = "if specified, reference pool lines will not be written")
    private boolean noPools;

    /** input directory */
    @Argument(index = 0, metaVar = "inDir", usage = "input directory of metadata files", required = true)
    private File inDir;

    /** output archive */
    @Argument(index = 1, metaVar = "output.zip", usage = "output ZIP archive", required = true)
    private File outFile;

    @Override
    protected void setDefaults() {
        this.templateFile = null;
        this.favouriteFile = null;
        this.format = BulkExporter.Format.SDRF;
        this.noPools = false;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (! this.inDir.isDirectory())
            throw new FileNotFoundException("Input directory " + this.inDir + " is not found or invalid.");
        File[] files = this.inDir.listFiles(x -> x.isFile() && FilenameUtils.isExtension(x.getName().toLowerCase(),
                "xlsx", "tsv", "sdrf"));
        this.inFiles = new ArrayList<File>(Arrays.asList(files));
        this.inFiles.sort(null);
        if (this.inFiles.isEmpty())
            throw new ParseFailureException("No metadata files found in " + this.inDir + ".");
        log.info("{} metadata files found in {}.", this.inFiles.size(), this.inDir);
        this.support = new CommandSupport(this.templateFile, this.favouriteFile, null);
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        List<Long> tableIds = new ArrayList<Long>(this.inFiles.size());
        for (File inFile : this.inFiles) {
            try {
                tableIds.add(this.support.load(inFile));
            } catch (SdrfException | IOException e) {
                log.error("Could not load {}: {}", inFile, e.toString());
            }
        }
        ExportManifest manifest;
        try (OutputStream outStream = new FileOutputStream(this.outFile)) {
            manifest = this.support.getService().bulkExport(CommandSupport.ACTOR, tableIds, this.format,
                    ! this.noPools, outStream);
        }
        System.out.println("table\tfile\tsize\terror");
        for (ExportManifest.Entry entry : manifest.getEntries())
            System.out.format("%s\t%s\t%d\t%s%n", entry.getTableName(),
                    entry.isSuccess() ? entry.getFileName() : "", entry.getSize(),
                    entry.isSuccess() ? "" : entry.getError());
        log.info("Bulk export to {}: {}.", this.outFile, manifest);
    }

}
