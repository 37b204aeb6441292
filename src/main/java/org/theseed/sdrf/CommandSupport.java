/**
 *
 */
package org.theseed.sdrf;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.errors.SdrfException;
import org.theseed.sdrf.io.ImportOptions;
import org.theseed.sdrf.io.ImportResult;
import org.theseed.sdrf.io.PartialImportWarning;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.service.FavouriteList;
import org.theseed.sdrf.service.MemoryTableStore;
import org.theseed.sdrf.service.OntologyLookup;
import org.theseed.sdrf.service.OpenAccessPolicy;
import org.theseed.sdrf.service.SynonymLookup;
import org.theseed.sdrf.service.TableService;
import org.theseed.sdrf.templates.TemplateRegistry;

/**
 * This object holds the table service used by the command-line tools, along with the methods for reading and
 * writing table files.  A file whose name ends in ".xlsx" is a workbook; any other file is SDRF.
 *
 * @author Bruce Parrello
 *
 */
public class CommandSupport {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CommandSupport.class);
    /** table service */
    private final TableService service;

    /** name of the user for command-line operations */
    public static final String ACTOR = "cli";

    /**
     * Set up the table service.
     *
     * @param templateFile		template library file, or NULL for the built-in library
     * @param favouriteFile		favourite options file, or NULL for none
     * @param synonymFile		ontology synonym file, or NULL for none
     *
     * @throws IOException if a file cannot be read
     */
    public CommandSupport(File templateFile, File favouriteFile, File synonymFile) throws IOException {
        TemplateRegistry registry;
        if (templateFile == null)
            registry = TemplateRegistry.loadDefault();
        else
            registry = TemplateRegistry.load(templateFile);
        log.info("{} column templates loaded.", registry.size());
        FavouriteList favourites = (favouriteFile == null ? new FavouriteList() : FavouriteList.load(favouriteFile));
        OntologyLookup ontology = (synonymFile == null ? OntologyLookup.NONE : SynonymLookup.load(synonymFile));
        this.service = new TableService(new MemoryTableStore(), new OpenAccessPolicy(), registry, favourites, ontology);
    }

    /**
     * @return TRUE if the specified file is a workbook
     *
     * @param file	file to check
     */
    public static boolean isWorkbook(File file) {
        return FilenameUtils.isExtension(file.getName().toLowerCase(), "xlsx");
    }

    /**
     * @return the ID of a new table loaded from a file
     *
     * @param file		SDRF or workbook file to load
     *
     * @throws IOException if an input error occurs
     * @throws SdrfException if the file is invalid
     */
    public long load(File file) throws IOException, SdrfException {
        String name = FilenameUtils.getBaseName(file.getName());
        MetadataTable table = this.service.createTable(ACTOR, name, 0);
        ImportOptions options = new ImportOptions();
        ImportResult result;
        if (isWorkbook(file)) {
            try (InputStream inStream = new FileInputStream(file)) {
                result = this.service.importWorkbook(ACTOR, table.getId(), inStream, options);
            }
        } else {
            try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
                result = this.service.importSdrf(ACTOR, table.getId(), reader, options);
            }
        }
        for (PartialImportWarning warning : result.getWarnings())
            log.warn("{}: {}", file, warning);
        log.info("{} loaded:  {} samples, {} columns.", file, result.getSampleCount(), result.getColumnsCreated());
        return table.getId();
    }

    /**
     * Write a table to a file.
     *
     * @param tableId		ID of the table to write
     * @param file			output file (SDRF or workbook)
     * @param includePools	TRUE to include reference pool lines in SDRF output
     *
     * @throws IOException if an output error occurs
     * @throws SdrfException if the table is not found
     */
    public void save(long tableId, File file, boolean includePools) throws IOException, SdrfException {
        if (isWorkbook(file)) {
            try (OutputStream outStream = new FileOutputStream(file)) {
                this.service.exportWorkbook(ACTOR, tableId, outStream);
            }
        } else {
            try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
                int lines = this.service.exportSdrf(ACTOR, tableId, writer, includePools, null);
                log.info("{} data lines written to {}.", lines, file);
            }
        }
    }

    /**
     * @return the table service
     */
    public TableService getService() {
        return this.service;
    }

}
