/**
 *
 */
package org.theseed.sdrf.service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.io.SdrfExporter;
import org.theseed.sdrf.io.WorkbookExporter;
import org.theseed.sdrf.matrix.MetadataTable;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * This object exports a list of tables into a single ZIP archive, one file per table, followed by a
 * "manifest.json" entry describing the results.  A table that fails to export is recorded in the manifest
 * and does not stop the others.  The calling thread's interrupt flag is checked between tables.
 *
 * @author Bruce Parrello
 *
 */
public class BulkExporter {

    /**
     * Output formats for the table files.
     */
    public static enum Format {
        SDRF(".sdrf.tsv"), WORKBOOK("_template.xlsx");

        /** file name suffix */
        private final String suffix;

        private Format(String suffix) {
            this.suffix = suffix;
        }

        /**
         * @return the file name suffix for this format
         */
        public String getSuffix() {
            return this.suffix;
        }
    }

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BulkExporter.class);
    /** SDRF exporter */
    private final SdrfExporter sdrfExporter;
    /** workbook exporter */
    private final WorkbookExporter workbookExporter;
    /** JSON mapper for the manifest */
    private final ObjectMapper mapper;

    /** name of the manifest entry */
    public static final String MANIFEST_NAME = "manifest.json";
    /** maximum length of a file name, including the suffix */
    public static final int MAX_FILE_NAME = 200;

    /**
     * Construct a bulk exporter.
     *
     * @param sdrfExporter		SDRF exporter
     * @param workbookExporter	workbook exporter
     */
    public BulkExporter(SdrfExporter sdrfExporter, WorkbookExporter workbookExporter) {
        this.sdrfExporter = sdrfExporter;
        this.workbookExporter = workbookExporter;
        this.mapper = new ObjectMapper();
    }

    /**
     * Export tables to a ZIP archive.  The output stream is finished but not closed.
     *
     * @param tables		tables to export
     * @param format		output format
     * @param includePools	TRUE to include pool lines in SDRF output
     * @param outStream		output stream for the archive
     *
     * @return the manifest of the export
     *
     * @throws IOException if an error occurs writing the archive itself
     */
    public ExportManifest export(List<MetadataTable> tables, Format format, boolean includePools,
            OutputStream outStream) throws IOException {
        return this.export(tables, new ExportManifest(), format, includePools, outStream);
    }

    /**
     * Export tables to a ZIP archive, including in the manifest the tables that were rejected before the
     * export began.  The output stream is finished but not closed.
     *
     * @param tables		tables to export
     * @param skipped		manifest of the tables rejected by the caller
     * @param format		output format
     * @param includePools	TRUE to include pool lines in SDRF output
     * @param outStream		output stream for the archive
     *
     * @return the manifest of the export, with the skipped tables after the exported ones
     *
     * @throws IOException if an error occurs writing the archive itself
     */
    public ExportManifest export(List<MetadataTable> tables, ExportManifest skipped, Format format,
            boolean includePools, OutputStream outStream) throws IOException {
        ExportManifest retVal = new ExportManifest();
        Set<String> usedNames = new HashSet<String>();
        ZipOutputStream zipStream = new ZipOutputStream(outStream, StandardCharsets.UTF_8);
        for (MetadataTable table : tables) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Bulk export interrupted after {} tables.", retVal.getEntries().size());
                retVal.setCancelled();
                break;
            }
            byte[] content = null;
            try {
                content = this.exportTable(table, format, includePools);
            } catch (IOException | RuntimeException e) {
                log.error("Export of table \"{}\" failed: {}", table.getName(), e.toString());
                retVal.addFailure(table.getId(), table.getName(), e.toString());
            }
            if (content != null) {
                String fileName = safeFileName(table.getName(), format.getSuffix());
                if (! usedNames.add(fileName)) {
                    fileName = safeFileName(table.getName(), "_" + table.getId() + format.getSuffix());
                    usedNames.add(fileName);
                }
                zipStream.putNextEntry(new ZipEntry(fileName));
                zipStream.write(content);
                zipStream.closeEntry();
                retVal.addSuccess(table.getId(), table.getName(), fileName, content.length);
                log.debug("Table \"{}\" written to {}.", table.getName(), fileName);
            }
        }
        retVal.getEntries().addAll(skipped.getEntries());
        zipStream.putNextEntry(new ZipEntry(MANIFEST_NAME));
        zipStream.write(this.mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(retVal));
        zipStream.closeEntry();
        zipStream.finish();
        log.info("Bulk export complete: {}.", retVal);
        return retVal;
    }

    /**
     * @return the exported form of a single table
     *
     * @param table			table to export
     * @param format		output format
     * @param includePools	TRUE to include pool lines in SDRF output
     *
     * @throws IOException if an output error occurs
     */
    private byte[] exportTable(MetadataTable table, Format format, boolean includePools) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        switch (format) {
        case SDRF :
            Writer writer = new OutputStreamWriter(buffer, StandardCharsets.UTF_8);
            this.sdrfExporter.export(table, writer, includePools, null);
            writer.flush();
            break;
        case WORKBOOK :
            this.workbookExporter.export(table, buffer);
            break;
        }
        return buffer.toByteArray();
    }

    /**
     * Convert a table name to a safe file name.  Only letters, digits, spaces, hyphens and underscores are
     * kept, trailing spaces are removed, and the remaining spaces become underscores.  The name is truncated
     * so that the result, including the suffix, fits in the file name limit.
     *
     * @param name		table name
     * @param suffix	file name suffix
     *
     * @return a file name for the table
     */
    public static String safeFileName(String name, String suffix) {
        StringBuilder buffer = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_')
                buffer.append(c);
        }
        String base = StringUtils.stripEnd(buffer.toString(), " ").replace(' ', '_');
        int available = MAX_FILE_NAME - suffix.length();
        if (base.length() > available)
            base = base.substring(0, available);
        if (base.isEmpty())
            base = "table";
        return base + suffix;
    }

}
