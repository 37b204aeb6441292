/**
 *
 */
package org.theseed.sdrf.service;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This ontology lookup maps synonyms to preferred terms.  Matching is case-insensitive within an ontology type.
 * The synonyms can be loaded from a tab-delimited file with the header line "ontology_type	synonym	term".
 *
 * @author Bruce Parrello
 *
 */
public class SynonymLookup implements OntologyLookup {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SynonymLookup.class);
    /** map of ontology types to synonym maps */
    private Map<String, Map<String, String>> synonyms;

    /** input file format */
    private static final CSVFormat FILE_FORMAT = CSVFormat.TDF.builder().setHeader().setSkipHeaderRecord(true)
            .setQuote(null).setIgnoreEmptyLines(true).build();

    /**
     * Construct an empty synonym lookup.
     */
    public SynonymLookup() {
        this.synonyms = new HashMap<String, Map<String, String>>();
    }

    /**
     * @return a synonym lookup loaded from a file
     *
     * @param inFile	file containing the synonyms
     *
     * @throws IOException if the file cannot be read or is invalid
     */
    public static SynonymLookup load(File inFile) throws IOException {
        SynonymLookup retVal = new SynonymLookup();
        int count = 0;
        try (Reader reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8);
                CSVParser parser = FILE_FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                retVal.put(record.get("ontology_type"), record.get("synonym"), record.get("term"));
                count++;
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IOException("Invalid synonym file " + inFile + ": " + e.getMessage(), e);
        }
        log.info("{} synonyms loaded from {}.", count, inFile);
        return retVal;
    }

    /**
     * Add a synonym.
     *
     * @param ontologyType	ontology type of the term
     * @param synonym		synonym to recognize
     * @param term			preferred term
     */
    public void put(String ontologyType, String synonym, String term) {
        this.synonyms.computeIfAbsent(ontologyType.trim(), x -> new HashMap<String, String>())
                .put(synonym.trim().toLowerCase(Locale.ROOT), term.trim());
    }

    @Override
    public String normalize(String ontologyType, String value) {
        String retVal = null;
        Map<String, String> typeMap = this.synonyms.get(ontologyType);
        if (typeMap != null && ! StringUtils.isBlank(value))
            retVal = typeMap.get(value.trim().toLowerCase(Locale.ROOT));
        return retVal;
    }

}
