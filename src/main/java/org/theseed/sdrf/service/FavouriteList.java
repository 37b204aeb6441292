/**
 *
 */
package org.theseed.sdrf.service;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.matrix.ColumnCategory;

/**
 * This is an in-memory favourite source.  It can be loaded from a tab-delimited file with the header
 * line "id	tier	column	display	value", where the tier is USER, LAB_GROUP or GLOBAL.  Options are
 * matched to columns by inner name, so "organism" and "characteristics[organism]" are the same column.
 *
 * @author Bruce Parrello
 *
 */
public class FavouriteList implements FavouriteSource {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(FavouriteList.class);
    /** options in load order */
    private List<FavouriteOption> options;
    /** map of option IDs to options */
    private Map<Long, FavouriteOption> idMap;

    /** input file format */
    private static final CSVFormat FILE_FORMAT = CSVFormat.TDF.builder().setHeader().setSkipHeaderRecord(true)
            .setQuote(null).setIgnoreEmptyLines(true).build();

    /**
     * Construct an empty favourite list.
     */
    public FavouriteList() {
        this.options = new ArrayList<FavouriteOption>();
        this.idMap = new HashMap<Long, FavouriteOption>();
    }

    /**
     * @return a favourite list loaded from a file
     *
     * @param inFile	file containing the favourite options
     *
     * @throws IOException if the file cannot be read or is invalid
     */
    public static FavouriteList load(File inFile) throws IOException {
        FavouriteList retVal = new FavouriteList();
        try (Reader reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8);
                CSVParser parser = FILE_FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                long id = Long.parseLong(record.get("id"));
                FavouriteTier tier = FavouriteTier.valueOf(record.get("tier").trim().toUpperCase());
                retVal.add(new FavouriteOption(id, tier, record.get("column"), record.get("display"),
                        record.get("value")));
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IOException("Invalid favourites file " + inFile + ": " + e.getMessage(), e);
        }
        log.info("{} favourite options loaded from {}.", retVal.options.size(), inFile);
        return retVal;
    }

    /**
     * Add an option to this list.
     *
     * @param option	option to add
     */
    public void add(FavouriteOption option) {
        this.options.add(option);
        this.idMap.put(option.getId(), option);
    }

    @Override
    public List<FavouriteOption> getOptions(String columnName, FavouriteTier tier) {
        String key = ColumnCategory.innerName(columnName);
        List<FavouriteOption> retVal = new ArrayList<FavouriteOption>();
        for (FavouriteOption option : this.options) {
            if (option.getTier() == tier && ColumnCategory.innerName(option.getColumnName()).equals(key))
                retVal.add(option);
        }
        return retVal;
    }

    @Override
    public FavouriteOption getOption(long id) {
        return this.idMap.get(id);
    }

    /**
     * @return the number of options in this list
     */
    public int size() {
        return this.options.size();
    }

}
