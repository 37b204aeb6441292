/**
 *
 */
package org.theseed.sdrf.templates;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.sdrf.matrix.ColumnCategory;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;

/**
 * This object arranges the columns of a table.  The columns are always grouped into sections in the order
 * source name, characteristics, special, technology type, comment, factor value.  In schema ordering, the
 * columns named by the schemas in use come first within each section, in schema order, followed by the other
 * columns of the section in their current order.  In basic ordering, each section simply keeps its current
 * order.  Only positions change; column values are never touched.
 *
 * @author Bruce Parrello
 *
 */
public class ColumnOrderer {

    /**
     * Ordering strategies.
     */
    public static enum Strategy {
        /** order by the schemas of the table's templates, falling back to BASIC if there are none */
        AUTO,
        /** order by the schemas of the table's templates */
        SCHEMA,
        /** order by section only */
        BASIC;
    }

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ColumnOrderer.class);
    /** template library */
    private final TemplateRegistry registry;

    /**
     * Construct a column orderer.
     *
     * @param registry	template library containing the schemas
     */
    public ColumnOrderer(TemplateRegistry registry) {
        this.registry = registry;
    }

    /**
     * Reorder the columns of a table.
     *
     * @param table		table to reorder
     * @param strategy	ordering strategy
     *
     * @return the strategy actually used (SCHEMA or BASIC)
     */
    public Strategy reorder(MetadataTable table, Strategy strategy) {
        List<String> schemas = this.schemasInUse(table);
        Strategy retVal;
        if (strategy == Strategy.BASIC || schemas.isEmpty())
            retVal = Strategy.BASIC;
        else
            retVal = Strategy.SCHEMA;
        List<ColumnTemplate> schemaOrder = new ArrayList<ColumnTemplate>();
        if (retVal == Strategy.SCHEMA) {
            for (String schema : schemas)
                schemaOrder.addAll(this.registry.getSchema(schema));
        }
        table.applyOrder(this.computeOrder(table.getColumns(), schemaOrder));
        log.debug("Table \"{}\" reordered using {} strategy.", table.getName(), retVal);
        return retVal;
    }

    /**
     * @return the names of the known schemas referenced by the table's columns, in order of first reference
     *
     * @param table		table to examine
     */
    public List<String> schemasInUse(MetadataTable table) {
        Set<String> retVal = new LinkedHashSet<String>();
        for (MetadataColumn column : table.getColumns()) {
            String schema = ColumnTemplate.schemaOf(column.getTemplateRef());
            if (schema != null && this.registry.hasSchema(schema))
                retVal.add(schema);
        }
        return new ArrayList<String>(retVal);
    }

    /**
     * @return the columns arranged in section order, with schema columns first in each section
     *
     * @param columns		columns in their current order
     * @param schemaOrder	schema templates in the desired order (empty for basic ordering)
     */
    protected List<MetadataColumn> computeOrder(List<MetadataColumn> columns, List<ColumnTemplate> schemaOrder) {
        Map<ColumnCategory, List<MetadataColumn>> sections = new EnumMap<ColumnCategory, List<MetadataColumn>>(ColumnCategory.class);
        for (ColumnCategory category : ColumnCategory.values())
            sections.put(category, new ArrayList<MetadataColumn>());
        List<MetadataColumn> remaining = new ArrayList<MetadataColumn>(columns);
        // Place the schema columns.  All occurrences of a repeated name are kept together.
        Set<String> placed = new LinkedHashSet<String>();
        for (ColumnTemplate template : schemaOrder) {
            String key = template.getKey();
            if (placed.add(key)) {
                for (MetadataColumn column : columns) {
                    if (column.getKey().equals(key)) {
                        sections.get(column.getCategory()).add(column);
                        remaining.remove(column);
                    }
                }
            }
        }
        // Add the other columns in their current order.
        for (MetadataColumn column : remaining)
            sections.get(column.getCategory()).add(column);
        List<MetadataColumn> retVal = new ArrayList<MetadataColumn>(columns.size());
        for (List<MetadataColumn> section : sections.values())
            retVal.addAll(section);
        return retVal;
    }

}
