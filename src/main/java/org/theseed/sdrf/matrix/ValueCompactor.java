/**
 *
 */
package org.theseed.sdrf.matrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * This class converts a full map of sample values into the compact default-plus-modifiers form used by
 * a metadata column.  The most common value becomes the default.  Ties go to the value seen first when
 * the samples are scanned in ascending order.  Every other value becomes a modifier, and the modifiers
 * are listed in order of first appearance.  The output depends only on the input map, so the same map
 * always produces the same compaction.
 *
 * @author Bruce Parrello
 *
 */
public class ValueCompactor {

    /**
     * This object holds the result of a compaction.
     */
    public static class Compaction {

        /** default value (NULL if there were no values) */
        private final String defaultValue;
        /** modifiers for the non-default values */
        private final List<Modifier> modifiers;

        /**
         * Construct a compaction result.
         *
         * @param defaultValue	default value
         * @param modifiers		list of modifiers
         */
        protected Compaction(String defaultValue, List<Modifier> modifiers) {
            this.defaultValue = defaultValue;
            this.modifiers = Collections.unmodifiableList(modifiers);
        }

        /**
         * @return the default value, or NULL if the input was empty
         */
        public String getDefaultValue() {
            return this.defaultValue;
        }

        /**
         * @return the modifiers for the non-default values
         */
        public List<Modifier> getModifiers() {
            return this.modifiers;
        }

    }

    /**
     * Compact a map of sample values.
     *
     * @param valueMap	map of sample indices to values
     *
     * @return the default value and modifiers that reproduce the map
     */
    public static Compaction compact(Map<Integer, String> valueMap) {
        // Scan the samples in order, grouping them by value.  The linked hash map remembers first appearance.
        SortedMap<Integer, String> sorted = new TreeMap<Integer, String>(valueMap);
        Map<String, List<Integer>> groups = new LinkedHashMap<String, List<Integer>>();
        for (Map.Entry<Integer, String> entry : sorted.entrySet())
            groups.computeIfAbsent(entry.getValue(), x -> new ArrayList<Integer>()).add(entry.getKey());
        // Find the largest group.  A strict comparison keeps the earliest value on a tie.
        String defaultValue = null;
        int best = 0;
        for (Map.Entry<String, List<Integer>> group : groups.entrySet()) {
            if (group.getValue().size() > best) {
                best = group.getValue().size();
                defaultValue = group.getKey();
            }
        }
        // Everything else becomes a modifier.
        List<Modifier> modifiers = new ArrayList<Modifier>(groups.size());
        for (Map.Entry<String, List<Integer>> group : groups.entrySet()) {
            if (! group.getKey().equals(defaultValue))
                modifiers.add(new Modifier(RangeSet.of(group.getValue()), group.getKey()));
        }
        return new Compaction(defaultValue, modifiers);
    }

}
