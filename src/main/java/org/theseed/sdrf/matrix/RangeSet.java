/**
 *
 */
package org.theseed.sdrf.matrix;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;
import org.theseed.sdrf.errors.MalformedRangeException;

/**
 * A range set is an immutable, sorted, duplicate-free set of sample indices.  Sample indices are positive
 * integers.  The set has a compact string form in which three or more consecutive indices collapse into
 * a "start-end" token and all other indices are listed individually, separated by commas.  So, the set
 * {1, 2, 3, 5, 7, 8} is encoded as "1-3,5,7,8".  Note that a run of exactly two is written as two
 * singletons.  On input, however, any ascending "start-end" token is accepted.
 *
 * @author Bruce Parrello
 *
 */
public class RangeSet implements Iterable<Integer> {

    // FIELDS
    /** sorted array of member indices */
    private final int[] members;

    /** empty range set */
    public static final RangeSet EMPTY = new RangeSet(new int[0]);

    /**
     * Construct a range set from a sorted, duplicate-free array.
     *
     * @param sorted	array of indices in ascending order
     */
    private RangeSet(int[] sorted) {
        this.members = sorted;
    }

    /**
     * @return a range set containing the specified indices
     *
     * @param indices	collection of sample indices (all must be positive)
     */
    public static RangeSet of(Collection<Integer> indices) {
        TreeSet<Integer> sorted = new TreeSet<Integer>(indices);
        int[] array = new int[sorted.size()];
        int i = 0;
        for (int idx : sorted) {
            if (idx < 1)
                throw new IllegalArgumentException("Invalid sample index " + idx + ".");
            array[i] = idx;
            i++;
        }
        return new RangeSet(array);
    }

    /**
     * @return a range set containing the specified indices
     *
     * @param indices	sample indices (all must be positive)
     */
    public static RangeSet of(int... indices) {
        List<Integer> list = new ArrayList<Integer>(indices.length);
        for (int idx : indices)
            list.add(idx);
        return of(list);
    }

    /**
     * @return a range set containing all the indices from a starting index to an ending index, inclusive
     *
     * @param start		first index
     * @param end		last index
     */
    public static RangeSet span(int start, int end) {
        if (start < 1)
            throw new IllegalArgumentException("Invalid sample index " + start + ".");
        if (end < start)
            return EMPTY;
        int[] array = new int[end - start + 1];
        for (int i = 0; i < array.length; i++)
            array[i] = start + i;
        return new RangeSet(array);
    }

    /**
     * Decode a sample range string.
     *
     * @param string	range string to parse (e.g. "1-3,5,7,8")
     *
     * @return the range set described by the string
     *
     * @throws MalformedRangeException if a token is not a valid index or ascending range
     */
    public static RangeSet parse(String string) throws MalformedRangeException {
        RangeSet retVal = EMPTY;
        if (! StringUtils.isBlank(string)) {
            TreeSet<Integer> indices = new TreeSet<Integer>();
            String[] tokens = StringUtils.splitPreserveAllTokens(string, ',');
            for (String rawToken : tokens) {
                String token = rawToken.trim();
                int dash = token.indexOf('-');
                if (dash < 0) {
                    indices.add(parseIndex(token, string));
                } else {
                    int start = parseIndex(token.substring(0, dash).trim(), string);
                    int end = parseIndex(token.substring(dash + 1).trim(), string);
                    if (end < start)
                        throw new MalformedRangeException("Descending range \"" + token + "\" in \"" + string + "\".");
                    for (int i = start; i <= end; i++)
                        indices.add(i);
                }
            }
            retVal = of(indices);
        }
        return retVal;
    }

    /**
     * @return the sample index represented by a token
     *
     * @param token		token to parse
     * @param string	full range string (for error messages)
     *
     * @throws MalformedRangeException if the token is not a positive integer
     */
    private static int parseIndex(String token, String string) throws MalformedRangeException {
        if (token.isEmpty() || ! StringUtils.isNumeric(token))
            throw new MalformedRangeException("Invalid token \"" + token + "\" in range \"" + string + "\".");
        int retVal;
        try {
            retVal = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new MalformedRangeException("Sample index \"" + token + "\" is out of range in \"" + string + "\".", e);
        }
        if (retVal < 1)
            throw new MalformedRangeException("Sample indices must be positive in range \"" + string + "\".");
        return retVal;
    }

    /**
     * @return the compact string form of this range set
     */
    public String encode() {
        List<String> tokens = new ArrayList<String>();
        int i = 0;
        while (i < this.members.length) {
            int start = this.members[i];
            int end = start;
            while (i + 1 < this.members.length && this.members[i + 1] == end + 1) {
                i++;
                end = this.members[i];
            }
            if (end - start >= 2)
                tokens.add(start + "-" + end);
            else {
                // Runs of one or two are listed individually.
                for (int idx = start; idx <= end; idx++)
                    tokens.add(Integer.toString(idx));
            }
            i++;
        }
        return StringUtils.join(tokens, ',');
    }

    /**
     * @return TRUE if the specified index is in this set
     *
     * @param idx	sample index to check
     */
    public boolean contains(int idx) {
        return Arrays.binarySearch(this.members, idx) >= 0;
    }

    /**
     * @return the number of indices in this set
     */
    public int size() {
        return this.members.length;
    }

    /**
     * @return TRUE if this set has no members
     */
    public boolean isEmpty() {
        return this.members.length == 0;
    }

    /**
     * @return the smallest index in this set
     */
    public int first() {
        if (this.members.length == 0)
            throw new NoSuchElementException("Range set is empty.");
        return this.members[0];
    }

    /**
     * @return the largest index in this set
     */
    public int last() {
        if (this.members.length == 0)
            throw new NoSuchElementException("Range set is empty.");
        return this.members[this.members.length - 1];
    }

    /**
     * @return the members of this set as a list
     */
    public List<Integer> toList() {
        List<Integer> retVal = new ArrayList<Integer>(this.members.length);
        for (int idx : this.members)
            retVal.add(idx);
        return retVal;
    }

    /**
     * @return a set containing the members of both this set and another
     *
     * @param other		other set to merge in
     */
    public RangeSet union(RangeSet other) {
        List<Integer> all = this.toList();
        all.addAll(other.toList());
        return of(all);
    }

    /**
     * @return a set containing the members of this set not found in another
     *
     * @param other		set of indices to remove
     */
    public RangeSet minus(RangeSet other) {
        List<Integer> kept = new ArrayList<Integer>(this.members.length);
        for (int idx : this.members) {
            if (! other.contains(idx))
                kept.add(idx);
        }
        return (kept.size() == this.members.length ? this : of(kept));
    }

    /**
     * @return TRUE if this set shares at least one member with another
     *
     * @param other		set to check
     */
    public boolean intersects(RangeSet other) {
        boolean retVal = false;
        for (int i = 0; i < this.members.length && ! retVal; i++)
            retVal = other.contains(this.members[i]);
        return retVal;
    }

    /**
     * @return a copy of this set with every index shifted by the specified amount
     *
     * @param offset	amount to add to each index
     */
    public RangeSet shift(int offset) {
        int[] array = new int[this.members.length];
        for (int i = 0; i < array.length; i++)
            array[i] = this.members[i] + offset;
        if (array.length > 0 && array[0] < 1)
            throw new IllegalArgumentException("Shift by " + offset + " produces a non-positive sample index.");
        return new RangeSet(array);
    }

    @Override
    public Iterator<Integer> iterator() {
        return this.toList().iterator();
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(this.members);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof RangeSet))
            return false;
        RangeSet other = (RangeSet) obj;
        return Arrays.equals(this.members, other.members);
    }

    @Override
    public String toString() {
        return this.encode();
    }

}
