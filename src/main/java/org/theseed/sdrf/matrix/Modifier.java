/**
 *
 */
package org.theseed.sdrf.matrix;

/**
 * A modifier is an exception to a column's default value.  It assigns a single value to a set of samples.
 *
 * @author Bruce Parrello
 *
 */
public class Modifier {

    // FIELDS
    /** samples covered by this modifier */
    private final RangeSet samples;
    /** value for those samples */
    private final String value;

    /**
     * Construct a modifier.
     *
     * @param samples	set of samples covered
     * @param value		value assigned to those samples
     */
    public Modifier(RangeSet samples, String value) {
        this.samples = samples;
        this.value = value;
    }

    /**
     * @return the samples covered by this modifier
     */
    public RangeSet getSamples() {
        return this.samples;
    }

    /**
     * @return the value assigned to the covered samples
     */
    public String getValue() {
        return this.value;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.samples.hashCode();
        result = prime * result + ((this.value == null) ? 0 : this.value.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Modifier)) {
            return false;
        }
        Modifier other = (Modifier) obj;
        if (! this.samples.equals(other.samples)) {
            return false;
        }
        if (this.value == null) {
            if (other.value != null) {
                return false;
            }
        } else if (!this.value.equals(other.value)) {
            return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return this.samples.encode() + "=" + this.value;
    }

}
