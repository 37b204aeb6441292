/**
 *
 */
package org.theseed.sdrf.matrix;

/**
 * Membership status of a sample with respect to a pool.
 *
 * @author Bruce Parrello
 *
 */
public enum SampleStatus {
    /** the sample exists only as part of the pool */
    POOLED_ONLY,
    /** the sample is reported independently and as part of the pool */
    POOLED_AND_INDEPENDENT,
    /** the sample is not in the pool */
    NOT_IN_POOL;
}
