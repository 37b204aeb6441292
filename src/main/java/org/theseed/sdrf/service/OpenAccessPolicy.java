/**
 *
 */
package org.theseed.sdrf.service;

import org.theseed.sdrf.matrix.MetadataTable;

/**
 * This access policy allows everyone to do everything.  It is used by the command-line tools.
 *
 * @author Bruce Parrello
 *
 */
public class OpenAccessPolicy implements AccessPolicy {

    @Override
    public boolean canView(String actor, MetadataTable table) {
        return true;
    }

    @Override
    public boolean canEdit(String actor, MetadataTable table) {
        return true;
    }

}
