/**
 *
 */
package org.theseed.sdrf.service;

import org.theseed.sdrf.matrix.MetadataTable;

/**
 * This access policy allows only the owner of a table to change it.  The owner and the table's listed
 * viewers may read it.  A table with no owner is open to everyone.
 *
 * @author Bruce Parrello
 *
 */
public class OwnerAccessPolicy implements AccessPolicy {

    @Override
    public boolean canView(String actor, MetadataTable table) {
        return this.canEdit(actor, table) || table.getViewers().contains(actor);
    }

    @Override
    public boolean canEdit(String actor, MetadataTable table) {
        String owner = table.getOwner();
        return owner == null || owner.equals(actor);
    }

}
