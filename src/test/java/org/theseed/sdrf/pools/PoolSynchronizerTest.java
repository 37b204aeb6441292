/**
 *
 */
package org.theseed.sdrf.pools;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.theseed.sdrf.errors.EmptyPoolException;
import org.theseed.sdrf.errors.SdrfException;
import org.theseed.sdrf.errors.ValidationFailureException;
import org.theseed.sdrf.matrix.ColumnCategory;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.matrix.MetadataTable;
import org.theseed.sdrf.matrix.PoolColumn;
import org.theseed.sdrf.matrix.RangeSet;
import org.theseed.sdrf.matrix.SamplePool;

/**
 * Tests for keeping pools consistent with their tables.
 *
 * @author Bruce Parrello
 *
 */
public class PoolSynchronizerTest {

    private PoolSynchronizer synchronizer;
    private MetadataTable table;
    private MetadataColumn disease;

    @BeforeEach
    public void setup() {
        this.synchronizer = new PoolSynchronizer(new PoolAggregator());
        this.table = new MetadataTable(1, "test", 4);
        this.synchronizer.attach(this.table);
        this.table.addColumn("source name");
        this.disease = this.table.addColumn("characteristics[disease]");
        this.disease.setDefaultValue("normal");
        this.disease.setValueForSamples("cancer", RangeSet.of(3, 4));
    }

    /**
     * Verify that every pool has exactly one derived column per table column, in table order.
     */
    private void checkInvariant() {
        List<Long> parents = this.table.getColumns().stream().map(MetadataColumn::getId).collect(Collectors.toList());
        for (SamplePool pool : this.table.getPools()) {
            List<Long> derived = pool.getDerivedColumns().stream().map(PoolColumn::getParentId)
                    .collect(Collectors.toList());
            assertThat(pool.getName(), derived, equalTo(parents));
        }
    }

    @Test
    public void testColumnEvents() throws SdrfException {
        SamplePool pool = this.table.addPool("pool", RangeSet.of(2, 3, 4), RangeSet.EMPTY, false);
        this.synchronizer.getAggregator().refreshAll(this.table);
        this.checkInvariant();
        assertThat(pool.getDerivedColumn(this.disease).getValue(), equalTo("cancer"));
        MetadataColumn label = this.table.addColumn("comment[label]", 1, x -> x.setDefaultValue("TMT"));
        this.checkInvariant();
        PoolColumn derived = pool.getDerivedColumn(label);
        assertThat(derived.getValue(), equalTo("TMT"));
        assertThat(derived.getCategory(), equalTo(ColumnCategory.COMMENT));
        assertThat(derived.getDefaultValue(), equalTo("TMT"));
        assertThat(derived.isHidden(), equalTo(false));
        // Renames and flag changes reach the pool copy without touching its value.
        this.table.updateColumn(label.getId(), x -> {
            x.setName("characteristics[label]");
            x.setHidden(true);
            x.setMandatory(true);
            x.setNotApplicable(true);
            x.setOntologyType("ms_terms");
            x.setTemplateRef("minimum/comment[label]");
        });
        this.checkInvariant();
        derived = pool.getDerivedColumn(label);
        assertThat(derived.getName(), equalTo("characteristics[label]"));
        assertThat(derived.getCategory(), equalTo(ColumnCategory.CHARACTERISTICS));
        assertThat(derived.isHidden(), equalTo(true));
        assertThat(derived.isMandatory(), equalTo(true));
        assertThat(derived.isNotApplicable(), equalTo(true));
        assertThat(derived.getOntologyType(), equalTo("ms_terms"));
        assertThat(derived.getTemplateRef(), equalTo("minimum/comment[label]"));
        assertThat(derived.getValue(), equalTo("TMT"));
        PoolColumn copied = this.table.copy().findPool("pool").getDerivedColumns().get(1);
        assertThat(copied.getName(), equalTo("characteristics[label]"));
        assertThat(copied.isMandatory(), equalTo(true));
        // A refresh keeps the metadata in step as well.
        label.setHidden(false);
        this.synchronizer.getAggregator().refreshPool(this.table, pool);
        assertThat(pool.getDerivedColumn(label).isHidden(), equalTo(false));
        this.table.removeColumn(this.disease.getId());
        this.checkInvariant();
        assertThat(pool.getDerivedColumn(this.disease), nullValue());
        this.table.moveColumn(label.getId(), 5);
        this.checkInvariant();
    }

    @Test
    public void testSync() throws SdrfException {
        SamplePool keep = this.table.addPool("keep", RangeSet.of(1), RangeSet.EMPTY, false);
        SamplePool byId = this.table.addPool("old name", RangeSet.of(2), RangeSet.EMPTY, false);
        SamplePool doomed = this.table.addPool("doomed", RangeSet.of(4), RangeSet.EMPTY, false);
        PoolSpec spec1 = new PoolSpec("keep", RangeSet.of(3, 4), RangeSet.of(1), true);
        spec1.putExplicitValue(this.disease.getId(), "flu");
        spec1.setSdrfValue("SN=x,y,z");
        PoolSpec spec2 = new PoolSpec("new name", RangeSet.of(2, 3), RangeSet.EMPTY, false);
        spec2.setPoolId(byId.getId());
        PoolSpec spec3 = new PoolSpec("fresh", RangeSet.of(1, 2), RangeSet.EMPTY, false);
        SyncResult result = this.synchronizer.syncPoolsWithImport(this.table, Arrays.asList(spec1, spec2, spec3));
        assertThat(result.getUpdated(), equalTo(2));
        assertThat(result.getCreated(), equalTo(1));
        assertThat(result.getDeleted(), equalTo(1));
        assertThat(this.table.getPools().size(), equalTo(3));
        assertThat(this.table.getPools(), not(hasItem(doomed)));
        assertThat(keep.isReference(), equalTo(true));
        assertThat(keep.getPooledOnly(), equalTo(RangeSet.of(3, 4)));
        assertThat(keep.getPooledAndIndependent(), equalTo(RangeSet.of(1)));
        assertThat(keep.getDerivedColumn(this.disease).getValue(), equalTo("flu"));
        assertThat(keep.getSdrfValue(), equalTo("SN=x,y,z"));
        assertThat(byId.getName(), equalTo("new name"));
        assertThat(byId.getDerivedColumn(this.disease).getValue(), equalTo("normal"));
        SamplePool fresh = this.table.findPool("fresh");
        assertThat(fresh.getDerivedColumn(this.disease).getValue(), equalTo("normal"));
        assertThat(fresh.getSdrfValue(), equalTo("pooled"));
        this.checkInvariant();
        // An empty import list removes every pool.
        result = this.synchronizer.syncPoolsWithImport(this.table, Collections.emptyList());
        assertThat(result.getDeleted(), equalTo(3));
        assertThat(this.table.getPools(), empty());
    }

    @Test
    public void testInvalidSpecs() {
        assertThrows(EmptyPoolException.class, () -> this.synchronizer.syncPoolsWithImport(this.table,
                Arrays.asList(new PoolSpec("empty", RangeSet.EMPTY, RangeSet.EMPTY, false))));
        assertThrows(ValidationFailureException.class, () -> this.synchronizer.syncPoolsWithImport(this.table,
                Arrays.asList(new PoolSpec("far", RangeSet.of(12), RangeSet.EMPTY, false))));
    }

}
