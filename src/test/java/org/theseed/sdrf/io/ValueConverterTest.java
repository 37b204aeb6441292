/**
 *
 */
package org.theseed.sdrf.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.theseed.sdrf.matrix.MetadataColumn;
import org.theseed.sdrf.service.FavouriteList;
import org.theseed.sdrf.service.FavouriteOption;
import org.theseed.sdrf.service.FavouriteTier;
import org.theseed.sdrf.service.SynonymLookup;

/**
 * Tests for favourite decoding and ontology normalization of imported values.
 *
 * @author Bruce Parrello
 *
 */
public class ValueConverterTest {

    @Test
    public void testFavouriteList() throws IOException {
        FavouriteList favourites = FavouriteList.load(new File("data", "favourites.tsv"));
        assertThat(favourites.size(), equalTo(5));
        assertThat(favourites.getOptions("characteristics[organism]", FavouriteTier.GLOBAL).stream()
                .map(FavouriteOption::getId).collect(Collectors.toList()), contains(103L, 104L));
        assertThat(favourites.getOptions("Characteristics[Organism]", FavouriteTier.LAB_GROUP).size(), equalTo(1));
        assertThat(favourites.getOptions("characteristics[disease]", FavouriteTier.GLOBAL), empty());
        FavouriteOption healthy = favourites.getOption(201);
        assertThat(healthy.toChoice(), equalTo("[201] Healthy[*]"));
        assertThat(healthy.getValue(), equalTo("normal"));
        assertThat(favourites.getOption(500), nullValue());
        assertThrows(IOException.class, () -> FavouriteList.load(new File("data", "synonyms.tsv")));
    }

    @Test
    public void testConvert() throws IOException {
        FavouriteList favourites = FavouriteList.load(new File("data", "favourites.tsv"));
        SynonymLookup synonyms = SynonymLookup.load(new File("data", "synonyms.tsv"));
        ValueConverter converter = new ValueConverter(favourites, synonyms);
        MetadataColumn disease = new MetadataColumn(1, "characteristics[disease]", 0);
        disease.setOntologyType("disease");
        assertThat(converter.convert(disease, "[201] Healthy[*]"), equalTo("normal"));
        assertThat(converter.convert(disease, " Healthy "), equalTo("normal"));
        assertThat(converter.convert(disease, "[999] Fibrosis[***]"), equalTo("Fibrosis"));
        assertThat(converter.convert(disease, "[999] healthy[**]"), equalTo("normal"));
        assertThat(converter.convert(disease, "cancer"), equalTo("cancer"));
        MetadataColumn label = new MetadataColumn(2, "comment[label]", 1);
        assertThat(converter.convert(label, "healthy"), equalTo("healthy"));
        assertThat(converter.convert(label, "[x] TMT126"), equalTo("TMT126"));
        assertThat(ValueConverter.plain().convert(disease, "[201] Healthy[*]"), equalTo("Healthy"));
    }

}
