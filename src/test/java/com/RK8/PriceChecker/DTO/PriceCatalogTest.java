package com.RK8.PriceChecker.DTO;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PriceCatalogTest {

    private static CatalogEntry entry(String partNo, String rootPartNo) {
        return new CatalogEntry(partNo, rootPartNo, "Brand", new BigDecimal("1280"), new BigDecimal("28"));
    }

    @Test
    void indexesPartAndRootPartNumbers() {
        CatalogEntry e = entry("MN-77411", "MN-77410");
        PriceCatalog catalog = new PriceCatalog(List.of(e));

        assertThat(catalog.findExact("MN-77411")).containsSame(e);
        assertThat(catalog.findExact("MN-77410")).containsSame(e);
        assertThat(catalog.findExact("MN-7741")).isEmpty();
        assertThat(catalog.getDuplicateIdentifiers()).isEmpty();
    }

    @Test
    void reportsDuplicateIdentifiersOnce() {
        PriceCatalog catalog = new PriceCatalog(List.of(
                entry("MN-77410", "MN-77410"),
                entry("MN-77411", "MN-77410"),
                entry("MN-77412", "MN-77410"),
                entry("MN-77411", "MN-77411")));

        assertThat(catalog.getDuplicateIdentifiers()).containsExactly("MN-77410", "MN-77411");
        assertThat(catalog.findExact("MN-77411").get().getRootPartNo()).isEqualTo("MN-77410");
    }

    @Test
    void isNotAffectedByChangesToTheSourceList() {
        List<CatalogEntry> source = new ArrayList<>(List.of(entry("A", "A")));
        PriceCatalog catalog = new PriceCatalog(source);

        source.add(entry("B", "B"));

        assertThat(catalog.size()).isEqualTo(1);
        assertThatThrownBy(() -> catalog.getEntries().add(entry("C", "C")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
