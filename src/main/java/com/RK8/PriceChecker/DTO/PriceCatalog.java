package com.RK8.PriceChecker.DTO;

import java.util.*;

/**
 * Immutable master price list. Exact lookups go through an index on part number and
 * root part number; when an identifier occurs more than once the earliest entry in
 * catalog order owns it.
 */
public final class PriceCatalog {

    private final List<CatalogEntry> entries;
    private final Map<String, CatalogEntry> exactIndex;
    private final List<String> duplicateIdentifiers;

    public PriceCatalog(List<CatalogEntry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));

        Map<String, CatalogEntry> index = new HashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (CatalogEntry entry : this.entries) {
            index(index, duplicates, entry.getPartNo(), entry);
            if (!Objects.equals(entry.getRootPartNo(), entry.getPartNo())) {
                index(index, duplicates, entry.getRootPartNo(), entry);
            }
        }
        this.exactIndex = Collections.unmodifiableMap(index);
        this.duplicateIdentifiers = List.copyOf(duplicates);
    }

    private static void index(Map<String, CatalogEntry> index, Set<String> duplicates,
                              String key, CatalogEntry entry) {
        if (key == null || key.isEmpty()) return;
        CatalogEntry existing = index.putIfAbsent(key, entry);
        if (existing != null && existing != entry) {
            duplicates.add(key);
        }
    }

    public static PriceCatalog empty() {
        return new PriceCatalog(Collections.emptyList());
    }

    public Optional<CatalogEntry> findExact(String partNo) {
        return Optional.ofNullable(exactIndex.get(partNo));
    }

    public List<CatalogEntry> getEntries() {
        return entries;
    }

    public List<String> getDuplicateIdentifiers() {
        return duplicateIdentifiers;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
