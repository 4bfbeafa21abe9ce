package com.RK8.PriceChecker.Parser;

import com.RK8.PriceChecker.DTO.CatalogEntry;
import com.RK8.PriceChecker.Exception.CatalogLoadException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the master price list as a JSON array of
 * {@code {part_no, root_part_no, brand, mrp, gst_percent}} records.
 */
@Slf4j
@Component
public class CatalogJsonParser {

    private final ObjectMapper objectMapper;

    public CatalogJsonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<CatalogEntry> parse(InputStream is) {
        JsonNode root;
        try {
            root = objectMapper.readTree(is);
        } catch (IOException e) {
            throw new CatalogLoadException("Master price list is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new CatalogLoadException("Master price list must be a JSON array of records");
        }

        List<CatalogEntry> entries = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            index++;
            CatalogEntry entry = CatalogRecords.toEntry(
                    text(node, "part_no"),
                    text(node, "root_part_no"),
                    text(node, "brand"),
                    text(node, "mrp"),
                    text(node, "gst_percent"));
            if (entry == null) {
                log.warn("Dropping catalog record {}: {}", index, node);
                continue;
            }
            entries.add(entry);
        }

        log.info("Catalog JSON Parser: Loaded {} of {} records", entries.size(), index);
        return entries;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.isNumber()) return value.decimalValue().toPlainString();
        return value.asText();
    }
}
