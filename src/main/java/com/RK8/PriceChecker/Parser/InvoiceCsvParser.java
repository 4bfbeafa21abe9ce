package com.RK8.PriceChecker.Parser;

import com.RK8.PriceChecker.DTO.InvoiceLine;
import com.RK8.PriceChecker.Exception.InvoiceFormatException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.*;

@Slf4j
@Component
public class InvoiceCsvParser {
    public static final String PART_NO = "Part No";
    public static final String SUPPLIER_PRICE = "Supplier Price";

    private static final List<String> REQUIRED_COLUMNS = List.of(PART_NO, SUPPLIER_PRICE);

    public List<InvoiceLine> parse(InputStream is) {
        try (InputStreamReader isr = new InputStreamReader(is, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(isr)) {

            String[] header = reader.readNext();
            if (header == null) {
                throw new InvoiceFormatException("Invoice file is empty");
            }
            Map<String, Integer> colIndex = buildColumnIndexMap(header);
            validateColumns(colIndex);

            int partNoIdx = colIndex.get(PART_NO);
            int priceIdx = colIndex.get(SUPPLIER_PRICE);

            List<InvoiceLine> lines = new ArrayList<>();
            int rowNumber = 0;
            String[] row;
            while ((row = reader.readNext()) != null) {
                rowNumber++;
                if (isEmptyRow(row)) continue;

                String partNo = cellAt(row, partNoIdx).trim();
                lines.add(new InvoiceLine(rowNumber, partNo, cellAt(row, priceIdx)));
            }

            log.info("Invoice Parser: Loaded {} lines", lines.size());
            return lines;

        } catch (IOException | CsvValidationException e) {
            throw new InvoiceFormatException("Error parsing CSV: " + e.getMessage(), e);
        }
    }

    private Map<String, Integer> buildColumnIndexMap(String[] header) {
        Map<String, Integer> map = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String h = header[i] == null ? "" : header[i].replace("\uFEFF", "").trim();
            map.putIfAbsent(h, i);
        }
        return map;
    }

    private void validateColumns(Map<String, Integer> colIndex) {
        List<String> missing = new ArrayList<>();
        for (String col : REQUIRED_COLUMNS) {
            if (!colIndex.containsKey(col)) {
                missing.add(col);
            }
        }
        if (!missing.isEmpty()) {
            throw new InvoiceFormatException("Missing columns: " + String.join(", ", missing));
        }
    }

    private boolean isEmptyRow(String[] row) {
        for (String cell : row) {
            if (cell != null && !cell.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private String cellAt(String[] row, int idx) {
        if (idx >= row.length || row[idx] == null) return "";
        return row[idx];
    }
}
