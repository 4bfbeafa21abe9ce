package com.RK8.PriceChecker.Parser;

import com.RK8.PriceChecker.DTO.CatalogEntry;
import com.RK8.PriceChecker.Exception.CatalogLoadException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.*;

/**
 * Reads the master price list workbook (first sheet, columns Brand, Part No,
 * Root Part No, MRP, GST%).
 */
@Slf4j
@Component
public class CatalogExcelParser {
    private static final String BRAND = "BRAND";
    private static final String PART_NO = "PART_NO";
    private static final String ROOT_PART_NO = "ROOT_PART_NO";
    private static final String MRP = "MRP";
    private static final String GST = "GST";

    public List<CatalogEntry> parse(InputStream is) {
        try (Workbook workbook = WorkbookFactory.create(is)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new CatalogLoadException("Master price list workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            int headerRowIndex = findHeaderRow(sheet);
            Map<String, Integer> colIndex = buildColumnIndexMap(sheet.getRow(headerRowIndex));
            validateColumns(colIndex);

            List<CatalogEntry> list = new ArrayList<>();
            int dropped = 0;
            for (int i = headerRowIndex + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null || isEmptyRow(row)) continue;

                CatalogEntry entry = CatalogRecords.toEntry(
                        getStringValue(row.getCell(colIndex.get(PART_NO))),
                        getStringValue(row.getCell(colIndex.get(ROOT_PART_NO))),
                        getStringValue(row.getCell(colIndex.get(BRAND))),
                        getStringValue(row.getCell(colIndex.get(MRP))),
                        getStringValue(row.getCell(colIndex.get(GST))));
                if (entry == null) {
                    log.warn("Dropping catalog row {} with missing part number, MRP or GST%", i + 1);
                    dropped++;
                    continue;
                }
                list.add(entry);
            }

            log.info("Catalog Excel Parser: Loaded {} entries, dropped {}", list.size(), dropped);
            return list;

        } catch (IOException | org.apache.poi.EncryptedDocumentException e) {
            throw new CatalogLoadException("Could not read master price list workbook: " + e.getMessage(), e);
        }
    }

    private boolean isEmptyRow(Row row) {
        for (Cell cell : row) {
            if (cell != null && cell.getCellType() != CellType.BLANK
                    && !getStringValue(cell).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private int findHeaderRow(Sheet sheet) {
        for (int i = 0; i <= 20; i++) {
            Row row = sheet.getRow(i);
            if (row == null) continue;

            int hits = 0;
            for (Cell cell : row) {
                String v = getStringValue(cell).toUpperCase();
                if (v.contains("PART") && v.contains("NO")) hits++;
                if (v.equals("MRP")) hits++;
                if (v.contains("GST")) hits++;
            }
            if (hits >= 2) {
                log.debug("Found catalog header at row: {}", i);
                return i;
            }
        }
        throw new CatalogLoadException("Catalog header row not found");
    }

    private Map<String, Integer> buildColumnIndexMap(Row headerRow) {
        Map<String, Integer> map = new HashMap<>();
        for (Cell cell : headerRow) {
            String h = getStringValue(cell).toUpperCase();

            if (h.contains("ROOT") && h.contains("PART")) {
                map.putIfAbsent(ROOT_PART_NO, cell.getColumnIndex());
            } else if (h.contains("PART") && h.contains("NO")) {
                map.putIfAbsent(PART_NO, cell.getColumnIndex());
            } else if (h.contains("BRAND")) {
                map.putIfAbsent(BRAND, cell.getColumnIndex());
            } else if (h.equals("MRP")) {
                map.putIfAbsent(MRP, cell.getColumnIndex());
            } else if (h.contains("GST")) {
                map.putIfAbsent(GST, cell.getColumnIndex());
            }
        }
        return map;
    }

    private void validateColumns(Map<String, Integer> colIndex) {
        String[] required = {BRAND, PART_NO, ROOT_PART_NO, MRP, GST};
        for (String col : required) {
            if (!colIndex.containsKey(col)) {
                throw new CatalogLoadException("Missing required column in master price list: " + col);
            }
        }
    }

    private String getStringValue(Cell cell) {
        if (cell == null) return "";

        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue().trim();
            case NUMERIC:
                return BigDecimal.valueOf(cell.getNumericCellValue())
                        .stripTrailingZeros().toPlainString();
            case FORMULA:
                if (cell.getCachedFormulaResultType() == CellType.NUMERIC) {
                    return BigDecimal.valueOf(cell.getNumericCellValue())
                            .stripTrailingZeros().toPlainString();
                }
                if (cell.getCachedFormulaResultType() == CellType.STRING) {
                    return cell.getStringCellValue().trim();
                }
                return "";
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }
}
