package com.RK8.PriceChecker.Service;

import com.RK8.PriceChecker.DTO.ReconciliationReport;
import com.RK8.PriceChecker.DTO.ReconciliationSummary;
import com.RK8.PriceChecker.DTO.RemarkStatus;
import com.RK8.PriceChecker.DTO.ResultRecord;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

@Service
public class PriceCheckReportService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("dd-MMM-yyyy");
    private static final int[] COLUMN_WIDTHS = {14, 18, 18, 12, 8, 20, 16, 30};

    public byte[] generateReport(ReconciliationReport report) {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Map<String, CellStyle> styles = createStyles(workbook);

            createSummarySheet(workbook, styles, report);
            createResultsSheet(workbook, styles, report);

            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            workbook.write(baos);
            return baos.toByteArray();

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to generate price check report", e);
        }
    }

    private Map<String, CellStyle> createStyles(XSSFWorkbook workbook) {
        Map<String, CellStyle> styles = new HashMap<>();

        CellStyle title = workbook.createCellStyle();
        title.setFont(boldFont(workbook, (short) 14, IndexedColors.BLACK));
        styles.put("title", title);

        CellStyle data = bordered(workbook);
        styles.put("data", data);

        CellStyle header = filled(workbook, data, IndexedColors.DARK_BLUE);
        header.setFont(boldFont(workbook, (short) 11, IndexedColors.WHITE));
        header.setAlignment(HorizontalAlignment.CENTER);
        styles.put("header", header);

        CellStyle currency = bordered(workbook);
        currency.setDataFormat(workbook.createDataFormat().getFormat("₹#,##0.00"));
        styles.put("currency", currency);

        styles.put("possible", filled(workbook, data, IndexedColors.LIGHT_YELLOW));
        styles.put("mismatch", filled(workbook, data, IndexedColors.CORAL));
        return styles;
    }

    private Font boldFont(XSSFWorkbook workbook, short points, IndexedColors color) {
        Font font = workbook.createFont();
        font.setBold(true);
        font.setFontHeightInPoints(points);
        font.setColor(color.getIndex());
        return font;
    }

    private CellStyle bordered(XSSFWorkbook workbook) {
        CellStyle style = workbook.createCellStyle();
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
        return style;
    }

    private CellStyle filled(XSSFWorkbook workbook, CellStyle base, IndexedColors color) {
        CellStyle style = workbook.createCellStyle();
        style.cloneStyleFrom(base);
        style.setFillForegroundColor(color.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        return style;
    }

    private void createSummarySheet(XSSFWorkbook workbook,
                                    Map<String, CellStyle> styles,
                                    ReconciliationReport report) {

        Sheet sheet = workbook.createSheet("Summary");
        ReconciliationSummary summary = report.getSummary();

        int rowNum = 0;

        Row titleRow = sheet.createRow(rowNum++);
        Cell titleCell = titleRow.createCell(0);
        titleCell.setCellValue("Supplier Invoice Price Check");
        titleCell.setCellStyle(styles.get("title"));
        sheet.addMergedRegion(new CellRangeAddress(0, 0, 0, 2));

        Row dateRow = sheet.createRow(rowNum++);
        dateRow.createCell(0).setCellValue("Report Date: " + LocalDate.now().format(DATE_FORMATTER));

        rowNum++;
        Row summaryHeader = sheet.createRow(rowNum++);
        String[] summaryHeaders = {"Parameter", "Count", "Remarks"};
        for (int i = 0; i < summaryHeaders.length; i++) {
            Cell cell = summaryHeader.createCell(i);
            cell.setCellValue(summaryHeaders[i]);
            cell.setCellStyle(styles.get("header"));
        }

        Object[][] summaryData = {
                {"Items Checked", summary.getTotal(), "Invoice lines with a readable supplier price"},
                {"Matched", summary.getMatched(), "Supplier price equals expected list price"},
                {"Mismatched", summary.getMismatched(), "Price differs, or catalog GST% is unsupported"},
                {"Not In Price List", summary.getNotFound(), "No catalog entry close enough"},
                {"Possible Matches", summary.getPossibleMatch(), "Near part number, verify manually"},
                {"Skipped Lines", report.getWarnings().size(), "Unreadable supplier price"}
        };

        for (Object[] rowData : summaryData) {
            Row row = sheet.createRow(rowNum++);
            Cell label = row.createCell(0);
            label.setCellValue((String) rowData[0]);
            Cell count = row.createCell(1);
            count.setCellValue(((Number) rowData[1]).doubleValue());
            Cell remarks = row.createCell(2);
            remarks.setCellValue((String) rowData[2]);

            CellStyle style = ((Number) rowData[1]).longValue() > 0
                    && (rowData[0].equals("Mismatched") || rowData[0].equals("Skipped Lines"))
                    ? styles.get("mismatch") : styles.get("data");
            label.setCellStyle(style);
            count.setCellStyle(style);
            remarks.setCellStyle(style);
        }

        if (!report.getWarnings().isEmpty()) {
            rowNum += 2;
            Row warningHeader = sheet.createRow(rowNum++);
            warningHeader.createCell(0).setCellValue("Skipped Lines:");
            warningHeader.getCell(0).setCellStyle(styles.get("header"));
            sheet.addMergedRegion(new CellRangeAddress(rowNum - 1, rowNum - 1, 0, 2));

            for (String warning : report.getWarnings()) {
                sheet.createRow(rowNum++).createCell(0).setCellValue(warning);
            }
        }

        sheet.setColumnWidth(0, 24 * 256);
        sheet.setColumnWidth(1, 10 * 256);
        sheet.setColumnWidth(2, 48 * 256);
    }

    private void createResultsSheet(XSSFWorkbook workbook,
                                    Map<String, CellStyle> styles,
                                    ReconciliationReport report) {

        Sheet sheet = workbook.createSheet("Results");
        int rowNum = 0;

        Row header = sheet.createRow(rowNum++);
        String[] headers = ResultCsvExporter.HEADERS;
        for (int i = 0; i < headers.length; i++) {
            Cell cell = header.createCell(i);
            cell.setCellValue(headers[i]);
            cell.setCellStyle(styles.get("header"));
        }

        for (ResultRecord r : report.getResults()) {
            Row row = sheet.createRow(rowNum++);
            CellStyle rowStyle = rowStyle(styles, r.getStatus());

            setText(row, 0, r.getBrand(), rowStyle);
            setText(row, 1, r.getPartNo(), rowStyle);
            setText(row, 2, r.getRootPartNo(), rowStyle);
            setAmount(row, 3, r.getMrp(), styles, rowStyle);
            Cell gst = row.createCell(4);
            if (r.getGstPercent() != null) {
                gst.setCellValue(r.getGstPercent().doubleValue());
            }
            gst.setCellStyle(rowStyle);
            setAmount(row, 5, r.getExpectedListPrice(), styles, rowStyle);
            setAmount(row, 6, r.getSupplierPrice(), styles, rowStyle);
            setText(row, 7, r.getRemark(), rowStyle);
        }

        sheet.createFreezePane(0, 1);
        for (int i = 0; i < headers.length; i++) {
            sheet.setColumnWidth(i, COLUMN_WIDTHS[i] * 256);
        }
    }

    private CellStyle rowStyle(Map<String, CellStyle> styles, RemarkStatus status) {
        switch (status) {
            case NOT_MATCH:
            case ERROR:
                return styles.get("mismatch");
            case POSSIBLE_MATCH:
            case NOT_IN_PRICE_LIST:
                return styles.get("possible");
            default:
                return styles.get("data");
        }
    }

    private void setText(Row row, int col, String value, CellStyle style) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value == null ? "" : value);
        cell.setCellStyle(style);
    }

    private void setAmount(Row row, int col, BigDecimal value, Map<String, CellStyle> styles, CellStyle rowStyle) {
        Cell cell = row.createCell(col);
        if (value != null) {
            cell.setCellValue(value.doubleValue());
            // keep the row fill on highlighted rows
            cell.setCellStyle(rowStyle == styles.get("data") ? styles.get("currency") : rowStyle);
        } else {
            cell.setCellStyle(rowStyle);
        }
    }
}
