package com.RK8.PriceChecker.Controller;

import com.RK8.PriceChecker.DTO.InvoiceLine;
import com.RK8.PriceChecker.DTO.PriceCatalog;
import com.RK8.PriceChecker.DTO.ReconciliationReport;
import com.RK8.PriceChecker.Exception.InvoiceFormatException;
import com.RK8.PriceChecker.Parser.InvoiceCsvParser;
import com.RK8.PriceChecker.Service.PriceCatalogService;
import com.RK8.PriceChecker.Service.PriceCheckReportService;
import com.RK8.PriceChecker.Service.ReconciliationEngine;
import com.RK8.PriceChecker.Service.ResultCsvExporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/price-check")
public class PriceCheckController {

    private static final MediaType XLSX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");
    private static final MediaType CSV = MediaType.parseMediaType("text/csv");

    private final InvoiceCsvParser invoiceParser;
    private final PriceCatalogService catalogService;
    private final ReconciliationEngine engine;
    private final ResultCsvExporter csvExporter;
    private final PriceCheckReportService reportService;

    public PriceCheckController(
            InvoiceCsvParser invoiceParser,
            PriceCatalogService catalogService,
            ReconciliationEngine engine,
            ResultCsvExporter csvExporter,
            PriceCheckReportService reportService
    ) {
        this.invoiceParser = invoiceParser;
        this.catalogService = catalogService;
        this.engine = engine;
        this.csvExporter = csvExporter;
        this.reportService = reportService;
    }

    @GetMapping("/catalog")
    public Map<String, Object> catalogStatus() {
        PriceCatalog catalog = catalogService.getCatalog();

        Map<String, Object> response = new HashMap<>();
        response.put("loaded", !catalog.isEmpty());
        response.put("entries", catalog.size());
        response.put("duplicatePartNumbers", catalog.getDuplicateIdentifiers().size());
        return response;
    }

    @PostMapping("/upload")
    public ResponseEntity<Map<String, Object>> uploadInvoice(
            @RequestParam("invoiceFile") MultipartFile invoiceFile) {

        Map<String, Object> response = new HashMap<>();
        try {
            ReconciliationReport report = reconcile(invoiceFile);

            response.put("fileName", invoiceFile.getOriginalFilename());
            response.put("summary", report.getSummary());
            response.put("summaryText", report.getSummary().toSummaryText());
            response.put("warnings", report.getWarnings());
            response.put("results", report.getResults());
            return ResponseEntity.ok(response);

        } catch (InvoiceFormatException e) {
            log.warn("Rejected invoice {}: {}", invoiceFile.getOriginalFilename(), e.getMessage());
            response.put("error", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            log.error("Price check failed for {}", invoiceFile.getOriginalFilename(), e);
            response.put("error", e.getMessage());
            return ResponseEntity.internalServerError().body(response);
        }
    }

    @PostMapping("/download-csv")
    public ResponseEntity<ByteArrayResource> downloadCsv(
            @RequestParam("invoiceFile") MultipartFile invoiceFile) {

        try {
            ReconciliationReport report = reconcile(invoiceFile);
            byte[] csvBytes = csvExporter.export(report.getResults());
            return attachment(csvBytes, ResultCsvExporter.FILE_NAME, CSV);

        } catch (InvoiceFormatException e) {
            log.warn("Rejected invoice {}: {}", invoiceFile.getOriginalFilename(), e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (Exception e) {
            log.error("CSV export failed for {}", invoiceFile.getOriginalFilename(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @PostMapping("/download-report")
    public ResponseEntity<ByteArrayResource> downloadReport(
            @RequestParam("invoiceFile") MultipartFile invoiceFile) {

        try {
            ReconciliationReport report = reconcile(invoiceFile);
            byte[] reportBytes = reportService.generateReport(report);

            String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
            String filename = String.format("Price_Check_Report_%s.xlsx", timestamp);
            return attachment(reportBytes, filename, XLSX);

        } catch (InvoiceFormatException e) {
            log.warn("Rejected invoice {}: {}", invoiceFile.getOriginalFilename(), e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (Exception e) {
            log.error("Report generation failed for {}", invoiceFile.getOriginalFilename(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @GetMapping("/sample-invoice")
    public ResponseEntity<ByteArrayResource> sampleInvoice() throws IOException {
        byte[] sample;
        try (InputStream is = new ClassPathResource("sample_supplier_invoice.csv").getInputStream()) {
            sample = StreamUtils.copyToByteArray(is);
        }
        return attachment(sample, "sample_supplier_invoice.csv", CSV);
    }

    private ReconciliationReport reconcile(MultipartFile invoiceFile) throws IOException {
        if (invoiceFile.isEmpty()) {
            throw new InvoiceFormatException("Please select a CSV invoice file");
        }

        List<InvoiceLine> lines;
        try (InputStream invoiceStream = invoiceFile.getInputStream()) {
            lines = invoiceParser.parse(invoiceStream);
        }

        log.info("Checking {} lines from {}", lines.size(), invoiceFile.getOriginalFilename());
        return engine.processInvoice(lines, catalogService.getCatalog());
    }

    private ResponseEntity<ByteArrayResource> attachment(byte[] bytes, String filename, MediaType type) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(type)
                .contentLength(bytes.length)
                .body(new ByteArrayResource(bytes));
    }
}
