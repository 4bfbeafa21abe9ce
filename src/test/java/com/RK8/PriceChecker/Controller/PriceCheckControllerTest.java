package com.RK8.PriceChecker.Controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = "pricecheck.catalog.location=classpath:test_price_list.json")
class PriceCheckControllerTest {

    private static final String INVOICE =
            "Part No,Supplier Price,Qty\n" +
            "A1,1000,2\n" +
            "A1X,999,1\n" +
            "ZZZ,1,1\n" +
            "RT-1,abc,1\n";

    @Autowired
    private MockMvc mockMvc;

    private static MockMultipartFile invoice(String content) {
        return new MockMultipartFile("invoiceFile", "invoice.csv", "text/csv",
                content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void reportsCatalogStatus() throws Exception {
        mockMvc.perform(get("/api/price-check/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loaded").value(true))
                .andExpect(jsonPath("$.entries").value(3))
                .andExpect(jsonPath("$.duplicatePartNumbers").value(0));
    }

    @Test
    void uploadReturnsSummaryResultsAndWarnings() throws Exception {
        mockMvc.perform(multipart("/api/price-check/upload").file(invoice(INVOICE)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fileName").value("invoice.csv"))
                .andExpect(jsonPath("$.summary.total").value(3))
                .andExpect(jsonPath("$.summary.matched").value(1))
                .andExpect(jsonPath("$.summary.mismatched").value(0))
                .andExpect(jsonPath("$.summary.notFound").value(2))
                .andExpect(jsonPath("$.summary.possibleMatch").value(0))
                .andExpect(jsonPath("$.summaryText").value(
                        "3 items checked → 1 matched, 0 mismatched, 2 not in price list, 0 possible matches."))
                .andExpect(jsonPath("$.results.length()").value(3))
                .andExpect(jsonPath("$.results[0].remark").value("MATCH"))
                .andExpect(jsonPath("$.results[0].brand").value("X"))
                .andExpect(jsonPath("$.results[1].partNo").value("A1X"))
                .andExpect(jsonPath("$.results[1].remark").value("NOT IN PRICE LIST"))
                .andExpect(jsonPath("$.results[2].remark").value("NOT IN PRICE LIST"))
                .andExpect(jsonPath("$.warnings[0]").value("Row 4: Invalid Supplier Price for Part No: RT-1"));
    }

    @Test
    void uploadReportsUnsupportedTaxRateInline() throws Exception {
        mockMvc.perform(multipart("/api/price-check/upload")
                        .file(invoice("Part No,Supplier Price\nTAX-12,1000\nRT-1,1000\n")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].remark").value("ERROR: Unsupported GST: 12"))
                .andExpect(jsonPath("$.results[1].remark").value("MATCH"))
                .andExpect(jsonPath("$.summary.mismatched").value(1))
                .andExpect(jsonPath("$.summary.matched").value(1));
    }

    @Test
    void uploadRejectsInvoiceWithoutRequiredColumns() throws Exception {
        mockMvc.perform(multipart("/api/price-check/upload")
                        .file(invoice("Part No,Price\nA1,1000\n")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing columns: Supplier Price"));
    }

    @Test
    void uploadRejectsEmptyFile() throws Exception {
        mockMvc.perform(multipart("/api/price-check/upload").file(invoice("")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Please select a CSV invoice file"));
    }

    @Test
    void downloadCsvReturnsResultFile() throws Exception {
        MvcResult result = mockMvc.perform(multipart("/api/price-check/download-csv").file(invoice(INVOICE)))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"price_check_results.csv\""))
                .andExpect(content().contentType("text/csv"))
                .andReturn();

        String body = result.getResponse().getContentAsString(StandardCharsets.UTF_8);
        assertThat(body.split("\n")).containsExactly(
                "Brand,Part No,Root Part No,MRP,GST%,Expected List Price,Supplier Price,Remark",
                "X,A1,A1,1280,28,1000.00,1000,MATCH",
                ",A1X,,,,,999,NOT IN PRICE LIST",
                ",ZZZ,,,,,1,NOT IN PRICE LIST");
    }

    @Test
    void downloadCsvRejectsBadInvoice() throws Exception {
        mockMvc.perform(multipart("/api/price-check/download-csv").file(invoice("Qty\n1\n")))
                .andExpect(status().isBadRequest());
    }

    @Test
    void downloadReportReturnsWorkbook() throws Exception {
        MvcResult result = mockMvc.perform(multipart("/api/price-check/download-report").file(invoice(INVOICE)))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        startsWith("attachment; filename=\"Price_Check_Report_")))
                .andExpect(content().contentType(
                        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"))
                .andReturn();

        // xlsx is a zip archive
        byte[] body = result.getResponse().getContentAsByteArray();
        assertThat(body).startsWith((byte) 'P', (byte) 'K');
    }

    @Test
    void sampleInvoiceIsDownloadable() throws Exception {
        mockMvc.perform(get("/api/price-check/sample-invoice"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("sample_supplier_invoice.csv")))
                .andExpect(content().string(startsWith("Part No,")));
    }
}
