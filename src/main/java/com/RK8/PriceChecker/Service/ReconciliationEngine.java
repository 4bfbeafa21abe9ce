package com.RK8.PriceChecker.Service;

import com.RK8.PriceChecker.DTO.*;
import com.RK8.PriceChecker.Exception.UnsupportedTaxRateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class ReconciliationEngine {

    private static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    private final PartNumberMatcher matcher;
    private final PriceCalculator calculator;

    public ReconciliationEngine(PartNumberMatcher matcher, PriceCalculator calculator) {
        this.matcher = matcher;
        this.calculator = calculator;
    }

    public ReconciliationReport processInvoice(List<InvoiceLine> invoiceLines, PriceCatalog catalog) {
        List<ResultRecord> results = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        ReconciliationSummary summary = new ReconciliationSummary();

        for (InvoiceLine line : invoiceLines) {
            BigDecimal supplierPrice = parsePrice(line.getSupplierPriceText());
            if (supplierPrice == null) {
                String warning = String.format("Row %d: Invalid Supplier Price for Part No: %s",
                        line.getRowNumber(), line.getPartNo());
                log.warn(warning);
                warnings.add(warning);
                continue;
            }

            MatchResult match = matcher.resolve(line.getPartNo(), catalog);
            ResultRecord record = classify(line, supplierPrice, match);

            summary.record(record.getStatus());
            results.add(record);
        }

        log.info("Reconciled {} invoice lines against {} catalog entries: {}",
                invoiceLines.size(), catalog.size(), summary.toSummaryText());
        return new ReconciliationReport(results, summary, warnings);
    }

    private ResultRecord classify(InvoiceLine line, BigDecimal supplierPrice, MatchResult match) {
        if (!match.isResolved()) {
            return new ResultRecord(null, line.getPartNo(), null, null, null, null, supplierPrice,
                    RemarkStatus.NOT_IN_PRICE_LIST.getLabel(), RemarkStatus.NOT_IN_PRICE_LIST,
                    match.getKind(), match.getScore());
        }

        CatalogEntry entry = match.getEntry();
        BigDecimal expected;
        try {
            expected = calculator.expectedListPrice(entry.getMrp(), entry.getGstPercent());
        } catch (UnsupportedTaxRateException e) {
            log.warn("Row {}: part {} matched catalog entry {} with {}",
                    line.getRowNumber(), line.getPartNo(), entry.getPartNo(), e.getMessage());
            return toRecord(line, entry, null, supplierPrice,
                    RemarkStatus.ERROR.getLabel() + ": " + e.getMessage(), RemarkStatus.ERROR, match);
        }

        RemarkStatus status;
        if (match.getKind() == MatchKind.POSSIBLE) {
            // provisional match, price agreement is not judged
            status = RemarkStatus.POSSIBLE_MATCH;
        } else if (isPriceMatch(expected, supplierPrice)) {
            status = RemarkStatus.MATCH;
        } else {
            status = RemarkStatus.NOT_MATCH;
        }
        return toRecord(line, entry, expected, supplierPrice, status.getLabel(), status, match);
    }

    private ResultRecord toRecord(InvoiceLine line, CatalogEntry entry, BigDecimal expected,
                                  BigDecimal supplierPrice, String remark, RemarkStatus status,
                                  MatchResult match) {
        return new ResultRecord(
                entry.getBrand(),
                line.getPartNo(),
                entry.getRootPartNo(),
                entry.getMrp(),
                entry.getGstPercent(),
                expected,
                supplierPrice,
                remark,
                status,
                match.getKind(),
                match.getScore()
        );
    }

    private boolean isPriceMatch(BigDecimal expected, BigDecimal supplierPrice) {
        return expected.subtract(supplierPrice).abs().compareTo(TOLERANCE) < 0;
    }

    private BigDecimal parsePrice(String text) {
        if (text == null) return null;
        String val = text.trim();
        if (val.isEmpty()) return null;
        try {
            return new BigDecimal(val);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
