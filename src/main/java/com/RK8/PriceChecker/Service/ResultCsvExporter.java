package com.RK8.PriceChecker.Service;

import com.RK8.PriceChecker.DTO.ResultRecord;
import com.opencsv.CSVWriter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.List;

@Service
public class ResultCsvExporter {

    public static final String FILE_NAME = "price_check_results.csv";

    static final String[] HEADERS = {"Brand", "Part No", "Root Part No", "MRP", "GST%",
            "Expected List Price", "Supplier Price", "Remark"};

    public byte[] export(List<ResultRecord> results) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADERS, false);
            for (ResultRecord r : results) {
                writer.writeNext(new String[]{
                        text(r.getBrand()),
                        text(r.getPartNo()),
                        text(r.getRootPartNo()),
                        amount(r.getMrp()),
                        amount(r.getGstPercent()),
                        price(r.getExpectedListPrice()),
                        amount(r.getSupplierPrice()),
                        text(r.getRemark())
                }, false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write result CSV", e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    private String text(String value) {
        return value == null ? "" : value;
    }

    private String amount(BigDecimal value) {
        return value == null ? "" : value.stripTrailingZeros().toPlainString();
    }

    // expected prices come out of a division, round for display
    private String price(BigDecimal value) {
        return value == null ? "" : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
