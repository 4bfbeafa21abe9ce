package com.RK8.PriceChecker.Service;

import com.RK8.PriceChecker.DTO.MatchKind;
import com.RK8.PriceChecker.DTO.RemarkStatus;
import com.RK8.PriceChecker.DTO.ResultRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ResultCsvExporterTest {

    private final ResultCsvExporter exporter = new ResultCsvExporter();

    @Test
    void writesHeaderAndRowsInOrder() {
        List<ResultRecord> results = List.of(
                new ResultRecord("Bosch", "BP-1001", "BP-1001", new BigDecimal("100.0"), new BigDecimal("18"),
                        new BigDecimal("84.745763"), new BigDecimal("84.75"), "NOT MATCH",
                        RemarkStatus.NOT_MATCH, MatchKind.EXACT, 1.0),
                new ResultRecord(null, "ZZZ", null, null, null, null, new BigDecimal("1"),
                        "NOT IN PRICE LIST", RemarkStatus.NOT_IN_PRICE_LIST, MatchKind.NONE, 0.0),
                new ResultRecord("Acme, Inc", "T-1", "T-1", new BigDecimal("1120"), new BigDecimal("12"), null,
                        new BigDecimal("1000"), "ERROR: Unsupported GST: 12",
                        RemarkStatus.ERROR, MatchKind.EXACT, 1.0));

        String csv = new String(exporter.export(results), StandardCharsets.UTF_8);

        assertThat(csv.split("\n")).containsExactly(
                "Brand,Part No,Root Part No,MRP,GST%,Expected List Price,Supplier Price,Remark",
                "Bosch,BP-1001,BP-1001,100,18,84.75,84.75,NOT MATCH",
                ",ZZZ,,,,,1,NOT IN PRICE LIST",
                "\"Acme, Inc\",T-1,T-1,1120,12,,1000,ERROR: Unsupported GST: 12");
    }

    @Test
    void writesOnlyHeaderForNoResults() {
        String csv = new String(exporter.export(List.of()), StandardCharsets.UTF_8);

        assertThat(csv.trim()).isEqualTo(
                "Brand,Part No,Root Part No,MRP,GST%,Expected List Price,Supplier Price,Remark");
    }
}
