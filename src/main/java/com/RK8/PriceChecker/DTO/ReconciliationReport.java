package com.RK8.PriceChecker.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ReconciliationReport {
    private List<ResultRecord> results;
    private ReconciliationSummary summary;
    private List<String> warnings;
}
