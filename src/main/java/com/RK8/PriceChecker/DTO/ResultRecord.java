package com.RK8.PriceChecker.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

@Data
@AllArgsConstructor
public class ResultRecord {
    private String brand;
    private String partNo;
    private String rootPartNo;
    private BigDecimal mrp;
    private BigDecimal gstPercent;
    private BigDecimal expectedListPrice;
    private BigDecimal supplierPrice;
    private String remark;
    private RemarkStatus status;
    private MatchKind matchKind;
    private double similarityScore;
}
