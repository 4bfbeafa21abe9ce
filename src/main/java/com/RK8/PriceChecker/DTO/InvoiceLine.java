package com.RK8.PriceChecker.DTO;

import lombok.Value;

@Value
public class InvoiceLine {
    int rowNumber;              // 1-based, header excluded
    String partNo;
    String supplierPriceText;   // parsed during reconciliation
}
