package com.RK8.PriceChecker.DTO;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One row of the master price list. MRP is tax inclusive.
 */
@Value
public class CatalogEntry {
    String partNo;
    String rootPartNo;
    String brand;
    BigDecimal mrp;
    BigDecimal gstPercent;
}
