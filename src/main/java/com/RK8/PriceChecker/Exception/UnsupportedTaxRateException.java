package com.RK8.PriceChecker.Exception;

import java.math.BigDecimal;

public class UnsupportedTaxRateException extends RuntimeException {

    private final BigDecimal gstPercent;

    public UnsupportedTaxRateException(BigDecimal gstPercent) {
        super("Unsupported GST: " + gstPercent.stripTrailingZeros().toPlainString());
        this.gstPercent = gstPercent;
    }

    public BigDecimal getGstPercent() {
        return gstPercent;
    }
}
