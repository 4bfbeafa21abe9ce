package com.RK8.PriceChecker.Service;

import com.RK8.PriceChecker.Exception.UnsupportedTaxRateException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Service
public class PriceCalculator {

    private static final BigDecimal GST_18 = new BigDecimal("18");
    private static final BigDecimal GST_28 = new BigDecimal("28");
    private static final BigDecimal GST_18_DIVISOR = new BigDecimal("1.18");
    private static final BigDecimal GST_28_DIVISOR = new BigDecimal("1.28");
    private static final int SCALE = 6;

    /**
     * Strips GST from a tax-inclusive MRP to get the list price the supplier should bill.
     *
     * @throws UnsupportedTaxRateException for any rate other than 18 or 28
     */
    public BigDecimal expectedListPrice(BigDecimal mrp, BigDecimal gstPercent) {
        if (gstPercent.compareTo(GST_18) == 0) {
            return mrp.divide(GST_18_DIVISOR, SCALE, RoundingMode.HALF_UP);
        }
        if (gstPercent.compareTo(GST_28) == 0) {
            return mrp.divide(GST_28_DIVISOR, SCALE, RoundingMode.HALF_UP);
        }
        throw new UnsupportedTaxRateException(gstPercent);
    }
}
