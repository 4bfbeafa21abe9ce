package com.RK8.PriceChecker.Parser;

import com.RK8.PriceChecker.DTO.CatalogEntry;

import java.math.BigDecimal;

/**
 * Cleaning rules shared by the catalog parsers: text fields are trimmed, and a record
 * without a numeric MRP or GST rate is unusable. Unsupported GST rates are kept.
 */
final class CatalogRecords {

    private CatalogRecords() {
    }

    static CatalogEntry toEntry(String partNo, String rootPartNo, String brand,
                                String mrpText, String gstText) {
        BigDecimal mrp = parseDecimal(mrpText);
        BigDecimal gst = parseDecimal(gstText);
        if (mrp == null || gst == null || mrp.signum() <= 0) {
            return null;
        }
        String part = trim(partNo);
        if (part.isEmpty()) {
            return null;
        }
        String root = trim(rootPartNo);
        return new CatalogEntry(part, root.isEmpty() ? part : root, trim(brand), mrp, gst.stripTrailingZeros());
    }

    static BigDecimal parseDecimal(String text) {
        if (text == null) return null;
        String val = text.trim();
        if (val.isEmpty()) return null;
        try {
            return new BigDecimal(val);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }
}
