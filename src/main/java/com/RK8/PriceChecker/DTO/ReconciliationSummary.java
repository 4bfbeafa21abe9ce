package com.RK8.PriceChecker.DTO;

import lombok.Data;

@Data
public class ReconciliationSummary {

    private long total;
    private long matched;
    private long mismatched;
    private long notFound;
    private long possibleMatch;

    public void record(RemarkStatus status) {
        total++;
        switch (status) {
            case MATCH:
                matched++;
                break;
            case NOT_MATCH:
            case ERROR:
                mismatched++;
                break;
            case POSSIBLE_MATCH:
                possibleMatch++;
                break;
            case NOT_IN_PRICE_LIST:
                notFound++;
                break;
        }
    }

    public String toSummaryText() {
        return String.format("%d items checked → %d matched, %d mismatched, %d not in price list, %d possible matches.",
                total, matched, mismatched, notFound, possibleMatch);
    }
}
