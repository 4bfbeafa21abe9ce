package com.RK8.PriceChecker.DTO;

public enum RemarkStatus {
    MATCH("MATCH"),
    NOT_MATCH("NOT MATCH"),
    POSSIBLE_MATCH("POSSIBLE MATCH"),
    NOT_IN_PRICE_LIST("NOT IN PRICE LIST"),
    ERROR("ERROR");

    private final String label;

    RemarkStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
