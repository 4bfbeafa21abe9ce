package com.RK8.PriceChecker.DTO;

public enum MatchKind {
    EXACT,
    POSSIBLE,
    NONE
}
