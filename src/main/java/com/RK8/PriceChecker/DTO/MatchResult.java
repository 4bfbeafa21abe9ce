package com.RK8.PriceChecker.DTO;

import lombok.Value;

@Value
public class MatchResult {
    CatalogEntry entry;
    MatchKind kind;
    double score;

    public static MatchResult exact(CatalogEntry entry) {
        return new MatchResult(entry, MatchKind.EXACT, 1.0);
    }

    public static MatchResult possible(CatalogEntry entry, double score) {
        return new MatchResult(entry, MatchKind.POSSIBLE, score);
    }

    public static MatchResult none(double bestScore) {
        return new MatchResult(null, MatchKind.NONE, bestScore);
    }

    public boolean isResolved() {
        return entry != null;
    }
}
