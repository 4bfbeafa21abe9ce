package com.RK8.PriceChecker.Service;

import com.RK8.PriceChecker.DTO.CatalogEntry;
import com.RK8.PriceChecker.DTO.MatchResult;
import com.RK8.PriceChecker.DTO.PriceCatalog;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class PartNumberMatcher {

    static final double POSSIBLE_MATCH_THRESHOLD = 0.9;

    private final PartNumberSimilarity similarity;

    public PartNumberMatcher(PartNumberSimilarity similarity) {
        this.similarity = similarity;
    }

    /**
     * Strategy 1: exact part number or root part number.
     * Strategy 2: closest part number by similarity, accepted from 0.9 upwards.
     */
    public MatchResult resolve(String partNo, PriceCatalog catalog) {
        String key = partNo == null ? "" : partNo.trim();

        Optional<CatalogEntry> exact = catalog.findExact(key);
        if (exact.isPresent()) {
            return MatchResult.exact(exact.get());
        }

        CatalogEntry best = null;
        double bestScore = 0.0;
        for (CatalogEntry candidate : catalog.getEntries()) {
            double score = similarity.score(key, candidate.getPartNo());
            // strict > keeps the first entry on ties
            if (best == null || score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }

        if (best != null && bestScore >= POSSIBLE_MATCH_THRESHOLD) {
            return MatchResult.possible(best, bestScore);
        }
        return MatchResult.none(bestScore);
    }
}
