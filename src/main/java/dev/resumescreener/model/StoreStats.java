package dev.resumescreener.model;

import java.util.Map;

/**
 * Point-in-time statistics over the ranked candidates.
 */
public record StoreStats(
        int count,
        double averageScore,
        int topScore,
        int lowestScore,
        boolean requirementSetActive,
        Map<String, Integer> scoreDistribution) {
}
