package dev.resumescreener.model;

import java.util.List;

/**
 * Outcome of one batch. {@code failedCandidates} is ordered by row number.
 */
public record BatchResult(int totalRows, int successCount, int failCount, List<FailedCandidate> failedCandidates) {

    public static final BatchResult EMPTY = new BatchResult(0, 0, 0, List.of());

    public BatchResult {
        failedCandidates = List.copyOf(failedCandidates);
    }
}
