package dev.resumescreener.model;

import dev.resumescreener.error.ErrorKind;

/**
 * A row that reached a terminal failure, kept for manual remediation.
 */
public record FailedCandidate(
        int rowNumber,
        String name,
        String email,
        String phone,
        String resumeLocator,
        ErrorKind errorKind,
        String errorMessage) {

    public static FailedCandidate of(CandidateRow row, ErrorKind kind, String message) {
        return new FailedCandidate(
                row.getRowNumber(),
                row.getName(),
                row.getEmail(),
                row.getPhone(),
                row.getResumeLocator(),
                kind,
                message);
    }
}
