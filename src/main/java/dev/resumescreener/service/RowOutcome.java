package dev.resumescreener.service;

import dev.resumescreener.model.CandidateRecord;
import dev.resumescreener.model.CandidateRow;
import dev.resumescreener.model.FailedCandidate;

/**
 * Terminal state of one row: an uncommitted record or a failed candidate.
 */
public record RowOutcome(CandidateRow row, CandidateRecord record, FailedCandidate failure) {

    public static RowOutcome success(CandidateRow row, CandidateRecord record) {
        return new RowOutcome(row, record, null);
    }

    public static RowOutcome failure(CandidateRow row, FailedCandidate failure) {
        return new RowOutcome(row, null, failure);
    }

    public boolean isSuccess() {
        return record != null;
    }
}
