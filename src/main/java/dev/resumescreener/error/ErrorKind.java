package dev.resumescreener.error;

/**
 * Classification of everything that can go wrong while screening.
 * Row-level kinds end up on a {@link dev.resumescreener.model.FailedCandidate};
 * call-level kinds propagate to the caller as a {@link ScreeningException}.
 */
public enum ErrorKind {

    // Call-level
    INVALID_INPUT(false),
    ALREADY_SET(false),
    REQUIREMENTS_NOT_SET(false),
    REQUIREMENTS_CHANGED(false),
    DUPLICATE_ROW(false),
    NOT_FOUND(false),
    SCORING_UNAVAILABLE(false),

    // Row-level
    MISSING_FIELD(false),
    LOCATOR_INVALID(false),
    FETCH_TIMEOUT(true),
    FETCH_ACCESS_DENIED(false),
    FETCH_NOT_FOUND(false),
    UNSUPPORTED_FORMAT(false),
    EXTRACTION_FAILED(false),
    SCORING_TIMEOUT(false),
    SCORING_RATE_LIMITED(true),
    SCORING_MALFORMED_RESPONSE(false),
    PROCESSING_FAILED(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * Transient kinds are retried with backoff before being finalized.
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
