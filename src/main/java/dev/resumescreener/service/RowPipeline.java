package dev.resumescreener.service;

import dev.resumescreener.config.ScreeningConfig;
import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.error.ScreeningException;
import dev.resumescreener.extract.TextExtractor;
import dev.resumescreener.fetch.FetchedResume;
import dev.resumescreener.fetch.ResumeFetcher;
import dev.resumescreener.metrics.ScreeningMetrics;
import dev.resumescreener.model.CandidateRecord;
import dev.resumescreener.model.CandidateRow;
import dev.resumescreener.model.FailedCandidate;
import dev.resumescreener.model.RequirementSet;
import dev.resumescreener.model.ScoreBreakdown;
import dev.resumescreener.oracle.ScoringOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.util.concurrent.TimeoutException;

/**
 * Per-row processing: validate, fetch, extract, score, build record.
 * Every stage failure is classified; the returned Mono never errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RowPipeline {

    private final ResumeFetcher resumeFetcher;
    private final TextExtractor textExtractor;
    private final ScoringOracle scoringOracle;
    private final ScreeningConfig config;
    private final ScreeningMetrics metrics;

    /**
     * Run all stages for one row against the given requirement set.
     *
     * @return the row's terminal outcome
     */
    public Mono<RowOutcome> process(CandidateRow row, RequirementSet requirements) {
        return validate(row)
                .flatMap(this::fetch)
                .flatMap(resume -> extract(row, resume)
                        .flatMap(text -> score(row, text, requirements)
                                .map(breakdown -> CandidateRecord.fromRow(row, resume.filename(), text, breakdown))))
                .map(record -> {
                    log.info("Row {} ({}) scored {}", row.getRowNumber(), row.getName(), record.getOverallScore());
                    return RowOutcome.success(row, record);
                })
                .onErrorResume(e -> Mono.just(RowOutcome.failure(row, toFailure(row, e))));
    }

    private Mono<CandidateRow> validate(CandidateRow row) {
        if (row.getName() == null || row.getName().isBlank()) {
            return Mono.error(new ScreeningException(ErrorKind.MISSING_FIELD, "Candidate name is missing"));
        }
        String locator = row.getResumeLocator();
        if (locator == null || locator.isBlank() || "nan".equalsIgnoreCase(locator.strip())) {
            return Mono.error(new ScreeningException(ErrorKind.LOCATOR_INVALID, "No resume link provided"));
        }
        return Mono.just(row);
    }

    private Mono<FetchedResume> fetch(CandidateRow row) {
        ScreeningConfig.Fetch fetch = config.getFetch();
        long start = System.currentTimeMillis();
        return Mono.defer(() -> resumeFetcher.fetch(row.getResumeLocator()))
                .timeout(fetch.getTimeout())
                .onErrorMap(TimeoutException.class, e -> new ScreeningException(ErrorKind.FETCH_TIMEOUT,
                        "Resume download timed out after " + fetch.getTimeout().toMillis() + " ms", e))
                .retryWhen(Retry.backoff(fetch.getMaxRetries(), fetch.getBackoff())
                        .filter(RowPipeline::isTransient)
                        .doBeforeRetry(signal -> {
                            metrics.recordRetry(ErrorKind.FETCH_TIMEOUT);
                            log.info("Retrying resume download for row {} (Attempt {})",
                                    row.getRowNumber(), signal.totalRetries() + 1);
                        })
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnTerminate(() -> metrics.recordStageLatency("fetch", System.currentTimeMillis() - start));
    }

    private Mono<String> extract(CandidateRow row, FetchedResume resume) {
        return Mono.fromCallable(() -> textExtractor.extractText(resume.content(), resume.filename()))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof ScreeningException), e -> new ScreeningException(
                        ErrorKind.EXTRACTION_FAILED, "Failed to extract text from resume: " + e.getMessage(), e))
                .flatMap(text -> {
                    if (text == null || text.isBlank()) {
                        return Mono.error(new ScreeningException(ErrorKind.EXTRACTION_FAILED,
                                "No text extracted from " + resume.filename()));
                    }
                    log.debug("Row {}: extracted {} characters from {}",
                            row.getRowNumber(), text.length(), resume.filename());
                    return Mono.just(text);
                });
    }

    private Mono<ScoreBreakdown> score(CandidateRow row, String text, RequirementSet requirements) {
        ScreeningConfig.Scoring scoring = config.getScoring();
        long start = System.currentTimeMillis();
        return Mono.defer(() -> scoringOracle.scoreCandidate(text, requirements))
                .timeout(scoring.getTimeout())
                .onErrorMap(TimeoutException.class, e -> new ScreeningException(ErrorKind.SCORING_TIMEOUT,
                        "Scoring timed out after " + scoring.getTimeout().toMillis() + " ms", e))
                .flatMap(result -> result.isSuccess()
                        ? Mono.just(result.value())
                        : Mono.<ScoreBreakdown>error(result.toException()))
                .retryWhen(Retry.backoff(scoring.getMaxRetries(), scoring.getBackoff())
                        .filter(RowPipeline::isTransient)
                        .doBeforeRetry(signal -> {
                            metrics.recordRetry(ErrorKind.SCORING_RATE_LIMITED);
                            log.info("Scoring rate limited for row {}, retrying (Attempt {})",
                                    row.getRowNumber(), signal.totalRetries() + 1);
                        })
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnTerminate(() -> metrics.recordStageLatency("score", System.currentTimeMillis() - start));
    }

    private static boolean isTransient(Throwable error) {
        return error instanceof ScreeningException screening && screening.getKind().isTransient();
    }

    private FailedCandidate toFailure(CandidateRow row, Throwable error) {
        ErrorKind kind;
        String message;
        if (error instanceof ScreeningException screening) {
            kind = screening.getKind();
            message = screening.getMessage();
        } else {
            kind = ErrorKind.PROCESSING_FAILED;
            message = "Unexpected error: " + error.getMessage();
            log.error("Unexpected error processing row {} ({})", row.getRowNumber(), row.getName(), error);
        }
        log.warn("Row {} ({}) failed: {} - {}", row.getRowNumber(), row.getName(), kind, message);
        return FailedCandidate.of(row, kind, message);
    }
}
