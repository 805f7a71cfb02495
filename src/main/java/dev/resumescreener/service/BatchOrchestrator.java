package dev.resumescreener.service;

import dev.resumescreener.config.ScreeningConfig;
import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.error.ScreeningException;
import dev.resumescreener.metrics.ScreeningMetrics;
import dev.resumescreener.model.BatchResult;
import dev.resumescreener.model.CandidateRecord;
import dev.resumescreener.model.CandidateRow;
import dev.resumescreener.model.FailedCandidate;
import dev.resumescreener.model.RequirementSet;
import dev.resumescreener.store.ScreeningContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fans a batch of rows out over a bounded number of concurrent pipelines and
 * commits the outcomes in row-number order once every row is terminal.
 */
@Slf4j
@Service
public class BatchOrchestrator {

    private final RowPipeline rowPipeline;
    private final ScreeningMetrics metrics;
    private final int concurrency;

    @Autowired
    public BatchOrchestrator(RowPipeline rowPipeline, ScreeningConfig config, ScreeningMetrics metrics) {
        this(rowPipeline, config.getConcurrency(), metrics);
    }

    public BatchOrchestrator(RowPipeline rowPipeline, int concurrency, ScreeningMetrics metrics) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, was " + concurrency);
        }
        this.rowPipeline = rowPipeline;
        this.metrics = metrics;
        this.concurrency = concurrency;
    }

    /**
     * Process every row and commit the results to the context.
     *
     * @return counts and the failed candidates ordered by row number
     * @throws ScreeningException INVALID_INPUT, DUPLICATE_ROW, REQUIREMENTS_NOT_SET before any row
     *                            is processed; REQUIREMENTS_CHANGED when the set was reset meanwhile
     */
    public BatchResult runBatch(ScreeningContext context, List<CandidateRow> rows) {
        if (rows == null || rows.isEmpty()) {
            log.info("Empty batch, nothing to process");
            return BatchResult.EMPTY;
        }
        validateRowNumbers(rows);
        RequirementSet requirements = context.requirements()
                .orElseThrow(() -> new ScreeningException(ErrorKind.REQUIREMENTS_NOT_SET,
                        "Please set job requirements first"));

        log.info("Processing batch of {} rows (concurrency {})", rows.size(), concurrency);

        List<RowOutcome> outcomes = Flux.fromIterable(rows)
                .flatMap(row -> rowPipeline.process(row, requirements)
                        .subscribeOn(Schedulers.boundedElastic()), concurrency)
                .collectSortedList(Comparator.comparingInt(outcome -> outcome.row().getRowNumber()))
                .block();

        if (outcomes == null || outcomes.size() != rows.size()) {
            throw new ScreeningException(ErrorKind.PROCESSING_FAILED,
                    "Batch ended with " + (outcomes == null ? 0 : outcomes.size()) + " of " + rows.size() + " rows");
        }

        List<CandidateRecord> records = outcomes.stream()
                .filter(RowOutcome::isSuccess)
                .map(RowOutcome::record)
                .toList();
        List<FailedCandidate> failures = outcomes.stream()
                .filter(outcome -> !outcome.isSuccess())
                .map(RowOutcome::failure)
                .toList();

        context.commit(requirements, records, failures);
        metrics.recordRowsSucceeded(records.size());
        failures.forEach(failure -> metrics.recordRowFailed(failure.errorKind()));

        log.info("Batch complete: {} succeeded, {} failed", records.size(), failures.size());
        return new BatchResult(rows.size(), records.size(), failures.size(), failures);
    }

    private static void validateRowNumbers(List<CandidateRow> rows) {
        Set<Integer> seen = new HashSet<>();
        for (CandidateRow row : rows) {
            if (row == null) {
                throw new ScreeningException(ErrorKind.INVALID_INPUT, "Batch contains a null row");
            }
            if (row.getRowNumber() <= 0) {
                throw new ScreeningException(ErrorKind.INVALID_INPUT,
                        "Row number must be positive, was " + row.getRowNumber());
            }
            if (!seen.add(row.getRowNumber())) {
                throw new ScreeningException(ErrorKind.DUPLICATE_ROW,
                        "Duplicate row number " + row.getRowNumber());
            }
        }
    }
}
