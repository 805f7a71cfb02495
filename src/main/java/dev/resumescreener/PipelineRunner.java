package dev.resumescreener;

import dev.resumescreener.config.ScreeningConfig;
import dev.resumescreener.model.BatchResult;
import dev.resumescreener.model.CandidateRecord;
import dev.resumescreener.model.CandidateRow;
import dev.resumescreener.model.FailedCandidate;
import dev.resumescreener.model.ScoreBreakdown;
import dev.resumescreener.model.StoreStats;
import dev.resumescreener.service.CandidateBatchReader;
import dev.resumescreener.service.ScreeningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one screening pass from files: job description in, ranked report out.
 * Separated from the main Application class for testability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

    private static final String SEPARATOR = "========================================";

    private final ScreeningService screeningService;
    private final CandidateBatchReader batchReader;
    private final ScreeningConfig config;

    @Value("${screening.metrics-wait-seconds:0}")
    private int metricsWaitSeconds;

    /**
     * Sets requirements from the job description file, screens the candidates file
     * and logs the ranking.
     *
     * @return number of candidates scored
     */
    public int execute() {
        log.info(SEPARATOR);
        log.info("Resume Screener Starting");
        log.info(SEPARATOR);

        try {
            ScreeningConfig.Input input = config.getInput();
            String jobDescription = Files.readString(Path.of(input.getJobDescriptionFile()), StandardCharsets.UTF_8);
            List<CandidateRow> rows = batchReader.read(Path.of(input.getCandidatesFile()));

            screeningService.setRequirements(jobDescription);
            BatchResult result = screeningService.runBatch(rows);

            report(result, input.getReportTopN());

            log.info(SEPARATOR);
            log.info("Resume Screener Completed Successfully");
            log.info("Candidates scored: {}, failed: {}", result.successCount(), result.failCount());
            log.info(SEPARATOR);

            handleMetricsWait();

            return result.successCount();
        } catch (IOException e) {
            log.error("Resume Screener failed to read input: {}", e.getMessage(), e);
            throw new IllegalStateException("Cannot read screening input", e);
        } catch (Exception e) {
            log.error("Resume Screener failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Screening run failed", e);
        }
    }

    private void report(BatchResult result, int topN) {
        StoreStats stats = screeningService.stats();
        log.info("Ranked {} candidates (average {}, top {}, lowest {})",
                stats.count(), stats.averageScore(), stats.topScore(), stats.lowestScore());
        log.info("Score distribution: {}", stats.scoreDistribution());

        List<CandidateRecord> ranked = screeningService.listCandidates();
        ranked.stream().limit(topN).forEach(candidate -> {
            ScoreBreakdown breakdown = candidate.getBreakdown();
            log.info("#{} {} [row {}] score={} (skills={}, experience={}, education={}, keywords={})",
                    candidate.getRank(), candidate.getName(), candidate.getRowNumber(),
                    candidate.getOverallScore(), breakdown.getSkillsMatch(), breakdown.getExperienceMatch(),
                    breakdown.getEducationMatch(), breakdown.getKeywordsMatch());
        });

        for (FailedCandidate failed : result.failedCandidates()) {
            log.warn("Row {} ({}) not scored: {} - {}",
                    failed.rowNumber(), failed.name(), failed.errorKind(), failed.errorMessage());
        }
    }

    private void handleMetricsWait() {
        if (metricsWaitSeconds > 0) {
            log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
            try {
                Thread.sleep(metricsWaitSeconds * 1000L);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Metrics wait interrupted");
            }
        }
    }
}
