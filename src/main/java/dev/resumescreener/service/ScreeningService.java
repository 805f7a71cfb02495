package dev.resumescreener.service;

import dev.resumescreener.metrics.ScreeningMetrics;
import dev.resumescreener.model.BatchResult;
import dev.resumescreener.model.CandidateRecord;
import dev.resumescreener.model.CandidateRow;
import dev.resumescreener.model.FailedCandidate;
import dev.resumescreener.model.RequirementSet;
import dev.resumescreener.model.StoreStats;
import dev.resumescreener.ranking.Ranker;
import dev.resumescreener.store.ScreeningContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for screening: owns the screening context and delegates each
 * operation to the component responsible for it.
 */
@Service
public class ScreeningService {

    private final RequirementExtractor requirementExtractor;
    private final BatchOrchestrator batchOrchestrator;
    private final ScreeningMetrics metrics;
    private final ScreeningContext context;

    @Autowired
    public ScreeningService(RequirementExtractor requirementExtractor,
                            BatchOrchestrator batchOrchestrator,
                            Ranker ranker,
                            ScreeningMetrics metrics) {
        this(requirementExtractor, batchOrchestrator, metrics, new ScreeningContext(ranker));
    }

    ScreeningService(RequirementExtractor requirementExtractor,
                     BatchOrchestrator batchOrchestrator,
                     ScreeningMetrics metrics,
                     ScreeningContext context) {
        this.requirementExtractor = requirementExtractor;
        this.batchOrchestrator = batchOrchestrator;
        this.metrics = metrics;
        this.context = context;
    }

    // Requirements

    public RequirementSet setRequirements(String jobDescription) {
        return requirementExtractor.setRequirements(context, jobDescription);
    }

    public RequirementSet getRequirements() {
        return requirementExtractor.getRequirements(context);
    }

    public void resetRequirements() {
        requirementExtractor.resetRequirements(context);
    }

    // Batches

    public BatchResult runBatch(List<CandidateRow> rows) {
        long start = System.currentTimeMillis();
        BatchResult result = batchOrchestrator.runBatch(context, rows);
        metrics.recordBatch(result.totalRows(), result.successCount(), result.failCount());
        metrics.recordStageLatency("batch", System.currentTimeMillis() - start);
        return result;
    }

    // Candidates

    public List<CandidateRecord> listCandidates() {
        return context.candidates().list();
    }

    public CandidateRecord getCandidate(long id) {
        return context.candidates().get(id);
    }

    public void deleteCandidate(long id) {
        context.candidates().delete(id);
    }

    /**
     * Empties the store and the failure log; requirements stay active.
     *
     * @return number of candidates removed
     */
    public int clearCandidates() {
        return context.candidates().clear();
    }

    public StoreStats stats() {
        return context.candidates().stats();
    }

    // Failures

    public List<FailedCandidate> failedCandidates() {
        return context.failures().list();
    }

    public int clearFailures() {
        return context.failures().clear();
    }
}
