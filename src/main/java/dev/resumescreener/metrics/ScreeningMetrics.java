package dev.resumescreener.metrics;

import dev.resumescreener.error.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for screening batches.
 */
@Component
public class ScreeningMetrics {

    private static final String TAG_STAGE = "stage";
    private static final String TAG_KIND = "kind";
    private final MeterRegistry registry;

    // Counters
    private final Counter batchesCounter;
    private final Counter rowsSucceededCounter;
    private final Counter rowsFailedCounter;
    private final Counter retriesCounter;

    // Timers (per stage)
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastBatchRows = new AtomicInteger(0);
    private final AtomicInteger lastBatchSucceeded = new AtomicInteger(0);
    private final AtomicInteger lastBatchFailed = new AtomicInteger(0);

    public ScreeningMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.batchesCounter = Counter.builder("resume_screener_batches_total")
                .description("Total batches run")
                .register(registry);

        this.rowsSucceededCounter = Counter.builder("resume_screener_rows_succeeded_total")
                .description("Total rows scored and committed")
                .register(registry);

        this.rowsFailedCounter = Counter.builder("resume_screener_rows_failed_total")
                .description("Total rows that ended as failed candidates")
                .register(registry);

        this.retriesCounter = Counter.builder("resume_screener_retries_total")
                .description("Total retries of transient fetch and scoring failures")
                .register(registry);

        Gauge.builder("resume_screener_last_batch_rows", lastBatchRows, AtomicInteger::get)
                .description("Rows in last batch")
                .register(registry);

        Gauge.builder("resume_screener_last_batch_succeeded", lastBatchSucceeded, AtomicInteger::get)
                .description("Rows succeeded in last batch")
                .register(registry);

        Gauge.builder("resume_screener_last_batch_failed", lastBatchFailed, AtomicInteger::get)
                .description("Rows failed in last batch")
                .register(registry);
    }

    /**
     * Get or create a timer for a pipeline stage.
     */
    public Timer getStageTimer(String stage) {
        return stageTimers.computeIfAbsent(stage, name ->
                Timer.builder("resume_screener_stage_duration")
                        .description("Time spent in a row pipeline stage")
                        .tag(TAG_STAGE, name)
                        .register(registry)
        );
    }

    public void recordStageLatency(String stage, long latencyMs) {
        getStageTimer(stage).record(Duration.ofMillis(latencyMs));
    }

    public void recordRowsSucceeded(int count) {
        rowsSucceededCounter.increment(count);
    }

    /**
     * Record a failed row, also counted per error kind.
     */
    public void recordRowFailed(ErrorKind kind) {
        rowsFailedCounter.increment();
        Counter.builder("resume_screener_row_failures_by_kind_total")
                .tag(TAG_KIND, kind.name())
                .register(registry)
                .increment();
    }

    public void recordRetry(ErrorKind kind) {
        retriesCounter.increment();
        Counter.builder("resume_screener_retries_by_kind_total")
                .tag(TAG_KIND, kind.name())
                .register(registry)
                .increment();
    }

    /**
     * Update last batch statistics.
     */
    public void recordBatch(int rows, int succeeded, int failed) {
        batchesCounter.increment();
        lastBatchRows.set(rows);
        lastBatchSucceeded.set(succeeded);
        lastBatchFailed.set(failed);
    }
}
