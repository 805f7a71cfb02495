package dev.resumescreener.store;

import dev.resumescreener.model.FailedCandidate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Accumulates classified row failures across batches until cleared.
 */
@Slf4j
public class FailureLog {

    private final List<FailedCandidate> failures = new ArrayList<>();

    public synchronized void append(FailedCandidate failure) {
        failures.add(failure);
    }

    public synchronized void appendAll(Collection<FailedCandidate> batch) {
        failures.addAll(batch);
    }

    /**
     * Snapshot in insertion order.
     */
    public synchronized List<FailedCandidate> list() {
        return List.copyOf(failures);
    }

    public synchronized int size() {
        return failures.size();
    }

    /**
     * @return number of entries removed
     */
    public synchronized int clear() {
        int count = failures.size();
        failures.clear();
        if (count > 0) {
            log.info("Cleared {} failed candidates", count);
        }
        return count;
    }
}
