package dev.resumescreener.store;

import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.error.ScreeningException;
import dev.resumescreener.model.CandidateRecord;
import dev.resumescreener.model.StoreStats;
import dev.resumescreener.ranking.Ranker;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Candidate id to record mapping plus the ranked view.
 * <p>
 * Mutations are serialised by a single lock and end with a full re-rank. Each mutation
 * publishes a new immutable ranked snapshot; readers only ever see a complete snapshot
 * and never wait on the lock.
 */
@Slf4j
public class CandidateStore {

    private final Ranker ranker;
    private final FailureLog failureLog;
    private final BooleanSupplier requirementSetActive;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, CandidateRecord> records = new LinkedHashMap<>();
    private long nextId = 1;
    private long nextSeq = 1;

    private volatile List<CandidateRecord> ranked = List.of();

    public CandidateStore(Ranker ranker, FailureLog failureLog, BooleanSupplier requirementSetActive) {
        this.ranker = ranker;
        this.failureLog = failureLog;
        this.requirementSetActive = requirementSetActive;
    }

    /**
     * Assigns id and insertion sequence, then re-ranks.
     *
     * @return the assigned id
     */
    public long add(CandidateRecord record) {
        lock.lock();
        try {
            long id = insert(record);
            rerank();
            return id;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds records in list order under one lock acquisition with a single re-rank.
     *
     * @return assigned ids, in the same order as the input
     */
    public List<Long> addAll(List<CandidateRecord> batch) {
        if (batch.isEmpty()) {
            return List.of();
        }
        lock.lock();
        try {
            List<Long> ids = new ArrayList<>(batch.size());
            for (CandidateRecord record : batch) {
                ids.add(insert(record));
            }
            rerank();
            return ids;
        } finally {
            lock.unlock();
        }
    }

    public CandidateRecord get(long id) {
        for (CandidateRecord record : ranked) {
            if (record.getId() == id) {
                return record;
            }
        }
        throw notFound(id);
    }

    public void delete(long id) {
        lock.lock();
        try {
            if (records.remove(id) == null) {
                throw notFound(id);
            }
            rerank();
            log.info("Deleted candidate {}", id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Empties the store and the failure log. Ids are not reused afterwards.
     *
     * @return number of candidates removed
     */
    public int clear() {
        lock.lock();
        try {
            int count = records.size();
            failureLog.clear();
            if (count == 0) {
                return 0;
            }
            records.clear();
            rerank();
            log.info("Cleared {} candidates", count);
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ranked, read-only snapshot.
     */
    public List<CandidateRecord> list() {
        return ranked;
    }

    public int size() {
        return ranked.size();
    }

    /**
     * Computed on demand from the current snapshot.
     */
    public StoreStats stats() {
        List<CandidateRecord> snapshot = ranked;
        boolean active = requirementSetActive.getAsBoolean();
        Map<String, Integer> distribution = new LinkedHashMap<>();
        distribution.put("90-100", 0);
        distribution.put("80-89", 0);
        distribution.put("70-79", 0);
        distribution.put("60-69", 0);
        distribution.put("0-59", 0);

        if (snapshot.isEmpty()) {
            return new StoreStats(0, 0.0, 0, 0, active, distribution);
        }

        long sum = 0;
        int top = Integer.MIN_VALUE;
        int lowest = Integer.MAX_VALUE;
        for (CandidateRecord record : snapshot) {
            int score = record.getOverallScore();
            sum += score;
            top = Math.max(top, score);
            lowest = Math.min(lowest, score);
            distribution.merge(bucket(score), 1, Integer::sum);
        }
        double average = Math.round(sum * 100.0 / snapshot.size()) / 100.0;
        return new StoreStats(snapshot.size(), average, top, lowest, active, distribution);
    }

    private long insert(CandidateRecord record) {
        long id = nextId++;
        CandidateRecord stored = record.toBuilder()
                .id(id)
                .insertionSeq(nextSeq++)
                .rank(0)
                .build();
        records.put(id, stored);
        return id;
    }

    private void rerank() {
        List<CandidateRecord> reRanked = ranker.rank(records.values());
        for (CandidateRecord record : reRanked) {
            records.put(record.getId(), record);
        }
        ranked = reRanked;
    }

    private static String bucket(int score) {
        if (score >= 90) {
            return "90-100";
        } else if (score >= 80) {
            return "80-89";
        } else if (score >= 70) {
            return "70-79";
        } else if (score >= 60) {
            return "60-69";
        }
        return "0-59";
    }

    private static ScreeningException notFound(long id) {
        return new ScreeningException(ErrorKind.NOT_FOUND, "Candidate with ID " + id + " not found");
    }
}
