package dev.resumescreener.store;

import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.error.ScreeningException;
import dev.resumescreener.model.CandidateRecord;
import dev.resumescreener.model.FailedCandidate;
import dev.resumescreener.model.RequirementSet;
import dev.resumescreener.ranking.Ranker;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Screening state: the active requirement set, the candidate store and the failure log.
 * Passed explicitly to every screening operation.
 * <p>
 * Reset and batch commit take the same lock, so a commit either lands entirely before a
 * reset or is refused because the requirement set it was scored against is gone.
 */
@Slf4j
public class ScreeningContext {

    private final AtomicReference<RequirementSet> requirements = new AtomicReference<>();
    private final FailureLog failureLog;
    private final CandidateStore candidateStore;
    private final ReentrantLock stateLock = new ReentrantLock();

    public ScreeningContext(Ranker ranker) {
        this.failureLog = new FailureLog();
        this.candidateStore = new CandidateStore(ranker, failureLog, () -> requirements.get() != null);
    }

    public Optional<RequirementSet> requirements() {
        return Optional.ofNullable(requirements.get());
    }

    public boolean hasRequirements() {
        return requirements.get() != null;
    }

    public CandidateStore candidates() {
        return candidateStore;
    }

    public FailureLog failures() {
        return failureLog;
    }

    /**
     * Installs the requirement set unless one is already active.
     *
     * @throws ScreeningException ALREADY_SET when another set is active
     */
    public void activate(RequirementSet requirementSet) {
        stateLock.lock();
        try {
            if (!requirements.compareAndSet(null, requirementSet)) {
                throw new ScreeningException(ErrorKind.ALREADY_SET,
                        "Requirements already set. Reset requirements before setting new ones.");
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Clears the requirement set, the candidate store and the failure log as one step.
     */
    public void reset() {
        stateLock.lock();
        try {
            requirements.set(null);
            int removed = candidateStore.clear();
            log.info("Screening context reset ({} candidates removed)", removed);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Commits a finished batch: records in the given order, then failures.
     *
     * @param scoredAgainst the requirement set the batch was processed with
     * @throws ScreeningException REQUIREMENTS_CHANGED when that set is no longer active
     */
    public void commit(RequirementSet scoredAgainst, List<CandidateRecord> records, List<FailedCandidate> failed) {
        stateLock.lock();
        try {
            if (requirements.get() != scoredAgainst) {
                throw new ScreeningException(ErrorKind.REQUIREMENTS_CHANGED,
                        "Requirements were reset while the batch was running; results discarded");
            }
            candidateStore.addAll(records);
            failureLog.appendAll(failed);
        } finally {
            stateLock.unlock();
        }
    }
}
