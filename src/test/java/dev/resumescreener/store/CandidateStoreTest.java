package dev.resumescreener.store;

import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.error.ScreeningException;
import dev.resumescreener.model.CandidateRecord;
import dev.resumescreener.model.CandidateRow;
import dev.resumescreener.model.Explanation;
import dev.resumescreener.model.FailedCandidate;
import dev.resumescreener.model.ScoreBreakdown;
import dev.resumescreener.model.ScoringWeights;
import dev.resumescreener.model.StoreStats;
import dev.resumescreener.ranking.Ranker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateStoreTest {

    private FailureLog failureLog;
    private CandidateStore store;

    @BeforeEach
    void setUp() {
        failureLog = new FailureLog();
        store = new CandidateStore(new Ranker(ScoringWeights.DEFAULT), failureLog, () -> true);
    }

    private CandidateRecord scored(String name, int score) {
        return CandidateRecord.builder()
                .name(name)
                .breakdown(ScoreBreakdown.of(score, score, score, score, Explanation.NONE, ScoringWeights.DEFAULT))
                .build();
    }

    @Nested
    @DisplayName("Adding and reading")
    class AddTests {

        @Test
        @DisplayName("Should assign increasing ids and rank on add")
        void shouldAssignIdsAndRank() {
            long first = store.add(scored("alice", 60));
            long second = store.add(scored("bob", 90));

            assertThat(second).isGreaterThan(first);
            assertThat(store.get(second).getRank()).isEqualTo(1);
            assertThat(store.get(first).getRank()).isEqualTo(2);
            assertThat(store.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should add a batch in list order with ascending insertion sequence")
        void shouldAddBatchInOrder() {
            List<Long> ids = store.addAll(List.of(scored("a", 70), scored("b", 70), scored("c", 70)));

            assertThat(ids).hasSize(3).isSorted();
            assertThat(store.list()).extracting(CandidateRecord::getName).containsExactly("a", "b", "c");
            assertThat(store.list()).extracting(CandidateRecord::getRank).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("Should fail with NotFound for an unknown id")
        void shouldFailForUnknownId() {
            assertThatThrownBy(() -> store.get(42))
                    .isInstanceOf(ScreeningException.class)
                    .satisfies(e -> assertThat(((ScreeningException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND))
                    .hasMessageContaining("42");
        }

        @Test
        @DisplayName("Should return an immutable snapshot")
        void shouldReturnImmutableSnapshot() {
            store.add(scored("alice", 60));
            List<CandidateRecord> snapshot = store.list();

            store.add(scored("bob", 70));

            assertThat(snapshot).hasSize(1);
            assertThatThrownBy(snapshot::clear).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Removing")
    class RemoveTests {

        @Test
        @DisplayName("Should shrink by one and close the rank gap on delete")
        void shouldReRankAfterDelete() {
            long top = store.add(scored("top", 95));
            store.add(scored("mid", 75));
            store.add(scored("low", 55));

            store.delete(top);

            assertThat(store.size()).isEqualTo(2);
            assertThat(store.list()).extracting(CandidateRecord::getRank).containsExactly(1, 2);
            assertThat(store.list().get(0).getName()).isEqualTo("mid");
        }

        @Test
        @DisplayName("Should fail with NotFound when deleting twice")
        void shouldFailOnSecondDelete() {
            long id = store.add(scored("alice", 60));
            store.delete(id);

            assertThatThrownBy(() -> store.delete(id))
                    .isInstanceOf(ScreeningException.class)
                    .satisfies(e -> assertThat(((ScreeningException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
        }

        @Test
        @DisplayName("Should clear candidates and failures without reusing ids")
        void shouldClearWithoutReusingIds() {
            long before = store.add(scored("alice", 60));
            failureLog.append(FailedCandidate.of(
                    CandidateRow.builder().rowNumber(2).name("bob").resumeLocator("x").build(),
                    ErrorKind.FETCH_NOT_FOUND, "gone"));

            assertThat(store.clear()).isEqualTo(1);
            long after = store.add(scored("carol", 60));

            assertThat(after).isGreaterThan(before);
            assertThat(failureLog.size()).isZero();
            assertThat(store.list()).extracting(CandidateRecord::getName).containsExactly("carol");
        }

        @Test
        @DisplayName("Should treat clearing an empty store as a no-op")
        void shouldClearEmptyStore() {
            assertThat(store.clear()).isZero();
            assertThat(store.list()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Statistics")
    class StatsTests {

        @Test
        @DisplayName("Should report zeros for an empty store")
        void shouldReportEmptyStats() {
            StoreStats stats = store.stats();

            assertThat(stats.count()).isZero();
            assertThat(stats.averageScore()).isZero();
            assertThat(stats.requirementSetActive()).isTrue();
            assertThat(stats.scoreDistribution().values()).allMatch(v -> v == 0);
        }

        @Test
        @DisplayName("Should compute average, extremes and distribution")
        void shouldComputeStats() {
            store.addAll(List.of(scored("a", 95), scored("b", 85), scored("c", 72), scored("d", 40)));

            StoreStats stats = store.stats();

            assertThat(stats.count()).isEqualTo(4);
            assertThat(stats.averageScore()).isEqualTo(73.0);
            assertThat(stats.topScore()).isEqualTo(95);
            assertThat(stats.lowestScore()).isEqualTo(40);
            assertThat(stats.scoreDistribution())
                    .containsEntry("90-100", 1)
                    .containsEntry("80-89", 1)
                    .containsEntry("70-79", 1)
                    .containsEntry("60-69", 0)
                    .containsEntry("0-59", 1);
            assertThat(stats.scoreDistribution().values().stream().mapToInt(Integer::intValue).sum())
                    .isEqualTo(stats.count());
        }

        @Test
        @DisplayName("Should round the average to two decimals")
        void shouldRoundAverage() {
            store.addAll(List.of(scored("a", 70), scored("b", 70), scored("c", 71)));

            assertThat(store.stats().averageScore()).isEqualTo(70.33);
        }
    }
}
