package dev.resumescreener.ranking;

import dev.resumescreener.config.ScreeningConfig;
import dev.resumescreener.model.CandidateRecord;
import dev.resumescreener.model.ScoringWeights;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Derives overall scores and assigns contiguous ranks.
 * Order: overall score descending, then insertion sequence ascending.
 */
@Slf4j
@Component
public class Ranker {

    static final Comparator<CandidateRecord> RANK_ORDER = Comparator
            .comparingInt(CandidateRecord::getOverallScore).reversed()
            .thenComparingLong(CandidateRecord::getInsertionSeq);

    private final ScoringWeights weights;

    @Autowired
    public Ranker(ScreeningConfig config) {
        this(config.getWeights().toScoringWeights());
    }

    public Ranker(ScoringWeights weights) {
        this.weights = weights;
    }

    /**
     * Overall score of the four sub-scores under the configured weights.
     */
    public int overallScore(int skillsMatch, int experienceMatch, int educationMatch, int keywordsMatch) {
        return weights.overallScore(skillsMatch, experienceMatch, educationMatch, keywordsMatch);
    }

    /**
     * Full re-rank: re-derives every overall score, re-sorts and assigns ranks 1..N.
     *
     * @param records current store contents, any order
     * @return new immutable list of ranked copies
     */
    public List<CandidateRecord> rank(Collection<CandidateRecord> records) {
        List<CandidateRecord> rescored = new ArrayList<>(records.size());
        for (CandidateRecord record : records) {
            rescored.add(record.toBuilder()
                    .breakdown(record.getBreakdown().reweigh(weights))
                    .build());
        }
        rescored.sort(RANK_ORDER);

        List<CandidateRecord> ranked = new ArrayList<>(rescored.size());
        for (int i = 0; i < rescored.size(); i++) {
            ranked.add(rescored.get(i).withRank(i + 1));
        }
        log.debug("Re-ranked {} candidates", ranked.size());
        return List.copyOf(ranked);
    }
}
