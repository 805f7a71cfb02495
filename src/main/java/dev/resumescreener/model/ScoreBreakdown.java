package dev.resumescreener.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Sub-scores for one candidate plus the derived overall score.
 * The overall score can only be obtained through {@link #of} or {@link #reweigh},
 * so it always matches the sub-scores.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScoreBreakdown {

    int skillsMatch;
    int experienceMatch;
    int educationMatch;
    int keywordsMatch;
    int overallScore;
    Explanation explanation;

    public static ScoreBreakdown of(int skillsMatch, int experienceMatch, int educationMatch, int keywordsMatch,
                                    Explanation explanation, ScoringWeights weights) {
        int skills = ScoringWeights.clamp(skillsMatch);
        int experience = ScoringWeights.clamp(experienceMatch);
        int education = ScoringWeights.clamp(educationMatch);
        int keywords = ScoringWeights.clamp(keywordsMatch);
        return new ScoreBreakdown(skills, experience, education, keywords,
                weights.overallScore(skills, experience, education, keywords),
                explanation != null ? explanation : Explanation.NONE);
    }

    /**
     * Same sub-scores, overall score re-derived with the given weights.
     */
    public ScoreBreakdown reweigh(ScoringWeights weights) {
        return of(skillsMatch, experienceMatch, educationMatch, keywordsMatch, explanation, weights);
    }
}
