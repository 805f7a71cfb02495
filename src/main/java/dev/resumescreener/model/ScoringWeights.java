package dev.resumescreener.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Weights applied to the four sub-scores when deriving the overall score.
 */
public record ScoringWeights(double skills, double experience, double education, double keywords) {

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.40, 0.25, 0.15, 0.20);

    public ScoringWeights {
        if (skills < 0 || experience < 0 || education < 0 || keywords < 0) {
            throw new IllegalArgumentException("Scoring weights must not be negative");
        }
    }

    /**
     * Weighted sum of the sub-scores, rounded half-up and clamped to [0, 100].
     * Summed in decimal so that weights such as 0.15 hit exact halves.
     */
    public int overallScore(int skillsMatch, int experienceMatch, int educationMatch, int keywordsMatch) {
        BigDecimal weighted = weigh(skills, skillsMatch)
                .add(weigh(experience, experienceMatch))
                .add(weigh(education, educationMatch))
                .add(weigh(keywords, keywordsMatch));
        return clamp(weighted.setScale(0, RoundingMode.HALF_UP).intValue());
    }

    private static BigDecimal weigh(double weight, int score) {
        return BigDecimal.valueOf(weight).multiply(BigDecimal.valueOf(score));
    }

    static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
