package dev.resumescreener.model;

import java.util.List;

/**
 * Oracle narrative attached to a score breakdown.
 */
public record Explanation(String overall, List<String> strengths, List<String> weaknesses) {

    private static final String NO_EXPLANATION = "No explanation provided";

    public static final Explanation NONE = new Explanation(NO_EXPLANATION, List.of(), List.of());

    public Explanation {
        overall = overall == null || overall.isBlank() ? NO_EXPLANATION : overall;
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
    }
}
