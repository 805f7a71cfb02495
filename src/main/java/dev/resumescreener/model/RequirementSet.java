package dev.resumescreener.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Structured criteria derived from a job description.
 * Immutable; a new set is only created by setting requirements again after a reset.
 */
@Value
@Builder
public class RequirementSet {

    @Builder.Default
    Set<String> requiredSkills = Set.of();

    @Builder.Default
    Set<String> niceToHaveSkills = Set.of();

    double minExperienceYears;

    @Builder.Default
    String educationLevel = "";

    @Builder.Default
    Set<String> keywords = Set.of();

    @Builder.Default
    Set<String> certifications = Set.of();

    @Builder.Default
    String jobDescription = "";

    /**
     * A set with no skills, keywords, certifications, education or experience carries no usable criteria.
     */
    public boolean isEmpty() {
        return requiredSkills.isEmpty()
                && niceToHaveSkills.isEmpty()
                && keywords.isEmpty()
                && certifications.isEmpty()
                && (educationLevel == null || educationLevel.isBlank())
                && minExperienceYears <= 0;
    }
}
