package dev.resumescreener.service;

import dev.resumescreener.config.ScreeningConfig;
import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.error.ScreeningException;
import dev.resumescreener.model.RequirementSet;
import dev.resumescreener.oracle.OracleResult;
import dev.resumescreener.oracle.ScoringOracle;
import dev.resumescreener.store.ScreeningContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Turns a job description into the context's single active requirement set.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequirementExtractor {

    private final ScoringOracle scoringOracle;
    private final ScreeningConfig config;

    /**
     * Parse the job description and make the result the active requirement set.
     *
     * @throws ScreeningException INVALID_INPUT, ALREADY_SET or SCORING_UNAVAILABLE
     */
    public RequirementSet setRequirements(ScreeningContext context, String jobDescription) {
        String text = jobDescription == null ? "" : jobDescription.strip();
        log.info("Setting job description ({} chars)", text.length());

        int minLength = config.getRequirements().getMinLength();
        int maxLength = config.getRequirements().getMaxLength();
        if (text.length() < minLength) {
            throw new ScreeningException(ErrorKind.INVALID_INPUT,
                    "Job description too short. Minimum " + minLength + " characters required.");
        }
        if (text.length() > maxLength) {
            throw new ScreeningException(ErrorKind.INVALID_INPUT,
                    "Job description too long. Maximum " + maxLength + " characters.");
        }
        if (context.hasRequirements()) {
            throw new ScreeningException(ErrorKind.ALREADY_SET,
                    "Requirements already set. Reset requirements before setting new ones.");
        }

        OracleResult<RequirementSet> result = scoringOracle.parseRequirements(text)
                .timeout(config.getScoring().getTimeout())
                .onErrorResume(e -> Mono.just(OracleResult.<RequirementSet>failure(
                        e instanceof TimeoutException ? ErrorKind.SCORING_TIMEOUT : ErrorKind.PROCESSING_FAILED,
                        "Requirement parsing failed: " + e.getMessage())))
                .block();

        if (result == null || !result.isSuccess()) {
            String reason = result == null ? "no response" : result.errorKind() + ": " + result.message();
            throw new ScreeningException(ErrorKind.SCORING_UNAVAILABLE,
                    "Failed to parse job description (" + reason + ")");
        }

        RequirementSet requirements = normalize(result.value(), text);
        if (requirements.isEmpty()) {
            throw new ScreeningException(ErrorKind.SCORING_UNAVAILABLE,
                    "Failed to parse job description: no usable requirements returned");
        }

        context.activate(requirements);
        log.info("Requirements set: {} required skills, {} nice-to-have, {} keywords, min {} years",
                requirements.getRequiredSkills().size(), requirements.getNiceToHaveSkills().size(),
                requirements.getKeywords().size(), requirements.getMinExperienceYears());
        return requirements;
    }

    /**
     * @throws ScreeningException REQUIREMENTS_NOT_SET when none is active
     */
    public RequirementSet getRequirements(ScreeningContext context) {
        return context.requirements().orElseThrow(() -> new ScreeningException(
                ErrorKind.REQUIREMENTS_NOT_SET, "No job description set. Please set job description first."));
    }

    /**
     * Clears requirements, candidates and failures together.
     */
    public void resetRequirements(ScreeningContext context) {
        context.reset();
        log.info("Requirements reset");
    }

    /**
     * Best-effort cleanup of a partial oracle result: null collections become empty,
     * entries are trimmed and de-duplicated, negative experience becomes 0.
     */
    static RequirementSet normalize(RequirementSet parsed, String jobDescription) {
        if (parsed == null) {
            return RequirementSet.builder().jobDescription(jobDescription).build();
        }
        double years = parsed.getMinExperienceYears();
        return RequirementSet.builder()
                .requiredSkills(clean(parsed.getRequiredSkills()))
                .niceToHaveSkills(clean(parsed.getNiceToHaveSkills()))
                .minExperienceYears(Double.isFinite(years) && years > 0 ? years : 0)
                .educationLevel(parsed.getEducationLevel() == null ? "" : parsed.getEducationLevel().strip())
                .keywords(clean(parsed.getKeywords()))
                .certifications(clean(parsed.getCertifications()))
                .jobDescription(jobDescription)
                .build();
    }

    private static Set<String> clean(Collection<String> values) {
        Set<String> cleaned = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    cleaned.add(value.strip());
                }
            }
        }
        return Collections.unmodifiableSet(cleaned);
    }
}
