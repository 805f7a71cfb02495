package dev.resumescreener.oracle;

import dev.resumescreener.model.RequirementSet;
import dev.resumescreener.model.ScoreBreakdown;
import reactor.core.publisher.Mono;

/**
 * Language-model backed scoring capability.
 * Responses of uncertain shape come back as {@link OracleResult} failures rather than errors.
 */
public interface ScoringOracle {

    /**
     * Score a resume against the requirement set.
     *
     * @return success with the breakdown, or failure of kind SCORING_TIMEOUT,
     *         SCORING_RATE_LIMITED or SCORING_MALFORMED_RESPONSE
     */
    Mono<OracleResult<ScoreBreakdown>> scoreCandidate(String resumeText, RequirementSet requirements);

    /**
     * Parse free-text job description into a (possibly partial) requirement set.
     *
     * @return success with whatever fields could be read, or failure when the response was unusable
     */
    Mono<OracleResult<RequirementSet>> parseRequirements(String jobDescription);
}
