package dev.resumescreener.service;

import dev.resumescreener.config.ScreeningConfig;
import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.error.ScreeningException;
import dev.resumescreener.model.RequirementSet;
import dev.resumescreener.model.ScoringWeights;
import dev.resumescreener.oracle.OracleResult;
import dev.resumescreener.oracle.ScoringOracle;
import dev.resumescreener.ranking.Ranker;
import dev.resumescreener.store.ScreeningContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RequirementExtractorTest {

    private static final String JOB_DESCRIPTION =
            "Senior Java engineer with Spring Boot, Kafka and five years of backend experience.";

    @Mock
    private ScoringOracle scoringOracle;

    private ScreeningConfig config;
    private RequirementExtractor extractor;
    private ScreeningContext context;

    @BeforeEach
    void setUp() {
        config = new ScreeningConfig();
        config.getScoring().setTimeout(Duration.ofSeconds(2));
        extractor = new RequirementExtractor(scoringOracle, config);
        context = new ScreeningContext(new Ranker(ScoringWeights.DEFAULT));
    }

    private static Mono<OracleResult<RequirementSet>> parsed(RequirementSet set) {
        return Mono.just(OracleResult.success(set));
    }

    private static RequirementSet javaRequirements() {
        return RequirementSet.builder()
                .requiredSkills(Set.of("Java", "Spring Boot"))
                .minExperienceYears(5)
                .educationLevel("Bachelor's")
                .keywords(Set.of("backend"))
                .build();
    }

    private static void assertKind(Throwable error, ErrorKind kind) {
        assertThat(error).isInstanceOf(ScreeningException.class);
        assertThat(((ScreeningException) error).getKind()).isEqualTo(kind);
    }

    @Nested
    @DisplayName("Input validation")
    class ValidationTests {

        @Test
        @DisplayName("Should reject a description shorter than the minimum")
        void shouldRejectShortDescription() {
            assertThatThrownBy(() -> extractor.setRequirements(context, "Java dev"))
                    .satisfies(e -> assertKind(e, ErrorKind.INVALID_INPUT));
            verify(scoringOracle, never()).parseRequirements(anyString());
        }

        @Test
        @DisplayName("Should reject a description longer than the maximum")
        void shouldRejectLongDescription() {
            String tooLong = "x".repeat(config.getRequirements().getMaxLength() + 1);

            assertThatThrownBy(() -> extractor.setRequirements(context, tooLong))
                    .satisfies(e -> assertKind(e, ErrorKind.INVALID_INPUT));
        }

        @Test
        @DisplayName("Should measure length after trimming whitespace")
        void shouldTrimBeforeMeasuring() {
            String padded = "   " + "a".repeat(20) + "   ".repeat(20);

            assertThatThrownBy(() -> extractor.setRequirements(context, padded))
                    .satisfies(e -> assertKind(e, ErrorKind.INVALID_INPUT));
        }

        @Test
        @DisplayName("Should reject null")
        void shouldRejectNull() {
            assertThatThrownBy(() -> extractor.setRequirements(context, null))
                    .satisfies(e -> assertKind(e, ErrorKind.INVALID_INPUT));
        }
    }

    @Nested
    @DisplayName("Activation")
    class ActivationTests {

        @Test
        @DisplayName("Should activate the parsed requirement set")
        void shouldActivateParsedSet() {
            when(scoringOracle.parseRequirements(JOB_DESCRIPTION)).thenReturn(parsed(javaRequirements()));

            RequirementSet result = extractor.setRequirements(context, JOB_DESCRIPTION);

            assertThat(result.getRequiredSkills()).containsExactlyInAnyOrder("Java", "Spring Boot");
            assertThat(result.getJobDescription()).isEqualTo(JOB_DESCRIPTION);
            assertThat(extractor.getRequirements(context)).isSameAs(result);
        }

        @Test
        @DisplayName("Should fail AlreadySet on a second call and keep the original")
        void shouldRefuseSecondSet() {
            when(scoringOracle.parseRequirements(JOB_DESCRIPTION)).thenReturn(parsed(javaRequirements()));
            RequirementSet original = extractor.setRequirements(context, JOB_DESCRIPTION);

            assertThatThrownBy(() -> extractor.setRequirements(context,
                    "Python data engineer with Airflow, dbt and three years in analytics."))
                    .satisfies(e -> assertKind(e, ErrorKind.ALREADY_SET));
            assertThat(extractor.getRequirements(context)).isSameAs(original);
        }

        @Test
        @DisplayName("Should allow a new set after reset")
        void shouldAllowSetAfterReset() {
            when(scoringOracle.parseRequirements(JOB_DESCRIPTION)).thenReturn(parsed(javaRequirements()));
            extractor.setRequirements(context, JOB_DESCRIPTION);

            extractor.resetRequirements(context);

            assertThatThrownBy(() -> extractor.getRequirements(context))
                    .satisfies(e -> assertKind(e, ErrorKind.REQUIREMENTS_NOT_SET));
            assertThat(extractor.setRequirements(context, JOB_DESCRIPTION)).isNotNull();
        }
    }

    @Nested
    @DisplayName("Oracle results")
    class OracleResultTests {

        @Test
        @DisplayName("Should default missing fields and clean partial results")
        void shouldNormalizePartialResult() {
            RequirementSet partial = RequirementSet.builder()
                    .requiredSkills(new LinkedHashSet<>(Arrays.asList(" Java ", "", "Kafka", null)))
                    .niceToHaveSkills(null)
                    .minExperienceYears(-3)
                    .educationLevel(null)
                    .keywords(null)
                    .certifications(null)
                    .build();
            when(scoringOracle.parseRequirements(JOB_DESCRIPTION)).thenReturn(parsed(partial));

            RequirementSet result = extractor.setRequirements(context, JOB_DESCRIPTION);

            assertThat(result.getRequiredSkills()).containsExactly("Java", "Kafka");
            assertThat(result.getNiceToHaveSkills()).isEmpty();
            assertThat(result.getKeywords()).isEmpty();
            assertThat(result.getMinExperienceYears()).isZero();
            assertThat(result.getEducationLevel()).isEmpty();
        }

        @Test
        @DisplayName("Should fail ScoringUnavailable when the oracle reports a failure")
        void shouldFailOnOracleFailure() {
            when(scoringOracle.parseRequirements(JOB_DESCRIPTION)).thenReturn(
                    Mono.just(OracleResult.failure(ErrorKind.SCORING_MALFORMED_RESPONSE, "not json")));

            assertThatThrownBy(() -> extractor.setRequirements(context, JOB_DESCRIPTION))
                    .satisfies(e -> assertKind(e, ErrorKind.SCORING_UNAVAILABLE));
            assertThat(context.hasRequirements()).isFalse();
        }

        @Test
        @DisplayName("Should fail ScoringUnavailable when the oracle errors")
        void shouldFailOnOracleError() {
            when(scoringOracle.parseRequirements(JOB_DESCRIPTION))
                    .thenReturn(Mono.error(new IllegalStateException("Groq API key not configured")));

            assertThatThrownBy(() -> extractor.setRequirements(context, JOB_DESCRIPTION))
                    .satisfies(e -> assertKind(e, ErrorKind.SCORING_UNAVAILABLE));
        }

        @Test
        @DisplayName("Should fail ScoringUnavailable when nothing usable is returned")
        void shouldFailOnEmptyResult() {
            when(scoringOracle.parseRequirements(JOB_DESCRIPTION))
                    .thenReturn(parsed(RequirementSet.builder().build()));

            assertThatThrownBy(() -> extractor.setRequirements(context, JOB_DESCRIPTION))
                    .satisfies(e -> assertKind(e, ErrorKind.SCORING_UNAVAILABLE));
            assertThat(context.hasRequirements()).isFalse();
        }
    }
}
