package dev.resumescreener.oracle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.resumescreener.config.ScreeningConfig;
import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.model.Explanation;
import dev.resumescreener.model.RequirementSet;
import dev.resumescreener.model.ScoreBreakdown;
import dev.resumescreener.model.ScoringWeights;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * ScoringOracle backed by the Groq Cloud chat completions API (OpenAI compatible).
 */
@Slf4j
@Service
public class GroqScoringOracle implements ScoringOracle {

    private static final String CHAT_PATH = "/chat/completions";
    private static final int MAX_JD_CHARS = 2000;
    private static final int MAX_RESUME_CHARS = 3000;
    private static final List<String> SUB_SCORES =
            List.of("skills_match", "experience_match", "education_match", "keywords_match");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final ScoringWeights weights;

    @Autowired
    public GroqScoringOracle(
            @Value("${app.ai.groq.api-key:}") String apiKey,
            @Value("${app.ai.groq.model:llama-3.3-70b-versatile}") String model,
            @Value("${app.ai.groq.base-url:https://api.groq.com/openai/v1}") String baseUrl,
            @Value("${app.ai.groq.temperature:0.3}") double temperature,
            ObjectMapper objectMapper,
            ScreeningConfig config) {
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
        this.objectMapper = objectMapper;
        this.weights = config.getWeights().toScoringWeights();
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Groq API Key is missing! Scoring requests will be rejected.");
        } else {
            log.info("Groq scoring oracle enabled with model: {}", this.model);
        }
    }

    @Override
    public Mono<OracleResult<ScoreBreakdown>> scoreCandidate(String resumeText, RequirementSet requirements) {
        GroqRequest request = buildRequest(
                "You are an expert HR recruiter and resume analyst. Analyze resumes objectively and provide detailed, fair scoring.",
                buildScoringPrompt(resumeText, requirements), temperature, 2000);

        return complete(request)
                .map(this::toBreakdown)
                .onErrorResume(e -> Mono.just(this.<ScoreBreakdown>classifyFailure(e)));
    }

    @Override
    public Mono<OracleResult<RequirementSet>> parseRequirements(String jobDescription) {
        GroqRequest request = buildRequest(
                "You are an expert at analyzing job descriptions and extracting key requirements.",
                buildRequirementsPrompt(jobDescription), 0.2, 1000);

        return complete(request)
                .map(content -> toRequirements(content, jobDescription))
                .onErrorResume(e -> Mono.just(this.<RequirementSet>classifyFailure(e)));
    }

    private Mono<String> complete(GroqRequest request) {
        if (!isEnabled()) {
            return Mono.error(new IllegalStateException("Groq API key not configured"));
        }
        return webClient.post()
                .uri(CHAT_PATH)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(GroqResponse.class)
                .map(response -> {
                    String content = extractContent(response);
                    log.debug("Groq response received ({} chars)", content.length());
                    return content;
                });
    }

    OracleResult<ScoreBreakdown> toBreakdown(String content) {
        Optional<JsonNode> parsed = OracleJson.readObject(objectMapper, content);
        if (parsed.isEmpty()) {
            return OracleResult.failure(ErrorKind.SCORING_MALFORMED_RESPONSE,
                    "Could not parse JSON from response: " + abbreviate(content));
        }
        JsonNode node = parsed.get();
        int[] scores = new int[SUB_SCORES.size()];
        for (int i = 0; i < SUB_SCORES.size(); i++) {
            JsonNode score = node.get(SUB_SCORES.get(i));
            if (score == null || score.isNull()) {
                return OracleResult.failure(ErrorKind.SCORING_MALFORMED_RESPONSE,
                        "Missing required field: " + SUB_SCORES.get(i));
            }
            if (!score.isNumber()) {
                return OracleResult.failure(ErrorKind.SCORING_MALFORMED_RESPONSE,
                        SUB_SCORES.get(i) + " must be a number, got " + score.getNodeType());
            }
            scores[i] = (int) Math.round(score.asDouble());
        }

        Explanation explanation = Explanation.NONE;
        JsonNode explanationNode = node.get("explanation");
        if (explanationNode != null && explanationNode.isObject()) {
            explanation = new Explanation(
                    OracleJson.text(explanationNode.get("overall")),
                    OracleJson.stringList(explanationNode.get("strengths")),
                    OracleJson.stringList(explanationNode.get("weaknesses")));
        }
        return OracleResult.success(ScoreBreakdown.of(scores[0], scores[1], scores[2], scores[3], explanation, weights));
    }

    OracleResult<RequirementSet> toRequirements(String content, String jobDescription) {
        Optional<JsonNode> parsed = OracleJson.readObject(objectMapper, content);
        if (parsed.isEmpty()) {
            return OracleResult.failure(ErrorKind.SCORING_MALFORMED_RESPONSE,
                    "Could not parse JSON from response: " + abbreviate(content));
        }
        JsonNode node = parsed.get();
        RequirementSet requirements = RequirementSet.builder()
                .requiredSkills(OracleJson.stringSet(OracleJson.field(node, "required_skills", "skills")))
                .niceToHaveSkills(OracleJson.stringSet(OracleJson.field(node, "nice_to_have_skills", "nice_to_have")))
                .minExperienceYears(OracleJson.number(OracleJson.field(node, "min_experience_years", "experience_years")))
                .educationLevel(OracleJson.text(OracleJson.field(node, "education_level", "education")))
                .keywords(OracleJson.stringSet(node.get("keywords")))
                .certifications(OracleJson.stringSet(node.get("certifications")))
                .jobDescription(jobDescription)
                .build();
        log.info("Extracted {} skills, {} keywords",
                requirements.getRequiredSkills().size(), requirements.getKeywords().size());
        return OracleResult.success(requirements);
    }

    private <T> OracleResult<T> classifyFailure(Throwable error) {
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            if (status == 429) {
                log.warn("Groq rate limited (HTTP {})", status);
                return OracleResult.failure(ErrorKind.SCORING_RATE_LIMITED, "Scoring oracle rate limited (HTTP " + status + ")");
            }
            if (status == 504 || status == 408) {
                return OracleResult.failure(ErrorKind.SCORING_TIMEOUT, "Scoring oracle timed out (HTTP " + status + ")");
            }
            log.error("Groq API error {}: {}", status, abbreviate(response.getResponseBodyAsString()));
            return OracleResult.failure(ErrorKind.SCORING_MALFORMED_RESPONSE, "Scoring oracle error (HTTP " + status + ")");
        }
        if (error instanceof TimeoutException
                || (error instanceof WebClientRequestException request && request.getRootCause() instanceof ReadTimeoutException)) {
            return OracleResult.failure(ErrorKind.SCORING_TIMEOUT, "Scoring oracle timed out");
        }
        log.warn("Groq request failed: {}", error.getMessage());
        return OracleResult.failure(ErrorKind.SCORING_MALFORMED_RESPONSE, "Scoring oracle request failed: " + error.getMessage());
    }

    private String buildScoringPrompt(String resumeText, RequirementSet requirements) {
        return String.format("""
                Analyze this candidate's resume against the job requirements and provide detailed scoring.

                JOB DESCRIPTION:
                %s

                REQUIREMENTS:
                Required skills: %s
                Nice to have: %s
                Minimum experience (years): %s
                Education: %s
                Certifications: %s
                Keywords: %s

                CANDIDATE RESUME:
                %s

                SCORING GUIDELINES:
                - skills_match (0-100): How well technical skills match requirements. Weight: %.0f%%
                - experience_match (0-100): Relevant work experience and years. Weight: %.0f%%
                - education_match (0-100): Education level and field alignment. Weight: %.0f%%
                - keywords_match (0-100): Important domain keywords and terminology. Weight: %.0f%%

                Be strict but fair. A perfect match is rare (90-100). Good matches are 70-85. Partial matches 50-70.

                Respond ONLY with valid JSON in this EXACT format:
                {
                    "skills_match": <number 0-100>,
                    "experience_match": <number 0-100>,
                    "education_match": <number 0-100>,
                    "keywords_match": <number 0-100>,
                    "explanation": {
                        "overall": "<overall assessment in 2-3 sentences>",
                        "strengths": ["<strength 1>", "<strength 2>", "<strength 3>"],
                        "weaknesses": ["<weakness 1>", "<weakness 2>"]
                    }
                }
                """,
                truncate(requirements.getJobDescription(), MAX_JD_CHARS),
                String.join(", ", requirements.getRequiredSkills()),
                String.join(", ", requirements.getNiceToHaveSkills()),
                requirements.getMinExperienceYears(),
                requirements.getEducationLevel(),
                String.join(", ", requirements.getCertifications()),
                String.join(", ", requirements.getKeywords()),
                truncate(resumeText, MAX_RESUME_CHARS),
                weights.skills() * 100, weights.experience() * 100,
                weights.education() * 100, weights.keywords() * 100);
    }

    private String buildRequirementsPrompt(String jobDescription) {
        return String.format("""
                Analyze this job description and extract key requirements.

                JOB DESCRIPTION:
                %s

                Extract and return ONLY valid JSON in this format:
                {
                    "required_skills": ["skill1", "skill2"],
                    "nice_to_have_skills": ["skill1", "skill2"],
                    "min_experience_years": <number or null>,
                    "education_level": "<degree or empty>",
                    "certifications": ["cert1"],
                    "keywords": ["keyword1", "keyword2"]
                }

                Be thorough but concise. Extract 5-15 skills and 10-20 keywords.
                """, jobDescription);
    }

    private GroqRequest buildRequest(String system, String prompt, double requestTemperature, int maxTokens) {
        return new GroqRequest(model,
                List.of(new GroqRequest.Message("system", system), new GroqRequest.Message("user", prompt)),
                requestTemperature, maxTokens);
    }

    private String extractContent(GroqResponse response) {
        if (response != null && response.choices() != null && !response.choices().isEmpty()
                && response.choices().get(0).message() != null) {
            String content = response.choices().get(0).message().content();
            return content != null ? content : "";
        }
        return "";
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }

    private static String abbreviate(String text) {
        return truncate(text, 200);
    }

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    // DTOs
    record GroqRequest(String model, List<Message> messages, double temperature,
                       @JsonProperty("max_tokens") int maxTokens) {
        record Message(String role, String content) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GroqResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Message(String content) {
            }
        }
    }
}
