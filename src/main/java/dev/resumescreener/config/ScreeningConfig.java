package dev.resumescreener.config;

import dev.resumescreener.model.ScoringWeights;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tuning for the screening pipeline.
 * Loaded from application.yml under 'screening' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "screening")
public class ScreeningConfig {

    /**
     * Number of rows processed concurrently within a batch.
     */
    private int concurrency = 5;

    private Requirements requirements = new Requirements();
    private Fetch fetch = new Fetch();
    private Extraction extraction = new Extraction();
    private Scoring scoring = new Scoring();
    private Weights weights = new Weights();
    private Input input = new Input();

    @Data
    public static class Requirements {
        private int minLength = 50;
        private int maxLength = 10_000;
    }

    @Data
    public static class Fetch {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private Duration backoff = Duration.ofSeconds(1);
        private int maxBytes = 10 * 1024 * 1024;
    }

    @Data
    public static class Extraction {
        private int minTextLength = 50;
        private int maxChars = 50_000;
    }

    @Data
    public static class Scoring {
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRetries = 2;
        private Duration backoff = Duration.ofSeconds(5);
    }

    @Data
    public static class Weights {
        private double skills = 0.40;
        private double experience = 0.25;
        private double education = 0.15;
        private double keywords = 0.20;

        public ScoringWeights toScoringWeights() {
            return new ScoringWeights(skills, experience, education, keywords);
        }
    }

    @Data
    public static class Input {
        private String jobDescriptionFile = "job-description.txt";
        private String candidatesFile = "candidates.json";
        private int reportTopN = 10;
    }
}
