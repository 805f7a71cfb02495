package dev.resumescreener;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class ResumeScreenerApplication implements CommandLineRunner {

    private final PipelineRunner pipelineRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(ResumeScreenerApplication.class, args);
    }

    @Override
    public void run(String... args) {
        int scored;
        try {
            scored = pipelineRunner.execute();
        } catch (Exception e) {
            exitManager.aborted(e);
            return;
        }
        exitManager.completed(scored);
    }
}
