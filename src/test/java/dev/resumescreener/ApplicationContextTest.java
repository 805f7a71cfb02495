package dev.resumescreener;

import dev.resumescreener.oracle.GroqScoringOracle;
import dev.resumescreener.service.ScreeningService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

    @MockitoBean
    private PipelineRunner pipelineRunner;

    @MockitoBean
    private ExitManager exitManager;

    @Autowired
    private ScreeningService screeningService;

    @Autowired
    private GroqScoringOracle groqScoringOracle;

    @Test
    void contextLoads() {
        assertThat(screeningService.listCandidates()).isEmpty();
        assertThat(groqScoringOracle.isEnabled()).isFalse();
    }
}
