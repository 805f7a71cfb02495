package dev.resumescreener;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResumeScreenerApplicationTests {

    @Mock
    private PipelineRunner pipelineRunner;

    @Mock
    private ExitManager exitManager;

    @Test
    void shouldRunPipelineAndExitSuccessfully() {
        ResumeScreenerApplication app = new ResumeScreenerApplication(pipelineRunner, exitManager);

        when(pipelineRunner.execute()).thenReturn(3);

        app.run();

        verify(pipelineRunner).execute();
        verify(exitManager).completed(3);
    }

    @Test
    void shouldHandleExceptionAndExitWithError() {
        ResumeScreenerApplication app = new ResumeScreenerApplication(pipelineRunner, exitManager);

        when(pipelineRunner.execute()).thenThrow(new IllegalStateException("Screening run failed"));

        app.run();

        verify(exitManager).aborted(any(IllegalStateException.class));
    }
}
