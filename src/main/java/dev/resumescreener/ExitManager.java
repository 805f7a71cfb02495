package dev.resumescreener;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns the outcome of a screening run into the process exit status.
 * A run that finishes is status 0 even when rows failed; only an aborted run is status 1.
 */
@Slf4j
@Component
public class ExitManager {

    static final int STATUS_COMPLETED = 0;
    static final int STATUS_ABORTED = 1;

    private final boolean exitOnCompletion;

    public ExitManager(@Value("${screening.exit-on-completion:true}") boolean exitOnCompletion) {
        this.exitOnCompletion = exitOnCompletion;
    }

    public void completed(int scored) {
        log.info("Resume Screener exiting ({} candidates scored)", scored);
        exit(STATUS_COMPLETED);
    }

    public void aborted(Throwable cause) {
        log.error("Resume Screener failed: {}", cause.getMessage());
        exit(STATUS_ABORTED);
    }

    private void exit(int status) {
        if (!exitOnCompletion || isTestRun()) {
            log.debug("Keeping the JVM alive (exit status {})", status);
            return;
        }
        terminate(status);
    }

    protected void terminate(int status) {
        System.exit(status);
    }

    protected boolean isTestRun() {
        String classPath = System.getProperty("java.class.path", "");
        return classPath.contains("junit") || classPath.contains("surefire");
    }
}
