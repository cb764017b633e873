package com.eyelevel.attachmentprocessor.scheduler;

import com.eyelevel.attachmentprocessor.model.RunSummary;
import com.eyelevel.attachmentprocessor.service.RetryRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Performs exactly one retried run at start-up ({@code app.processing.run-mode=once}), the mode used when
 * an external cron launches the process.
 * <p>
 * A {@link com.eyelevel.attachmentprocessor.exception.RetriesExhaustedException} is not caught: it aborts
 * the application start-up, so the process exits with a non-zero status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.processing.run-mode", havingValue = "once", matchIfMissing = true)
public class SingleRunApplicationRunner implements ApplicationRunner {

    private final RetryRunner retryRunner;

    @Override
    public void run(ApplicationArguments args) {
        final RunSummary summary = retryRunner.runWithRetry();
        log.info("Single run finished: {} messages, {}/{} eligible attachments stored.", summary.totalMessages(),
                summary.processedAttachments(), summary.eligibleAttachments());
    }
}
