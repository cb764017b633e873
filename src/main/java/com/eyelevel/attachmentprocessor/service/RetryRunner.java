package com.eyelevel.attachmentprocessor.service;

import com.eyelevel.attachmentprocessor.config.AttachmentProcessingConfig;
import com.eyelevel.attachmentprocessor.exception.RetriesExhaustedException;
import com.eyelevel.attachmentprocessor.model.RunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@link BatchCoordinator#run()} until it succeeds or the configured attempts are used up.
 * Every attempt starts from scratch: it re-fetches and reprocesses the whole batch.
 */
@Slf4j
@Service
public class RetryRunner {

    private final BatchCoordinator batchCoordinator;
    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    @Autowired
    public RetryRunner(BatchCoordinator batchCoordinator,
                       @Qualifier("ingestionRetryTemplate") RetryTemplate retryTemplate,
                       AttachmentProcessingConfig config) {
        this(batchCoordinator, retryTemplate, config.getRetry().getAttempts());
    }

    RetryRunner(BatchCoordinator batchCoordinator, RetryTemplate retryTemplate, int maxAttempts) {
        this.batchCoordinator = batchCoordinator;
        this.retryTemplate = retryTemplate;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @return The summary of the first successful attempt.
     * @throws RetriesExhaustedException if the attempts ran out or the pause between them was interrupted;
     *                                   carries the last failure and the number of attempts actually made.
     */
    public RunSummary runWithRetry() {
        final AtomicInteger attemptsStarted = new AtomicInteger();
        try {
            return retryTemplate.execute(context -> {
                final int attempt = attemptsStarted.incrementAndGet();
                log.info("Processing attempt {}/{}", attempt, maxAttempts);
                return batchCoordinator.run();
            });
        } catch (RuntimeException e) {
            // Fewer than maxAttempts when the back-off pause was interrupted.
            throw new RetriesExhaustedException(attemptsStarted.get(), e);
        }
    }
}
