package com.eyelevel.attachmentprocessor.scheduler;

import com.eyelevel.attachmentprocessor.exception.RetriesExhaustedException;
import com.eyelevel.attachmentprocessor.model.RunSummary;
import com.eyelevel.attachmentprocessor.service.RetryRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Sweeps the mailbox on a cron schedule while the application is up ({@code app.processing.run-mode=scheduled}).
 * <p>
 * Runs on Spring's single scheduler thread, so two sweeps never overlap. An exhausted run is logged and
 * the next tick starts over with a fresh batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.processing.run-mode", havingValue = "scheduled")
public class AttachmentIngestionScheduler {

    private final RetryRunner retryRunner;

    @Scheduled(cron = "${app.processing.schedule-cron}")
    public void sweepMailbox() {
        log.info("Starting scheduled mailbox sweep...");
        try {
            final RunSummary summary = retryRunner.runWithRetry();
            log.info("Scheduled mailbox sweep finished: {}/{} eligible attachments stored.",
                    summary.processedAttachments(), summary.eligibleAttachments());
        } catch (RetriesExhaustedException e) {
            log.error("Scheduled mailbox sweep failed after {} attempts.", e.getAttempts(), e);
        }
    }
}
