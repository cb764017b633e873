package com.eyelevel.attachmentprocessor.service;

import com.eyelevel.attachmentprocessor.config.AttachmentProcessingConfig;
import com.eyelevel.attachmentprocessor.exception.BatchAggregationException;
import com.eyelevel.attachmentprocessor.exception.MessageFetchException;
import com.eyelevel.attachmentprocessor.filter.AttachmentFilter;
import com.eyelevel.attachmentprocessor.filter.FilterDecision;
import com.eyelevel.attachmentprocessor.mailbox.MessageSource;
import com.eyelevel.attachmentprocessor.model.Attachment;
import com.eyelevel.attachmentprocessor.model.AttachmentPolicy;
import com.eyelevel.attachmentprocessor.model.Message;
import com.eyelevel.attachmentprocessor.model.ProcessingContext;
import com.eyelevel.attachmentprocessor.model.ProcessingOutcome;
import com.eyelevel.attachmentprocessor.model.RunSummary;
import com.eyelevel.attachmentprocessor.notification.NotificationSender;
import com.eyelevel.attachmentprocessor.notification.RunNotification;
import com.eyelevel.attachmentprocessor.notification.SummaryNotificationFormatter;
import com.eyelevel.attachmentprocessor.worker.ProcessingPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Orchestrates one run: fetches the batch, filters every attachment against the policy, processes the
 * eligible ones in a single pool invocation, tallies the outcomes and sends the run report.
 * <p>
 * Faults that affect the whole run (fetching, bookkeeping) propagate to the caller, which decides whether
 * to retry. Faults of single attachments never reach this level; they arrive as failed outcomes.
 */
@Slf4j
@Service
public class BatchCoordinator {

    private final MessageSource messageSource;
    private final AttachmentFilter attachmentFilter;
    private final ProcessingPool processingPool;
    private final SummaryNotificationFormatter notificationFormatter;
    private final Optional<NotificationSender> notificationSender;
    private final AttachmentProcessingConfig config;

    public BatchCoordinator(MessageSource messageSource,
                            AttachmentFilter attachmentFilter,
                            ProcessingPool processingPool,
                            SummaryNotificationFormatter notificationFormatter,
                            Optional<NotificationSender> notificationSender,
                            AttachmentProcessingConfig config) {
        this.messageSource = messageSource;
        this.attachmentFilter = attachmentFilter;
        this.processingPool = processingPool;
        this.notificationFormatter = notificationFormatter;
        this.notificationSender = notificationSender;
        this.config = config;
    }

    /**
     * Runs one batch with the configured mailbox, policy and worker count.
     */
    public RunSummary run() {
        return run(messageSource, config.toPolicy(), config.getWorkerCount());
    }

    /**
     * Runs one batch.
     *
     * @param source      Where to fetch the messages from. Called exactly once.
     * @param policy      Which attachments are eligible.
     * @param workerCount Maximum number of attachments processed concurrently.
     * @return The counters of this run.
     * @throws MessageFetchException     if the source fails.
     * @throws BatchAggregationException if the outcomes cannot be collected.
     */
    public RunSummary run(final MessageSource source, final AttachmentPolicy policy, final int workerCount) {
        log.info("Starting email processing run");

        final List<Message> messages = fetch(source);
        if (messages.isEmpty()) {
            log.info("No emails to process");
            return RunSummary.EMPTY;
        }

        int messagesWithAttachments = 0;
        final List<ProcessingContext> workItems = new ArrayList<>();

        for (final Message message : messages) {
            log.info("Processing email: {}", message.subject());
            if (!message.hasAttachments()) {
                log.warn("No attachments found in email: {}", message.subject());
                continue;
            }
            messagesWithAttachments++;

            for (final Attachment attachment : message.attachments()) {
                final FilterDecision decision = attachmentFilter.evaluate(attachment, policy);
                if (decision.isAccepted()) {
                    workItems.add(new ProcessingContext(attachment, message.subject()));
                } else {
                    log.warn("Skipping attachment {} ({} bytes) from '{}' - {}", attachment.filename(),
                            attachment.size(), message.subject(), decision);
                }
            }
        }

        final List<ProcessingOutcome> outcomes = processingPool.runAll(workItems, workerCount);
        if (outcomes.size() != workItems.size()) {
            throw new BatchAggregationException("Expected " + workItems.size() + " outcomes but collected "
                                                + outcomes.size() + ".");
        }

        int processed = 0;
        for (final ProcessingOutcome outcome : outcomes) {
            if (outcome.success()) {
                processed++;
                log.info("Completed: {} in {} ms", outcome.filename(), outcome.elapsed().toMillis());
            } else {
                log.error("Failed: {} - {}", outcome.filename(), outcome.error());
            }
        }

        final RunSummary summary = new RunSummary(messages.size(), messagesWithAttachments, workItems.size(),
                processed);
        logSummary(summary);
        sendReport(summary);
        return summary;
    }

    private List<Message> fetch(final MessageSource source) {
        final List<Message> messages;
        try {
            messages = source.fetchMessages();
        } catch (RuntimeException e) {
            throw new MessageFetchException("Failed to fetch messages: " + e.getMessage(), e);
        }
        return messages == null ? List.of() : messages;
    }

    private void logSummary(final RunSummary summary) {
        log.info("Processing completed:");
        log.info("  - Total emails: {}", summary.totalMessages());
        log.info("  - Emails with attachments: {}", summary.messagesWithAttachments());
        log.info("  - Emails without attachments: {}", summary.messagesWithoutAttachments());
        log.info("  - Total attachments: {}", summary.eligibleAttachments());
        log.info("  - Processed attachments: {}", summary.processedAttachments());

        if (summary.hasNoAttachments()) {
            log.warn("No emails contained attachments - this might indicate an issue");
        }
    }

    /**
     * Sends the run report when a sender is available, notifications are enabled and a recipient is set.
     * Delivery problems are logged and never fail the run.
     */
    private void sendReport(final RunSummary summary) {
        final AttachmentProcessingConfig.Notification settings = config.getNotification();
        if (notificationSender.isEmpty() || !settings.isEnabled() || !StringUtils.hasText(settings.getRecipient())) {
            log.debug("Notifications not configured; skipping run report.");
            return;
        }

        final RunNotification notification = notificationFormatter.format(summary);
        log.info("Sending notification to {}", settings.getRecipient());
        try {
            notificationSender.get().send(notification, settings.getRecipient());
            log.info("Notification sent successfully");
        } catch (RuntimeException e) {
            log.error("Error sending notification to {}: {}", settings.getRecipient(), e.getMessage(), e);
        }
    }
}
