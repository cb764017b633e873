package com.eyelevel.attachmentprocessor.notification;

import com.eyelevel.attachmentprocessor.model.RunSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Renders a {@link RunSummary} as the plain-text run report.
 */
@Component
@RequiredArgsConstructor
public class SummaryNotificationFormatter {

    static final String STATUS_SUCCESS = "Success";
    static final String STATUS_PARTIAL = "Partial";
    static final String NO_ATTACHMENTS_WARNING = "Warning: No attachments found in any emails.";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public RunNotification format(final RunSummary summary) {
        final String status = summary.isSuccess() ? STATUS_SUCCESS : STATUS_PARTIAL;
        final String nl = System.lineSeparator();

        final StringBuilder body = new StringBuilder()
                .append("Email Processor Report").append(nl)
                .append("Status: ").append(status).append(nl)
                .append(nl)
                .append("Processing Summary:").append(nl)
                .append("  - Total Emails Processed: ").append(summary.totalMessages()).append(nl)
                .append("  - Emails with Attachments: ").append(summary.messagesWithAttachments()).append(nl)
                .append("  - Total Attachments Found: ").append(summary.eligibleAttachments()).append(nl)
                .append("  - Successfully Processed: ").append(summary.processedAttachments()).append(nl)
                .append("  - Failed to Process: ").append(summary.failedAttachments()).append(nl)
                .append(nl)
                .append("Timestamp: ").append(LocalDateTime.now(clock).format(TIMESTAMP));

        if (summary.hasNoAttachments()) {
            body.append(nl).append(NO_ATTACHMENTS_WARNING);
        }

        return new RunNotification("Email Processor Report - " + status, body.toString());
    }
}
