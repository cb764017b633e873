package com.eyelevel.attachmentprocessor.mailbox;

import com.eyelevel.attachmentprocessor.model.Attachment;
import com.eyelevel.attachmentprocessor.model.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * A fixed sample mailbox for running the pipeline end to end without a mail server
 * ({@code app.mailbox.type=demo}). The batch mixes eligible, oversized and unsupported attachments
 * and includes a message without attachments.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.mailbox.type", havingValue = "demo", matchIfMissing = true)
public class DemoMessageSource implements MessageSource {

    private static final String PDF = "application/pdf";
    private static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    private static final String DOCX = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    private final Clock clock;

    @Override
    public List<Message> fetchMessages() {
        final OffsetDateTime now = OffsetDateTime.now(clock);
        final List<Message> messages = List.of(
                Message.builder()
                        .id("email_001")
                        .subject("Monthly Financial Report - January 2024")
                        .sender("finance@company.com")
                        .receivedAt(now.minusDays(1))
                        .attachment(sample("monthly_financial_report.pdf", PDF, "Mock PDF content for testing",
                                "abc123def456"))
                        .attachment(sample("budget_analysis.xlsx", XLSX, "Mock Excel content for testing",
                                "def456ghi789"))
                        .build(),
                Message.builder()
                        .id("email_002")
                        .subject("Invoice #INV-2024-001")
                        .sender("billing@vendor.com")
                        .receivedAt(now.minusDays(2))
                        .attachment(sample("invoice_INV-2024-001.pdf", PDF, "Mock PDF content for testing", null))
                        .build(),
                Message.builder()
                        .id("email_003")
                        .subject("Contract Documents for Review")
                        .sender("legal@lawfirm.com")
                        .receivedAt(now.minusDays(3))
                        .attachment(sample("contract_agreement.docx", DOCX, "Mock Word document content for testing",
                                null))
                        .attachment(sample("terms_conditions.txt", "text/plain", "Mock text content for testing", null))
                        .build(),
                Message.builder()
                        .id("email_004")
                        .subject("Marketing Materials")
                        .sender("marketing@company.com")
                        .receivedAt(now.minusDays(4))
                        .attachment(sample("company_logo.png", "image/png", "Mock PNG content", null))
                        .attachment(sample("product_demo.mp4", "video/mp4", "Mock MP4 content", null))
                        .build(),
                Message.builder()
                        .id("email_005")
                        .subject("Large Dataset Export")
                        .sender("data@analytics.com")
                        .receivedAt(now.minusDays(5))
                        .attachment(Attachment.builder()
                                .filename("large_dataset.csv")
                                .size(30L * 1024 * 1024)
                                .contentType("text/csv")
                                .payload("Mock CSV content for testing".getBytes(StandardCharsets.UTF_8))
                                .build())
                        .build(),
                Message.builder()
                        .id("email_006")
                        .subject("Meeting Reminder")
                        .sender("calendar@company.com")
                        .receivedAt(now.minusHours(6))
                        .build());
        log.info("Loaded {} demo messages", messages.size());
        return messages;
    }

    private static Attachment sample(final String filename, final String contentType, final String content,
                                     final String checksum) {
        final byte[] payload = content.getBytes(StandardCharsets.UTF_8);
        return Attachment.builder()
                .filename(filename)
                .size(payload.length)
                .contentType(contentType)
                .payload(payload)
                .checksum(checksum)
                .build();
    }
}
