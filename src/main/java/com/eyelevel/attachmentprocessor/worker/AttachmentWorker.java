package com.eyelevel.attachmentprocessor.worker;

import com.eyelevel.attachmentprocessor.exception.AttachmentParseException;
import com.eyelevel.attachmentprocessor.model.Attachment;
import com.eyelevel.attachmentprocessor.model.ProcessingContext;
import com.eyelevel.attachmentprocessor.model.ProcessingOutcome;
import com.eyelevel.attachmentprocessor.storage.ObjectStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Processes a single attachment: builds its storable record, writes it to the object store and
 * reports the result as a {@link ProcessingOutcome}.
 * <p>
 * Holds no per-call state, so one instance serves every thread of the processing pool.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttachmentWorker {

    static final String PARSER_VERSION = "1.0.0";
    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final ObjectStore objectStore;
    private final Clock clock;

    /**
     * Parses and stores the attachment of the given context. Never throws: any failure is returned as a
     * failed outcome carrying the error description. Elapsed time covers both steps, success or not.
     *
     * @param context The attachment and its message subject.
     * @return The outcome for this context.
     */
    public ProcessingOutcome process(final ProcessingContext context) {
        final long start = System.nanoTime();
        final String filename = context.filename();
        log.info("[{}] Processing attachment '{}'", context.messageSubject(), filename);

        try {
            final ParsedAttachment parsed = parse(context.attachment());
            final String key = persist(parsed);
            final Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.info("[{}] Stored '{}' at '{}' in {} ms", context.messageSubject(), filename, key, elapsed.toMillis());
            return ProcessingOutcome.succeeded(context, key, elapsed);
        } catch (Exception e) {
            final Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.error("[{}] Failed to process '{}' after {} ms: {}", context.messageSubject(), filename,
                    elapsed.toMillis(), e.getMessage(), e);
            return ProcessingOutcome.failed(context, describe(e), elapsed);
        }
    }

    /**
     * Builds the storable record. Bookkeeping only: content is not interpreted.
     *
     * @throws AttachmentParseException if the attachment has no name or no decoded payload.
     */
    ParsedAttachment parse(final Attachment attachment) {
        if (!StringUtils.hasText(attachment.filename())) {
            throw new AttachmentParseException("Attachment has no file name.");
        }
        final byte[] payload = attachment.payload();
        if (payload == null) {
            throw new AttachmentParseException("Attachment '" + attachment.filename() + "' has no decoded payload.");
        }
        final String contentType = StringUtils.hasText(attachment.contentType())
                ? attachment.contentType()
                : DEFAULT_CONTENT_TYPE;
        log.debug("Parsed attachment '{}' ({} bytes, {})", attachment.filename(), attachment.size(), contentType);
        return new ParsedAttachment(attachment.filename(), contentType, attachment.size(), payload,
                DigestUtils.sha256Hex(payload), attachment.checksum(), clock.instant(), PARSER_VERSION);
    }

    private String persist(final ParsedAttachment parsed) {
        final LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        final String key = ObjectStore.constructKey(parsed.filename(), today);

        final Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("content-type", parsed.contentType());
        metadata.put("original-size", String.valueOf(parsed.size()));
        metadata.put("parsed-at", parsed.parsedAt().toString());
        metadata.put("parser-version", parsed.parserVersion());
        metadata.put("sha256", parsed.sha256());
        if (StringUtils.hasText(parsed.checksum())) {
            metadata.put("checksum", parsed.checksum());
        }
        metadata.put("uploaded-at", Instant.now(clock).toString());

        objectStore.putObject(key, parsed.payload(), parsed.contentType(), metadata);
        return key;
    }

    static String describe(final Throwable error) {
        final String message = error.getMessage();
        return StringUtils.hasText(message) ? message : error.getClass().getSimpleName();
    }
}
