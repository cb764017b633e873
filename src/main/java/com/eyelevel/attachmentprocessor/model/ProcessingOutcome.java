package com.eyelevel.attachmentprocessor.model;

import java.time.Duration;

/**
 * The result of processing one attachment. Produced exactly once per submitted {@link ProcessingContext}.
 *
 * @param filename       The attachment's file name.
 * @param messageSubject Subject of the originating message.
 * @param success        Whether the attachment was stored.
 * @param error          Description of the failure, {@code null} on success.
 * @param elapsed        Wall-clock time spent on the attachment, recorded on failure too.
 * @param objectKey      Storage key written, {@code null} on failure.
 */
public record ProcessingOutcome(String filename, String messageSubject, boolean success, String error,
                                Duration elapsed, String objectKey) {

    public static ProcessingOutcome succeeded(ProcessingContext context, String objectKey, Duration elapsed) {
        return new ProcessingOutcome(context.filename(), context.messageSubject(), true, null, elapsed, objectKey);
    }

    public static ProcessingOutcome failed(ProcessingContext context, String error, Duration elapsed) {
        return new ProcessingOutcome(context.filename(), context.messageSubject(), false, error, elapsed, null);
    }
}
