package com.eyelevel.attachmentprocessor.model;

import lombok.Builder;
import lombok.Singular;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * One mailbox message as handed over by a {@code MessageSource}. Owned by a single run and discarded afterwards.
 *
 * @param id          Identifier, unique within a run.
 * @param subject     Decoded subject line.
 * @param sender      The From address.
 * @param receivedAt  When the mailbox received the message, {@code null} if unknown.
 * @param attachments Attachments in the order they appear in the message.
 */
@Builder
public record Message(String id, String subject, String sender, OffsetDateTime receivedAt,
                      @Singular List<Attachment> attachments) {

    public static final String NO_SUBJECT = "No Subject";

    public Message {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        subject = subject == null || subject.isBlank() ? NO_SUBJECT : subject;
    }

    public boolean hasAttachments() {
        return !attachments.isEmpty();
    }
}
