package com.eyelevel.attachmentprocessor.model;

import java.util.Objects;

/**
 * One unit of work for the processing pool: an eligible attachment and the subject of the message it came from.
 */
public record ProcessingContext(Attachment attachment, String messageSubject) {

    public ProcessingContext {
        Objects.requireNonNull(attachment, "attachment");
    }

    public String filename() {
        return attachment.filename();
    }
}
