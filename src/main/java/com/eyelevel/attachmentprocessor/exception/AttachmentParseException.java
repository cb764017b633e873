package com.eyelevel.attachmentprocessor.exception;

import java.io.Serial;

/**
 * Thrown when an attachment cannot be turned into a storable record, e.g. its payload was never decoded.
 */
public class AttachmentParseException extends AttachmentProcessingException {
    @Serial
    private static final long serialVersionUID = 7046218844290118371L;

    public AttachmentParseException(String message) {
        super(message);
    }
}
