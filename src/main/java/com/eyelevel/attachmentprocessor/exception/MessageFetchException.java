package com.eyelevel.attachmentprocessor.exception;

import java.io.Serial;

/**
 * Thrown when the message source cannot deliver a batch. Aborts the current attempt.
 */
public class MessageFetchException extends AttachmentProcessingException {
    @Serial
    private static final long serialVersionUID = 5581297046932208110L;

    public MessageFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
