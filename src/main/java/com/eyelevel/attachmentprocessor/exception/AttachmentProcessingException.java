package com.eyelevel.attachmentprocessor.exception;

import java.io.Serial;

/**
 * A base exception for errors that occur in the attachment processing pipeline.
 */
public class AttachmentProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2291850672846620417L;

    public AttachmentProcessingException(String message) {
        super(message);
    }

    public AttachmentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
