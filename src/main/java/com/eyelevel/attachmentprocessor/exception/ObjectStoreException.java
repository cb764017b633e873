package com.eyelevel.attachmentprocessor.exception;

import java.io.Serial;

/**
 * Thrown when the object store rejects or fails a write.
 */
public class ObjectStoreException extends AttachmentProcessingException {
    @Serial
    private static final long serialVersionUID = -3127706259311869140L;

    public ObjectStoreException(String message) {
        super(message);
    }

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
