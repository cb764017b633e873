package com.eyelevel.attachmentprocessor.exception;

import java.io.Serial;

/**
 * Thrown when batch bookkeeping cannot complete, e.g. the pool was interrupted or outcomes went missing.
 * Aborts the current attempt.
 */
public class BatchAggregationException extends AttachmentProcessingException {
    @Serial
    private static final long serialVersionUID = -8460335173021559762L;

    public BatchAggregationException(String message) {
        super(message);
    }

    public BatchAggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
