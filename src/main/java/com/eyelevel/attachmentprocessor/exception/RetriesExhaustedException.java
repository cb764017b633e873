package com.eyelevel.attachmentprocessor.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when a run gives up: every configured attempt failed, or the pause before the next one was
 * interrupted. This is the only fatal outcome of a run.
 */
@Getter
public class RetriesExhaustedException extends AttachmentProcessingException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastFailure) {
        super("Processing failed after " + attempts + " attempt(s). Last error: "
              + (lastFailure == null ? "unknown" : lastFailure.getMessage()), lastFailure);
        this.attempts = attempts;
    }
}
