package com.eyelevel.attachmentprocessor.filter;

/**
 * The verdict of {@link AttachmentFilter} for a single attachment.
 */
public enum FilterDecision {
    ACCEPTED,
    /**
     * The file name has no extension, so its type cannot be checked.
     */
    MISSING_EXTENSION,
    /**
     * The file name cannot be parsed at all, e.g. it contains a NUL character.
     */
    INVALID_FILENAME,
    UNSUPPORTED_TYPE,
    SIZE_EXCEEDED;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
