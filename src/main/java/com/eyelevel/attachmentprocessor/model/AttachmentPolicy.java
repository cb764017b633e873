package com.eyelevel.attachmentprocessor.model;

import java.util.Set;

/**
 * The rules deciding which attachments are eligible for processing.
 *
 * @param allowedExtensions Lower-case file extensions, without the leading dot.
 * @param maxSizeBytes      Inclusive size ceiling in bytes.
 */
public record AttachmentPolicy(Set<String> allowedExtensions, long maxSizeBytes) {

    public AttachmentPolicy {
        allowedExtensions = Set.copyOf(allowedExtensions);
        if (maxSizeBytes < 0) {
            throw new IllegalArgumentException("maxSizeBytes must not be negative: " + maxSizeBytes);
        }
    }
}
