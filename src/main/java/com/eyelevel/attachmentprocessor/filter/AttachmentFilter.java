package com.eyelevel.attachmentprocessor.filter;

import com.eyelevel.attachmentprocessor.model.Attachment;
import com.eyelevel.attachmentprocessor.model.AttachmentPolicy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Decides whether an attachment is eligible for processing. Stateless; the same attachment and policy
 * always produce the same decision.
 */
@Slf4j
@Component
public class AttachmentFilter {

    /**
     * Checks the attachment's extension against the allow-list, then its size against the ceiling.
     * A size equal to the ceiling is accepted. Never throws: an unusable file name is a rejection.
     *
     * @param attachment The attachment to classify.
     * @param policy     The active policy.
     * @return The decision, {@link FilterDecision#ACCEPTED} if the attachment may be processed.
     */
    public FilterDecision evaluate(final Attachment attachment, final AttachmentPolicy policy) {
        final String extension;
        try {
            extension = extensionOf(attachment.filename());
        } catch (IllegalArgumentException e) {
            log.warn("Rejecting attachment with unusable file name: {}", e.getMessage());
            return FilterDecision.INVALID_FILENAME;
        }
        if (!StringUtils.hasText(extension)) {
            return FilterDecision.MISSING_EXTENSION;
        }
        if (!policy.allowedExtensions().contains(extension)) {
            return FilterDecision.UNSUPPORTED_TYPE;
        }
        if (attachment.size() > policy.maxSizeBytes()) {
            return FilterDecision.SIZE_EXCEEDED;
        }
        return FilterDecision.ACCEPTED;
    }

    public boolean accept(final Attachment attachment, final AttachmentPolicy policy) {
        return evaluate(attachment, policy).isAccepted();
    }

    /**
     * @throws IllegalArgumentException if the name contains a NUL character.
     */
    static String extensionOf(final String filename) {
        final String baseName = FilenameUtils.getName(filename);
        if (baseName == null) {
            return "";
        }
        return FilenameUtils.getExtension(baseName).toLowerCase(Locale.ROOT);
    }
}
