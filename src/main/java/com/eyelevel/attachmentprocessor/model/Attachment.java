package com.eyelevel.attachmentprocessor.model;

import lombok.Builder;

import java.util.Arrays;
import java.util.Objects;

/**
 * A single file carried by a {@link Message}. Immutable: the payload is copied on the way in and on the way out.
 *
 * @param filename    The file name as declared by the sender.
 * @param size        The declared size in bytes.
 * @param contentType The declared MIME type.
 * @param payload     The raw bytes, or {@code null} if the mailbox could not decode the part.
 * @param checksum    Optional checksum supplied by the mailbox, may be {@code null}.
 */
@Builder
public record Attachment(String filename, long size, String contentType, byte[] payload, String checksum) {

    public Attachment {
        payload = payload == null ? null : payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload == null ? null : payload.clone();
    }

    @Override
    public String toString() {
        return "Attachment[filename=" + filename + ", size=" + size + ", contentType=" + contentType
               + ", payloadBytes=" + (payload == null ? "null" : payload.length) + ", checksum=" + checksum + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Attachment other)) {
            return false;
        }
        return size == other.size
               && Objects.equals(filename, other.filename)
               && Objects.equals(contentType, other.contentType)
               && Arrays.equals(payload, other.payload)
               && Objects.equals(checksum, other.checksum);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(filename, size, contentType, checksum);
        return 31 * result + Arrays.hashCode(payload);
    }
}
