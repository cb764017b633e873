package com.eyelevel.attachmentprocessor.storage;

import com.eyelevel.attachmentprocessor.exception.ObjectStoreException;

import java.time.LocalDate;
import java.util.Map;

/**
 * Durable storage for processed attachments. Implementations must be safe for concurrent use,
 * since every worker in the processing pool writes through the same instance.
 */
public interface ObjectStore {

    /**
     * Stores a payload under the given key, replacing any previous object with that key.
     *
     * @param key         The destination key.
     * @param payload     The bytes to store.
     * @param contentType The MIME type recorded with the object.
     * @param metadata    User metadata recorded with the object.
     * @throws ObjectStoreException if the backend rejects the write or cannot be reached.
     */
    void putObject(String key, byte[] payload, String contentType, Map<String, String> metadata);

    /**
     * Builds the date-partitioned key {@code yyyy/MM/dd/<file name>}. Characters outside
     * {@code [a-zA-Z0-9.-_]} are replaced so that a file name can never introduce extra path segments.
     */
    static String constructKey(final String fileName, final LocalDate date) {
        final String safeFileName = fileName.replaceAll("[^a-zA-Z0-9.\\-_]", "_");
        return String.format("%04d/%02d/%02d/%s", date.getYear(), date.getMonthValue(), date.getDayOfMonth(),
                safeFileName);
    }
}
