package com.eyelevel.attachmentprocessor.worker;

import java.time.Instant;

/**
 * The storable form of an attachment. Content is carried as opaque bytes; nothing here interprets it.
 *
 * @param filename      Original file name.
 * @param contentType   Declared MIME type.
 * @param size          Declared size in bytes.
 * @param payload       The raw bytes to store.
 * @param sha256        Hex SHA-256 of the payload.
 * @param checksum      Checksum supplied by the mailbox, may be {@code null}.
 * @param parsedAt      When the record was built.
 * @param parserVersion Version tag of the record layout.
 */
record ParsedAttachment(String filename, String contentType, long size, byte[] payload, String sha256,
                        String checksum, Instant parsedAt, String parserVersion) {
}
