package com.eyelevel.attachmentprocessor.storage;

import com.eyelevel.attachmentprocessor.exception.ObjectStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

import java.util.Map;

/**
 * Stores attachments in an S3 bucket. The payload is already in memory, so a single
 * {@code PutObject} call is enough; the SDK's own retry policy handles throttling and transient errors.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.storage.type", havingValue = "s3", matchIfMissing = true)
public class S3ObjectStore implements ObjectStore {

    private final S3Client s3Client;
    private final String bucketName;

    public S3ObjectStore(final S3Client s3Client, @Value("${aws.s3.bucket}") final String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        log.info("S3ObjectStore initialized for bucket '{}'.", bucketName);
    }

    @Override
    public void putObject(final String key, final byte[] payload, final String contentType,
                          final Map<String, String> metadata) {
        log.debug("Uploading {} bytes to S3 key: {}", payload.length, key);
        final PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType(contentType)
                .contentLength((long) payload.length)
                .metadata(metadata)
                .build();
        try {
            final PutObjectResponse response = s3Client.putObject(request, RequestBody.fromBytes(payload));
            log.info("Successfully uploaded object to s3://{}/{} (ETag {})", bucketName, key, response.eTag());
        } catch (SdkException e) {
            log.error("S3 upload failed for key: {}", key, e);
            throw new ObjectStoreException("S3 upload failed for key '" + key + "': " + e.getMessage(), e);
        }
    }
}
