package com.eyelevel.attachmentprocessor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * Builds the {@link S3Client} behind the S3 object store ({@code app.storage.type=s3}).
 * <p>
 * Each upload is bounded by {@code aws.s3.upload-timeout-seconds}, SDK retries included, so a stalled
 * upload turns into a failed outcome for that attachment instead of holding a worker forever.
 * Setting {@code aws.s3.endpoint} points the client at an S3-compatible store (MinIO, LocalStack)
 * with path-style addressing.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "app.storage.type", havingValue = "s3", matchIfMissing = true)
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    @Value("${aws.s3.retry-count:3}")
    private int s3RetryCount;

    @Value("${aws.s3.upload-timeout-seconds:60}")
    private long uploadTimeoutSeconds;

    @Value("${aws.s3.endpoint:}")
    private String endpoint;

    /**
     * Static keys are mandatory under the {@code local} profile and used whenever both are configured.
     * Otherwise the default chain applies (environment, instance profile, IAM role).
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment) {
        final boolean keysConfigured = StringUtils.hasText(accessKey) && StringUtils.hasText(secretKey);
        if (environment.acceptsProfiles(Profiles.of("local")) && !keysConfigured) {
            throw new IllegalArgumentException(
                    "aws.access-key and aws.secret-key must be set for the 'local' profile.");
        }
        if (keysConfigured) {
            log.info("Using StaticCredentialsProvider with the configured access key.");
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        log.info("No static AWS keys configured. Using DefaultCredentialsProvider.");
        return DefaultCredentialsProvider.create();
    }

    /**
     * SDK retries cover transient S3 errors inside one upload and are independent of the run-level retry.
     * The call timeout spans all of them.
     */
    @Bean
    public ClientOverrideConfiguration clientOverrideConfiguration() {
        final RetryPolicy adaptiveRetryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder()
                                                           .numRetries(s3RetryCount).build();

        return ClientOverrideConfiguration.builder()
                                          .retryPolicy(adaptiveRetryPolicy)
                                          .apiCallTimeout(Duration.ofSeconds(uploadTimeoutSeconds))
                                          .build();
    }

    @Bean(destroyMethod = "close")
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider,
                             ClientOverrideConfiguration clientOverrideConfig) {
        final S3ClientBuilder builder = S3Client.builder()
                                                .credentialsProvider(credentialsProvider)
                                                .region(Region.of(awsRegion))
                                                .overrideConfiguration(clientOverrideConfig);
        if (StringUtils.hasText(endpoint)) {
            log.info("Configuring S3Client for endpoint {} (region {}, path-style access)", endpoint, awsRegion);
            builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true);
        } else {
            log.info("Configuring S3Client for region: {}", awsRegion);
        }
        return builder.build();
    }
}
