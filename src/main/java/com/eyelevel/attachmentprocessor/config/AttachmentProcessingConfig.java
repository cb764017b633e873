package com.eyelevel.attachmentprocessor.config;

import com.eyelevel.attachmentprocessor.model.AttachmentPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object. Built once at start-up and injected wherever a run needs its policy.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.processing")
public class AttachmentProcessingConfig {

    public static final long BYTES_PER_MEGABYTE = 1024L * 1024L;

    @NotEmpty
    private Set<String> allowedExtensions = Set.of("pdf", "doc", "docx", "txt", "csv", "xlsx");

    @Min(0)
    private long maxAttachmentSizeMb = 25;

    @Min(1)
    private int workerCount = 4;

    @NotNull
    private RunMode runMode = RunMode.ONCE;

    private String scheduleCron = "0 0 * * * *";

    @Valid
    private RetryConfig retry = new RetryConfig();

    @Valid
    private Notification notification = new Notification();

    /**
     * Builds the filtering policy from the configured extension list and megabyte ceiling.
     * Extensions are normalised to lower case without a leading dot.
     */
    public AttachmentPolicy toPolicy() {
        final Set<String> normalised = allowedExtensions.stream()
                .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .filter(ext -> !ext.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        return new AttachmentPolicy(normalised, maxAttachmentSizeMb * BYTES_PER_MEGABYTE);
    }

    public enum RunMode {
        /**
         * A single retried run at start-up, after which the application exits.
         */
        ONCE,
        /**
         * Runs on {@code scheduleCron} for as long as the application is up.
         */
        SCHEDULED
    }

    @Data
    public static class RetryConfig {
        @Min(1)
        private int attempts = 3;
        @Min(0)
        private long delaySeconds = 30;

        public Duration getDelay() {
            return Duration.ofSeconds(delaySeconds);
        }
    }

    @Data
    public static class Notification {
        private boolean enabled = true;
        private String recipient;
    }
}
