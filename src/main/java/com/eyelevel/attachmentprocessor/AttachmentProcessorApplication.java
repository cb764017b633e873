package com.eyelevel.attachmentprocessor;

import com.eyelevel.attachmentprocessor.config.AttachmentProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Boots the attachment processor. What happens after start-up depends on {@code app.processing.run-mode}:
 * a single retried run that ends the process, or a cron-driven sweep (hence {@link EnableScheduling}).
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = AttachmentProcessingConfig.class)
public class AttachmentProcessorApplication {

    public static void main(final String[] args) {
        log.info("Starting AttachmentProcessorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(AttachmentProcessorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is up.", env.getProperty("spring.application.name", "AttachmentProcessor"));
        log.info("  - Run mode:   {}", env.getProperty("app.processing.run-mode", "once"));
        log.info("  - Mailbox:    {}", env.getProperty("app.mailbox.type", "demo"));
        log.info("  - Storage:    {}", env.getProperty("app.storage.type", "s3"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
