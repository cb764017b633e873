package com.eyelevel.attachmentprocessor.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Writes run reports to the application log instead of a mail transport.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.processing.notification.enabled", havingValue = "true", matchIfMissing = true)
public class LoggingNotificationSender implements NotificationSender {

    @Override
    public void send(final RunNotification notification, final String recipient) {
        log.info("Notification for {}: {}{}{}", recipient, notification.subject(), System.lineSeparator(),
                notification.body());
    }
}
