package com.eyelevel.attachmentprocessor.notification;

/**
 * A rendered run report, ready to hand to a {@link NotificationSender}.
 */
public record RunNotification(String subject, String body) {
}
