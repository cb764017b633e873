package com.eyelevel.attachmentprocessor.notification;

/**
 * Delivers run reports. Delivery is best-effort: callers log a failure and carry on.
 */
public interface NotificationSender {

    /**
     * @param notification The rendered report.
     * @param recipient    Where to deliver it.
     * @throws RuntimeException if delivery fails.
     */
    void send(RunNotification notification, String recipient);
}
