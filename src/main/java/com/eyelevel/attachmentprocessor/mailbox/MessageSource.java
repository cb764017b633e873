package com.eyelevel.attachmentprocessor.mailbox;

import com.eyelevel.attachmentprocessor.model.Message;

import java.util.List;

/**
 * Supplies the batch of messages for one run. Called once per attempt.
 */
@FunctionalInterface
public interface MessageSource {

    /**
     * @return The messages to process, possibly empty, never {@code null}.
     * @throws RuntimeException if the mailbox cannot be read; the attempt is then retried.
     */
    List<Message> fetchMessages();
}
