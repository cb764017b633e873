package com.eyelevel.attachmentprocessor.model;

/**
 * Counters describing one run. Recomputed for every run, never carried over.
 *
 * @param totalMessages           Messages returned by the mailbox.
 * @param messagesWithAttachments Messages carrying at least one attachment.
 * @param eligibleAttachments     Attachments that passed the policy filter.
 * @param processedAttachments    Eligible attachments stored successfully.
 */
public record RunSummary(int totalMessages, int messagesWithAttachments, int eligibleAttachments,
                         int processedAttachments) {

    public static final RunSummary EMPTY = new RunSummary(0, 0, 0, 0);

    public RunSummary {
        if (processedAttachments > eligibleAttachments) {
            throw new IllegalArgumentException(
                    "processed (" + processedAttachments + ") exceeds eligible (" + eligibleAttachments + ")");
        }
    }

    public int failedAttachments() {
        return eligibleAttachments - processedAttachments;
    }

    public int messagesWithoutAttachments() {
        return totalMessages - messagesWithAttachments;
    }

    /**
     * A run succeeds when every eligible attachment was stored, including the case of nothing to store.
     */
    public boolean isSuccess() {
        return processedAttachments == eligibleAttachments;
    }

    /**
     * True when the mailbox returned messages but none of them had an attachment.
     */
    public boolean hasNoAttachments() {
        return totalMessages > 0 && messagesWithAttachments == 0;
    }
}
