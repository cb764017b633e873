package com.eyelevel.attachmentprocessor;

import com.eyelevel.attachmentprocessor.model.RunSummary;
import com.eyelevel.attachmentprocessor.service.RetryRunner;
import com.eyelevel.attachmentprocessor.storage.InMemoryObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "app.storage.type=memory",
        "app.mailbox.type=demo",
        "app.processing.run-mode=scheduled",
        "app.processing.schedule-cron=-",
        "app.processing.retry.delay-seconds=0",
        "app.processing.notification.recipient=ops@example.com"
})
class AttachmentProcessorApplicationTests {

    @Autowired
    private RetryRunner retryRunner;

    @Autowired
    private InMemoryObjectStore objectStore;

    @BeforeEach
    void clearStore() {
        objectStore.clear();
    }

    @Test
    @DisplayName("Demo mailbox is filtered and stored end to end")
    void testDemoMailboxEndToEnd() {
        RunSummary summary = retryRunner.runWithRetry();

        assertThat(summary).isEqualTo(new RunSummary(6, 5, 5, 5));
        assertThat(objectStore.size()).isEqualTo(5);
        assertThat(objectStore.keys())
                .allMatch(key -> key.matches("\\d{4}/\\d{2}/\\d{2}/[a-zA-Z0-9._-]+"))
                .noneMatch(key -> key.endsWith(".png") || key.endsWith(".mp4") || key.endsWith(".csv"));
    }
}
