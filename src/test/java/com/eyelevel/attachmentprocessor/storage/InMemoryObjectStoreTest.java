package com.eyelevel.attachmentprocessor.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryObjectStoreTest {

    private final InMemoryObjectStore store = new InMemoryObjectStore();

    @Test
    @DisplayName("Same key overwrites the previous object")
    void testSameKeyOverwrites() {
        store.putObject("2024/01/15/a.pdf", new byte[]{1}, "application/pdf", Map.of("v", "1"));
        store.putObject("2024/01/15/a.pdf", new byte[]{2, 3}, "application/pdf", Map.of("v", "2"));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.find("2024/01/15/a.pdf")).hasValueSatisfying(stored -> {
            assertThat(stored.payload()).containsExactly(2, 3);
            assertThat(stored.metadata()).containsEntry("v", "2");
        });
    }

    @Test
    @DisplayName("Stored payload is detached from the caller array")
    void testPayloadDetached() {
        byte[] payload = {7, 7};
        store.putObject("k", payload, "text/plain", Map.of());
        payload[0] = 0;

        assertThat(store.find("k").orElseThrow().payload()).containsExactly(7, 7);
    }

    @Test
    @DisplayName("Clear removes every object")
    void testClear() {
        store.putObject("k1", new byte[0], "text/plain", Map.of());
        store.putObject("k2", new byte[0], "text/plain", Map.of());

        assertThat(store.keys()).containsExactlyInAnyOrder("k1", "k2");
        store.clear();
        assertThat(store.size()).isZero();
        assertThat(store.find("k1")).isEmpty();
    }
}
