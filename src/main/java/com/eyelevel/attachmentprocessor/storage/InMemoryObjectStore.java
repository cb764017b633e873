package com.eyelevel.attachmentprocessor.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps stored attachments in memory. Used for local runs without AWS access ({@code app.storage.type=memory}).
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.storage.type", havingValue = "memory")
public class InMemoryObjectStore implements ObjectStore {

    private final Map<String, StoredObject> objects = new ConcurrentHashMap<>();

    @Override
    public void putObject(final String key, final byte[] payload, final String contentType,
                          final Map<String, String> metadata) {
        objects.put(key, new StoredObject(payload.clone(), contentType, Map.copyOf(metadata)));
        log.info("Stored {} bytes in memory under key: {}", payload.length, key);
    }

    public Optional<StoredObject> find(final String key) {
        return Optional.ofNullable(objects.get(key));
    }

    public Set<String> keys() {
        return Set.copyOf(objects.keySet());
    }

    public int size() {
        return objects.size();
    }

    public void clear() {
        objects.clear();
    }

    public record StoredObject(byte[] payload, String contentType, Map<String, String> metadata) {
    }
}
