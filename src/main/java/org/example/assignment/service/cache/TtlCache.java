package org.example.assignment.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Keyed cache whose entries expire {@code ttl} after they were written.
 *
 * <p>Values are stored as JSON envelopes ({@code storedAt}, {@code value}) in a {@link CacheStore}.
 * Expiry is checked lazily on read: an expired entry is removed and reported as absent.
 * Write failures are logged and reported through the return value of {@link #set}.</p>
 */
public class TtlCache {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private static final String STORED_AT = "storedAt";
    private static final String VALUE = "value";

    private final CacheStore store;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final Clock clock;

    public TtlCache(CacheStore store, ObjectMapper objectMapper, Duration ttl, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.ttl = ttl == null || ttl.isZero() || ttl.isNegative() ? DEFAULT_TTL : ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return read(key, objectMapper.constructType(type));
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return read(key, objectMapper.getTypeFactory().constructType(type));
    }

    /**
     * @return false if the value could not be cached; callers carry on without the cache
     */
    public boolean set(String key, Object value) {
        try {
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.put(STORED_AT, clock.millis());
            envelope.set(VALUE, objectMapper.valueToTree(value));
            store.put(key, objectMapper.writeValueAsString(envelope));
            return true;
        } catch (CacheWriteException e) {
            log.warn("Proceeding without caching '{}': {}", key, e.getMessage());
            return false;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Could not serialise value for cache key '{}'", key, e);
            return false;
        }
    }

    public void remove(String key) {
        store.remove(key);
    }

    /**
     * Drop every entry. Only used on logout or an explicit reset.
     */
    public void clear() {
        store.clear();
        log.info("Cache cleared");
    }

    public int size() {
        return store.size();
    }

    public Duration getTtl() {
        return ttl;
    }

    private <T> Optional<T> read(String key, JavaType type) {
        Optional<String> raw = store.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }

        try {
            JsonNode envelope = objectMapper.readTree(raw.get());
            JsonNode storedAt = envelope.get(STORED_AT);
            if (storedAt == null || !storedAt.canConvertToLong()) {
                log.warn("Discarding cache entry '{}' without a timestamp", key);
                store.remove(key);
                return Optional.empty();
            }

            long ageMillis = clock.millis() - storedAt.asLong();
            if (ageMillis >= ttl.toMillis()) {
                log.debug("Cache entry '{}' expired {}ms ago", key, ageMillis - ttl.toMillis());
                store.remove(key);
                return Optional.empty();
            }

            T value = objectMapper.convertValue(envelope.get(VALUE), type);
            return Optional.ofNullable(value);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Discarding unreadable cache entry '{}'", key, e);
            store.remove(key);
            return Optional.empty();
        }
    }
}
