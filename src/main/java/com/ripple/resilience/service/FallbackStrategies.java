package com.ripple.resilience.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.ripple.resilience.model.FallbackStrategy;
import com.ripple.resilience.model.ServiceLevel;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ready-made fallback strategies.
 *
 * <p>Both strategies read the request from the call context: {@code operation}
 * ({@code get}, {@code set} or {@code delete}), {@code key}, {@code data} and an optional
 * {@code ttl} as a {@link Duration}.
 */
@Slf4j
public final class FallbackStrategies {

    private FallbackStrategies() {
    }

    /**
     * In-memory key/value store with optional per-entry expiry, bounded to
     * {@link MemoryCache#DEFAULT_MAXIMUM_SIZE} entries.
     */
    public static FallbackStrategy memoryCache(String serviceName, Clock clock) {
        return memoryCache(serviceName, new MemoryCache(MemoryCache.DEFAULT_MAXIMUM_SIZE, clock));
    }

    public static FallbackStrategy memoryCache(String serviceName, MemoryCache cache) {
        return FallbackStrategy.builder()
            .name("memoryCache")
            .description("Use in-memory cache for " + serviceName + " data")
            .serviceLevel(ServiceLevel.DEGRADED)
            .priority(2)
            .action(context -> {
                String operation = String.valueOf(context.get("operation"));
                Object key = context.get("key");
                switch (operation) {
                    case "get":
                        return cache.get(key);
                    case "set":
                        cache.put(key, context.get("data"), (Duration) context.get("ttl"));
                        return Boolean.TRUE;
                    case "delete":
                        cache.remove(key);
                        return Boolean.TRUE;
                    default:
                        throw new IllegalArgumentException("Unknown operation: " + operation);
                }
            })
            .build();
    }

    /**
     * Emergency strategy that queues the request for later replay.
     */
    public static FallbackStrategy offlineQueue(String serviceName, OfflineQueue queue) {
        return FallbackStrategy.builder()
            .name("offlineQueue")
            .description("Queue " + serviceName + " operations for later execution")
            .serviceLevel(ServiceLevel.EMERGENCY)
            .priority(3)
            .action(context -> {
                int queueLength = queue.enqueue(serviceName, context.get("operation"), context.get("data"));
                log.info("Operation queued for later execution: serviceName={}, queueLength={}", serviceName, queueLength);

                Map<String, Object> receipt = new LinkedHashMap<>();
                receipt.put("queued", Boolean.TRUE);
                receipt.put("queueLength", queueLength);
                receipt.put("message", "Operation queued for later execution");
                return receipt;
            })
            .build();
    }

    /**
     * Caffeine-backed store behind {@link #memoryCache(String, MemoryCache)}. Entries expire
     * by their own ttl and are evicted in the background of later writes and {@link #size()}
     * calls, whether or not they are read again. Time is taken from the supplied clock.
     */
    public static final class MemoryCache {

        public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

        private final Cache<Object, CacheEntry> entries;

        public MemoryCache(long maximumSize, Clock clock) {
            this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new PerEntryExpiry())
                .ticker(() -> {
                    Instant now = clock.instant();
                    return now.getEpochSecond() * 1_000_000_000L + now.getNano();
                })
                .executor(Runnable::run)
                .build();
        }

        public Object get(Object key) {
            if (key == null) {
                return null;
            }
            CacheEntry entry = entries.getIfPresent(key);
            return entry == null ? null : entry.data;
        }

        /**
         * Stores {@code data} under {@code key}; a {@code null} ttl never expires.
         */
        public void put(Object key, Object data, Duration ttl) {
            if (key == null) {
                throw new IllegalArgumentException("Cache key is required");
            }
            entries.put(key, new CacheEntry(data, ttl));
        }

        public void remove(Object key) {
            if (key != null) {
                entries.invalidate(key);
            }
        }

        public long size() {
            entries.cleanUp();
            return entries.estimatedSize();
        }
    }

    private static final class CacheEntry {
        private final Object data;
        private final Duration ttl;

        private CacheEntry(Object data, Duration ttl) {
            this.data = data;
            this.ttl = ttl;
        }
    }

    private static final class PerEntryExpiry implements Expiry<Object, CacheEntry> {

        @Override
        public long expireAfterCreate(Object key, CacheEntry entry, long currentTime) {
            return entry.ttl == null ? Long.MAX_VALUE : Math.max(0L, entry.ttl.toNanos());
        }

        @Override
        public long expireAfterUpdate(Object key, CacheEntry entry, long currentTime, long currentDuration) {
            return expireAfterCreate(key, entry, currentTime);
        }

        @Override
        public long expireAfterRead(Object key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    /**
     * Requests parked by {@link #offlineQueue(String, OfflineQueue)}.
     */
    public static final class OfflineQueue {
        private final Clock clock;
        private final List<QueuedOperation> entries = new ArrayList<>();

        public OfflineQueue(Clock clock) {
            this.clock = clock;
        }

        synchronized int enqueue(String serviceName, Object operation, Object data) {
            entries.add(new QueuedOperation(serviceName, operation, data, clock.instant()));
            return entries.size();
        }

        /**
         * Removes and returns every queued request, oldest first.
         */
        public synchronized List<QueuedOperation> drain() {
            List<QueuedOperation> drained = new ArrayList<>(entries);
            entries.clear();
            return Collections.unmodifiableList(drained);
        }

        public synchronized int size() {
            return entries.size();
        }
    }

    @Value
    public static class QueuedOperation {
        String serviceName;
        Object operation;
        Object data;
        Instant queuedAt;
    }
}
