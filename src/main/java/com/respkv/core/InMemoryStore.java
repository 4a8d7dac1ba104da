package com.respkv.core;

import com.respkv.network.protocol.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Thread-safe in-memory key-value store implementation using ConcurrentHashMap.
 * Entries expire lazily on read; a background sweep reclaims memory held by
 * expired entries nobody reads again.
 */
public class InMemoryStore implements KVStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStore.class);
    private static final long DEFAULT_SWEEP_INTERVAL_MS = 60_000;

    private final ConcurrentHashMap<String, StoreEntry> store;
    private final ScheduledExecutorService sweepExecutor;
    private final long sweepIntervalMs;
    private final LongSupplier ticker;

    /**
     * Create a new in-memory store with the default sweep interval (1 minute).
     */
    public InMemoryStore() {
        this(DEFAULT_SWEEP_INTERVAL_MS);
    }

    /**
     * Create a new in-memory store with a custom sweep interval.
     *
     * @param sweepIntervalMs interval between sweep runs in milliseconds
     */
    public InMemoryStore(long sweepIntervalMs) {
        this(sweepIntervalMs, System::nanoTime);
    }

    /**
     * Create a new in-memory store with a custom sweep interval and clock.
     *
     * @param sweepIntervalMs interval between sweep runs in milliseconds
     * @param ticker          monotonic nanosecond clock used for expiry
     */
    public InMemoryStore(long sweepIntervalMs, LongSupplier ticker) {
        if (sweepIntervalMs <= 0) {
            throw new IllegalArgumentException("sweepIntervalMs must be positive");
        }
        this.store = new ConcurrentHashMap<>();
        this.sweepIntervalMs = sweepIntervalMs;
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "respkv-sweep");
            t.setDaemon(true);
            return t;
        });
        startSweepTask();
    }

    private void startSweepTask() {
        sweepExecutor.scheduleAtFixedRate(this::sweepQuietly,
                sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
        logger.debug("Started TTL sweep task with interval {}ms", sweepIntervalMs);
    }

    // An exception escaping a scheduled task cancels all future runs
    private void sweepQuietly() {
        try {
            sweep();
        } catch (RuntimeException e) {
            logger.error("TTL sweep failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void set(String key, byte[] value) {
        set(key, value, 0);
    }

    @Override
    public void set(String key, byte[] value, long ttlMillis) {
        validateKey(key);
        Objects.requireNonNull(value, "value");
        if (ttlMillis < 0 || ttlMillis > Command.MAX_TTL_MILLIS) {
            throw new IllegalArgumentException("ttlMillis out of range: " + ttlMillis);
        }

        StoreEntry entry = ttlMillis > 0
                ? StoreEntry.expiringAt(value, ticker.getAsLong() + ttlMillis * 1_000_000L)
                : StoreEntry.persistent(value);
        store.put(key, entry);

        logger.trace("SET key={}, valueSize={}, ttl={}", key, value.length, ttlMillis);
    }

    @Override
    public Optional<StoreEntry> get(String key) {
        validateKey(key);
        StoreEntry entry = store.get(key);
        if (entry == null) {
            logger.trace("GET key={} -> NOT_FOUND", key);
            return Optional.empty();
        }
        if (entry.isExpired(ticker.getAsLong())) {
            // Conditional remove: a concurrent SET may already have replaced the entry
            store.remove(key, entry);
            logger.trace("GET key={} -> EXPIRED", key);
            return Optional.empty();
        }
        logger.trace("GET key={} -> FOUND", key);
        return Optional.of(entry);
    }

    /**
     * Remove all expired entries.
     * Uses conditional remove to avoid a race where the value is replaced
     * between the check and the removal.
     */
    @Override
    public int sweep() {
        long now = ticker.getAsLong();
        int removed = 0;
        for (var entry : store.entrySet()) {
            StoreEntry value = entry.getValue();
            if (value.isExpired(now) && store.remove(entry.getKey(), value)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Swept {} expired entries, remaining={}", removed, store.size());
        }
        return removed;
    }

    @Override
    public int size() {
        long now = ticker.getAsLong();
        return (int) store.values().stream()
                .filter(e -> !e.isExpired(now))
                .count();
    }

    @Override
    public void clear() {
        store.clear();
        logger.debug("Store cleared");
    }

    /**
     * Get raw entry count including expired entries not yet reclaimed.
     */
    public int rawSize() {
        return store.size();
    }

    /**
     * Shutdown the sweep executor.
     */
    public void shutdown() {
        sweepExecutor.shutdown();
        try {
            if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sweepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("InMemoryStore shutdown complete");
    }

    private void validateKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
    }
}
