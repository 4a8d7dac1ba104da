package com.respkv.util;

import com.respkv.core.KVStore;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Metrics collector for RespKV.
 * Tracks command throughput, keyspace hits, errors, latency and connections.
 */
public class MetricsCollector {

    /**
     * Commands tracked individually.
     */
    public enum CommandKind {
        PING, ECHO, SET, GET, INFO, UNKNOWN
    }

    /**
     * Error categories, one per failure class a connection can hit.
     */
    public enum ErrorKind {
        PROTOCOL, ARGUMENT, UNKNOWN_COMMAND, INTERNAL, IO
    }

    private final MeterRegistry registry;

    // Counters
    private final Map<CommandKind, Counter> commandCounters;
    private final Map<ErrorKind, Counter> errorCounters;
    private final Counter keyspaceHits;
    private final Counter keyspaceMisses;

    // Timers
    private final Timer getLatency;
    private final Timer setLatency;

    // Gauges
    private final LongAdder activeConnections;

    /**
     * Create a metrics collector with a simple registry.
     */
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;

        this.commandCounters = new EnumMap<>(CommandKind.class);
        for (CommandKind kind : CommandKind.values()) {
            commandCounters.put(kind, Counter.builder("respkv.commands")
                .tag("command", kind.name().toLowerCase(Locale.ROOT))
                .description("Commands processed")
                .register(registry));
        }

        this.errorCounters = new EnumMap<>(ErrorKind.class);
        for (ErrorKind kind : ErrorKind.values()) {
            errorCounters.put(kind, Counter.builder("respkv.errors")
                .tag("type", kind.name().toLowerCase(Locale.ROOT))
                .description("Errors by category")
                .register(registry));
        }

        this.keyspaceHits = Counter.builder("respkv.keyspace")
            .tag("result", "hit")
            .description("GET hits")
            .register(registry);

        this.keyspaceMisses = Counter.builder("respkv.keyspace")
            .tag("result", "miss")
            .description("GET misses")
            .register(registry);

        this.getLatency = Timer.builder("respkv.latency")
            .tag("command", "get")
            .description("GET latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);

        this.setLatency = Timer.builder("respkv.latency")
            .tag("command", "set")
            .description("SET latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);

        this.activeConnections = new LongAdder();
        Gauge.builder("respkv.connections", activeConnections, LongAdder::sum)
            .description("Active connections")
            .register(registry);
    }

    /**
     * Expose the live entry count of a store as the respkv.store.size gauge.
     *
     * @param store the store to observe
     */
    public void bindStoreSize(KVStore store) {
        Gauge.builder("respkv.store.size", store, KVStore::size)
            .description("Number of live entries in store")
            .register(registry);
    }

    // Command recording

    public void recordCommand(CommandKind kind) {
        commandCounters.get(kind).increment();
    }

    public void recordGet(long durationNanos, boolean hit) {
        recordCommand(CommandKind.GET);
        getLatency.record(durationNanos, TimeUnit.NANOSECONDS);
        if (hit) {
            keyspaceHits.increment();
        } else {
            keyspaceMisses.increment();
        }
    }

    public void recordSet(long durationNanos) {
        recordCommand(CommandKind.SET);
        setLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordError(ErrorKind kind) {
        errorCounters.get(kind).increment();
    }

    // Connection tracking

    public void connectionOpened() {
        activeConnections.increment();
    }

    public void connectionClosed() {
        activeConnections.decrement();
    }

    // Getters for metrics values

    public long getCommandCount(CommandKind kind) {
        return (long) commandCounters.get(kind).count();
    }

    public long getTotalCommands() {
        long total = 0;
        for (Counter counter : commandCounters.values()) {
            total += (long) counter.count();
        }
        return total;
    }

    public long getErrorCount(ErrorKind kind) {
        return (long) errorCounters.get(kind).count();
    }

    public long getTotalErrors() {
        long total = 0;
        for (Counter counter : errorCounters.values()) {
            total += (long) counter.count();
        }
        return total;
    }

    public long getKeyspaceHits() {
        return (long) keyspaceHits.count();
    }

    public long getKeyspaceMisses() {
        return (long) keyspaceMisses.count();
    }

    public long getActiveConnections() {
        return activeConnections.sum();
    }

    public double getHitRate() {
        double hits = keyspaceHits.count();
        double total = hits + keyspaceMisses.count();
        return total > 0 ? hits / total : 0.0;
    }

    public double getGetMeanLatencyMs() {
        return getLatency.mean(TimeUnit.MILLISECONDS);
    }

    public double getSetMeanLatencyMs() {
        return setLatency.mean(TimeUnit.MILLISECONDS);
    }

    /**
     * Get the underlying registry.
     *
     * @return the MeterRegistry
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Print a summary of current metrics.
     *
     * @return formatted metrics string
     */
    public String summary() {
        return String.format(
            "RespKV Metrics Summary%n" +
            "======================%n" +
            "Commands: total=%d, PING=%d, ECHO=%d, SET=%d, GET=%d, INFO=%d, unknown=%d%n" +
            "Keyspace: hits=%d, misses=%d, hitRate=%.2f%%%n" +
            "Errors: total=%d, protocol=%d, argument=%d, io=%d%n" +
            "Connections: %d active%n" +
            "Latency (mean): GET=%.3fms, SET=%.3fms",
            getTotalCommands(),
            getCommandCount(CommandKind.PING), getCommandCount(CommandKind.ECHO),
            getCommandCount(CommandKind.SET), getCommandCount(CommandKind.GET),
            getCommandCount(CommandKind.INFO), getCommandCount(CommandKind.UNKNOWN),
            getKeyspaceHits(), getKeyspaceMisses(), getHitRate() * 100,
            getTotalErrors(), getErrorCount(ErrorKind.PROTOCOL),
            getErrorCount(ErrorKind.ARGUMENT), getErrorCount(ErrorKind.IO),
            getActiveConnections(),
            getGetMeanLatencyMs(), getSetMeanLatencyMs()
        );
    }
}
