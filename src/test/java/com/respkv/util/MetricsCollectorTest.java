package com.respkv.util;

import com.respkv.core.InMemoryStore;
import com.respkv.util.MetricsCollector.CommandKind;
import com.respkv.util.MetricsCollector.ErrorKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MetricsCollectorTest {

    private MetricsCollector metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsCollector();
    }

    @Test
    void recordGet_countsCommandAndKeyspace() {
        metrics.recordGet(1_000_000L, true);
        metrics.recordGet(2_000_000L, true);
        metrics.recordGet(3_000_000L, false);

        assertThat(metrics.getCommandCount(CommandKind.GET)).isEqualTo(3);
        assertThat(metrics.getKeyspaceHits()).isEqualTo(2);
        assertThat(metrics.getKeyspaceMisses()).isEqualTo(1);
        assertThat(metrics.getHitRate()).isEqualTo(2.0 / 3.0);
    }

    @Test
    void recordSet_countsCommandAndLatency() {
        metrics.recordSet(2_000_000L);
        metrics.recordSet(4_000_000L);

        assertThat(metrics.getCommandCount(CommandKind.SET)).isEqualTo(2);
        assertThat(metrics.getSetMeanLatencyMs()).isEqualTo(3.0);
    }

    @Test
    void totalCommands_sumsAllKinds() {
        metrics.recordCommand(CommandKind.PING);
        metrics.recordCommand(CommandKind.ECHO);
        metrics.recordCommand(CommandKind.UNKNOWN);
        metrics.recordSet(1L);

        assertThat(metrics.getTotalCommands()).isEqualTo(4);
    }

    @Test
    void recordError_byKind() {
        metrics.recordError(ErrorKind.PROTOCOL);
        metrics.recordError(ErrorKind.ARGUMENT);
        metrics.recordError(ErrorKind.ARGUMENT);

        assertThat(metrics.getErrorCount(ErrorKind.ARGUMENT)).isEqualTo(2);
        assertThat(metrics.getErrorCount(ErrorKind.IO)).isZero();
        assertThat(metrics.getTotalErrors()).isEqualTo(3);
    }

    @Test
    void connections_trackOpenAndClose() {
        metrics.connectionOpened();
        metrics.connectionOpened();
        metrics.connectionClosed();

        assertThat(metrics.getActiveConnections()).isEqualTo(1);
    }

    @Test
    void hitRate_zeroWithoutGets() {
        assertThat(metrics.getHitRate()).isZero();
    }

    @Test
    void meters_registeredWithTags() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsCollector collector = new MetricsCollector(registry);
        collector.recordCommand(CommandKind.PING);
        collector.recordError(ErrorKind.UNKNOWN_COMMAND);

        assertThat(registry.get("respkv.commands").tag("command", "ping").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("respkv.errors").tag("type", "unknown_command").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("respkv.latency").tag("command", "get").timer()).isNotNull();
        assertThat(collector.getRegistry()).isSameAs(registry);
    }

    @Test
    void bindStoreSize_reportsLiveEntries() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsCollector collector = new MetricsCollector(registry);
        InMemoryStore store = new InMemoryStore();
        try {
            collector.bindStoreSize(store);
            store.set("a", new byte[]{1});
            store.set("b", new byte[]{2});

            assertThat(registry.get("respkv.store.size").gauge().value()).isEqualTo(2.0);
        } finally {
            store.shutdown();
        }
    }

    @Test
    void summary_containsKeyFigures() {
        metrics.recordGet(1_000_000L, true);
        metrics.connectionOpened();

        String summary = metrics.summary();

        assertThat(summary).contains("RespKV Metrics Summary", "GET=1", "hits=1", "1 active");
    }
}
