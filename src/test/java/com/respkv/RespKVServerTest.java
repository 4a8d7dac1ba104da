package com.respkv;

import com.respkv.config.ServerConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RespKVServerTest {

    @Test
    void parseArgs_defaults() {
        ServerConfig config = RespKVServer.parseArgs(new String[0]);

        assertThat(config.getPort()).isEqualTo(6379);
        assertThat(config.getHost()).isEqualTo("127.0.0.1");
    }

    @Test
    void parseArgs_allOptions() {
        ServerConfig config = RespKVServer.parseArgs(new String[]{
            "-p", "7000", "--max-frame-bytes", "4096", "--sweep-interval-ms", "250"});

        assertThat(config.getPort()).isEqualTo(7000);
        assertThat(config.getMaxFrameBytes()).isEqualTo(4096);
        assertThat(config.getSweepIntervalMs()).isEqualTo(250);
    }

    @Test
    void parseArgs_longPortOption() {
        assertThat(RespKVServer.parseArgs(new String[]{"--port", "6380"}).getPort()).isEqualTo(6380);
    }

    @Test
    void parseArgs_portOutOfRange() {
        assertThatThrownBy(() -> RespKVServer.parseArgs(new String[]{"--port", "0"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Port must be between 1 and 65535");
        assertThatThrownBy(() -> RespKVServer.parseArgs(new String[]{"--port", "70000"}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseArgs_nonNumericValue() {
        assertThatThrownBy(() -> RespKVServer.parseArgs(new String[]{"-p", "abc"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Invalid value for --port: abc");
    }

    @Test
    void parseArgs_missingValue() {
        assertThatThrownBy(() -> RespKVServer.parseArgs(new String[]{"--max-frame-bytes"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("--max-frame-bytes requires a value");
    }

    @Test
    void parseArgs_unknownOption() {
        assertThatThrownBy(() -> RespKVServer.parseArgs(new String[]{"--daemonize"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown option: --daemonize");
    }

    @Test
    void parseArgs_invalidFrameLimit() {
        assertThatThrownBy(() -> RespKVServer.parseArgs(new String[]{"--max-frame-bytes", "-1"}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void startAndStop_onEphemeralPort() throws Exception {
        RespKVServer server = new RespKVServer(ServerConfig.builder().port(0).build());
        server.start();
        try {
            assertThat(server.isRunning()).isTrue();
            assertThat(server.getPort()).isPositive();
        } finally {
            server.stop();
        }

        assertThat(server.isRunning()).isFalse();
        server.stop();
    }

    @Test
    void start_failsWhenPortTaken() throws Exception {
        RespKVServer first = new RespKVServer(ServerConfig.builder().port(0).build());
        first.start();
        try {
            RespKVServer second = new RespKVServer(ServerConfig.builder().port(first.getPort()).build());
            try {
                assertThatThrownBy(second::start).isInstanceOf(java.io.IOException.class);
                assertThat(second.isRunning()).isFalse();
            } finally {
                second.stop();
            }
        } finally {
            first.stop();
        }
    }
}
