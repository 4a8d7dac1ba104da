package com.respkv.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ServerConfigTest {

    @Test
    void defaultValues() {
        ServerConfig config = new ServerConfig();

        assertThat(config.getHost()).isEqualTo("127.0.0.1");
        assertThat(config.getPort()).isEqualTo(6379);
        assertThat(config.getMaxFrameBytes()).isEqualTo(512 * 1024);
        assertThat(config.getSweepIntervalMs()).isEqualTo(60_000);
    }

    @Test
    void builder_setsValues() {
        ServerConfig config = ServerConfig.builder()
            .host("localhost")
            .port(0)
            .maxFrameBytes(1024)
            .sweepIntervalMs(50)
            .build();

        assertThat(config.getHost()).isEqualTo("localhost");
        assertThat(config.getPort()).isZero();
        assertThat(config.getMaxFrameBytes()).isEqualTo(1024);
        assertThat(config.getSweepIntervalMs()).isEqualTo(50);
    }

    @Test
    void setPort_validatesRange() {
        ServerConfig config = new ServerConfig();

        assertThatThrownBy(() -> config.setPort(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("port");
        assertThatThrownBy(() -> config.setPort(65536))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void setMaxFrameBytes_mustBePositive() {
        assertThatThrownBy(() -> ServerConfig.builder().maxFrameBytes(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxFrameBytes must be positive");
    }

    @Test
    void setSweepIntervalMs_mustBePositive() {
        assertThatThrownBy(() -> ServerConfig.builder().sweepIntervalMs(-5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sweepIntervalMs must be positive");
    }

    @Test
    void setHost_rejectsEmpty() {
        assertThatThrownBy(() -> ServerConfig.builder().host(""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
