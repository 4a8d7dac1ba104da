package com.respkv.config;

import com.respkv.network.protocol.RespDecoder;

/**
 * Configuration for a RespKV server.
 */
public class ServerConfig {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 6379;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 60_000;

    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private int maxFrameBytes = RespDecoder.DEFAULT_MAX_FRAME_BYTES;
    private long sweepIntervalMs = DEFAULT_SWEEP_INTERVAL_MS;

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("host must not be empty");
        }
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    /**
     * Port 0 asks the operating system for an ephemeral port.
     */
    public void setPort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
        }
        this.port = port;
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public void setMaxFrameBytes(int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive, got: " + maxFrameBytes);
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        if (sweepIntervalMs <= 0) {
            throw new IllegalArgumentException("sweepIntervalMs must be positive, got: " + sweepIntervalMs);
        }
        this.sweepIntervalMs = sweepIntervalMs;
    }

    @Override
    public String toString() {
        return "ServerConfig{host=" + host + ", port=" + port
                + ", maxFrameBytes=" + maxFrameBytes + ", sweepIntervalMs=" + sweepIntervalMs + "}";
    }

    /**
     * Builder for ServerConfig.
     */
    public static class Builder {
        private final ServerConfig config = new ServerConfig();

        public Builder host(String host) {
            config.setHost(host);
            return this;
        }

        public Builder port(int port) {
            config.setPort(port);
            return this;
        }

        public Builder maxFrameBytes(int max) {
            config.setMaxFrameBytes(max);
            return this;
        }

        public Builder sweepIntervalMs(long interval) {
            config.setSweepIntervalMs(interval);
            return this;
        }

        public ServerConfig build() {
            return config;
        }
    }
}
