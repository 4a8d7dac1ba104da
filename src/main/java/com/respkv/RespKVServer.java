package com.respkv;

import com.respkv.config.ServerConfig;
import com.respkv.core.InMemoryStore;
import com.respkv.core.KVStore;
import com.respkv.network.CommandDispatcher;
import com.respkv.network.TcpServer;
import com.respkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RespKV Server entry point.
 * Wires the store, dispatcher and listener together and runs them until stopped.
 */
public class RespKVServer {

    private static final Logger logger = LoggerFactory.getLogger(RespKVServer.class);

    public static final String VERSION = "1.0.0";

    private final ServerConfig config;
    private final KVStore store;
    private final MetricsCollector metrics;
    private final TcpServer tcpServer;
    private final CountDownLatch shutdownLatch;
    private final AtomicBoolean stopped;

    /**
     * Create a new RespKV server.
     *
     * @param config server settings
     */
    public RespKVServer(ServerConfig config) {
        this(config, new InMemoryStore(config.getSweepIntervalMs()), new MetricsCollector());
    }

    /**
     * Create a server with custom store and metrics.
     *
     * @param config  server settings
     * @param store   the key-value store to use
     * @param metrics the metrics collector to use
     */
    public RespKVServer(ServerConfig config, KVStore store, MetricsCollector metrics) {
        this.config = config;
        this.store = store;
        this.metrics = metrics;
        this.shutdownLatch = new CountDownLatch(1);
        this.stopped = new AtomicBoolean(false);
        metrics.bindStoreSize(store);
        this.tcpServer = new TcpServer(config, new CommandDispatcher(store, metrics), metrics);
    }

    /**
     * Start the server.
     *
     * @throws IOException if the listener cannot bind
     */
    public void start() throws IOException {
        logger.info("Starting RespKV Server v{}", VERSION);
        logger.info("Max frame size: {} bytes, sweep interval: {}ms",
                config.getMaxFrameBytes(), config.getSweepIntervalMs());

        tcpServer.start();

        logger.info("RespKV Server started on {}:{}", config.getHost(), tcpServer.getPort());
    }

    /**
     * Start the server and block until stopped.
     */
    public void startAndBlock() throws IOException, InterruptedException {
        start();
        shutdownLatch.await();
    }

    /**
     * Stop the server. Safe to call more than once and from any thread.
     */
    public void stop() {
        if (stopped.getAndSet(true)) {
            return;
        }
        logger.info("Stopping RespKV Server");

        tcpServer.stop();

        if (store instanceof InMemoryStore) {
            ((InMemoryStore) store).shutdown();
        }

        logger.info("{}", metrics.summary());
        shutdownLatch.countDown();
        logger.info("RespKV Server stopped");
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return tcpServer.isRunning();
    }

    /**
     * Get the port the server listens on. After {@link #start()} this is the
     * bound port, which differs from the configured one when that was 0.
     */
    public int getPort() {
        return tcpServer.getPort();
    }

    public KVStore getStore() {
        return store;
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return tcpServer.getConnectionCount();
    }

    /**
     * Parse command line options into a server configuration.
     * {@code --help} and {@code --version} are handled by {@link #main} and skipped here.
     *
     * @param args command line arguments
     * @return the configuration
     * @throws IllegalArgumentException on an unknown option or invalid value
     */
    static ServerConfig parseArgs(String[] args) {
        ServerConfig config = new ServerConfig();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--port":
                case "-p":
                    int port = parseInt(args, ++i, "--port");
                    if (port <= 0 || port > 65535) {
                        throw new IllegalArgumentException("Port must be between 1 and 65535");
                    }
                    config.setPort(port);
                    break;
                case "--max-frame-bytes":
                    config.setMaxFrameBytes(parseInt(args, ++i, "--max-frame-bytes"));
                    break;
                case "--sweep-interval-ms":
                    config.setSweepIntervalMs(parseInt(args, ++i, "--sweep-interval-ms"));
                    break;
                case "--help":
                case "-h":
                case "--version":
                case "-v":
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return config;
    }

    private static int parseInt(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        try {
            return Integer.parseInt(args[index]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + option + ": " + args[index]);
        }
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        for (String arg : args) {
            if (arg.equals("--help") || arg.equals("-h")) {
                printHelp();
                return;
            }
            if (arg.equals("--version") || arg.equals("-v")) {
                System.out.println("RespKV Server v" + VERSION);
                return;
            }
        }

        ServerConfig config;
        try {
            config = parseArgs(args);
        } catch (IllegalArgumentException e) {
            exitWithError(e.getMessage());
            return;
        }

        printBanner();

        // Ensure logs directory exists
        ensureLogsDirectory();

        RespKVServer server = new RespKVServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            server.stop();
        }, "respkv-shutdown"));

        try {
            server.startAndBlock();
        } catch (IOException e) {
            logger.error("Failed to start server: {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void ensureLogsDirectory() {
        java.io.File logsDir = new java.io.File("logs");
        if (!logsDir.exists()) {
            if (logsDir.mkdir()) {
                logger.info("Created logs directory");
            } else {
                logger.warn("Failed to create logs directory, file logging may not work");
            }
        }
    }

    private static void printBanner() {
        System.out.println();
        System.out.println("  ____                 _  ____     __");
        System.out.println(" |  _ \\ ___  ___ _ __ | |/ /\\ \\   / /");
        System.out.println(" | |_) / _ \\/ __| '_ \\| ' /  \\ \\ / / ");
        System.out.println(" |  _ <  __/\\__ \\ |_) | . \\   \\ V /  ");
        System.out.println(" |_| \\_\\___||___/ .__/|_|\\_\\   \\_/   ");
        System.out.println("                |_|                  ");
        System.out.println();
        System.out.println("  In-Memory RESP Key-Value Server v" + VERSION);
        System.out.println();
    }

    private static void exitWithError(String message) {
        System.err.println("Error: " + message);
        System.err.println("Use --help for usage information");
        System.exit(1);
    }

    private static void printHelp() {
        System.out.println("RespKV Server - In-Memory RESP Key-Value Server");
        System.out.println();
        System.out.println("Usage: respkv [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -p, --port <port>              Port to listen on (default: " + ServerConfig.DEFAULT_PORT + ")");
        System.out.println("      --max-frame-bytes <n>      Largest accepted request frame (default: 524288)");
        System.out.println("      --sweep-interval-ms <n>    Interval between expired-key sweeps (default: 60000)");
        System.out.println("  -h, --help                     Show this help message");
        System.out.println("  -v, --version                  Show version");
        System.out.println();
        System.out.println("The server listens on 127.0.0.1 only.");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  respkv");
        System.out.println("  respkv --port 6380");
        System.out.println();
    }
}
