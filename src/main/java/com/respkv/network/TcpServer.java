package com.respkv.network;

import com.respkv.config.ServerConfig;
import com.respkv.network.protocol.RespDecoder;
import com.respkv.util.MetricsCollector;
import com.respkv.util.MetricsCollector.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.*;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NIO-based TCP server for RespKV.
 * A single selector thread accepts connections, performs all socket I/O and
 * executes commands inline, so commands on one connection run in the order
 * they arrived.
 */
public class TcpServer {

    private static final Logger logger = LoggerFactory.getLogger(TcpServer.class);

    private final ServerConfig config;
    private final RespDecoder decoder;
    private final CommandDispatcher dispatcher;
    private final MetricsCollector metrics;
    private final AtomicBoolean running;
    private final Map<SocketChannel, ConnectionHandler> connections;

    private Selector selector;
    private ServerSocketChannel serverChannel;
    private Thread serverThread;
    private volatile int boundPort;

    /**
     * Create a new TCP server.
     *
     * @param config     listener address, port and frame limit
     * @param dispatcher executes decoded commands
     * @param metrics    the metrics collector
     */
    public TcpServer(ServerConfig config, CommandDispatcher dispatcher, MetricsCollector metrics) {
        this.config = config;
        this.decoder = new RespDecoder(config.getMaxFrameBytes());
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.running = new AtomicBoolean(false);
        this.connections = new ConcurrentHashMap<>();
        this.boundPort = config.getPort();
    }

    /**
     * Bind the listening socket and start the event loop thread.
     *
     * @throws IOException if the address cannot be bound
     */
    public void start() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Server already running");
        }

        try {
            selector = Selector.open();
            serverChannel = ServerSocketChannel.open();
            serverChannel.configureBlocking(false);
            serverChannel.socket().setReuseAddress(true);
            serverChannel.bind(new InetSocketAddress(config.getHost(), config.getPort()));
            serverChannel.register(selector, SelectionKey.OP_ACCEPT);
        } catch (IOException e) {
            running.set(false);
            closeQuietly();
            throw new IOException("Failed to bind " + config.getHost() + ":" + config.getPort()
                    + ": " + e.getMessage(), e);
        }

        boundPort = ((InetSocketAddress) serverChannel.getLocalAddress()).getPort();
        serverThread = new Thread(this::eventLoop, "respkv-server-" + boundPort);
        serverThread.start();

        logger.info("RespKV server listening on {}:{}", config.getHost(), boundPort);
    }

    private void eventLoop() {
        while (running.get()) {
            try {
                int ready = selector.select(1000); // 1 second timeout for clean shutdown

                if (ready == 0) {
                    continue;
                }

                Iterator<SelectionKey> keys = selector.selectedKeys().iterator();
                while (keys.hasNext()) {
                    SelectionKey key = keys.next();
                    keys.remove();

                    if (!key.isValid()) {
                        continue;
                    }

                    try {
                        if (key.isAcceptable()) {
                            accept();
                        }
                        if (key.isReadable()) {
                            read(key);
                        }
                        if (key.isValid() && key.isWritable()) {
                            write(key);
                        }
                    } catch (CancelledKeyException e) {
                        // Key was cancelled, ignore
                    } catch (RuntimeException e) {
                        logger.error("Error handling connection {}: {}", key.channel(), e.getMessage(), e);
                        ConnectionHandler handler = (ConnectionHandler) key.attachment();
                        if (handler != null) {
                            closeConnection(key, handler);
                        }
                    }
                }
            } catch (IOException e) {
                if (running.get()) {
                    logger.error("Selector error: {}", e.getMessage());
                }
            }
        }

        cleanup();
    }

    private void accept() {
        SocketChannel clientChannel;
        try {
            clientChannel = serverChannel.accept();
        } catch (IOException e) {
            // A failed accept must not take the listener down
            logger.warn("Failed to accept connection: {}", e.getMessage());
            metrics.recordError(ErrorKind.IO);
            return;
        }
        if (clientChannel == null) {
            return;
        }

        try {
            clientChannel.configureBlocking(false);
            clientChannel.socket().setTcpNoDelay(true);
            clientChannel.socket().setKeepAlive(true);
        } catch (IOException e) {
            logger.warn("Failed to configure accepted connection: {}", e.getMessage());
            metrics.recordError(ErrorKind.IO);
            try {
                clientChannel.close();
            } catch (IOException closeError) {
                logger.debug("Error closing rejected connection: {}", closeError.getMessage());
            }
            return;
        }

        ConnectionHandler handler = new ConnectionHandler(clientChannel, decoder, dispatcher, metrics, this);
        connections.put(clientChannel, handler);

        try {
            clientChannel.register(selector, SelectionKey.OP_READ, handler);
        } catch (ClosedChannelException e) {
            handler.close();
            return;
        }

        logger.debug("Accepted connection from {}", handler.getRemoteAddress());
    }

    private void read(SelectionKey key) {
        ConnectionHandler handler = (ConnectionHandler) key.attachment();
        if (handler == null) {
            key.cancel();
            return;
        }

        if (!handler.handleRead(key)) {
            closeConnection(key, handler);
        }
    }

    private void write(SelectionKey key) {
        ConnectionHandler handler = (ConnectionHandler) key.attachment();
        if (handler == null) {
            key.cancel();
            return;
        }

        if (!handler.handleWrite(key)) {
            closeConnection(key, handler);
        }
    }

    private void closeConnection(SelectionKey key, ConnectionHandler handler) {
        key.cancel();
        connections.remove((SocketChannel) key.channel());
        handler.close();
    }

    /**
     * Stop accepting connections, close every open connection and wait for
     * the event loop to exit.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        logger.info("Stopping RespKV server on port {}", boundPort);

        // Wake up the selector to exit the event loop
        if (selector != null) {
            selector.wakeup();
        }

        if (serverThread != null && serverThread != Thread.currentThread()) {
            try {
                serverThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void cleanup() {
        for (ConnectionHandler handler : connections.values()) {
            handler.close();
        }
        connections.clear();

        closeQuietly();

        logger.info("RespKV server stopped on port {}", boundPort);
    }

    private void closeQuietly() {
        if (serverChannel != null) {
            try {
                serverChannel.close();
            } catch (IOException e) {
                logger.debug("Error closing server channel: {}", e.getMessage());
            }
        }

        if (selector != null) {
            try {
                selector.close();
            } catch (IOException e) {
                logger.debug("Error closing selector: {}", e.getMessage());
            }
        }
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Get the port this server is listening on. When configured with port 0
     * this is the ephemeral port chosen at bind time.
     */
    public int getPort() {
        return boundPort;
    }

    /**
     * Remove a connection from tracking.
     * Package-private, called by ConnectionHandler when connection is closed.
     */
    void removeConnection(SocketChannel channel) {
        connections.remove(channel);
    }
}
