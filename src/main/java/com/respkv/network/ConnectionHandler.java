package com.respkv.network;

import com.respkv.network.protocol.ArgumentException;
import com.respkv.network.protocol.Command;
import com.respkv.network.protocol.DecodeResult;
import com.respkv.network.protocol.ProtocolException;
import com.respkv.network.protocol.Reply;
import com.respkv.network.protocol.RespDecoder;
import com.respkv.network.protocol.RespEncoder;
import com.respkv.util.MetricsCollector;
import com.respkv.util.MetricsCollector.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.util.ArrayDeque;
import java.util.Queue;

/**
 * Handles individual client connections.
 * Owns the growable read buffer and the reply queue, and drives
 * decode, dispatch and reply for every complete frame received.
 * All methods except {@link #getState()} run on the selector thread.
 */
public class ConnectionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);
    private static final int INITIAL_BUFFER_SIZE = 16 * 1024;
    // Stop decoding while this many reply bytes wait for the socket
    static final int MAX_PENDING_REPLY_BYTES = 1024 * 1024;

    private final SocketChannel channel;
    private final RespDecoder decoder;
    private final CommandDispatcher dispatcher;
    private final MetricsCollector metrics;
    private final TcpServer server;
    private final String clientAddress;
    private final int maxReadBufferSize;
    private final Queue<ByteBuffer> pendingReplies;
    private ByteBuffer readBuffer; // write mode between events
    private long pendingReplyBytes;
    private volatile ConnectionState state;
    private boolean closed = false;

    public ConnectionHandler(SocketChannel channel, RespDecoder decoder, CommandDispatcher dispatcher,
            MetricsCollector metrics, TcpServer server) {
        this.channel = channel;
        this.decoder = decoder;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.server = server;
        this.maxReadBufferSize = decoder.getMaxFrameBytes();
        this.readBuffer = ByteBuffer.allocate(Math.min(INITIAL_BUFFER_SIZE, maxReadBufferSize));
        this.pendingReplies = new ArrayDeque<>();
        this.clientAddress = getClientAddress();
        this.state = ConnectionState.READING;
        metrics.connectionOpened();
        logger.debug("New connection from {}", clientAddress);
    }

    private String getClientAddress() {
        try {
            return String.valueOf(channel.getRemoteAddress());
        } catch (IOException e) {
            return "unknown";
        }
    }

    /**
     * Handle a read event from the selector.
     *
     * @param key the selection key
     * @return true if the connection should continue, false to close
     */
    public boolean handleRead(SelectionKey key) {
        try {
            int bytesRead = channel.read(readBuffer);
            if (bytesRead == -1) {
                logger.debug("Client {} disconnected", clientAddress);
                return false;
            }
            if (bytesRead > 0) {
                processInput();
                afterProcessing(key);
            }
            return true;
        } catch (ProtocolException e) {
            return onProtocolError(e);
        } catch (IOException e) {
            logger.warn("Read error from {}: {}", clientAddress, e.getMessage());
            metrics.recordError(ErrorKind.IO);
            return false;
        }
    }

    /**
     * Handle a write event from the selector.
     * Frames held back by backpressure are processed as the reply backlog
     * drains.
     *
     * @param key the selection key
     * @return true if the connection should continue, false to close
     */
    public boolean handleWrite(SelectionKey key) {
        try {
            flush();
            if (readBuffer.position() > 0) {
                processInput();
            }
            afterProcessing(key);
            return true;
        } catch (ProtocolException e) {
            return onProtocolError(e);
        } catch (IOException e) {
            logger.warn("Write error to {}: {}", clientAddress, e.getMessage());
            metrics.recordError(ErrorKind.IO);
            return false;
        }
    }

    /**
     * Alternate decoding and flushing until no complete frame is left or
     * the socket stops draining replies. Frames held back by backpressure
     * must be handled here: the client may send nothing more until it has
     * their replies.
     */
    private void processInput() throws IOException {
        while (true) {
            int handled = processReadBuffer();
            flush();
            if (handled == 0 || isBackpressured()) {
                return;
            }
        }
    }

    /**
     * Decode and execute complete frames in the read buffer, in order,
     * until the buffer holds no complete frame or too many reply bytes are pending.
     * Partial trailing bytes stay in the buffer for the next read.
     *
     * @return number of frames handled
     */
    private int processReadBuffer() {
        int handled = 0;
        readBuffer.flip();
        try {
            while (!isBackpressured()) {
                transition(ConnectionState.DECODING);
                Reply reply;
                try {
                    DecodeResult result = decoder.decode(readBuffer);
                    if (result.needsMoreData()) {
                        break;
                    }
                    transition(ConnectionState.DISPATCHING);
                    reply = dispatch(result.getCommand());
                } catch (ArgumentException e) {
                    logger.debug("Invalid arguments from {}: {}", clientAddress, e.getMessage());
                    metrics.recordError(ErrorKind.ARGUMENT);
                    reply = Reply.error(e.getMessage());
                }
                transition(ConnectionState.REPLYING);
                queueReply(reply);
                handled++;
            }
            transition(ConnectionState.READING);
        } finally {
            readBuffer.compact();
        }
        return handled;
    }

    private Reply dispatch(Command command) {
        try {
            return dispatcher.dispatch(command);
        } catch (RuntimeException e) {
            logger.error("Error processing {} from {}: {}", command, clientAddress, e.toString(), e);
            metrics.recordError(ErrorKind.INTERNAL);
            return Reply.error("internal error");
        }
    }

    private boolean onProtocolError(ProtocolException e) {
        logger.warn("Protocol violation from {} (closing connection): {}", clientAddress, e.getMessage());
        metrics.recordError(ErrorKind.PROTOCOL);
        transition(ConnectionState.CLOSING);
        queueReply(Reply.error("Protocol error: " + e.getMessage()));
        try {
            flush();
        } catch (IOException writeError) {
            logger.debug("Could not deliver protocol error to {}: {}", clientAddress, writeError.getMessage());
        }
        return false;
    }

    private void queueReply(Reply reply) {
        ByteBuffer encoded = RespEncoder.encode(reply);
        pendingReplyBytes += encoded.remaining();
        pendingReplies.offer(encoded);
    }

    /**
     * Write queued replies until the queue is empty or the socket stops
     * accepting bytes.
     */
    private void flush() throws IOException {
        while (!pendingReplies.isEmpty()) {
            ByteBuffer head = pendingReplies.peek();
            pendingReplyBytes -= channel.write(head);
            if (head.hasRemaining()) {
                return;
            }
            pendingReplies.poll();
        }
    }

    private boolean isBackpressured() {
        return pendingReplyBytes >= MAX_PENDING_REPLY_BYTES;
    }

    private void afterProcessing(SelectionKey key) {
        // Full buffer without a complete frame: the frame is larger than the buffer
        if (!readBuffer.hasRemaining() && !isBackpressured()) {
            growReadBuffer();
        }
        if (!key.isValid()) {
            return;
        }
        int ops = 0;
        if (!isBackpressured()) {
            ops |= SelectionKey.OP_READ;
        }
        if (!pendingReplies.isEmpty()) {
            ops |= SelectionKey.OP_WRITE;
        }
        key.interestOps(ops);
    }

    /**
     * Grow the read buffer to accommodate a larger frame.
     * PRECONDITION: Buffer must be in WRITE MODE.
     * POSTCONDITION: Buffer is in WRITE MODE with all unread bytes preserved at the start.
     */
    private void growReadBuffer() {
        int currentCapacity = readBuffer.capacity();
        if (currentCapacity >= maxReadBufferSize) {
            throw new ProtocolException("frame exceeds maximum size of " + maxReadBufferSize + " bytes");
        }

        int newCapacity = (int) Math.min((long) currentCapacity * 2, maxReadBufferSize);
        logger.debug("Growing read buffer from {} to {} bytes for {} (preserving {} bytes)",
                currentCapacity, newCapacity, clientAddress, readBuffer.position());

        ByteBuffer newBuffer = ByteBuffer.allocate(newCapacity);
        readBuffer.flip();
        newBuffer.put(readBuffer);
        readBuffer = newBuffer;
    }

    private void transition(ConnectionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Invalid connection state transition "
                    + state + " -> " + next + " for " + clientAddress);
        }
        if (state != next) {
            logger.trace("{}: {} -> {}", clientAddress, state, next);
            state = next;
        }
    }

    /**
     * Close this connection and release resources.
     * Idempotent - safe to call multiple times.
     */
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            state = ConnectionState.CLOSED;
        }

        try {
            channel.close();
        } catch (IOException e) {
            logger.debug("Error closing connection: {}", e.getMessage());
        }

        if (server != null) {
            server.removeConnection(channel);
        }

        metrics.connectionClosed();
        logger.debug("Connection closed: {}", clientAddress);
    }

    public ConnectionState getState() {
        return state;
    }

    public String getRemoteAddress() {
        return clientAddress;
    }
}
