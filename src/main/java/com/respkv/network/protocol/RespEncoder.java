package com.respkv.network.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * RESP encoder for server replies and client requests.
 *
 * Reply formats:
 * <pre>
 *   simple string  +&lt;text&gt;\r\n
 *   bulk string    $&lt;len&gt;\r\n&lt;bytes&gt;\r\n
 *   nil bulk       $-1\r\n
 *   error          -ERR &lt;message&gt;\r\n
 * </pre>
 */
public final class RespEncoder {

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NIL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] ERROR_PREFIX = "-ERR ".getBytes(StandardCharsets.US_ASCII);

    private RespEncoder() {
        // Utility class
    }

    // ==================== Replies ====================

    /**
     * Encode a reply into a ByteBuffer.
     *
     * @param reply the reply to encode
     * @return ByteBuffer positioned at start, ready to read
     */
    public static ByteBuffer encode(Reply reply) {
        ByteBuffer buffer = ByteBuffer.allocate(encodedSize(reply));
        encode(reply, buffer);
        buffer.flip();
        return buffer;
    }

    /**
     * Encode a reply into an existing ByteBuffer.
     *
     * @param reply  the reply to encode
     * @param buffer the buffer to write to (must have sufficient capacity)
     */
    public static void encode(Reply reply, ByteBuffer buffer) {
        switch (reply.getType()) {
            case SIMPLE_STRING:
                buffer.put((byte) '+');
                buffer.put(reply.getText().getBytes(StandardCharsets.UTF_8));
                buffer.put(CRLF);
                break;
            case BULK_STRING:
                putBulk(reply.getPayloadUnsafe(), buffer);
                break;
            case NULL_BULK:
                buffer.put(NIL_BULK);
                break;
            case ERROR:
                buffer.put(ERROR_PREFIX);
                buffer.put(reply.getText().getBytes(StandardCharsets.UTF_8));
                buffer.put(CRLF);
                break;
            default:
                throw new IllegalStateException("Unhandled reply type: " + reply.getType());
        }
    }

    /**
     * Calculate the encoded size of a reply.
     *
     * @param reply the reply
     * @return size in bytes
     */
    public static int encodedSize(Reply reply) {
        switch (reply.getType()) {
            case SIMPLE_STRING:
                return 1 + reply.getText().getBytes(StandardCharsets.UTF_8).length + 2;
            case BULK_STRING:
                return bulkSize(reply.getPayloadUnsafe());
            case NULL_BULK:
                return NIL_BULK.length;
            case ERROR:
                return ERROR_PREFIX.length + reply.getText().getBytes(StandardCharsets.UTF_8).length + 2;
            default:
                throw new IllegalStateException("Unhandled reply type: " + reply.getType());
        }
    }

    // ==================== Requests ====================

    /**
     * Encode a request as an array of bulk strings.
     *
     * @param parts command name followed by its arguments
     * @return ByteBuffer positioned at start, ready to read
     */
    public static ByteBuffer encodeCommand(byte[]... parts) {
        byte[] header = ("*" + parts.length + "\r\n").getBytes(StandardCharsets.US_ASCII);
        int size = header.length;
        for (byte[] part : parts) {
            size += bulkSize(part);
        }

        ByteBuffer buffer = ByteBuffer.allocate(size);
        buffer.put(header);
        for (byte[] part : parts) {
            putBulk(part, buffer);
        }
        buffer.flip();
        return buffer;
    }

    /**
     * Encode a request whose parts are UTF-8 strings.
     */
    public static ByteBuffer encodeCommand(String... parts) {
        byte[][] raw = new byte[parts.length][];
        for (int i = 0; i < parts.length; i++) {
            raw[i] = parts[i].getBytes(StandardCharsets.UTF_8);
        }
        return encodeCommand(raw);
    }

    // ==================== Helpers ====================

    private static void putBulk(byte[] payload, ByteBuffer buffer) {
        buffer.put((byte) '$');
        buffer.put(Integer.toString(payload.length).getBytes(StandardCharsets.US_ASCII));
        buffer.put(CRLF);
        buffer.put(payload);
        buffer.put(CRLF);
    }

    private static int bulkSize(byte[] payload) {
        return 1 + Integer.toString(payload.length).length() + 2 + payload.length + 2;
    }
}
