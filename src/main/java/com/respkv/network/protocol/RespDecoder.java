package com.respkv.network.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Incremental decoder for RESP requests.
 *
 * Request format (array of bulk strings):
 * <pre>
 *   *&lt;count&gt;\r\n
 *   $&lt;len&gt;\r\n&lt;len bytes&gt;\r\n   (repeated count times)
 * </pre>
 *
 * The decoder is stateless: each call inspects the readable bytes of the
 * caller's buffer from its position. A complete frame advances the position
 * past the frame; an incomplete one leaves the buffer untouched so the caller
 * can append more bytes and retry. Instances are immutable and thread-safe.
 */
public final class RespDecoder {

    public static final int DEFAULT_MAX_FRAME_BYTES = 512 * 1024;

    // Longest accepted length header, digits only
    static final int MAX_LENGTH_LINE = 32;

    // Smallest possible element: "$0\r\n\r\n"
    private static final int MIN_ELEMENT_BYTES = 6;

    private final int maxFrameBytes;

    public RespDecoder() {
        this(DEFAULT_MAX_FRAME_BYTES);
    }

    /**
     * @param maxFrameBytes largest frame accepted, in bytes
     */
    public RespDecoder(int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive, got: " + maxFrameBytes);
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    /**
     * Try to decode one command from the buffer.
     *
     * <p>On success the buffer position is moved past the frame before the
     * command arguments are validated, so an {@link ArgumentException} leaves
     * the stream aligned on the next frame.
     *
     * @param buffer buffer in read mode
     * @return the parsed command, or {@link DecodeResult#needMoreData()}
     * @throws ProtocolException if the bytes are not a valid request or the
     *                           frame exceeds the maximum size
     * @throws ArgumentException if the frame is valid but its arguments are not
     */
    public DecodeResult decode(ByteBuffer buffer) {
        int start = buffer.position();
        int limit = buffer.limit();
        if (start >= limit) {
            return DecodeResult.needMoreData();
        }

        byte marker = buffer.get(start);
        if (marker != '*') {
            throw new ProtocolException("expected '*', got " + describe(marker));
        }
        int lineEnd = findLineEnd(buffer, start + 1, limit);
        if (lineEnd < 0) {
            return incomplete(start, limit);
        }
        long count = parseLength(buffer, start + 1, lineEnd, "multibulk");
        if (count > maxFrameBytes / MIN_ELEMENT_BYTES) {
            throw new ProtocolException("multibulk length " + count
                + " cannot fit in maximum frame size of " + maxFrameBytes + " bytes");
        }

        int cursor = lineEnd + 2;
        List<byte[]> parts = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) {
            if (cursor >= limit) {
                return incomplete(start, limit);
            }
            marker = buffer.get(cursor);
            if (marker != '$') {
                throw new ProtocolException("expected '$', got " + describe(marker));
            }
            lineEnd = findLineEnd(buffer, cursor + 1, limit);
            if (lineEnd < 0) {
                return incomplete(start, limit);
            }
            long length = parseLength(buffer, cursor + 1, lineEnd, "bulk");
            if (length > maxFrameBytes) {
                throw new ProtocolException("bulk length " + length
                    + " exceeds maximum frame size of " + maxFrameBytes + " bytes");
            }

            int payloadStart = lineEnd + 2;
            long payloadEnd = payloadStart + length;
            if (payloadEnd + 2 > limit) {
                return incomplete(start, limit);
            }
            int end = (int) payloadEnd;
            if (buffer.get(end) != '\r' || buffer.get(end + 1) != '\n') {
                throw new ProtocolException("bulk string not terminated by CRLF");
            }

            byte[] part = new byte[(int) length];
            ByteBuffer view = buffer.duplicate();
            view.position(payloadStart);
            view.get(part);
            parts.add(part);

            cursor = end + 2;
            checkFrameSize(cursor - start);
        }

        int consumed = cursor - start;
        buffer.position(cursor);
        return DecodeResult.parsed(Command.fromFrame(parts), consumed);
    }

    private DecodeResult incomplete(int start, int limit) {
        // The frame is longer than what is buffered, so at least this long
        checkFrameSize(limit - start + 1);
        return DecodeResult.needMoreData();
    }

    private void checkFrameSize(long frameBytes) {
        if (frameBytes > maxFrameBytes) {
            throw new ProtocolException("frame exceeds maximum size of " + maxFrameBytes + " bytes");
        }
    }

    /**
     * Find the CR of the CRLF ending a length header.
     *
     * @return index of CR, or -1 if the line is not complete yet
     */
    private static int findLineEnd(ByteBuffer buffer, int from, int limit) {
        for (int i = from; i + 1 < limit; i++) {
            if (buffer.get(i) == '\r' && buffer.get(i + 1) == '\n') {
                return i;
            }
            if (i - from >= MAX_LENGTH_LINE) {
                throw new ProtocolException("length header exceeds " + MAX_LENGTH_LINE + " bytes");
            }
        }
        return -1;
    }

    /**
     * Parse a non-negative decimal length header. Signs, blanks and values
     * above {@link Integer#MAX_VALUE} are rejected.
     */
    private static long parseLength(ByteBuffer buffer, int from, int to, String kind) {
        if (from == to) {
            throw new ProtocolException("invalid " + kind + " length");
        }
        long value = 0;
        for (int i = from; i < to; i++) {
            byte b = buffer.get(i);
            if (b < '0' || b > '9') {
                throw new ProtocolException("invalid " + kind + " length");
            }
            value = value * 10 + (b - '0');
            if (value > Integer.MAX_VALUE) {
                throw new ProtocolException("invalid " + kind + " length");
            }
        }
        return value;
    }

    private static String describe(byte b) {
        if (b >= 0x20 && b < 0x7F) {
            return "'" + (char) b + "'";
        }
        return String.format("0x%02X", b & 0xFF);
    }
}
