package com.respkv.network.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable description of a server reply, independent of its wire encoding.
 */
public final class Reply {

    /**
     * Reply kinds supported by the encoder.
     */
    public enum Type {
        SIMPLE_STRING,
        BULK_STRING,
        NULL_BULK,
        ERROR
    }

    private static final Reply OK = new Reply(Type.SIMPLE_STRING, "OK", null);
    private static final Reply PONG = new Reply(Type.SIMPLE_STRING, "PONG", null);
    private static final Reply NIL = new Reply(Type.NULL_BULK, null, null);

    private final Type type;
    private final String text;   // simple string or error message
    private final byte[] payload; // bulk string payload

    private Reply(Type type, String text, byte[] payload) {
        this.type = type;
        this.text = text;
        this.payload = payload;
    }

    /**
     * Create a simple string reply.
     *
     * @throws IllegalArgumentException if the text contains CR or LF
     */
    public static Reply simple(String text) {
        Objects.requireNonNull(text, "text");
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Simple string cannot contain CR or LF");
        }
        return new Reply(Type.SIMPLE_STRING, text, null);
    }

    /**
     * The +OK reply.
     */
    public static Reply ok() {
        return OK;
    }

    /**
     * The +PONG reply.
     */
    public static Reply pong() {
        return PONG;
    }

    /**
     * Create a bulk string reply.
     */
    public static Reply bulk(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        return new Reply(Type.BULK_STRING, null, Arrays.copyOf(payload, payload.length));
    }

    /**
     * Create a bulk string reply from UTF-8 text.
     */
    public static Reply bulk(String text) {
        return new Reply(Type.BULK_STRING, null, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * The nil bulk reply for absent values.
     */
    public static Reply nil() {
        return NIL;
    }

    /**
     * Create an error reply. Line breaks in the message are replaced with spaces
     * so the reply stays on one line.
     *
     * @param message the message, without the ERR prefix
     */
    public static Reply error(String message) {
        String text = message != null ? message : "unknown error";
        return new Reply(Type.ERROR, text.replace('\r', ' ').replace('\n', ' '), null);
    }

    public Type getType() {
        return type;
    }

    /**
     * Get the text of a simple string or error reply.
     *
     * @return the text, or null for bulk replies
     */
    public String getText() {
        return text;
    }

    /**
     * Get the raw bulk payload without copying.
     *
     * @return internal payload array, or null for non-bulk replies
     */
    public byte[] getPayloadUnsafe() {
        return payload;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Reply reply = (Reply) o;
        return type == reply.type &&
               Objects.equals(text, reply.text) &&
               Arrays.equals(payload, reply.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type, text);
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        return "Reply{" +
               "type=" + type +
               (text != null ? ", text='" + text + '\'' : "") +
               (payload != null ? ", payloadLength=" + payload.length : "") +
               '}';
    }
}
