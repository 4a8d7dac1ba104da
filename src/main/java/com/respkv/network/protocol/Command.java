package com.respkv.network.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable command object representing a fully decoded client request.
 * Built only from a complete frame, never partially.
 */
public final class Command {

    /**
     * Command variants understood by the server.
     */
    public enum Type {
        PING,
        ECHO,
        SET,
        GET,
        INFO,
        UNKNOWN
    }

    /**
     * Largest TTL whose nanosecond value still fits in a long.
     */
    public static final long MAX_TTL_MILLIS = Long.MAX_VALUE / 1_000_000L;

    private static final List<byte[]> NO_ARGS = Collections.emptyList();

    private final Type type;
    private final String name;
    private final String key;
    private final byte[] value;
    private final long ttlMillis;    // 0 = no expiration
    private final List<byte[]> args; // raw arguments for INFO and UNKNOWN

    private Command(Type type, String name, String key, byte[] value, long ttlMillis, List<byte[]> args) {
        this.type = type;
        this.name = name;
        this.key = key;
        this.value = value != null ? Arrays.copyOf(value, value.length) : null;
        this.ttlMillis = ttlMillis;
        this.args = args;
    }

    /**
     * Create a PING command.
     */
    public static Command ping() {
        return new Command(Type.PING, "PING", null, null, 0, NO_ARGS);
    }

    /**
     * Create an ECHO command.
     */
    public static Command echo(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        return new Command(Type.ECHO, "ECHO", null, payload, 0, NO_ARGS);
    }

    /**
     * Create a SET command without expiry.
     */
    public static Command set(String key, byte[] value) {
        return set(key, value, 0);
    }

    /**
     * Create a SET command.
     *
     * @param ttlMillis time-to-live in milliseconds (0 for no expiration)
     */
    public static Command set(String key, byte[] value, long ttlMillis) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttlMillis < 0) {
            throw new IllegalArgumentException("ttlMillis must be non-negative, got: " + ttlMillis);
        }
        return new Command(Type.SET, "SET", key, value, ttlMillis, NO_ARGS);
    }

    /**
     * Create a GET command.
     */
    public static Command get(String key) {
        Objects.requireNonNull(key, "key");
        return new Command(Type.GET, "GET", key, null, 0, NO_ARGS);
    }

    /**
     * Create an INFO command.
     *
     * @param section the requested section, or null for the default set
     */
    public static Command info(String section) {
        List<byte[]> args = section != null
            ? List.of(section.getBytes(StandardCharsets.UTF_8))
            : NO_ARGS;
        return new Command(Type.INFO, "INFO", null, null, 0, args);
    }

    /**
     * Create a command the server does not recognize.
     *
     * @param name the command name as sent by the client
     * @param args the remaining arguments
     */
    public static Command unknown(String name, List<byte[]> args) {
        Objects.requireNonNull(name, "name");
        List<byte[]> copy = new ArrayList<>(args.size());
        for (byte[] arg : args) {
            copy.add(Arrays.copyOf(arg, arg.length));
        }
        return new Command(Type.UNKNOWN, name, null, null, 0, Collections.unmodifiableList(copy));
    }

    /**
     * Build a command from the bulk strings of a complete RESP array.
     * The command name is matched case-insensitively; unrecognized names
     * yield an {@link Type#UNKNOWN} command.
     *
     * @param parts the array elements, command name first
     * @return the command
     * @throws ArgumentException if the arguments are invalid for the command
     */
    public static Command fromFrame(List<byte[]> parts) {
        if (parts.isEmpty()) {
            throw new ArgumentException("empty command");
        }
        String name = new String(parts.get(0), StandardCharsets.UTF_8);
        switch (name.toUpperCase(Locale.ROOT)) {
            case "PING":
                return ping();
            case "ECHO":
                requireArity(name, parts, 2);
                return echo(parts.get(1));
            case "GET":
                requireArity(name, parts, 2);
                return get(key(parts.get(1)));
            case "SET":
                return parseSet(name, parts);
            case "INFO":
                if (parts.size() > 2) {
                    throw new ArgumentException("syntax error");
                }
                return info(parts.size() == 2 ? utf8(parts.get(1)) : null);
            default:
                return unknown(name, parts.subList(1, parts.size()));
        }
    }

    // SET key value [PX milliseconds | EX seconds]
    private static Command parseSet(String name, List<byte[]> parts) {
        if (parts.size() < 3) {
            throw ArgumentException.wrongArity(name);
        }
        String key = key(parts.get(1));
        byte[] value = parts.get(2);
        if (parts.size() == 3) {
            return set(key, value);
        }
        if (parts.size() != 5) {
            throw new ArgumentException("syntax error");
        }

        String option = utf8(parts.get(3)).toUpperCase(Locale.ROOT);
        long ttlMillis;
        switch (option) {
            case "PX":
                ttlMillis = parseInteger(parts.get(4));
                break;
            case "EX":
                long seconds = parseInteger(parts.get(4));
                if (seconds <= 0 || seconds > MAX_TTL_MILLIS / 1000) {
                    throw invalidExpireTime(name);
                }
                ttlMillis = seconds * 1000;
                break;
            default:
                throw new ArgumentException("syntax error");
        }
        if (ttlMillis <= 0 || ttlMillis > MAX_TTL_MILLIS) {
            throw invalidExpireTime(name);
        }
        return set(key, value, ttlMillis);
    }

    private static long parseInteger(byte[] raw) {
        try {
            return Long.parseLong(new String(raw, StandardCharsets.US_ASCII));
        } catch (NumberFormatException e) {
            throw new ArgumentException("value is not an integer or out of range");
        }
    }

    private static ArgumentException invalidExpireTime(String name) {
        return new ArgumentException("invalid expire time in '"
            + name.toLowerCase(Locale.ROOT) + "' command");
    }

    private static void requireArity(String name, List<byte[]> parts, int expected) {
        if (parts.size() != expected) {
            throw ArgumentException.wrongArity(name);
        }
    }

    /**
     * Keys are binary: one char per byte, so distinct byte strings never
     * map to the same key.
     */
    static String key(byte[] bytes) {
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    private static String utf8(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Get the command type.
     */
    public Type getType() {
        return type;
    }

    /**
     * Get the command name; for UNKNOWN commands this is the name as sent.
     */
    public String getName() {
        return name;
    }

    /**
     * Get the key.
     *
     * @return the key, or null for commands without one
     */
    public String getKey() {
        return key;
    }

    /**
     * Get the value (SET) or payload (ECHO).
     *
     * @return copy of the value, or null if no value
     */
    public byte[] getValue() {
        return value != null ? Arrays.copyOf(value, value.length) : null;
    }

    /**
     * Get the raw value without copying.
     *
     * @return internal value array, or null
     */
    public byte[] getValueUnsafe() {
        return value;
    }

    /**
     * Get the time-to-live for SET.
     *
     * @return TTL in milliseconds, or 0 for no expiration
     */
    public long getTtlMillis() {
        return ttlMillis;
    }

    /**
     * Check if this SET carries an expiry.
     */
    public boolean hasTtl() {
        return ttlMillis > 0;
    }

    /**
     * Get the raw arguments of INFO and UNKNOWN commands.
     *
     * @return unmodifiable argument list, empty for other commands
     */
    public List<byte[]> getArgs() {
        return args;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Command command = (Command) o;
        if (type != command.type ||
            ttlMillis != command.ttlMillis ||
            !Objects.equals(name, command.name) ||
            !Objects.equals(key, command.key) ||
            !Arrays.equals(value, command.value) ||
            args.size() != command.args.size()) {
            return false;
        }
        for (int i = 0; i < args.size(); i++) {
            if (!Arrays.equals(args.get(i), command.args.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type, name, key, ttlMillis);
        result = 31 * result + Arrays.hashCode(value);
        for (byte[] arg : args) {
            result = 31 * result + Arrays.hashCode(arg);
        }
        return result;
    }

    @Override
    public String toString() {
        return "Command{" +
               "type=" + type +
               (type == Type.UNKNOWN ? ", name='" + name + '\'' : "") +
               (key != null ? ", key='" + key + '\'' : "") +
               (value != null ? ", valueLength=" + value.length : "") +
               (ttlMillis > 0 ? ", ttlMillis=" + ttlMillis : "") +
               (!args.isEmpty() ? ", args=" + args.size() : "") +
               '}';
    }
}
