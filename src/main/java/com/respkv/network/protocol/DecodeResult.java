package com.respkv.network.protocol;

import java.util.Objects;

/**
 * Outcome of one decode attempt: either a complete command or a request
 * for more bytes. Malformed input is reported by {@link ProtocolException}.
 */
public final class DecodeResult {

    private static final DecodeResult NEED_MORE_DATA = new DecodeResult(null, 0);

    private final Command command;
    private final int bytesConsumed;

    private DecodeResult(Command command, int bytesConsumed) {
        this.command = command;
        this.bytesConsumed = bytesConsumed;
    }

    public static DecodeResult parsed(Command command, int bytesConsumed) {
        Objects.requireNonNull(command, "command");
        if (bytesConsumed <= 0) {
            throw new IllegalArgumentException("bytesConsumed must be positive, got: " + bytesConsumed);
        }
        return new DecodeResult(command, bytesConsumed);
    }

    public static DecodeResult needMoreData() {
        return NEED_MORE_DATA;
    }

    public boolean isParsed() {
        return command != null;
    }

    public boolean needsMoreData() {
        return command == null;
    }

    /**
     * Get the decoded command.
     *
     * @throws IllegalStateException if no command was decoded
     */
    public Command getCommand() {
        if (command == null) {
            throw new IllegalStateException("No command decoded");
        }
        return command;
    }

    /**
     * Get the number of bytes the frame occupied, 0 when more data is needed.
     */
    public int getBytesConsumed() {
        return bytesConsumed;
    }

    @Override
    public String toString() {
        return command != null
            ? "DecodeResult{parsed=" + command + ", bytesConsumed=" + bytesConsumed + '}'
            : "DecodeResult{needMoreData}";
    }
}
