package com.respkv.network;

/**
 * States of a client connection.
 *
 * <pre>
 *   READING --&gt; DECODING --&gt; DISPATCHING --&gt; REPLYING
 *      ^           |  |                          |
 *      +-----------+  +--&gt; CLOSING --&gt; CLOSED    |
 *      +-----------------------------------------+
 * </pre>
 *
 * <p>DECODING returns to READING when the buffered bytes hold no complete
 * frame, and goes straight to REPLYING when a frame carries invalid
 * arguments. REPLYING loops back to DECODING while pipelined frames remain.
 * A protocol violation moves to CLOSING; EOF or an I/O error may close the
 * connection from any state.
 */
public enum ConnectionState {

    READING,
    DECODING,
    DISPATCHING,
    REPLYING,
    CLOSING,
    CLOSED;

    /**
     * Check if no further transitions are possible.
     */
    public boolean isTerminal() {
        return this == CLOSED;
    }

    /**
     * Check if a transition from this state to {@code next} is allowed.
     * Staying in the same state is always allowed for non-terminal states.
     *
     * @param next the target state
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(ConnectionState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == this || next == CLOSED) {
            return true;
        }
        switch (this) {
            case READING:
                return next == DECODING || next == CLOSING;
            case DECODING:
                return next == READING || next == DISPATCHING || next == REPLYING || next == CLOSING;
            case DISPATCHING:
                return next == REPLYING || next == CLOSING;
            case REPLYING:
                return next == DECODING || next == READING || next == CLOSING;
            case CLOSING:
                return false;
            default:
                return false;
        }
    }
}
