package com.respkv.network.protocol;

/**
 * Exception thrown when a well-formed frame carries invalid arguments for its
 * command. The message is sent back to the client as an error reply and the
 * connection stays usable.
 */
public class ArgumentException extends IllegalArgumentException {

    public ArgumentException(String message) {
        super(message);
    }

    /**
     * Create the standard arity error for a command.
     *
     * @param command the command name as sent by the client
     */
    public static ArgumentException wrongArity(String command) {
        return new ArgumentException("wrong number of arguments for '"
            + command.toLowerCase(java.util.Locale.ROOT) + "' command");
    }
}
