package com.respkv.network;

import com.respkv.RespKVServer;
import com.respkv.core.KVStore;
import com.respkv.core.StoreEntry;
import com.respkv.network.protocol.Command;
import com.respkv.network.protocol.Reply;
import com.respkv.util.MetricsCollector;
import com.respkv.util.MetricsCollector.CommandKind;
import com.respkv.util.MetricsCollector.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Maps decoded commands to store operations and produces replies.
 * Stateless apart from the shared store and metrics, so one instance serves
 * every connection.
 */
public class CommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);
    private static final int MAX_ECHOED_ARGS = 3;

    private final KVStore store;
    private final MetricsCollector metrics;
    private final long startedAtNanos;

    public CommandDispatcher(KVStore store, MetricsCollector metrics) {
        this.store = store;
        this.metrics = metrics;
        this.startedAtNanos = System.nanoTime();
    }

    /**
     * Execute a command.
     *
     * @param command the decoded command
     * @return the reply to send
     */
    public Reply dispatch(Command command) {
        long startTime = System.nanoTime();

        switch (command.getType()) {
            case PING:
                metrics.recordCommand(CommandKind.PING);
                return Reply.pong();

            case ECHO:
                metrics.recordCommand(CommandKind.ECHO);
                return Reply.bulk(command.getValueUnsafe());

            case SET:
                store.set(command.getKey(), command.getValueUnsafe(), command.getTtlMillis());
                metrics.recordSet(System.nanoTime() - startTime);
                return Reply.ok();

            case GET:
                Optional<StoreEntry> entry = store.get(command.getKey());
                metrics.recordGet(System.nanoTime() - startTime, entry.isPresent());
                return entry.map(e -> Reply.bulk(e.getValueUnsafe())).orElseGet(Reply::nil);

            case INFO:
                metrics.recordCommand(CommandKind.INFO);
                return Reply.bulk(info(command.getArgs()));

            case UNKNOWN:
                metrics.recordCommand(CommandKind.UNKNOWN);
                metrics.recordError(ErrorKind.UNKNOWN_COMMAND);
                logger.debug("Unknown command '{}'", command.getName());
                return Reply.error(unknownCommandMessage(command));

            default:
                throw new IllegalStateException("Unhandled command type: " + command.getType());
        }
    }

    private static String unknownCommandMessage(Command command) {
        StringBuilder message = new StringBuilder()
            .append("unknown command '").append(command.getName())
            .append("', with args beginning with: ");
        List<byte[]> args = command.getArgs();
        for (int i = 0; i < Math.min(args.size(), MAX_ECHOED_ARGS); i++) {
            message.append('\'').append(new String(args.get(i), StandardCharsets.UTF_8)).append("' ");
        }
        return message.toString();
    }

    private String info(List<byte[]> args) {
        String section = args.isEmpty()
            ? "default"
            : new String(args.get(0), StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
        boolean all = section.equals("default") || section.equals("all");

        StringBuilder info = new StringBuilder();
        if (all || section.equals("server")) {
            long uptimeSeconds = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - startedAtNanos);
            appendSection(info, "Server")
                .append("respkv_version:").append(RespKVServer.VERSION).append("\r\n")
                .append("uptime_in_seconds:").append(uptimeSeconds).append("\r\n");
        }
        if (all || section.equals("clients")) {
            appendSection(info, "Clients")
                .append("connected_clients:").append(metrics.getActiveConnections()).append("\r\n");
        }
        if (all || section.equals("stats")) {
            appendSection(info, "Stats")
                .append("total_commands_processed:").append(metrics.getTotalCommands()).append("\r\n")
                .append("keyspace_hits:").append(metrics.getKeyspaceHits()).append("\r\n")
                .append("keyspace_misses:").append(metrics.getKeyspaceMisses()).append("\r\n");
        }
        if (all || section.equals("keyspace")) {
            appendSection(info, "Keyspace")
                .append("keys:").append(store.size()).append("\r\n");
        }
        return info.toString();
    }

    private static StringBuilder appendSection(StringBuilder info, String title) {
        if (info.length() > 0) {
            info.append("\r\n");
        }
        return info.append("# ").append(title).append("\r\n");
    }
}
