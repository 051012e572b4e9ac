package ai.lspgateway.rpc;

import ai.lspgateway.ServerNotReadyException;
import ai.lspgateway.ServerTerminatedException;
import ai.lspgateway.config.FramingMode;
import ai.lspgateway.process.ProcessSupervisor;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.jetbrains.annotations.Nullable;

/**
 * Speaks JSON-RPC over a server process's stdio on behalf of every connection attached to it: allocates request ids,
 * correlates responses with pending requests, and hands unsolicited notifications to the caller-supplied handler.
 */
public final class ProtocolMultiplexer {
    private static final Logger logger = LogManager.getLogger(ProtocolMultiplexer.class);
    private static final int ERROR_LOG_LINE_LIMIT = 4;

    private final ProcessSupervisor supervisor;
    private final FramingMode framing;

    public ProtocolMultiplexer(ProcessSupervisor supervisor, FramingMode framing) {
        this.supervisor = supervisor;
        this.framing = framing;
    }

    /**
     * Send a request and return a future for its result. The future fails with {@link ResponseErrorException} when
     * the server answers with an error, and with {@link ServerNotReadyException} right away if the endpoint can no
     * longer be written to. If the endpoint closes concurrently the future fails with
     * {@link ServerTerminatedException} instead.
     *
     * @param connectionId the issuing connection, or null for gateway-internal requests
     */
    public CompletableFuture<JsonElement> send(
            RpcEndpoint endpoint, String method, @Nullable JsonElement params, @Nullable String connectionId) {
        if (!endpoint.isWritable()) {
            return CompletableFuture.failedFuture(new ServerNotReadyException(endpoint.instanceId(), "not writable"));
        }
        var future = new CompletableFuture<JsonElement>();
        long id;
        synchronized (endpoint.writeLock()) {
            if (endpoint.isClosed()) {
                var reason = "closed before " + method + " was sent";
                future.completeExceptionally(new ServerTerminatedException(endpoint.instanceId(), reason, null));
                return future;
            }
            id = endpoint.allocateId();
            endpoint.register(new PendingRequest(id, method, connectionId, future));
            try {
                writeLocked(endpoint, new RpcMessage.Request(RpcId.of(id), method, params));
            } catch (UncheckedIOException e) {
                endpoint.forget(id);
                future.completeExceptionally(e.getCause());
                return future;
            }
        }
        logger.debug("-> {} request {} {}", endpoint.instanceId(), id, method);
        // a request that times out on the caller's side must not linger in the pending map
        future.whenComplete((result, error) -> endpoint.forget(id));
        return future;
    }

    /** Fire-and-forget: no id, no pending entry, nothing reported back. */
    public void notify(RpcEndpoint endpoint, String method, @Nullable JsonElement params) {
        if (!endpoint.isWritable()) {
            logger.debug("Dropping {} notification to {}: not writable", method, endpoint.instanceId());
            return;
        }
        write(endpoint, new RpcMessage.Notification(method, params));
        logger.debug("-> {} notification {}", endpoint.instanceId(), method);
    }

    /**
     * Start the endpoint's reader thread. Records are decoded on the reader and dispatched, in arrival order, on the
     * endpoint's lane.
     */
    public void startReading(RpcEndpoint endpoint, Consumer<RpcMessage.Notification> notifications) {
        var reader = new Thread(() -> readLoop(endpoint, notifications), "lsp-" + endpoint.instanceId() + "-reader");
        reader.setDaemon(true);
        reader.start();
    }

    private void readLoop(RpcEndpoint endpoint, Consumer<RpcMessage.Notification> notifications) {
        var framer = new MessageFramer();
        var buffer = new byte[8 * 1024];
        try (var stdout = endpoint.process().stdout()) {
            int read;
            while ((read = stdout.read(buffer)) != -1) {
                for (var record : framer.feed(buffer, 0, read)) {
                    RpcMessage message;
                    try {
                        message = RpcCodec.decode(record);
                    } catch (MalformedMessageException e) {
                        logger.warn("Ignoring malformed message from {}: {}", endpoint.instanceId(), e.getMessage());
                        continue;
                    }
                    endpoint.submit(() -> dispatch(endpoint, message, notifications));
                }
            }
        } catch (IOException e) {
            if (!endpoint.isClosed()) {
                logger.debug("Output of {} closed: {}", endpoint.instanceId(), e.getMessage());
            }
        }
        if (framer.pending() > 0) {
            logger.debug("Discarded {} trailing bytes from {}", framer.pending(), endpoint.instanceId());
        }
        logger.debug("Reader for {} finished", endpoint.instanceId());
    }

    /** Routes one inbound message. Runs on the endpoint's lane. */
    void dispatch(RpcEndpoint endpoint, RpcMessage message, Consumer<RpcMessage.Notification> notifications) {
        if (message instanceof RpcMessage.Response response) {
            var pending = endpoint.take(response.id());
            if (pending == null) {
                logger.debug("Dropping response {} from {}: no pending request", response.id(), endpoint.instanceId());
                return;
            }
            logger.debug("<- {} response {} {}", endpoint.instanceId(), pending.id(), pending.method());
            pending.future().complete(response.result());
        } else if (message instanceof RpcMessage.ErrorResponse errorResponse) {
            var id = errorResponse.id();
            var pending = id == null ? null : endpoint.take(id);
            var error = errorResponse.error();
            if (pending == null) {
                logger.warn(
                        "Server {} reported error {} for unknown request {}: {}",
                        endpoint.instanceId(),
                        error.getCode(),
                        id,
                        error.getMessage());
                return;
            }
            logger.debug(
                    "<- {} error {} for {} {}: {}",
                    endpoint.instanceId(),
                    error.getCode(),
                    pending.id(),
                    pending.method(),
                    error.getMessage());
            pending.future().completeExceptionally(new ResponseErrorException(error));
        } else if (message instanceof RpcMessage.Request request) {
            logger.debug("<- {} server request {} {}", endpoint.instanceId(), request.id(), request.method());
            write(endpoint, ServerRequestResponder.answer(request, endpoint.workspaceRoot()));
        } else if (message instanceof RpcMessage.Notification notification) {
            var method = notification.method();
            if (LspMethods.LOG_MESSAGE.equals(method) || LspMethods.SHOW_MESSAGE.equals(method)) {
                logServerMessage(endpoint, notification);
            }
            logger.trace("<- {} notification {}", endpoint.instanceId(), method);
            try {
                notifications.accept(notification);
            } catch (RuntimeException e) {
                logger.error("Notification handler for {} failed on {}", endpoint.instanceId(), method, e);
            }
        }
    }

    private void write(RpcEndpoint endpoint, RpcMessage message) {
        synchronized (endpoint.writeLock()) {
            try {
                writeLocked(endpoint, message);
            } catch (UncheckedIOException e) {
                logger.warn("Failed to write to {}: {}", endpoint.instanceId(), e.getCause().getMessage());
            }
        }
    }

    private void writeLocked(RpcEndpoint endpoint, RpcMessage message) {
        supervisor.write(endpoint.process(), MessageFramer.frame(RpcCodec.encode(message), framing));
    }

    private static void logServerMessage(RpcEndpoint endpoint, RpcMessage.Notification notification) {
        var params = notification.params();
        if (params == null) {
            return;
        }
        MessageParams message;
        try {
            message = RpcCodec.fromJsonTree(params, MessageParams.class);
        } catch (JsonParseException e) {
            logger.debug("Unparseable {} from {}: {}", notification.method(), endpoint.instanceId(), params);
            return;
        }
        var text = message.getMessage() == null ? "" : message.getMessage();
        var type = message.getType();
        if (type == null) {
            logger.debug("[lsp:{}] {}", endpoint.instanceId(), text);
            return;
        }
        switch (type) {
            case Error -> {
                var lines = text.lines().collect(Collectors.toCollection(ArrayList::new));
                // long server stack traces belong in the server's own log
                if (lines.size() > ERROR_LOG_LINE_LIMIT) {
                    var omitted = lines.size() - ERROR_LOG_LINE_LIMIT;
                    lines.subList(ERROR_LOG_LINE_LIMIT, lines.size()).clear();
                    lines.add("... " + omitted + " more lines");
                }
                logger.error("[lsp:{}] {}", endpoint.instanceId(), String.join(System.lineSeparator(), lines));
            }
            case Warning -> logger.warn("[lsp:{}] {}", endpoint.instanceId(), text);
            case Info -> logger.info("[lsp:{}] {}", endpoint.instanceId(), text);
            default -> logger.debug("[lsp:{}] {}", endpoint.instanceId(), text);
        }
    }
}
