package ai.lspgateway.testutil;

import ai.lspgateway.config.FramingMode;
import ai.lspgateway.rpc.MalformedMessageException;
import ai.lspgateway.rpc.MessageFramer;
import ai.lspgateway.rpc.RpcCodec;
import ai.lspgateway.rpc.RpcId;
import ai.lspgateway.rpc.RpcMessage;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Predicate;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.jetbrains.annotations.Nullable;

/**
 * A language server stand-in running on the far side of a {@link FakeServerProcess}. Records everything the gateway
 * sends and answers {@code initialize} and {@code shutdown} unless told otherwise.
 */
public final class ScriptedServer {
    public static final String DEFAULT_CAPABILITIES = "{\"textDocumentSync\":1,\"hoverProvider\":true}";

    private final FakeServerProcess process;
    private final List<RpcMessage> received = new CopyOnWriteArrayList<>();
    private final Map<String, Function<RpcMessage.Request, RpcMessage>> handlers = new ConcurrentHashMap<>();
    private volatile FramingMode framing = FramingMode.CONTENT_LENGTH;

    public ScriptedServer(FakeServerProcess process) {
        this.process = process;
        respond("initialize", request -> JsonParser.parseString("{\"capabilities\":" + DEFAULT_CAPABILITIES + "}"));
        respond("shutdown", request -> JsonNull.INSTANCE);
    }

    public FakeServerProcess process() {
        return process;
    }

    public ScriptedServer framing(FramingMode framing) {
        this.framing = framing;
        return this;
    }

    public ScriptedServer respond(String method, Function<RpcMessage.Request, JsonElement> result) {
        handlers.put(method, request -> new RpcMessage.Response(request.id(), result.apply(request)));
        return this;
    }

    public ScriptedServer fail(String method, int code, String message) {
        handlers.put(
                method, request -> new RpcMessage.ErrorResponse(request.id(), new ResponseError(code, message, null)));
        return this;
    }

    /** Leaves {@code method} requests unanswered. */
    public ScriptedServer ignore(String method) {
        handlers.put(method, request -> null);
        return this;
    }

    public ScriptedServer start() {
        var reader = new Thread(this::readLoop, "scripted-server-" + process.pid());
        reader.setDaemon(true);
        reader.start();
        return this;
    }

    public void notifyClient(String method, @Nullable JsonElement params) {
        write(new RpcMessage.Notification(method, params));
    }

    /** Sends a server-to-client request, as servers do for {@code workspace/configuration}. */
    public void requestClient(String id, String method, @Nullable JsonElement params) {
        write(new RpcMessage.Request(RpcId.of(id), method, params));
    }

    /** Writes raw bytes to the gateway, bypassing framing. */
    public void writeRaw(byte[] bytes) {
        try {
            synchronized (this) {
                process.serverOutput().write(bytes);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void write(RpcMessage message) {
        writeRaw(MessageFramer.frame(RpcCodec.encode(message), framing));
    }

    public List<RpcMessage> received() {
        return List.copyOf(received);
    }

    /** Methods of received requests and notifications, in arrival order. */
    public List<String> methods() {
        return received.stream().map(ScriptedServer::methodOf).filter(m -> m != null).toList();
    }

    /** Received messages other than the startup handshake. */
    public List<RpcMessage> afterHandshake() {
        return received.stream()
                .filter(message -> {
                    var method = methodOf(message);
                    return !"initialize".equals(method) && !"initialized".equals(method);
                })
                .toList();
    }

    public RpcMessage await(Predicate<RpcMessage> match, Duration timeout) throws TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            for (var message : received) {
                if (match.test(message)) {
                    return message;
                }
            }
            Await.pause();
        }
        throw new TimeoutException("No matching message; received " + methods());
    }

    public RpcMessage awaitMethod(String method) throws TimeoutException {
        return await(message -> method.equals(methodOf(message)), Await.DEFAULT_TIMEOUT);
    }

    /** Messages with {@code method}. */
    public List<RpcMessage> withMethod(String method) {
        return received.stream().filter(message -> method.equals(methodOf(message))).toList();
    }

    public static @Nullable String methodOf(RpcMessage message) {
        if (message instanceof RpcMessage.Request request) {
            return request.method();
        }
        if (message instanceof RpcMessage.Notification notification) {
            return notification.method();
        }
        return null;
    }

    public static JsonObject params(RpcMessage message) {
        JsonElement params = null;
        if (message instanceof RpcMessage.Request request) {
            params = request.params();
        } else if (message instanceof RpcMessage.Notification notification) {
            params = notification.params();
        }
        if (params == null || !params.isJsonObject()) {
            throw new AssertionError("Message has no object params: " + message);
        }
        return params.getAsJsonObject();
    }

    private void readLoop() {
        var framer = new MessageFramer();
        var buffer = new byte[4096];
        try {
            int read;
            while ((read = process.serverInput().read(buffer)) != -1) {
                for (var record : framer.feed(buffer, 0, read)) {
                    var message = RpcCodec.decode(record);
                    received.add(message);
                    if (message instanceof RpcMessage.Request request) {
                        var handler = handlers.get(request.method());
                        if (handler != null) {
                            var reply = handler.apply(request);
                            if (reply != null) {
                                write(reply);
                            }
                        }
                    }
                }
            }
        } catch (IOException | UncheckedIOException | MalformedMessageException e) {
            // the gateway killed the process or sent garbage; tests assert on what was received
        }
    }
}
