package ai.lspgateway.connection;

import ai.lspgateway.rpc.RpcCodec;
import ai.lspgateway.rpc.RpcMessage;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.jetbrains.annotations.Nullable;

/** Event names and payloads pushed to client channels. */
public final class ClientEvents {
    /** A server notification, as the JSON-RPC message plus {@code serverId}. */
    public static final String MESSAGE = "lsp:message";

    public static final String RESPONSE = "lsp:response";
    public static final String ERROR = "lsp:error";
    public static final String SERVER_EXIT = "lsp:server:exit";

    private ClientEvents() {}

    public static JsonObject message(String serverId, RpcMessage.Notification notification) {
        var payload = new JsonObject();
        payload.addProperty("jsonrpc", "2.0");
        payload.addProperty("method", notification.method());
        if (notification.params() != null) {
            payload.add("params", notification.params());
        }
        payload.addProperty("serverId", serverId);
        return payload;
    }

    public static JsonObject response(String id, JsonElement result) {
        var payload = new JsonObject();
        payload.addProperty("id", id);
        payload.add("result", result);
        return payload;
    }

    public static JsonObject error(String id, ResponseError error, String serverId) {
        var payload = new JsonObject();
        payload.addProperty("id", id);
        payload.add("error", RpcCodec.errorJson(error));
        payload.addProperty("serverId", serverId);
        return payload;
    }

    public static JsonObject serverExit(String serverId, @Nullable Integer exitCode) {
        var payload = new JsonObject();
        payload.addProperty("serverId", serverId);
        payload.addProperty("exitCode", exitCode);
        return payload;
    }
}
