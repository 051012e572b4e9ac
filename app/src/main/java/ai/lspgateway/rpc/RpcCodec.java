package ai.lspgateway.rpc;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.util.Collections;
import org.eclipse.lsp4j.jsonrpc.json.MessageJsonHandler;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.jetbrains.annotations.Nullable;

/**
 * Converts between JSON text and {@link RpcMessage}. Decoding validates the envelope so the rest of the gateway
 * only sees well-formed messages.
 */
public final class RpcCodec {
    private static final String JSONRPC_VERSION = "2.0";

    /** lsp4j's Gson, so lsp4j protocol types encode exactly as the protocol expects (enums as numbers etc.). */
    private static final Gson lspGson = new MessageJsonHandler(Collections.emptyMap()).getGson();

    /** Envelope writer; keeps explicit nulls such as {@code "result": null}. */
    private static final Gson envelopeGson =
            new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    private RpcCodec() {}

    /** Converts an lsp4j parameter object (or any Gson-serializable value) to a JSON tree. */
    public static JsonElement toJsonTree(Object params) {
        return lspGson.toJsonTree(params);
    }

    public static <T> T fromJsonTree(JsonElement json, Class<T> type) {
        return lspGson.fromJson(json, type);
    }

    public static RpcMessage decode(String text) throws MalformedMessageException {
        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new MalformedMessageException("Invalid JSON: " + e.getMessage(), e);
        }
        if (!parsed.isJsonObject()) {
            throw new MalformedMessageException("JSON-RPC message must be an object");
        }
        var json = parsed.getAsJsonObject();

        var version = json.get("jsonrpc");
        if (version == null || !version.isJsonPrimitive() || !JSONRPC_VERSION.equals(version.getAsString())) {
            throw new MalformedMessageException("Missing or unsupported jsonrpc version: " + version);
        }

        var id = parseId(json.get("id"));
        var method = json.get("method");
        if (method != null) {
            if (!method.isJsonPrimitive() || !method.getAsJsonPrimitive().isString()) {
                throw new MalformedMessageException("method must be a string");
            }
            var params = json.get("params");
            if (params != null && !params.isJsonNull() && !params.isJsonObject() && !params.isJsonArray()) {
                throw new MalformedMessageException("params must be an object or an array");
            }
            var normalizedParams = params == null || params.isJsonNull() ? null : params;
            return id == null
                    ? new RpcMessage.Notification(method.getAsString(), normalizedParams)
                    : new RpcMessage.Request(id, method.getAsString(), normalizedParams);
        }

        var error = json.get("error");
        if (error != null && !error.isJsonNull()) {
            return new RpcMessage.ErrorResponse(id, parseError(error));
        }
        if (id == null) {
            throw new MalformedMessageException("Response without id");
        }
        if (!json.has("result")) {
            throw new MalformedMessageException("Response " + id + " has neither result nor error");
        }
        return new RpcMessage.Response(id, json.get("result"));
    }

    public static String encode(RpcMessage message) {
        var json = new JsonObject();
        json.addProperty("jsonrpc", JSONRPC_VERSION);
        if (message instanceof RpcMessage.Request request) {
            json.add("id", request.id().value());
            json.addProperty("method", request.method());
            if (request.params() != null) {
                json.add("params", request.params());
            }
        } else if (message instanceof RpcMessage.Notification notification) {
            json.addProperty("method", notification.method());
            if (notification.params() != null) {
                json.add("params", notification.params());
            }
        } else if (message instanceof RpcMessage.Response response) {
            json.add("id", response.id().value());
            json.add("result", response.result());
        } else if (message instanceof RpcMessage.ErrorResponse errorResponse) {
            var id = errorResponse.id();
            json.add("id", id == null ? JsonNull.INSTANCE : id.value());
            json.add("error", errorJson(errorResponse.error()));
        }
        return envelopeGson.toJson(json);
    }

    /** {@code {code, message[, data]}} as it appears on the wire and in client error events. */
    public static JsonObject errorJson(ResponseError error) {
        var json = new JsonObject();
        json.addProperty("code", error.getCode());
        json.addProperty("message", error.getMessage());
        var data = error.getData();
        if (data instanceof JsonElement element) {
            json.add("data", element);
        } else if (data != null) {
            json.add("data", lspGson.toJsonTree(data));
        }
        return json;
    }

    private static @Nullable RpcId parseId(@Nullable JsonElement id) throws MalformedMessageException {
        if (id == null || id.isJsonNull()) {
            return null;
        }
        if (!id.isJsonPrimitive()) {
            throw new MalformedMessageException("id must be a number or a string");
        }
        JsonPrimitive primitive = id.getAsJsonPrimitive();
        if (!primitive.isNumber() && !primitive.isString()) {
            throw new MalformedMessageException("id must be a number or a string");
        }
        return new RpcId(primitive);
    }

    private static ResponseError parseError(JsonElement error) throws MalformedMessageException {
        if (!error.isJsonObject()) {
            throw new MalformedMessageException("error must be an object");
        }
        var errorObject = error.getAsJsonObject();
        var code = errorObject.get("code");
        if (code == null || !code.isJsonPrimitive() || !code.getAsJsonPrimitive().isNumber()) {
            throw new MalformedMessageException("error.code must be a number");
        }
        var message = errorObject.get("message");
        var messageText = message != null && message.isJsonPrimitive() ? message.getAsString() : "";
        var data = errorObject.get("data");
        return new ResponseError(code.getAsInt(), messageText, data == null || data.isJsonNull() ? null : data);
    }
}
