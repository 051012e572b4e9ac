package ai.lspgateway.rpc;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import java.util.Objects;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.jetbrains.annotations.Nullable;

/** A decoded JSON-RPC 2.0 message. {@link RpcCodec#decode} is the only producer of inbound instances. */
public sealed interface RpcMessage {

    record Request(RpcId id, String method, @Nullable JsonElement params) implements RpcMessage {
        public Request {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(method, "method");
        }
    }

    record Notification(String method, @Nullable JsonElement params) implements RpcMessage {
        public Notification {
            Objects.requireNonNull(method, "method");
        }
    }

    /** A successful response; {@code result} is {@link JsonNull} for a null result. */
    record Response(RpcId id, JsonElement result) implements RpcMessage {
        public Response {
            Objects.requireNonNull(id, "id");
            result = result == null ? JsonNull.INSTANCE : result;
        }
    }

    /** An error response; {@code id} is null when the peer could not determine the request id. */
    record ErrorResponse(@Nullable RpcId id, ResponseError error) implements RpcMessage {
        public ErrorResponse {
            Objects.requireNonNull(error, "error");
        }
    }
}
