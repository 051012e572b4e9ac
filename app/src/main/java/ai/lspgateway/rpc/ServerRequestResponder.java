package ai.lspgateway.rpc;

import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import java.nio.file.Path;
import java.util.List;
import org.eclipse.lsp4j.WorkspaceFolder;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;

/**
 * Answers requests a server sends to its client. Servers block on several of these during startup, so the gateway
 * replies on behalf of all attached clients.
 */
final class ServerRequestResponder {

    private ServerRequestResponder() {}

    static RpcMessage answer(RpcMessage.Request request, Path workspaceRoot) {
        return switch (request.method()) {
            case LspMethods.REGISTER_CAPABILITY,
                    LspMethods.UNREGISTER_CAPABILITY,
                    LspMethods.WORK_DONE_PROGRESS_CREATE -> new RpcMessage.Response(request.id(), JsonNull.INSTANCE);
            case LspMethods.CONFIGURATION -> new RpcMessage.Response(request.id(), configuration(request));
            case LspMethods.WORKSPACE_FOLDERS -> new RpcMessage.Response(
                    request.id(), RpcCodec.toJsonTree(List.of(workspaceFolder(workspaceRoot))));
            default -> new RpcMessage.ErrorResponse(
                    request.id(),
                    new ResponseError(
                            ResponseErrorCode.MethodNotFound, "Unhandled method " + request.method(), null));
        };
    }

    /** One {@code null} per requested item: the server falls back to its own defaults. */
    private static JsonArray configuration(RpcMessage.Request request) {
        var result = new JsonArray();
        var params = request.params();
        if (params != null && params.isJsonObject()) {
            var items = params.getAsJsonObject().get("items");
            if (items != null && items.isJsonArray()) {
                for (int i = 0; i < items.getAsJsonArray().size(); i++) {
                    result.add(JsonNull.INSTANCE);
                }
            }
        }
        return result;
    }

    static WorkspaceFolder workspaceFolder(Path workspaceRoot) {
        var fileName = workspaceRoot.getFileName();
        return new WorkspaceFolder(
                workspaceRoot.toUri().toString(), fileName == null ? workspaceRoot.toString() : fileName.toString());
    }
}
