package ai.lspgateway.rpc;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.Optional;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;

/** Params of the three document synchronization notifications. */
public final class TextDocumentParams {

    private TextDocumentParams() {}

    public static JsonElement didOpen(String uri, String languageId, int version, String text) {
        return RpcCodec.toJsonTree(new DidOpenTextDocumentParams(new TextDocumentItem(uri, languageId, version, text)));
    }

    /** {@code contentChanges} is forwarded verbatim; full-text and ranged changes are both passed through. */
    public static JsonElement didChange(String uri, int version, JsonArray contentChanges) {
        var params = new JsonObject();
        params.add("textDocument", RpcCodec.toJsonTree(new VersionedTextDocumentIdentifier(uri, version)));
        params.add("contentChanges", contentChanges.deepCopy());
        return params;
    }

    public static JsonElement didClose(String uri) {
        return RpcCodec.toJsonTree(new DidCloseTextDocumentParams(new TextDocumentIdentifier(uri)));
    }

    /** The {@code textDocument.uri} or top-level {@code uri} of a notification's params, if present. */
    public static Optional<String> uriOf(JsonElement params) {
        if (!params.isJsonObject()) {
            return Optional.empty();
        }
        var object = params.getAsJsonObject();
        var uri = object.get("uri");
        if (uri == null && object.get("textDocument") instanceof JsonObject textDocument) {
            uri = textDocument.get("uri");
        }
        return uri != null && uri.isJsonPrimitive()
                ? Optional.of(uri.getAsString())
                : Optional.empty();
    }
}
