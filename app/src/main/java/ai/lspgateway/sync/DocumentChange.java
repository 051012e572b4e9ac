package ai.lspgateway.sync;

import com.google.gson.JsonArray;
import java.util.Objects;

/** {@code contentChanges} as the editor produced them (full-text or ranged {@code TextDocumentContentChangeEvent}s). */
public record DocumentChange(String uri, int version, JsonArray contentChanges) {
    public DocumentChange {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(contentChanges, "contentChanges");
    }
}
