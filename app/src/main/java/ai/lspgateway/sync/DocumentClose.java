package ai.lspgateway.sync;

import java.util.Objects;

public record DocumentClose(String uri) {
    public DocumentClose {
        Objects.requireNonNull(uri, "uri");
    }
}
