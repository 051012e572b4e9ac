package ai.lspgateway.sync;

import java.util.Objects;

/** An editor opened {@code uri}; {@code text} is its full content at {@code version}. */
public record DocumentOpen(String uri, String languageId, int version, String text) {
    public DocumentOpen {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(languageId, "languageId");
        Objects.requireNonNull(text, "text");
    }
}
