package ai.lspgateway.config;

import java.util.Locale;
import java.util.Optional;

/** How outbound JSON-RPC messages are delimited on a server's stdin. Inbound accepts both. */
public enum FramingMode {
    /** {@code Content-Length: N\r\n\r\n} header followed by the body, as the LSP base protocol defines. */
    CONTENT_LENGTH("content-length"),
    /** One JSON document per line. */
    LINE_DELIMITED("line-delimited");

    private final String key;

    FramingMode(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<FramingMode> parse(String raw) {
        var normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (var mode : values()) {
            if (mode.key.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
