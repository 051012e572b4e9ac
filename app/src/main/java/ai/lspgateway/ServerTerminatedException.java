package ai.lspgateway;

import org.jetbrains.annotations.Nullable;

/**
 * Completes every in-flight request of an instance that was stopped, failed, or whose process exited.
 * Unchecked because it only ever travels inside a {@link java.util.concurrent.CompletableFuture}.
 */
public final class ServerTerminatedException extends RuntimeException {
    private final String serverId;
    private final @Nullable Integer exitCode;

    public ServerTerminatedException(String serverId, String reason, @Nullable Integer exitCode) {
        super("LSP server " + serverId + " terminated: " + reason);
        this.serverId = serverId;
        this.exitCode = exitCode;
    }

    public String serverId() {
        return serverId;
    }

    public @Nullable Integer exitCode() {
        return exitCode;
    }
}
