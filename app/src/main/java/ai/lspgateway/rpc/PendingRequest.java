package ai.lspgateway.rpc;

import com.google.gson.JsonElement;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;

/**
 * An outbound request awaiting its response.
 *
 * @param connectionId the connection that issued it, or null for gateway-internal requests such as {@code initialize}
 */
public record PendingRequest(
        long id, String method, @Nullable String connectionId, CompletableFuture<JsonElement> future) {}
