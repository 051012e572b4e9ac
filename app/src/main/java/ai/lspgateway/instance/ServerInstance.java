package ai.lspgateway.instance;

import ai.lspgateway.config.ServerDescriptor;
import ai.lspgateway.rpc.RpcEndpoint;
import com.google.gson.JsonElement;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** One running language server dedicated to a (language, workspace) pair. */
public final class ServerInstance {
    private static final Logger logger = LogManager.getLogger(ServerInstance.class);

    private final String id;
    private final ServerDescriptor descriptor;
    private final String languageId;
    private final Path workspaceRoot;
    private final Instant createdAt = Instant.now();
    private final AtomicReference<ServerState> state = new AtomicReference<>(ServerState.STARTING);
    private final Set<String> connectionIds = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<ServerState> terminated = new CompletableFuture<>();
    private final AtomicBoolean tearingDown = new AtomicBoolean();

    // uri -> version; only touched on the endpoint's lane
    private final Map<String, Integer> openDocuments = new HashMap<>();

    private volatile @Nullable RpcEndpoint endpoint;
    private volatile @Nullable JsonElement capabilities;

    public ServerInstance(String id, ServerDescriptor descriptor, String languageId, Path workspaceRoot) {
        this.id = id;
        this.descriptor = descriptor;
        this.languageId = languageId;
        this.workspaceRoot = workspaceRoot;
    }

    public String id() {
        return id;
    }

    public ServerDescriptor descriptor() {
        return descriptor;
    }

    public String languageId() {
        return languageId;
    }

    public Path workspaceRoot() {
        return workspaceRoot;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public ServerState state() {
        return state.get();
    }

    /**
     * Moves from {@code from} to {@code to} if the instance is still in {@code from} and the transition is legal.
     *
     * @return whether this call performed the transition
     */
    public boolean transition(ServerState from, ServerState to) {
        if (!from.canTransitionTo(to)) {
            logger.warn("Refusing illegal transition {} -> {} for {}", from, to, id);
            return false;
        }
        if (!state.compareAndSet(from, to)) {
            return false;
        }
        logger.info("LSP server {} {} -> {}", id, from.label(), to.label());
        return true;
    }

    /**
     * Moves to {@link ServerState#FAILED} from whatever non-terminal state the instance is in.
     *
     * @return the state it failed from, or null if it was already terminal
     */
    public @Nullable ServerState fail(String reason) {
        while (true) {
            var current = state.get();
            if (current.isTerminal()) {
                return null;
            }
            if (state.compareAndSet(current, ServerState.FAILED)) {
                logger.warn("LSP server {} {} -> failed: {}", id, current.label(), reason);
                return current;
            }
        }
    }

    public @Nullable RpcEndpoint endpoint() {
        return endpoint;
    }

    public void attach(RpcEndpoint endpoint) {
        this.endpoint = endpoint;
    }

    public @Nullable JsonElement capabilities() {
        return capabilities;
    }

    public void capabilities(@Nullable JsonElement capabilities) {
        this.capabilities = capabilities;
    }

    /** Version of each open document. Must only be used from the instance's lane. */
    public Map<String, Integer> openDocuments() {
        return openDocuments;
    }

    public Set<String> connectionIds() {
        return connectionIds;
    }

    /** True for exactly one caller: the one that performs the teardown. */
    public boolean beginTeardown() {
        return tearingDown.compareAndSet(false, true);
    }

    /** Completes with the final state once teardown has finished. */
    public CompletableFuture<ServerState> terminated() {
        return terminated;
    }

    @Override
    public String toString() {
        return "ServerInstance{" + id + ", " + state.get().label() + ", " + workspaceRoot + "}";
    }
}
