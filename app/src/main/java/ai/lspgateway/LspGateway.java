package ai.lspgateway;

import ai.lspgateway.config.GatewayConfig;
import ai.lspgateway.config.LanguageServerRegistry;
import ai.lspgateway.config.ServerDescriptor;
import ai.lspgateway.connection.ClientChannel;
import ai.lspgateway.connection.ClientEvents;
import ai.lspgateway.connection.Connection;
import ai.lspgateway.connection.ConnectionRegistry;
import ai.lspgateway.instance.InstanceRegistry;
import ai.lspgateway.instance.ServerInstance;
import ai.lspgateway.instance.ServerState;
import ai.lspgateway.lifecycle.LifecycleCoordinator;
import ai.lspgateway.process.ProcessLauncher;
import ai.lspgateway.process.ProcessSupervisor;
import ai.lspgateway.rpc.ProtocolMultiplexer;
import ai.lspgateway.sync.DocumentChange;
import ai.lspgateway.sync.DocumentClose;
import ai.lspgateway.sync.DocumentOpen;
import ai.lspgateway.sync.DocumentSyncRouter;
import com.google.gson.JsonElement;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.jetbrains.annotations.Nullable;

/**
 * Shares language server processes among many editing clients.
 *
 * <p>One process runs per (language, workspace) pair. Clients attach to it through connections, push document
 * events, and receive the server's notifications on their {@link ClientChannel}. All state is owned by the gateway
 * instance, so several gateways can coexist in one JVM.
 *
 * <p>{@link #startServer}, {@link #stopServer} and {@link #shutdown} block until the lifecycle step has finished or
 * timed out. Document events and connection management never wait on a server.
 */
public final class LspGateway implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(LspGateway.class);

    private final LanguageServerRegistry languages;
    private final WorkspaceRootResolver workspaceRoots;
    private final InstanceRegistry instances = new InstanceRegistry();
    private final ProcessSupervisor supervisor;
    private final ProtocolMultiplexer multiplexer;
    private final ConnectionRegistry connections;
    private final DocumentSyncRouter documents;
    private final LifecycleCoordinator lifecycle;

    public LspGateway(
            GatewayConfig config,
            LanguageServerRegistry languages,
            ProcessLauncher launcher,
            WorkspaceRootResolver workspaceRoots) {
        this.languages = languages;
        this.workspaceRoots = workspaceRoots;
        this.supervisor = new ProcessSupervisor(launcher);
        this.multiplexer = new ProtocolMultiplexer(supervisor, config.framing());
        this.connections = new ConnectionRegistry(instances, multiplexer);
        this.documents = new DocumentSyncRouter(instances, connections, multiplexer);
        this.lifecycle = new LifecycleCoordinator(config, instances, connections, supervisor, multiplexer);
    }

    /** A gateway using {@link GatewayConfig#load()}, the configured language servers and real OS processes. */
    public static LspGateway create(WorkspaceRootResolver workspaceRoots) {
        var config = GatewayConfig.load();
        return new LspGateway(config, LanguageServerRegistry.load(config), ProcessLauncher.os(), workspaceRoots);
    }

    public SortedSet<String> getSupportedLanguages() {
        return languages.getSupportedLanguages();
    }

    public Optional<ServerDescriptor> getServerConfig(@Nullable String languageId) {
        return languages.getServerConfig(languageId);
    }

    public ExecutableCheck checkServerExecutable(String languageId) throws UnsupportedLanguageException {
        var descriptor = descriptorFor(languageId);
        return new ExecutableCheck(
                languageId, descriptor.name(), descriptor.command(), supervisor.isExecutableAvailable(descriptor));
    }

    /**
     * Starts a server for {@code languageId} with {@code workspaceRoot} as its working directory, and waits for the
     * initialize handshake. Returns the id of an already ready instance for the same language and root instead of
     * starting a second one.
     */
    public String startServer(String languageId, Path workspaceRoot)
            throws UnsupportedLanguageException, ExecutableNotFoundException, ServerStartException {
        var descriptor = descriptorFor(languageId);
        var root = workspaceRoot.toAbsolutePath().normalize();
        var running = instances.findReady(languageId, root);
        if (running.isPresent()) {
            logger.debug("Reusing {} for {} in {}", running.get().id(), languageId, root);
            return running.get().id();
        }
        return lifecycle.start(descriptor, languageId, root).id();
    }

    public String startServerForWorkspace(String languageId, String workspaceId)
            throws UnsupportedLanguageException, ExecutableNotFoundException, ServerStartException {
        return startServer(languageId, workspaceRoots.resolve(workspaceId));
    }

    /**
     * Runs the shutdown handshake and terminates the process.
     *
     * @return false if no such server is registered
     */
    public boolean stopServer(String serverId) {
        var instance = instances.get(serverId);
        if (instance.isEmpty()) {
            return false;
        }
        lifecycle.stop(instance.get());
        return true;
    }

    /** Attaches {@code channel} to a ready server and returns the connection id. */
    public String createConnection(String serverId, ClientChannel channel, Path workspaceRoot)
            throws ServerNotFoundException, ServerNotReadyException {
        return connections.create(serverId, channel, workspaceRoot).id();
    }

    public boolean removeConnection(String connectionId) {
        return connections.remove(connectionId);
    }

    /** Removes every connection of a client that went away; returns how many there were. */
    public int removeChannel(String channelId) {
        return connections.removeChannel(channelId);
    }

    public CompletableFuture<Boolean> handleDocumentOpen(String serverId, DocumentOpen event) {
        return documents.open(serverId, event);
    }

    public CompletableFuture<Boolean> handleDocumentChange(String serverId, DocumentChange event) {
        return documents.change(serverId, event);
    }

    public CompletableFuture<Boolean> handleDocumentClose(String serverId, DocumentClose event) {
        return documents.close(serverId, event);
    }

    /** Like {@link #handleDocumentOpen}, also routing the document's diagnostics to the connection. */
    public CompletableFuture<Boolean> openDocument(String connectionId, DocumentOpen event)
            throws ConnectionNotFoundException {
        return documents.openFor(connectionId, event);
    }

    public CompletableFuture<Boolean> changeDocument(String connectionId, DocumentChange event)
            throws ConnectionNotFoundException {
        return documents.changeFor(connectionId, event);
    }

    public CompletableFuture<Boolean> closeDocument(String connectionId, DocumentClose event)
            throws ConnectionNotFoundException {
        return documents.closeFor(connectionId, event);
    }

    /**
     * Forwards a request from a connection's client. The future fails with {@link ResponseErrorException} when the
     * server answers with an error, {@link ServerNotReadyException} when the server is not ready, and
     * {@link ServerTerminatedException} when it goes away before answering.
     */
    public CompletableFuture<JsonElement> sendRequest(String connectionId, String method, @Nullable JsonElement params)
            throws ConnectionNotFoundException {
        var connection = connection(connectionId);
        var instance = connection.instance();
        var endpoint = instance.endpoint();
        if (endpoint == null || instance.state() != ServerState.READY) {
            return CompletableFuture.failedFuture(new ServerNotReadyException(instance.id(), instance.state().label()));
        }
        return multiplexer.send(endpoint, method, params, connectionId);
    }

    /**
     * Forwards a client request and answers it on the client's channel with {@code lsp:response} or
     * {@code lsp:error}, under the client's own request id.
     */
    public void handleClientRequest(
            String connectionId, String clientRequestId, String method, @Nullable JsonElement params)
            throws ConnectionNotFoundException {
        var connection = connection(connectionId);
        var channel = connection.channel();
        sendRequest(connectionId, method, params).whenComplete((result, error) -> {
            try {
                if (error == null) {
                    channel.emit(ClientEvents.RESPONSE, ClientEvents.response(clientRequestId, result));
                } else {
                    var responseError = toResponseError(error);
                    logger.debug("{} from {} failed: {}", method, connectionId, responseError.getMessage());
                    channel.emit(
                            ClientEvents.ERROR,
                            ClientEvents.error(clientRequestId, responseError, connection.instanceId()));
                }
            } catch (RuntimeException e) {
                logger.warn("Channel {} failed to accept reply to {}", channel.id(), method, e);
            }
        });
    }

    public void sendNotification(String connectionId, String method, @Nullable JsonElement params)
            throws ConnectionNotFoundException {
        var instance = connection(connectionId).instance();
        var endpoint = instance.endpoint();
        if (endpoint == null || instance.state() != ServerState.READY) {
            logger.debug("Dropping {} from {}: server is {}", method, connectionId, instance.state().label());
            return;
        }
        multiplexer.notify(endpoint, method, params);
    }

    public Optional<ActiveServer> getServerStatus(String serverId) {
        return instances.get(serverId).filter(instance -> !instance.state().isTerminal()).map(this::status);
    }

    /** Every server that has not terminated, ordered by id. */
    public List<ActiveServer> getActiveServers() {
        return instances.all().stream()
                .filter(instance -> !instance.state().isTerminal())
                .map(this::status)
                .toList();
    }

    /** Stops every server concurrently and returns once all are torn down. */
    public void shutdown() {
        var running = instances.all();
        if (running.isEmpty()) {
            return;
        }
        logger.info("Shutting down {} LSP servers", running.size());
        var threadCount = new AtomicInteger();
        var executor = Executors.newFixedThreadPool(Math.min(running.size(), 8), r -> {
            var t = new Thread(r, "lsp-shutdown-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            var stops = running.stream()
                    .map(instance -> CompletableFuture.runAsync(() -> lifecycle.stop(instance), executor))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(stops).join();
        } catch (CompletionException e) {
            logger.error("Error while shutting down LSP servers", e.getCause());
        } finally {
            executor.shutdown();
        }
        if (!instances.isEmpty()) {
            logger.warn("{} LSP servers still registered after shutdown", instances.all().size());
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private ActiveServer status(ServerInstance instance) {
        return new ActiveServer(
                instance.id(),
                instance.descriptor().name(),
                instance.state().label(),
                instance.connectionIds().size());
    }

    private ServerDescriptor descriptorFor(String languageId) throws UnsupportedLanguageException {
        return languages.getServerConfig(languageId).orElseThrow(() -> new UnsupportedLanguageException(languageId));
    }

    private Connection connection(String connectionId) throws ConnectionNotFoundException {
        return connections.get(connectionId).orElseThrow(() -> new ConnectionNotFoundException(connectionId));
    }

    private static ResponseError toResponseError(Throwable error) {
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof ResponseErrorException responseError) {
            return responseError.getResponseError();
        }
        return new ResponseError(ResponseErrorCode.InternalError, String.valueOf(cause.getMessage()), null);
    }
}
