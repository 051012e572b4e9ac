package ai.lspgateway.lifecycle;

import ai.lspgateway.ExecutableNotFoundException;
import ai.lspgateway.ServerStartException;
import ai.lspgateway.ServerTerminatedException;
import ai.lspgateway.config.GatewayConfig;
import ai.lspgateway.config.ServerDescriptor;
import ai.lspgateway.connection.ConnectionRegistry;
import ai.lspgateway.instance.InstanceIds;
import ai.lspgateway.instance.InstanceRegistry;
import ai.lspgateway.instance.ServerInstance;
import ai.lspgateway.instance.ServerState;
import ai.lspgateway.process.ProcessSupervisor;
import ai.lspgateway.process.ServerProcess;
import ai.lspgateway.rpc.LspMethods;
import ai.lspgateway.rpc.ProtocolMultiplexer;
import ai.lspgateway.rpc.RpcCodec;
import ai.lspgateway.rpc.RpcEndpoint;
import com.google.gson.JsonElement;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.ClientCapabilities;
import org.eclipse.lsp4j.ClientInfo;
import org.eclipse.lsp4j.CompletionCapabilities;
import org.eclipse.lsp4j.DefinitionCapabilities;
import org.eclipse.lsp4j.DocumentSymbolCapabilities;
import org.eclipse.lsp4j.HoverCapabilities;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.PublishDiagnosticsCapabilities;
import org.eclipse.lsp4j.ReferencesCapabilities;
import org.eclipse.lsp4j.SymbolCapabilities;
import org.eclipse.lsp4j.SymbolKind;
import org.eclipse.lsp4j.SymbolKindCapabilities;
import org.eclipse.lsp4j.SynchronizationCapabilities;
import org.eclipse.lsp4j.TextDocumentClientCapabilities;
import org.eclipse.lsp4j.WindowClientCapabilities;
import org.eclipse.lsp4j.WorkspaceClientCapabilities;
import org.eclipse.lsp4j.WorkspaceFolder;
import org.jetbrains.annotations.Nullable;

/**
 * Drives server instances through {@link ServerState}: spawn and handshake, two-phase shutdown, and the teardown
 * that follows a stop, a failed start or an unexpected process exit. The only component that terminates processes.
 */
public final class LifecycleCoordinator {
    private static final Logger logger = LogManager.getLogger(LifecycleCoordinator.class);

    private final GatewayConfig config;
    private final InstanceRegistry instances;
    private final ConnectionRegistry connections;
    private final ProcessSupervisor supervisor;
    private final ProtocolMultiplexer multiplexer;

    public LifecycleCoordinator(
            GatewayConfig config,
            InstanceRegistry instances,
            ConnectionRegistry connections,
            ProcessSupervisor supervisor,
            ProtocolMultiplexer multiplexer) {
        this.config = config;
        this.instances = instances;
        this.connections = connections;
        this.supervisor = supervisor;
        this.multiplexer = multiplexer;
    }

    /**
     * Spawns a server for {@code languageId} in {@code workspaceRoot} and blocks until it is {@code READY}.
     *
     * @throws ExecutableNotFoundException if the server binary does not resolve; nothing is spawned
     * @throws ServerStartException if spawning or the initialize handshake fails, or the instance is stopped
     *     before it gets ready. The instance is {@code FAILED} and unregistered by then.
     */
    public ServerInstance start(ServerDescriptor descriptor, String languageId, Path workspaceRoot)
            throws ExecutableNotFoundException, ServerStartException {
        var instance =
                new ServerInstance(InstanceIds.next(descriptor.primaryName()), descriptor, languageId, workspaceRoot);
        instances.register(instance);
        logger.info("Starting {} for {} in {}", descriptor.name(), instance.id(), workspaceRoot);

        ServerProcess process;
        try {
            process = supervisor.spawn(descriptor, workspaceRoot, instance.id());
        } catch (ExecutableNotFoundException | ServerStartException e) {
            instance.fail(e.getMessage());
            teardown(instance, null, "spawn failed");
            throw e;
        }

        var endpoint = new RpcEndpoint(instance.id(), process, workspaceRoot);
        instance.attach(endpoint);
        process.onExit().whenComplete((exitCode, error) -> onProcessExit(instance, exitCode));
        multiplexer.startReading(endpoint, notification -> connections.deliver(instance, notification));

        if (!instance.transition(ServerState.STARTING, ServerState.INITIALIZING)) {
            // stopped while spawning; abort() could not reach the process yet
            var reason = "stopped while starting";
            endpoint.close(new ServerTerminatedException(instance.id(), reason, null));
            exitCode(supervisor.terminate(process, config.terminateGrace()));
            teardown(instance, null, reason);
            throw new ServerStartException("LSP server " + instance.id() + " was " + reason);
        }

        JsonElement result;
        try {
            result = multiplexer
                    .send(endpoint, LspMethods.INITIALIZE, RpcCodec.toJsonTree(initializeParams(workspaceRoot)), null)
                    .orTimeout(config.startupTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .get();
        } catch (ExecutionException e) {
            var cause = e.getCause() == null ? e : e.getCause();
            var reason = cause instanceof TimeoutException
                    ? "initialize timed out after " + config.startupTimeout().toMillis() + " ms"
                    : "initialize failed: " + cause.getMessage();
            abort(instance, reason);
            throw new ServerStartException("LSP server " + instance.id() + " did not start: " + reason, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(instance, "interrupted during initialize");
            throw new ServerStartException("Interrupted while starting " + instance.id(), e);
        }

        if (result.isJsonObject()) {
            instance.capabilities(result.getAsJsonObject().get("capabilities"));
        }
        multiplexer.notify(endpoint, LspMethods.INITIALIZED, RpcCodec.toJsonTree(new InitializedParams()));

        if (!instance.transition(ServerState.INITIALIZING, ServerState.READY)) {
            throw new ServerStartException(
                    "LSP server " + instance.id() + " left initialization as " + instance.state().label());
        }
        return instance;
    }

    /**
     * Stops {@code instance} and blocks until it is torn down. A ready instance gets the shutdown/exit handshake;
     * one still starting is failed and killed. Concurrent stops of the same instance wait for the first one.
     */
    public void stop(ServerInstance instance) {
        while (true) {
            var state = instance.state();
            switch (state) {
                case READY -> {
                    if (instance.transition(ServerState.READY, ServerState.DRAINING)) {
                        drain(instance);
                        return;
                    }
                }
                case STARTING, INITIALIZING -> {
                    if (instance.fail("stopped during startup") != null) {
                        abort(instance, "stopped during startup");
                        return;
                    }
                }
                case DRAINING, TERMINATED, FAILED -> {
                    awaitTeardown(instance);
                    return;
                }
            }
        }
    }

    private void drain(ServerInstance instance) {
        var endpoint = instance.endpoint();
        if (endpoint == null) {
            throw new IllegalStateException("Ready instance without endpoint: " + instance.id());
        }
        var timeout = config.shutdownTimeout();
        try {
            multiplexer
                    .send(endpoint, LspMethods.SHUTDOWN, null, null)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .get();
        } catch (ExecutionException e) {
            var cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof TimeoutException) {
                logger.warn("{} did not answer shutdown within {} ms, terminating", instance.id(), timeout.toMillis());
            } else {
                logger.warn("Shutdown request to {} failed: {}", instance.id(), cause.getMessage());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while draining {}, terminating", instance.id());
        }
        multiplexer.notify(endpoint, LspMethods.EXIT, null);

        var exitCode = exitCode(supervisor.terminate(endpoint.process(), config.terminateGrace()));
        instance.transition(ServerState.DRAINING, ServerState.TERMINATED);
        teardown(instance, exitCode, "stopped");
    }

    /** Fails the instance if it is not already, kills its process and tears it down. */
    private void abort(ServerInstance instance, String reason) {
        instance.fail(reason);
        var endpoint = instance.endpoint();
        Integer exitCode = null;
        if (endpoint != null) {
            exitCode = exitCode(supervisor.terminate(endpoint.process(), config.terminateGrace()));
        }
        teardown(instance, exitCode, reason);
    }

    private void onProcessExit(ServerInstance instance, @Nullable Integer exitCode) {
        var state = instance.state();
        if (state == ServerState.DRAINING || state.isTerminal()) {
            logger.debug("{} exited with {} while {}", instance.id(), exitCode, state.label());
            return;
        }
        var reason = "process exited unexpectedly with code " + exitCode;
        if (instance.fail(reason) != null) {
            teardown(instance, exitCode, reason);
        }
    }

    /**
     * Rejects pending requests, drops connections without didClose and unregisters the instance. Runs once per
     * instance, whichever path gets here first.
     */
    private void teardown(ServerInstance instance, @Nullable Integer exitCode, String reason) {
        if (!instance.beginTeardown()) {
            return;
        }
        var endpoint = instance.endpoint();
        if (endpoint != null) {
            endpoint.close(new ServerTerminatedException(instance.id(), reason, exitCode));
        }
        connections.forceRemoveAll(instance, exitCode);
        instances.remove(instance);
        var finalState = instance.state();
        instance.terminated().complete(finalState);
        logger.info("LSP server {} removed ({}, exit code {})", instance.id(), finalState.label(), exitCode);
    }

    private void awaitTeardown(ServerInstance instance) {
        var bound = config.shutdownTimeout().plus(config.terminateGrace().multipliedBy(2));
        try {
            instance.terminated().get(bound.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Teardown of {} did not finish within {} ms", instance.id(), bound.toMillis());
        } catch (ExecutionException e) {
            logger.warn("Teardown of {} failed", instance.id(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for {} to stop", instance.id());
        }
    }

    private @Nullable Integer exitCode(CompletableFuture<Integer> exit) {
        try {
            return exit.get(config.terminateGrace().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Process did not exit within {} ms of being killed", config.terminateGrace().toMillis());
            return null;
        } catch (ExecutionException e) {
            logger.debug("Exit status unavailable", e.getCause());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    @SuppressWarnings("deprecation")
    InitializeParams initializeParams(Path workspaceRoot) {
        var params = new InitializeParams();
        params.setProcessId((int) ProcessHandle.current().pid());
        params.setRootUri(workspaceRoot.toUri().toString());
        params.setRootPath(workspaceRoot.toString());
        var folderName = workspaceRoot.getFileName();
        params.setWorkspaceFolders(List.of(new WorkspaceFolder(
                workspaceRoot.toUri().toString(),
                folderName == null ? workspaceRoot.toString() : folderName.toString())));
        params.setClientInfo(new ClientInfo(config.clientName()));
        params.setCapabilities(clientCapabilities());
        return params;
    }

    /** What the gateway's clients are assumed to handle; servers tailor their output to this. */
    static ClientCapabilities clientCapabilities() {
        var workspace = new WorkspaceClientCapabilities();
        var symbolKinds = new SymbolKindCapabilities();
        symbolKinds.setValueSet(Arrays.stream(SymbolKind.values()).collect(Collectors.toList()));
        var symbols = new SymbolCapabilities();
        symbols.setSymbolKind(symbolKinds);
        workspace.setSymbol(symbols);
        workspace.setWorkspaceFolders(true);
        workspace.setConfiguration(true);

        var textDocument = new TextDocumentClientCapabilities();
        var synchronization = new SynchronizationCapabilities();
        synchronization.setDidSave(true);
        textDocument.setSynchronization(synchronization);
        textDocument.setPublishDiagnostics(new PublishDiagnosticsCapabilities(true));
        textDocument.setHover(new HoverCapabilities());
        textDocument.setCompletion(new CompletionCapabilities());
        textDocument.setDefinition(new DefinitionCapabilities());
        textDocument.setReferences(new ReferencesCapabilities());
        var documentSymbols = new DocumentSymbolCapabilities();
        documentSymbols.setHierarchicalDocumentSymbolSupport(true);
        textDocument.setDocumentSymbol(documentSymbols);

        var window = new WindowClientCapabilities();
        window.setWorkDoneProgress(true);

        var capabilities = new ClientCapabilities();
        capabilities.setWorkspace(workspace);
        capabilities.setTextDocument(textDocument);
        capabilities.setWindow(window);
        return capabilities;
    }
}
