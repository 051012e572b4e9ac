package ai.lspgateway.testutil;

import ai.lspgateway.ServerTerminatedException;
import ai.lspgateway.config.FramingMode;
import ai.lspgateway.config.ServerDescriptor;
import ai.lspgateway.connection.ConnectionRegistry;
import ai.lspgateway.instance.InstanceRegistry;
import ai.lspgateway.instance.ServerInstance;
import ai.lspgateway.instance.ServerState;
import ai.lspgateway.process.ProcessSupervisor;
import ai.lspgateway.rpc.ProtocolMultiplexer;
import ai.lspgateway.rpc.RpcEndpoint;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registries wired the way the gateway wires them, with ready instances whose processes are {@link ScriptedServer}s.
 * Skips the lifecycle handshake so connection and document routing can be tested on their own.
 */
public final class InstanceFixture implements AutoCloseable {
    public static final ServerDescriptor TYPESCRIPT = new ServerDescriptor(
            "typescript",
            "typescript-language-server",
            "typescript-language-server",
            List.of("--stdio"),
            Set.of("javascript"));

    private final InstanceRegistry instances = new InstanceRegistry();
    private final ProtocolMultiplexer multiplexer =
            new ProtocolMultiplexer(new ProcessSupervisor(new FakeProcessLauncher()), FramingMode.CONTENT_LENGTH);
    private final ConnectionRegistry connections = new ConnectionRegistry(instances, multiplexer);
    private final Map<String, ScriptedServer> servers = new ConcurrentHashMap<>();

    public InstanceRegistry instances() {
        return instances;
    }

    public ProtocolMultiplexer multiplexer() {
        return multiplexer;
    }

    public ConnectionRegistry connections() {
        return connections;
    }

    public ServerInstance ready(String id, Path workspaceRoot) {
        var instance = new ServerInstance(id, TYPESCRIPT, "typescript", workspaceRoot);
        var process = new FakeServerProcess(TYPESCRIPT.commandLine(), workspaceRoot);
        servers.put(id, new ScriptedServer(process).start());
        var endpoint = new RpcEndpoint(id, process, workspaceRoot);
        instance.attach(endpoint);
        multiplexer.startReading(endpoint, notification -> connections.deliver(instance, notification));
        instance.transition(ServerState.STARTING, ServerState.INITIALIZING);
        instance.transition(ServerState.INITIALIZING, ServerState.READY);
        instances.register(instance);
        return instance;
    }

    public ScriptedServer server(String instanceId) {
        var server = servers.get(instanceId);
        if (server == null) {
            throw new AssertionError("No server for " + instanceId);
        }
        return server;
    }

    /** Waits until everything already queued on the instance's lane has run. */
    public void drainLane(ServerInstance instance) {
        var endpoint = instance.endpoint();
        if (endpoint == null) {
            return;
        }
        try {
            endpoint.supply(() -> true, false).get(Await.DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            throw new AssertionError("Lane of " + instance.id() + " did not drain", e);
        }
    }

    /**
     * Drains the lane, then round-trips a marker notification so that everything written before it has reached the
     * server.
     */
    public void flush(ServerInstance instance) {
        drainLane(instance);
        var endpoint = instance.endpoint();
        if (endpoint == null) {
            return;
        }
        var marker = "$/marker-" + System.nanoTime();
        multiplexer.notify(endpoint, marker, null);
        try {
            server(instance.id()).awaitMethod(marker);
        } catch (TimeoutException e) {
            throw new AssertionError("Server " + instance.id() + " never saw the marker", e);
        }
    }

    @Override
    public void close() {
        for (var instance : instances.all()) {
            var endpoint = instance.endpoint();
            if (endpoint != null) {
                endpoint.close(new ServerTerminatedException(instance.id(), "fixture closed", null));
            }
        }
        for (var server : servers.values()) {
            server.process().crash(0);
        }
    }
}
