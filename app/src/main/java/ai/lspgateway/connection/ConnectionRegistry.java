package ai.lspgateway.connection;

import ai.lspgateway.ServerNotFoundException;
import ai.lspgateway.ServerNotReadyException;
import ai.lspgateway.instance.InstanceRegistry;
import ai.lspgateway.instance.ServerInstance;
import ai.lspgateway.instance.ServerState;
import ai.lspgateway.rpc.LspMethods;
import ai.lspgateway.rpc.ProtocolMultiplexer;
import ai.lspgateway.rpc.RpcMessage;
import ai.lspgateway.rpc.TextDocumentParams;
import com.google.gson.JsonObject;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Connections by id, and the fan-out of server notifications to them. Compound mutations are serialized on the
 * registry; document state is only touched on the owning instance's lane.
 */
public final class ConnectionRegistry {
    private static final Logger logger = LogManager.getLogger(ConnectionRegistry.class);

    private final InstanceRegistry instances;
    private final ProtocolMultiplexer multiplexer;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    public ConnectionRegistry(InstanceRegistry instances, ProtocolMultiplexer multiplexer) {
        this.instances = instances;
        this.multiplexer = multiplexer;
    }

    /**
     * Attaches {@code channel} to a ready instance. Creating the same (instance, channel) pair again returns the
     * existing connection.
     */
    public Connection create(String instanceId, ClientChannel channel, Path workspaceRoot)
            throws ServerNotFoundException, ServerNotReadyException {
        var instance = instances.get(instanceId).orElseThrow(() -> new ServerNotFoundException(instanceId));
        synchronized (this) {
            var state = instance.state();
            if (state != ServerState.READY) {
                throw new ServerNotReadyException(instanceId, state.label());
            }
            var id = Connection.idFor(instanceId, channel.id());
            var existing = connections.get(id);
            if (existing != null) {
                logger.debug("Connection {} already exists", id);
                return existing;
            }
            var connection = new Connection(instance, channel, workspaceRoot);
            connections.put(id, connection);
            instance.connectionIds().add(id);
            logger.info(
                    "Connected {} to {} ({} connections)", channel.id(), instanceId, instance.connectionIds().size());
            return connection;
        }
    }

    /**
     * Detaches a connection. Documents it had open that no other connection to the same instance holds are closed
     * on the server.
     *
     * @return whether the connection existed
     */
    public boolean remove(String connectionId) {
        Connection connection;
        synchronized (this) {
            connection = connections.remove(connectionId);
            if (connection == null) {
                return false;
            }
            connection.instance().connectionIds().remove(connectionId);
        }
        logger.info("Disconnected {} from {}", connectionId, connection.instanceId());

        var instance = connection.instance();
        var endpoint = instance.endpoint();
        var uris = List.copyOf(connection.openDocuments());
        if (endpoint != null && !uris.isEmpty()) {
            endpoint.submit(() -> {
                for (var uri : uris) {
                    closeIfUnreferenced(instance, uri);
                }
            });
        }
        return true;
    }

    /**
     * Removes every connection held by {@code channelId}, as when a client goes away.
     *
     * @return the number of connections removed
     */
    public int removeChannel(String channelId) {
        int removed = 0;
        for (var connectionId : connectionsForChannel(channelId)) {
            if (remove(connectionId)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Detaches every connection of a terminated instance without notifying the server, and tells each attached
     * channel once that the server is gone.
     */
    public void forceRemoveAll(ServerInstance instance, @Nullable Integer exitCode) {
        List<Connection> removed = new ArrayList<>();
        synchronized (this) {
            for (var connectionId : List.copyOf(instance.connectionIds())) {
                var connection = connections.remove(connectionId);
                if (connection != null) {
                    removed.add(connection);
                }
            }
            instance.connectionIds().clear();
        }
        if (removed.isEmpty()) {
            return;
        }
        logger.info("Dropped {} connections of {}", removed.size(), instance.id());

        var channels = new LinkedHashMap<String, ClientChannel>();
        for (var connection : removed) {
            channels.putIfAbsent(connection.channel().id(), connection.channel());
        }
        var payload = ClientEvents.serverExit(instance.id(), exitCode);
        for (var channel : channels.values()) {
            emit(channel, ClientEvents.SERVER_EXIT, payload.deepCopy());
        }
    }

    public Optional<Connection> get(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public List<Connection> listForInstance(String instanceId) {
        return connections.values().stream()
                .filter(connection -> connection.instanceId().equals(instanceId))
                .toList();
    }

    public List<String> connectionsForChannel(String channelId) {
        return connections.values().stream()
                .filter(connection -> connection.channel().id().equals(channelId))
                .map(Connection::id)
                .sorted()
                .toList();
    }

    private boolean isHeldOpen(ServerInstance instance, String uri) {
        return listForInstance(instance.id()).stream()
                .anyMatch(connection -> connection.openDocuments().contains(uri));
    }

    /**
     * Sends didClose for {@code uri} unless another connection still has it open. Must run on the instance's lane.
     *
     * @return whether didClose was sent
     */
    public boolean closeIfUnreferenced(ServerInstance instance, String uri) {
        if (isHeldOpen(instance, uri)) {
            logger.debug("Keeping {} open on {}: still referenced", uri, instance.id());
            return false;
        }
        instance.openDocuments().remove(uri);
        var endpoint = instance.endpoint();
        if (endpoint == null || instance.state() != ServerState.READY) {
            return false;
        }
        multiplexer.notify(endpoint, LspMethods.DID_CLOSE, TextDocumentParams.didClose(uri));
        return true;
    }

    /**
     * Fans a server notification out to the instance's connections. Diagnostics go only to connections that have
     * the document open, or to every connection when none has. Runs on the instance's lane.
     */
    public void deliver(ServerInstance instance, RpcMessage.Notification notification) {
        var targets = listForInstance(instance.id());
        if (targets.isEmpty()) {
            logger.trace("No connections on {} for {}", instance.id(), notification.method());
            return;
        }
        var params = notification.params();
        if (LspMethods.PUBLISH_DIAGNOSTICS.equals(notification.method()) && params != null) {
            var uri = TextDocumentParams.uriOf(params);
            if (uri.isPresent()) {
                var interested = targets.stream()
                        .filter(connection -> connection.openDocuments().contains(uri.get()))
                        .toList();
                if (!interested.isEmpty()) {
                    targets = interested;
                }
            }
        }
        var payload = ClientEvents.message(instance.id(), notification);
        for (var connection : targets) {
            emit(connection.channel(), ClientEvents.MESSAGE, payload.deepCopy());
        }
    }

    private static void emit(ClientChannel channel, String event, JsonObject payload) {
        try {
            channel.emit(event, payload);
        } catch (RuntimeException e) {
            logger.warn("Channel {} failed to accept {}", channel.id(), event, e);
        }
    }
}
