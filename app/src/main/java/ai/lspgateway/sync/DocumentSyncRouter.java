package ai.lspgateway.sync;

import ai.lspgateway.ConnectionNotFoundException;
import ai.lspgateway.connection.Connection;
import ai.lspgateway.connection.ConnectionRegistry;
import ai.lspgateway.instance.InstanceRegistry;
import ai.lspgateway.instance.ServerInstance;
import ai.lspgateway.instance.ServerState;
import ai.lspgateway.rpc.LspMethods;
import ai.lspgateway.rpc.ProtocolMultiplexer;
import ai.lspgateway.rpc.RpcEndpoint;
import ai.lspgateway.rpc.TextDocumentParams;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiPredicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns editor open/change/close events into {@code textDocument/did*} notifications.
 *
 * <p>Every operation is queued on the instance's lane, so document versions are checked and updated in the same
 * order the notifications reach the server. The returned futures complete with {@code true} when a notification
 * was sent and {@code false} when the event was dropped: unknown or not-ready instance, stale version, or a close
 * that another connection still holds open.
 */
public final class DocumentSyncRouter {
    private static final Logger logger = LogManager.getLogger(DocumentSyncRouter.class);

    private final InstanceRegistry instances;
    private final ConnectionRegistry connections;
    private final ProtocolMultiplexer multiplexer;

    public DocumentSyncRouter(
            InstanceRegistry instances, ConnectionRegistry connections, ProtocolMultiplexer multiplexer) {
        this.instances = instances;
        this.connections = connections;
        this.multiplexer = multiplexer;
    }

    public CompletableFuture<Boolean> open(String instanceId, DocumentOpen event) {
        return onLane(instanceId, "open " + event.uri(), (instance, endpoint) -> doOpen(instance, endpoint, event));
    }

    public CompletableFuture<Boolean> change(String instanceId, DocumentChange event) {
        return onLane(
                instanceId, "change " + event.uri(), (instance, endpoint) -> doChange(instance, endpoint, event));
    }

    public CompletableFuture<Boolean> close(String instanceId, DocumentClose event) {
        return onLane(
                instanceId,
                "close " + event.uri(),
                (instance, endpoint) -> connections.closeIfUnreferenced(instance, event.uri()));
    }

    /** Opens on behalf of a connection, which then receives the document's diagnostics. */
    public CompletableFuture<Boolean> openFor(String connectionId, DocumentOpen event)
            throws ConnectionNotFoundException {
        var connection = connection(connectionId);
        return onLane(connection.instanceId(), "open " + event.uri(), (instance, endpoint) -> {
            if (!isAttached(connection)) {
                logger.debug("Ignoring open of {}: connection {} was removed", event.uri(), connectionId);
                return false;
            }
            connection.openDocuments().add(event.uri());
            return doOpen(instance, endpoint, event);
        });
    }

    public CompletableFuture<Boolean> changeFor(String connectionId, DocumentChange event)
            throws ConnectionNotFoundException {
        return change(connection(connectionId).instanceId(), event);
    }

    /** Closes on behalf of a connection; the server only sees didClose once no connection holds the document. */
    public CompletableFuture<Boolean> closeFor(String connectionId, DocumentClose event)
            throws ConnectionNotFoundException {
        var connection = connection(connectionId);
        return onLane(connection.instanceId(), "close " + event.uri(), (instance, endpoint) -> {
            if (!isAttached(connection)) {
                logger.debug("Ignoring close of {}: connection {} was removed", event.uri(), connectionId);
                return false;
            }
            connection.openDocuments().remove(event.uri());
            return connections.closeIfUnreferenced(instance, event.uri());
        });
    }

    private boolean doOpen(ServerInstance instance, RpcEndpoint endpoint, DocumentOpen event) {
        var documents = instance.openDocuments();
        var current = documents.get(event.uri());
        if (current != null && event.version() <= current) {
            logger.debug(
                    "Ignoring reopen of {} on {} at version {} (open at {})",
                    event.uri(),
                    instance.id(),
                    event.version(),
                    current);
            return false;
        }
        documents.put(event.uri(), event.version());
        multiplexer.notify(
                endpoint,
                LspMethods.DID_OPEN,
                TextDocumentParams.didOpen(event.uri(), event.languageId(), event.version(), event.text()));
        return true;
    }

    private boolean doChange(ServerInstance instance, RpcEndpoint endpoint, DocumentChange event) {
        var documents = instance.openDocuments();
        var current = documents.get(event.uri());
        if (current == null) {
            logger.debug("Ignoring change to {} on {}: not open", event.uri(), instance.id());
            return false;
        }
        if (event.version() <= current) {
            logger.debug(
                    "Dropping stale change to {} on {}: version {} <= {}",
                    event.uri(),
                    instance.id(),
                    event.version(),
                    current);
            return false;
        }
        documents.put(event.uri(), event.version());
        multiplexer.notify(
                endpoint,
                LspMethods.DID_CHANGE,
                TextDocumentParams.didChange(event.uri(), event.version(), event.contentChanges()));
        return true;
    }

    private CompletableFuture<Boolean> onLane(
            String instanceId, String what, BiPredicate<ServerInstance, RpcEndpoint> action) {
        var instance = instances.get(instanceId).orElse(null);
        if (instance == null) {
            logger.debug("Ignoring {}: unknown server {}", what, instanceId);
            return CompletableFuture.completedFuture(false);
        }
        var endpoint = instance.endpoint();
        if (endpoint == null || instance.state() != ServerState.READY) {
            logger.debug("Ignoring {}: server {} is {}", what, instanceId, instance.state().label());
            return CompletableFuture.completedFuture(false);
        }
        return endpoint.supply(
                () -> {
                    // the instance may have left READY while this was queued
                    if (instance.state() != ServerState.READY) {
                        return false;
                    }
                    return action.test(instance, endpoint);
                },
                false);
    }

    /** Whether {@code connection} is still registered; a queued task may outlive its removal. */
    private boolean isAttached(Connection connection) {
        return connections.get(connection.id()).orElse(null) == connection;
    }

    private Connection connection(String connectionId) throws ConnectionNotFoundException {
        return connections.get(connectionId).orElseThrow(() -> new ConnectionNotFoundException(connectionId));
    }
}
