package ai.lspgateway.connection;

import ai.lspgateway.instance.ServerInstance;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Attachment of one client channel to one server instance.
 *
 * @param openDocuments uris this connection has open; scopes diagnostics and the didClose sent when it detaches
 */
public record Connection(
        String id, ServerInstance instance, ClientChannel channel, Path workspaceRoot, Set<String> openDocuments) {

    Connection(ServerInstance instance, ClientChannel channel, Path workspaceRoot) {
        this(idFor(instance.id(), channel.id()), instance, channel, workspaceRoot, ConcurrentHashMap.newKeySet());
    }

    public static String idFor(String instanceId, String channelId) {
        return instanceId + "-" + channelId;
    }

    public String instanceId() {
        return instance.id();
    }
}
