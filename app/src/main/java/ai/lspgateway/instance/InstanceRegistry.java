package ai.lspgateway.instance;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Live server instances by id. Mutations are serialized; lookups are lock-free. */
public final class InstanceRegistry {
    private final Map<String, ServerInstance> instances = new ConcurrentHashMap<>();

    public synchronized void register(ServerInstance instance) {
        var previous = instances.putIfAbsent(instance.id(), instance);
        if (previous != null) {
            throw new IllegalStateException("Instance id already registered: " + instance.id());
        }
    }

    public synchronized boolean remove(ServerInstance instance) {
        return instances.remove(instance.id(), instance);
    }

    public Optional<ServerInstance> get(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    /** A ready instance serving {@code languageId} for {@code workspaceRoot}, if one exists. */
    public Optional<ServerInstance> findReady(String languageId, Path workspaceRoot) {
        return instances.values().stream()
                .filter(instance -> instance.state() == ServerState.READY)
                .filter(instance -> instance.languageId().equals(languageId))
                .filter(instance -> instance.workspaceRoot().equals(workspaceRoot))
                .findFirst();
    }

    /** Snapshot ordered by id, which orders by server name then creation time. */
    public List<ServerInstance> all() {
        return instances.values().stream()
                .sorted((a, b) -> a.id().compareTo(b.id()))
                .toList();
    }

    public boolean isEmpty() {
        return instances.isEmpty();
    }
}
