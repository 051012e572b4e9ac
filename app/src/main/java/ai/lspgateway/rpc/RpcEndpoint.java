package ai.lspgateway.rpc;

import ai.lspgateway.process.ServerProcess;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Protocol state of one server instance: its process, id generator, in-flight requests and the single ordered lane
 * on which inbound messages and document state changes are processed.
 */
public final class RpcEndpoint {
    private static final Logger logger = LogManager.getLogger(RpcEndpoint.class);

    private final String instanceId;
    private final ServerProcess process;
    private final Path workspaceRoot;
    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<Long, PendingRequest> pending = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private final ExecutorService lane;
    private volatile boolean closed;

    public RpcEndpoint(String instanceId, ServerProcess process, Path workspaceRoot) {
        this.instanceId = instanceId;
        this.process = process;
        this.workspaceRoot = workspaceRoot;
        this.lane = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "lsp-" + instanceId + "-lane");
            t.setDaemon(true);
            return t;
        });
    }

    public String instanceId() {
        return instanceId;
    }

    public ServerProcess process() {
        return process;
    }

    public Path workspaceRoot() {
        return workspaceRoot;
    }

    public boolean isWritable() {
        return !closed && process.isAlive();
    }

    public boolean isClosed() {
        return closed;
    }

    public int pendingCount() {
        return pending.size();
    }

    /** Runs {@code task} on this endpoint's lane after everything already scheduled. */
    public boolean submit(Runnable task) {
        try {
            lane.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            logger.debug("Lane of {} is closed, dropping task", instanceId);
            return false;
        }
    }

    /** Like {@link #submit} but yields the task's result; completes with {@code whenClosed} if the lane is gone. */
    public <T> CompletableFuture<T> supply(Supplier<T> task, T whenClosed) {
        var future = new CompletableFuture<T>();
        var scheduled = submit(() -> {
            try {
                future.complete(task.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        if (!scheduled) {
            future.complete(whenClosed);
        }
        return future;
    }

    Object writeLock() {
        return writeLock;
    }

    long allocateId() {
        return nextId.getAndIncrement();
    }

    void register(PendingRequest request) {
        pending.put(request.id(), request);
    }

    @Nullable
    PendingRequest take(RpcId id) {
        var numeric = id.asLong();
        return numeric.isPresent() ? pending.remove(numeric.getAsLong()) : null;
    }

    void forget(long id) {
        pending.remove(id);
    }

    /**
     * Stops accepting work and fails every in-flight request with {@code cause}. Tasks already on the lane still
     * run; the lane thread exits afterwards.
     */
    public void close(Throwable cause) {
        List<PendingRequest> failed;
        // under the write lock so no request registers after the drain
        synchronized (writeLock) {
            closed = true;
            failed = new ArrayList<>(pending.values());
            pending.clear();
        }
        for (var request : failed) {
            request.future().completeExceptionally(cause);
        }
        if (!failed.isEmpty()) {
            logger.debug("Failed {} pending requests of {}: {}", failed.size(), instanceId, cause.getMessage());
        }
        lane.shutdown();
    }
}
