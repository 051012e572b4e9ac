package ai.lspgateway.process;

import ai.lspgateway.ExecutableNotFoundException;
import ai.lspgateway.ServerStartException;
import ai.lspgateway.config.ServerDescriptor;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Owns the OS side of server instances: spawning, writing to stdin, draining stderr and terminating. Knows nothing
 * about the protocol spoken on the pipes.
 */
public final class ProcessSupervisor {
    private static final Logger logger = LogManager.getLogger(ProcessSupervisor.class);

    private final ProcessLauncher launcher;

    public ProcessSupervisor(ProcessLauncher launcher) {
        this.launcher = launcher;
    }

    public boolean isExecutableAvailable(ServerDescriptor descriptor) {
        return launcher.isExecutable(descriptor.command());
    }

    /**
     * Spawn the server described by {@code descriptor} with {@code workspaceRoot} as its working directory.
     *
     * @param instanceId used to name the stderr drain thread and prefix its log lines
     * @throws ExecutableNotFoundException if the command does not resolve; nothing is spawned in that case
     * @throws ServerStartException if the process could not be started
     */
    public ServerProcess spawn(ServerDescriptor descriptor, Path workspaceRoot, String instanceId)
            throws ExecutableNotFoundException, ServerStartException {
        if (!launcher.isExecutable(descriptor.command())) {
            throw new ExecutableNotFoundException(descriptor.command());
        }

        ServerProcess process;
        try {
            process = launcher.launch(descriptor.commandLine(), workspaceRoot);
        } catch (IOException e) {
            throw new ServerStartException("Failed to start " + descriptor.name() + " for " + instanceId, e);
        }
        logger.info(
                "Started {} for {} (pid={}, cwd={})", descriptor.command(), instanceId, process.pid(), workspaceRoot);

        drainStderr(process, instanceId);
        return process;
    }

    /**
     * Best-effort write to the server's stdin. Does nothing once the process has exited, so writes racing a
     * teardown are harmless.
     *
     * @throws UncheckedIOException if the write fails while the process is still alive
     */
    public void write(ServerProcess process, byte[] bytes) {
        if (!process.isAlive()) {
            logger.debug("Skipping write of {} bytes to exited process {}", bytes.length, process.pid());
            return;
        }
        try {
            var stdin = process.stdin();
            stdin.write(bytes);
            stdin.flush();
        } catch (IOException e) {
            if (!process.isAlive()) {
                logger.debug("Write to process {} raced its exit: {}", process.pid(), e.getMessage());
                return;
            }
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Ask the process to terminate, and kill it if it is still running after {@code grace}.
     *
     * @return the process's single exit future
     */
    public CompletableFuture<Integer> terminate(ServerProcess process, Duration grace) {
        process.destroy();
        try {
            process.onExit().get(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Process {} did not terminate within {} ms, forcing kill", process.pid(), grace.toMillis());
            process.destroyForcibly();
        } catch (ExecutionException e) {
            logger.debug("Exit of process {} completed exceptionally", process.pid(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for process {} to terminate, forcing kill", process.pid());
            process.destroyForcibly();
        }
        return process.onExit();
    }

    private void drainStderr(ServerProcess process, String instanceId) {
        var stderrReader = new Thread(
                () -> {
                    try (var reader = new BufferedReader(
                            new InputStreamReader(process.stderr(), StandardCharsets.UTF_8))) {
                        reader.lines().forEach(line -> logger.debug("[lsp:{}:stderr] {}", instanceId, line));
                    } catch (IOException | UncheckedIOException e) {
                        logger.debug("stderr of {} closed: {}", instanceId, e.getMessage());
                    }
                },
                "lsp-" + instanceId + "-stderr");
        stderrReader.setDaemon(true);
        stderrReader.start();
    }
}
