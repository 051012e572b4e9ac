package ai.lspgateway.testutil;

import ai.lspgateway.process.ServerProcess;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** A {@link ServerProcess} whose stdio are in-memory pipes. Exit codes follow the POSIX signal convention. */
public final class FakeServerProcess implements ServerProcess {
    private static final AtomicLong nextPid = new AtomicLong(40_000);

    private final long pid = nextPid.incrementAndGet();
    private final List<String> command;
    private final Path workingDirectory;
    private final BytePipe stdin = new BytePipe();
    private final BytePipe stdout = new BytePipe();
    private final BytePipe stderr = new BytePipe();
    private final CompletableFuture<Integer> exit = new CompletableFuture<>();
    private final AtomicInteger politeSignals = new AtomicInteger();
    private final AtomicInteger forcedKills = new AtomicInteger();
    private volatile boolean ignorePoliteSignal;

    public FakeServerProcess(List<String> command, Path workingDirectory) {
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
    }

    public List<String> command() {
        return command;
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    /** What the server reads: everything the gateway wrote to stdin. */
    public InputStream serverInput() {
        return stdin.input();
    }

    /** Where the server writes protocol output. */
    public OutputStream serverOutput() {
        return stdout.output();
    }

    public OutputStream serverError() {
        return stderr.output();
    }

    /** Makes {@link #destroy()} a no-op apart from being counted, like a server that traps SIGTERM. */
    public void ignorePoliteSignal() {
        this.ignorePoliteSignal = true;
    }

    public int politeSignals() {
        return politeSignals.get();
    }

    public int forcedKills() {
        return forcedKills.get();
    }

    /** Exits on its own, as a crashing server does. */
    public void crash(int exitCode) {
        exit(exitCode);
    }

    @Override
    public long pid() {
        return pid;
    }

    @Override
    public OutputStream stdin() {
        return stdin.output();
    }

    @Override
    public InputStream stdout() {
        return stdout.input();
    }

    @Override
    public InputStream stderr() {
        return stderr.input();
    }

    @Override
    public boolean isAlive() {
        return !exit.isDone();
    }

    @Override
    public void destroy() {
        politeSignals.incrementAndGet();
        if (!ignorePoliteSignal) {
            exit(143);
        }
    }

    @Override
    public void destroyForcibly() {
        forcedKills.incrementAndGet();
        exit(137);
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return exit;
    }

    private synchronized void exit(int exitCode) {
        if (exit.isDone()) {
            return;
        }
        stdin.close();
        stdout.close();
        stderr.close();
        exit.complete(exitCode);
    }
}
