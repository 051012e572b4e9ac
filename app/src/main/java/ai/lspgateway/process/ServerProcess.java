package ai.lspgateway.process;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/** A running language server process with piped stdio. */
public interface ServerProcess {

    long pid();

    /** The server's stdin. */
    OutputStream stdin();

    /** The server's stdout, carrying protocol messages. */
    InputStream stdout();

    /** The server's stderr, for diagnostics only. */
    InputStream stderr();

    boolean isAlive();

    /** Polite termination request (SIGTERM on POSIX). */
    void destroy();

    void destroyForcibly();

    /** Completes exactly once, with the exit code, when the process has exited. */
    CompletableFuture<Integer> onExit();
}
