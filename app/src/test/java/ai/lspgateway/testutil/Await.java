package ai.lspgateway.testutil;

import java.time.Duration;
import java.util.function.BooleanSupplier;

public final class Await {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private Await() {}

    /** Polls {@code condition} until it holds, failing the test with {@code description} after the default timeout. */
    public static void until(String description, BooleanSupplier condition) {
        long deadline = System.nanoTime() + DEFAULT_TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Timed out waiting for " + description);
            }
            pause();
        }
    }

    static void pause() {
        try {
            Thread.sleep(10);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted", e);
        }
    }
}
