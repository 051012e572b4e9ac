package ai.lspgateway.instance;

import java.util.Locale;

/**
 * Lifecycle of a server instance.
 *
 * <pre>
 * STARTING -> INITIALIZING -> READY -> DRAINING -> TERMINATED
 *     \____________\____________\_________\______-> FAILED
 * </pre>
 */
public enum ServerState {
    STARTING,
    INITIALIZING,
    READY,
    DRAINING,
    TERMINATED,
    FAILED;

    public boolean isTerminal() {
        return this == TERMINATED || this == FAILED;
    }

    public boolean canTransitionTo(ServerState next) {
        if (next == FAILED) {
            return !isTerminal();
        }
        return switch (this) {
            case STARTING -> next == INITIALIZING;
            case INITIALIZING -> next == READY;
            case READY -> next == DRAINING;
            case DRAINING -> next == TERMINATED;
            case TERMINATED, FAILED -> false;
        };
    }

    /** Lower-case name as reported to clients. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
