package ai.lspgateway;

/** The descriptor's launch command does not resolve to an executable file. Raised before anything is spawned. */
public final class ExecutableNotFoundException extends GatewayException {
    private final String command;

    public ExecutableNotFoundException(String command) {
        super("Language server executable not found: " + command);
        this.command = command;
    }

    public String command() {
        return command;
    }
}
