package ai.lspgateway;

/** The instance exists but is not in a state that accepts the operation. */
public final class ServerNotReadyException extends GatewayException {
    public ServerNotReadyException(String serverId, String state) {
        super("LSP server not ready: " + serverId + " (" + state + ")");
    }
}
