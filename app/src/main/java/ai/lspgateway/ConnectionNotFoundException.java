package ai.lspgateway;

public final class ConnectionNotFoundException extends GatewayException {
    public ConnectionNotFoundException(String connectionId) {
        super("LSP connection not found: " + connectionId);
    }
}
