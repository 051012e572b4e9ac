package ai.lspgateway;

public final class ServerNotFoundException extends GatewayException {
    public ServerNotFoundException(String serverId) {
        super("LSP server not found: " + serverId);
    }
}
