package ai.lspgateway;

/** The server process could not be spawned or did not complete the initialize handshake. */
public final class ServerStartException extends GatewayException {
    public ServerStartException(String message) {
        super(message);
    }

    public ServerStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
