package ai.lspgateway;

/** Base of the caller-facing failures raised by the gateway. None of them is fatal to the hosting process. */
public class GatewayException extends Exception {
    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
