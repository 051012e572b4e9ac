package ai.lspgateway.rpc;

/** A framed record that is not a valid JSON-RPC 2.0 message. */
public final class MalformedMessageException extends Exception {
    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
