package ai.lspgateway;

/**
 * Status of one live server instance as reported to clients.
 *
 * @param status lower-case lifecycle state, e.g. {@code ready}
 * @param connections number of attached connections
 */
public record ActiveServer(String serverId, String name, String status, int connections) {}
