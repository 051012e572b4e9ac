package ai.lspgateway;

/** Whether the server configured for {@code language} is installed. */
public record ExecutableCheck(String language, String serverName, String command, boolean available) {}
