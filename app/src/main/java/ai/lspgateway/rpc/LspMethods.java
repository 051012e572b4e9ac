package ai.lspgateway.rpc;

/** Protocol method names the gateway originates or inspects. */
public final class LspMethods {
    public static final String INITIALIZE = "initialize";
    public static final String INITIALIZED = "initialized";
    public static final String SHUTDOWN = "shutdown";
    public static final String EXIT = "exit";

    public static final String DID_OPEN = "textDocument/didOpen";
    public static final String DID_CHANGE = "textDocument/didChange";
    public static final String DID_CLOSE = "textDocument/didClose";
    public static final String PUBLISH_DIAGNOSTICS = "textDocument/publishDiagnostics";

    public static final String LOG_MESSAGE = "window/logMessage";
    public static final String SHOW_MESSAGE = "window/showMessage";
    public static final String WORK_DONE_PROGRESS_CREATE = "window/workDoneProgress/create";
    public static final String REGISTER_CAPABILITY = "client/registerCapability";
    public static final String UNREGISTER_CAPABILITY = "client/unregisterCapability";
    public static final String CONFIGURATION = "workspace/configuration";
    public static final String WORKSPACE_FOLDERS = "workspace/workspaceFolders";

    private LspMethods() {}
}
