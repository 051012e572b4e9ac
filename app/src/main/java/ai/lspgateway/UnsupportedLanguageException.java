package ai.lspgateway;

/** No server descriptor claims the requested language id. */
public final class UnsupportedLanguageException extends GatewayException {
    private final String languageId;

    public UnsupportedLanguageException(String languageId) {
        super("No LSP server configuration found for language: " + languageId);
        this.languageId = languageId;
    }

    public String languageId() {
        return languageId;
    }
}
