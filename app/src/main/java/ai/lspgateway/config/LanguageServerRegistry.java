package ai.lspgateway.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Static mapping from language ids (primary names and aliases) to {@link ServerDescriptor}s.
 *
 * <p>Descriptors come from {@code lsp-servers.json}: the file named by {@link GatewayConfig#serversFile()} when set,
 * otherwise the classpath resource, otherwise the built-in defaults.
 */
public final class LanguageServerRegistry {
    private static final Logger logger = LogManager.getLogger(LanguageServerRegistry.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String RESOURCE = "lsp-servers.json";

    private final Map<String, ServerDescriptor> byPrimaryName;

    public LanguageServerRegistry(Collection<ServerDescriptor> descriptors) {
        var map = new LinkedHashMap<String, ServerDescriptor>();
        for (var descriptor : descriptors) {
            var previous = map.putIfAbsent(descriptor.primaryName(), descriptor);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate language server key: " + descriptor.primaryName());
            }
        }
        this.byPrimaryName = Collections.unmodifiableMap(map);
    }

    public static LanguageServerRegistry load(GatewayConfig config) {
        var serversFile = config.serversFile();
        if (serversFile != null) {
            try (var in = Files.newInputStream(serversFile)) {
                var descriptors = parse(in);
                logger.info("Loaded {} language server definitions from {}", descriptors.size(), serversFile);
                return new LanguageServerRegistry(descriptors);
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("Failed to load language servers from {}: {}", serversFile, e.getMessage());
            }
        }
        try (var in = LanguageServerRegistry.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                return new LanguageServerRegistry(parse(in));
            }
            logger.debug("No {} on the classpath, using built-in language servers", RESOURCE);
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Failed to load {} from the classpath: {}", RESOURCE, e.getMessage());
        }
        return new LanguageServerRegistry(defaults());
    }

    /**
     * Parses the {@code {"servers": {"<primaryName>": {...}}}} document. Entries with {@code "enabled": false} are
     * skipped.
     */
    static List<ServerDescriptor> parse(InputStream in) throws IOException {
        var file = objectMapper.readValue(in, ServersFile.class);
        if (file.servers() == null) {
            throw new IOException("Missing 'servers' object");
        }
        var descriptors = new ArrayList<ServerDescriptor>();
        for (var entry : file.servers().entrySet()) {
            var server = entry.getValue();
            if (Boolean.FALSE.equals(server.enabled())) {
                logger.debug("Language server {} is disabled", entry.getKey());
                continue;
            }
            if (server.command() == null) {
                throw new IOException("Language server " + entry.getKey() + " has no command");
            }
            descriptors.add(new ServerDescriptor(
                    entry.getKey(),
                    server.name() == null ? entry.getKey() : server.name(),
                    server.command(),
                    server.args() == null ? List.of() : server.args(),
                    server.languages() == null ? Set.of() : Set.copyOf(server.languages())));
        }
        return descriptors;
    }

    static List<ServerDescriptor> defaults() {
        return List.of(
                new ServerDescriptor(
                        "typescript",
                        "typescript-language-server",
                        "typescript-language-server",
                        List.of("--stdio"),
                        Set.of("typescript", "javascript", "typescriptreact", "javascriptreact")),
                new ServerDescriptor("python", "python-lsp-server", "pylsp", List.of(), Set.of("python")),
                new ServerDescriptor("java", "eclipse-jdt-ls", "jdtls", List.of(), Set.of("java")),
                new ServerDescriptor("go", "gopls", "gopls", List.of("serve"), Set.of("go")),
                new ServerDescriptor("rust", "rust-analyzer", "rust-analyzer", List.of(), Set.of("rust")),
                new ServerDescriptor(
                        "cpp", "clangd", "clangd", List.of("--background-index"), Set.of("c", "cpp", "objective-c")));
    }

    /** Every primary name and alias, sorted. */
    public SortedSet<String> getSupportedLanguages() {
        var languages = new TreeSet<String>();
        for (var descriptor : byPrimaryName.values()) {
            languages.addAll(descriptor.languages());
        }
        return Collections.unmodifiableSortedSet(languages);
    }

    /**
     * Finds the descriptor serving {@code languageId}. A primary-name match wins over an alias match; the first
     * descriptor (in definition order) declaring the alias wins among aliases.
     */
    public Optional<ServerDescriptor> getServerConfig(@Nullable String languageId) {
        if (languageId == null || languageId.isBlank()) {
            return Optional.empty();
        }
        var primary = byPrimaryName.get(languageId);
        if (primary != null) {
            return Optional.of(primary);
        }
        return byPrimaryName.values().stream()
                .filter(descriptor -> descriptor.serves(languageId))
                .findFirst();
    }

    public Collection<ServerDescriptor> descriptors() {
        return byPrimaryName.values();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ServersFile(@Nullable Map<String, ServerEntry> servers) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ServerEntry(
            @Nullable String name,
            @Nullable Boolean enabled,
            @Nullable String command,
            @Nullable List<String> args,
            @Nullable List<String> languages) {}
}
