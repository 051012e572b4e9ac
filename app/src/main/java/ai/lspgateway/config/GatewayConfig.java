package ai.lspgateway.config;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Gateway tunables, read from the classpath resource {@value #RESOURCE}. Every key can be overridden by a JVM
 * system property of the same name.
 */
public record GatewayConfig(
        Duration startupTimeout,
        Duration shutdownTimeout,
        Duration terminateGrace,
        FramingMode framing,
        @Nullable Path serversFile,
        String clientName) {

    private static final Logger logger = LogManager.getLogger(GatewayConfig.class);

    public static final String RESOURCE = "lsp-gateway.properties";

    public static final String STARTUP_TIMEOUT_KEY = "lspgateway.startupTimeoutMs";
    public static final String SHUTDOWN_TIMEOUT_KEY = "lspgateway.shutdownTimeoutMs";
    public static final String TERMINATE_GRACE_KEY = "lspgateway.terminateGraceMs";
    public static final String FRAMING_KEY = "lspgateway.framing";
    public static final String SERVERS_FILE_KEY = "lspgateway.serversFile";
    public static final String CLIENT_NAME_KEY = "lspgateway.clientName";

    private static final List<String> KEYS = List.of(
            STARTUP_TIMEOUT_KEY,
            SHUTDOWN_TIMEOUT_KEY,
            TERMINATE_GRACE_KEY,
            FRAMING_KEY,
            SERVERS_FILE_KEY,
            CLIENT_NAME_KEY);

    private static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_TERMINATE_GRACE = Duration.ofSeconds(5);
    private static final String DEFAULT_CLIENT_NAME = "lsp-gateway";

    public GatewayConfig {
        Objects.requireNonNull(startupTimeout, "startupTimeout");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        Objects.requireNonNull(terminateGrace, "terminateGrace");
        Objects.requireNonNull(framing, "framing");
        Objects.requireNonNull(clientName, "clientName");
    }

    public static GatewayConfig defaults() {
        return new GatewayConfig(
                DEFAULT_STARTUP_TIMEOUT,
                DEFAULT_SHUTDOWN_TIMEOUT,
                DEFAULT_TERMINATE_GRACE,
                FramingMode.CONTENT_LENGTH,
                null,
                DEFAULT_CLIENT_NAME);
    }

    /** Loads {@value #RESOURCE} from the classpath (if present) and applies system property overrides. */
    public static GatewayConfig load() {
        var props = new Properties();
        try (var in = GatewayConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.debug("No {} on the classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", RESOURCE, e.getMessage());
        }
        for (var key : KEYS) {
            var override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    public static GatewayConfig fromProperties(Properties props) {
        var defaults = defaults();
        var framing = defaults.framing();
        var rawFraming = props.getProperty(FRAMING_KEY);
        if (rawFraming != null && !rawFraming.isBlank()) {
            framing = FramingMode.parse(rawFraming).orElseGet(() -> {
                logger.warn("Unknown framing '{}' for {}, using {}", rawFraming, FRAMING_KEY, defaults.framing().key());
                return defaults.framing();
            });
        }
        var rawServersFile = props.getProperty(SERVERS_FILE_KEY);
        Path serversFile = rawServersFile == null || rawServersFile.isBlank() ? null : Path.of(rawServersFile.trim());
        var clientName = props.getProperty(CLIENT_NAME_KEY, defaults.clientName()).trim();

        return new GatewayConfig(
                millis(props, STARTUP_TIMEOUT_KEY, defaults.startupTimeout()),
                millis(props, SHUTDOWN_TIMEOUT_KEY, defaults.shutdownTimeout()),
                millis(props, TERMINATE_GRACE_KEY, defaults.terminateGrace()),
                framing,
                serversFile,
                clientName.isEmpty() ? defaults.clientName() : clientName);
    }

    private static Duration millis(Properties props, String key, Duration fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value <= 0) {
                logger.warn("{} must be > 0 (was {}), using {} ms", key, value, fallback.toMillis());
                return fallback;
            }
            return Duration.ofMillis(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid value '{}' for {}, using {} ms", raw, key, fallback.toMillis());
            return fallback;
        }
    }

    public GatewayConfig withStartupTimeout(Duration timeout) {
        return new GatewayConfig(timeout, shutdownTimeout, terminateGrace, framing, serversFile, clientName);
    }

    public GatewayConfig withShutdownTimeout(Duration timeout) {
        return new GatewayConfig(startupTimeout, timeout, terminateGrace, framing, serversFile, clientName);
    }

    public GatewayConfig withTerminateGrace(Duration grace) {
        return new GatewayConfig(startupTimeout, shutdownTimeout, grace, framing, serversFile, clientName);
    }

    public GatewayConfig withFraming(FramingMode mode) {
        return new GatewayConfig(startupTimeout, shutdownTimeout, terminateGrace, mode, serversFile, clientName);
    }
}
