package ai.lspgateway.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class GatewayConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(GatewayConfig.STARTUP_TIMEOUT_KEY);
        System.clearProperty(GatewayConfig.FRAMING_KEY);
    }

    @Test
    void emptyPropertiesYieldDefaults() {
        assertEquals(GatewayConfig.defaults(), GatewayConfig.fromProperties(new Properties()));
    }

    @Test
    void parsesEveryKey() {
        var props = new Properties();
        props.setProperty(GatewayConfig.STARTUP_TIMEOUT_KEY, "1500");
        props.setProperty(GatewayConfig.SHUTDOWN_TIMEOUT_KEY, "250");
        props.setProperty(GatewayConfig.TERMINATE_GRACE_KEY, "100");
        props.setProperty(GatewayConfig.FRAMING_KEY, "LINE_DELIMITED");
        props.setProperty(GatewayConfig.SERVERS_FILE_KEY, " /etc/lsp/servers.json ");
        props.setProperty(GatewayConfig.CLIENT_NAME_KEY, "ide-backend");

        var config = GatewayConfig.fromProperties(props);

        assertEquals(Duration.ofMillis(1500), config.startupTimeout());
        assertEquals(Duration.ofMillis(250), config.shutdownTimeout());
        assertEquals(Duration.ofMillis(100), config.terminateGrace());
        assertEquals(FramingMode.LINE_DELIMITED, config.framing());
        assertEquals(Path.of("/etc/lsp/servers.json"), config.serversFile());
        assertEquals("ide-backend", config.clientName());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        var props = new Properties();
        props.setProperty(GatewayConfig.STARTUP_TIMEOUT_KEY, "soon");
        props.setProperty(GatewayConfig.SHUTDOWN_TIMEOUT_KEY, "-5");
        props.setProperty(GatewayConfig.FRAMING_KEY, "websocket");
        props.setProperty(GatewayConfig.CLIENT_NAME_KEY, "  ");

        var config = GatewayConfig.fromProperties(props);

        var defaults = GatewayConfig.defaults();
        assertEquals(defaults.startupTimeout(), config.startupTimeout());
        assertEquals(defaults.shutdownTimeout(), config.shutdownTimeout());
        assertEquals(defaults.framing(), config.framing());
        assertEquals(defaults.clientName(), config.clientName());
    }

    @Test
    void systemPropertiesOverrideTheResource() {
        System.setProperty(GatewayConfig.STARTUP_TIMEOUT_KEY, "1234");
        System.setProperty(GatewayConfig.FRAMING_KEY, "line-delimited");

        var config = GatewayConfig.load();

        assertEquals(Duration.ofMillis(1234), config.startupTimeout());
        assertEquals(FramingMode.LINE_DELIMITED, config.framing());
        assertEquals(Duration.ofSeconds(5), config.shutdownTimeout());
    }

    @Test
    void withersReplaceOneField() {
        var config = GatewayConfig.defaults().withShutdownTimeout(Duration.ofMillis(10));
        assertEquals(Duration.ofMillis(10), config.shutdownTimeout());
        assertEquals(GatewayConfig.defaults().startupTimeout(), config.startupTimeout());
    }
}
