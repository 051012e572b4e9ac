package ai.lspgateway.process;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExecutableLocatorTest {

    @TempDir
    Path tempDir;

    private Path binDir;

    @BeforeEach
    void setUp() throws IOException {
        assumeTrue(File.separatorChar == '/', "POSIX permissions required");
        binDir = Files.createDirectories(tempDir.resolve("bin"));
    }

    @Test
    void findsExecutableOnPath() throws IOException {
        var server = executable(binDir.resolve("fake-ls"));
        var path = tempDir.resolve("missing") + File.pathSeparator + binDir;

        assertEquals(server, ExecutableLocator.locate("fake-ls", path).orElseThrow());
    }

    @Test
    void ignoresNonExecutableFiles() throws IOException {
        Files.writeString(binDir.resolve("readme-ls"), "not a program");

        assertTrue(ExecutableLocator.locate("readme-ls", binDir.toString()).isEmpty());
    }

    @Test
    void absolutePathIsCheckedDirectly() throws IOException {
        var server = executable(tempDir.resolve("opt-ls"));

        assertEquals(server, ExecutableLocator.locate(server.toString(), null).orElseThrow());
        assertTrue(ExecutableLocator.locate(tempDir.resolve("nope").toString(), binDir.toString()).isEmpty());
    }

    @Test
    void bareCommandWithoutPathIsUnavailable() {
        assertTrue(ExecutableLocator.locate("fake-ls", null).isEmpty());
        assertTrue(ExecutableLocator.locate("fake-ls", "").isEmpty());
        assertTrue(ExecutableLocator.locate("  ", binDir.toString()).isEmpty());
    }

    private static Path executable(Path path) throws IOException {
        Files.writeString(path, "#!/bin/sh\nexit 0\n");
        assertTrue(path.toFile().setExecutable(true));
        return path;
    }
}
