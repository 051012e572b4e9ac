package ai.lspgateway.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Starts server processes. The OS implementation is {@link #os()}; tests substitute in-memory processes. */
public interface ProcessLauncher {

    ServerProcess launch(List<String> command, Path workingDirectory) throws IOException;

    default boolean isExecutable(String command) {
        return ExecutableLocator.isAvailable(command);
    }

    static ProcessLauncher os() {
        return (command, workingDirectory) -> {
            var processBuilder = new ProcessBuilder(command);
            processBuilder.directory(workingDirectory.toFile());
            processBuilder.redirectInput(ProcessBuilder.Redirect.PIPE);
            processBuilder.redirectOutput(ProcessBuilder.Redirect.PIPE);
            processBuilder.redirectError(ProcessBuilder.Redirect.PIPE);
            return new OsServerProcess(processBuilder.start());
        };
    }
}
