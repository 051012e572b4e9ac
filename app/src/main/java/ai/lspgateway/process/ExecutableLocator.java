package ai.lspgateway.process;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Resolves a launch command to an executable file: absolute path, relative path, or a {@code PATH} search. */
public final class ExecutableLocator {
    private static final String[] WINDOWS_EXTENSIONS = {".exe", ".cmd", ".bat"};

    private ExecutableLocator() {}

    public static boolean isAvailable(String command) {
        return locate(command, System.getenv("PATH")).isPresent();
    }

    static Optional<Path> locate(String command, @Nullable String pathEnv) {
        if (command.isBlank() || command.contains("\0")) {
            return Optional.empty();
        }
        Path commandPath;
        try {
            commandPath = Path.of(command);
        } catch (InvalidPathException e) {
            return Optional.empty();
        }

        if (commandPath.isAbsolute() || commandPath.getNameCount() > 1) {
            return isExecutableFile(commandPath) ? Optional.of(commandPath) : Optional.empty();
        }
        if (pathEnv == null || pathEnv.isEmpty()) {
            return Optional.empty();
        }

        boolean windows = isWindows();
        for (var dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Path dirPath;
            try {
                dirPath = Path.of(dir);
            } catch (InvalidPathException e) {
                continue;
            }
            if (!Files.isDirectory(dirPath)) {
                continue;
            }
            var candidate = dirPath.resolve(command);
            if (isExecutableFile(candidate)) {
                return Optional.of(candidate);
            }
            if (windows && !command.contains(".")) {
                for (var extension : WINDOWS_EXTENSIONS) {
                    var withExtension = dirPath.resolve(command + extension);
                    if (isExecutableFile(withExtension)) {
                        return Optional.of(withExtension);
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isExecutableFile(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("windows");
    }
}
