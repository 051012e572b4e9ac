package ai.lspgateway.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of a language server binary and the languages it serves.
 *
 * @param primaryName registry key, also the prefix of instance ids (e.g. {@code typescript})
 * @param name human-readable server name reported to clients (e.g. {@code typescript-language-server})
 * @param command executable to launch
 * @param args launch arguments
 * @param languages every language id served; always contains {@code primaryName}
 */
public record ServerDescriptor(
        String primaryName, String name, String command, List<String> args, Set<String> languages) {

    public ServerDescriptor {
        Objects.requireNonNull(primaryName, "primaryName");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(command, "command");
        if (primaryName.isBlank()) {
            throw new IllegalArgumentException("primaryName must not be blank");
        }
        if (command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank for server " + primaryName);
        }
        args = List.copyOf(args);
        var allLanguages = new LinkedHashSet<String>();
        allLanguages.add(primaryName);
        allLanguages.addAll(languages);
        languages = Collections.unmodifiableSet(allLanguages);
    }

    public boolean serves(String languageId) {
        return languages.contains(languageId);
    }

    /** Full command line: the executable followed by its arguments. */
    public List<String> commandLine() {
        var commandLine = new ArrayList<String>(args.size() + 1);
        commandLine.add(command);
        commandLine.addAll(args);
        return commandLine;
    }
}
