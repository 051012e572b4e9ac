package ai.lspgateway.testutil;

import ai.lspgateway.process.ProcessLauncher;
import ai.lspgateway.process.ServerProcess;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/** Launches {@link FakeServerProcess}es, each driven by a started {@link ScriptedServer}. */
public final class FakeProcessLauncher implements ProcessLauncher {
    private final List<ScriptedServer> servers = new CopyOnWriteArrayList<>();
    private final Set<String> missingCommands = ConcurrentHashMap.newKeySet();
    private volatile Consumer<ScriptedServer> script = server -> {};
    private volatile boolean failLaunch;

    /** Applied to every server before it starts reading. */
    public FakeProcessLauncher script(Consumer<ScriptedServer> script) {
        this.script = script;
        return this;
    }

    public FakeProcessLauncher missing(String command) {
        missingCommands.add(command);
        return this;
    }

    public FakeProcessLauncher failLaunch() {
        this.failLaunch = true;
        return this;
    }

    @Override
    public boolean isExecutable(String command) {
        return !missingCommands.contains(command);
    }

    @Override
    public ServerProcess launch(List<String> command, Path workingDirectory) throws IOException {
        if (failLaunch) {
            throw new IOException("error=13, Permission denied");
        }
        var process = new FakeServerProcess(command, workingDirectory);
        var server = new ScriptedServer(process);
        script.accept(server);
        servers.add(server.start());
        return process;
    }

    public List<ScriptedServer> servers() {
        return List.copyOf(servers);
    }

    public ScriptedServer onlyServer() {
        if (servers.size() != 1) {
            throw new AssertionError("Expected exactly one launched server, got " + servers.size());
        }
        return servers.get(0);
    }

    public int launchCount() {
        return servers.size();
    }
}
