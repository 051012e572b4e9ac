package ai.lspgateway;

import java.nio.file.Path;

/** Maps a workspace id to the directory its servers run in. The gateway neither validates nor creates it. */
@FunctionalInterface
public interface WorkspaceRootResolver {

    Path resolve(String workspaceId);
}
