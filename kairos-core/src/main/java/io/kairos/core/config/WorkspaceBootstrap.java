package io.kairos.core.config;

import io.kairos.core.heartbeat.HeartbeatFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class WorkspaceBootstrap {
    static final String HEARTBEAT_TEMPLATE = """
        # Heartbeat Tasks

        <!-- Tasks listed below are picked up on every heartbeat. Leave the file empty to skip ticks. -->

        - [ ]
        """;

    private WorkspaceBootstrap() {
    }

    /**
     * Creates the workspace and an empty {@code HEARTBEAT.md}; an existing file is left untouched.
     *
     * @return {@code true} if the heartbeat file was written
     */
    public static boolean ensureWorkspace(Path workspace) throws IOException {
        Files.createDirectories(workspace);

        Path heartbeat = HeartbeatFile.resolve(workspace);
        if (Files.exists(heartbeat)) {
            return false;
        }
        Files.writeString(heartbeat, HEARTBEAT_TEMPLATE, StandardCharsets.UTF_8);
        return true;
    }

    public static void ensureParentDirectory(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
