package io.kairos.core.config;

import java.nio.file.Path;

/**
 * Outcome of {@code kairos onboard}: what happened to {@code config.json} and where the scheduler will keep its state.
 */
public record OnboardResult(
    Path configPath,
    ConfigAction configAction,
    Path storePath,
    Path workspacePath,
    Path heartbeatFile,
    boolean heartbeatCreated
) {

    public enum ConfigAction {
        /** No config existed; defaults were written. */
        CREATED,
        /** An existing config was replaced with defaults. */
        RESET,
        /** An existing config was kept and missing keys were filled from defaults. */
        MERGED
    }
}
