package io.kairos.core.heartbeat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HeartbeatFile {
    private static final Logger LOG = LoggerFactory.getLogger(HeartbeatFile.class);
    public static final String FILE_NAME = "HEARTBEAT.md";

    private static final Set<String> EMPTY_CHECKBOXES = Set.of("- [ ]", "* [ ]", "- [x]", "* [x]");

    private HeartbeatFile() {
    }

    public static Path resolve(Path workspace) {
        return workspace.resolve(FILE_NAME);
    }

    public static Optional<String> read(Path workspace) {
        Path path = resolve(workspace);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.warn("Failed to read {}", path, e);
            return Optional.empty();
        }
    }

    /**
     * True when the content holds nothing actionable: blank lines, headings, HTML comments and bare checkboxes only.
     */
    public static boolean isEmpty(String content) {
        if (content == null || content.isEmpty()) {
            return true;
        }
        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("<!--") || EMPTY_CHECKBOXES.contains(line)) {
                continue;
            }
            return false;
        }
        return true;
    }
}
