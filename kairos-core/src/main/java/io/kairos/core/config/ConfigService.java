package io.kairos.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kairos.core.config.OnboardResult.ConfigAction;
import io.kairos.core.config.model.CronConfig;
import io.kairos.core.config.model.GatewayConfig;
import io.kairos.core.config.model.HeartbeatConfig;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.heartbeat.HeartbeatFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes {@code config.json}. The file is layered over {@link KairosConfig#defaults()}: keys it omits, or
 * sets to {@code null}, keep their default. Loaded values are range-checked; errors name the offending key.
 */
public final class ConfigService {
    private final ObjectMapper mapper = new ObjectMapper();

    public KairosConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return KairosConfig.defaults();
        }

        JsonNode user = mapper.readTree(Files.readString(configPath));
        ObjectNode layered = mapper.valueToTree(KairosConfig.defaults());
        if (user != null && user.isObject()) {
            overlay(layered, (ObjectNode) user);
        } else if (user != null && !user.isNull() && !user.isMissingNode()) {
            throw new IllegalArgumentException(configPath + ": expected a JSON object");
        }

        KairosConfig config = mapper.treeToValue(layered, KairosConfig.class);
        validate(configPath, config);
        return config;
    }

    public void save(Path configPath, KairosConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        WorkspaceBootstrap.ensureParentDirectory(configPath);
        Files.writeString(
            configPath,
            mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config) + System.lineSeparator()
        );
    }

    /**
     * Writes the config (fresh, reset, or merged with new defaults), then prepares the cron store directory and the
     * heartbeat workspace it points at.
     */
    public OnboardResult onboard(Path configPath, boolean reset) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        ConfigAction action;
        if (!Files.exists(configPath)) {
            action = ConfigAction.CREATED;
        } else if (reset) {
            action = ConfigAction.RESET;
        } else {
            action = ConfigAction.MERGED;
        }

        KairosConfig config = action == ConfigAction.MERGED ? load(configPath) : KairosConfig.defaults();
        save(configPath, config);

        Path storePath = ConfigPaths.resolveStorePath(config.cron().storePath());
        WorkspaceBootstrap.ensureParentDirectory(storePath);
        Path workspace = ConfigPaths.resolveWorkspace(config.heartbeat().workspace());
        boolean heartbeatCreated = WorkspaceBootstrap.ensureWorkspace(workspace);

        return new OnboardResult(
            configPath,
            action,
            storePath,
            workspace,
            HeartbeatFile.resolve(workspace),
            heartbeatCreated
        );
    }

    private static void overlay(ObjectNode target, ObjectNode user) {
        Iterator<Map.Entry<String, JsonNode>> fields = user.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                continue;
            }
            JsonNode current = target.get(field.getKey());
            if (current instanceof ObjectNode section && value.isObject()) {
                overlay(section, (ObjectNode) value);
            } else {
                target.set(field.getKey(), value);
            }
        }
    }

    private static void validate(Path configPath, KairosConfig config) {
        CronConfig cron = config.cron();
        require(cron.idleIntervalMs() > 0, configPath, "cron.idleIntervalMs must be > 0");
        require(cron.shutdownTimeoutMs() >= 0, configPath, "cron.shutdownTimeoutMs must be >= 0");

        HeartbeatConfig heartbeat = config.heartbeat();
        require(heartbeat.intervalSeconds() > 0, configPath, "heartbeat.intervalSeconds must be > 0");

        GatewayConfig gateway = config.gateway();
        require(gateway.port() >= 0 && gateway.port() <= 65_535, configPath, "gateway.port must be in 0..65535");
    }

    private static void require(boolean condition, Path configPath, String message) {
        if (!condition) {
            throw new IllegalArgumentException(configPath + ": " + message);
        }
    }
}
