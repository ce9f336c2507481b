package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KairosConfig(
    CronConfig cron,
    HeartbeatConfig heartbeat,
    GatewayConfig gateway
) {

    public static KairosConfig defaults() {
        return new KairosConfig(
            CronConfig.defaults(),
            HeartbeatConfig.defaults(),
            GatewayConfig.defaults()
        );
    }
}
