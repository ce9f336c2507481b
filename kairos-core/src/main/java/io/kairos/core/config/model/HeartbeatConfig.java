package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HeartbeatConfig(boolean enabled, long intervalSeconds, String workspace) {

    public static HeartbeatConfig defaults() {
        return new HeartbeatConfig(true, 30 * 60, "~/.kairos/workspace");
    }
}
