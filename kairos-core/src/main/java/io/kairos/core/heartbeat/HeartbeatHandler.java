package io.kairos.core.heartbeat;

/**
 * Receives the heartbeat prompt and returns the host's reply.
 */
@FunctionalInterface
public interface HeartbeatHandler {
    String onHeartbeat(String prompt) throws Exception;
}
