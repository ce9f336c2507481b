package io.kairos.core.cron;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What the executor should do when the job fires. Never interpreted by the scheduler.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronPayload(
    String kind,
    String message,
    boolean deliver,
    String channel,
    String to
) {
    public static final String AGENT_TURN = "agent_turn";
    public static final String SYSTEM_EVENT = "system_event";

    public CronPayload {
        kind = kind == null || kind.isBlank() ? AGENT_TURN : kind.trim();
        message = message == null ? "" : message;
        channel = channel == null || channel.isBlank() ? null : channel.trim();
        to = to == null || to.isBlank() ? null : to.trim();
    }

    public static CronPayload agentTurn(String message) {
        return new CronPayload(AGENT_TURN, message, false, null, null);
    }

    public static CronPayload delivered(String message, String channel, String to) {
        return new CronPayload(AGENT_TURN, message, true, channel, to);
    }
}
