package io.kairos.core.heartbeat;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically wakes the host to work through the tasks listed in the workspace's {@code HEARTBEAT.md}.
 * Ticks are skipped while the file is missing or has nothing actionable.
 */
public final class HeartbeatService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HeartbeatService.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(30);
    public static final String OK_TOKEN = "HEARTBEAT_OK";
    public static final String PROMPT = """
        Read HEARTBEAT.md in your workspace (if it exists).
        Follow any instructions or tasks listed there.
        If nothing needs attention, reply with just: HEARTBEAT_OK""";

    private final Path workspace;
    private final Duration interval;
    private final boolean enabled;
    private final AtomicReference<HeartbeatHandler> handler;
    private ScheduledExecutorService scheduler;

    public HeartbeatService(Path workspace, Duration interval, boolean enabled, HeartbeatHandler handler) {
        this.workspace = Objects.requireNonNull(workspace, "workspace must not be null");
        this.interval = interval == null ? DEFAULT_INTERVAL : interval;
        if (this.interval.isNegative() || this.interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.enabled = enabled;
        this.handler = new AtomicReference<>(handler);
    }

    public synchronized void start() {
        if (!enabled) {
            LOG.info("Heartbeat disabled");
            return;
        }
        if (scheduler != null) {
            throw new IllegalStateException("heartbeat service is already running");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "kairos-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        LOG.info("Heartbeat started (every {}s)", interval.toSeconds());
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        scheduler = null;
        LOG.info("Heartbeat stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    @Override
    public void close() {
        stop();
    }

    public void setHandler(HeartbeatHandler replacement) {
        handler.set(replacement);
    }

    public Path heartbeatFile() {
        return HeartbeatFile.resolve(workspace);
    }

    public Duration interval() {
        return interval;
    }

    public boolean enabled() {
        return enabled;
    }

    /**
     * Invokes the handler immediately, regardless of the file's content.
     *
     * @return the handler's reply, or empty when no handler is set
     */
    public Optional<String> triggerNow() throws Exception {
        HeartbeatHandler current = handler.get();
        if (current == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(current.onHeartbeat(PROMPT));
    }

    /**
     * Runs one heartbeat check.
     *
     * @return {@code true} if the handler was invoked
     */
    boolean tick() {
        if (HeartbeatFile.isEmpty(HeartbeatFile.read(workspace).orElse(null))) {
            LOG.debug("Heartbeat skipped: nothing actionable in {}", heartbeatFile());
            return false;
        }
        HeartbeatHandler current = handler.get();
        if (current == null) {
            return false;
        }

        LOG.info("Heartbeat checking for tasks");
        try {
            String reply = current.onHeartbeat(PROMPT);
            if (isOk(reply)) {
                LOG.info("Heartbeat OK (no action needed)");
            } else {
                LOG.info("Heartbeat completed task");
            }
        } catch (Exception e) {
            LOG.warn("Heartbeat handler failed", e);
        }
        return true;
    }

    static boolean isOk(String reply) {
        if (reply == null) {
            return false;
        }
        String normalized = reply.toUpperCase(Locale.ROOT).replace("_", "");
        return normalized.contains(OK_TOKEN.replace("_", ""));
    }
}
