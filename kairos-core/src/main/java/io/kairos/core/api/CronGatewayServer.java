package io.kairos.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kairos.core.cron.CronJob;
import io.kairos.core.cron.CronMetrics;
import io.kairos.core.cron.CronService;
import io.kairos.core.cron.CronStatus;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP control surface for a {@link CronService}.
 *
 * <pre>
 * GET    /healthz
 * GET    /cron/status
 * GET    /cron/jobs?includeDisabled=true
 * POST   /cron/jobs
 * GET    /cron/jobs/{id}
 * DELETE /cron/jobs/{id}
 * POST   /cron/jobs/{id}/enable
 * POST   /cron/jobs/{id}/disable
 * POST   /cron/jobs/{id}/run?force=true
 * </pre>
 */
public final class CronGatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CronGatewayServer.class);
    private static final String JOBS_PATH = "/cron/jobs";

    private final ObjectMapper mapper;
    private final CronService cronService;
    private final CronMetrics metrics;
    private final String host;
    private final int requestedPort;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public CronGatewayServer(int port, CronService cronService) {
        this(port, "127.0.0.1", cronService, null);
    }

    public CronGatewayServer(int port, String host, CronService cronService, CronMetrics metrics) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.cronService = Objects.requireNonNull(cronService, "cronService must not be null");
        this.metrics = metrics;

        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/cron/status", blocking(this::handleStatus))
            .addPrefixPath(JOBS_PATH, blocking(this::handleJobs));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Cron gateway listening on http://{}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
            server = null;
        }
    }

    private HttpHandler blocking(HttpHandler handler) {
        return exchange -> {
            if (exchange.isInIoThread()) {
                exchange.dispatch(() -> {
                    try {
                        handler.handleRequest(exchange);
                    } catch (Exception e) {
                        sendInternalError(exchange, e);
                    }
                });
                return;
            }
            handler.handleRequest(exchange);
        };
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleStatus(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        CronStatus status = cronService.status();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("running", status.running());
        payload.put("jobCount", status.jobCount());
        payload.put("nextWakeAtMs", status.nextWakeAtMs());
        payload.put("nextWakeAt", status.nextWakeAtMs() == null ? null : Instant.ofEpochMilli(status.nextWakeAtMs()));
        if (metrics != null) {
            payload.put("metrics", metrics.snapshot());
        }
        sendJson(exchange, 200, payload);
    }

    private void handleJobs(HttpServerExchange exchange) throws IOException {
        String remainder = exchange.getRequestPath().substring(JOBS_PATH.length());
        if (remainder.isEmpty() || "/".equals(remainder)) {
            handleJobCollection(exchange);
            return;
        }
        if (!remainder.startsWith("/")) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }

        String[] segments = remainder.substring(1).split("/");
        String id = segments[0];
        if (id.isBlank() || segments.length > 2) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        if (segments.length == 1) {
            handleJob(exchange, id);
            return;
        }
        handleJobAction(exchange, id, segments[1]);
    }

    private void handleJobCollection(HttpServerExchange exchange) throws IOException {
        if (isMethod(exchange, "GET")) {
            boolean includeDisabled = parseQueryBoolean(exchange, "includeDisabled", false);
            List<Map<String, Object>> jobs = new ArrayList<>();
            for (CronJob job : cronService.list(includeDisabled)) {
                jobs.add(toJobResponse(job));
            }
            sendJson(exchange, 200, Map.of("jobs", jobs));
            return;
        }
        if (isMethod(exchange, "POST")) {
            CreateJobRequest request;
            try {
                request = mapper.treeToValue(readJsonBody(exchange), CreateJobRequest.class);
                if (request == null || request.schedule() == null) {
                    sendJson(exchange, 400, Map.of("error", "schedule is required"));
                    return;
                }
                CronJob created = cronService.add(
                    request.name(),
                    request.schedule(),
                    request.payload(),
                    request.deleteAfterRun()
                );
                sendJson(exchange, 201, toJobResponse(created));
            } catch (JsonProcessingException e) {
                sendJson(exchange, 400, Map.of("error", "invalid_request: " + e.getOriginalMessage()));
            } catch (IllegalArgumentException e) {
                sendJson(exchange, 400, Map.of("error", e.getMessage()));
            }
            return;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
    }

    private void handleJob(HttpServerExchange exchange, String id) throws IOException {
        if (isMethod(exchange, "GET")) {
            Optional<CronJob> job = cronService.job(id);
            if (job.isEmpty()) {
                sendJson(exchange, 404, Map.of("error", "not_found"));
                return;
            }
            sendJson(exchange, 200, toJobResponse(job.get()));
            return;
        }
        if (isMethod(exchange, "DELETE")) {
            if (!cronService.remove(id)) {
                sendJson(exchange, 404, Map.of("error", "not_found"));
                return;
            }
            sendJson(exchange, 200, Map.of("removed", true));
            return;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
    }

    private void handleJobAction(HttpServerExchange exchange, String id, String action) throws IOException {
        if (!isMethod(exchange, "POST")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        switch (action) {
            case "enable", "disable" -> {
                Optional<CronJob> updated = cronService.enable(id, "enable".equals(action));
                if (updated.isEmpty()) {
                    sendJson(exchange, 404, Map.of("error", "not_found"));
                    return;
                }
                sendJson(exchange, 200, toJobResponse(updated.get()));
            }
            case "run" -> {
                if (cronService.job(id).isEmpty()) {
                    sendJson(exchange, 404, Map.of("error", "not_found"));
                    return;
                }
                boolean ran = cronService.run(id, parseQueryBoolean(exchange, "force", false));
                sendJson(exchange, 200, Map.of("ran", ran));
            }
            default -> sendJson(exchange, 404, Map.of("error", "not_found"));
        }
    }

    private Map<String, Object> toJobResponse(CronJob job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", job.id());
        payload.put("name", job.name());
        payload.put("enabled", job.enabled());
        payload.put("schedule", job.schedule());
        payload.put("payload", job.payload());
        payload.put("state", job.state());
        payload.put("nextRunAt", toInstant(job.state().nextRunAtMs()));
        payload.put("lastRunAt", toInstant(job.state().lastRunAtMs()));
        payload.put("createdAtMs", job.createdAtMs());
        payload.put("updatedAtMs", job.updatedAtMs());
        payload.put("deleteAfterRun", job.deleteAfterRun());
        return payload;
    }

    private static Instant toInstant(Long epochMs) {
        return epochMs == null ? null : Instant.ofEpochMilli(epochMs);
    }

    private boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private boolean parseQueryBoolean(HttpServerExchange exchange, String key, boolean fallback) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        String raw = values.peekFirst();
        return raw == null || raw.isBlank() ? fallback : Boolean.parseBoolean(raw.trim());
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.warn("Cron gateway request {} failed", exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.debug("Failed to send error response: {}", e.getMessage());
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port: {}", e.getMessage());
        }
        return fallbackPort;
    }
}
