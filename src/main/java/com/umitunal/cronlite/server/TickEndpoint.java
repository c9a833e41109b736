package com.umitunal.cronlite.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.umitunal.cronlite.core.StoreUnavailableException;
import com.umitunal.cronlite.worker.NamedThreadFactory;
import com.umitunal.cronlite.worker.TickSummary;
import com.umitunal.cronlite.worker.TriggerDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * HTTP entry point for an external timer service.
 * <pre>
 *   POST /cron/tick   run one trigger cycle, reply with its counts
 *   GET  /healthz     liveness
 * </pre>
 */
public class TickEndpoint implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TickEndpoint.class);

    public static final String TICK_PATH = "/cron/tick";
    public static final String HEALTH_PATH = "/healthz";

    private final TriggerDriver driver;
    private final TickAuthenticator authenticator;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final HttpServer server;
    private final ExecutorService requestPool;

    public TickEndpoint(int port, TriggerDriver driver, TickAuthenticator authenticator,
                        ObjectMapper mapper, Clock clock) throws IOException {
        this.driver = driver;
        this.authenticator = authenticator;
        this.mapper = mapper;
        this.clock = clock;

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext(TICK_PATH, this::handleTick);
        server.createContext(HEALTH_PATH, exchange -> respond(exchange, 200, "OK"));

        this.requestPool = Executors.newCachedThreadPool(new NamedThreadFactory("cronlite-http", true));
        server.setExecutor(requestPool);
    }

    public void start() {
        server.start();
        log.info("Tick endpoint listening on port {} ({} auth)", getPort(),
                authenticator.requiresSecret() ? "bearer secret" : "scheduler header");
    }

    /**
     * The bound port; useful when constructed with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        requestPool.shutdownNow();
    }

    private void handleTick(HttpExchange exchange) throws IOException {
        String traceId = UUID.randomUUID().toString();
        Instant started = clock.instant();
        MDC.put("trace_id", traceId);
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "POST");
                respondJson(exchange, 405, body("error", started, traceId, Map.of("error", "method not allowed")));
                return;
            }

            String authorization = exchange.getRequestHeaders().getFirst("Authorization");
            String schedulerHeader = exchange.getRequestHeaders().getFirst(TickAuthenticator.SCHEDULER_HEADER);
            if (!authenticator.isAuthorized(authorization, schedulerHeader)) {
                log.warn("Unauthorized tick from {}", exchange.getRemoteAddress());
                respondJson(exchange, 401, body("error", started, traceId, Map.of("error", "unauthorized")));
                return;
            }

            log.info("Tick received");
            TickSummary summary;
            try {
                summary = driver.runOnceCycle();
            } catch (StoreUnavailableException e) {
                log.error("Tick failed, store unavailable: {}", e.getMessage());
                respondJson(exchange, 503, body("error", started, traceId, Map.of("error", "store unavailable")));
                return;
            } catch (RuntimeException e) {
                log.error("Tick failed", e);
                respondJson(exchange, 500, body("error", started, traceId, Map.of("error", e.toString())));
                return;
            }

            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("checked", summary.getChecked());
            metrics.put("claimed", summary.getClaimed());
            metrics.put("succeeded", summary.getSucceeded());
            metrics.put("failed", summary.getFailed());
            metrics.put("execution_time_ms", Duration.between(started, clock.instant()).toMillis());
            respondJson(exchange, 200, body("success", started, traceId, metrics));
        } finally {
            MDC.remove("trace_id");
        }
    }

    private static Map<String, Object> body(String status, Instant timestamp, String traceId, Map<String, Object> metrics) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("timestamp", timestamp.toString());
        body.put("trace_id", traceId);
        body.put("metrics", metrics);
        return body;
    }

    private void respondJson(HttpExchange exchange, int code, Object value) throws IOException {
        byte[] data = mapper.writeValueAsBytes(value);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(code, data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }

    private static void respond(HttpExchange exchange, int code, String text) throws IOException {
        byte[] data = text.getBytes(UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(code, data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }
}
