package com.umitunal.cronlite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.cronlite.core.StoreUnavailableException;
import com.umitunal.cronlite.serialization.JsonCodec;
import com.umitunal.cronlite.worker.TickSummary;
import com.umitunal.cronlite.worker.TriggerDriver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;

class TickEndpointTest {
    private final ObjectMapper mapper = JsonCodec.createDefaultMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    private final AtomicInteger cycles = new AtomicInteger();
    private TickEndpoint endpoint;

    @AfterEach
    void tearDown() {
        if (endpoint != null) {
            endpoint.close();
        }
    }

    private void start(String secret, Supplier<TickSummary> cycle) throws Exception {
        TriggerDriver driver = new TriggerDriver() {
            @Override
            public TickSummary runOnceCycle() {
                cycles.incrementAndGet();
                return cycle.get();
            }

            @Override
            public void close() {
            }
        };
        endpoint = new TickEndpoint(0, driver, new TickAuthenticator(secret), mapper, Clock.systemUTC());
        endpoint.start();
    }

    private HttpResponse<String> post(String path, String header, String value) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create("http://localhost:" + endpoint.getPort() + path))
                .timeout(Duration.ofSeconds(10))
                .POST(HttpRequest.BodyPublishers.noBody());
        if (header != null) {
            request.header(header, value);
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Should run a cycle and report its counts")
    void testTick() throws Exception {
        // Given
        start("s3cret", () -> new TickSummary(3, 2, 1, 1));

        // When
        HttpResponse<String> response = post(TickEndpoint.TICK_PATH, "Authorization", "Bearer s3cret");

        // Then
        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("status").asText()).isEqualTo("success");
        assertThat(body.get("trace_id").asText()).isNotBlank();
        assertThat(body.get("timestamp").asText()).isNotBlank();
        JsonNode metrics = body.get("metrics");
        assertThat(metrics.get("checked").asInt()).isEqualTo(3);
        assertThat(metrics.get("claimed").asInt()).isEqualTo(2);
        assertThat(metrics.get("succeeded").asInt()).isEqualTo(1);
        assertThat(metrics.get("failed").asInt()).isEqualTo(1);
        assertThat(metrics.has("execution_time_ms")).isTrue();
        assertThat(cycles.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should accept the scheduler header when no secret is set")
    void testSchedulerHeader() throws Exception {
        // Given
        start(null, TickSummary::empty);

        // When
        HttpResponse<String> response = post(TickEndpoint.TICK_PATH, TickAuthenticator.SCHEDULER_HEADER, "true");

        // Then
        assertThat(response.statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should reject unauthenticated ticks without running a cycle")
    void testUnauthorized() throws Exception {
        // Given
        start("s3cret", TickSummary::empty);

        // When
        HttpResponse<String> missing = post(TickEndpoint.TICK_PATH, null, null);
        HttpResponse<String> wrong = post(TickEndpoint.TICK_PATH, "Authorization", "Bearer nope");

        // Then
        assertThat(missing.statusCode()).isEqualTo(401);
        assertThat(wrong.statusCode()).isEqualTo(401);
        assertThat(mapper.readTree(wrong.body()).get("status").asText()).isEqualTo("error");
        assertThat(cycles.get()).isZero();
    }

    @Test
    @DisplayName("Should only accept POST")
    void testMethodNotAllowed() throws Exception {
        // Given
        start(null, TickSummary::empty);
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://localhost:" + endpoint.getPort() + TickEndpoint.TICK_PATH))
                .header(TickAuthenticator.SCHEDULER_HEADER, "true")
                .GET()
                .build();

        // When
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

        // Then
        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(response.headers().firstValue("Allow")).contains("POST");
        assertThat(cycles.get()).isZero();
    }

    @Test
    @DisplayName("Should answer 503 when the store is down and 500 on other errors")
    void testErrors() throws Exception {
        // Given
        start(null, () -> {
            if (cycles.get() == 1) {
                throw new StoreUnavailableException("disk gone");
            }
            throw new IllegalStateException("bug");
        });

        // When
        HttpResponse<String> unavailable = post(TickEndpoint.TICK_PATH, TickAuthenticator.SCHEDULER_HEADER, "true");
        HttpResponse<String> broken = post(TickEndpoint.TICK_PATH, TickAuthenticator.SCHEDULER_HEADER, "true");

        // Then
        assertThat(unavailable.statusCode()).isEqualTo(503);
        assertThat(mapper.readTree(unavailable.body()).get("metrics").get("error").asText())
                .isEqualTo("store unavailable");
        assertThat(broken.statusCode()).isEqualTo(500);
        assertThat(mapper.readTree(broken.body()).get("status").asText()).isEqualTo("error");
    }

    @Test
    @DisplayName("Should answer health checks")
    void testHealth() throws Exception {
        // Given
        start(null, TickSummary::empty);

        // When
        HttpResponse<String> response = client.send(HttpRequest.newBuilder(
                URI.create("http://localhost:" + endpoint.getPort() + TickEndpoint.HEALTH_PATH)).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        // Then
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("OK");
    }
}
