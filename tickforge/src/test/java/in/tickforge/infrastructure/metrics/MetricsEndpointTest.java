package in.tickforge.infrastructure.metrics;

import in.tickforge.domain.signal.CloseReason;
import in.tickforge.domain.tick.TickAction;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19191;
    private Undertow server;
    private PrometheusEngineMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusEngineMetrics(new CollectorRegistry());
        server = PrometheusMetricsHandler.server(metrics.getRegistry(), "localhost", TEST_PORT);
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointReturns200() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"), "Content-Type should be text/plain");
    }

    @Test
    public void testRecordedValuesAreExposed() throws Exception {
        metrics.recordTick("breakout", TickAction.OPENED);
        metrics.recordClose("breakout", CloseReason.TAKE_PROFIT, 1.6);
        metrics.recordRejection("breakout", "TAKE_PROFIT_TOO_CLOSE");
        metrics.recordFault("breakout", true);

        String body = scrape().body();

        assertTrue(body.contains("# TYPE tickforge_ticks_total"), "Should declare tick counter");
        assertTrue(body.contains("tickforge_ticks_total{strategy=\"breakout\",action=\"OPENED\",} 1.0"),
            "Should expose the recorded tick");
        assertTrue(body.contains("tickforge_closes_total{strategy=\"breakout\",reason=\"TAKE_PROFIT\",} 1.0"));
        assertTrue(body.contains("tickforge_rejections_total{strategy=\"breakout\",code=\"TAKE_PROFIT_TOO_CLOSE\",} 1.0"));
        assertTrue(body.contains("tickforge_faults_total{strategy=\"breakout\",severity=\"fatal\",} 1.0"));
    }

    @Test
    public void testUnknownPathIsNotServed() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/admin"))
            .GET()
            .build();

        assertEquals(404, httpClient.send(request, HttpResponse.BodyHandlers.ofString()).statusCode());
    }
}
