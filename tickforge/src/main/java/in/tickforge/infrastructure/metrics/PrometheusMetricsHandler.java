package in.tickforge.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * HTTP handler for the read-only Prometheus /metrics endpoint.
 *
 * Example output:
 * <pre>
 * # HELP tickforge_closes_total Closed positions by reason
 * # TYPE tickforge_closes_total counter
 * tickforge_closes_total{strategy="breakout",reason="TAKE_PROFIT"} 12.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    /**
     * Build (not start) an Undertow server exposing {@code /metrics} on the given port.
     */
    public static Undertow server(CollectorRegistry registry, String host, int port) {
        return Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(Handlers.path().addPrefixPath("/metrics", new PrometheusMetricsHandler(registry)))
            .build();
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        try {
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);

            Writer writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            String metricsOutput = writer.toString();

            exchange.setStatusCode(200);
            exchange.getResponseSender().send(metricsOutput);

            log.debug("[METRICS] Served {} bytes", metricsOutput.length());

        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }
}
