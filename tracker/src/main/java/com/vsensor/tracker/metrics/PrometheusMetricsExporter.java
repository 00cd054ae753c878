package com.vsensor.tracker.metrics;

import com.vsensor.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Serves every meter of the process in Prometheus text format.
 * <p>
 * Tracker meters and the Reactor Netty HTTP server meters both live in the global
 * registry; the Prometheus registry is attached to it so one scrape returns all of them.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.registry = Metrics.REGISTRY;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        } else {
            log.warn("Global registry is not a composite, /metrics will only show JVM meters");
        }

        registry.config().commonTags("service", "vsensor-tracker", MetricsTags.NODE_ID, nodeId);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("Prometheus exporter attached to the global registry for node {}", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
