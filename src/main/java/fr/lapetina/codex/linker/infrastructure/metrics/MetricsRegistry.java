package fr.lapetina.codex.linker.infrastructure.metrics;

import fr.lapetina.codex.linker.dispatch.LogDispatcher;
import fr.lapetina.codex.linker.domain.model.ProbeOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Probe counters by candidate and outcome
 * - Probe and race latency timers
 * - Log dispatcher gauges (queue depth, dropped, delivered, failed, rejected)
 * - JVM metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private static final String SUCCESS = "SUCCESS";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> probeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> probeTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> raceCounters = new ConcurrentHashMap<>();
    private final Timer raceTimer;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        this.raceTimer = Timer.builder(prefix + "_race_duration")
                .description("Wall-clock time of endpoint detection races")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        log.debug("MetricsRegistry initialized with prefix: {}", prefix);
    }

    /**
     * Records a probe outcome and its latency.
     */
    public void recordProbe(ProbeOutcome outcome) {
        String candidate = outcome.candidate().baseUrl();
        String result = outcome.success() ? SUCCESS : outcome.failure().name();
        String key = candidate + ":" + result;
        probeCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_probes_total")
                        .description("Total number of endpoint probes")
                        .tag("candidate", candidate)
                        .tag("outcome", result)
                        .register(registry)
        ).increment();

        probeTimers.computeIfAbsent(candidate, k ->
                Timer.builder(prefix + "_probe_latency")
                        .description("Endpoint probe latency")
                        .tag("candidate", candidate)
                        .register(registry)
        ).record(outcome.latency());
    }

    /**
     * Records the result of a detection race.
     */
    public void recordRace(boolean detected, Duration elapsed) {
        String result = detected ? "detected" : "none";
        raceCounters.computeIfAbsent(result, k ->
                Counter.builder(prefix + "_races_total")
                        .description("Total number of detection races")
                        .tag("result", result)
                        .register(registry)
        ).increment();
        raceTimer.record(elapsed);
    }

    /**
     * Registers gauges tracking a log dispatcher.
     */
    public void registerDispatcher(LogDispatcher dispatcher) {
        Gauge.builder(prefix + "_log_queue_depth", dispatcher, LogDispatcher::getQueueSize)
                .strongReference(true)
                .description("Records waiting in the log dispatcher queue")
                .register(registry);
        Gauge.builder(prefix + "_log_dropped", dispatcher, LogDispatcher::getDroppedCount)
                .strongReference(true)
                .description("Records dropped under backpressure or at drain timeout")
                .register(registry);
        Gauge.builder(prefix + "_log_delivered", dispatcher, LogDispatcher::getDeliveredCount)
                .strongReference(true)
                .description("Records forwarded to the log transport")
                .register(registry);
        Gauge.builder(prefix + "_log_failed", dispatcher, LogDispatcher::getFailedCount)
                .strongReference(true)
                .description("Records lost to transport errors")
                .register(registry);
        Gauge.builder(prefix + "_log_rejected", dispatcher, LogDispatcher::getRejectedCount)
                .strongReference(true)
                .description("Records rejected after shutdown started")
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
