package com.z254.sipo.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for the SIPO service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Alert ingestion by source (upload, data file, synthetic)</li>
 *     <li>Correlation runs (latency, failures, incidents created)</li>
 *     <li>Noise reduction achieved per run</li>
 * </ul>
 */
@Component
public class SipoMetrics {

    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter correlationRuns;
    @Getter
    private final Counter correlationFailures;
    @Getter
    private final Counter incidentsCreated;
    private final Timer correlationLatency;
    private final DistributionSummary reductionRate;
    private final DistributionSummary incidentsPerRun;
    private final Map<String, Counter> alertsBySource = new ConcurrentHashMap<>();
    private final Map<String, Counter> incidentsByPriority = new ConcurrentHashMap<>();

    public SipoMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.correlationRuns = Counter.builder("sipo.correlation.runs")
                .description("Correlation runs started")
                .register(meterRegistry);
        this.correlationFailures = Counter.builder("sipo.correlation.failures")
                .description("Correlation runs that raised an error")
                .register(meterRegistry);
        this.incidentsCreated = Counter.builder("sipo.incidents.created")
                .description("Total incidents produced by correlation")
                .register(meterRegistry);
        this.correlationLatency = Timer.builder("sipo.correlation.latency")
                .description("Correlation run latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.reductionRate = DistributionSummary.builder("sipo.correlation.reduction_rate")
                .description("Alert noise reduction percentage per run")
                .baseUnit("percent")
                .register(meterRegistry);
        this.incidentsPerRun = DistributionSummary.builder("sipo.correlation.incidents")
                .description("Incidents produced per run")
                .register(meterRegistry);
    }

    // ========== Ingestion ==========

    public void recordAlertsIngested(String source, int count) {
        alertsBySource.computeIfAbsent(source, s ->
                Counter.builder("sipo.alerts.ingested")
                        .tag("source", s)
                        .description("Alerts ingested by source")
                        .register(meterRegistry))
                .increment(count);
    }

    // ========== Correlation ==========

    public Timer.Sample startCorrelationTimer() {
        correlationRuns.increment();
        return Timer.start(meterRegistry);
    }

    public void recordCorrelationCompleted(Timer.Sample sample, int incidentCount, double reduction) {
        sample.stop(correlationLatency);
        incidentsCreated.increment(incidentCount);
        incidentsPerRun.record(incidentCount);
        reductionRate.record(reduction);
    }

    public void recordCorrelationFailed(Timer.Sample sample) {
        sample.stop(correlationLatency);
        correlationFailures.increment();
    }

    public void recordIncidentPriority(String priorityLabel, int count) {
        incidentsByPriority.computeIfAbsent(priorityLabel, label ->
                Counter.builder("sipo.incidents.by_priority")
                        .tag("priority", label)
                        .description("Incidents produced by priority")
                        .register(meterRegistry))
                .increment(count);
    }
}
