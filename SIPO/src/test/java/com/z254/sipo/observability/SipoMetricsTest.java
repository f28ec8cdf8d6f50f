package com.z254.sipo.observability;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SipoMetricsTest {

    private SimpleMeterRegistry registry;
    private SipoMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SipoMetrics(registry);
    }

    @Test
    void completedRunUpdatesCountersAndSummaries() {
        Timer.Sample sample = metrics.startCorrelationTimer();
        metrics.recordCorrelationCompleted(sample, 15, 93.3);

        assertThat(metrics.getCorrelationRuns().count()).isEqualTo(1.0);
        assertThat(metrics.getIncidentsCreated().count()).isEqualTo(15.0);
        assertThat(registry.get("sipo.correlation.latency").timer().count()).isEqualTo(1);
        assertThat(registry.get("sipo.correlation.reduction_rate").summary().max()).isEqualTo(93.3);
    }

    @Test
    void failedRunIsTimedAndCounted() {
        metrics.recordCorrelationFailed(metrics.startCorrelationTimer());

        assertThat(metrics.getCorrelationFailures().count()).isEqualTo(1.0);
        assertThat(registry.get("sipo.correlation.latency").timer().count()).isEqualTo(1);
    }

    @Test
    void ingestionAndPriorityCountersAreTagged() {
        metrics.recordAlertsIngested("upload", 3);
        metrics.recordAlertsIngested("upload", 2);
        metrics.recordIncidentPriority("High", 4);

        assertThat(registry.get("sipo.alerts.ingested").tag("source", "upload").counter().count())
                .isEqualTo(5.0);
        assertThat(registry.get("sipo.incidents.by_priority").tag("priority", "High").counter().count())
                .isEqualTo(4.0);
    }
}
