package com.z254.sipo.health;

import com.z254.sipo.config.SipoProperties;
import com.z254.sipo.service.IncidentCorrelationService;
import com.z254.sipo.service.IncidentCorrelationService.RunOutline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SipoHealthIndicatorTest {

    @Mock
    private IncidentCorrelationService correlationService;

    @TempDir
    Path tempDir;

    private SipoHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        healthIndicator = new SipoHealthIndicator(correlationService, new SipoProperties());
    }

    @Test
    void upWithoutDataFileOrRuns() {
        when(correlationService.dataFile()).thenReturn(tempDir.resolve("missing.csv"));
        when(correlationService.getLastRun()).thenReturn(Optional.empty());

        Health health = healthIndicator.checkHealth();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("dataFile.available", false)
                .containsEntry("lastRun", "NONE")
                .containsEntry("targetIncidentCount", 15)
                .containsEntry("highThreshold", 500_000L)
                .containsEntry("mediumThreshold", 100_000L);
    }

    @Test
    void reportsDataFileAndLastRun() throws Exception {
        Path dataFile = Files.writeString(tempDir.resolve("alerts.csv"), "timestamp\n");
        when(correlationService.dataFile()).thenReturn(dataFile);
        when(correlationService.getLastRun()).thenReturn(Optional.of(RunOutline.builder()
                .correlationId("c-1")
                .source("upload")
                .completedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .alertCount(30)
                .incidentCount(15)
                .reductionRate(50.0)
                .build()));

        Health health = healthIndicator.checkHealth();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("dataFile", dataFile.toString())
                .containsEntry("dataFile.available", true)
                .containsEntry("lastRun.source", "upload")
                .containsEntry("lastRun.completedAt", "2024-05-01T10:00:00Z")
                .containsEntry("lastRun.alerts", 30L)
                .containsEntry("lastRun.incidents", 15)
                .containsEntry("lastRun.reductionRate", 50.0)
                .doesNotContainKey("lastRun");
    }

    @Test
    void reactiveHealthEmitsOnce() {
        when(correlationService.dataFile()).thenReturn(tempDir.resolve("missing.csv"));
        when(correlationService.getLastRun()).thenReturn(Optional.empty());

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.UP))
                .verifyComplete();
    }
}
