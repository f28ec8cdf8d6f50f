package com.z254.sipo.api.v1;

import com.z254.sipo.config.SipoProperties;
import com.z254.sipo.correlation.FixedCountAlertGrouper;
import com.z254.sipo.correlation.IncidentAggregator;
import com.z254.sipo.correlation.IncidentRanker;
import com.z254.sipo.correlation.PriorityClassifier;
import com.z254.sipo.correlation.SummaryCalculator;
import com.z254.sipo.correlation.AlertCorrelationEngine;
import com.z254.sipo.domain.model.CorrelationResult;
import com.z254.sipo.fixtures.AlertFixtures;
import com.z254.sipo.ingest.AlertDataNotFoundException;
import com.z254.sipo.ingest.AlertIngestionException;
import com.z254.sipo.service.IncidentCorrelationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.file.Path;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IncidentControllerTest {

    @Mock
    private IncidentCorrelationService correlationService;

    private WebTestClient webTestClient;

    private final AlertCorrelationEngine engine = new AlertCorrelationEngine(
            new FixedCountAlertGrouper(new SipoProperties()),
            new IncidentAggregator(new PriorityClassifier(new SipoProperties())),
            new IncidentRanker(),
            new SummaryCalculator());

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new IncidentController(correlationService)).build();
    }

    @Test
    void listsRankedIncidentsWithSnakeCaseFields() {
        CorrelationResult result = engine.correlate(AlertFixtures.rising(30, 20_000));
        when(correlationService.correlateDataFile()).thenReturn(result);

        webTestClient.get().uri("/api/v1/incidents")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Correlated 30 alerts into 15 incidents")
                .jsonPath("$.incidents.length()").isEqualTo(15)
                .jsonPath("$.incidents[0].incident_id").isEqualTo(15)
                .jsonPath("$.incidents[0].alert_count").isEqualTo(2)
                .jsonPath("$.incidents[0].total_revenue_risk").isEqualTo(1_180_000)
                .jsonPath("$.incidents[0].priority").isEqualTo("High")
                .jsonPath("$.incidents[0].primary_error").isNotEmpty()
                .jsonPath("$.incidents[0].affected_devices").isArray()
                .jsonPath("$.incidents[0].alerts[0].device_id").isNotEmpty()
                .jsonPath("$.summary.totalIncidents").isEqualTo(15)
                .jsonPath("$.summary.reductionRate").isEqualTo(50.0)
                .jsonPath("$.error").doesNotExist();
    }

    @Test
    void missingDataFileIsNotFound() {
        when(correlationService.correlateDataFile())
                .thenThrow(new AlertDataNotFoundException(Path.of("data/alerts.csv")));

        webTestClient.get().uri("/api/v1/incidents")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Alerts data not found. Please generate alerts first.");
    }

    @Test
    void unreadableDataFileIsServerError() {
        when(correlationService.correlateDataFile())
                .thenThrow(new AlertIngestionException("Failed to parse alert CSV: bad quote"));

        webTestClient.get().uri("/api/v1/incidents")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Failed to retrieve incidents");
    }

    @Test
    void summaryOmitsIncidentList() {
        when(correlationService.correlateDataFile())
                .thenReturn(engine.correlate(AlertFixtures.uniform(30, 100, 10_000)));

        webTestClient.get().uri("/api/v1/incidents/summary")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Summarized 15 incidents")
                .jsonPath("$.incidents").doesNotExist()
                .jsonPath("$.summary.priorityCounts.Low").isEqualTo(15);
    }

    @Test
    void correlatesRequestBodyAfterNormalizing() {
        when(correlationService.correlate(anyList(), eq(IncidentCorrelationService.SOURCE_REQUEST)))
                .thenAnswer(invocation -> engine.correlate(invocation.getArgument(0)));

        webTestClient.post().uri("/api/v1/incidents/correlate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        [
                          {"timestamp": "2024-05-01T10:00:00Z", "device_id": "T1", "error_code": "BGP_FAIL",
                           "customer_impact": "120", "revenue_risk": 300000},
                          {"timestamp": "2024-05-01T10:01:00Z", "device_id": "T2", "error_code": "LINK_DOWN",
                           "customer_impact": -4, "revenue_risk": "abc"}
                        ]
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.incidents.length()").isEqualTo(2)
                .jsonPath("$.incidents[0].total_revenue_risk").isEqualTo(300_000)
                .jsonPath("$.incidents[0].priority").isEqualTo("Medium")
                .jsonPath("$.incidents[1].total_customers").isEqualTo(0)
                .jsonPath("$.summary.totalCustomers").isEqualTo(120);
    }

    @Test
    void emptyRequestBodyGivesEmptyResult() {
        when(correlationService.correlate(anyList(), eq(IncidentCorrelationService.SOURCE_REQUEST)))
                .thenAnswer(invocation -> engine.correlate(invocation.getArgument(0)));

        webTestClient.post().uri("/api/v1/incidents/correlate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("[]")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.incidents").isEmpty()
                .jsonPath("$.summary.reductionRate").isEqualTo(0.0);
    }

    @Test
    void correlationFailureIsServerError() {
        when(correlationService.correlate(anyList(), eq(IncidentCorrelationService.SOURCE_REQUEST)))
                .thenThrow(new IllegalStateException("invalid partition"));

        webTestClient.post().uri("/api/v1/incidents/correlate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(List.of())
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Failed to correlate alerts");
    }
}
