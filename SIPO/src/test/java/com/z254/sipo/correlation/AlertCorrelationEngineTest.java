package com.z254.sipo.correlation;

import com.z254.sipo.config.SipoProperties;
import com.z254.sipo.domain.model.AlertRecord;
import com.z254.sipo.domain.model.CorrelationResult;
import com.z254.sipo.domain.model.Incident;
import com.z254.sipo.domain.model.Priority;
import com.z254.sipo.fixtures.AlertFixtures;
import com.z254.sipo.ingest.AlertCsvCodec;
import com.z254.sipo.ingest.AlertNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class AlertCorrelationEngineTest {

    private AlertCorrelationEngine engine;

    @BeforeEach
    void setUp() {
        engine = engine(new SipoProperties());
    }

    static AlertCorrelationEngine engine(SipoProperties properties) {
        return new AlertCorrelationEngine(
                new FixedCountAlertGrouper(properties),
                new IncidentAggregator(new PriorityClassifier(properties)),
                new IncidentRanker(),
                new SummaryCalculator());
    }

    @Test
    void thirtyIdenticalAlertsBecomeFifteenLowPairs() {
        CorrelationResult result = engine.correlate(AlertFixtures.uniform(30, 100, 10_000));

        assertThat(result.getIncidents()).hasSize(15);
        assertThat(result.getIncidents()).allSatisfy(incident -> {
            assertThat(incident.getAlertCount()).isEqualTo(2);
            assertThat(incident.getTotalRevenueRisk()).isEqualTo(20_000);
            assertThat(incident.getTotalCustomers()).isEqualTo(200);
            assertThat(incident.getPriority()).isEqualTo(Priority.LOW);
        });
        // all ties, so emission order survives ranking
        assertThat(result.getIncidents()).extracting(Incident::getIncidentId)
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15);
        assertThat(result.getSummary().getReductionRate()).isEqualTo(50.0);
        assertThat(result.getSummary().getPriorityCounts()).containsExactly(entry("Low", 15));
    }

    @Test
    void emptyInputGivesEmptyResult() {
        CorrelationResult result = engine.correlate(List.of());

        assertThat(result.getIncidents()).isEmpty();
        assertThat(result.getIncidentCount()).isZero();
        assertThat(result.getSummary().getTotalIncidents()).isZero();
        assertThat(result.getSummary().getReductionRate()).isZero();
        assertThat(result.getSummary().getPriorityCounts()).isEmpty();
    }

    @Test
    void singleAlertBecomesSingleIncident() {
        AlertRecord alert = AlertFixtures.alert("T4", "FIBER_CUT", 900, 600_000);

        CorrelationResult result = engine.correlate(List.of(alert));

        assertThat(result.getIncidents()).singleElement().satisfies(incident -> {
            assertThat(incident.getIncidentId()).isEqualTo(1);
            assertThat(incident.getPrimaryError()).isEqualTo("FIBER_CUT");
            assertThat(incident.getAffectedDevices()).containsExactly("T4");
            assertThat(incident.getPriority()).isEqualTo(Priority.HIGH);
        });
        assertThat(result.getSummary().getReductionRate()).isZero();
    }

    @Test
    void rankingKeepsIdsFromEmissionOrder() {
        // 45 alerts -> 15 groups of 3, risk rises with position
        CorrelationResult result = engine.correlate(AlertFixtures.rising(45, 10_000));

        assertThat(result.getIncidents()).extracting(Incident::getIncidentId)
                .containsExactly(15, 14, 13, 12, 11, 10, 9, 8, 7, 6, 5, 4, 3, 2, 1);
        assertThat(result.getIncidents()).isSortedAccordingTo(
                (a, b) -> Long.compare(b.getTotalRevenueRisk(), a.getTotalRevenueRisk()));
        // last group: alerts 43..45 -> (43 + 44 + 45) * 10_000
        assertThat(result.getIncidents().get(0).getTotalRevenueRisk()).isEqualTo(1_320_000);
        assertThat(result.getIncidents().get(0).getPriority()).isEqualTo(Priority.HIGH);
    }

    @Test
    void everyAlertLandsInExactlyOneIncident() {
        List<AlertRecord> alerts = AlertFixtures.rising(1000, 37);

        CorrelationResult result = engine.correlate(alerts);

        List<AlertRecord> members = new ArrayList<>();
        result.getIncidents().stream()
                .sorted((a, b) -> Integer.compare(a.getIncidentId(), b.getIncidentId()))
                .forEach(incident -> members.addAll(incident.getAlerts()));
        assertThat(members).containsExactlyElementsOf(alerts);
        assertThat(result.getIncidents()).hasSize(15);
        assertThat(result.getSummary().getTotalAlerts()).isEqualTo(1000);
        assertThat(result.getSummary().getReductionRate()).isEqualTo(98.5);
        assertThat(result.getSummary().getTotalRevenue())
                .isEqualTo(alerts.stream().mapToLong(AlertRecord::getRevenueRisk).sum());
    }

    @Test
    void oversizedCsvValuesKeepTotalsPositive() {
        String csv = "timestamp,device_id,error_code,customer_impact,revenue_risk\n"
                + "2024-05-01T10:00:00Z,T1,BGP_FAIL,1,99999999999999999999\n"
                + "2024-05-01T10:01:00Z,T2,BGP_FAIL,1,99999999999999999999\n";
        List<AlertRecord> alerts = new AlertCsvCodec().read(csv.getBytes(StandardCharsets.UTF_8));

        CorrelationResult result = engine.correlate(alerts);

        assertThat(alerts).extracting(AlertRecord::getRevenueRisk)
                .containsOnly(AlertNormalizer.MAX_COUNT);
        assertThat(result.getIncidents()).allSatisfy(incident -> {
            assertThat(incident.getTotalRevenueRisk()).isEqualTo(AlertNormalizer.MAX_COUNT);
            assertThat(incident.getPriority()).isEqualTo(Priority.HIGH);
        });
        assertThat(result.getSummary().getTotalRevenue()).isEqualTo(2 * AlertNormalizer.MAX_COUNT);
    }

    @Test
    void correlationIsRepeatable() {
        List<AlertRecord> alerts = AlertFixtures.rising(77, 3_000);

        assertThat(engine.correlate(alerts)).isEqualTo(engine.correlate(alerts));
    }

    @Test
    void callerListIsNotModified() {
        List<AlertRecord> alerts = new ArrayList<>(AlertFixtures.rising(20, 1_000));
        List<AlertRecord> before = List.copyOf(alerts);

        engine.correlate(alerts);

        assertThat(alerts).containsExactlyElementsOf(before);
    }
}
