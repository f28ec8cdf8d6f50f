package com.z254.sipo.service;

import com.z254.sipo.config.SipoProperties;
import com.z254.sipo.correlation.AlertCorrelationEngine;
import com.z254.sipo.domain.model.AlertRecord;
import com.z254.sipo.domain.model.CorrelationResult;
import com.z254.sipo.domain.model.IncidentSummary;
import com.z254.sipo.ingest.AlertCsvCodec;
import com.z254.sipo.ingest.SyntheticAlertGenerator;
import com.z254.sipo.observability.SipoMetrics;
import com.z254.sipo.observability.SipoStructuredLogger;
import com.z254.sipo.observability.SipoStructuredLogger.CorrelationEventType;
import io.micrometer.core.instrument.Timer;
import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for correlation requests.
 * <p>
 * Loads alerts from the configured source, runs the correlation engine and
 * records metrics and structured logs around each run. Holds no incident
 * state; only the outline of the most recent run is kept for health reporting.
 */
@Service
public class IncidentCorrelationService {

    public static final String SOURCE_DATA_FILE = "data-file";
    public static final String SOURCE_UPLOAD = "upload";
    public static final String SOURCE_REQUEST = "request";
    public static final String SOURCE_SYNTHETIC = "synthetic";

    private final AlertCorrelationEngine engine;
    private final AlertCsvCodec csvCodec;
    private final SyntheticAlertGenerator generator;
    private final SipoProperties properties;
    private final SipoMetrics metrics;
    private final SipoStructuredLogger logger;

    private final AtomicReference<RunOutline> lastRun = new AtomicReference<>();

    public IncidentCorrelationService(AlertCorrelationEngine engine,
                                      AlertCsvCodec csvCodec,
                                      SyntheticAlertGenerator generator,
                                      SipoProperties properties,
                                      SipoMetrics metrics,
                                      SipoStructuredLogger logger) {
        this.engine = engine;
        this.csvCodec = csvCodec;
        this.generator = generator;
        this.properties = properties;
        this.metrics = metrics;
        this.logger = logger;
    }

    /**
     * Correlate the alerts stored in the configured data file.
     *
     * @throws com.z254.sipo.ingest.AlertDataNotFoundException if the file is missing
     * @throws com.z254.sipo.ingest.AlertIngestionException if the file cannot be parsed
     */
    public CorrelationResult correlateDataFile() {
        return correlate(loadDataFile(), SOURCE_DATA_FILE);
    }

    /**
     * Correlate an explicit alert batch.
     *
     * @param alerts normalized alerts in source order
     * @param source label used for metrics and logs
     */
    public CorrelationResult correlate(List<AlertRecord> alerts, String source) {
        String correlationId = UUID.randomUUID().toString();
        try (var scope = logger.withContext(Map.of(
                SipoStructuredLogger.MDC_CORRELATION_ID, correlationId,
                SipoStructuredLogger.MDC_SOURCE, source))) {

            if (alerts.isEmpty()) {
                logger.logCorrelationEvent(CorrelationEventType.EMPTY_INPUT,
                        "No alerts to correlate", Map.of("source", source));
            } else {
                logger.logCorrelationEvent(CorrelationEventType.STARTED,
                        "Correlating alerts", Map.of("source", source, "alerts", alerts.size()));
            }

            Timer.Sample sample = metrics.startCorrelationTimer();
            CorrelationResult result;
            try {
                result = logger.timed("correlate", () -> engine.correlate(alerts));
            } catch (RuntimeException e) {
                metrics.recordCorrelationFailed(sample);
                logger.logCorrelationEvent(CorrelationEventType.FAILED,
                        "Correlation failed: " + e.getMessage(),
                        Map.of("source", source, "alerts", alerts.size()));
                throw e;
            }

            IncidentSummary summary = result.getSummary();
            metrics.recordCorrelationCompleted(sample, result.getIncidentCount(), summary.getReductionRate());
            summary.getPriorityCounts().forEach(metrics::recordIncidentPriority);
            lastRun.set(RunOutline.builder()
                    .correlationId(correlationId)
                    .source(source)
                    .completedAt(Instant.now())
                    .alertCount(summary.getTotalAlerts())
                    .incidentCount(summary.getTotalIncidents())
                    .reductionRate(summary.getReductionRate())
                    .build());

            logger.logCorrelationEvent(CorrelationEventType.COMPLETED,
                    "Correlated " + summary.getTotalAlerts() + " alerts into "
                            + summary.getTotalIncidents() + " incidents",
                    Map.of("source", source,
                            "reductionRate", summary.getReductionRate(),
                            "totalRevenue", summary.getTotalRevenue(),
                            "priorityCounts", summary.getPriorityCounts()));
            return result;
        }
    }

    /**
     * Parse an uploaded CSV document into normalized alerts.
     */
    public List<AlertRecord> parseUpload(byte[] csvContent) {
        List<AlertRecord> alerts = csvCodec.read(csvContent);
        metrics.recordAlertsIngested(SOURCE_UPLOAD, alerts.size());
        logger.logCorrelationEvent(CorrelationEventType.INGESTED,
                "Parsed uploaded alert CSV", Map.of("alerts", alerts.size()));
        return alerts;
    }

    /**
     * Produce a synthetic alert batch without persisting it.
     */
    public List<AlertRecord> generateAlerts(int count) {
        List<AlertRecord> alerts = generator.generate(count);
        metrics.recordAlertsIngested(SOURCE_SYNTHETIC, alerts.size());
        return alerts;
    }

    /**
     * Generate a synthetic batch and store it as the data file.
     *
     * @return location of the written file
     */
    public Path regenerateDataFile(int count) {
        List<AlertRecord> alerts = generator.generate(count);
        Path path = dataFile();
        csvCodec.write(alerts, path);
        logger.logCorrelationEvent(CorrelationEventType.GENERATED,
                "Generated synthetic alert data", Map.of("alerts", alerts.size(), "file", path.toString()));
        return path;
    }

    public Path dataFile() {
        return Path.of(properties.getData().getAlertsFile());
    }

    public Optional<RunOutline> getLastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    private List<AlertRecord> loadDataFile() {
        List<AlertRecord> alerts = csvCodec.read(dataFile());
        metrics.recordAlertsIngested(SOURCE_DATA_FILE, alerts.size());
        return alerts;
    }

    /**
     * Outline of a completed correlation run.
     */
    @Value
    @Builder
    public static class RunOutline {
        String correlationId;
        String source;
        Instant completedAt;
        long alertCount;
        int incidentCount;
        double reductionRate;
    }
}
