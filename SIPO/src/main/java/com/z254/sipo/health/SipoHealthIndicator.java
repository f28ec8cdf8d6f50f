package com.z254.sipo.health;

import com.z254.sipo.config.SipoProperties;
import com.z254.sipo.service.IncidentCorrelationService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the SIPO service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Availability of the alert data file</li>
 *     <li>Outline of the most recent correlation run</li>
 *     <li>Active grouping and priority configuration</li>
 * </ul>
 * A missing data file is reported as a detail, not as DOWN: uploads and
 * synthetic batches still work without it.
 */
@Component
public class SipoHealthIndicator implements ReactiveHealthIndicator {

    private final IncidentCorrelationService correlationService;
    private final SipoProperties properties;

    public SipoHealthIndicator(IncidentCorrelationService correlationService,
                               SipoProperties properties) {
        this.correlationService = correlationService;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth)
                .subscribeOn(Schedulers.boundedElastic());
    }

    Health checkHealth() {
        Map<String, Object> details = new LinkedHashMap<>();

        Path dataFile = correlationService.dataFile();
        details.put("dataFile", dataFile.toString());
        details.put("dataFile.available", Files.isReadable(dataFile));

        correlationService.getLastRun().ifPresentOrElse(run -> {
            details.put("lastRun.source", run.getSource());
            details.put("lastRun.completedAt", run.getCompletedAt().toString());
            details.put("lastRun.alerts", run.getAlertCount());
            details.put("lastRun.incidents", run.getIncidentCount());
            details.put("lastRun.reductionRate", run.getReductionRate());
        }, () -> details.put("lastRun", "NONE"));

        details.put("targetIncidentCount", properties.getCorrelation().getTargetIncidentCount());
        details.put("highThreshold", properties.getPriority().getHighThreshold());
        details.put("mediumThreshold", properties.getPriority().getMediumThreshold());

        return Health.up()
                .withDetails(details)
                .build();
    }
}
