package com.z254.sipo.api.v1;

import com.z254.sipo.api.dto.CorrelationResponse;
import com.z254.sipo.api.mapper.IncidentMapper;
import com.z254.sipo.domain.model.AlertRecord;
import com.z254.sipo.domain.model.CorrelationResult;
import com.z254.sipo.ingest.AlertDataNotFoundException;
import com.z254.sipo.ingest.AlertNormalizer;
import com.z254.sipo.service.IncidentCorrelationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * REST API controller for correlated incidents.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/incidents")
@Tag(name = "Incidents", description = "Correlated, prioritized incidents")
public class IncidentController {

    private final IncidentCorrelationService correlationService;

    public IncidentController(IncidentCorrelationService correlationService) {
        this.correlationService = correlationService;
    }

    @GetMapping
    @Operation(summary = "List incidents",
               description = "Correlate the stored alert data into incidents ranked by revenue risk")
    public Mono<ResponseEntity<CorrelationResponse>> listIncidents() {
        return correlateDataFile(IncidentMapper::toResponse);
    }

    @GetMapping("/summary")
    @Operation(summary = "Incident summary",
               description = "Totals, priority distribution and alert reduction for the stored alert data")
    public Mono<ResponseEntity<CorrelationResponse>> getSummary() {
        return correlateDataFile(result -> CorrelationResponse.builder()
                .message("Summarized " + result.getIncidentCount() + " incidents")
                .summary(result.getSummary())
                .build());
    }

    @PostMapping("/correlate")
    @Operation(summary = "Correlate alerts",
               description = "Correlate the alerts in the request body; numeric fields are coerced to non-negative integers")
    public Mono<ResponseEntity<CorrelationResponse>> correlate(
            @RequestBody List<Map<String, Object>> rawAlerts) {

        return Mono.fromCallable(() -> {
                    List<AlertRecord> alerts = rawAlerts.stream()
                            .map(AlertNormalizer::fromFields)
                            .toList();
                    return correlationService.correlate(alerts, IncidentCorrelationService.SOURCE_REQUEST);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(IncidentMapper.toResponse(result)))
                .onErrorResume(error -> {
                    log.error("Alert correlation failed", error);
                    return Mono.just(errorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                            "Failed to correlate alerts"));
                });
    }

    private Mono<ResponseEntity<CorrelationResponse>> correlateDataFile(
            Function<CorrelationResult, CorrelationResponse> toBody) {

        return Mono.fromCallable(correlationService::correlateDataFile)
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(toBody.apply(result)))
                .onErrorResume(AlertDataNotFoundException.class, error -> {
                    log.warn("Alert data file missing: {}", error.getPath());
                    return Mono.just(errorResponse(HttpStatus.NOT_FOUND,
                            "Alerts data not found. Please generate alerts first."));
                })
                .onErrorResume(error -> {
                    log.error("Failed to load incidents", error);
                    return Mono.just(errorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                            "Failed to retrieve incidents"));
                });
    }

    private static ResponseEntity<CorrelationResponse> errorResponse(HttpStatus status, String error) {
        return ResponseEntity.status(status)
                .body(CorrelationResponse.builder().error(error).build());
    }
}
