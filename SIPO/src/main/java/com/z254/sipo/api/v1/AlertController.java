package com.z254.sipo.api.v1;

import com.z254.sipo.api.dto.AlertBatchResponse;
import com.z254.sipo.config.SipoProperties;
import com.z254.sipo.service.IncidentCorrelationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST API controller for alert ingestion.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Alert ingestion and synthetic generation")
public class AlertController {

    private final IncidentCorrelationService correlationService;
    private final SipoProperties properties;

    public AlertController(IncidentCorrelationService correlationService,
                           SipoProperties properties) {
        this.correlationService = correlationService;
        this.properties = properties;
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload alert CSV",
               description = "Parse a CSV with columns timestamp, device_id, error_code, customer_impact, revenue_risk")
    public Mono<ResponseEntity<AlertBatchResponse>> uploadCsv(
            @Parameter(description = "CSV file")
            @RequestPart(name = "csvFile", required = false) FilePart csvFile) {

        if (csvFile == null) {
            return Mono.just(errorResponse(HttpStatus.BAD_REQUEST, "No CSV file uploaded"));
        }

        long maxBytes = properties.getData().getMaxUploadSize().toBytes();
        return DataBufferUtils.join(csvFile.content(), (int) Math.min(maxBytes, Integer.MAX_VALUE))
                .map(AlertController::drain)
                .defaultIfEmpty(new byte[0])
                .publishOn(Schedulers.boundedElastic())
                .map(correlationService::parseUpload)
                .map(alerts -> ResponseEntity.ok(AlertBatchResponse.builder()
                        .message("Successfully parsed " + alerts.size() + " alerts")
                        .alerts(alerts)
                        .build()))
                .onErrorResume(DataBufferLimitException.class, error -> {
                    log.warn("CSV upload {} exceeds {} bytes", csvFile.filename(), maxBytes);
                    return Mono.just(errorResponse(HttpStatus.PAYLOAD_TOO_LARGE,
                            "CSV file exceeds " + maxBytes + " bytes"));
                })
                .onErrorResume(error -> {
                    log.error("CSV parsing error for {}", csvFile.filename(), error);
                    return Mono.just(errorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                            "Failed to parse CSV file"));
                });
    }

    @GetMapping("/prometheus")
    @Operation(summary = "Mock Prometheus alerts",
               description = "Return a synthetic batch of network alerts")
    public Mono<ResponseEntity<AlertBatchResponse>> prometheusAlerts(
            @Parameter(description = "Number of alerts, defaults to the configured batch size")
            @RequestParam(required = false) Integer count) {

        int size = count != null ? count : properties.getGenerator().getAlertCount();
        String invalid = validateCount(size);
        if (invalid != null) {
            return Mono.just(errorResponse(HttpStatus.BAD_REQUEST, invalid));
        }

        return Mono.fromCallable(() -> correlationService.generateAlerts(size))
                .subscribeOn(Schedulers.boundedElastic())
                .map(alerts -> ResponseEntity.ok(AlertBatchResponse.builder()
                        .message("Retrieved " + alerts.size() + " alerts from Prometheus")
                        .alerts(alerts)
                        .build()))
                .onErrorResume(error -> {
                    log.error("Prometheus alerts error", error);
                    return Mono.just(errorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                            "Failed to retrieve Prometheus alerts"));
                });
    }

    @PostMapping("/generate")
    @Operation(summary = "Generate alert data",
               description = "Write a synthetic alert batch to the configured alert data file")
    public Mono<ResponseEntity<AlertBatchResponse>> generateDataFile(
            @Parameter(description = "Number of alerts, defaults to the configured batch size")
            @RequestParam(required = false) Integer count) {

        int size = count != null ? count : properties.getGenerator().getAlertCount();
        String invalid = validateCount(size);
        if (invalid != null) {
            return Mono.just(errorResponse(HttpStatus.BAD_REQUEST, invalid));
        }

        return Mono.fromCallable(() -> correlationService.regenerateDataFile(size))
                .subscribeOn(Schedulers.boundedElastic())
                .map(path -> ResponseEntity.ok(AlertBatchResponse.builder()
                        .message("Generated " + size + " alerts")
                        .file(path.toString())
                        .count(size)
                        .build()))
                .onErrorResume(error -> {
                    log.error("Alert generation failed", error);
                    return Mono.just(errorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                            "Failed to generate alerts"));
                });
    }

    // null when the batch size is acceptable
    private String validateCount(int size) {
        if (size < 0) {
            return "count must not be negative";
        }
        int max = properties.getGenerator().getMaxAlertCount();
        if (size > max) {
            return "count must not exceed " + max;
        }
        return null;
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private static ResponseEntity<AlertBatchResponse> errorResponse(HttpStatus status, String error) {
        return ResponseEntity.status(status)
                .body(AlertBatchResponse.builder().error(error).build());
    }
}
