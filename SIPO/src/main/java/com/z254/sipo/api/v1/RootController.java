package com.z254.sipo.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Service banner listing the available endpoints.
 */
@RestController
@Tag(name = "Service", description = "Service information")
public class RootController {

    static final List<String> ENDPOINTS = List.of(
            "POST /api/v1/alerts/upload",
            "GET  /api/v1/alerts/prometheus",
            "POST /api/v1/alerts/generate",
            "GET  /api/v1/incidents",
            "GET  /api/v1/incidents/summary",
            "POST /api/v1/incidents/correlate");

    @GetMapping("/")
    @Operation(summary = "Service info", description = "Confirm the API is running and list its endpoints")
    public Mono<ResponseEntity<Map<String, Object>>> info() {
        return Mono.just(ResponseEntity.ok(Map.of(
                "message", "SIPO Backend API is running",
                "version", "1.0.0",
                "endpoints", ENDPOINTS)));
    }
}
