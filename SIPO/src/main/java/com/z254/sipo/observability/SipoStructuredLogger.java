package com.z254.sipo.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.z254.sipo.config.SipoProperties;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Structured logging for correlation runs.
 * <p>
 * Lines read {@code message | data={...}} where the data part is JSON, so
 * nested values such as priority counts stay machine-readable. Run context
 * (correlation id, alert source) travels in the MDC.
 */
@Slf4j
@Component
public class SipoStructuredLogger {

    // MDC keys
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_SOURCE = "alertSource";

    private static final ObjectMapper LOG_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    private final Duration slowRunThreshold;

    public SipoStructuredLogger(SipoProperties properties) {
        this.slowRunThreshold = properties.getCorrelation().getSlowRunThreshold();
    }

    /**
     * Log a correlation lifecycle event.
     */
    public void logCorrelationEvent(CorrelationEventType eventType, String message,
                                    Map<String, ?> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", eventType.name());
        if (details != null) {
            logData.putAll(details);
        }

        String data = formatLogData(logData);
        switch (eventType) {
            case STARTED -> log.debug("{} | data={}", message, data);
            case EMPTY_INPUT -> log.warn("{} | data={}", message, data);
            case FAILED -> log.error("{} | data={}", message, data);
            default -> log.info("{} | data={}", message, data);
        }
    }

    /**
     * Run a correlation step and log its duration; runs slower than the
     * configured threshold are logged at WARN.
     */
    public <T> T timed(String step, Supplier<T> action) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            T result = action.get();
            success = true;
            return result;
        } finally {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            String data = formatLogData(Map.of(
                    "event", "TIMING",
                    "step", step,
                    "durationMs", elapsed.toMillis(),
                    "success", success));
            if (elapsed.compareTo(slowRunThreshold) > 0) {
                log.warn("Slow correlation step {} took {}ms | data={}", step, elapsed.toMillis(), data);
            } else {
                log.debug("Correlation step {} took {}ms | data={}", step, elapsed.toMillis(), data);
            }
        }
    }

    /**
     * Put run context into the MDC; closing the scope restores what was there before.
     */
    public MDCScope withContext(Map<String, String> context) {
        Map<String, String> previous = new LinkedHashMap<>();
        context.forEach((key, value) -> {
            previous.put(key, MDC.get(key));
            MDC.put(key, value);
        });
        return new MDCScope(previous);
    }

    String formatLogData(Map<String, ?> data) {
        try {
            return LOG_MAPPER.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            // keep the log line; the data part degrades to its toString form
            log.debug("Could not render log data as JSON", e);
            return String.valueOf(data);
        }
    }

    public enum CorrelationEventType {
        INGESTED, GENERATED, STARTED, COMPLETED, EMPTY_INPUT, FAILED
    }

    /**
     * MDC scope that restores the previous values of its keys on close.
     */
    public static final class MDCScope implements AutoCloseable {
        private final Map<String, String> previous;

        private MDCScope(Map<String, String> previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            previous.forEach((key, value) -> {
                if (value == null) {
                    MDC.remove(key);
                } else {
                    MDC.put(key, value);
                }
            });
        }
    }
}
