package com.z254.sipo.ingest;

import com.z254.sipo.config.SipoProperties;
import com.z254.sipo.domain.model.AlertRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates synthetic 5G network alerts for demos and load checks.
 * <p>
 * Devices are drawn uniformly, error codes by their configured weight, and
 * timestamps fall within the configured window ending at the current time.
 */
@Slf4j
@Component
public class SyntheticAlertGenerator {

    private final SipoProperties.Generator config;
    private final Clock clock;

    @Autowired
    public SyntheticAlertGenerator(SipoProperties properties) {
        this(properties, Clock.systemUTC());
    }

    SyntheticAlertGenerator(SipoProperties properties, Clock clock) {
        this.config = properties.getGenerator();
        this.clock = clock;
    }

    /**
     * Generate the configured default number of alerts.
     */
    public List<AlertRecord> generate() {
        return generate(config.getAlertCount());
    }

    /**
     * Generate {@code count} alerts, seeded from configuration when a seed is set.
     */
    public List<AlertRecord> generate(int count) {
        Random random = config.getSeed() != null ? new Random(config.getSeed()) : new Random();
        return generate(count, random);
    }

    public List<AlertRecord> generate(int count, Random random) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }

        Instant windowStart = clock.instant().minus(config.getWindow());
        long windowMinutes = config.getWindow().toMinutes();
        List<String> devices = config.getDevices();

        List<AlertRecord> alerts = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Instant timestamp = windowStart.plus(nextLong(random, 0, windowMinutes), ChronoUnit.MINUTES);
            alerts.add(AlertRecord.builder()
                    .timestamp(timestamp.toString())
                    .deviceId(devices.get(random.nextInt(devices.size())))
                    .errorCode(pickErrorCode(random))
                    .customerImpact(nextLong(random, config.getMinCustomerImpact(), config.getMaxCustomerImpact()))
                    .revenueRisk(nextLong(random, config.getMinRevenueRisk(), config.getMaxRevenueRisk()))
                    .build());
        }

        log.debug("Generated {} synthetic alerts across {} devices", count, devices.size());
        return alerts;
    }

    // Cumulative-weight draw; falls back to the first code if the weights sum below 1
    private String pickErrorCode(Random random) {
        Map<String, Double> weights = config.getErrorWeights();
        double roll = random.nextDouble();
        double cumulative = 0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            cumulative += entry.getValue();
            if (roll <= cumulative) {
                return entry.getKey();
            }
        }
        return weights.keySet().iterator().next();
    }

    /** Uniform draw in [min, max], both inclusive. */
    private static long nextLong(Random random, long min, long max) {
        if (max <= min) {
            return min;
        }
        long span = max - min + 1;
        return min + (long) Math.floor(random.nextDouble() * span);
    }
}
