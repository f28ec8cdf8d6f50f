package com.z254.sipo.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Configuration properties for the SIPO service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Alert grouping and priority thresholds</li>
 *     <li>Location of the alert data file</li>
 *     <li>Synthetic alert generation</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sipo")
public class SipoProperties {

    private final Correlation correlation = new Correlation();
    private final PriorityThresholds priority = new PriorityThresholds();
    private final DataFiles data = new DataFiles();
    private final Generator generator = new Generator();

    /**
     * Alert grouping configuration.
     */
    @Data
    public static class Correlation {
        /** Number of incidents the grouping stage aims for, regardless of input size */
        @Positive
        private int targetIncidentCount = 15;

        /** Correlation steps slower than this are logged at WARN */
        private Duration slowRunThreshold = Duration.ofSeconds(2);
    }

    /**
     * Revenue-risk thresholds (dollars, exclusive lower bounds).
     */
    @Data
    public static class PriorityThresholds {
        /** Incidents above this revenue risk are High */
        @PositiveOrZero
        private long highThreshold = 500_000L;

        /** Incidents above this revenue risk (and not High) are Medium */
        @PositiveOrZero
        private long mediumThreshold = 100_000L;
    }

    /**
     * Alert data file settings.
     */
    @Data
    public static class DataFiles {
        @NotBlank
        private String alertsFile = "data/alerts.csv";

        /** Largest CSV upload accepted before parsing */
        private DataSize maxUploadSize = DataSize.ofMegabytes(10);
    }

    /**
     * Synthetic alert generator settings.
     */
    @Data
    public static class Generator {
        @Positive
        private int alertCount = 1000;

        /** Upper bound for a requested batch size */
        @Positive
        @Max(1_000_000)
        private int maxAlertCount = 100_000;

        /** Timestamps are spread over this window ending now */
        private Duration window = Duration.ofHours(24);

        /** Fixed seed for reproducible batches; random when unset */
        private Long seed;

        @NotEmpty
        private List<String> devices = defaultDevices();

        /** Error code to selection weight; iteration order matters */
        @NotEmpty
        private Map<String, Double> errorWeights = defaultErrorWeights();

        private long minCustomerImpact = 1;
        private long maxCustomerImpact = 10_000;
        private long minRevenueRisk = 1_000;
        private long maxRevenueRisk = 1_000_000;

        private static List<String> defaultDevices() {
            List<String> devices = new ArrayList<>();
            IntStream.rangeClosed(1, 20).forEach(i -> devices.add("T" + i));
            IntStream.rangeClosed(1, 10).forEach(i -> devices.add("R" + i));
            return devices;
        }

        private static Map<String, Double> defaultErrorWeights() {
            Map<String, Double> weights = new LinkedHashMap<>();
            weights.put("BGP_FAIL", 0.10);
            weights.put("LINK_DOWN", 0.15);
            weights.put("HARDWARE_FAIL", 0.10);
            weights.put("POWER_FAIL", 0.08);
            weights.put("FIBER_CUT", 0.12);
            weights.put("OVERLOAD", 0.20);
            weights.put("CONFIG_ERROR", 0.10);
            weights.put("TIMEOUT", 0.15);
            return weights;
        }
    }
}
