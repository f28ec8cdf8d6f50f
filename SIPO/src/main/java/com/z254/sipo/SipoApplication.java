package com.z254.sipo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * SIPO - Smart Incident Prioritizer for telecom network operations.
 *
 * <p>SIPO provides:
 * <ul>
 *   <li>Alert Ingestion - CSV uploads, a stored alert data file and synthetic batches</li>
 *   <li>Alert Correlation - Grouping raw alerts into incidents</li>
 *   <li>Prioritization - Revenue-risk based priority and ranking</li>
 *   <li>Noise Reduction Summary - Totals and reduction rate for the NOC dashboard</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class SipoApplication {

    public static void main(String[] args) {
        SpringApplication.run(SipoApplication.class, args);
    }
}
