package com.z254.sipo.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One normalized network fault observation.
 * <p>
 * Numeric fields are always non-negative; use
 * {@link com.z254.sipo.ingest.AlertNormalizer} to build records from raw input.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({"timestamp", "device_id", "error_code", "customer_impact", "revenue_risk"})
public class AlertRecord {

    /** Observation time, ISO-8601 as received */
    @JsonProperty("timestamp")
    String timestamp;

    /** Reporting network element (tower or router) */
    @JsonProperty("device_id")
    String deviceId;

    /** Fault category, e.g. BGP_FAIL */
    @JsonProperty("error_code")
    String errorCode;

    /** Affected subscribers */
    @JsonProperty("customer_impact")
    long customerImpact;

    /** Revenue at risk in dollars */
    @JsonProperty("revenue_risk")
    long revenueRisk;
}
