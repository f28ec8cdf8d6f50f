package com.z254.sipo.ingest;

import com.z254.sipo.domain.model.AlertRecord;

import java.util.Map;

/**
 * Builds {@link AlertRecord}s from loosely typed input (CSV cells, JSON values).
 * <p>
 * Numeric fields are read the way a lenient integer parse would: optional
 * leading whitespace and sign, then the leading run of digits. Anything
 * without leading digits becomes 0, negative results are clamped to 0 and
 * oversized results are clamped to {@link #MAX_COUNT}.
 */
public final class AlertNormalizer {

    /** Largest accepted count, 2^53 - 1; keeps per-incident sums far from long overflow */
    public static final long MAX_COUNT = (1L << 53) - 1;

    public static final String TIMESTAMP = "timestamp";
    public static final String DEVICE_ID = "device_id";
    public static final String ERROR_CODE = "error_code";
    public static final String CUSTOMER_IMPACT = "customer_impact";
    public static final String REVENUE_RISK = "revenue_risk";

    private AlertNormalizer() {}

    /**
     * Normalize a row keyed by the standard column names. Unknown keys are ignored.
     */
    public static AlertRecord fromFields(Map<String, ?> fields) {
        return normalize(
                asText(fields.get(TIMESTAMP)),
                asText(fields.get(DEVICE_ID)),
                asText(fields.get(ERROR_CODE)),
                fields.get(CUSTOMER_IMPACT),
                fields.get(REVENUE_RISK));
    }

    public static AlertRecord normalize(String timestamp, String deviceId, String errorCode,
                                        Object customerImpact, Object revenueRisk) {
        return AlertRecord.builder()
                .timestamp(timestamp)
                .deviceId(deviceId)
                .errorCode(errorCode)
                .customerImpact(toCount(customerImpact))
                .revenueRisk(toCount(revenueRisk))
                .build();
    }

    /**
     * Coerce a raw value to an integer in {@code [0, MAX_COUNT]}, defaulting to 0.
     */
    public static long toCount(Object raw) {
        if (raw == null) {
            return 0L;
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return clamp(((Number) raw).longValue());
        }
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || value <= 0) {
                return 0L;
            }
            return value >= MAX_COUNT ? MAX_COUNT : (long) value;
        }
        return parseLeadingInteger(raw.toString());
    }

    private static long clamp(long value) {
        return Math.min(Math.max(0L, value), MAX_COUNT);
    }

    private static long parseLeadingInteger(String text) {
        int length = text.length();
        int i = 0;
        while (i < length && Character.isWhitespace(text.charAt(i))) {
            i++;
        }

        boolean negative = false;
        if (i < length && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
            negative = text.charAt(i) == '-';
            i++;
        }

        long value = 0;
        int digits = 0;
        while (i < length && text.charAt(i) >= '0' && text.charAt(i) <= '9') {
            int digit = text.charAt(i) - '0';
            if (value < MAX_COUNT) {
                value = Math.min(value * 10 + digit, MAX_COUNT);
            }
            digits++;
            i++;
        }

        if (digits == 0 || negative) {
            return 0L;
        }
        return value;
    }

    private static String asText(Object value) {
        return value == null ? null : value.toString();
    }
}
