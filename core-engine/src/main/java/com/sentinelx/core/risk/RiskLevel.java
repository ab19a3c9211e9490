package com.sentinelx.core.risk;

/**
 * Coarse bands of a 0–100 risk score, used for logging and summaries.
 *
 * @since 1.0.0
 */
public enum RiskLevel {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * @param score risk score in [0, 100]
     * @return LOW below 30, MEDIUM below 60, HIGH below 80, else CRITICAL
     */
    public static RiskLevel of(double score) {
        if (score < 30.0) {
            return LOW;
        }
        if (score < 60.0) {
            return MEDIUM;
        }
        if (score < 80.0) {
            return HIGH;
        }
        return CRITICAL;
    }
}
