package com.sentinelx.core.sink;

import com.sentinelx.core.model.RiskReport;

/**
 * Receiver of periodic risk reports.
 * <p>
 * Implementations must not throw for delivery problems: every outcome,
 * including transport failure, is expressed as a {@link DeliveryResult}.
 * </p>
 */
public interface ReportSink {

    /**
     * Deliver one report.
     *
     * @param report report to deliver; must not be {@code null}
     * @return delivery outcome, never {@code null}
     */
    DeliveryResult deliver(RiskReport report);
}
