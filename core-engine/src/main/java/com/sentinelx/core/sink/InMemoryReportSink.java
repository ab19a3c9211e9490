package com.sentinelx.core.sink;

import com.sentinelx.core.aggregate.RiskAggregator;
import com.sentinelx.core.model.RiskReport;
import com.sentinelx.core.validation.RiskReportValidator;
import com.sentinelx.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * In-process collector: validates, stores and aggregates reports.
 *
 * <p>
 * Stands in for a remote storage API when no server is configured. Safe for
 * concurrent sessions. Only the most recent {@code capacity} raw reports are
 * kept; the {@link RiskAggregator} carries the long-running totals.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryReportSink implements ReportSink {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryReportSink.class);

    public static final int DEFAULT_CAPACITY = 1_000;

    private final RiskReportValidator validator;
    private final RiskAggregator aggregator;
    private final int capacity;
    private final Deque<RiskReport> recent = new ArrayDeque<>();

    public InMemoryReportSink() {
        this(new RiskReportValidator(), new RiskAggregator(), DEFAULT_CAPACITY);
    }

    /**
     * @param capacity number of recent raw reports retained; must be &gt; 0
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public InMemoryReportSink(RiskReportValidator validator, RiskAggregator aggregator, int capacity) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public DeliveryResult deliver(RiskReport report) {
        Objects.requireNonNull(report, "RiskReport must not be null");
        ValidationResult result = validator.validate(report);
        if (!result.isValid()) {
            LOG.warn("Rejected report for session {}: {}", report.getSessionId(), result.getReason());
            return DeliveryResult.rejected(result.getReason());
        }
        synchronized (recent) {
            if (recent.size() == capacity) {
                recent.removeFirst();
            }
            recent.addLast(report);
        }
        aggregator.add(report);
        LOG.debug("Stored report for session {}: risk={}", report.getSessionId(), report.getRiskScore());
        return DeliveryResult.accepted();
    }

    /** Snapshot of the most recent accepted reports, oldest first. */
    public List<RiskReport> storedReports() {
        synchronized (recent) {
            return List.copyOf(recent);
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public RiskAggregator getAggregator() {
        return aggregator;
    }
}
