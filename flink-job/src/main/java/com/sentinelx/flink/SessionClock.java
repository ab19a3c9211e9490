package com.sentinelx.flink;

import java.io.Serializable;

/**
 * Per-session clock in the producer's time base.
 *
 * <p>
 * Event timestamps come from the producer's clock, which may be a monotonic
 * clock or simply skewed from the cluster's. Ticking the monitor at cluster
 * processing time would prune every buffered event, so the session's "now"
 * is the latest event timestamp plus the processing time elapsed since that
 * event arrived. Late events never move the clock backwards.
 * </p>
 */
public final class SessionClock implements Serializable {

    private static final long serialVersionUID = 1L;

    private boolean anchored;
    private double anchorEventTime;
    private long anchorProcessingMs;
    private double lastNow = Double.NEGATIVE_INFINITY;

    /**
     * Record an event observed at {@code processingMs}. The clock re-anchors
     * on events at or ahead of its current projection.
     */
    public void observe(double eventTime, long processingMs) {
        if (!anchored || eventTime >= project(processingMs)) {
            anchored = true;
            anchorEventTime = eventTime;
            anchorProcessingMs = processingMs;
        }
    }

    /**
     * @return session time in seconds at {@code processingMs}; never decreases
     * @throws IllegalStateException if no event was observed yet
     */
    public double now(long processingMs) {
        if (!anchored) {
            throw new IllegalStateException("No event observed yet");
        }
        lastNow = Math.max(lastNow, project(processingMs));
        return lastNow;
    }

    public boolean isAnchored() {
        return anchored;
    }

    private double project(long processingMs) {
        return anchorEventTime + (processingMs - anchorProcessingMs) / 1000.0;
    }

    @Override
    public String toString() {
        return anchored
                ? "SessionClock{anchor=" + anchorEventTime + "@" + anchorProcessingMs + "ms}"
                : "SessionClock{unanchored}";
    }
}
