package com.sentinelx.core.sink;

import java.util.Objects;

/**
 * Outcome of handing one risk report to a {@link ReportSink}.
 *
 * @since 1.0.0
 */
public final class DeliveryResult {

    /**
     * Delivery status.
     */
    public enum Status {
        /** Stored by the receiver. */
        ACCEPTED,
        /** Refused by the receiver's validation; resending will not help. */
        REJECTED,
        /** Transport failure or timeout; the report is lost. */
        FAILED
    }

    private final Status status;
    private final String detail;

    private DeliveryResult(Status status, String detail) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.detail = detail != null ? detail : "";
    }

    public static DeliveryResult accepted() {
        return new DeliveryResult(Status.ACCEPTED, "");
    }

    public static DeliveryResult rejected(String reason) {
        return new DeliveryResult(Status.REJECTED, reason);
    }

    public static DeliveryResult failed(String reason) {
        return new DeliveryResult(Status.FAILED, reason);
    }

    public Status getStatus() {
        return status;
    }

    public String getDetail() {
        return detail;
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeliveryResult that))
            return false;
        return status == that.status && detail.equals(that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, detail);
    }

    @Override
    public String toString() {
        return detail.isEmpty() ? status.name() : status + ": " + detail;
    }
}
