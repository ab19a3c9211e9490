package com.sentinelx.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Immutable, timestamp-only interaction event.
 *
 * <p>
 * The payload depends on the {@link EventKind}: mouse kinds carry screen
 * coordinates, idle kinds carry a duration in seconds and focus kinds carry a
 * lost/gained flag. Keystrokes carry nothing but their timestamp.
 * </p>
 *
 * <p>
 * JSON form (snake_case, absent payload fields omitted):
 * </p>
 *
 * <pre>
 * {"timestamp": 1718000000.25, "type": "mouse_move", "x": 640, "y": 360}
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"timestamp", "type", "x", "y", "duration", "lost_focus"})
public final class InteractionEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Event time in seconds; monotonic-ish, not guaranteed ordered. */
    private final double timestamp;

    private final EventKind kind;

    private final Integer x;
    private final Integer y;

    /** Idle duration in seconds (idle kinds only). */
    private final Double duration;

    private final Boolean lostFocus;

    @JsonCreator
    public InteractionEvent(@JsonProperty(value = "timestamp", required = true) double timestamp,
            @JsonProperty(value = "type", required = true) EventKind kind,
            @JsonProperty("x") Integer x,
            @JsonProperty("y") Integer y,
            @JsonProperty("duration") Double duration,
            @JsonProperty("lost_focus") Boolean lostFocus) {
        this.timestamp = timestamp;
        this.kind = Objects.requireNonNull(kind, "Event kind must not be null");
        this.x = x;
        this.y = y;
        this.duration = duration;
        this.lostFocus = lostFocus;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static InteractionEvent keyPress(double timestamp) {
        return new InteractionEvent(timestamp, EventKind.KEY_PRESS, null, null, null, null);
    }

    public static InteractionEvent keyRelease(double timestamp) {
        return new InteractionEvent(timestamp, EventKind.KEY_RELEASE, null, null, null, null);
    }

    public static InteractionEvent mouseMove(double timestamp, int x, int y) {
        return new InteractionEvent(timestamp, EventKind.MOUSE_MOVE, x, y, null, null);
    }

    public static InteractionEvent mouseClick(double timestamp, int x, int y) {
        return new InteractionEvent(timestamp, EventKind.MOUSE_CLICK, x, y, null, null);
    }

    public static InteractionEvent mouseScroll(double timestamp, int x, int y) {
        return new InteractionEvent(timestamp, EventKind.MOUSE_SCROLL, x, y, null, null);
    }

    public static InteractionEvent focusLost(double timestamp) {
        return new InteractionEvent(timestamp, EventKind.FOCUS_LOST, null, null, null, true);
    }

    public static InteractionEvent focusGained(double timestamp) {
        return new InteractionEvent(timestamp, EventKind.FOCUS_GAINED, null, null, null, false);
    }

    public static InteractionEvent idlePeriod(double timestamp, double durationSeconds) {
        return new InteractionEvent(timestamp, EventKind.IDLE_PERIOD, null, null, durationSeconds, null);
    }

    public static InteractionEvent idleEnd(double timestamp, double durationSeconds) {
        return new InteractionEvent(timestamp, EventKind.IDLE_END, null, null, durationSeconds, null);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    @JsonProperty("timestamp")
    public double getTimestamp() {
        return timestamp;
    }

    @JsonProperty("type")
    public EventKind getKind() {
        return kind;
    }

    @JsonProperty("x")
    public Integer getX() {
        return x;
    }

    @JsonProperty("y")
    public Integer getY() {
        return y;
    }

    @JsonProperty("duration")
    public Double getDuration() {
        return duration;
    }

    @JsonProperty("lost_focus")
    public Boolean getLostFocus() {
        return lostFocus;
    }

    /**
     * @return {@code true} if both coordinates are present
     */
    @JsonIgnore
    public boolean hasPosition() {
        return x != null && y != null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof InteractionEvent that))
            return false;
        return Double.compare(timestamp, that.timestamp) == 0
                && kind == that.kind
                && Objects.equals(x, that.x)
                && Objects.equals(y, that.y)
                && Objects.equals(duration, that.duration)
                && Objects.equals(lostFocus, that.lostFocus);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, kind, x, y, duration, lostFocus);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("InteractionEvent{")
                .append("timestamp=").append(timestamp)
                .append(", kind=").append(kind);
        if (hasPosition()) {
            sb.append(", x=").append(x).append(", y=").append(y);
        }
        if (duration != null) {
            sb.append(", duration=").append(duration);
        }
        if (lostFocus != null) {
            sb.append(", lostFocus=").append(lostFocus);
        }
        return sb.append('}').toString();
    }
}
