package com.sentinelx.flink;

import com.sentinelx.core.model.InteractionEvent;

import java.io.Serializable;
import java.util.Objects;

/**
 * An {@link InteractionEvent} tagged with the session it belongs to; the
 * unit keyed by the streaming job.
 */
public final class SessionEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sessionId;
    private final InteractionEvent event;

    public SessionEvent(String sessionId, InteractionEvent event) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.event = Objects.requireNonNull(event, "event must not be null");
    }

    public String getSessionId() {
        return sessionId;
    }

    public InteractionEvent getEvent() {
        return event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SessionEvent that))
            return false;
        return sessionId.equals(that.sessionId) && event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, event);
    }

    @Override
    public String toString() {
        return "SessionEvent{sessionId='" + sessionId + "', event=" + event + '}';
    }
}
