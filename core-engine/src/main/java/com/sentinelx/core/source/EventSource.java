package com.sentinelx.core.source;

import com.sentinelx.core.model.InteractionEvent;

import java.time.Duration;
import java.util.List;

/**
 * Producer of timing-only interaction events, drained by the polling loop.
 */
public interface EventSource {

    /** Begin producing events. Calling it twice has no effect. */
    void start();

    /** Stop producing events. Buffered events may still be drained. */
    void stop();

    /**
     * Collect buffered events, waiting at most {@code timeout} for the first
     * one.
     *
     * @return drained events in arrival order, possibly empty
     */
    List<InteractionEvent> drain(Duration timeout);
}
