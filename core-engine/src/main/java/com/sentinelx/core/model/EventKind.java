package com.sentinelx.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of timing-only interaction events.
 *
 * <p>
 * The wire name of each kind is its lowercase form ({@code key_press},
 * {@code mouse_move}, ...). No kind carries content: keystrokes carry no key
 * identity and focus changes carry no window title.
 * </p>
 *
 * @since 1.0.0
 */
public enum EventKind {

    KEY_PRESS,
    KEY_RELEASE,
    MOUSE_MOVE,
    MOUSE_CLICK,
    MOUSE_SCROLL,
    FOCUS_LOST,
    FOCUS_GAINED,
    IDLE_PERIOD,
    IDLE_END;

    /**
     * @return the lowercase wire name
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a kind from its wire name (case-insensitive).
     *
     * @param value wire name, e.g. {@code "key_press"}
     * @return the matching kind
     * @throws IllegalArgumentException if {@code value} is {@code null} or unknown
     */
    @JsonCreator
    public static EventKind fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Event kind must not be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event kind: '" + value + "'", e);
        }
    }

    public boolean isMouse() {
        return this == MOUSE_MOVE || this == MOUSE_CLICK || this == MOUSE_SCROLL;
    }

    public boolean isIdle() {
        return this == IDLE_PERIOD || this == IDLE_END;
    }

    public boolean isFocus() {
        return this == FOCUS_LOST || this == FOCUS_GAINED;
    }
}
