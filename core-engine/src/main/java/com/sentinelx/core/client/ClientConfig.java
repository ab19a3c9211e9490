package com.sentinelx.core.client;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Deployment settings of the standalone client, resolved from environment
 * variables.
 *
 * <ul>
 * <li>{@code SENTINEL_SESSIONS}: number of independent sessions (default 1)</li>
 * <li>{@code SENTINEL_SERVER_URL}: collector base URL; unset means in-process
 * collection</li>
 * <li>{@code SENTINEL_DURATION_SECONDS}: run time, 0 runs until interrupted</li>
 * <li>{@code SENTINEL_SEED}: base seed of the synthetic sources</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ClientConfig {

    private final int sessions;
    private final String serverUrl;
    private final long durationSeconds;
    private final long seed;

    private ClientConfig(int sessions, String serverUrl, long durationSeconds, long seed) {
        this.sessions = sessions;
        this.serverUrl = serverUrl;
        this.durationSeconds = durationSeconds;
        this.seed = seed;
    }

    public static ClientConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * @throws IllegalStateException    if a numeric value cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    static ClientConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            int sessions = Integer.parseInt(value(env, "SENTINEL_SESSIONS", "1"));
            long duration = Long.parseLong(value(env, "SENTINEL_DURATION_SECONDS", "0"));
            long seed = Long.parseLong(value(env, "SENTINEL_SEED", String.valueOf(System.nanoTime())));
            String url = value(env, "SENTINEL_SERVER_URL", null);

            if (sessions < 1) {
                throw new IllegalArgumentException("SENTINEL_SESSIONS must be >= 1, got: " + sessions);
            }
            if (duration < 0) {
                throw new IllegalArgumentException("SENTINEL_DURATION_SECONDS must be >= 0, got: " + duration);
            }
            return new ClientConfig(sessions, url, duration, seed);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    public int getSessions() {
        return sessions;
    }

    public Optional<String> getServerUrl() {
        return Optional.ofNullable(serverUrl);
    }

    public long getDurationSeconds() {
        return durationSeconds;
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return "ClientConfig{" +
                "sessions=" + sessions +
                ", serverUrl=" + (serverUrl != null ? serverUrl : "<in-memory>") +
                ", durationSeconds=" + durationSeconds +
                ", seed=" + seed +
                '}';
    }
}
