package com.sentinelx.flink;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Deployment settings of the SentinelX Flink job, read from environment
 * variables.
 *
 * <table>
 * <caption>Variables</caption>
 * <tr><td>{@code KAFKA_BOOTSTRAP_SERVERS}</td><td>localhost:9092</td></tr>
 * <tr><td>{@code KAFKA_EVENT_TOPIC}</td><td>interaction-events</td></tr>
 * <tr><td>{@code KAFKA_REPORT_TOPIC}</td><td>risk-reports</td></tr>
 * <tr><td>{@code KAFKA_GROUP_ID}</td><td>sentinelx</td></tr>
 * <tr><td>{@code FLINK_PARALLELISM}</td><td>1</td></tr>
 * <tr><td>{@code FLINK_CHECKPOINT_INTERVAL_MS}</td><td>60000</td></tr>
 * <tr><td>{@code SENTINEL_CONFIG_PATH}</td><td>blank: classpath {@code sentinel.yml}</td></tr>
 * <tr><td>{@code SESSION_IDLE_TIMEOUT_MS}</td><td>600000</td></tr>
 * <tr><td>{@code HEALTH_PORT}</td><td>8080</td></tr>
 * </table>
 *
 * <p>
 * Pipeline tuning (windows, thresholds, weights) is not here; it lives in
 * the YAML file.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String kafkaBootstrapServers;
    private final String kafkaEventTopic;
    private final String kafkaReportTopic;
    private final String kafkaGroupId;
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final String sentinelConfigPath;
    private final long sessionIdleTimeoutMs;
    private final int healthPort;

    private JobConfig(UnaryOperator<String> env) {
        kafkaBootstrapServers = value(env, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092");
        kafkaEventTopic = value(env, "KAFKA_EVENT_TOPIC", "interaction-events");
        kafkaReportTopic = value(env, "KAFKA_REPORT_TOPIC", "risk-reports");
        kafkaGroupId = value(env, "KAFKA_GROUP_ID", "sentinelx");
        sentinelConfigPath = value(env, "SENTINEL_CONFIG_PATH", "");
        try {
            parallelism = Integer.parseInt(value(env, "FLINK_PARALLELISM", "1"));
            checkpointIntervalMs = Long.parseLong(value(env, "FLINK_CHECKPOINT_INTERVAL_MS", "60000"));
            sessionIdleTimeoutMs = Long.parseLong(value(env, "SESSION_IDLE_TIMEOUT_MS", "600000"));
            healthPort = Integer.parseInt(value(env, "HEALTH_PORT", "8080"));
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Resolve the configuration from the process environment.
     *
     * @throws IllegalStateException    if a numeric value cannot be parsed
     * @throws IllegalArgumentException if any value is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static JobConfig fromEnvironment(UnaryOperator<String> env) {
        JobConfig config = new JobConfig(env);
        config.validate();
        return config;
    }

    private void validate() {
        List<String> errors = new ArrayList<>();
        if (parallelism < 1) {
            errors.add("FLINK_PARALLELISM must be >= 1, got: " + parallelism);
        }
        if (checkpointIntervalMs < 1) {
            errors.add("FLINK_CHECKPOINT_INTERVAL_MS must be >= 1, got: " + checkpointIntervalMs);
        }
        if (sessionIdleTimeoutMs < 1) {
            errors.add("SESSION_IDLE_TIMEOUT_MS must be >= 1, got: " + sessionIdleTimeoutMs);
        }
        if (healthPort < 1 || healthPort > 65_535) {
            errors.add("HEALTH_PORT must be in [1, 65535], got: " + healthPort);
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Job configuration invalid:\n  - " + String.join("\n  - ", errors));
        }
    }

    /** Producer settings for the exactly-once report sink. */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaEventTopic() {
        return kafkaEventTopic;
    }

    public String getKafkaReportTopic() {
        return kafkaReportTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /** Pipeline YAML path; blank means classpath {@code sentinel.yml}. */
    public String getSentinelConfigPath() {
        return sentinelConfigPath;
    }

    public long getSessionIdleTimeoutMs() {
        return sessionIdleTimeoutMs;
    }

    public int getHealthPort() {
        return healthPort;
    }

    private static String value(UnaryOperator<String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{kafka=" + kafkaBootstrapServers
                + ", topics=" + kafkaEventTopic + "->" + kafkaReportTopic
                + ", group=" + kafkaGroupId
                + ", parallelism=" + parallelism
                + ", checkpointMs=" + checkpointIntervalMs
                + ", config=" + (sentinelConfigPath.isEmpty() ? "<classpath>" : sentinelConfigPath)
                + ", idleTimeoutMs=" + sessionIdleTimeoutMs
                + ", healthPort=" + healthPort
                + '}';
    }
}
