package com.sentinelx.flink;

import com.sentinelx.core.config.SentinelConfig;
import com.sentinelx.core.config.SentinelConfigLoader;
import com.sentinelx.core.model.RiskReport;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point of the SentinelX Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (interaction-events)
 *     → JSON → SessionEvent
 *     → key by session id
 *     → SessionRiskFunction (one SessionMonitor per session, timer ticks)
 *     → RiskReport → JSON
 *     → Kafka (risk-reports)
 * </pre>
 *
 * <p>
 * Deployment settings come from {@link JobConfig}; pipeline tuning from the
 * YAML file loaded by {@link SentinelConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelRiskJob {

        private static final Logger LOG = LoggerFactory.getLogger(SentinelRiskJob.class);

        private SentinelRiskJob() {
        }

        public static void main(String[] args) throws Exception {
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting SentinelX with config: {}", config);

                SentinelConfig sentinelConfig = loadSentinelConfig(config);
                LOG.info("Pipeline configuration: {}", sentinelConfig);

                HealthServer healthServer = new HealthServer();
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                buildPipeline(env, config, sentinelConfig);

                healthServer.markReady();
                env.execute("SentinelX - Behavioral Risk Scoring");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        SentinelConfig sentinelConfig) {
                KafkaSource<SessionEvent> kafkaSource = KafkaSource.<SessionEvent>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaEventTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.latest())
                                .setValueOnlyDeserializer(new SessionEventDeserializationSchema())
                                .build();

                // Ticks run on processing time, so no watermarks are needed.
                DataStream<SessionEvent> events = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-interaction-events");

                DataStream<RiskReport> reports = events
                                .filter(Objects::nonNull)
                                .keyBy(SessionEvent::getSessionId)
                                .process(new SessionRiskFunction(sentinelConfig, config.getSessionIdleTimeoutMs()))
                                .name("session-risk");

                KafkaSink<RiskReport> kafkaSink = KafkaSink.<RiskReport>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaReportTopic())
                                                                .setValueSerializationSchema(
                                                                                new RiskReportSerializationSchema())
                                                                .build())
                                .build();

                reports.sinkTo(kafkaSink).name("kafka-risk-reports");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        static SentinelConfig loadSentinelConfig(JobConfig config) {
                String path = config.getSentinelConfigPath();
                if (path != null && !path.isBlank()) {
                        return SentinelConfigLoader.fromFile(path);
                }
                return SentinelConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
