package com.sentinelx.core.client;

import com.sentinelx.core.config.SentinelConfig;
import com.sentinelx.core.config.SentinelConfigLoader;
import com.sentinelx.core.model.SessionSummary;
import com.sentinelx.core.session.LoggingPipelineObserver;
import com.sentinelx.core.session.MonitoringLoop;
import com.sentinelx.core.session.SessionMonitor;
import com.sentinelx.core.sink.HttpReportSink;
import com.sentinelx.core.sink.InMemoryReportSink;
import com.sentinelx.core.sink.ReportSink;
import com.sentinelx.core.source.SyntheticEventSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Standalone client running one or more independent monitoring sessions.
 *
 * <p>
 * Each session owns its event source, monitor and polling loop on a
 * dedicated thread; nothing mutable is shared between sessions except the
 * thread-safe in-process collector. Events come from
 * {@link SyntheticEventSource}; OS-level capture plugs in through
 * {@link com.sentinelx.core.source.QueuedEventSource}.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelClient {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelClient.class);

    private final SentinelConfig config;
    private final ClientConfig clientConfig;
    private final ReportSink sink;
    private final List<MonitoringLoop> loops = new ArrayList<>();
    private ExecutorService executor;

    public SentinelClient(SentinelConfig config, ClientConfig clientConfig) {
        this.config = Objects.requireNonNull(config, "SentinelConfig must not be null");
        this.clientConfig = Objects.requireNonNull(clientConfig, "ClientConfig must not be null");
        this.sink = clientConfig.getServerUrl()
                .<ReportSink>map(HttpReportSink::new)
                .orElseGet(InMemoryReportSink::new);
    }

    public static void main(String[] args) throws InterruptedException {
        SentinelConfig config = SentinelConfigLoader.load();
        ClientConfig clientConfig = ClientConfig.fromEnvironment();
        LOG.info("Starting SentinelX client with {}", clientConfig);

        SentinelClient client = new SentinelClient(config, clientConfig);
        Runtime.getRuntime().addShutdownHook(new Thread(client::stop, "sentinelx-shutdown"));
        client.start();

        if (clientConfig.getDurationSeconds() > 0) {
            TimeUnit.SECONDS.sleep(clientConfig.getDurationSeconds());
            client.stop();
        } else {
            client.awaitTermination();
        }
    }

    /**
     * Start every session loop.
     */
    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Client already started");
        }
        int sessions = clientConfig.getSessions();
        executor = Executors.newFixedThreadPool(sessions, sessionThreadFactory());
        for (int i = 0; i < sessions; i++) {
            String sessionId = UUID.randomUUID().toString();
            SessionMonitor monitor = new SessionMonitor(sessionId, config, new LoggingPipelineObserver());
            SyntheticEventSource source = new SyntheticEventSource(clientConfig.getSeed() + i);
            MonitoringLoop loop = new MonitoringLoop(monitor, source, sink, config.getReporting());
            loops.add(loop);
            executor.submit(loop);
            LOG.info("Session {} started", sessionId);
        }
    }

    /**
     * Stop every loop, wait for them and log per-session summaries.
     */
    public synchronized void stop() {
        if (executor == null || executor.isShutdown()) {
            return;
        }
        loops.forEach(MonitoringLoop::stop);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Session loops did not stop in time, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (MonitoringLoop loop : loops) {
            SessionMonitor monitor = loop.getMonitor();
            LOG.info("Session {} finished: {}", monitor.getSessionId(), monitor);
            summary(monitor.getSessionId()).ifPresent(s -> LOG.info("Collector summary: {}", s));
        }
        if (sink instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                LOG.warn("Failed to close report sink: {}", e.getMessage());
            }
        }
    }

    /** Threads named {@code sentinelx-session-0..N-1} in creation order. */
    static ThreadFactory sessionThreadFactory() {
        AtomicInteger next = new AtomicInteger();
        return r -> new Thread(r, "sentinelx-session-" + next.getAndIncrement());
    }

    void awaitTermination() throws InterruptedException {
        while (executor != null && !executor.awaitTermination(1, TimeUnit.HOURS)) {
            LOG.debug("Client still running");
        }
    }

    /**
     * Collector summary of a session when reports are collected in process.
     */
    public Optional<SessionSummary> summary(String sessionId) {
        if (sink instanceof InMemoryReportSink memory) {
            return memory.getAggregator().summary(sessionId);
        }
        return Optional.empty();
    }

    public List<MonitoringLoop> getLoops() {
        return List.copyOf(loops);
    }

    ReportSink getSink() {
        return sink;
    }
}
