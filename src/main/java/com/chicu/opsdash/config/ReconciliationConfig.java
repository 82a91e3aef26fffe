package com.chicu.opsdash.config;

import com.chicu.opsdash.aggregate.CrossSourceAggregator;
import com.chicu.opsdash.aggregate.RestTemplateWriteBackClient;
import com.chicu.opsdash.aggregate.WriteBackClient;
import com.chicu.opsdash.common.enums.RefreshCadence;
import com.chicu.opsdash.common.time.LenientTimestamps;
import com.chicu.opsdash.fusion.DiscrepancyRule;
import com.chicu.opsdash.fusion.ExecutionTelemetryFusionEngine;
import com.chicu.opsdash.regime.FileKeyValueStore;
import com.chicu.opsdash.regime.InMemoryKeyValueStore;
import com.chicu.opsdash.regime.KeyValueStore;
import com.chicu.opsdash.regime.RegimeHistoryBuffer;
import com.chicu.opsdash.regime.RegimeTimelineService;
import com.chicu.opsdash.snapshot.SnapshotService;
import com.chicu.opsdash.source.PayloadEnvelope;
import com.chicu.opsdash.source.RecordMapper;
import com.chicu.opsdash.source.SourceAdapter;
import com.chicu.opsdash.source.SourceFetcher;
import com.chicu.opsdash.source.mapper.AlertRecordMapper;
import com.chicu.opsdash.source.mapper.AnomalyRecordMapper;
import com.chicu.opsdash.source.mapper.AuditRecordMapper;
import com.chicu.opsdash.source.mapper.ComplianceRecordMapper;
import com.chicu.opsdash.source.mapper.ImpactRecordMapper;
import com.chicu.opsdash.source.mapper.LatencyRecordMapper;
import com.chicu.opsdash.source.mapper.NotificationRecordMapper;
import com.chicu.opsdash.source.mapper.RegimeRecordMapper;
import com.chicu.opsdash.source.mapper.VenueHealthRecordMapper;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import com.chicu.opsdash.telemetry.model.VenueHealth;
import com.chicu.opsdash.web.ws.TelemetryLiveWsBridge;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Сборка слоя сверки: адаптеры источников, пулы, агрегатор, fusion, режимы, панели.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(OpsDashProperties.class)
public class ReconciliationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LenientTimestamps lenientTimestamps(Clock clock) {
        return new LenientTimestamps(clock);
    }

    // =====================================================================
    // POOLS
    // =====================================================================

    /** Блокирующие HTTP-выборки источников */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService opsIoExecutor(OpsDashProperties props) {
        return Executors.newFixedThreadPool(Math.max(2, props.getRefresh().getIoThreads()), daemon("OpsIo-"));
    }

    /**
     * Таймеры: периодические обновления, polling live-каналов, retry потока.
     * Делается daemon=true чтобы не блокировать завершение приложения.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService opsScheduler() {
        return Executors.newScheduledThreadPool(
                Math.max(2, Runtime.getRuntime().availableProcessors()),
                daemon("OpsScheduler-"));
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName(prefix + seq.incrementAndGet());
            return t;
        };
    }

    // =====================================================================
    // FEED
    // =====================================================================

    @Bean
    public WriteBackClient writeBackClient(@Qualifier("upstreamRestTemplate") RestTemplate restTemplate,
                                           OpsDashProperties props) {
        return new RestTemplateWriteBackClient(restTemplate, props);
    }

    @Bean
    public CrossSourceAggregator crossSourceAggregator(OpsDashProperties props,
                                                       SourceFetcher fetcher,
                                                       LenientTimestamps timestamps,
                                                       WriteBackClient writeBackClient,
                                                       @Qualifier("opsIoExecutor") ExecutorService io,
                                                       Clock clock,
                                                       TelemetryLiveWsBridge wsBridge) {
        OpsDashProperties.Sources s = props.getSources();

        // порядок списка = порядок при равных timestamp
        List<SourceAdapter<TelemetryEvent>> adapters = List.of(
                new SourceAdapter<>("alerts", s.getAlerts(), fetcher, new AlertRecordMapper(), timestamps),
                new SourceAdapter<>("notifications", s.getNotifications(), fetcher, new NotificationRecordMapper(), timestamps),
                new SourceAdapter<>("compliance", s.getCompliance(), fetcher, new ComplianceRecordMapper(), timestamps),
                new SourceAdapter<>("audit", s.getAudit(), fetcher, new AuditRecordMapper(), timestamps),
                new SourceAdapter<>("anomalies", s.getAnomalies(), fetcher, new AnomalyRecordMapper(), timestamps)
        );

        CrossSourceAggregator aggregator = new CrossSourceAggregator(
                adapters, writeBackClient, io, io, props.getFeed().getCapacity(), clock);
        aggregator.addListener(wsBridge::publishAlerts);
        return aggregator;
    }

    // =====================================================================
    // FUSION
    // =====================================================================

    @Bean
    public ExecutionTelemetryFusionEngine executionTelemetryFusionEngine(OpsDashProperties props,
                                                                         SourceFetcher fetcher,
                                                                         LenientTimestamps timestamps,
                                                                         @Qualifier("opsIoExecutor") ExecutorService io,
                                                                         Clock clock) {
        OpsDashProperties.Sources s = props.getSources();
        return new ExecutionTelemetryFusionEngine(
                new SourceAdapter<>("latency", s.getLatency(), fetcher, new LatencyRecordMapper(), timestamps),
                new SourceAdapter<>("impact", s.getImpact(), fetcher, new ImpactRecordMapper(), timestamps),
                io,
                new DiscrepancyRule(props.getFusion().getDiscrepancyThreshold()),
                clock
        );
    }

    // =====================================================================
    // REGIME
    // =====================================================================

    @Bean
    public KeyValueStore keyValueStore(OpsDashProperties props, ObjectMapper objectMapper) {
        OpsDashProperties.Regime r = props.getRegime();
        if ("file".equalsIgnoreCase(r.getStore())) {
            log.info("💾 kv-store: file {}", r.getFile());
            return new FileKeyValueStore(Path.of(r.getFile()), objectMapper);
        }
        log.info("💾 kv-store: memory");
        return new InMemoryKeyValueStore();
    }

    @Bean
    public RegimeTimelineService regimeTimelineService(OpsDashProperties props,
                                                       SourceFetcher fetcher,
                                                       LenientTimestamps timestamps,
                                                       KeyValueStore store,
                                                       ObjectMapper objectMapper,
                                                       Clock clock) {
        OpsDashProperties.Regime r = props.getRegime();
        RegimeHistoryBuffer history = new RegimeHistoryBuffer(store, objectMapper, r.getHistoryKey(), r.getCapacity());
        return new RegimeTimelineService(
                new SourceAdapter<>("regime", props.getSources().getRegime(), fetcher, new RegimeRecordMapper(), timestamps),
                history,
                clock
        );
    }

    // =====================================================================
    // SNAPSHOTS
    // =====================================================================

    @Bean
    public SnapshotService snapshotService(OpsDashProperties props,
                                           SourceFetcher fetcher,
                                           LenientTimestamps timestamps,
                                           Clock clock) {
        SnapshotService service = new SnapshotService(clock);
        RecordMapper<JsonNode> passThrough = (item, ctx) -> item;

        for (Map.Entry<String, OpsDashProperties.Snapshot> e : props.getSnapshots().entrySet()) {
            SourceAdapter<JsonNode> adapter =
                    new SourceAdapter<>(e.getKey(), e.getValue().getPaths(), fetcher, passThrough, timestamps);
            service.register(e.getKey(), e.getValue().getInterval(),
                    () -> adapter.fetchEnvelope(Map.of()).map(PayloadEnvelope::unwrap));
        }

        // здоровье площадок - типизированно
        SourceAdapter<VenueHealth> venues = new SourceAdapter<>("venue-health", props.getSources().getVenueHealth(),
                fetcher, new VenueHealthRecordMapper(), timestamps);
        Duration venueInterval = RefreshCadence.REGISTRIES.getInterval();
        service.register("venue-health", venueInterval, () -> venues.tryFetch(Map.of()));

        log.info("🗂 snapshots: {}", service.names());
        return service;
    }
}
