package com.chicu.opsdash.fusion;

import com.chicu.opsdash.common.time.TimeWindow;
import com.chicu.opsdash.config.OpsDashProperties;
import com.chicu.opsdash.engine.RefreshHandle;
import com.chicu.opsdash.engine.RefreshScheduler;
import com.chicu.opsdash.telemetry.model.HeatmapResult;
import com.chicu.opsdash.web.ws.TelemetryLiveWsBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Последний результат heatmap по каждому запросу + авто-обновление текущего запроса.
 */
@Slf4j
@Service
public class HeatmapService {

    public static final String REFRESH_KEY = "execution-heatmap";

    private static final int MAX_CACHED_QUERIES = 16;

    private final ExecutionTelemetryFusionEngine engine;
    private final RefreshScheduler scheduler;
    private final TelemetryLiveWsBridge wsBridge;
    private final Duration interval;
    private final TimeWindow defaultWindow;

    private final Map<FusionQuery, HeatmapResult> lastResults =
            new LinkedHashMap<>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<FusionQuery, HeatmapResult> eldest) {
                    return size() > MAX_CACHED_QUERIES;
                }
            };

    private volatile FusionQuery current;
    private volatile boolean autoRefresh;

    public HeatmapService(ExecutionTelemetryFusionEngine engine,
                          RefreshScheduler scheduler,
                          TelemetryLiveWsBridge wsBridge,
                          OpsDashProperties props) {
        this.engine = engine;
        this.scheduler = scheduler;
        this.wsBridge = wsBridge;
        this.interval = props.getRefresh().getHeatmap();
        this.defaultWindow = TimeWindow.from(props.getFusion().getDefaultWindow());
        this.current = FusionQuery.builder().window(defaultWindow).build();
    }

    public FusionQuery defaultQuery() {
        return FusionQuery.builder().window(defaultWindow).build();
    }

    /** Прогон сейчас; запрос становится текущим для авто-обновления */
    public HeatmapResult query(FusionQuery query) {
        current = query;
        HeatmapResult result = engine.fuse(query);
        store(query, result);
        return result;
    }

    public Optional<HeatmapResult> last(FusionQuery query) {
        synchronized (lastResults) {
            return Optional.ofNullable(lastResults.get(query));
        }
    }

    public FusionQuery getCurrent() {
        return current;
    }

    // =====================================================================
    // AUTO-REFRESH
    // =====================================================================

    public boolean isAutoRefresh() {
        return autoRefresh;
    }

    public synchronized void setAutoRefresh(boolean enabled) {
        if (enabled == autoRefresh) {
            return;
        }
        autoRefresh = enabled;
        if (enabled) {
            scheduler.activate(REFRESH_KEY, this::refreshCurrent, interval);
        } else {
            scheduler.deactivate(REFRESH_KEY);
        }
        log.info("🔥 heatmap auto-refresh: {}", enabled ? "ON" : "OFF");
    }

    void refreshCurrent(RefreshHandle handle) {
        FusionQuery q = current;
        HeatmapResult result = engine.fuse(q);
        if (!handle.isAlive()) {
            log.debug("heatmap: авто-обновление снято, результат отброшен");
            return;
        }
        store(q, result);
    }

    private void store(FusionQuery query, HeatmapResult result) {
        synchronized (lastResults) {
            lastResults.put(query, result);
        }
        if (query.equals(current)) {
            wsBridge.publishHeatmap(result);
        }
    }
}
