package com.chicu.opsdash.orchestrator;

import com.chicu.opsdash.aggregate.CrossSourceAggregator;
import com.chicu.opsdash.config.OpsDashProperties;
import com.chicu.opsdash.engine.RefreshScheduler;
import com.chicu.opsdash.fusion.HeatmapService;
import com.chicu.opsdash.regime.RegimeTimelineService;
import com.chicu.opsdash.snapshot.SnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;

/**
 * Поднимает периодические обновления всех панелей после старта
 * и снимает их при остановке.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationOrchestrator {

    public static final String ALERT_FEED_KEY = "alert-feed";
    public static final String REGIME_KEY = "regime-timeline";

    private final OpsDashProperties props;
    private final RefreshScheduler scheduler;
    private final CrossSourceAggregator aggregator;
    private final HeatmapService heatmapService;
    private final RegimeTimelineService regimeService;
    private final SnapshotService snapshotService;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        OpsDashProperties.Refresh refresh = props.getRefresh();
        if (!refresh.isEnabled()) {
            log.info("⏸ refresh выключен (opsdash.refresh.enabled=false)");
            return;
        }
        start();
    }

    public void start() {
        OpsDashProperties.Refresh refresh = props.getRefresh();

        scheduler.activate(ALERT_FEED_KEY, handle -> aggregator.refresh(handle::isAlive), refresh.getAlertFeed());
        scheduler.activate(REGIME_KEY, () -> regimeService.refresh(), refresh.getRegime());
        heatmapService.setAutoRefresh(refresh.isHeatmapAutoRefresh());
        snapshotService.activateAll(scheduler);

        log.info("🚀 Reconciliation started: feed={}s heatmap={} regime={}s snapshots={}",
                refresh.getAlertFeed().toSeconds(),
                refresh.isHeatmapAutoRefresh() ? refresh.getHeatmap().toSeconds() + "s" : "off",
                refresh.getRegime().toSeconds(),
                snapshotService.names());
    }

    @PreDestroy
    public void stop() {
        log.info("💤 Reconciliation stopping…");
        heatmapService.setAutoRefresh(false);
        scheduler.deactivate(ALERT_FEED_KEY);
        scheduler.deactivate(REGIME_KEY);
        snapshotService.deactivateAll(scheduler);
    }
}
