package com.chicu.opsdash.web.controller.api;

import com.chicu.opsdash.common.time.TimeRange;
import com.chicu.opsdash.common.time.TimeWindow;
import com.chicu.opsdash.fusion.FusionQuery;
import com.chicu.opsdash.fusion.HeatmapService;
import com.chicu.opsdash.regime.RegimeTimelineService;
import com.chicu.opsdash.telemetry.model.HeatmapResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/ops/execution/heatmap")
public class ExecutionHeatmapApiController {

    private final HeatmapService heatmapService;
    private final RegimeTimelineService regimeService;

    /**
     * GET /api/ops/execution/heatmap?venue=binance&symbol=BTCUSDT&window=4h
     * Диапазон: from/to (epoch ms) или regime=<id сегмента>, важнее window.
     */
    @GetMapping
    public HeatmapResult heatmap(
            @RequestParam(required = false) String venue,
            @RequestParam(required = false) String symbol,
            @RequestParam(required = false) String window,
            @RequestParam(required = false) Long from,
            @RequestParam(required = false) Long to,
            @RequestParam(required = false) String regime
    ) {
        FusionQuery.FusionQueryBuilder q = FusionQuery.builder()
                .venue(venue)
                .symbol(symbol)
                .window(window != null ? TimeWindow.from(window) : heatmapService.defaultQuery().getWindow());

        if (regime != null && !regime.isBlank()) {
            q.range(regimeService.select(regime));
        } else if (from != null || to != null) {
            if (from == null || to == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "from и to задаются вместе");
            }
            try {
                q.range(TimeRange.ofEpochMillis(from, to));
            } catch (IllegalArgumentException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
            }
        }

        FusionQuery query = q.build();
        log.info("🌐 [API] heatmap venue={} symbol={} window={}", query.getVenue(), query.getSymbol(), query.windowCode());
        return heatmapService.query(query);
    }

    @PostMapping("/auto-refresh")
    public Map<String, Object> autoRefresh(@RequestParam boolean enabled) {
        heatmapService.setAutoRefresh(enabled);
        return Map.of("autoRefresh", heatmapService.isAutoRefresh());
    }
}
