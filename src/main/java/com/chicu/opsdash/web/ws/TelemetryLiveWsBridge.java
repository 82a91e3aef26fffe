package com.chicu.opsdash.web.ws;

import com.chicu.opsdash.live.LiveChannelState;
import com.chicu.opsdash.telemetry.model.HeatmapResult;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Рассылка снимков в STOMP-топики.
 *  /topic/ops/alerts       - лента после refresh / действия
 *  /topic/ops/heatmap      - результат fusion
 *  /topic/ops/live/{feed}  - состояние live-канала
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelemetryLiveWsBridge {

    public static final String ALERTS_TOPIC = "/topic/ops/alerts";
    public static final String HEATMAP_TOPIC = "/topic/ops/heatmap";
    public static final String LIVE_TOPIC_PREFIX = "/topic/ops/live/";

    private final SimpMessagingTemplate ws;

    /**
     * 🔁 Дедупликация последних снимков
     * key = топик, value = последний отправленный payload
     */
    private final Map<String, Object> lastPayload = new ConcurrentHashMap<>();

    // =====================================================
    // PUBLIC API
    // =====================================================

    public void publishLive(LiveChannelState state) {
        if (state == null || state.feed() == null) {
            log.warn("🚫 LIVE publish called with NULL state");
            return;
        }
        send(LIVE_TOPIC_PREFIX + state.feed(), state);
    }

    public void publishAlerts(List<TelemetryEvent> feed) {
        if (feed == null) return;
        send(ALERTS_TOPIC, feed);
    }

    public void publishHeatmap(HeatmapResult result) {
        if (result == null) return;
        send(HEATMAP_TOPIC, result);
    }

    // =====================================================
    // HELPERS
    // =====================================================

    private void send(String dest, Object payload) {
        Object prev = lastPayload.put(dest, payload);
        if (payload.equals(prev)) {
            log.debug("🔕 WS DEDUP SKIP {}", dest);
            return;
        }

        try {
            log.debug("📡 WS SEND → {}", dest);
            ws.convertAndSend(dest, payload);
        } catch (Exception e) {
            // push не должен ломать цикл обновления
            lastPayload.remove(dest);
            log.warn("⚠ WS send failed {}: {}", dest, e.getMessage());
        }
    }
}
