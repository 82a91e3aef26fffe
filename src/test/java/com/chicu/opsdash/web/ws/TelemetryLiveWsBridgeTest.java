package com.chicu.opsdash.web.ws;

import com.chicu.opsdash.common.enums.ChannelMode;
import com.chicu.opsdash.common.enums.EventSource;
import com.chicu.opsdash.live.LiveChannelState;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TelemetryLiveWsBridgeTest {

    private static final Instant TS = Instant.parse("2024-02-01T00:00:00Z");

    @Mock private SimpMessagingTemplate template;

    private TelemetryLiveWsBridge bridge;

    @BeforeEach
    void setUp() {
        bridge = new TelemetryLiveWsBridge(template);
    }

    private static TelemetryEvent event(String id, boolean read) {
        return TelemetryEvent.builder()
                .id(id).timestamp(TS).source(EventSource.ALERTS).read(read).build();
    }

    @Test
    void equalFeedIsNotResent() {
        bridge.publishAlerts(List.of(event("a", false)));
        bridge.publishAlerts(List.of(event("a", false)));

        verify(template, times(1)).convertAndSend(eq(TelemetryLiveWsBridge.ALERTS_TOPIC), any(Object.class));
    }

    @Test
    void changedFeedIsSentAgain() {
        List<TelemetryEvent> first = List.of(event("a", false));
        List<TelemetryEvent> second = List.of(event("a", true));

        bridge.publishAlerts(first);
        bridge.publishAlerts(second);

        verify(template).convertAndSend(TelemetryLiveWsBridge.ALERTS_TOPIC, (Object) first);
        verify(template).convertAndSend(TelemetryLiveWsBridge.ALERTS_TOPIC, (Object) second);
    }

    @Test
    void failedSendDoesNotSuppressRetry() {
        List<TelemetryEvent> feed = List.of(event("a", false));
        doThrow(new MessagingException("broker down"))
                .doNothing()
                .when(template).convertAndSend(eq(TelemetryLiveWsBridge.ALERTS_TOPIC), any(Object.class));

        bridge.publishAlerts(feed);
        bridge.publishAlerts(List.of(event("a", false)));

        verify(template, times(2)).convertAndSend(eq(TelemetryLiveWsBridge.ALERTS_TOPIC), any(Object.class));
    }

    @Test
    void liveTopicsAreDedupedPerFeed() {
        LiveChannelState alerts = new LiveChannelState("alerts", ChannelMode.POLLING, TS, List.of(), 1);
        LiveChannelState audit = new LiveChannelState("audit", ChannelMode.POLLING, TS, List.of(), 1);

        bridge.publishLive(alerts);
        bridge.publishLive(audit);
        bridge.publishLive(new LiveChannelState("alerts", ChannelMode.POLLING, TS, List.of(), 1));

        verify(template).convertAndSend(TelemetryLiveWsBridge.LIVE_TOPIC_PREFIX + "alerts", (Object) alerts);
        verify(template).convertAndSend(TelemetryLiveWsBridge.LIVE_TOPIC_PREFIX + "audit", (Object) audit);
        verifyNoMoreInteractions(template);
    }

    @Test
    void nullStateIsIgnored() {
        bridge.publishLive(null);
        bridge.publishAlerts(null);
        bridge.publishHeatmap(null);

        verifyNoInteractions(template);
    }
}
