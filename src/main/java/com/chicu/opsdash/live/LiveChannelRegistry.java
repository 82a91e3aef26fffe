package com.chicu.opsdash.live;

import com.chicu.opsdash.common.time.LenientTimestamps;
import com.chicu.opsdash.config.OpsDashProperties;
import com.chicu.opsdash.source.SourceAdapter;
import com.chicu.opsdash.source.SourceFetcher;
import com.chicu.opsdash.source.mapper.AlertRecordMapper;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import com.chicu.opsdash.web.ws.TelemetryLiveWsBridge;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Один LiveChannelManager на именованную ленту (breaches, alerts, ...).
 */
@Slf4j
@Component
public class LiveChannelRegistry {

    private final OpsDashProperties props;
    private final Map<String, LiveChannelManager> channels = new LinkedHashMap<>();

    public LiveChannelRegistry(OpsDashProperties props,
                               LiveTransport transport,
                               SourceFetcher fetcher,
                               ObjectMapper objectMapper,
                               LenientTimestamps timestamps,
                               @Qualifier("opsScheduler") ScheduledExecutorService scheduler,
                               TelemetryLiveWsBridge wsBridge) {
        this.props = props;

        OpsDashProperties.Live live = props.getLive();
        AlertRecordMapper mapper = new AlertRecordMapper();
        LiveEventDecoder decoder = new LiveEventDecoder(objectMapper, mapper, timestamps);

        live.getFeeds().forEach((name, feed) -> {
            SourceAdapter<TelemetryEvent> pollSource =
                    new SourceAdapter<>("live-" + name, live.getPollPaths(), fetcher, mapper, timestamps);

            LiveChannelManager manager = LiveChannelManager.builder()
                    .feed(name)
                    .streamPath(live.getStreamPath())
                    .transport(transport)
                    .decoder(decoder)
                    .pollSource(pollSource)
                    .scheduler(scheduler)
                    .pollInterval(live.getPollInterval())
                    .pollLimit(live.getPollLimit())
                    .streamRetryInterval(live.getStreamRetryInterval())
                    .eventFilter(feed.getEventFilter())
                    .capacity(feed.getCapacity())
                    .build();

            manager.addListener(wsBridge::publishLive);
            channels.put(name, manager);
        });
    }

    @PostConstruct
    public void init() {
        if (!props.getLive().isAutostart()) {
            log.info("📡 live channels: autostart выключен ({} лент)", channels.size());
            return;
        }
        channels.values().forEach(LiveChannelManager::start);
    }

    @PreDestroy
    public void shutdown() {
        log.info("💤 live channels shutting down…");
        channels.values().forEach(LiveChannelManager::stop);
    }

    public LiveChannelManager get(String feed) {
        LiveChannelManager m = channels.get(feed);
        if (m == null) {
            throw new NoSuchElementException("Unknown live feed: " + feed);
        }
        return m;
    }

    public Collection<LiveChannelManager> all() {
        return Collections.unmodifiableCollection(channels.values());
    }
}
