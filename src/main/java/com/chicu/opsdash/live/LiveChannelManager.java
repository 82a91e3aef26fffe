package com.chicu.opsdash.live;

import com.chicu.opsdash.common.enums.ChannelMode;
import com.chicu.opsdash.source.SourceAdapter;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Live-канал одной ленты: SSE-поток с деградацией в polling.
 *
 * CONNECTING → STREAMING на открытии или первом событии;
 * ошибка/закрытие потока → POLLING ровно один раз на обрыв;
 * stop() → CLOSED из любого состояния.
 *
 * Курсор = максимальный timestamp из всех увиденных событий, назад не ходит.
 * Polling не вливает события с timestamp <= курсора.
 */
@Slf4j
public class LiveChannelManager {

    private final String feed;
    private final String streamPath;
    private final LiveTransport transport;
    private final LiveEventDecoder decoder;
    private final SourceAdapter<TelemetryEvent> pollSource;
    private final ScheduledExecutorService scheduler;

    private final Duration pollInterval;
    private final int pollLimit;
    private final Duration streamRetryInterval;

    /** пусто = пропускать всё */
    private final String eventFilter;

    private final EventBuffer buffer;
    private final List<Consumer<LiveChannelState>> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();

    // ---- состояние под lock ----
    private ChannelMode mode = ChannelMode.CLOSED;
    private Instant cursor;
    private LiveConnection connection;
    /** номер текущего подключения; колбэки чужих подключений игнорируются */
    private long generation;
    private ScheduledFuture<?> pollFuture;
    private ScheduledFuture<?> retryFuture;
    private int fallbacks;

    @Builder
    public LiveChannelManager(String feed,
                              String streamPath,
                              LiveTransport transport,
                              LiveEventDecoder decoder,
                              SourceAdapter<TelemetryEvent> pollSource,
                              ScheduledExecutorService scheduler,
                              Duration pollInterval,
                              int pollLimit,
                              Duration streamRetryInterval,
                              String eventFilter,
                              int capacity) {
        this.feed = feed;
        this.streamPath = streamPath;
        this.transport = transport;
        this.decoder = decoder;
        this.pollSource = pollSource;
        this.scheduler = scheduler;
        this.pollInterval = pollInterval != null ? pollInterval : Duration.ofSeconds(3);
        this.pollLimit = pollLimit > 0 ? pollLimit : 50;
        this.streamRetryInterval = streamRetryInterval != null ? streamRetryInterval : Duration.ZERO;
        this.eventFilter = eventFilter == null ? "" : eventFilter.trim();
        this.buffer = new EventBuffer(capacity > 0 ? capacity : 200);
    }

    public String getFeed() {
        return feed;
    }

    public void addListener(Consumer<LiveChannelState> listener) {
        listeners.add(listener);
    }

    // =====================================================================
    // ▶️ START / ⏹ STOP
    // =====================================================================

    public void start() {
        LiveChannelState state;
        synchronized (lock) {
            if (mode != ChannelMode.CLOSED) {
                log.info("📡 live '{}': уже запущен ({})", feed, mode);
                return;
            }
            mode = ChannelMode.CONNECTING;
            log.info("📡 live '{}': CONNECT {}", feed, streamPath);
            openStream();
            state = snapshotLocked();
        }
        publish(state);
    }

    public void stop() {
        LiveChannelState state;
        synchronized (lock) {
            if (mode == ChannelMode.CLOSED) {
                return;
            }
            mode = ChannelMode.CLOSED;
            closeConnection();
            cancel(pollFuture);
            cancel(retryFuture);
            pollFuture = null;
            retryFuture = null;
            log.info("🛑 live '{}': CLOSED", feed);
            state = snapshotLocked();
        }
        publish(state);
    }

    // =====================================================================
    // STREAM
    // =====================================================================

    /** Вызывается под lock */
    private void openStream() {
        long gen = ++generation;
        try {
            LiveConnection opened = transport.open(streamPath, new StreamCallback(gen));
            if (gen == generation) {
                connection = opened;
            } else if (opened != null) {
                // транспорт успел упасть синхронно внутри open()
                opened.close();
            }
        } catch (RuntimeException e) {
            log.warn("⚠ live '{}': поток не открылся: {}", feed, e.getMessage());
            connection = null;
            fallbackLocked(gen, e);
        }
    }

    private class StreamCallback implements LiveTransport.Callback {

        private final long gen;

        StreamCallback(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen() {
            LiveChannelState state = null;
            synchronized (lock) {
                if (isStale(gen)) return;
                if (promoteToStreaming()) {
                    state = snapshotLocked();
                }
            }
            if (state != null) publish(state);
        }

        @Override
        public void onEvent(String eventName, String data) {
            if (!decoder.isKnown(eventName)) {
                return;
            }
            List<TelemetryEvent> events = decoder.decode(eventName, data);

            LiveChannelState state = null;
            synchronized (lock) {
                if (isStale(gen)) return;
                boolean changed = promoteToStreaming();
                changed |= mergeLocked(events, false);
                if (changed) {
                    state = snapshotLocked();
                }
            }
            if (state != null) publish(state);
        }

        @Override
        public void onFailure(Throwable error) {
            fallback(gen, error);
        }

        @Override
        public void onClosed() {
            fallback(gen, null);
        }
    }

    private boolean isStale(long gen) {
        return mode == ChannelMode.CLOSED || gen != generation;
    }

    /** Под lock. @return true, если режим сменился */
    private boolean promoteToStreaming() {
        if (mode == ChannelMode.STREAMING) {
            return false;
        }
        if (mode == ChannelMode.POLLING) {
            cancel(pollFuture);
            pollFuture = null;
            log.info("✅ live '{}': поток восстановлен, polling остановлен", feed);
        } else {
            log.info("✅ live '{}': STREAMING", feed);
        }
        mode = ChannelMode.STREAMING;
        return true;
    }

    private void fallback(long gen, Throwable error) {
        LiveChannelState state;
        synchronized (lock) {
            if (isStale(gen)) return;
            fallbackLocked(gen, error);
            state = snapshotLocked();
        }
        publish(state);
    }

    /**
     * Под lock. Обрыв потока: закрыть его и, если ещё не в polling, начать опрос.
     * generation сдвигается в closeConnection(), поэтому onFailure + onClosed
     * одного подключения дают ровно один переход.
     */
    private void fallbackLocked(long gen, Throwable error) {
        if (gen != generation) {
            return;
        }
        closeConnection();

        if (mode == ChannelMode.POLLING) {
            // неудачная повторная попытка потока
            log.debug("live '{}': retry потока не удался", feed);
            scheduleRetry();
            return;
        }

        mode = ChannelMode.POLLING;
        fallbacks++;
        log.warn("⚠ live '{}': поток оборвался ({}), перехожу на polling каждые {}s",
                feed, error != null ? error.getMessage() : "closed", pollInterval.toSeconds());

        schedulePoll(Duration.ZERO);
        scheduleRetry();
    }

    private void closeConnection() {
        generation++;
        LiveConnection c = connection;
        connection = null;
        if (c != null) {
            try {
                c.close();
            } catch (RuntimeException e) {
                log.debug("live '{}': close: {}", feed, e.getMessage());
            }
        }
    }

    // =====================================================================
    // POLLING
    // =====================================================================

    private void schedulePoll(Duration delay) {
        pollFuture = scheduler.schedule(this::pollOnce, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    void pollOnce() {
        Instant since;
        synchronized (lock) {
            if (mode != ChannelMode.POLLING) return;
            since = cursor;
        }

        Map<String, String> query = new LinkedHashMap<>();
        query.put("limit", String.valueOf(pollLimit));
        if (since != null) {
            query.put("since", since.toString());
        }

        List<TelemetryEvent> fetched;
        try {
            fetched = pollSource.fetch(query);
        } catch (RuntimeException e) {
            log.warn("⚠ live '{}': poll failed: {}", feed, e.getMessage());
            fetched = List.of();
        }

        LiveChannelState state = null;
        synchronized (lock) {
            if (mode != ChannelMode.POLLING) return;
            if (mergeLocked(fetched, true)) {
                state = snapshotLocked();
            }
            schedulePoll(pollInterval);
        }
        if (state != null) publish(state);
    }

    private void scheduleRetry() {
        if (streamRetryInterval.isZero() || streamRetryInterval.isNegative()) {
            return;
        }
        retryFuture = scheduler.schedule(this::retryStream, streamRetryInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    void retryStream() {
        synchronized (lock) {
            if (mode != ChannelMode.POLLING) return;
            retryFuture = null;
            log.info("🔄 live '{}': повторная попытка потока", feed);
            openStream();
        }
    }

    // =====================================================================
    // MERGE
    // =====================================================================

    /**
     * Под lock. Курсор двигается по всем событиям, фильтр ленты - только для буфера.
     *
     * @param onlyNewer отбросить всё, что не новее курсора (polling)
     */
    private boolean mergeLocked(List<TelemetryEvent> events, boolean onlyNewer) {
        if (events == null || events.isEmpty()) {
            return false;
        }
        Instant before = cursor;

        List<TelemetryEvent> accepted = new ArrayList<>(events.size());
        for (TelemetryEvent e : events) {
            if (e == null || e.getTimestamp() == null) continue;
            if (onlyNewer && before != null && !e.getTimestamp().isAfter(before)) continue;

            if (cursor == null || e.getTimestamp().isAfter(cursor)) {
                cursor = e.getTimestamp();
            }
            if (eventFilter.isEmpty() || eventFilter.equals(e.getEvent())) {
                accepted.add(e);
            }
        }

        boolean changed = buffer.merge(accepted);
        return changed || !Objects.equals(before, cursor);
    }

    // =====================================================================
    // STATE
    // =====================================================================

    public LiveChannelState snapshot() {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    public ChannelMode getMode() {
        synchronized (lock) {
            return mode;
        }
    }

    public Instant getCursor() {
        synchronized (lock) {
            return cursor;
        }
    }

    private LiveChannelState snapshotLocked() {
        return new LiveChannelState(feed, mode, cursor, buffer.snapshot(), fallbacks);
    }

    private void publish(LiveChannelState state) {
        for (Consumer<LiveChannelState> l : listeners) {
            try {
                l.accept(state);
            } catch (RuntimeException e) {
                log.warn("⚠ live '{}': listener failed: {}", feed, e.getMessage());
            }
        }
    }

    private static void cancel(ScheduledFuture<?> f) {
        if (f != null) {
            f.cancel(false);
        }
    }
}
