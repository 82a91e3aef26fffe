package com.chicu.opsdash.live;

import com.chicu.opsdash.config.OpsDashProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.sse.EventSource;
import okhttp3.sse.EventSourceListener;
import okhttp3.sse.EventSources;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * SSE поверх общего OkHttpClient.
 * Для потока отключается read-timeout: событий может не быть минутами.
 */
@Slf4j
@Component
public class OkHttpSseTransport implements LiveTransport {

    private final OkHttpClient streamingClient;
    private final OpsDashProperties.Upstream upstream;

    public OkHttpSseTransport(OkHttpClient client, OpsDashProperties props) {
        this.streamingClient = client.newBuilder()
                .readTimeout(Duration.ZERO)
                .retryOnConnectionFailure(false)
                .build();
        this.upstream = props.getUpstream();
    }

    @Override
    public LiveConnection open(String path, Callback callback) {
        String url = trimSlash(upstream.getBaseUrl()) + path;

        Request.Builder rb = new Request.Builder()
                .url(url)
                .header("Accept", "text/event-stream")
                .header("Cache-Control", "no-cache");
        if (upstream.getApiKey() != null && !upstream.getApiKey().isBlank()) {
            rb.header("X-API-Key", upstream.getApiKey());
        }

        log.info("📡 [SSE] CONNECT {}", url);

        EventSource source = EventSources.createFactory(streamingClient)
                .newEventSource(rb.build(), new EventSourceListener() {

                    @Override
                    public void onOpen(@NotNull EventSource es, @NotNull Response response) {
                        log.info("✅ [SSE] OPEN {} ({})", url, response.code());
                        callback.onOpen();
                    }

                    @Override
                    public void onEvent(@NotNull EventSource es, @Nullable String id,
                                        @Nullable String type, @NotNull String data) {
                        callback.onEvent(type != null ? type : "message", data);
                    }

                    @Override
                    public void onClosed(@NotNull EventSource es) {
                        log.info("🔌 [SSE] CLOSED {}", url);
                        callback.onClosed();
                    }

                    @Override
                    public void onFailure(@NotNull EventSource es, @Nullable Throwable t, @Nullable Response response) {
                        String reason = t != null
                                ? t.getMessage()
                                : (response != null ? "HTTP " + response.code() : "unknown");
                        log.warn("⚠ [SSE] FAILURE {}: {}", url, reason);
                        callback.onFailure(t != null ? t : new IllegalStateException(reason));
                    }
                });

        return source::cancel;
    }

    private static String trimSlash(String base) {
        if (base == null) return "";
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
