package com.chicu.opsdash.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    /**
     * 🌐 ЕДИНЫЙ OkHttpClient для всего приложения.
     * Используется live-каналом (SSE); под конкретный вызов тюнится через newBuilder().
     */
    @Bean
    public OkHttpClient okHttpClient(OpsDashProperties props) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getUpstream().getConnectTimeoutMs())))
                .readTimeout(Duration.ofSeconds(30))
                .writeTimeout(Duration.ofSeconds(30))
                .retryOnConnectionFailure(true)
                .build();
    }
}
