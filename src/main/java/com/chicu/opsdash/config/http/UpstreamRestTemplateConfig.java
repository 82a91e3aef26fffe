package com.chicu.opsdash.config.http;

import com.chicu.opsdash.config.OpsDashProperties;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class UpstreamRestTemplateConfig {

    @Bean
    public PoolingHttpClientConnectionManager upstreamConnManager(OpsDashProperties props) {
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        int max = Math.max(4, props.getUpstream().getMaxConnections());
        cm.setMaxTotal(max);
        // все источники живут на одном хосте
        cm.setDefaultMaxPerRoute(max);
        return cm;
    }

    @Bean
    public CloseableHttpClient upstreamHttpClient(PoolingHttpClientConnectionManager upstreamConnManager,
                                                  OpsDashProperties props) {

        OpsDashProperties.Upstream up = props.getUpstream();

        RequestConfig cfg = RequestConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(up.getConnectTimeoutMs()))
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(up.getConnectTimeoutMs()))
                // общий лимит ответа: медленный источник не должен тормозить цикл
                .setResponseTimeout(Timeout.ofMilliseconds(up.getReadTimeoutMs()))
                .build();

        return HttpClients.custom()
                .setConnectionManager(upstreamConnManager)
                .setDefaultRequestConfig(cfg)
                .evictExpiredConnections()
                .evictIdleConnections(Timeout.ofSeconds(20))
                .build();
    }

    @Bean
    @Qualifier("upstreamRestTemplate")
    public RestTemplate upstreamRestTemplate(CloseableHttpClient upstreamHttpClient) {
        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(upstreamHttpClient));
    }
}
