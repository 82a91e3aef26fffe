package com.chicu.opsdash.aggregate;

import com.chicu.opsdash.config.OpsDashProperties;
import com.chicu.opsdash.source.RestTemplateSourceFetcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

@Slf4j
public class RestTemplateWriteBackClient implements WriteBackClient {

    private final RestTemplate restTemplate;
    private final OpsDashProperties.Upstream upstream;
    private final OpsDashProperties.WriteBack paths;

    public RestTemplateWriteBackClient(RestTemplate restTemplate, OpsDashProperties props) {
        this.restTemplate = restTemplate;
        this.upstream = props.getUpstream();
        this.paths = props.getWriteBack();
    }

    @Override
    public boolean markNotificationRead(String id) {
        return send(HttpMethod.PATCH, expand(paths.getNotificationReadPath(), id), Map.of("read", true));
    }

    @Override
    public boolean markAllNotificationsRead() {
        return send(HttpMethod.POST, RestTemplateSourceFetcher.buildUri(upstream.getBaseUrl(),
                paths.getNotificationsReadAllPath(), Map.of()), null);
    }

    @Override
    public boolean acknowledgeAnomaly(String id) {
        return send(HttpMethod.POST, expand(paths.getAnomalyAckPath(), id), null);
    }

    private URI expand(String template, String id) {
        return UriComponentsBuilder.fromHttpUrl(upstream.getBaseUrl())
                .path(template)
                .buildAndExpand(Map.of("id", id))
                .encode()
                .toUri();
    }

    private boolean send(HttpMethod method, URI uri, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (upstream.getApiKey() != null && !upstream.getApiKey().isBlank()) {
            headers.set("X-API-Key", upstream.getApiKey());
        }

        try {
            restTemplate.exchange(uri, method, new HttpEntity<>(body, headers), String.class);
            log.debug("✅ write-back {} {}", method, uri);
            return true;
        } catch (RestClientException e) {
            // локальное состояние не откатываем
            log.warn("⚠ write-back {} {} failed: {}", method, uri, e.getMessage());
            return false;
        }
    }
}
