package com.chicu.opsdash.source;

import com.chicu.opsdash.config.OpsDashProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class RestTemplateSourceFetcher implements SourceFetcher {

    private final RestTemplate rest;
    private final ObjectMapper objectMapper;
    private final OpsDashProperties props;

    public RestTemplateSourceFetcher(@Qualifier("upstreamRestTemplate") RestTemplate rest,
                                     ObjectMapper objectMapper,
                                     OpsDashProperties props) {
        this.rest = rest;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    @Override
    public Optional<JsonNode> get(String path, Map<String, String> query) {
        URI uri = buildUri(props.getUpstream().getBaseUrl(), path, query);

        try {
            ResponseEntity<String> resp = rest.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers()), String.class);

            if (!resp.getStatusCode().is2xxSuccessful()) {
                log.warn("⚠ upstream GET {} -> {}", path, resp.getStatusCode().value());
                return Optional.empty();
            }

            String body = resp.getBody();
            if (body == null || body.isBlank()) {
                log.warn("⚠ upstream GET {} -> пустое тело", path);
                return Optional.empty();
            }

            return Optional.of(objectMapper.readTree(body));

        } catch (RestClientException e) {
            log.warn("⚠ upstream GET {} failed: {}", path, e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("⚠ upstream GET {} -> битый JSON: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    HttpHeaders headers() {
        HttpHeaders h = new HttpHeaders();
        h.setAccept(List.of(MediaType.APPLICATION_JSON));
        h.setCacheControl("no-cache");
        String apiKey = props.getUpstream().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            h.set("X-API-Key", apiKey.trim());
        }
        return h;
    }

    public static URI buildUri(String baseUrl, String path, Map<String, String> query) {
        String base = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
        String p = path.startsWith("/") ? path : "/" + path;

        UriComponentsBuilder b = UriComponentsBuilder.fromHttpUrl(base + p);
        if (query != null) {
            query.forEach((k, v) -> {
                if (v != null && !v.isBlank()) {
                    b.queryParam(k, v);
                }
            });
        }
        return b.encode().build().toUri();
    }
}
