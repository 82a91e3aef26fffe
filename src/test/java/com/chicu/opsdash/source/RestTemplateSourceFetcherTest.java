package com.chicu.opsdash.source;

import com.chicu.opsdash.config.OpsDashProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RestTemplateSourceFetcherTest {

    @Mock
    private RestTemplate restTemplate;

    private RestTemplateSourceFetcher fetcher() {
        OpsDashProperties props = new OpsDashProperties();
        props.getUpstream().setBaseUrl("http://upstream:8080/");
        return new RestTemplateSourceFetcher(restTemplate, new ObjectMapper(), props);
    }

    @Test
    void buildUriSkipsBlankParams() {
        Map<String, String> q = new LinkedHashMap<>();
        q.put("venue", "binance");
        q.put("symbol", "");
        q.put("window", "1h");

        URI uri = RestTemplateSourceFetcher.buildUri("http://upstream:8080/", "/api/execution/latency", q);
        assertEquals("http://upstream:8080/api/execution/latency?venue=binance&window=1h", uri.toString());
    }

    @Test
    void parsesBody() {
        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(String.class)))
                .thenReturn(ResponseEntity.ok("{\"data\":[1,2]}"));

        Optional<JsonNode> out = fetcher().get("/api/alerts", Map.of());
        assertTrue(out.isPresent());
        assertEquals(2, out.get().get("data").size());
    }

    @Test
    void transportErrorIsEmpty() {
        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(String.class)))
                .thenThrow(new ResourceAccessException("connection refused"));

        assertTrue(fetcher().get("/api/alerts", Map.of()).isEmpty());
    }

    @Test
    void unparsableBodyIsEmpty() {
        when(restTemplate.exchange(any(URI.class), eq(HttpMethod.GET), any(HttpEntity.class), eq(String.class)))
                .thenReturn(ResponseEntity.ok("<html>oops</html>"));

        assertTrue(fetcher().get("/api/alerts", Map.of()).isEmpty());
    }
}
