package com.chicu.opsdash.smoke;

import com.chicu.opsdash.aggregate.CrossSourceAggregator;
import com.chicu.opsdash.engine.RefreshScheduler;
import com.chicu.opsdash.fusion.HeatmapService;
import com.chicu.opsdash.live.LiveChannelRegistry;
import com.chicu.opsdash.orchestrator.ReconciliationOrchestrator;
import com.chicu.opsdash.regime.InMemoryKeyValueStore;
import com.chicu.opsdash.regime.KeyValueStore;
import com.chicu.opsdash.web.ws.TelemetryLiveWsBridge;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.ApplicationContext;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ActiveProfiles("test")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class HealthSmokeTest {

    @LocalServerPort
    int port;

    @Autowired
    ApplicationContext context;

    TestRestTemplate rest = new TestRestTemplate();

    @Test
    void upWhileUpstreamIsUnreachable() {
        // upstream в test-профиле указывает на закрытый порт
        String url = "http://localhost:" + port + "/actuator/health";
        ResponseEntity<Map> resp = rest.getForEntity(url, Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertNotNull(resp.getBody());
        assertEquals("UP", resp.getBody().get("status"));
    }

    @Test
    void reconciliationBeansAreWired() {
        assertNotNull(context.getBean(ReconciliationOrchestrator.class));
        assertNotNull(context.getBean(CrossSourceAggregator.class));
        assertNotNull(context.getBean(HeatmapService.class));
        assertNotNull(context.getBean(LiveChannelRegistry.class));
        assertNotNull(context.getBean(RefreshScheduler.class));
        assertNotNull(context.getBean(TelemetryLiveWsBridge.class));
        assertInstanceOf(InMemoryKeyValueStore.class, context.getBean(KeyValueStore.class));
    }
}
