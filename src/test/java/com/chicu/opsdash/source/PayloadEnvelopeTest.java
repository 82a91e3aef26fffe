package com.chicu.opsdash.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PayloadEnvelopeTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void wrappedAndBareGiveSameItems() throws Exception {
        PayloadEnvelope wrapped = PayloadEnvelope.of(om.readTree(
                "{\"status\":\"success\",\"data\":{\"items\":[{\"id\":\"a\"},{\"id\":\"b\"}]}}"));
        PayloadEnvelope bare = PayloadEnvelope.of(om.readTree("[{\"id\":\"a\"},{\"id\":\"b\"}]"));

        assertEquals(PayloadEnvelope.Kind.WRAPPED, wrapped.getKind());
        assertEquals("success", wrapped.getStatus());
        assertEquals(PayloadEnvelope.Kind.BARE, bare.getKind());
        assertNull(bare.getStatus());

        assertEquals(2, wrapped.items("items").size());
        assertEquals(wrapped.items("items"), bare.items("items"));
    }

    @Test
    void listKeyPrecedence() throws Exception {
        PayloadEnvelope env = PayloadEnvelope.of(om.readTree(
                "{\"data\":{\"notifications\":[{\"id\":1}],\"items\":[{\"id\":2},{\"id\":3}]}}"));

        assertEquals(1, env.items("notifications", "items").size());
        assertEquals(2, env.items("items", "notifications").size());
    }

    @Test
    void nullDataIsTreatedAsBare() throws Exception {
        PayloadEnvelope env = PayloadEnvelope.of(om.readTree("{\"data\":null,\"label\":\"Trend\"}"));
        assertEquals(PayloadEnvelope.Kind.BARE, env.getKind());
        assertEquals("Trend", env.unwrap().get("label").asText());
        assertTrue(env.items("items").isEmpty());
    }
}
