package org.iotdash.ws;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FanOutWebSocketTest {

    @Test
    void initialTopicsComeFromTopicsQueryParameter() {
        assertEquals(List.of("a/b", "c/d"), FanOutWebSocket.initialTopics(Map.of("topics", List.of("a/b, c/d"))));
        assertEquals(List.of("a", "b"), FanOutWebSocket.initialTopics(Map.of("topics", List.of("a", "b"))));
    }

    @Test
    void missingOrBlankParameterMeansNoSubscriptions() {
        assertTrue(FanOutWebSocket.initialTopics(Map.of()).isEmpty());
        assertTrue(FanOutWebSocket.initialTopics(Map.of("topics", List.of(" , "))).isEmpty());
        assertTrue(FanOutWebSocket.initialTopics(null).isEmpty());
    }
}
