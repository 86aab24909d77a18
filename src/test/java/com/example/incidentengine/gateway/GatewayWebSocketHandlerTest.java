package com.example.incidentengine.gateway;

import com.example.incidentengine.config.AppConfig;
import com.example.incidentengine.config.EngineProperties;
import com.example.incidentengine.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GatewayWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
    private GatewayWebSocketHandler handler;
    private WebSocketSession session;

    @BeforeEach
    void connect() {
        handler = new GatewayWebSocketHandler(objectMapper, new EngineProperties(), clock);
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s-1");
        when(session.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(session);
    }

    private List<JsonNode> sent() throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        List<JsonNode> messages = new ArrayList<>();
        for (TextMessage message : captor.getAllValues()) {
            messages.add(objectMapper.readTree(message.getPayload()));
        }
        return messages;
    }

    private JsonNode lastSent() throws Exception {
        List<JsonNode> messages = sent();
        return messages.get(messages.size() - 1);
    }

    @Test
    void greetsNewSession() throws Exception {
        JsonNode greeting = lastSent();
        assertEquals("gateway.connected", greeting.get("method").asText());
        assertEquals("s-1", greeting.get("params").get("session_id").asText());
        assertEquals(1, handler.getActiveSessionCount());
    }

    @Test
    void answersHeartbeat() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"jsonrpc\":\"2.0\",\"id\":\"7\",\"method\":\"heartbeat\"}"));

        JsonNode reply = lastSent();
        assertEquals("7", reply.get("id").asText());
        assertEquals("alive", reply.get("result").get("status").asText());
        assertEquals(clock.instant().toString(), reply.get("result").get("timestamp").asText());
    }

    @Test
    void reportsParseError() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{not json"));

        JsonNode reply = lastSent();
        assertEquals(-32700, reply.get("error").get("code").asInt());
        assertFalse(reply.has("id"));
    }

    @Test
    void rejectsUnknownMethod() throws Exception {
        handler.handleTextMessage(session, new TextMessage("{\"jsonrpc\":\"2.0\",\"id\":\"8\",\"method\":\"subscribe\"}"));

        JsonNode reply = lastSent();
        assertEquals("8", reply.get("id").asText());
        assertEquals(-32601, reply.get("error").get("code").asInt());
        assertEquals("Method not found: subscribe", reply.get("error").get("message").asText());
    }

    @Test
    void heartbeatKeepsSessionInBroadcasts() throws Exception {
        clock.advance(Duration.ofSeconds(60));
        handler.handleTextMessage(session, new TextMessage("{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"method\":\"heartbeat\"}"));
        clock.advance(Duration.ofSeconds(60));

        handler.broadcast("incident.created", Map.of("incident_id", "inc-1"));

        assertEquals(1, handler.getActiveSessionCount());
        JsonNode event = lastSent();
        assertEquals("incident.created", event.get("method").asText());
        assertEquals("inc-1", event.get("params").get("incident_id").asText());
    }

    @Test
    void silentSessionIsDroppedOnBroadcast() {
        clock.advance(Duration.ofSeconds(91));

        handler.broadcast("incident.created", Map.of("incident_id", "inc-1"));

        assertEquals(0, handler.getActiveSessionCount());
    }

    @Test
    void closedSessionIsForgotten() {
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);
        assertEquals(0, handler.getActiveSessionCount());
    }
}
