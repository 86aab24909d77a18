package com.example.incidentengine.gateway;

import com.example.incidentengine.config.EngineProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event stream for dashboards. Clients connect once and receive every
 * incident lifecycle event as a JSON-RPC notification; the only method
 * they may call is {@code heartbeat}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayWebSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;
    private final EngineProperties properties;
    private final Clock clock;

    private final Map<String, GatewaySession> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Instant now = clock.instant();
        GatewaySession gatewaySession = GatewaySession.builder()
                .sessionId(session.getId())
                .webSocketSession(session)
                .connectedAt(now)
                .lastHeartbeat(now)
                .build();

        sessions.put(session.getId(), gatewaySession);
        log.info("Gateway session connected: {} (total: {})", session.getId(), sessions.size());

        send(session, JsonRpcMessage.notification("gateway.connected", Map.of("session_id", session.getId())));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonRpcMessage request;
        try {
            request = objectMapper.readValue(message.getPayload(), JsonRpcMessage.class);
        } catch (IOException e) {
            log.debug("Unparseable gateway message from {}: {}", session.getId(), e.getMessage());
            send(session, JsonRpcMessage.error(null, -32700, "Parse error"));
            return;
        }

        GatewaySession gatewaySession = sessions.get(session.getId());
        if (gatewaySession != null) {
            gatewaySession.updateHeartbeat(clock.instant());
        }

        if ("heartbeat".equals(request.getMethod())) {
            send(session, JsonRpcMessage.success(request.getId(), Map.of(
                    "status", "alive",
                    "timestamp", clock.instant().toString()
            )));
        } else {
            send(session, JsonRpcMessage.error(request.getId(), -32601, "Method not found: " + request.getMethod()));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Gateway session disconnected: {} (reason: {}, total: {})",
                session.getId(), status.getReason(), sessions.size());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Transport error for session {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    /**
     * Broadcast a notification to all live sessions. Stale sessions are dropped.
     */
    public void broadcast(String method, Object params) {
        JsonRpcMessage notification = JsonRpcMessage.notification(method, params);
        Instant now = clock.instant();
        int timeout = properties.getGateway().getHeartbeatTimeoutSeconds();
        sessions.values().removeIf(session -> !session.isAlive() || session.isStale(now, timeout));
        sessions.values().forEach(session -> send(session.getWebSocketSession(), notification));
    }

    private void send(WebSocketSession session, JsonRpcMessage message) {
        try {
            String json = objectMapper.writeValueAsString(message);
            // WebSocketSession is not safe for concurrent sends
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException e) {
            log.error("Failed to send {} to session {}", message.getMethod(), session.getId(), e);
        }
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }
}
