package com.example.incidentengine.gateway;

import lombok.Builder;
import lombok.Data;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;

/**
 * A connected event-stream client.
 */
@Data
@Builder
public class GatewaySession {

    private final String sessionId;
    private final WebSocketSession webSocketSession;
    private final Instant connectedAt;
    private volatile Instant lastHeartbeat;

    public void updateHeartbeat(Instant now) {
        this.lastHeartbeat = now;
    }

    public boolean isAlive() {
        return webSocketSession != null && webSocketSession.isOpen();
    }

    public boolean isStale(Instant now, int timeoutSeconds) {
        if (lastHeartbeat == null) return false;
        return now.isAfter(lastHeartbeat.plusSeconds(timeoutSeconds));
    }
}
