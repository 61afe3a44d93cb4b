package com.conversions.realtime.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open client sessions, each wrapped so that concurrent senders never block
 * each other: a send that finds the session busy is buffered, and a client
 * that stays slower than the send time or buffer limit is disconnected.
 */
@Slf4j
public class ClientSessions {

    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMillis;
    private final int bufferSizeLimit;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public ClientSessions(ObjectMapper objectMapper, int sendTimeLimitMillis, int bufferSizeLimit) {
        this.objectMapper = objectMapper;
        this.sendTimeLimitMillis = sendTimeLimitMillis;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    public WebSocketSession add(WebSocketSession session) {
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, bufferSizeLimit);
        sessions.put(session.getId(), decorated);
        return decorated;
    }

    public void remove(String sessionId) {
        sessions.remove(sessionId);
    }

    public int count() {
        return sessions.size();
    }

    public TextMessage encode(String event, Object data) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(new ClientFrame(event, data)));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Cannot serialize '" + event + "' frame: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * @return {@code false} when the session is gone or the send failed
     */
    public boolean send(String sessionId, TextMessage message) {
        WebSocketSession session = sessions.get(sessionId);
        return session != null && send(session, message);
    }

    /**
     * @return number of sessions the message was handed to
     */
    public int sendToAll(TextMessage message) {
        int sent = 0;
        for (WebSocketSession session : sessions.values()) {
            if (send(session, message)) {
                sent++;
            }
        }
        return sent;
    }

    private boolean send(WebSocketSession session, TextMessage message) {
        if (!session.isOpen()) {
            return false;
        }
        try {
            session.sendMessage(message);
            return true;
        } catch (SessionLimitExceededException ex) {
            // the decorator drops further sends silently once a limit is hit, so the session must go
            log.warn("Client {} too slow, disconnecting: {}", session.getId(), ex.getMessage());
            closeQuietly(session, ex.getStatus());
            return false;
        } catch (IOException | IllegalStateException ex) {
            log.warn("Failed to send to client {}: {}", session.getId(), ex.getMessage());
            closeQuietly(session, CloseStatus.SERVER_ERROR);
            return false;
        }
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException ex) {
            log.debug("Error closing client {}: {}", session.getId(), ex.getMessage());
        }
    }
}
