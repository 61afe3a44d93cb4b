package com.conversions.realtime.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebSocketFanoutSink Tests")
class WebSocketFanoutSinkTest {

    @Mock
    private WebSocketSession alice;

    @Mock
    private WebSocketSession bob;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SubscriptionRegistry registry;
    private WebSocketFanoutSink sink;

    @BeforeEach
    void setUp() {
        when(alice.getId()).thenReturn("alice");
        when(bob.getId()).thenReturn("bob");
        lenient().when(alice.isOpen()).thenReturn(true);
        lenient().when(bob.isOpen()).thenReturn(true);

        registry = new SubscriptionRegistry();
        ClientSessions clientSessions = new ClientSessions(objectMapper, 1000, 64 * 1024);
        for (WebSocketSession session : new WebSocketSession[]{alice, bob}) {
            clientSessions.add(session);
            registry.register(session.getId());
        }
        sink = new WebSocketFanoutSink(clientSessions, registry);
    }

    @Test
    @DisplayName("Should deliver only to members of the topic")
    void shouldDeliverToMembers() throws Exception {
        registry.join("alice", "conversion-c1");

        sink.broadcastToTopic("conversion-c1", "postgres_changes", Map.of("event", "UPDATE"));

        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(alice).sendMessage(captor.capture());
        JsonNode frame = objectMapper.readTree(((TextMessage) captor.getValue()).getPayload());
        assertThat(frame.get("event").asText()).isEqualTo("postgres_changes");
        assertThat(frame.get("data").get("event").asText()).isEqualTo("UPDATE");
        verify(bob, never()).sendMessage(any());
    }

    @Test
    @DisplayName("Should treat a topic without members as a no-op")
    void shouldIgnoreEmptyTopic() throws Exception {
        sink.broadcastToTopic("nobody-here", "postgres_changes", Map.of());

        verify(alice, never()).sendMessage(any());
        verify(bob, never()).sendMessage(any());
    }

    @Test
    @DisplayName("Should deliver to everyone on a global broadcast")
    void shouldDeliverToAll() throws Exception {
        sink.broadcastToAll("test_notification", Map.of("message", "hi"));

        verify(alice).sendMessage(any());
        verify(bob).sendMessage(any());
    }

    @Test
    @DisplayName("Should keep delivering when one member fails")
    void shouldIsolateFailingMember() throws Exception {
        registry.join("alice", "conversions");
        registry.join("bob", "conversions");
        doThrow(new IOException("broken pipe")).when(alice).sendMessage(any());

        sink.broadcastToTopic("conversions", "postgres_changes", Map.of());

        verify(bob).sendMessage(any());
        verify(alice).close(any(CloseStatus.class));
    }
}
