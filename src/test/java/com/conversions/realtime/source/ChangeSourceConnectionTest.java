package com.conversions.realtime.source;

import com.conversions.realtime.model.ConnectionState;
import com.conversions.realtime.model.RawNotificationEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.util.backoff.FixedBackOff;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.awaitility.Awaitility.await;

@DisplayName("ChangeSourceConnection Tests")
class ChangeSourceConnectionTest {

    private static final Set<String> CHANNELS = Set.of("conversion_changes", "conversion_step_changes");
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(20);

    private FakeNotificationSource source;
    private ScheduledThreadPoolExecutor executor;
    private ChangeSourceConnection connection;
    private final List<RawNotificationEvent> received = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        source = new FakeNotificationSource();
        executor = new ScheduledThreadPoolExecutor(1);
        executor.setRemoveOnCancelPolicy(true);
    }

    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.close();
        }
        executor.shutdownNow();
    }

    private ChangeSourceConnection connection(long reconnectDelayMillis) {
        connection = new ChangeSourceConnection(source, CHANNELS,
                new FixedBackOff(reconnectDelayMillis, FixedBackOff.UNLIMITED_ATTEMPTS), POLL_TIMEOUT, executor);
        return connection;
    }

    private void awaitState(ConnectionState state) {
        await().atMost(Duration.ofSeconds(5)).until(() -> connection.getState() == state);
    }

    @Nested
    @DisplayName("Starting")
    class Starting {

        @Test
        @DisplayName("Should register all channels and deliver notifications in arrival order")
        void shouldDeliverInOrder() {
            // Given
            connection(50).start(received::add);
            awaitState(ConnectionState.LISTENING);

            // When
            source.current().publish("conversion_changes", "{\"n\":1}");
            source.current().publish("conversion_changes", "{\"n\":2}");
            source.current().publish("conversion_changes", "{\"n\":3}");

            // Then
            await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 3);
            assertThat(received).extracting(RawNotificationEvent::rawPayload)
                    .containsExactly("{\"n\":1}", "{\"n\":2}", "{\"n\":3}");
            assertThat(source.current().listenCalls).containsExactly(CHANNELS);
        }

        @Test
        @DisplayName("Should ignore start while already listening")
        void shouldBeIdempotentWhileListening() {
            // Given
            connection(50);
            assertThat(connection.start(received::add)).isTrue();
            awaitState(ConnectionState.LISTENING);

            // When
            boolean secondStart = connection.start(received::add);
            source.current().publish("conversion_changes", "{}");

            // Then
            assertThat(secondStart).isFalse();
            await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 1);
            assertThat(source.opens).hasValue(1);
            assertThat(source.current().listenCalls).hasSize(1);
        }

        @Test
        @DisplayName("Should keep listening when the handler throws")
        void shouldSurviveHandlerFailure() {
            // Given
            connection(50).start(event -> {
                if (event.rawPayload().equals("bad")) {
                    throw new IllegalStateException("boom");
                }
                received.add(event);
            });
            awaitState(ConnectionState.LISTENING);

            // When
            source.current().publish("conversion_changes", "bad");
            source.current().publish("conversion_changes", "good");

            // Then
            await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 1);
            assertThat(received.get(0).rawPayload()).isEqualTo("good");
            assertThat(connection.getState()).isEqualTo(ConnectionState.LISTENING);
        }

        @Test
        @DisplayName("Should notify state listeners of each transition")
        void shouldNotifyStateListeners() {
            // Given
            List<ConnectionState> transitions = new CopyOnWriteArrayList<>();
            connection(50).addStateListener(transitions::add);

            // When
            connection.start(received::add);
            awaitState(ConnectionState.LISTENING);
            connection.stop();

            // Then
            assertThat(transitions).containsExactly(
                    ConnectionState.CONNECTING, ConnectionState.LISTENING, ConnectionState.DISCONNECTED);
        }
    }

    @Nested
    @DisplayName("Reconnecting")
    class Reconnecting {

        @Test
        @DisplayName("Should release the dropped connection and reconnect once")
        void shouldReconnectAfterDrop() {
            // Given
            connection(50).start(received::add);
            awaitState(ConnectionState.LISTENING);
            FakeNotificationSource.FakeSession first = source.current();

            // When
            first.breakConnection();

            // Then
            await().atMost(Duration.ofSeconds(5)).until(() -> source.opens.get() == 2
                    && connection.getState() == ConnectionState.LISTENING);
            assertThat(first.closed).isTrue();
            assertThat(connection.getReconnectAttempts()).isEqualTo(1);
            assertThat(source.maxOpenSessions).hasValue(1);

            source.current().publish("conversion_changes", "after-reconnect");
            await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 1);
        }

        @Test
        @DisplayName("Should retry until the source becomes available")
        void shouldRetryIndefinitely() {
            // Given
            source.failNextOpens(3);

            // When
            connection(20).start(received::add);

            // Then
            awaitState(ConnectionState.LISTENING);
            assertThat(source.opens).hasValue(4);
            assertThat(connection.getReconnectAttempts()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should treat a failed channel registration as a connection failure")
        void shouldAbortOnPartialRegistration() {
            // Given
            source.failNextListens(1);

            // When
            connection(20).start(received::add);

            // Then
            awaitState(ConnectionState.LISTENING);
            assertThat(source.sessions).hasSize(2);
            assertThat(source.sessions.get(0).closed).isTrue();
            assertThat(source.sessions.get(0).listenCalls).isEmpty();
            assertThat(source.maxOpenSessions).hasValue(1);
        }

        @Test
        @DisplayName("Should keep a single pending reconnect while degraded")
        void shouldKeepSinglePendingReconnect() {
            // Given
            source.failNextOpens(Integer.MAX_VALUE);

            // When
            connection(60_000).start(received::add);

            // Then
            awaitState(ConnectionState.DEGRADED);
            assertThat(connection.hasPendingReconnect()).isTrue();
            assertThat(executor.getQueue()).hasSize(1);
            assertThat(source.opens).hasValue(1);
        }

        @Test
        @DisplayName("Should go back to disconnected when the policy gives up")
        void shouldStopWhenPolicyExhausted() {
            // Given
            source.failNextOpens(Integer.MAX_VALUE);
            connection = new ChangeSourceConnection(source, CHANNELS, new FixedBackOff(10, 1), POLL_TIMEOUT, executor);

            // When
            connection.start(received::add);

            // Then
            await().atMost(Duration.ofSeconds(5)).until(() -> source.opens.get() == 2
                    && connection.getState() == ConnectionState.DISCONNECTED);
            assertThat(connection.hasPendingReconnect()).isFalse();
        }

        @Test
        @DisplayName("Should replace a pending reconnect with an immediate attempt on start")
        void shouldReconnectImmediatelyOnStartWhileDegraded() {
            // Given
            source.failNextOpens(1);
            connection(60_000).start(received::add);
            awaitState(ConnectionState.DEGRADED);

            // When
            boolean started = connection.start(received::add);

            // Then
            assertThat(started).isTrue();
            awaitState(ConnectionState.LISTENING);
            assertThat(source.opens).hasValue(2);
            assertThat(executor.getQueue()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Stopping")
    class Stopping {

        @Test
        @DisplayName("Should release the connection and stop delivering")
        void shouldReleaseConnection() {
            // Given
            connection(50).start(received::add);
            awaitState(ConnectionState.LISTENING);
            FakeNotificationSource.FakeSession session = source.current();

            // When
            connection.stop();
            session.publish("conversion_changes", "late");

            // Then
            assertThat(connection.getState()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(session.closed).isTrue();
            assertThat(source.openSessions).hasValue(0);
            assertThat(received).isEmpty();
        }

        @Test
        @DisplayName("Should cancel a pending reconnect")
        void shouldCancelPendingReconnect() {
            // Given
            source.failNextOpens(Integer.MAX_VALUE);
            connection(60_000).start(received::add);
            awaitState(ConnectionState.DEGRADED);

            // When
            connection.stop();

            // Then
            assertThat(connection.getState()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(connection.hasPendingReconnect()).isFalse();
            assertThat(executor.getQueue()).isEmpty();
        }

        @Test
        @DisplayName("Should be safe to call from any state")
        void shouldBeSafeFromAnyState() {
            connection(50);

            assertThatCode(() -> {
                connection.stop();
                connection.stop();
            }).doesNotThrowAnyException();
            assertThat(connection.getState()).isEqualTo(ConnectionState.DISCONNECTED);
        }

        @Test
        @DisplayName("Should allow listening again after stop")
        void shouldRestartAfterStop() {
            // Given
            connection(50).start(received::add);
            awaitState(ConnectionState.LISTENING);
            connection.stop();

            // When
            connection.start(received::add);

            // Then
            awaitState(ConnectionState.LISTENING);
            source.current().publish("conversion_changes", "again");
            await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 1);
            assertThat(source.maxOpenSessions).hasValue(1);
        }
    }
}
