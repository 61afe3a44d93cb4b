package com.conversions.realtime.source;

import com.conversions.realtime.model.ConnectionState;
import com.conversions.realtime.model.RawNotificationEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Owns the single listening connection to the change source.
 *
 * <p>All connection work runs on one thread of the supplied executor: the
 * connect attempt, the poll loop that hands notifications to the handler in
 * arrival order, and scheduled reconnects. Any connection-level failure
 * releases the current session, moves to {@link ConnectionState#DEGRADED} and
 * schedules exactly one reconnect according to the {@link BackOff}. Events
 * published while no session is listening are lost.
 *
 * <p>Every start and stop bumps a generation number; work belonging to an
 * older generation notices it is stale and exits without touching state.
 */
@Slf4j
public class ChangeSourceConnection implements AutoCloseable {

    private final NotificationSource source;
    private final Set<String> channels;
    private final BackOff reconnectBackOff;
    private final Duration pollTimeout;
    private final ScheduledExecutorService executor;

    private final Object lock = new Object();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong reconnectAttempts = new AtomicLong();
    private final List<Consumer<ConnectionState>> stateListeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    // guarded by lock
    private NotificationSession session;
    private Future<?> pendingAttempt;
    private BackOffExecution backOffExecution;
    private Consumer<RawNotificationEvent> handler;

    public ChangeSourceConnection(NotificationSource source,
                                  Set<String> channels,
                                  BackOff reconnectBackOff,
                                  Duration pollTimeout,
                                  ScheduledExecutorService executor) {
        this.source = Objects.requireNonNull(source, "source");
        this.channels = Collections.unmodifiableSet(new LinkedHashSet<>(channels));
        this.reconnectBackOff = Objects.requireNonNull(reconnectBackOff, "reconnectBackOff");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Starts listening and delivers every notification to {@code handler} on
     * the listener thread. No-op while connecting or listening. When a
     * reconnect is pending, it is replaced by an immediate attempt.
     *
     * @return {@code true} if a connect attempt was initiated
     */
    public boolean start(Consumer<RawNotificationEvent> handler) {
        Objects.requireNonNull(handler, "handler");
        synchronized (lock) {
            if (state == ConnectionState.CONNECTING || state == ConnectionState.LISTENING) {
                log.debug("Change source already {}, ignoring start", state);
                return false;
            }
            cancelPending();
            this.handler = handler;
            this.backOffExecution = null;
            long gen = generation.incrementAndGet();
            transition(ConnectionState.CONNECTING);
            pendingAttempt = executor.schedule(() -> connect(gen), 0, TimeUnit.MILLISECONDS);
            return true;
        }
    }

    /**
     * Cancels any pending reconnect and releases the current connection. Safe
     * from any state and never throws.
     */
    public void stop() {
        NotificationSession toClose;
        synchronized (lock) {
            generation.incrementAndGet();
            cancelPending();
            toClose = session;
            session = null;
            handler = null;
            backOffExecution = null;
            if (state != ConnectionState.DISCONNECTED) {
                transition(ConnectionState.DISCONNECTED);
            }
        }
        if (toClose != null) {
            release(toClose);
            log.info("Change source connection released");
        }
    }

    @Override
    public void close() {
        stop();
        executor.shutdownNow();
    }

    public ConnectionState getState() {
        return state;
    }

    public Set<String> getChannels() {
        return channels;
    }

    public long getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    public boolean hasPendingReconnect() {
        synchronized (lock) {
            return state == ConnectionState.DEGRADED && pendingAttempt != null && !pendingAttempt.isDone();
        }
    }

    public void addStateListener(Consumer<ConnectionState> listener) {
        stateListeners.add(listener);
    }

    private void connect(long gen) {
        if (!isCurrent(gen)) {
            return;
        }
        log.info("Connecting to change source {}", source.describe());
        NotificationSession opened = null;
        try {
            opened = source.open();
            opened.listen(channels);
        } catch (RuntimeException ex) {
            if (opened != null) {
                release(opened);
            }
            handleFailure(gen, ex);
            return;
        }

        Consumer<RawNotificationEvent> target;
        synchronized (lock) {
            if (!isCurrent(gen)) {
                release(opened);
                return;
            }
            session = opened;
            pendingAttempt = null;
            backOffExecution = null;
            target = handler;
            transition(ConnectionState.LISTENING);
        }
        log.info("📡 Listening for notifications on {}", channels);
        pump(gen, opened, target);
    }

    private void pump(long gen, NotificationSession active, Consumer<RawNotificationEvent> target) {
        while (isCurrent(gen)) {
            List<RawNotificationEvent> events;
            try {
                events = active.poll(pollTimeout);
            } catch (RuntimeException ex) {
                handleFailure(gen, ex);
                return;
            }
            for (RawNotificationEvent event : events) {
                if (!isCurrent(gen)) {
                    return;
                }
                deliver(target, event);
            }
        }
    }

    private void deliver(Consumer<RawNotificationEvent> target, RawNotificationEvent event) {
        try {
            target.accept(event);
        } catch (RuntimeException ex) {
            log.error("Notification handler failed for channel {}", event.channelName(), ex);
        }
    }

    private void handleFailure(long gen, RuntimeException cause) {
        NotificationSession toClose;
        synchronized (lock) {
            if (!isCurrent(gen)) {
                // stopped meanwhile, the failure comes from the released connection
                log.debug("Ignoring failure of stale change source connection: {}", cause.getMessage());
                return;
            }
            toClose = session;
            session = null;
            transition(ConnectionState.DEGRADED);
            scheduleReconnect(gen, cause);
        }
        if (toClose != null) {
            release(toClose);
        }
    }

    private void scheduleReconnect(long gen, RuntimeException cause) {
        if (backOffExecution == null) {
            backOffExecution = reconnectBackOff.start();
        }
        long delay = backOffExecution.nextBackOff();
        if (delay == BackOffExecution.STOP) {
            log.error("❌ Change source failed and the reconnect policy is exhausted", cause);
            generation.incrementAndGet();
            pendingAttempt = null;
            transition(ConnectionState.DISCONNECTED);
            return;
        }
        log.error("❌ Change source connection failed, reconnecting in {} ms: {}", delay, cause.getMessage());
        log.debug("Change source failure detail", cause);
        try {
            pendingAttempt = executor.schedule(() -> reconnect(gen), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            log.warn("Listener executor is shut down, not scheduling a reconnect");
            pendingAttempt = null;
        }
    }

    private void reconnect(long gen) {
        synchronized (lock) {
            if (!isCurrent(gen)) {
                return;
            }
            reconnectAttempts.incrementAndGet();
            transition(ConnectionState.CONNECTING);
        }
        log.info("🔄 Attempting to reconnect to change source");
        connect(gen);
    }

    private void cancelPending() {
        if (pendingAttempt != null) {
            pendingAttempt.cancel(false);
            pendingAttempt = null;
        }
    }

    private boolean isCurrent(long gen) {
        return generation.get() == gen;
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        state = next;
        log.debug("Change source state {} -> {}", previous, next);
        for (Consumer<ConnectionState> listener : stateListeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException ex) {
                log.warn("Connection state listener failed: {}", ex.getMessage());
            }
        }
    }

    private static void release(NotificationSession toClose) {
        try {
            toClose.close();
        } catch (RuntimeException ex) {
            log.warn("Error while releasing change source connection: {}", ex.getMessage());
        }
    }
}
