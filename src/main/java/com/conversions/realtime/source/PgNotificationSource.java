package com.conversions.realtime.source;

import com.conversions.realtime.model.RawNotificationEvent;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * PostgreSQL LISTEN/NOTIFY binding. Each session is a dedicated JDBC
 * connection in auto-commit mode, outside any pool.
 */
@Slf4j
public class PgNotificationSource implements NotificationSource {

    private static final Pattern CHANNEL_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]{0,62}");
    private static final String APPLICATION_NAME = "realtime-relay";
    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final PgConnectionUrl url;
    private final Duration validationInterval;
    private final Clock clock;

    public PgNotificationSource(PgConnectionUrl url, Duration validationInterval, Clock clock) {
        this.url = url;
        this.validationInterval = validationInterval;
        this.clock = clock;
    }

    @Override
    public NotificationSession open() {
        Properties props = url.toProperties();
        props.setProperty("ApplicationName", APPLICATION_NAME);
        props.setProperty("tcpKeepAlive", "true");
        Connection connection;
        try {
            connection = DriverManager.getConnection(url.jdbcUrl(), props);
        } catch (SQLException ex) {
            throw new ChangeSourceException("Could not connect to " + describe() + ": " + ex.getMessage(), ex);
        }
        try {
            connection.setAutoCommit(true);
            return new PgNotificationSession(connection, connection.unwrap(PGConnection.class));
        } catch (SQLException ex) {
            closeQuietly(connection);
            throw new ChangeSourceException("Connection to " + describe() + " is not a PostgreSQL connection", ex);
        }
    }

    @Override
    public String describe() {
        return url.toString();
    }

    static String quoteChannel(String channel) {
        if (channel == null || !CHANNEL_NAME.matcher(channel).matches()) {
            throw new IllegalArgumentException("Invalid channel name: " + channel);
        }
        return '"' + channel + '"';
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException ex) {
            log.debug("Ignoring error while closing source connection: {}", ex.getMessage());
        }
    }

    private final class PgNotificationSession implements NotificationSession {

        private final Connection connection;
        private final PGConnection pgConnection;
        private Instant lastActivity;

        private PgNotificationSession(Connection connection, PGConnection pgConnection) {
            this.connection = connection;
            this.pgConnection = pgConnection;
            this.lastActivity = clock.instant();
        }

        @Override
        public void listen(Set<String> channels) {
            try (Statement statement = connection.createStatement()) {
                for (String channel : channels) {
                    statement.execute("LISTEN " + quoteChannel(channel));
                }
            } catch (SQLException ex) {
                throw new ChangeSourceException("LISTEN failed: " + ex.getMessage(), ex);
            }
        }

        @Override
        public List<RawNotificationEvent> poll(Duration timeout) {
            // a timeout of 0 blocks forever in the driver
            int timeoutMillis = (int) Math.max(1, timeout.toMillis());
            PGNotification[] notifications;
            try {
                notifications = pgConnection.getNotifications(timeoutMillis);
            } catch (SQLException ex) {
                throw new ChangeSourceException("Lost notification connection: " + ex.getMessage(), ex);
            }

            Instant now = clock.instant();
            if (notifications == null || notifications.length == 0) {
                validateIfIdle(now);
                return Collections.emptyList();
            }
            lastActivity = now;
            List<RawNotificationEvent> events = new ArrayList<>(notifications.length);
            for (PGNotification notification : notifications) {
                events.add(new RawNotificationEvent(notification.getName(), notification.getParameter(), now));
            }
            return events;
        }

        private void validateIfIdle(Instant now) {
            if (Duration.between(lastActivity, now).compareTo(validationInterval) < 0) {
                return;
            }
            lastActivity = now;
            boolean valid;
            try {
                valid = connection.isValid(VALIDATION_TIMEOUT_SECONDS);
            } catch (SQLException ex) {
                throw new ChangeSourceException("Connection validation failed: " + ex.getMessage(), ex);
            }
            if (!valid) {
                throw new ChangeSourceException("Notification connection is no longer valid");
            }
        }

        @Override
        public void close() {
            closeQuietly(connection);
        }
    }
}
