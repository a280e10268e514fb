package org.example.restaurantfieldservice.offline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.event.ConnectivityRestoredEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import javax.sql.DataSource;
import java.net.ConnectException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks whether the database is reachable. The offline to online edge
 * publishes {@link ConnectivityRestoredEvent}, which triggers a queue replay.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectivityMonitor {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final ApplicationEventPublisher eventPublisher;

    private final AtomicBoolean online = new AtomicBoolean(true);

    public boolean isOnline() {
        return online.get();
    }

    public void markOffline(Throwable cause) {
        if (online.compareAndSet(true, false)) {
            log.warn("📴 Database unreachable, switching to offline mode: {}", cause != null ? cause.getMessage() : "probe failed");
        }
    }

    public void markOnline() {
        if (online.compareAndSet(false, true)) {
            log.info("📶 Database reachable again, replaying offline queue");
            eventPublisher.publishEvent(new ConnectivityRestoredEvent(this));
        }
    }

    /**
     * Checks the database and updates the online flag.
     */
    public boolean probe() {
        try (Connection connection = dataSource.getConnection()) {
            if (connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                markOnline();
                return true;
            }
            markOffline(null);
            return false;
        } catch (SQLException e) {
            markOffline(e);
            return false;
        }
    }

    /**
     * Whether {@code error} (or one of its causes) means the database could not be reached,
     * as opposed to a rejected or invalid write.
     */
    public static boolean isConnectivityFailure(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof DataAccessResourceFailureException
                    || current instanceof CannotCreateTransactionException
                    || current instanceof TransientDataAccessResourceException
                    || current instanceof SQLTransientConnectionException
                    || current instanceof ConnectException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
