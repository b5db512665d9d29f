package io.mnemo.core.storage;

import io.mnemo.core.result.StoreResult;
import java.sql.Connection;
import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs work inside a single transaction on a checked-out handle. A successful result commits;
 * a failed result or any exception rolls back. Nested scopes on the same handle are rejected.
 */
public final class TransactionCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(TransactionCoordinator.class);

    public <T> StoreResult<T> inTransaction(PooledConnection handle, ConnectionWork<T> work) throws SQLException {
        if (handle.inTransaction()) {
            throw new IllegalStateException("Handle " + handle.id() + " is already inside a transaction");
        }
        Connection connection = handle.connection();
        connection.setAutoCommit(false);
        handle.beginTransaction();
        try {
            StoreResult<T> result = work.apply(handle);
            if (result.isOk()) {
                connection.commit();
            } else {
                rollback(handle, null);
            }
            return result;
        } catch (SQLException | RuntimeException e) {
            rollback(handle, e);
            throw e;
        } finally {
            handle.endTransaction();
            restoreAutoCommit(handle);
        }
    }

    private void rollback(PooledConnection handle, Exception cause) {
        try {
            handle.connection().rollback();
        } catch (SQLException e) {
            if (cause != null) {
                cause.addSuppressed(e);
            }
            handle.markBroken();
            LOG.warn("Rollback failed on handle {}; retiring it: {}", handle.id(), e.getMessage());
        }
    }

    private void restoreAutoCommit(PooledConnection handle) {
        try {
            handle.connection().setAutoCommit(true);
        } catch (SQLException e) {
            handle.markBroken();
            LOG.warn("Could not restore auto-commit on handle {}; retiring it: {}", handle.id(), e.getMessage());
        }
    }
}
